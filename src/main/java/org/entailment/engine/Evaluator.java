package org.entailment.engine;

import org.entailment.formula.Formula;
import org.entailment.support.Assignment;

/**
 * VALUTATORE - Valore di verità di una formula sotto un assegnamento
 *
 * Funzione totale, non solleva mai eccezioni su un albero ben formato.
 *
 * SEMANTICA:
 * - ATOM: valore assegnato, false se l'atomo non compare nell'assegnamento
 * - NOT: negazione
 * - AND / OR: entrambi i lati vengono sempre valutati
 * - IF: implicazione materiale, !l || r
 * - IFF: congiunzione delle due implicazioni, (!l || r) && (l || !r)
 */
public final class Evaluator {

    /**
     * Previene istanziazione - classe utility
     */
    private Evaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula albero da valutare (non null)
     * @param assignment valori degli atomi (non null)
     * @return valore di verità della formula
     */
    public static boolean evaluate(Formula formula, Assignment assignment) {
        return switch (formula.getType()) {
            case ATOM -> assignment.valueOf(formula.getAtom());
            case NOT -> !evaluate(formula.getOperand(), assignment);
            case AND -> {
                boolean left = evaluate(formula.getLeft(), assignment);
                boolean right = evaluate(formula.getRight(), assignment);
                yield left && right;
            }
            case OR -> {
                boolean left = evaluate(formula.getLeft(), assignment);
                boolean right = evaluate(formula.getRight(), assignment);
                yield left || right;
            }
            case IF -> {
                boolean antecedent = evaluate(formula.getLeft(), assignment);
                boolean consequent = evaluate(formula.getRight(), assignment);
                yield !antecedent || consequent;
            }
            case IFF -> {
                boolean left = evaluate(formula.getLeft(), assignment);
                boolean right = evaluate(formula.getRight(), assignment);
                yield (!left || right) && (left || !right);
            }
        };
    }

    /**
     * Vero se tutte le formule sono vere sotto l'assegnamento (vero per lista vuota).
     */
    public static boolean evaluateAll(Iterable<Formula> formulas, Assignment assignment) {
        for (Formula formula : formulas) {
            if (!evaluate(formula, assignment)) {
                return false;
            }
        }
        return true;
    }
}
