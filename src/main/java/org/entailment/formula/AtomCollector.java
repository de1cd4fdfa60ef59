package org.entailment.formula;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RACCOLTA ATOMI - Estrae l'insieme delle variabili proposizionali di una o più formule
 *
 * Visita ricorsivamente ogni nodo una sola volta accumulando i nomi trovati nelle foglie.
 * L'insieme restituito segue l'ordine di prima comparsa (da sinistra a destra), ordine
 * che non ha significato semantico.
 *
 * Per la verifica di conseguenza logica gli atomi vanno uniti su tutte le formule della
 * base di conoscenza e sulla formula obiettivo prima dell'enumerazione: {@link #collectAll}.
 */
public final class AtomCollector {

    private static final Logger LOGGER = Logger.getLogger(AtomCollector.class.getName());

    /**
     * Previene istanziazione - classe utility
     */
    private AtomCollector() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Raccoglie gli atomi distinti di una formula.
     *
     * @param formula albero da visitare (non null)
     * @return insieme non modificabile dei nomi di variabile
     */
    public static Set<String> collect(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula null");
        }
        Set<String> atoms = new LinkedHashSet<>();
        visit(formula, atoms);
        LOGGER.finest("Atomi raccolti da " + formula + ": " + atoms);
        return Collections.unmodifiableSet(atoms);
    }

    /**
     * Unione degli atomi di tutte le formule fornite.
     *
     * @param formulas formule da visitare, nell'ordine dato
     * @return insieme non modificabile, eventualmente vuoto
     */
    public static Set<String> collectAll(Collection<Formula> formulas) {
        if (formulas == null) {
            throw new IllegalArgumentException("Collezione di formule null");
        }
        Set<String> atoms = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            if (formula == null) {
                throw new IllegalArgumentException("Collezione contenente formule null");
            }
            visit(formula, atoms);
        }
        LOGGER.fine("Universo di atomi su " + formulas.size() + " formule: " + atoms);
        return Collections.unmodifiableSet(atoms);
    }

    private static void visit(Formula node, Set<String> atoms) {
        switch (node.getType()) {
            case ATOM -> atoms.add(node.getAtom());
            case NOT -> visit(node.getOperand(), atoms);
            case AND, OR, IF, IFF -> {
                visit(node.getLeft(), atoms);
                visit(node.getRight(), atoms);
            }
        }
    }
}
