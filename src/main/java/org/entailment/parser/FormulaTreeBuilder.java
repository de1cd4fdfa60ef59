package org.entailment.parser;

import org.entailment.antlr.PropositionalFormulaBaseVisitor;
import org.entailment.antlr.PropositionalFormulaParser.ConditionalContext;
import org.entailment.antlr.PropositionalFormulaParser.ConnectiveContext;
import org.entailment.antlr.PropositionalFormulaParser.ExpressionContext;
import org.entailment.antlr.PropositionalFormulaParser.FormulaContext;
import org.entailment.antlr.PropositionalFormulaParser.NegationContext;
import org.entailment.antlr.PropositionalFormulaParser.ParenthesizedContext;
import org.entailment.antlr.PropositionalFormulaParser.VariableContext;
import org.entailment.formula.Formula;

import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO - Converte l'albero sintattico ANTLR in {@link Formula}
 *
 * Visitor sulla grammatica PropositionalFormula: ogni metodo visit gestisce un costrutto
 * e restituisce il sottoalbero corrispondente, costruito dalle foglie verso la radice.
 *
 * SEMANTICA DEI COSTRUTTI:
 * - Catene AND/OR: stesso livello di precedenza, piegate a sinistra nell'ordine di lettura
 *   ({@code a and b or c} diventa {@code Or(And(a, b), c)})
 * - NOT: si applica a un solo primario ({@code not a and b} diventa {@code And(Not(a), b)})
 * - Parentesi: trasparenti, restituiscono l'espressione interna
 * - if/iff ... then: il conseguente è un'espressione completa; iff secondo {@link IffPolicy}
 */
class FormulaTreeBuilder extends PropositionalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    private final IffPolicy iffPolicy;

    FormulaTreeBuilder(IffPolicy iffPolicy) {
        this.iffPolicy = iffPolicy;
    }

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.expression());
        LOGGER.fine("Albero costruito: " + formula);
        return formula;
    }

    //endregion

    //region CATENE AND/OR

    /**
     * Piega la catena {@code p0 op1 p1 op2 p2 ...} come {@code ((p0 op1 p1) op2 p2) ...}.
     */
    @Override
    public Formula visitExpression(ExpressionContext ctx) {
        Formula result = visit(ctx.primary(0));

        for (int i = 0; i < ctx.connective().size(); i++) {
            ConnectiveContext connective = ctx.connective(i);
            Formula right = visit(ctx.primary(i + 1));
            result = connective.AND() != null
                    ? Formula.and(result, right)
                    : Formula.or(result, right);
        }

        return result;
    }

    //endregion

    //region PRIMARI

    @Override
    public Formula visitVariable(VariableContext ctx) {
        String name = ctx.ATOM().getText();
        LOGGER.finest("Elaborazione variabile atomica: " + name);
        return Formula.atom(name);
    }

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.not(visit(ctx.primary()));
    }

    @Override
    public Formula visitParenthesized(ParenthesizedContext ctx) {
        LOGGER.finest("Rimozione parentesi trasparente");
        return visit(ctx.expression());
    }

    /**
     * Condizionale {@code if A then B} o {@code iff A then B}.
     */
    @Override
    public Formula visitConditional(ConditionalContext ctx) {
        Formula condition = visit(ctx.expression(0));
        Formula consequence = visit(ctx.expression(1));

        if (ctx.IFF() != null && iffPolicy == IffPolicy.BICONDITIONAL) {
            return Formula.iff(condition, consequence);
        }
        return Formula.implies(condition, consequence);
    }

    //endregion
}
