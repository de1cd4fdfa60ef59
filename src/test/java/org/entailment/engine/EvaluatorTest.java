package org.entailment.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.entailment.formula.Formula.and;
import static org.entailment.formula.Formula.atom;
import static org.entailment.formula.Formula.iff;
import static org.entailment.formula.Formula.implies;
import static org.entailment.formula.Formula.not;
import static org.entailment.formula.Formula.or;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.entailment.formula.Formula;
import org.entailment.parser.FormulaParser;
import org.entailment.support.Assignment;
import org.entailment.support.AssignmentEnumerator;
import org.junit.jupiter.api.Test;

class EvaluatorTest {

    private static final Formula A = atom("a");
    private static final Formula B = atom("b");

    @Test
    void atomTakesAssignedValue() {
        assertThat(Evaluator.evaluate(A, assignment(true, false))).isTrue();
        assertThat(Evaluator.evaluate(B, assignment(true, false))).isFalse();
    }

    @Test
    void missingAtomEvaluatesToFalse() {
        Assignment onlyA = new Assignment(Map.of("a", true));

        assertThat(Evaluator.evaluate(atom("z"), onlyA)).isFalse();
        assertThat(Evaluator.evaluate(not(atom("z")), onlyA)).isTrue();
    }

    @Test
    void connectivesFollowTruthTables() {
        for (Assignment assignment : new AssignmentEnumerator().enumerate(Set.of("a", "b"))) {
            boolean a = assignment.valueOf("a");
            boolean b = assignment.valueOf("b");

            assertThat(Evaluator.evaluate(not(A), assignment)).isEqualTo(!a);
            assertThat(Evaluator.evaluate(and(A, B), assignment)).isEqualTo(a && b);
            assertThat(Evaluator.evaluate(or(A, B), assignment)).isEqualTo(a || b);
            assertThat(Evaluator.evaluate(implies(A, B), assignment)).isEqualTo(!a || b);
            assertThat(Evaluator.evaluate(iff(A, B), assignment)).isEqualTo(a == b);
        }
    }

    @Test
    void nestedFormulaIsCompositional() {
        Formula formula = FormulaParser.parseFormula("if (a or b) then not (a and b)");

        assertThat(Evaluator.evaluate(formula, assignment(true, true))).isFalse();
        assertThat(Evaluator.evaluate(formula, assignment(true, false))).isTrue();
        assertThat(Evaluator.evaluate(formula, assignment(false, false))).isTrue();
    }

    @Test
    void evaluateAllIsConjunction() {
        assertThat(Evaluator.evaluateAll(List.of(A, or(A, B)), assignment(true, false))).isTrue();
        assertThat(Evaluator.evaluateAll(List.of(A, B), assignment(true, false))).isFalse();
        assertThat(Evaluator.evaluateAll(List.of(), assignment(false, false))).isTrue();
    }

    private static Assignment assignment(boolean a, boolean b) {
        return new Assignment(Map.of("a", a, "b", b));
    }
}
