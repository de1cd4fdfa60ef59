package org.entailment.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.entailment.formula.Formula;
import org.entailment.parser.FormulaParser;
import org.entailment.support.Assignment;
import org.entailment.support.AssignmentEnumerator;
import org.entailment.support.ResourceLimitExceededException;
import org.junit.jupiter.api.Test;

class EntailmentCheckerTest {

    private final EntailmentChecker checker = new EntailmentChecker();

    //region SODDISFACIBILITÀ

    @Test
    void conjunctionHasOneModel() {
        SatisfiabilityReport report = checker.satisfiability(parse("a and b"));

        assertThat(report.getAtoms()).containsExactly("a", "b");
        assertThat(report.getSatisfyingAssignments())
                .containsExactly(new Assignment(Map.of("a", true, "b", true)));
        assertThat(report.getFalsifyingAssignments()).hasSize(3);
        assertThat(report.isSatisfiable()).isTrue();
        assertThat(report.isValid()).isFalse();
    }

    @Test
    void negatedDisjunctionHasThreeModels() {
        SatisfiabilityReport report = checker.satisfiability(parse("not a or b"));

        assertThat(report.getSatisfyingAssignments()).hasSize(3);
        assertThat(report.getFalsifyingAssignments())
                .containsExactly(new Assignment(Map.of("a", true, "b", false)));
    }

    @Test
    void implicationIsFalseOnlyWhenAntecedentHolds() {
        SatisfiabilityReport report = checker.satisfiability(parse("if a then b"));

        assertThat(report.getFalsifyingAssignments())
                .containsExactly(new Assignment(Map.of("a", true, "b", false)));
        assertThat(report.getTotalAssignments()).isEqualTo(4);
    }

    @Test
    void tautologyAndContradiction() {
        assertThat(checker.satisfiability(parse("a or not a")).isValid()).isTrue();

        SatisfiabilityReport contradiction = checker.satisfiability(parse("a and not a"));
        assertThat(contradiction.isSatisfiable()).isFalse();
        assertThat(contradiction.getFalsifyingAssignments()).hasSize(2);
    }

    @Test
    void partitionPreservesEnumerationOrder() {
        SatisfiabilityReport report = checker.satisfiability(parse("a or b"));

        assertThat(report.getSatisfyingAssignments()).extracting(Assignment::toString).containsExactly(
                "{a=true, b=false}",
                "{a=false, b=true}",
                "{a=true, b=true}");
    }

    @Test
    void satisfiabilityCollectsStatistics() {
        SatisfiabilityReport report = checker.satisfiability(parse("if a then (b or c)"));
        EnumerationStatistics statistics = report.getStatistics();

        assertThat(statistics.getAtomCount()).isEqualTo(3);
        assertThat(statistics.getAssignmentsEvaluated()).isEqualTo(8);
        assertThat(statistics.getModelsFound()).isEqualTo(7);
        assertThat(statistics.getExecutionTimeMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void satisfiabilityRespectsAtomLimit() {
        EntailmentChecker limited = new EntailmentChecker(new AssignmentEnumerator(2));

        assertThatThrownBy(() -> limited.satisfiability(parse("a and b and c")))
                .isInstanceOf(ResourceLimitExceededException.class);
    }

    //endregion

    //region CONSEGUENZA LOGICA

    @Test
    void modusPonensIsEntailed() {
        EntailmentResult result = checker.entails(List.of(parse("a"), parse("if a then b")), parse("b"));

        assertThat(result.isEntailed()).isTrue();
        assertThat(result.getCounterModel()).isEmpty();
        assertThat(result.getKnowledgeBaseModels()).isEqualTo(1);
    }

    @Test
    void disjunctionDoesNotEntailDisjunct() {
        EntailmentResult result = checker.entails(List.of(parse("a or b")), parse("a"));

        assertThat(result.isEntailed()).isFalse();
        assertThat(result.getCounterModel()).contains(new Assignment(Map.of("a", false, "b", true)));
        assertThat(result.getKnowledgeBaseModels()).isEqualTo(3);
    }

    @Test
    void counterModelSatisfiesKnowledgeBaseButNotQuery() {
        List<Formula> knowledgeBase = List.of(parse("if p then q"), parse("q or r"));
        Formula query = parse("p");

        EntailmentResult result = checker.entails(knowledgeBase, query);

        assertThat(result.isEntailed()).isFalse();
        Assignment counterModel = result.getCounterModel().orElseThrow();
        assertThat(Evaluator.evaluateAll(knowledgeBase, counterModel)).isTrue();
        assertThat(Evaluator.evaluate(query, counterModel)).isFalse();
    }

    @Test
    void emptyKnowledgeBaseEntailsOnlyValidFormulas() {
        assertThat(checker.entails(List.of(), parse("a or not a")).isEntailed()).isTrue();
        assertThat(checker.entails(List.of(), parse("a")).isEntailed()).isFalse();
    }

    @Test
    void inconsistentKnowledgeBaseEntailsEverything() {
        EntailmentResult result = checker.entails(List.of(parse("a"), parse("not a")), parse("z"));

        assertThat(result.isEntailed()).isTrue();
        assertThat(result.getKnowledgeBaseModels()).isZero();
    }

    @Test
    void queryAtomsOutsideKnowledgeBaseAreEnumerated() {
        EntailmentResult result = checker.entails(List.of(parse("a")), parse("a and c"));

        assertThat(result.isEntailed()).isFalse();
        assertThat(result.getCounterModel()).contains(new Assignment(Map.of("a", true, "c", false)));
        assertThat(result.getStatistics().getAtomCount()).isEqualTo(2);
    }

    @Test
    void entailmentIsMonotone() {
        List<Formula> knowledgeBase = new ArrayList<>(List.of(parse("if a then b"), parse("a or c")));
        Formula query = parse("b or c");
        assertThat(checker.entails(knowledgeBase, query).isEntailed()).isTrue();

        for (String extra : Arrays.asList("d", "not b", "if c then d", "a and not c")) {
            knowledgeBase.add(parse(extra));
            assertThat(checker.entails(knowledgeBase, query).isEntailed()).isTrue();
        }
    }

    @Test
    void entailmentEvaluatesEveryAssignment() {
        EntailmentResult result = checker.entails(List.of(parse("a or b")), parse("c"));

        assertThat(result.getStatistics().getAssignmentsEvaluated()).isEqualTo(8);
    }

    @Test
    void entailsRejectsNullArguments() {
        assertThatThrownBy(() -> checker.entails(null, parse("a")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> checker.entails(List.of(parse("a")), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void entailmentRespectsAtomLimitOnUnion() {
        EntailmentChecker limited = new EntailmentChecker(new AssignmentEnumerator(2));

        assertThatThrownBy(() -> limited.entails(List.of(parse("a and b")), parse("c")))
                .isInstanceOf(ResourceLimitExceededException.class);
    }

    //endregion

    private static Formula parse(String text) {
        return FormulaParser.parseFormula(text);
    }
}
