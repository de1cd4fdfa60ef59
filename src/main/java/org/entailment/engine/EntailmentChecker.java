package org.entailment.engine;

import org.entailment.formula.AtomCollector;
import org.entailment.formula.Formula;
import org.entailment.support.Assignment;
import org.entailment.support.AssignmentEnumerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * VERIFICATORE - Soddisfacibilità e conseguenza logica per enumerazione esaustiva
 *
 * PIPELINE:
 * 1. Raccolta atomi (unione su tutte le formule coinvolte)
 * 2. Ordinamento fisso degli atomi e controllo del limite di risorse
 * 3. Costruzione di ogni combinazione c = 0 .. 2^n - 1
 * 4. Valutazione delle formule sotto ogni assegnamento e aggregazione
 *
 * Nessuna potatura dello spazio di ricerca: tutti i 2^n assegnamenti vengono valutati.
 */
public class EntailmentChecker {

    private static final Logger LOGGER = Logger.getLogger(EntailmentChecker.class.getName());

    private final AssignmentEnumerator enumerator;

    /**
     * Verificatore con limite di atomi predefinito.
     */
    public EntailmentChecker() {
        this(new AssignmentEnumerator());
    }

    public EntailmentChecker(AssignmentEnumerator enumerator) {
        if (enumerator == null) {
            throw new IllegalArgumentException("Enumeratore non può essere null");
        }
        this.enumerator = enumerator;
    }

    //region SODDISFACIBILITÀ

    /**
     * Partiziona gli assegnamenti sugli atomi della formula in soddisfacenti e falsificanti.
     *
     * @param formula formula da analizzare (non null)
     * @return report con le due liste nell'ordine dell'enumerazione
     * @throws org.entailment.support.ResourceLimitExceededException se gli atomi superano il limite
     */
    public SatisfiabilityReport satisfiability(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula null");
        }

        EnumerationStatistics statistics = new EnumerationStatistics();
        Set<String> atoms = AtomCollector.collect(formula);
        List<String> ordering = enumerator.ordering(atoms);
        statistics.setAtomCount(ordering.size());

        List<Assignment> satisfying = new ArrayList<>();
        List<Assignment> falsifying = new ArrayList<>();

        for (Assignment assignment : enumerator.enumerate(atoms)) {
            statistics.incrementAssignmentsEvaluated();
            if (Evaluator.evaluate(formula, assignment)) {
                statistics.incrementModelsFound();
                satisfying.add(assignment);
            } else {
                falsifying.add(assignment);
            }
        }

        statistics.stopTimer();
        LOGGER.info("Formula " + formula + ": " + satisfying.size() + " assegnamenti soddisfacenti su "
                + (satisfying.size() + falsifying.size()));

        return new SatisfiabilityReport(formula, ordering, satisfying, falsifying, statistics);
    }

    //endregion

    //region CONSEGUENZA LOGICA

    /**
     * Verifica KB ⊨ α su un'unica enumerazione dell'unione degli atomi.
     *
     * Gli assegnamenti che falsificano una qualsiasi formula della base di conoscenza
     * vengono scartati; la conseguenza vale se α è vera in tutti i rimanenti
     * (vacuamente vera se la base di conoscenza è insoddisfacibile). Con base di
     * conoscenza vuota il verdetto coincide con la validità di α.
     *
     * @param knowledgeBase formule della base di conoscenza (non null, può essere vuota)
     * @param query formula α (non null)
     * @return verdetto con il primo controesempio trovato, se esiste
     * @throws org.entailment.support.ResourceLimitExceededException se gli atomi superano il limite
     */
    public EntailmentResult entails(List<Formula> knowledgeBase, Formula query) {
        if (knowledgeBase == null || knowledgeBase.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Base di conoscenza null o contenente formule null");
        }
        if (query == null) {
            throw new IllegalArgumentException("Formula obiettivo null");
        }

        List<Formula> universe = new ArrayList<>(knowledgeBase);
        universe.add(query);

        EnumerationStatistics statistics = new EnumerationStatistics();
        List<String> ordering = enumerator.ordering(AtomCollector.collectAll(universe));
        long total = enumerator.combinationCount(ordering);
        statistics.setAtomCount(ordering.size());

        LOGGER.fine("Verifica conseguenza logica su " + total + " assegnamenti, atomi " + ordering);

        Assignment counterModel = null;
        for (long combination = 0; combination < total; combination++) {
            Assignment assignment = enumerator.assignmentAt(ordering, combination);
            statistics.incrementAssignmentsEvaluated();

            if (!Evaluator.evaluateAll(knowledgeBase, assignment)) {
                continue;
            }
            statistics.incrementModelsFound();

            if (counterModel == null && !Evaluator.evaluate(query, assignment)) {
                counterModel = assignment;
                LOGGER.fine("Controesempio trovato: " + assignment);
            }
        }

        statistics.stopTimer();

        if (counterModel == null) {
            LOGGER.info("KB ⊨ " + query + ": vero (" + statistics.getModelsFound() + " modelli della KB)");
            return EntailmentResult.entailed(knowledgeBase, query, statistics.getModelsFound(), statistics);
        }
        LOGGER.info("KB ⊨ " + query + ": falso, controesempio " + counterModel);
        return EntailmentResult.notEntailed(knowledgeBase, query, counterModel, statistics.getModelsFound(), statistics);
    }

    //endregion

    public AssignmentEnumerator getEnumerator() {
        return enumerator;
    }
}
