package org.entailment.engine;

import org.entailment.formula.Formula;
import org.entailment.support.Assignment;

import java.util.List;

/**
 * REPORT SODDISFACIBILITÀ - Partizione completa degli assegnamenti di una formula
 *
 * COMPONENTI:
 * • Formula analizzata e ordinamento degli atomi usato dall'enumerazione
 * • Assegnamenti che rendono vera la formula (modelli)
 * • Assegnamenti che la rendono falsa
 * • Statistiche di esecuzione
 *
 * Entrambe le liste conservano l'ordine dell'enumerazione; insieme coprono esattamente
 * tutti i 2^n assegnamenti.
 */
public class SatisfiabilityReport {

    private final Formula formula;
    private final List<String> atoms;
    private final List<Assignment> satisfying;
    private final List<Assignment> falsifying;
    private final EnumerationStatistics statistics;

    /**
     * @throws IllegalArgumentException se un parametro è null o le liste non coprono 2^n assegnamenti
     */
    public SatisfiabilityReport(Formula formula, List<String> atoms, List<Assignment> satisfying,
                                List<Assignment> falsifying, EnumerationStatistics statistics) {
        if (formula == null || atoms == null || satisfying == null || falsifying == null) {
            throw new IllegalArgumentException("Parametri del report non possono essere null");
        }
        long expected = 1L << atoms.size();
        if (satisfying.size() + falsifying.size() != expected) {
            throw new IllegalArgumentException("Partizione incompleta: attesi " + expected + " assegnamenti, ricevuti "
                    + (satisfying.size() + falsifying.size()));
        }

        this.formula = formula;
        this.atoms = List.copyOf(atoms);
        this.satisfying = List.copyOf(satisfying);
        this.falsifying = List.copyOf(falsifying);
        this.statistics = statistics != null ? statistics : new EnumerationStatistics();
    }

    //region ACCESSORS E QUERY

    public Formula getFormula() {
        return formula;
    }

    /**
     * Atomi nell'ordine delle posizioni di bit.
     */
    public List<String> getAtoms() {
        return atoms;
    }

    public List<Assignment> getSatisfyingAssignments() {
        return satisfying;
    }

    public List<Assignment> getFalsifyingAssignments() {
        return falsifying;
    }

    public int getTotalAssignments() {
        return satisfying.size() + falsifying.size();
    }

    /**
     * Vero se esiste almeno un modello.
     */
    public boolean isSatisfiable() {
        return !satisfying.isEmpty();
    }

    /**
     * Vero se la formula è una tautologia: nessun assegnamento la falsifica.
     */
    public boolean isValid() {
        return falsifying.isEmpty();
    }

    public EnumerationStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("SatisfiabilityReport[%s: %d/%d soddisfacenti]",
                formula, satisfying.size(), getTotalAssignments());
    }
}
