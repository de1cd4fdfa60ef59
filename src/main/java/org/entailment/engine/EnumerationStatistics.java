package org.entailment.engine;

/**
 * STATISTICHE ENUMERAZIONE - Metriche di una singola esecuzione del verificatore
 *
 * Contatori per assegnamenti valutati e modelli trovati, più il tempo di esecuzione
 * misurato dalla costruzione fino a {@link #stopTimer()}.
 */
public class EnumerationStatistics {

    //region CONTATORI

    /** Numero di atomi dell'universo enumerato */
    private int atomCount = 0;

    /** Assegnamenti effettivamente costruiti e valutati */
    private long assignmentsEvaluated = 0;

    /**
     * Modelli trovati: assegnamenti che soddisfano la formula (modalità soddisfacibilità)
     * oppure tutte le formule della base di conoscenza (modalità conseguenza logica).
     */
    private long modelsFound = 0;

    //endregion

    //region TIMING

    /** Tempo di esecuzione totale in millisecondi */
    private long executionTimeMs = 0;

    private final long startTime;

    private boolean timerStopped = false;

    /**
     * Avvia immediatamente la misurazione del tempo.
     */
    public EnumerationStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Ferma il timer; le chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region AGGIORNAMENTO

    public void setAtomCount(int atomCount) {
        this.atomCount = atomCount;
    }

    public void incrementAssignmentsEvaluated() {
        assignmentsEvaluated++;
    }

    public void incrementModelsFound() {
        modelsFound++;
    }

    //endregion

    //region ACCESSORS

    public int getAtomCount() {
        return atomCount;
    }

    public long getAssignmentsEvaluated() {
        return assignmentsEvaluated;
    }

    public long getModelsFound() {
        return modelsFound;
    }

    /**
     * Tempo trascorso: definitivo se il timer è fermo, parziale altrimenti.
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("Atomi: %d | Assegnamenti valutati: %d | Modelli: %d | Tempo: %d ms",
                atomCount, assignmentsEvaluated, modelsFound, getExecutionTimeMs());
    }
}
