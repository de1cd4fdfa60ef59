package org.entailment.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * ENUMERATORE ASSEGNAMENTI - Genera tutte le 2^n valutazioni di un insieme di atomi
 *
 * MAPPING ATOMI -> BIT:
 * - gli atomi vengono ordinati alfabeticamente, ordinamento fisso per l'intera enumerazione
 * - l'atomo in posizione i è vero nella combinazione c se e solo se il bit i di c vale 1
 * - le combinazioni c = 0 .. 2^n - 1 sono prodotte in ordine crescente
 *
 * LIMITE RISORSE:
 * Tempo e memoria crescono come O(2^n · n): oltre {@link #getMaxAtoms()} atomi
 * l'enumerazione viene rifiutata con {@link ResourceLimitExceededException} prima di
 * qualsiasi allocazione.
 */
public class AssignmentEnumerator {

    private static final Logger LOGGER = Logger.getLogger(AssignmentEnumerator.class.getName());

    //region CONFIGURAZIONE LIMITI

    /** Limite predefinito sul numero di atomi */
    public static final int DEFAULT_MAX_ATOMS = 20;

    /** Limite massimo configurabile: 2^24 assegnamenti */
    public static final int HARD_MAX_ATOMS = 24;

    /** Limite in uso per questa istanza */
    private final int maxAtoms;

    /**
     * Enumeratore con limite predefinito.
     */
    public AssignmentEnumerator() {
        this(DEFAULT_MAX_ATOMS);
    }

    /**
     * @param maxAtoms numero massimo di atomi enumerabili (1 .. {@link #HARD_MAX_ATOMS})
     * @throws IllegalArgumentException se il limite è fuori intervallo
     */
    public AssignmentEnumerator(int maxAtoms) {
        if (maxAtoms < 1 || maxAtoms > HARD_MAX_ATOMS) {
            throw new IllegalArgumentException("Limite atomi deve essere tra 1 e " + HARD_MAX_ATOMS
                    + ", ricevuto: " + maxAtoms);
        }
        this.maxAtoms = maxAtoms;
    }

    public int getMaxAtoms() {
        return maxAtoms;
    }

    //endregion

    //region ENUMERAZIONE

    /**
     * Ordinamento stabile degli atomi: la posizione nella lista è la posizione del bit.
     *
     * @param atoms insieme di atomi (non null)
     * @return lista non modificabile in ordine alfabetico
     * @throws ResourceLimitExceededException se gli atomi superano il limite
     */
    public List<String> ordering(Set<String> atoms) {
        if (atoms == null || atoms.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Insieme di atomi null o contenente null");
        }
        checkLimit(atoms.size());
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(atoms)));
    }

    /**
     * Numero di combinazioni per un ordinamento: 2^n.
     */
    public long combinationCount(List<String> ordering) {
        checkLimit(ordering.size());
        return 1L << ordering.size();
    }

    /**
     * Genera l'elenco completo degli assegnamenti.
     *
     * @param atoms atomi su cui enumerare; vuoto produce un solo assegnamento vuoto
     * @return lista non modificabile di esattamente 2^n assegnamenti distinti
     * @throws ResourceLimitExceededException se gli atomi superano il limite
     */
    public List<Assignment> enumerate(Set<String> atoms) {
        List<String> ordering = ordering(atoms);
        long total = combinationCount(ordering);

        LOGGER.fine("Enumerazione di " + total + " assegnamenti su " + ordering);

        List<Assignment> assignments = new ArrayList<>((int) total);
        for (long combination = 0; combination < total; combination++) {
            assignments.add(assignmentAt(ordering, combination));
        }
        return Collections.unmodifiableList(assignments);
    }

    /**
     * Costruisce una singola combinazione senza materializzare l'intero elenco.
     *
     * @param ordering ordinamento degli atomi (posizione = bit)
     * @param combination valore in 0 .. 2^n - 1
     * @return assegnamento corrispondente
     * @throws IllegalArgumentException se la combinazione è fuori intervallo
     */
    public Assignment assignmentAt(List<String> ordering, long combination) {
        long total = combinationCount(ordering);
        if (combination < 0 || combination >= total) {
            throw new IllegalArgumentException("Combinazione " + combination
                    + " fuori intervallo [0, " + total + ")");
        }

        Map<String, Boolean> values = new LinkedHashMap<>();
        for (int i = 0; i < ordering.size(); i++) {
            values.put(ordering.get(i), (combination & (1L << i)) != 0);
        }
        return new Assignment(values);
    }

    private void checkLimit(int atomCount) {
        if (atomCount > maxAtoms) {
            LOGGER.warning("Enumerazione rifiutata: " + atomCount + " atomi, limite " + maxAtoms);
            throw new ResourceLimitExceededException(atomCount, maxAtoms);
        }
    }

    //endregion
}
