package org.entailment.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * ASSEGNAMENTO - Valutazione booleana totale su un insieme fissato di atomi
 *
 * Mappa immutabile atomo -> valore di verità che conserva l'ordine delle variabili usato
 * dall'enumerazione, così che la stampa segua le posizioni dei bit.
 *
 * POLITICA ATOMI MANCANTI:
 * • {@link #valueOf(String)} restituisce false per un atomo non presente
 * • permette di valutare una formula con un assegnamento costruito su un universo
 *   di atomi diverso (più piccolo), trattando gli atomi sconosciuti come falsi
 *
 * Due assegnamenti sono uguali se associano gli stessi valori agli stessi atomi,
 * indipendentemente dall'ordine.
 */
public final class Assignment {

    /**
     * Valori di verità nell'ordine delle posizioni di bit.
     * Invariante: non modificabile, nessuna chiave o valore null.
     */
    private final Map<String, Boolean> values;

    /**
     * Costruisce un assegnamento copiando la mappa fornita nel suo ordine di iterazione.
     *
     * @param values valori per ogni atomo (non null, senza chiavi o valori null)
     * @throws IllegalArgumentException se la mappa è null o contiene null
     */
    public Assignment(Map<String, Boolean> values) {
        if (values == null) {
            throw new IllegalArgumentException("Mappa dei valori non può essere null");
        }
        Map<String, Boolean> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Assegnamento con atomo o valore null: " + entry);
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Assegnamento vuoto: unico elemento dell'enumerazione su zero atomi.
     */
    public static Assignment empty() {
        return new Assignment(Map.of());
    }

    /**
     * Valore di verità dell'atomo, false se l'atomo non è assegnato.
     */
    public boolean valueOf(String atom) {
        return values.getOrDefault(atom, Boolean.FALSE);
    }

    public boolean isAssigned(String atom) {
        return values.containsKey(atom);
    }

    public Set<String> atoms() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * Vista non modificabile atomo -> valore, nell'ordine dell'enumerazione.
     */
    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Assignment other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /**
     * Formato {@code {a=true, b=false}}.
     */
    @Override
    public String toString() {
        return values.toString();
    }
}
