package org.entailment.support;

/**
 * Numero di atomi oltre il limite ammesso per l'enumerazione esaustiva.
 *
 * Sollevata prima di qualsiasi allocazione: 2^n assegnamenti con n atomi.
 */
public class ResourceLimitExceededException extends RuntimeException {

    private final int requestedAtoms;
    private final int maxAtoms;

    public ResourceLimitExceededException(int requestedAtoms, int maxAtoms) {
        super("Troppi atomi per l'enumerazione: " + requestedAtoms
                + " (massimo consentito " + maxAtoms + ", 2^" + requestedAtoms + " assegnamenti)");
        this.requestedAtoms = requestedAtoms;
        this.maxAtoms = maxAtoms;
    }

    public int getRequestedAtoms() {
        return requestedAtoms;
    }

    public int getMaxAtoms() {
        return maxAtoms;
    }
}
