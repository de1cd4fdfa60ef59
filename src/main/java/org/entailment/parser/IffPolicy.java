package org.entailment.parser;

/**
 * Interpretazione della forma {@code iff A then B}.
 */
public enum IffPolicy {

    /** Costruisce un nodo IFF (biimplicazione). Comportamento predefinito. */
    BICONDITIONAL,

    /** Costruisce un nodo IF come le versioni storiche, trattando iff come implicazione. */
    LEGACY_IMPLICATION
}
