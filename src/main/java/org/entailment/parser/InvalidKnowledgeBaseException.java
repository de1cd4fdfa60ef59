package org.entailment.parser;

/**
 * Formula non valida all'interno di una base di conoscenza.
 *
 * Indica quale formula (indice a partire da 1) ha fallito; la causa è l'errore di
 * lexing o parsing originale.
 */
public class InvalidKnowledgeBaseException extends FormulaSyntaxException {

    private final int formulaIndex;

    public InvalidKnowledgeBaseException(int formulaIndex, String formulaText, FormulaSyntaxException cause) {
        super("Formula n. " + formulaIndex + " della base di conoscenza non valida ('" + formulaText + "'): "
                + cause.getMessage(), formulaText, cause);
        this.formulaIndex = formulaIndex;
    }

    public int getFormulaIndex() {
        return formulaIndex;
    }
}
