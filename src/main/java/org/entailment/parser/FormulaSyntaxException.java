package org.entailment.parser;

/**
 * Errore sintattico su una formula: base comune degli errori di lexing e di parsing.
 *
 * Lexing e parsing si interrompono al primo errore, senza recupero e senza albero parziale.
 */
public class FormulaSyntaxException extends RuntimeException {

    /** Testo della formula che ha causato l'errore, null se non disponibile */
    private final String formulaText;

    public FormulaSyntaxException(String message, String formulaText) {
        super(message);
        this.formulaText = formulaText;
    }

    public FormulaSyntaxException(String message, String formulaText, Throwable cause) {
        super(message, cause);
        this.formulaText = formulaText;
    }

    public String getFormulaText() {
        return formulaText;
    }
}
