package org.entailment.parser;

/**
 * Violazione delle regole del lexer: {@code then} senza {@code if}/{@code iff} aperto,
 * oppure due atomi consecutivi senza operatore.
 */
public class FormulaLexException extends FormulaSyntaxException {

    /** Posizione (carattere, base 0) del lessema che ha causato l'errore */
    private final int position;

    public FormulaLexException(String message, String formulaText, int position) {
        super(message, formulaText);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
