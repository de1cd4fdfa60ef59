package org.entailment.parser;

/**
 * Violazione della grammatica durante il parsing della sequenza di token.
 */
public class FormulaParseException extends FormulaSyntaxException {

    /** Indice (base 0) del token in errore nella sequenza; pari alla lunghezza a fine input */
    private final int tokenIndex;

    public FormulaParseException(String message, String formulaText, int tokenIndex) {
        super(message, formulaText);
        this.tokenIndex = tokenIndex;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }
}
