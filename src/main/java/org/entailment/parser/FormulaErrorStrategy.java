package org.entailment.parser;

import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.entailment.antlr.PropositionalFormulaParser;

/**
 * STRATEGIA ERRORI - Interrompe il parsing al primo errore con un messaggio specifico
 *
 * Sostituisce il recupero automatico di ANTLR (inserimento/cancellazione di token) con
 * un'eccezione {@link FormulaParseException}: nessun albero parziale viene mai prodotto.
 *
 * CLASSIFICAZIONE DEGLI ERRORI (in base al token corrente e ai token attesi):
 * - parentesi di chiusura mancante: era attesa ')', anche se il token trovato è 'then'
 * - 'then' non atteso: then in posizione di espressione
 * - 'then' mancante: condizionale non completato
 * - token in eccesso: formula già completa, attesa fine input
 * - espressione attesa: qualsiasi altro inizio non valido, compreso l'input vuoto
 */
class FormulaErrorStrategy extends DefaultErrorStrategy {

    /** Testo della formula, solo per i messaggi; può essere null */
    private final String formulaText;

    FormulaErrorStrategy(String formulaText) {
        this.formulaText = formulaText;
    }

    @Override
    public void reportError(Parser recognizer, RecognitionException e) {
        throw describe(recognizer, e.getOffendingToken(), e.getExpectedTokens());
    }

    @Override
    public void recover(Parser recognizer, RecognitionException e) {
        throw describe(recognizer, e.getOffendingToken(), e.getExpectedTokens());
    }

    @Override
    public Token recoverInline(Parser recognizer) {
        throw describe(recognizer, recognizer.getCurrentToken(), recognizer.getExpectedTokens());
    }

    /**
     * Nessuna risincronizzazione: gli errori emergono solo dal match dei token.
     */
    @Override
    public void sync(Parser recognizer) {
    }

    private FormulaParseException describe(Parser recognizer, Token offending, IntervalSet expected) {
        Token current = offending != null ? offending : recognizer.getCurrentToken();
        IntervalSet expectedTokens = expected != null ? expected : recognizer.getExpectedTokens();
        int index = Math.max(current.getTokenIndex(), 0);
        String found = current.getType() == Token.EOF ? "fine input" : "'" + current.getText() + "'";

        String message;
        if (expectedTokens.contains(PropositionalFormulaParser.RPAR)) {
            message = "Manca la parentesi di chiusura, trovato " + found;
        } else if (current.getType() == PropositionalFormulaParser.THEN
                && !expectedTokens.contains(PropositionalFormulaParser.THEN)) {
            message = "'then' non atteso: nessun 'if' o 'iff' da completare";
        } else if (expectedTokens.contains(PropositionalFormulaParser.THEN)) {
            message = "Manca 'then' dopo la condizione di 'if'/'iff', trovato " + found;
        } else if (expectedTokens.contains(Token.EOF)) {
            message = "Token in eccesso dopo una formula completa: " + found;
        } else {
            message = "Espressione attesa, trovato " + found;
        }

        return new FormulaParseException(message + " (token " + index + ")", formulaText, index);
    }
}
