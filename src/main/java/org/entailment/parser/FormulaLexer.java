package org.entailment.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.entailment.antlr.PropositionalFormulaLexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * LEXER FORMULE - Converte il testo di una formula nella sequenza completa di token
 *
 * Il riconoscimento dei caratteri è delegato al lexer generato dalla grammatica
 * PropositionalFormula: sequenze massimali di lettere, parentesi, tutto il resto
 * scartato come separatore. Una sequenza di lettere uguale a una parola riservata
 * ({@code not, and, or, if, iff, then}) diventa il token corrispondente, altrimenti è un atomo.
 *
 * REGOLE APPLICATE DURANTE LA CONVERSIONE:
 * - {@code then} è ammesso solo se un {@code if}/{@code iff} precedente è ancora aperto;
 *   ogni {@code then} chiude un condizionale
 * - due atomi consecutivi senza operatore sono rifiutati appena compare il secondo
 * - l'annidamento non può superare {@link #MAX_NESTING_DEPTH} livelli
 *
 * PROFONDITÀ DI ANNIDAMENTO:
 * stima per eccesso della profondità dell'albero al token corrente, somma di
 * parentesi aperte, {@code if}/{@code iff} aperti nel gruppo di parentesi corrente
 * (il conseguente dopo {@code then} resta annidato fino alla chiusura del gruppo)
 * e {@code not} consecutivi.
 *
 * La sequenza restituita è interamente materializzata: il parser la consuma con lookahead.
 */
public final class FormulaLexer {

    private static final Logger LOGGER = Logger.getLogger(FormulaLexer.class.getName());

    /** Profondità massima di annidamento accettata */
    public static final int MAX_NESTING_DEPTH = 200;

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaLexer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region LEXING

    /**
     * Esegue il lexing completo della formula.
     *
     * @param input testo della formula (non null, può essere vuoto)
     * @return lista non modificabile di token, vuota per input senza lettere né parentesi
     * @throws FormulaLexException se {@code then} compare senza condizionale aperto,
     *         se due atomi sono adiacenti o se l'annidamento supera {@link #MAX_NESTING_DEPTH}
     * @throws IllegalArgumentException se input è null
     */
    public static List<FormulaToken> lex(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(CharStreams.fromString(input));
        lexer.removeErrorListeners();

        List<FormulaToken> tokens = new ArrayList<>();
        int openConditionals = 0;
        boolean lastWasAtom = false;

        // Condizionali aperti per ogni gruppo di parentesi, il primo elemento è il gruppo corrente
        Deque<Integer> conditionalsPerGroup = new ArrayDeque<>();
        conditionalsPerGroup.push(0);
        int nestedConditionals = 0;
        int negationRun = 0;

        for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken()) {
            FormulaToken.Type type = toFormulaType(token);

            switch (type) {
                case IF, IFF -> openConditionals++;
                case THEN -> {
                    if (openConditionals == 0) {
                        throw new FormulaLexException(
                                "'then' senza 'if' o 'iff' precedente (posizione " + token.getStartIndex() + ")",
                                input, token.getStartIndex());
                    }
                    openConditionals--;
                }
                case ATOM -> {
                    if (lastWasAtom) {
                        throw new FormulaLexException(
                                "Operatore mancante tra atomi prima di '" + token.getText()
                                        + "' (posizione " + token.getStartIndex() + ")",
                                input, token.getStartIndex());
                    }
                }
                case OPEN_PAREN -> conditionalsPerGroup.push(0);
                case CLOSE_PAREN -> {
                    if (conditionalsPerGroup.size() > 1) {
                        nestedConditionals -= conditionalsPerGroup.pop();
                    }
                }
                default -> { /* operatori: nessun vincolo */ }
            }

            if (type == FormulaToken.Type.IF || type == FormulaToken.Type.IFF) {
                conditionalsPerGroup.push(conditionalsPerGroup.pop() + 1);
                nestedConditionals++;
            }
            negationRun = type == FormulaToken.Type.NOT ? negationRun + 1 : 0;

            int depth = (conditionalsPerGroup.size() - 1) + nestedConditionals + negationRun;
            if (depth > MAX_NESTING_DEPTH) {
                LOGGER.warning("Formula rifiutata: annidamento oltre " + MAX_NESTING_DEPTH + " livelli");
                throw new FormulaLexException(
                        "Annidamento troppo profondo: oltre " + MAX_NESTING_DEPTH
                                + " livelli (posizione " + token.getStartIndex() + ")",
                        input, token.getStartIndex());
            }

            tokens.add(type == FormulaToken.Type.ATOM
                    ? FormulaToken.atom(token.getText())
                    : FormulaToken.of(type));
            lastWasAtom = type == FormulaToken.Type.ATOM;
        }

        LOGGER.finest("Token prodotti per '" + input + "': " + tokens);
        return List.copyOf(tokens);
    }

    /**
     * Corrispondenza tra i tipi del lexer generato e i tipi di {@link FormulaToken}.
     */
    private static FormulaToken.Type toFormulaType(Token token) {
        return switch (token.getType()) {
            case PropositionalFormulaLexer.ATOM -> FormulaToken.Type.ATOM;
            case PropositionalFormulaLexer.NOT -> FormulaToken.Type.NOT;
            case PropositionalFormulaLexer.AND -> FormulaToken.Type.AND;
            case PropositionalFormulaLexer.OR -> FormulaToken.Type.OR;
            case PropositionalFormulaLexer.IF -> FormulaToken.Type.IF;
            case PropositionalFormulaLexer.IFF -> FormulaToken.Type.IFF;
            case PropositionalFormulaLexer.THEN -> FormulaToken.Type.THEN;
            case PropositionalFormulaLexer.LPAR -> FormulaToken.Type.OPEN_PAREN;
            case PropositionalFormulaLexer.RPAR -> FormulaToken.Type.CLOSE_PAREN;
            default -> throw new IllegalStateException("Token inatteso dal lexer generato: " + token);
        };
    }

    //endregion

    //region SERIALIZZAZIONE

    /**
     * Riscrive una sequenza di token come testo separato da spazi.
     * Rileggere il risultato con {@link #lex(String)} restituisce la stessa sequenza.
     *
     * @param tokens token da serializzare
     * @return testo della formula
     */
    public static String render(List<FormulaToken> tokens) {
        if (tokens == null) {
            throw new IllegalArgumentException("Lista token null");
        }
        return tokens.stream()
                .map(FormulaToken::text)
                .collect(Collectors.joining(" "));
    }

    //endregion
}
