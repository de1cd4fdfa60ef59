package org.entailment.parser;

import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Token;
import org.entailment.antlr.PropositionalFormulaParser;
import org.entailment.antlr.PropositionalFormulaParser.FormulaContext;
import org.entailment.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * PARSER FORMULE - Costruisce l'albero di una formula dalla sequenza di token del lexer
 *
 * GRAMMATICA (dal legame più forte al più debole):
 * <pre>
 * formula    := expression EOF
 * expression := primary ( (AND | OR) primary )*
 * primary    := ATOM | NOT primary | '(' expression ')' | (IF | IFF) expression THEN expression
 * </pre>
 *
 * I token vengono riconvertiti in token ANTLR e consumati dal parser discendente generato
 * dalla grammatica PropositionalFormula; {@link FormulaTreeBuilder} produce poi la
 * {@link Formula}. Qualsiasi violazione interrompe il parsing con {@link FormulaParseException},
 * compresi input vuoto e token in eccesso.
 *
 * Ogni istanza analizza una sola sequenza.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private final List<FormulaToken> tokens;
    private final IffPolicy iffPolicy;
    private final String sourceText;

    //region COSTRUZIONE

    /**
     * Parser con interpretazione predefinita di iff (biimplicazione).
     */
    public FormulaParser(List<FormulaToken> tokens) {
        this(tokens, IffPolicy.BICONDITIONAL);
    }

    public FormulaParser(List<FormulaToken> tokens, IffPolicy iffPolicy) {
        this(tokens, iffPolicy, null);
    }

    private FormulaParser(List<FormulaToken> tokens, IffPolicy iffPolicy, String sourceText) {
        if (tokens == null || tokens.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Sequenza di token null o contenente elementi null");
        }
        if (iffPolicy == null) {
            throw new IllegalArgumentException("Politica iff non può essere null");
        }
        this.tokens = List.copyOf(tokens);
        this.iffPolicy = iffPolicy;
        this.sourceText = sourceText != null ? sourceText : FormulaLexer.render(tokens);
    }

    //endregion

    //region PARSING

    /**
     * Analizza l'intera sequenza di token.
     *
     * @return albero della formula
     * @throws FormulaParseException se la grammatica è violata, restano token non consumati
     *         o l'annidamento esaurisce lo stack
     */
    public Formula parse() {
        List<Token> antlrTokens = new ArrayList<>(tokens.size());
        for (FormulaToken token : tokens) {
            antlrTokens.add(new CommonToken(toAntlrType(token.type()), token.text()));
        }

        CommonTokenStream stream = new CommonTokenStream(new ListTokenSource(antlrTokens));
        PropositionalFormulaParser parser = new PropositionalFormulaParser(stream);
        parser.removeErrorListeners();
        parser.setErrorHandler(new FormulaErrorStrategy(sourceText));

        Formula formula;
        try {
            FormulaContext tree = parser.formula();
            formula = new FormulaTreeBuilder(iffPolicy).visit(tree);
        } catch (StackOverflowError e) {
            // Sequenze costruite a mano non passano dal controllo di annidamento del lexer
            LOGGER.warning("Parsing interrotto per annidamento eccessivo: " + tokens.size() + " token");
            throw new FormulaParseException("Annidamento troppo profondo per il parser", sourceText, 0);
        }

        LOGGER.fine("Formula '" + sourceText + "' analizzata: " + formula);
        return formula;
    }

    private static int toAntlrType(FormulaToken.Type type) {
        return switch (type) {
            case ATOM -> PropositionalFormulaParser.ATOM;
            case NOT -> PropositionalFormulaParser.NOT;
            case AND -> PropositionalFormulaParser.AND;
            case OR -> PropositionalFormulaParser.OR;
            case IF -> PropositionalFormulaParser.IF;
            case IFF -> PropositionalFormulaParser.IFF;
            case THEN -> PropositionalFormulaParser.THEN;
            case OPEN_PAREN -> PropositionalFormulaParser.LPAR;
            case CLOSE_PAREN -> PropositionalFormulaParser.RPAR;
        };
    }

    //endregion

    //region SCORCIATOIE TESTO -> FORMULA

    /**
     * Lexing e parsing in un solo passo, iff come biimplicazione.
     *
     * @param text testo della formula
     * @return albero della formula
     * @throws FormulaSyntaxException al primo errore di lexing o parsing
     */
    public static Formula parseFormula(String text) {
        return parseFormula(text, IffPolicy.BICONDITIONAL);
    }

    public static Formula parseFormula(String text, IffPolicy iffPolicy) {
        List<FormulaToken> tokens = FormulaLexer.lex(text);
        return new FormulaParser(tokens, iffPolicy, text).parse();
    }

    //endregion
}
