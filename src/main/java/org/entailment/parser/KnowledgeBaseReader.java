package org.entailment.parser;

import org.entailment.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Legge una base di conoscenza scritta su una riga come formule separate da virgole.
 *
 * Ogni pezzo viene ripulito dagli spazi; i pezzi vuoti vengono ignorati. Il primo pezzo
 * non valido interrompe la lettura indicando la sua posizione.
 */
public class KnowledgeBaseReader {

    private static final Logger LOGGER = Logger.getLogger(KnowledgeBaseReader.class.getName());

    private static final String SEPARATOR = ",";

    private final IffPolicy iffPolicy;

    public KnowledgeBaseReader() {
        this(IffPolicy.BICONDITIONAL);
    }

    public KnowledgeBaseReader(IffPolicy iffPolicy) {
        if (iffPolicy == null) {
            throw new IllegalArgumentException("Politica iff non può essere null");
        }
        this.iffPolicy = iffPolicy;
    }

    /**
     * Divide la riga sulle virgole, scartando spazi e pezzi vuoti.
     *
     * @param line riga della base di conoscenza (non null)
     * @return testi delle formule nell'ordine della riga
     */
    public static List<String> split(String line) {
        if (line == null) {
            throw new IllegalArgumentException("Riga della base di conoscenza null");
        }
        List<String> pieces = new ArrayList<>();
        for (String piece : line.split(SEPARATOR, -1)) {
            String trimmed = piece.trim();
            if (!trimmed.isEmpty()) {
                pieces.add(trimmed);
            }
        }
        return pieces;
    }

    /**
     * Divide e analizza tutte le formule della riga.
     *
     * @param line riga della base di conoscenza
     * @return formule analizzate, nell'ordine della riga; vuota se la riga non contiene formule
     * @throws InvalidKnowledgeBaseException alla prima formula non valida
     */
    public List<Formula> read(String line) {
        List<String> pieces = split(line);
        List<Formula> formulas = new ArrayList<>(pieces.size());

        for (int i = 0; i < pieces.size(); i++) {
            String piece = pieces.get(i);
            try {
                formulas.add(FormulaParser.parseFormula(piece, iffPolicy));
            } catch (FormulaSyntaxException e) {
                LOGGER.warning("Formula " + (i + 1) + " della base di conoscenza rifiutata: " + e.getMessage());
                throw new InvalidKnowledgeBaseException(i + 1, piece, e);
            }
        }

        LOGGER.fine("Base di conoscenza letta: " + formulas.size() + " formule");
        return List.copyOf(formulas);
    }
}
