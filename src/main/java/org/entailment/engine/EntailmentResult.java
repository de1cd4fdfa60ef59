package org.entailment.engine;

import org.entailment.formula.Formula;
import org.entailment.support.Assignment;

import java.util.List;
import java.util.Optional;

/**
 * ESITO CONSEGUENZA LOGICA - Verdetto di KB ⊨ α con eventuale controesempio
 *
 * VALIDAZIONI:
 * • entailed ↔ (counterModel == null)
 * • il controesempio, se presente, soddisfa la base di conoscenza ma non α
 */
public class EntailmentResult {

    private final List<Formula> knowledgeBase;
    private final Formula query;
    private final boolean entailed;
    private final Assignment counterModel;
    private final long knowledgeBaseModels;
    private final EnumerationStatistics statistics;

    private EntailmentResult(List<Formula> knowledgeBase, Formula query, boolean entailed,
                             Assignment counterModel, long knowledgeBaseModels, EnumerationStatistics statistics) {
        if (knowledgeBase == null || query == null) {
            throw new IllegalArgumentException("Base di conoscenza e formula obiettivo non possono essere null");
        }
        if (entailed == (counterModel != null)) {
            throw new IllegalArgumentException("Controesempio presente solo se la conseguenza non vale");
        }
        this.knowledgeBase = List.copyOf(knowledgeBase);
        this.query = query;
        this.entailed = entailed;
        this.counterModel = counterModel;
        this.knowledgeBaseModels = knowledgeBaseModels;
        this.statistics = statistics != null ? statistics : new EnumerationStatistics();
    }

    //region FACTORY METHODS

    /**
     * Ogni modello della base di conoscenza soddisfa α.
     */
    public static EntailmentResult entailed(List<Formula> knowledgeBase, Formula query,
                                            long knowledgeBaseModels, EnumerationStatistics statistics) {
        return new EntailmentResult(knowledgeBase, query, true, null, knowledgeBaseModels, statistics);
    }

    /**
     * Esiste un modello della base di conoscenza che falsifica α.
     *
     * @param counterModel primo controesempio trovato (non null)
     */
    public static EntailmentResult notEntailed(List<Formula> knowledgeBase, Formula query, Assignment counterModel,
                                               long knowledgeBaseModels, EnumerationStatistics statistics) {
        if (counterModel == null) {
            throw new IllegalArgumentException("Controesempio richiesto quando la conseguenza non vale");
        }
        return new EntailmentResult(knowledgeBase, query, false, counterModel, knowledgeBaseModels, statistics);
    }

    //endregion

    //region ACCESSORS E QUERY

    public boolean isEntailed() {
        return entailed;
    }

    /**
     * @return assegnamento che soddisfa la base di conoscenza ma non α; vuoto se KB ⊨ α
     */
    public Optional<Assignment> getCounterModel() {
        return Optional.ofNullable(counterModel);
    }

    public List<Formula> getKnowledgeBase() {
        return knowledgeBase;
    }

    public Formula getQuery() {
        return query;
    }

    /**
     * Numero di assegnamenti che soddisfano tutte le formule della base di conoscenza.
     */
    public long getKnowledgeBaseModels() {
        return knowledgeBaseModels;
    }

    public EnumerationStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        return "KB ⊨ " + query + ": " + entailed
                + (counterModel != null ? " (controesempio " + counterModel + ")" : "");
    }
}
