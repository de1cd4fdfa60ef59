package org.entailment.formula;

import java.util.Objects;

/**
 * ALBERO SINTATTICO - Rappresentazione immutabile di una formula proposizionale
 *
 * Ogni nodo appartiene a uno dei sei casi mutuamente esclusivi elencati in {@link Type}.
 * L'albero viene costruito dal basso verso l'alto durante il parsing e non viene più
 * modificato: ogni nodo composto possiede in esclusiva i propri figli.
 *
 * FORME SUPPORTATE:
 * - ATOM: variabile proposizionale (a, b, pioggia, ...)
 * - NOT: negazione di un singolo operando
 * - AND, OR: congiunzione e disgiunzione binarie
 * - IF: implicazione materiale (antecedente, conseguente)
 * - IFF: biimplicazione (sinistra, destra)
 *
 * I consumatori (valutatore, raccoglitore di atomi) eseguono uno switch totale sul tipo.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo dell'albero.
     */
    public enum Type {
        ATOM,   // Variabile atomica
        NOT,    // Negazione: not A
        AND,    // Congiunzione: A and B
        OR,     // Disgiunzione: A or B
        IF,     // Implicazione: if A then B
        IFF     // Biimplicazione: iff A then B
    }

    /** Tipo del nodo */
    private final Type type;

    /** Nome della variabile (solo per ATOM) */
    private final String atom;

    /** Operando sinistro, oppure unico operando per NOT */
    private final Formula left;

    /** Operando destro (solo per nodi binari) */
    private final Formula right;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String atom, Formula left, Formula right) {
        this.type = type;
        this.atom = atom;
        this.left = left;
        this.right = right;
    }

    /**
     * Crea una foglia per la variabile indicata.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @return nodo ATOM
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public static Formula atom(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        return new Formula(Type.ATOM, name, null, null);
    }

    /**
     * Crea la negazione dell'operando.
     */
    public static Formula not(Formula operand) {
        return new Formula(Type.NOT, null, requireOperand(operand, Type.NOT), null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    /**
     * Crea l'implicazione materiale {@code antecedent -> consequent}.
     */
    public static Formula implies(Formula antecedent, Formula consequent) {
        return binary(Type.IF, antecedent, consequent);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    private static Formula binary(Type type, Formula left, Formula right) {
        return new Formula(type, null, requireOperand(left, type), requireOperand(right, type));
    }

    private static Formula requireOperand(Formula operand, Type type) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per operatore " + type);
        }
        return operand;
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return nome della variabile per nodi ATOM, null altrimenti
     */
    public String getAtom() {
        return atom;
    }

    /**
     * Operando sinistro dei nodi binari, antecedente per IF, unico operando per NOT.
     */
    public Formula getLeft() {
        return left;
    }

    /**
     * Operando destro dei nodi binari, conseguente per IF; null per ATOM e NOT.
     */
    public Formula getRight() {
        return right;
    }

    /**
     * Alias leggibile di {@link #getLeft()} per i nodi NOT.
     */
    public Formula getOperand() {
        return left;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione strutturale, es. {@code Or(Not(Atom(a)), Atom(b))}.
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> "Atom(" + atom + ")";
            case NOT -> "Not(" + left + ")";
            case AND -> "And(" + left + ", " + right + ")";
            case OR -> "Or(" + left + ", " + right + ")";
            case IF -> "If(" + left + ", " + right + ")";
            case IFF -> "Iff(" + left + ", " + right + ")";
        };
    }

    /**
     * Riscrive la formula nella sintassi di input, con parentesi attorno a ogni
     * sottoformula composta. Il risultato, riletto dal parser, produce un albero uguale.
     *
     * @return formula in notazione infissa
     */
    public String toInfix() {
        return switch (type) {
            case ATOM -> atom;
            case NOT -> "not " + wrap(left);
            case AND -> wrap(left) + " and " + wrap(right);
            case OR -> wrap(left) + " or " + wrap(right);
            case IF -> "if " + wrap(left) + " then " + wrap(right);
            case IFF -> "iff " + wrap(left) + " then " + wrap(right);
        };
    }

    private static String wrap(Formula node) {
        return node.isAtom() ? node.toInfix() : "(" + node.toInfix() + ")";
    }

    //endregion

    //region UGUAGLIANZA STRUTTURALE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula other)) return false;
        return type == other.type
                && Objects.equals(atom, other.atom)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, atom, left, right);
    }

    //endregion
}
