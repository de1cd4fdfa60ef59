package org.entailment.parser;

import java.util.Arrays;
import java.util.Optional;

/**
 * Token prodotto dal lexer e consumato una sola volta dal parser.
 *
 * @param type tipo del token
 * @param text testo originale: nome della variabile per ATOM, lessema fisso per gli altri
 */
public record FormulaToken(Type type, String text) {

    /**
     * Tipi di token riconosciuti, con il lessema fisso delle parole chiave e delle parentesi.
     */
    public enum Type {
        ATOM(null, "Atom"),
        NOT("not", "Not"),
        AND("and", "And"),
        OR("or", "Or"),
        IF("if", "If"),
        IFF("iff", "Iff"),
        THEN("then", "Then"),
        OPEN_PAREN("(", "OpenParen"),
        CLOSE_PAREN(")", "CloseParen");

        private final String lexeme;
        private final String displayName;

        Type(String lexeme, String displayName) {
            this.lexeme = lexeme;
            this.displayName = displayName;
        }

        public String lexeme() {
            return lexeme;
        }

        /**
         * Parola chiave o parentesi corrispondente al testo, se esiste.
         * Il confronto distingue maiuscole e minuscole.
         */
        public static Optional<Type> fromLexeme(String text) {
            return Arrays.stream(values())
                    .filter(type -> type.lexeme != null && type.lexeme.equals(text))
                    .findFirst();
        }
    }

    public FormulaToken {
        if (type == null) {
            throw new IllegalArgumentException("Tipo token non può essere null");
        }
        if (type == Type.ATOM) {
            validateAtomName(text);
        } else if (!type.lexeme.equals(text)) {
            throw new IllegalArgumentException("Testo '" + text + "' non valido per token " + type);
        }
    }

    private static void validateAtomName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome atomo non può essere null o vuoto");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
                throw new IllegalArgumentException("Nome atomo non alfabetico: " + name);
            }
        }
        if (Type.fromLexeme(name).isPresent()) {
            throw new IllegalArgumentException("Parola riservata usata come atomo: " + name);
        }
    }

    /**
     * Token variabile.
     */
    public static FormulaToken atom(String name) {
        return new FormulaToken(Type.ATOM, name);
    }

    /**
     * Token parola chiave o parentesi con il suo lessema fisso.
     *
     * @throws IllegalArgumentException se invocato con {@link Type#ATOM}
     */
    public static FormulaToken of(Type type) {
        if (type == Type.ATOM) {
            throw new IllegalArgumentException("I token ATOM richiedono un nome: usare atom(name)");
        }
        return new FormulaToken(type, type.lexeme);
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    /**
     * Forma compatta usata nei report: {@code Atom(a)}, {@code And}, {@code OpenParen}, ...
     */
    @Override
    public String toString() {
        return type == Type.ATOM ? "Atom(" + text + ")" : type.displayName;
    }
}
