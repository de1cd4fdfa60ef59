package org.entailment.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.entailment.parser.FormulaToken.Type;
import org.junit.jupiter.api.Test;

class FormulaTokenTest {

    @Test
    void keywordTokensCarryTheirLexeme() {
        assertThat(FormulaToken.of(Type.IFF).text()).isEqualTo("iff");
        assertThat(FormulaToken.of(Type.OPEN_PAREN).text()).isEqualTo("(");
        assertThat(FormulaToken.of(Type.THEN).isAtom()).isFalse();
    }

    @Test
    void fromLexemeRecognisesKeywordsOnly() {
        assertThat(Type.fromLexeme("then")).contains(Type.THEN);
        assertThat(Type.fromLexeme(")")).contains(Type.CLOSE_PAREN);
        assertThat(Type.fromLexeme("Then")).isEmpty();
        assertThat(Type.fromLexeme("x")).isEmpty();
    }

    @Test
    void toStringUsesCompactForm() {
        assertThat(FormulaToken.atom("a")).hasToString("Atom(a)");
        assertThat(FormulaToken.of(Type.AND)).hasToString("And");
        assertThat(FormulaToken.of(Type.CLOSE_PAREN)).hasToString("CloseParen");
    }

    @Test
    void atomNameMustBeNonEmptyLetters() {
        assertThatThrownBy(() -> FormulaToken.atom(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormulaToken.atom("a1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormulaToken.atom(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void atomNameCannotBeAKeyword() {
        assertThatThrownBy(() -> FormulaToken.atom("and"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("and");
    }

    @Test
    void keywordTextMustMatchLexeme() {
        assertThatThrownBy(() -> new FormulaToken(Type.OR, "and"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormulaToken.of(Type.ATOM))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FormulaToken(null, "a"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
