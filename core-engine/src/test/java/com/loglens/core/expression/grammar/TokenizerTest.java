package com.loglens.core.expression.grammar;

import com.loglens.core.expression.InvalidExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Tokenizer}.
 */
class TokenizerTest {

    @Test
    @DisplayName("Should split a comparison into typed tokens ending with END")
    void shouldTokenizeComparison() throws InvalidExpressionException {
        List<Token> tokens = Tokenizer.tokenize("event.level == 'ERROR'");

        assertThat(tokens).extracting(Token::getType).containsExactly(
                TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER,
                TokenType.OPERATOR, TokenType.STRING, TokenType.END);
        assertThat(tokens.get(3).getContent()).isEqualTo("==");
        assertThat(tokens.get(4).getContent()).isEqualTo("ERROR");
        assertThat(tokens.get(4).getPosition()).isEqualTo(15);
    }

    @Test
    @DisplayName("Should read integer and decimal numbers")
    void shouldTokenizeNumbers() throws InvalidExpressionException {
        List<Token> tokens = Tokenizer.tokenize("42 + 0.5");

        assertThat(tokens).extracting(Token::getContent).containsExactly("42", "+", "0.5", "");
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.NUMBER);
    }

    @Test
    @DisplayName("Should unescape quoted strings in either quote style")
    void shouldUnescapeStrings() throws InvalidExpressionException {
        List<Token> tokens = Tokenizer.tokenize("\"it's\" 'a\\'b'");

        assertThat(tokens.get(0).getContent()).isEqualTo("it's");
        assertThat(tokens.get(1).getContent()).isEqualTo("a'b");
    }

    @Test
    @DisplayName("Should read two-character comparison operators")
    void shouldReadCompoundOperators() throws InvalidExpressionException {
        List<Token> tokens = Tokenizer.tokenize("a<=b>=c!=d<e");

        assertThat(tokens).filteredOn(t -> t.getType() == TokenType.OPERATOR)
                .extracting(Token::getContent)
                .containsExactly("<=", ">=", "!=", "<");
    }

    @Test
    @DisplayName("Should reject a single '=' with a hint")
    void shouldRejectSingleEquals() {
        assertThatThrownBy(() -> Tokenizer.tokenize("event.source = 'api'"))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("did you mean '=='");
    }

    @Test
    @DisplayName("Should reject unterminated strings and unknown characters")
    void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> Tokenizer.tokenize("event.source == 'api"))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("Unterminated string");
        assertThatThrownBy(() -> Tokenizer.tokenize("event.source; drop"))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("';'");
    }
}
