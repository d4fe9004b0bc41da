package com.loglens.core.expression.grammar;

import com.loglens.core.expression.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into tokens. Whitespace is discarded; the list always
 * ends with a single {@link TokenType#END} token.
 */
public final class Tokenizer {

    private Tokenizer() {}

    public static List<Token> tokenize(String expression) throws InvalidExpressionException {
        List<Token> tokens = new ArrayList<>();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);
            int start = i;

            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)
                    || (c == '.' && i + 1 < length && Character.isDigit(expression.charAt(i + 1)))) {
                i = scanNumber(expression, i);
                tokens.add(new Token(TokenType.NUMBER, expression.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < length && (Character.isLetterOrDigit(expression.charAt(i))
                        || expression.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, expression.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                StringBuilder content = new StringBuilder();
                i = scanQuoted(expression, i, content);
                tokens.add(new Token(TokenType.STRING, content.toString(), start));
            } else {
                i = scanSymbol(expression, i, tokens);
            }
        }

        tokens.add(new Token(TokenType.END, "", length));
        return tokens;
    }

    private static int scanNumber(String expression, int i) {
        int length = expression.length();
        boolean seenDot = false;
        while (i < length) {
            char c = expression.charAt(i);
            if (Character.isDigit(c)) {
                i++;
            } else if (c == '.' && !seenDot
                    && i + 1 < length && Character.isDigit(expression.charAt(i + 1))) {
                seenDot = true;
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static int scanQuoted(String expression, int i, StringBuilder content)
            throws InvalidExpressionException {
        char quote = expression.charAt(i);
        int start = i;
        i++;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == quote) {
                return i + 1;
            }
            if (c == '\\' && i + 1 < expression.length()) {
                char escaped = expression.charAt(i + 1);
                switch (escaped) {
                    case 'n' -> content.append('\n');
                    case 't' -> content.append('\t');
                    default -> content.append(escaped);
                }
                i += 2;
            } else {
                content.append(c);
                i++;
            }
        }
        throw new InvalidExpressionException(
                "Unterminated string starting at position " + start + " in: " + expression);
    }

    private static int scanSymbol(String expression, int i, List<Token> tokens)
            throws InvalidExpressionException {
        char c = expression.charAt(i);
        char next = i + 1 < expression.length() ? expression.charAt(i + 1) : '\0';

        switch (c) {
            case '(' -> tokens.add(new Token(TokenType.PARENTHESIS_OPEN, "(", i));
            case ')' -> tokens.add(new Token(TokenType.PARENTHESIS_CLOSE, ")", i));
            case '[' -> tokens.add(new Token(TokenType.BRACKET_OPEN, "[", i));
            case ']' -> tokens.add(new Token(TokenType.BRACKET_CLOSE, "]", i));
            case ',' -> tokens.add(new Token(TokenType.COMMA, ",", i));
            case '.' -> tokens.add(new Token(TokenType.DOT, ".", i));
            case '+', '-', '*', '/', '%' -> tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i));
            case '<', '>' -> {
                if (next == '=') {
                    tokens.add(new Token(TokenType.OPERATOR, c + "=", i));
                    return i + 2;
                }
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), i));
            }
            case '=', '!' -> {
                if (next != '=') {
                    throw new InvalidExpressionException("Unexpected '" + c + "' at position " + i
                            + " (did you mean '" + c + "='?) in: " + expression);
                }
                tokens.add(new Token(TokenType.OPERATOR, c + "=", i));
                return i + 2;
            }
            default -> throw new InvalidExpressionException(
                    "Unexpected character '" + c + "' at position " + i + " in: " + expression);
        }
        return i + 1;
    }
}
