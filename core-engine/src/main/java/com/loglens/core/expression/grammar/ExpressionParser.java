package com.loglens.core.expression.grammar;

import com.loglens.core.expression.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for event expressions.
 *
 * <p>
 * Precedence from loosest to tightest: {@code or}, {@code and}, {@code not},
 * comparisons and membership, {@code + -}, {@code * / %}, unary minus.
 * Only {@code event.*} paths and literals are reachable; there are no
 * function calls or variable bindings.
 * </p>
 */
public final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /**
     * Parses a complete expression.
     *
     * @throws InvalidExpressionException if the text is blank, malformed, or
     *         has trailing tokens
     */
    public static ExpressionNode parse(String expression) throws InvalidExpressionException {
        if (expression == null || expression.isBlank()) {
            throw new InvalidExpressionException("Expression must not be blank");
        }
        ExpressionParser parser = new ExpressionParser(expression, Tokenizer.tokenize(expression));
        ExpressionNode root = parser.parseOr();
        if (parser.peek().getType() != TokenType.END) {
            throw parser.error("Unexpected '" + parser.peek().getContent() + "'", parser.peek());
        }
        return root;
    }

    // -------------------------------------------------------------------------
    // Grammar rules
    // -------------------------------------------------------------------------

    private ExpressionNode parseOr() throws InvalidExpressionException {
        ExpressionNode left = parseAnd();
        while (acceptKeyword("or")) {
            left = new BinaryNode(BinaryNode.Operator.OR, left, parseAnd());
        }
        return left;
    }

    private ExpressionNode parseAnd() throws InvalidExpressionException {
        ExpressionNode left = parseNot();
        while (acceptKeyword("and")) {
            left = new BinaryNode(BinaryNode.Operator.AND, left, parseNot());
        }
        return left;
    }

    private ExpressionNode parseNot() throws InvalidExpressionException {
        if (acceptKeyword("not")) {
            return new UnaryNode(UnaryNode.Operator.NOT, parseNot());
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() throws InvalidExpressionException {
        ExpressionNode left = parseAdditive();
        Token token = peek();

        BinaryNode.Operator operator = null;
        if (token.getType() == TokenType.OPERATOR) {
            operator = switch (token.getContent()) {
                case "==", "!=", "<", "<=", ">", ">=" -> BinaryNode.Operator.fromSymbol(token.getContent());
                default -> null;
            };
            if (operator != null) {
                index++;
            }
        } else if (token.is(TokenType.IDENTIFIER, "in")) {
            index++;
            operator = BinaryNode.Operator.IN;
        } else if (token.is(TokenType.IDENTIFIER, "not") && peekAhead(1).is(TokenType.IDENTIFIER, "in")) {
            index += 2;
            operator = BinaryNode.Operator.NOT_IN;
        }

        if (operator == null) {
            return left;
        }
        return new BinaryNode(operator, left, parseAdditive());
    }

    private ExpressionNode parseAdditive() throws InvalidExpressionException {
        ExpressionNode left = parseTerm();
        while (true) {
            if (acceptOperator("+")) {
                left = new BinaryNode(BinaryNode.Operator.ADD, left, parseTerm());
            } else if (acceptOperator("-")) {
                left = new BinaryNode(BinaryNode.Operator.SUBTRACT, left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode parseTerm() throws InvalidExpressionException {
        ExpressionNode left = parseUnary();
        while (true) {
            if (acceptOperator("*")) {
                left = new BinaryNode(BinaryNode.Operator.MULTIPLY, left, parseUnary());
            } else if (acceptOperator("/")) {
                left = new BinaryNode(BinaryNode.Operator.DIVIDE, left, parseUnary());
            } else if (acceptOperator("%")) {
                left = new BinaryNode(BinaryNode.Operator.MODULO, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private ExpressionNode parseUnary() throws InvalidExpressionException {
        if (acceptOperator("-")) {
            return new UnaryNode(UnaryNode.Operator.NEGATE, parseUnary());
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() throws InvalidExpressionException {
        Token token = next();
        switch (token.getType()) {
            case NUMBER:
                return new LiteralNode(parseNumber(token.getContent()));
            case STRING:
                return new LiteralNode(token.getContent());
            case IDENTIFIER:
                return parseIdentifier(token);
            case PARENTHESIS_OPEN:
                return parseParenthesized();
            case BRACKET_OPEN:
                return new SequenceNode(parseElements(TokenType.BRACKET_CLOSE));
            case END:
                throw error("Unexpected end of expression", token);
            default:
                throw error("Unexpected '" + token.getContent() + "'", token);
        }
    }

    private ExpressionNode parseIdentifier(Token token) throws InvalidExpressionException {
        switch (token.getContent()) {
            case "True":
            case "true":
                return new LiteralNode(Boolean.TRUE);
            case "False":
            case "false":
                return new LiteralNode(Boolean.FALSE);
            case "None":
            case "null":
                return new LiteralNode(null);
            case "event":
                return parseEventPath(token);
            default:
                throw error("Unknown name '" + token.getContent() + "'", token);
        }
    }

    private ExpressionNode parseEventPath(Token eventToken) throws InvalidExpressionException {
        List<String> segments = new ArrayList<>();
        while (true) {
            Token token = peek();
            if (token.getType() == TokenType.DOT) {
                index++;
                Token name = next();
                if (name.getType() != TokenType.IDENTIFIER) {
                    throw error("Expected attribute name after '.'", name);
                }
                segments.add(name.getContent());
            } else if (token.getType() == TokenType.NUMBER && token.getContent().startsWith(".")) {
                // "event.metadata.items.0" tokenizes the index as ".0"
                index++;
                segments.add(token.getContent().substring(1));
            } else if (token.getType() == TokenType.BRACKET_OPEN) {
                index++;
                Token key = next();
                if (key.getType() != TokenType.STRING && key.getType() != TokenType.NUMBER) {
                    throw error("Expected string key inside '[...]'", key);
                }
                expect(TokenType.BRACKET_CLOSE, "]");
                segments.add(key.getContent());
            } else {
                break;
            }
        }

        if (segments.isEmpty()) {
            throw error("'event' must be followed by an attribute, e.g. event.level", eventToken);
        }
        String attribute = segments.get(0);
        if (!EventFieldNode.ATTRIBUTES.contains(attribute)) {
            throw error("Unknown event attribute '" + attribute + "'; expected one of "
                    + EventFieldNode.ATTRIBUTES, eventToken);
        }
        List<String> path = segments.subList(1, segments.size());
        if (!path.isEmpty() && !"metadata".equals(attribute)) {
            throw error("Attribute 'event." + attribute + "' has no nested fields", eventToken);
        }
        return new EventFieldNode(attribute, path);
    }

    private ExpressionNode parseParenthesized() throws InvalidExpressionException {
        if (accept(TokenType.PARENTHESIS_CLOSE)) {
            return new SequenceNode(List.of());
        }
        ExpressionNode first = parseOr();
        if (accept(TokenType.PARENTHESIS_CLOSE)) {
            return first;
        }
        expect(TokenType.COMMA, ",");
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(parseElements(TokenType.PARENTHESIS_CLOSE));
        return new SequenceNode(elements);
    }

    /** Comma separated elements up to the closing token; a trailing comma is allowed. */
    private List<ExpressionNode> parseElements(TokenType close) throws InvalidExpressionException {
        List<ExpressionNode> elements = new ArrayList<>();
        while (!accept(close)) {
            elements.add(parseOr());
            if (!accept(TokenType.COMMA)) {
                expect(close, close == TokenType.BRACKET_CLOSE ? "]" : ")");
                break;
            }
        }
        return elements;
    }

    // -------------------------------------------------------------------------
    // Token helpers
    // -------------------------------------------------------------------------

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.getType() != TokenType.END) {
            index++;
        }
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().getType() == type) {
            index++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().is(TokenType.IDENTIFIER, keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean acceptOperator(String symbol) {
        if (peek().is(TokenType.OPERATOR, symbol)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String display) throws InvalidExpressionException {
        Token token = peek();
        if (token.getType() != type) {
            String found = token.getType() == TokenType.END ? "end of expression" : "'" + token.getContent() + "'";
            throw error("Expected '" + display + "' but found " + found, token);
        }
        index++;
    }

    private static Object parseNumber(String text) {
        if (text.contains(".")) {
            return Double.parseDouble(text);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return Double.parseDouble(text);
        }
    }

    private InvalidExpressionException error(String message, Token token) {
        return new InvalidExpressionException(message + " at position " + token.getPosition()
                + " in: " + source);
    }
}
