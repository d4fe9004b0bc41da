package com.loglens.core.expression.grammar;

public enum TokenType {
    // Integer or decimal literal - 42, 0.5
    NUMBER,

    // Single- or double-quoted string constant, unescaped
    STRING,

    // Names and keywords - event, metadata, and, or, not, in, True, False, None
    IDENTIFIER,

    // Comparison and arithmetic symbols - ==, !=, <, <=, >, >=, +, -, *, /, %
    OPERATOR,

    // Attribute access - event.level
    DOT,

    // Element separator inside tuples and lists
    COMMA,

    PARENTHESIS_OPEN,
    PARENTHESIS_CLOSE,
    BRACKET_OPEN,
    BRACKET_CLOSE,

    // End of input
    END
}
