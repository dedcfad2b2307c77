package com.plantmodel.flowsheet.notation;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A token produced by {@link NotationTokenizer}.
 */
@Data
@AllArgsConstructor
public class NotationToken {
    private TokenType type;
    private String value;
    private int position;

    public enum TokenType {
        IDENTIFIER,
        STRING_LITERAL,
        ARROW,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        EQUALS,
        COMMA,
        COLON,
        LESS_THAN,
        PIPE,
        AMPERSAND,
        SEPARATOR,
        UNKNOWN,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
