package com.gsettings.explorer.value.text;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of value text notation.
 */
@Data
@AllArgsConstructor
public class ValueTextToken {
    private TokenType type;
    private String value;
    private int offset;

    public enum TokenType {
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        LPAREN,
        RPAREN,
        LANGLE,
        RANGLE,
        COMMA,
        COLON,
        STRING_LITERAL,
        NUMERIC_LITERAL,
        WORD,
        TYPE_ANNOTATION,
        EOF
    }

    public boolean isWord(String word) {
        return type == TokenType.WORD && value.equals(word);
    }
}
