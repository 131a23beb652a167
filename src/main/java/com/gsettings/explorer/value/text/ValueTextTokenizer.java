package com.gsettings.explorer.value.text;

import com.gsettings.explorer.exception.ValueSyntaxException;
import com.gsettings.explorer.value.text.ValueTextToken.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for value text notation.
 */
public class ValueTextTokenizer {

    private static final Map<Character, TokenType> PUNCTUATION = Map.of(
        '[', TokenType.LBRACKET,
        ']', TokenType.RBRACKET,
        '{', TokenType.LBRACE,
        '}', TokenType.RBRACE,
        '(', TokenType.LPAREN,
        ')', TokenType.RPAREN,
        '<', TokenType.LANGLE,
        '>', TokenType.RANGLE,
        ',', TokenType.COMMA,
        ':', TokenType.COLON
    );

    private final String source;
    private int pos = 0;

    public ValueTextTokenizer(String source) {
        this.source = source;
    }

    public List<ValueTextToken> tokenize() {
        List<ValueTextToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new ValueTextToken(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private ValueTextToken nextToken() {
        int start = pos;
        char c = source.charAt(pos);

        TokenType punctuation = PUNCTUATION.get(c);
        if (punctuation != null) {
            pos++;
            return new ValueTextToken(punctuation, String.valueOf(c), start);
        }
        if (c == '\'' || c == '"') {
            return readString(c);
        }
        if (c == '@') {
            return readTypeAnnotation();
        }
        if (Character.isDigit(c) || c == '.'
                || ((c == '-' || c == '+') && pos + 1 < source.length()
                    && (Character.isDigit(source.charAt(pos + 1)) || source.charAt(pos + 1) == '.'))) {
            return readNumber();
        }
        if (Character.isLetter(c) || ((c == '-' || c == '+') && pos + 1 < source.length()
                && Character.isLetter(source.charAt(pos + 1)))) {
            pos++;
            while (pos < source.length() && Character.isLetterOrDigit(source.charAt(pos))) {
                pos++;
            }
            return new ValueTextToken(TokenType.WORD, source.substring(start, pos), start);
        }
        throw new ValueSyntaxException(source, start, "unexpected character '" + c + "'");
    }

    private ValueTextToken readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new ValueTextToken(TokenType.STRING_LITERAL, sb.toString(), start);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= source.length()) {
                break;
            }
            char escaped = source.charAt(pos++);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'u' -> sb.append(readUnicodeEscape());
                default -> sb.append(escaped);
            }
        }
        throw new ValueSyntaxException(source, start, "unterminated string literal");
    }

    private char readUnicodeEscape() {
        int start = pos - 2;
        if (pos + 4 > source.length()) {
            throw new ValueSyntaxException(source, start, "truncated \\u escape");
        }
        try {
            char c = (char) Integer.parseInt(source.substring(pos, pos + 4), 16);
            pos += 4;
            return c;
        } catch (NumberFormatException e) {
            throw new ValueSyntaxException(source, start, "invalid \\u escape");
        }
    }

    private ValueTextToken readNumber() {
        int start = pos;
        pos++;
        boolean hex = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            char prev = source.charAt(pos - 1);
            if (c == 'x' || c == 'X') {
                hex = true;
            }
            boolean exponentSign = (c == '+' || c == '-') && !hex && (prev == 'e' || prev == 'E');
            if (Character.isLetterOrDigit(c) || c == '.' || exponentSign) {
                pos++;
            } else {
                break;
            }
        }
        return new ValueTextToken(TokenType.NUMERIC_LITERAL, source.substring(start, pos), start);
    }

    /**
     * Reads '@' followed by exactly one complete type, e.g. {@code @a{sv}}.
     */
    private ValueTextToken readTypeAnnotation() {
        int start = pos;
        pos++;
        int depth = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '(' || c == '{') {
                depth++;
            } else if (c == ')' || c == '}') {
                depth--;
            }
            if (depth <= 0 && c != 'a' && c != 'm') {
                break;
            }
        }
        String signature = source.substring(start + 1, pos);
        if (signature.isEmpty()) {
            throw new ValueSyntaxException(source, start, "missing type after '@'");
        }
        return new ValueTextToken(TokenType.TYPE_ANNOTATION, signature, start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
