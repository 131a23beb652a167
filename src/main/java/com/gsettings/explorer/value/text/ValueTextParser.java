package com.gsettings.explorer.value.text;

import com.gsettings.explorer.exception.MalformedSignatureException;
import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.exception.ValueSyntaxException;
import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.MaybeValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.TupleValue;
import com.gsettings.explorer.value.VariantValue;
import com.gsettings.explorer.value.text.ValueTextToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for value text notation.
 *
 * The expected signature drives parsing. Inside {@code <...>} the type is inferred from the text
 * unless an annotation such as {@code @as} or {@code int64} precedes the value.
 */
public class ValueTextParser {
    private static final Logger log = LoggerFactory.getLogger(ValueTextParser.class);

    private static final Map<String, TypeKind> TYPE_KEYWORDS = Map.ofEntries(
        Map.entry("boolean", TypeKind.BOOLEAN),
        Map.entry("byte", TypeKind.BYTE),
        Map.entry("int16", TypeKind.INT16),
        Map.entry("uint16", TypeKind.UINT16),
        Map.entry("int32", TypeKind.INT32),
        Map.entry("uint32", TypeKind.UINT32),
        Map.entry("int64", TypeKind.INT64),
        Map.entry("uint64", TypeKind.UINT64),
        Map.entry("double", TypeKind.DOUBLE),
        Map.entry("objectpath", TypeKind.OBJECT_PATH),
        Map.entry("signature", TypeKind.SIGNATURE)
    );

    private final String source;
    private final List<ValueTextToken> tokens;
    private int pos = 0;

    private ValueTextParser(String source) {
        this.source = source;
        this.tokens = new ValueTextTokenizer(source).tokenize();
    }

    /**
     * Parse text as a value of the given type.
     */
    public static GValue parse(TypeSignature signature, String text) {
        ValueTextParser parser = new ValueTextParser(text);
        GValue value = parser.parseValue(signature);
        if (!parser.isAtEnd()) {
            throw parser.error("unexpected trailing input '" + parser.peek().getValue() + "'");
        }
        log.debug("Parsed '{}' as {}", text, value.getSignature());
        return value;
    }

    public static GValue parse(String signature, String text) {
        return parse(TypeSignature.parse(signature), text);
    }

    /**
     * Parse text whose type is inferred from the text itself.
     */
    public static GValue parseInferred(String text) {
        ValueTextParser parser = new ValueTextParser(text);
        GValue value = parser.parseValue(null);
        if (!parser.isAtEnd()) {
            throw parser.error("unexpected trailing input '" + parser.peek().getValue() + "'");
        }
        return value;
    }

    private GValue parseValue(TypeSignature expected) {
        TypeSignature annotated = parseAnnotation();
        if (annotated != null) {
            if (expected != null && !expected.equals(annotated)) {
                throw error("annotated type '" + annotated + "' does not match expected type '" + expected + "'");
            }
            expected = annotated;
        }
        if (expected == null) {
            return parseInferred();
        }
        return switch (expected.getKind()) {
            case VARIANT -> parseVariant();
            case MAYBE -> parseMaybe(expected.innerSignature());
            case ARRAY -> parseArray(expected.elementSignature());
            case DICT_ENTRY_ARRAY -> parseDict(expected.keySignature(), expected.valueSignature());
            case TUPLE -> parseTuple(expected.componentSignatures());
            default -> parseScalar(expected.getKind());
        };
    }

    private TypeSignature parseAnnotation() {
        ValueTextToken token = peek();
        if (token.getType() == TokenType.TYPE_ANNOTATION) {
            advance();
            try {
                return TypeSignature.parse(token.getValue());
            } catch (MalformedSignatureException e) {
                throw new ValueSyntaxException(source, token.getOffset(), e.getMessage());
            }
        }
        if (token.getType() == TokenType.WORD && TYPE_KEYWORDS.containsKey(token.getValue())) {
            advance();
            return TypeSignature.leaf(TYPE_KEYWORDS.get(token.getValue()));
        }
        return null;
    }

    private GValue parseVariant() {
        expect(TokenType.LANGLE);
        GValue inner = parseValue(null);
        expect(TokenType.RANGLE);
        return VariantValue.of(inner);
    }

    private GValue parseMaybe(TypeSignature inner) {
        if (peek().isWord("nothing")) {
            advance();
            return MaybeValue.nothing(inner);
        }
        if (peek().isWord("just")) {
            advance();
        }
        return MaybeValue.just(inner, parseValue(inner));
    }

    private GValue parseArray(TypeSignature element) {
        expect(TokenType.LBRACKET);
        List<GValue> elements = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elements.add(parseValue(element));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RBRACKET);
        return new ArrayValue(element, elements);
    }

    private GValue parseDict(TypeSignature keySig, TypeSignature valueSig) {
        expect(TokenType.LBRACE);
        List<DictValue.Entry> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            entries.add(parseEntry(keySig, valueSig));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RBRACE);
        return new DictValue(keySig, valueSig, entries);
    }

    private DictValue.Entry parseEntry(TypeSignature keySig, TypeSignature valueSig) {
        GValue key = parseValue(keySig);
        expect(TokenType.COLON);
        GValue value = parseValue(valueSig);
        return new DictValue.Entry((ScalarValue) key, value);
    }

    private GValue parseTuple(List<TypeSignature> components) {
        int start = peek().getOffset();
        expect(TokenType.LPAREN);
        List<GValue> values = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            values.add(parseValue(components.get(i)));
            boolean comma = match(TokenType.COMMA);
            if (!comma && i < components.size() - 1) {
                throw error("expected ',' between tuple components");
            }
        }
        if (!check(TokenType.RPAREN)) {
            throw new ValueSyntaxException(source, start, "tuple has more than " + components.size() + " component(s)");
        }
        advance();
        return new TupleValue(values);
    }

    private GValue parseScalar(TypeKind kind) {
        ValueTextToken token = peek();
        try {
            if (kind == TypeKind.BOOLEAN) {
                if (token.isWord("true") || token.isWord("false")) {
                    advance();
                    return ScalarValue.ofBoolean(token.getValue().equals("true"));
                }
                throw error("expected true or false");
            }
            if (kind.isInteger()) {
                expect(TokenType.NUMERIC_LITERAL);
                return ScalarValue.ofInteger(kind, parseInteger(token, kind));
            }
            if (kind == TypeKind.DOUBLE) {
                if (token.getType() == TokenType.NUMERIC_LITERAL || token.getType() == TokenType.WORD) {
                    advance();
                    return ScalarValue.ofDouble(parseDouble(token));
                }
                throw error("expected a number");
            }
            expect(TokenType.STRING_LITERAL);
            return ScalarValue.ofText(kind, token.getValue());
        } catch (TypeMismatchException e) {
            throw new ValueSyntaxException(source, token.getOffset(), e.getMessage());
        }
    }

    private long parseInteger(ValueTextToken token, TypeKind kind) {
        String text = token.getValue();
        boolean negative = text.startsWith("-");
        String digits = text.startsWith("-") || text.startsWith("+") ? text.substring(1) : text;
        int radix = 10;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            radix = 16;
            digits = digits.substring(2);
        }
        try {
            if (kind == TypeKind.UINT64) {
                if (negative) {
                    throw new ValueSyntaxException(source, token.getOffset(), "uint64 cannot be negative");
                }
                return Long.parseUnsignedLong(digits, radix);
            }
            return Long.parseLong((negative ? "-" : "") + digits, radix);
        } catch (NumberFormatException e) {
            throw new ValueSyntaxException(source, token.getOffset(), "'" + text + "' is not a valid " + kind.getDisplayName());
        }
    }

    private double parseDouble(ValueTextToken token) {
        String text = token.getValue();
        return switch (text) {
            case "inf", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> {
                try {
                    yield Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    throw new ValueSyntaxException(source, token.getOffset(), "'" + text + "' is not a valid double");
                }
            }
        };
    }

    private GValue parseInferred() {
        ValueTextToken token = peek();
        switch (token.getType()) {
            case LANGLE:
                return parseVariant();
            case LBRACKET:
                return parseInferredArray();
            case LBRACE:
                return parseInferredDict();
            case LPAREN:
                return parseInferredTuple();
            case STRING_LITERAL:
                return parseScalar(TypeKind.STRING);
            case NUMERIC_LITERAL:
                return inferNumber(token);
            case WORD:
                return inferWord(token);
            default:
                throw error("unexpected '" + token.getValue() + "'");
        }
    }

    private GValue inferNumber(ValueTextToken token) {
        String text = token.getValue().toLowerCase();
        boolean hex = text.contains("0x");
        if (!hex && (text.contains(".") || text.contains("e"))) {
            return parseScalar(TypeKind.DOUBLE);
        }
        advance();
        long value = parseInteger(token, TypeKind.INT64);
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return ScalarValue.ofInt32((int) value);
        }
        return ScalarValue.ofInt64(value);
    }

    private GValue inferWord(ValueTextToken token) {
        switch (token.getValue()) {
            case "true", "false":
                return parseScalar(TypeKind.BOOLEAN);
            case "inf", "-inf", "+inf", "nan":
                return parseScalar(TypeKind.DOUBLE);
            case "just": {
                advance();
                GValue inner = parseValue(null);
                return MaybeValue.just(inner.getSignature(), inner);
            }
            case "nothing":
                throw error("cannot infer the type of 'nothing', annotate it e.g. @ms nothing");
            default:
                throw error("unknown word '" + token.getValue() + "'");
        }
    }

    private GValue parseInferredArray() {
        int start = peek().getOffset();
        expect(TokenType.LBRACKET);
        if (check(TokenType.RBRACKET)) {
            throw new ValueSyntaxException(source, start, "cannot infer the type of an empty array, annotate it e.g. @as []");
        }
        GValue first = parseValue(null);
        List<GValue> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA) && !check(TokenType.RBRACKET)) {
            elements.add(parseValue(first.getSignature()));
        }
        expect(TokenType.RBRACKET);
        return new ArrayValue(first.getSignature(), elements);
    }

    private GValue parseInferredDict() {
        int start = peek().getOffset();
        expect(TokenType.LBRACE);
        if (check(TokenType.RBRACE)) {
            throw new ValueSyntaxException(source, start, "cannot infer the type of an empty dictionary, annotate it e.g. @a{sv} {}");
        }
        GValue key = parseValue(null);
        if (!(key instanceof ScalarValue scalarKey)) {
            throw new ValueSyntaxException(source, start, "dictionary key must be a basic value");
        }
        expect(TokenType.COLON);
        GValue value = parseValue(null);
        List<DictValue.Entry> entries = new ArrayList<>();
        entries.add(new DictValue.Entry(scalarKey, value));
        while (match(TokenType.COMMA) && !check(TokenType.RBRACE)) {
            entries.add(parseEntry(key.getSignature(), value.getSignature()));
        }
        expect(TokenType.RBRACE);
        return new DictValue(key.getSignature(), value.getSignature(), entries);
    }

    private GValue parseInferredTuple() {
        expect(TokenType.LPAREN);
        List<GValue> components = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            components.add(parseValue(null));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        expect(TokenType.RPAREN);
        return new TupleValue(components);
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ValueTextToken peek() {
        return tokens.get(pos);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ValueTextToken advance() {
        ValueTextToken token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private ValueTextToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        ValueTextToken token = peek();
        String found = token.getType() == TokenType.EOF ? "end of input" : "'" + token.getValue() + "'";
        throw error("expected " + type + " but found " + found);
    }

    private ValueSyntaxException error(String reason) {
        return new ValueSyntaxException(source, peek().getOffset(), reason);
    }
}
