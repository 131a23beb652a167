package com.gsettings.explorer.signature;

import com.gsettings.explorer.exception.MalformedSignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass parser for type signature strings.
 *
 * Grammar:
 * <pre>
 *   type  := basic | 'v' | '@' | 'm' type | 'a' type | 'a{' basic type '}' | '(' type* ')'
 *   basic := 'b' | 'y' | 'n' | 'q' | 'i' | 'u' | 'x' | 't' | 'd' | 's' | 'o' | 'g'
 * </pre>
 * '@' is read as a variant. Parsed signatures are always canonical, so "@" comes back as "v".
 */
public class SignatureParser {
    private static final Logger log = LoggerFactory.getLogger(SignatureParser.class);

    static final int MAX_DEPTH = 128;

    private final String source;
    private int pos = 0;
    private int depth = 0;

    private SignatureParser(String source) {
        this.source = source;
    }

    /**
     * Parse exactly one complete type.
     */
    public static TypeSignature parse(String signature) {
        if (signature == null || signature.isEmpty()) {
            throw new MalformedSignatureException(String.valueOf(signature), 0, "empty signature");
        }
        SignatureParser parser = new SignatureParser(signature);
        TypeSignature result = parser.parseType();
        if (!parser.isAtEnd()) {
            throw parser.error("unexpected trailing characters");
        }
        log.trace("Parsed signature '{}' as {}", signature, result.getKind());
        return result;
    }

    /**
     * Parse a concatenation of complete types, e.g. the body of a tuple.
     */
    public static List<TypeSignature> parseAll(String signatures) {
        if (signatures == null) {
            throw new MalformedSignatureException("null", 0, "empty signature");
        }
        SignatureParser parser = new SignatureParser(signatures);
        List<TypeSignature> result = new ArrayList<>();
        while (!parser.isAtEnd()) {
            result.add(parser.parseType());
        }
        return result;
    }

    private TypeSignature parseType() {
        if (isAtEnd()) {
            throw error("unexpected end of signature");
        }
        if (++depth > MAX_DEPTH) {
            throw error("nesting deeper than " + MAX_DEPTH);
        }
        try {
            int start = pos;
            char c = advance();
            switch (c) {
                case 'v':
                case '@':
                    return TypeSignature.VARIANT;
                case 'm':
                    return TypeSignature.maybeOf(parseType());
                case 'a':
                    // a{ starts a dictionary, anything else (including a( ) is an array element type
                    if (check('{')) {
                        advance();
                        return parseDictEntry();
                    }
                    return TypeSignature.arrayOf(parseType());
                case '(':
                    return parseTuple(start);
                default:
                    pos = start;
                    TypeKind kind = TypeKind.leafFromCode(c)
                            .orElseThrow(() -> error("unrecognized type character '" + c + "'"));
                    pos++;
                    return TypeSignature.leaf(kind);
            }
        } finally {
            depth--;
        }
    }

    private TypeSignature parseDictEntry() {
        int keyStart = pos;
        TypeSignature key = parseType();
        if (!key.isLeaf()) {
            pos = keyStart;
            throw error("dictionary key must be a basic type, got '" + key + "'");
        }
        TypeSignature value = parseType();
        expect('}', "expected '}' to close dictionary entry");
        return TypeSignature.dictOf(key, value);
    }

    private TypeSignature parseTuple(int start) {
        List<TypeSignature> components = new ArrayList<>();
        while (!check(')')) {
            if (isAtEnd()) {
                pos = start;
                throw error("unterminated tuple");
            }
            components.add(parseType());
        }
        advance();
        return components.isEmpty() ? TypeSignature.UNIT : TypeSignature.tupleOf(components);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean check(char expected) {
        return !isAtEnd() && source.charAt(pos) == expected;
    }

    private char advance() {
        return source.charAt(pos++);
    }

    private void expect(char expected, String message) {
        if (!check(expected)) {
            throw error(message);
        }
        advance();
    }

    private MalformedSignatureException error(String reason) {
        return new MalformedSignatureException(source, pos, reason);
    }
}
