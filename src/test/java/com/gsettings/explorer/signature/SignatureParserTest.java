package com.gsettings.explorer.signature;

import com.gsettings.explorer.exception.MalformedSignatureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SignatureParserTest {

    @Test
    void testParseDictionaryOfVariants() {
        TypeSignature sig = SignatureParser.parse("a{sv}");

        assertThat(sig.getKind()).isEqualTo(TypeKind.DICT_ENTRY_ARRAY);
        assertThat(sig.keySignature().getKind()).isEqualTo(TypeKind.STRING);
        assertThat(sig.valueSignature().getKind()).isEqualTo(TypeKind.VARIANT);
    }

    @Test
    void testArrayOfTupleIsNotADictionary() {
        TypeSignature sig = SignatureParser.parse("a(ii)");

        assertThat(sig.getKind()).isEqualTo(TypeKind.ARRAY);
        TypeSignature element = sig.elementSignature();
        assertThat(element.getKind()).isEqualTo(TypeKind.TUPLE);
        assertThat(element.componentSignatures())
                .extracting(TypeSignature::getKind)
                .containsExactly(TypeKind.INT32, TypeKind.INT32);
    }

    @Test
    void testParseMaybeArray() {
        TypeSignature sig = SignatureParser.parse("mai");

        assertThat(sig.getKind()).isEqualTo(TypeKind.MAYBE);
        assertThat(sig.innerSignature().getKind()).isEqualTo(TypeKind.ARRAY);
        assertThat(sig.innerSignature().elementSignature().getKind()).isEqualTo(TypeKind.INT32);
    }

    @Test
    void testUnterminatedDictionaryIsMalformed() {
        assertThatThrownBy(() -> SignatureParser.parse("a{s"))
                .isInstanceOf(MalformedSignatureException.class)
                .hasMessageContaining("a{s");
    }

    @Test
    void testDictionaryKeyMustBeBasic() {
        assertThatThrownBy(() -> SignatureParser.parse("a{vs}"))
                .isInstanceOf(MalformedSignatureException.class)
                .hasMessageContaining("basic type");
    }

    @Test
    void testUnterminatedTupleReportsItsStart() {
        MalformedSignatureException e = catchThrowableOfType(
                () -> SignatureParser.parse("a(ii"), MalformedSignatureException.class);

        assertThat(e.getOffset()).isEqualTo(1);
        assertThat(e.getMessage()).contains("unterminated tuple");
    }

    @Test
    void testTrailingCharacters() {
        MalformedSignatureException e = catchThrowableOfType(
                () -> SignatureParser.parse("ii"), MalformedSignatureException.class);

        assertThat(e.getOffset()).isEqualTo(1);
        assertThat(e.getSignature()).isEqualTo("ii");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "h", "a", "m", "a{}", "a{s}", "(i", "i)", "{sv}", "z" })
    void testMalformedSignatures(String signature) {
        assertThatThrownBy(() -> SignatureParser.parse(signature))
                .isInstanceOf(MalformedSignatureException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = { "b", "y", "n", "q", "i", "u", "x", "t", "d", "s", "o", "g", "v",
            "as", "aas", "a{sv}", "a{s(ii)}", "(ia{sv}mas)", "mmi", "()", "a(sa{ib})", "av" })
    void testCanonicalFormIsUnchanged(String signature) {
        assertThat(SignatureParser.parse(signature).getSignature()).isEqualTo(signature);
    }

    @Test
    void testAtSignIsAVariant() {
        TypeSignature sig = SignatureParser.parse("a{s@}");

        assertThat(sig.valueSignature()).isEqualTo(TypeSignature.VARIANT);
        assertThat(sig.getSignature()).isEqualTo("a{sv}");
    }

    @Test
    void testEmptyTupleIsUnit() {
        assertThat(SignatureParser.parse("()")).isEqualTo(TypeSignature.UNIT);
        assertThat(SignatureParser.parse("()").componentSignatures()).isEmpty();
    }

    @Test
    void testNestingLimit() {
        String deep = "a".repeat(SignatureParser.MAX_DEPTH + 10) + "i";

        assertThatThrownBy(() -> SignatureParser.parse(deep))
                .isInstanceOf(MalformedSignatureException.class)
                .hasMessageContaining("nesting");
    }

    @Test
    void testParseAllSplitsConcatenatedTypes() {
        List<TypeSignature> types = SignatureParser.parseAll("sa{sv}(ii)");

        assertThat(types).extracting(TypeSignature::getSignature)
                .containsExactly("s", "a{sv}", "(ii)");
        assertThat(SignatureParser.parseAll("")).isEmpty();
    }

    @Test
    void testBuiltSignaturesEqualParsedOnes() {
        TypeSignature built = TypeSignature.dictOf(TypeSignature.leaf(TypeKind.STRING),
                TypeSignature.tupleOf(List.of(TypeSignature.leaf(TypeKind.INT32), TypeSignature.VARIANT)));

        assertThat(built).isEqualTo(TypeSignature.parse("a{s(iv)}"));
        assertThat(built).hasSameHashCodeAs(TypeSignature.parse("a{s(iv)}"));
    }
}
