package com.gsettings.explorer.value.text;

import com.gsettings.explorer.exception.ValueSyntaxException;
import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.MaybeValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.TupleValue;
import com.gsettings.explorer.value.VariantValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ValueTextParserTest {

    @Test
    void testParseIntegerArray() {
        GValue value = ValueTextParser.parse("ai", "[1, 2, 3]");

        assertThat(value).isInstanceOf(ArrayValue.class);
        ArrayValue array = (ArrayValue) value;
        assertThat(array.size()).isEqualTo(3);
        assertThat(((ScalarValue) array.get(1)).asLong()).isEqualTo(2);
    }

    @Test
    void testParseDictionaryOfVariantsInfersInnerTypes() {
        DictValue dict = (DictValue) ValueTextParser.parse("a{sv}",
                "{'a': <1>, 'b': <'x'>, 'c': <int64 5>, 'd': <@as []>}");

        assertThat(dict.getEntries())
                .extracting(e -> ((VariantValue) e.getValue()).getInnerSignature().getSignature())
                .containsExactly("i", "s", "x", "as");
    }

    @Test
    void testParseTuples() {
        TupleValue pair = (TupleValue) ValueTextParser.parse("(is)", "(1, 'a')");
        TupleValue single = (TupleValue) ValueTextParser.parse("(i)", "(7,)");

        assertThat(((ScalarValue) pair.get(1)).asString()).isEqualTo("a");
        assertThat(single.size()).isEqualTo(1);
        assertThat(ValueTextParser.parse("()", "()").getSignature().getSignature()).isEqualTo("()");
    }

    @Test
    void testTupleWithTooManyComponents() {
        assertThatThrownBy(() -> ValueTextParser.parse("(ii)", "(1, 2, 3)"))
                .isInstanceOf(ValueSyntaxException.class)
                .hasMessageContaining("more than 2");
    }

    @Test
    void testParseMaybe() {
        assertThat(((MaybeValue) ValueTextParser.parse("mi", "nothing")).isPresent()).isFalse();
        assertThat(((MaybeValue) ValueTextParser.parse("mi", "5")).getValue()).isEqualTo(ScalarValue.ofInt32(5));
        assertThat(((MaybeValue) ValueTextParser.parse("mi", "just 5")).getValue()).isEqualTo(ScalarValue.ofInt32(5));

        MaybeValue nested = (MaybeValue) ValueTextParser.parse("mmi", "just nothing");
        assertThat(nested.isPresent()).isTrue();
        assertThat(((MaybeValue) nested.getValue()).isPresent()).isFalse();
    }

    @Test
    void testStringEscapesAndQuotes() {
        assertThat(((ScalarValue) ValueTextParser.parse("s", "'it\\'s'")).asString()).isEqualTo("it's");
        assertThat(((ScalarValue) ValueTextParser.parse("s", "\"two\\nlines\"")).asString()).isEqualTo("two\nlines");
        assertThat(((ScalarValue) ValueTextParser.parse("s", "'\\u00e9'")).asString()).isEqualTo("\u00e9");
    }

    @Test
    void testTypedStringLikes() {
        ScalarValue path = (ScalarValue) ValueTextParser.parse("o", "objectpath '/org/example'");
        ScalarValue sig = (ScalarValue) ValueTextParser.parse("g", "'a{sv}'");

        assertThat(path.getKind()).isEqualTo(TypeKind.OBJECT_PATH);
        assertThat(sig.getKind()).isEqualTo(TypeKind.SIGNATURE);
        assertThatThrownBy(() -> ValueTextParser.parse("o", "'not a path'"))
                .isInstanceOf(ValueSyntaxException.class);
    }

    @Test
    void testNumbers() {
        assertThat(((ScalarValue) ValueTextParser.parse("i", "0x10")).asLong()).isEqualTo(16);
        assertThat(((ScalarValue) ValueTextParser.parse("x", "-9000000000")).asLong()).isEqualTo(-9000000000L);
        assertThat(((ScalarValue) ValueTextParser.parse("t", "18446744073709551615")).asLong()).isEqualTo(-1L);
        assertThat(((ScalarValue) ValueTextParser.parse("d", "2.5e-1")).asDouble()).isEqualTo(0.25);
        assertThat(((ScalarValue) ValueTextParser.parse("d", "-inf")).asDouble()).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "y | 256",
            "q | -1",
            "i | 1.5",
            "b | True",
            "s | unquoted",
            "ai | [1, 'a']",
            "i | 1 2",
            "a{si} | {'a' 1}",
            "s | 'open"
    })
    void testSyntaxErrors(String signature, String text) {
        assertThatThrownBy(() -> ValueTextParser.parse(signature, text))
                .isInstanceOf(ValueSyntaxException.class);
    }

    @Test
    void testInferredTypes() {
        assertThat(ValueTextParser.parseInferred("3000000000").getSignature().getSignature()).isEqualTo("x");
        assertThat(ValueTextParser.parseInferred("42").getSignature().getSignature()).isEqualTo("i");
        assertThat(ValueTextParser.parseInferred("[1.0, 2]").getSignature().getSignature()).isEqualTo("ad");
        assertThat(ValueTextParser.parseInferred("{'a': (1, true)}").getSignature().getSignature()).isEqualTo("a{s(ib)}");
        assertThat(ValueTextParser.parseInferred("just 'x'").getSignature().getSignature()).isEqualTo("ms");
        assertThat(ValueTextParser.parseInferred("@ms nothing").getSignature().getSignature()).isEqualTo("ms");
    }

    @Test
    void testEmptyContainersNeedAnAnnotation() {
        assertThatThrownBy(() -> ValueTextParser.parseInferred("[]"))
                .isInstanceOf(ValueSyntaxException.class)
                .hasMessageContaining("@as []");
        assertThatThrownBy(() -> ValueTextParser.parseInferred("nothing"))
                .isInstanceOf(ValueSyntaxException.class);
        assertThat(ValueTextParser.parseInferred("@as []").getSignature().getSignature()).isEqualTo("as");
    }

    @Test
    void testAnnotationMustMatchExpectedType() {
        assertThatThrownBy(() -> ValueTextParser.parse("ai", "@as []"))
                .isInstanceOf(ValueSyntaxException.class)
                .hasMessageContaining("does not match");
    }
}
