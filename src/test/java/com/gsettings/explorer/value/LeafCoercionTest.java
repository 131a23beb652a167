package com.gsettings.explorer.value;

import com.gsettings.explorer.exception.ValueCoercionException;
import com.gsettings.explorer.signature.TypeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class LeafCoercionTest {

    @Test
    void testBooleanAcceptsOnlyTrueAndFalse() {
        assertThat(LeafCoercion.coerce(TypeKind.BOOLEAN, "True").asBoolean()).isTrue();
        assertThat(LeafCoercion.coerce(TypeKind.BOOLEAN, "False").asBoolean()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "yes", "true", "TRUE", "1", "", " True" })
    void testBooleanRejectsOtherSpellings(String text) {
        assertThatThrownBy(() -> LeafCoercion.coerce(TypeKind.BOOLEAN, text))
                .isInstanceOf(ValueCoercionException.class)
                .hasMessageContaining("boolean");
    }

    @ParameterizedTest
    @CsvSource({
            "BYTE, 255, 255",
            "INT16, -32768, -32768",
            "UINT16, 65535, 65535",
            "INT32, ' 42 ', 42",
            "UINT32, 4294967295, 4294967295",
            "INT64, -9000000000, -9000000000",
            "INT32, +7, 7"
    })
    void testIntegersWithinRange(TypeKind kind, String text, long expected) {
        ScalarValue value = LeafCoercion.coerce(kind, text);

        assertThat(value.getKind()).isEqualTo(kind);
        assertThat(value.asLong()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "BYTE, 256",
            "BYTE, -1",
            "INT16, 32768",
            "UINT32, -1",
            "INT32, 2147483648",
            "INT64, 9223372036854775808",
            "UINT64, -1",
            "INT32, 1.5",
            "INT32, abc"
    })
    void testIntegersOutOfRangeOrMalformed(TypeKind kind, String text) {
        assertThatThrownBy(() -> LeafCoercion.coerce(kind, text))
                .isInstanceOf(ValueCoercionException.class);
    }

    @Test
    void testUint64UsesFullUnsignedRange() {
        ScalarValue max = LeafCoercion.coerce(TypeKind.UINT64, "18446744073709551615");

        assertThat(max.asLong()).isEqualTo(-1L);
        assertThat(LeafCoercion.displayText(max)).isEqualTo("18446744073709551615");
    }

    @Test
    void testDoubles() {
        assertThat(LeafCoercion.coerce(TypeKind.DOUBLE, "1.5").asDouble()).isEqualTo(1.5);
        assertThat(LeafCoercion.coerce(TypeKind.DOUBLE, "1e3").asDouble()).isEqualTo(1000.0);
        assertThat(LeafCoercion.coerce(TypeKind.DOUBLE, "-inf").asDouble()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(LeafCoercion.coerce(TypeKind.DOUBLE, "nan").asDouble()).isNaN();
        assertThatThrownBy(() -> LeafCoercion.coerce(TypeKind.DOUBLE, "1.5.5"))
                .isInstanceOf(ValueCoercionException.class);
    }

    @Test
    void testStringsAreTakenVerbatim() {
        assertThat(LeafCoercion.coerce(TypeKind.STRING, " spaced ").asString()).isEqualTo(" spaced ");
        assertThat(LeafCoercion.coerce(TypeKind.STRING, "").asString()).isEmpty();
    }

    @Test
    void testObjectPathAndSignatureAreValidated() {
        assertThat(LeafCoercion.coerce(TypeKind.OBJECT_PATH, "/org/example").asString()).isEqualTo("/org/example");
        assertThat(LeafCoercion.coerce(TypeKind.SIGNATURE, "a{sv}").asString()).isEqualTo("a{sv}");

        assertThatThrownBy(() -> LeafCoercion.coerce(TypeKind.OBJECT_PATH, "org/example/"))
                .isInstanceOf(ValueCoercionException.class);
        assertThatThrownBy(() -> LeafCoercion.coerce(TypeKind.SIGNATURE, "a{"))
                .isInstanceOf(ValueCoercionException.class);
    }

    @Test
    void testContainerKindIsRejected() {
        assertThatThrownBy(() -> LeafCoercion.coerce(TypeKind.ARRAY, "[1]"))
                .isInstanceOf(ValueCoercionException.class)
                .hasMessageContaining("not a primitive type");
    }

    @Test
    void testDisplayTextReadsBack() {
        ScalarValue[] values = {
                ScalarValue.ofBoolean(true),
                ScalarValue.ofInteger(TypeKind.BYTE, 200),
                ScalarValue.ofInt64(-12),
                ScalarValue.ofDouble(0.25),
                ScalarValue.ofString("text"),
                ScalarValue.ofText(TypeKind.OBJECT_PATH, "/a")
        };
        for (ScalarValue value : values) {
            assertThat(LeafCoercion.coerce(value.getKind(), LeafCoercion.displayText(value))).isEqualTo(value);
        }
        assertThat(LeafCoercion.displayText(ScalarValue.ofBoolean(false))).isEqualTo("False");
    }
}
