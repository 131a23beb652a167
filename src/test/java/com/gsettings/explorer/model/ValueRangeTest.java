package com.gsettings.explorer.model;

import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.text.ValueTextParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ValueRangeTest {

    @Test
    void testNumericRange() {
        ValueRange range = ValueRange.between(ScalarValue.ofInt32(0), ScalarValue.ofInt32(100));

        assertThat(range.isRestricted()).isTrue();
        assertThat(range.admits(ScalarValue.ofInt32(100))).isTrue();
        assertThat(range.admits(ScalarValue.ofInt32(101))).isFalse();
        assertThat(range.admits(ScalarValue.ofString("5"))).isFalse();
        assertThat(range.describe()).isEqualTo("range : [0, 100]");
    }

    @Test
    void testInvertedRangeIsRejected() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ValueRange.between(ScalarValue.ofInt32(5), ScalarValue.ofInt32(1)));
    }

    @Test
    void testNonFiniteDoublesAreOutsideRange() {
        ValueRange range = ValueRange.between(ScalarValue.ofDouble(0.0), ScalarValue.ofDouble(1.0));

        assertThat(range.admits(ScalarValue.ofDouble(0.5))).isTrue();
        assertThat(range.admits(ScalarValue.ofDouble(Double.POSITIVE_INFINITY))).isFalse();
        assertThat(range.admits(ScalarValue.ofDouble(Double.NEGATIVE_INFINITY))).isFalse();
        assertThat(range.admits(ScalarValue.ofDouble(Double.NaN))).isFalse();
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ValueRange.between(ScalarValue.ofDouble(0.0), ScalarValue.ofDouble(Double.NaN)));
    }

    @Test
    void testEnumAndFlags() {
        ValueRange choices = ValueRange.choices(List.of("auto", "manual"));
        ValueRange flags = ValueRange.flags(List.of("bold", "italic"));

        assertThat(choices.admits(ScalarValue.ofString("manual"))).isTrue();
        assertThat(choices.admits(ScalarValue.ofString("other"))).isFalse();
        assertThat(choices.describe()).isEqualTo("enum : ['auto', 'manual']");
        assertThat(flags.admits(ValueTextParser.parse("as", "['italic', 'bold']"))).isTrue();
        assertThat(flags.admits(ValueTextParser.parse("as", "['underline']"))).isFalse();
        assertThat(flags.admits(ValueTextParser.parse("as", "[]"))).isTrue();
    }

    @Test
    void testUnrestricted() {
        assertThat(ValueRange.none().isRestricted()).isFalse();
        assertThat(ValueRange.none().admits(ScalarValue.ofString("anything"))).isTrue();
        assertThat(RangeKind.fromLabel("flags")).isEqualTo(RangeKind.FLAGS);
    }
}
