package com.gsettings.explorer.tree;

import com.gsettings.explorer.exception.IndexOutOfRangeException;
import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.text.ValueTextParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DefaultResolverTest {

    private final GValue numbers = ValueTextParser.parse("ai", "[1, 2, 3]");

    @Test
    void testElementIsResolvedByPosition() {
        assertThat(DefaultResolver.resolveDefault(numbers, false, 1)).isEqualTo(ScalarValue.ofInt32(2));
    }

    @Test
    void testWholeCompoundIsReturnedUnchanged() {
        assertThat(DefaultResolver.resolveDefault(numbers, true, 5)).isSameAs(numbers);
    }

    @Test
    void testMissingPositionThrows() {
        IndexOutOfRangeException e = catchThrowableOfType(
                () -> DefaultResolver.resolveDefault(numbers, false, 3), IndexOutOfRangeException.class);

        assertThat(e.getIndex()).isEqualTo(3);
        assertThat(e.getSize()).isEqualTo(3);
    }

    @Test
    void testTupleAndMaybe() {
        GValue tuple = ValueTextParser.parse("(is)", "(1, 'a')");

        assertThat(DefaultResolver.resolveDefault(tuple, false, 1)).isEqualTo(ScalarValue.ofString("a"));
        assertThat(DefaultResolver.resolveDefault(ValueTextParser.parse("mi", "4"), false, 0))
                .isEqualTo(ScalarValue.ofInt32(4));
        assertThatThrownBy(() -> DefaultResolver.resolveDefault(ValueTextParser.parse("mi", "nothing"), false, 0))
                .isInstanceOf(IndexOutOfRangeException.class);
    }

    @Test
    void testDictionaryPositionsFollowEffectiveEntries() {
        TypeSignature s = TypeSignature.leaf(TypeKind.STRING);
        DictValue dict = new DictValue(s, s, List.of(
                new DictValue.Entry(ScalarValue.ofString("a"), ScalarValue.ofString("first")),
                new DictValue.Entry(ScalarValue.ofString("b"), ScalarValue.ofString("b")),
                new DictValue.Entry(ScalarValue.ofString("a"), ScalarValue.ofString("last"))));

        assertThat(DefaultResolver.resolveDefault(dict, false, 0)).isEqualTo(ScalarValue.ofString("last"));
        assertThat(DefaultResolver.resolveDefault(dict, false, 1)).isEqualTo(ScalarValue.ofString("b"));
        assertThatThrownBy(() -> DefaultResolver.resolveDefault(dict, false, 2))
                .isInstanceOf(IndexOutOfRangeException.class);
    }

    @Test
    void testVariantDefaultIsUnwrapped() {
        GValue wrapped = ValueTextParser.parse("v", "<<@ai [5, 6]>>");

        assertThat(DefaultResolver.resolveDefault(wrapped, false, 1)).isEqualTo(ScalarValue.ofInt32(6));
        assertThat(DefaultResolver.unwrapVariants(wrapped)).isEqualTo(ValueTextParser.parse("ai", "[5, 6]"));
    }

    @Test
    void testScalarDefaultAppliesAsIs() {
        GValue scalar = ScalarValue.ofInt32(9);

        assertThat(DefaultResolver.resolveDefault(scalar, false, 0)).isSameAs(scalar);
    }

    @Test
    void testNullDefaultIsRejected() {
        assertThatNullPointerException().isThrownBy(() -> DefaultResolver.resolveDefault(null, false, 0));
    }
}
