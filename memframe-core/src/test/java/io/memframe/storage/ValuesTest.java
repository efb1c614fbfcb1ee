package io.memframe.storage;

import io.memframe.core.Ternary;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ValuesTest {

    @Test
    void equalIsUnknownForNa() {
        assertThat(Values.equal(null, 1)).isEqualTo(Ternary.UNKNOWN);
        assertThat(Values.equal(null, null)).isEqualTo(Ternary.UNKNOWN);
    }

    @Test
    void numbersCompareByValue() {
        assertThat(Values.equal(1, 1L)).isEqualTo(Ternary.TRUE);
        assertThat(Values.equal(1L, 1.0)).isEqualTo(Ternary.TRUE);
        assertThat(Values.equal(1L, 1.5)).isEqualTo(Ternary.FALSE);
        assertThat(Values.equal(Double.NaN, Double.NaN)).isEqualTo(Ternary.FALSE);
        assertThat(Values.equal("a", "a")).isEqualTo(Ternary.TRUE);
    }

    @Test
    void equivalentMatchesNaAndNaN() {
        assertThat(Values.equivalent(null, null)).isTrue();
        assertThat(Values.equivalent(null, 0)).isFalse();
        assertThat(Values.equivalent(Double.NaN, Double.NaN)).isTrue();
        assertThat(Values.equivalent(0.0, -0.0)).isFalse();
        assertThat(Values.equivalent(2, 2.0)).isTrue();
    }

    @Test
    void hashAgreesWithEquivalence() {
        assertThat(Values.hash(2)).isEqualTo(Values.hash(2L)).isEqualTo(Values.hash(2.0));
        assertThat(Values.hash(null)).isEqualTo(Values.hash(null));
        assertThat(Values.hash("a")).isEqualTo("a".hashCode());
    }

    @Test
    void longsAndDoublesCompareExactlyBeyondDoublePrecision() {
        long twoPow53PlusOne = (1L << 53) + 1;
        double twoPow53 = 0x1p53;

        assertThat(Values.equal(twoPow53PlusOne, twoPow53)).isEqualTo(Ternary.FALSE);
        assertThat(Values.equal(twoPow53, twoPow53PlusOne)).isEqualTo(Ternary.FALSE);
        assertThat(Values.equivalent(twoPow53PlusOne, twoPow53)).isFalse();
        assertThat(Values.equivalent(1L << 53, twoPow53)).isTrue();
        assertThat(Values.hash(1L << 53)).isEqualTo(Values.hash(twoPow53));
        assertThat(Values.equal(Long.MAX_VALUE, 0x1p63)).isEqualTo(Ternary.FALSE);
        assertThat(Values.equivalent(Long.MIN_VALUE, -0x1p63)).isTrue();
    }

    @Test
    void negativeZeroEqualsButIsNotEquivalentToZero() {
        assertThat(Values.equal(0L, -0.0)).isEqualTo(Ternary.TRUE);
        assertThat(Values.equivalent(0L, -0.0)).isFalse();
        assertThat(Values.equivalent(0L, 0.0)).isTrue();
    }

    @Test
    void mixIsOrderSensitive() {
        int ab = Values.mix(Values.mix(0, 1), 2);
        int ba = Values.mix(Values.mix(0, 2), 1);

        assertThat(ab).isNotEqualTo(ba);
    }
}
