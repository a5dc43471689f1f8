package io.github.jakubt4.kepler.geometry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnglesTest {

    @Test
    void wrapsNegativeAnglesIntoPositiveRange() {
        assertThat(Angles.normalize(-Math.PI / 2)).isCloseTo(1.5 * Math.PI, within(1e-12));
    }

    @Test
    void wrapsAnglesBeyondFullTurn() {
        assertThat(Angles.normalize(7.0)).isCloseTo(7.0 - 2 * Math.PI, within(1e-12));
        assertThat(Angles.normalize(2 * Math.PI)).isEqualTo(0.0);
    }

    @Test
    void foldsRoundingAtUpperBoundBackToZero() {
        // -1e-17 + 2π rounds to exactly 2π in double precision
        assertThat(Angles.normalize(-1e-17)).isEqualTo(0.0);
    }

    @Test
    void negativeZeroBecomesPositiveZero() {
        assertThat(Double.doubleToRawLongBits(Angles.normalize(-0.0))).isEqualTo(Double.doubleToRawLongBits(0.0));
    }
}
