package io.github.jakubt4.kepler.geometry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PolarPointTest {

    @Test
    void convertsToCartesian() {
        final var point = new PolarPoint(2.0, Math.PI / 2, 0.0);

        assertThat(point.x()).isCloseTo(0.0, within(1e-12));
        assertThat(point.y()).isCloseTo(2.0, within(1e-12));
        assertThat(point.z()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void elevationLiftsPointOutOfPlane() {
        final var point = new PolarPoint(10.0, 0.0, Math.PI / 6);

        assertThat(point.x()).isCloseTo(10.0 * Math.cos(Math.PI / 6), within(1e-12));
        assertThat(point.z()).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void normalizesAzimuthOnConstruction() {
        assertThat(new PolarPoint(1.0, -Math.PI / 2, 0.0).azimuth()).isCloseTo(1.5 * Math.PI, within(1e-12));
        assertThat(new PolarPoint(1.0, 5 * Math.PI, 0.0).azimuth()).isCloseTo(Math.PI, within(1e-12));
    }

    @Test
    void rejectsNegativeRadius() {
        assertThatThrownBy(() -> new PolarPoint(-1.0, 0.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void arithmeticKeepsPolarRepresentation() {
        final var sum = new PolarPoint(1.0, 0.0, 0.0).add(new CartesianPoint(0.0, 1.0, 0.0));

        assertThat(sum).isInstanceOf(PolarPoint.class);
        assertThat(sum.radius()).isCloseTo(Math.sqrt(2.0), within(1e-12));
        assertThat(sum.azimuth()).isCloseTo(Math.PI / 4, within(1e-12));
        assertThat(sum.elevation()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void subtractingItselfGivesOrigin() {
        final var point = new PolarPoint(7000.0, 1.2, -0.4);

        final var difference = point.subtract(point);

        assertThat(difference.radius()).isCloseTo(0.0, within(1e-9));
    }
}
