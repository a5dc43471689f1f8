package io.github.jakubt4.kepler.orbit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerturbationModelTest {

    private final PhysicalConstants constants = PhysicalConstants.defaults();
    private final PerturbationModel model = new PerturbationModel(constants);

    @Test
    void densityDecaysExponentiallyWithScaleHeight() {
        assertThat(model.density(0.0)).isEqualTo(1.225);
        assertThat(model.density(8.5)).isCloseTo(1.225 / Math.E, within(1e-12));
    }

    @Test
    void dragIsIgnoredAboveCeiling() {
        assertThat(model.isDragActive(999.9)).isTrue();
        assertThat(model.isDragActive(1000.0)).isFalse();
        assertThat(model.dragDeceleration(1200.0, 7.2)).isZero();
    }

    @Test
    void dragDecelerationUsesSiDensityAndKilometreState() {
        final var altitude = 100.0;
        final var speed = 7.8;
        final var speedSi = speed * 1000.0;
        final var expectedSi = 0.5 * 2.2 * 1.0 * model.density(altitude) * speedSi * speedSi / 1000.0;

        assertThat(model.dragDeceleration(altitude, speed)).isCloseTo(expectedSi / 1000.0, within(1e-15));
    }

    @Test
    void nodeRegressesForProgradeAndAdvancesForRetrogradeOrbits() {
        final var rate = model.oblatenessRate(6378.137, 7000.0, 1.078e-3);

        assertThat(rate).isPositive();
        assertThat(model.nodalRate(rate, 0.9)).isNegative();
        assertThat(model.nodalRate(rate, 2.5)).isPositive();
    }

    @Test
    void apsidalRateFollowsInclinationFactor() {
        final var rate = model.oblatenessRate(6378.137, 7000.0, 1.078e-3);

        assertThat(model.apsidalRate(rate, 0.0)).isCloseTo(rate, within(1e-18));
        final var sinI = Math.sin(1.2);
        assertThat(model.apsidalRate(rate, 1.2)).isCloseTo(-rate * (2.5 * sinI * sinI - 1.0), within(1e-18));
    }

    @Test
    void oblatenessRateScalesWithInverseSquareRadius() {
        final var near = model.oblatenessRate(6378.137, 7000.0, 1e-3);
        final var far = model.oblatenessRate(6378.137, 14000.0, 1e-3);

        assertThat(near / far).isCloseTo(4.0, within(1e-12));
        assertThat(near).isCloseTo(1.5 * constants.j2() * Math.pow(6378.137 / 7000.0, 2) * 1e-3, within(1e-18));
    }
}
