package io.github.jakubt4.kepler.orbit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class KeplerSolverTest {

    private static final int SAMPLES = 72;

    private final KeplerSolver solver = new KeplerSolver(1e-6);

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.001, 0.1, 0.3, 0.5, 0.7, 0.9, 0.95})
    void eccentricAnomalyReproducesMeanAnomaly(final double eccentricity) {
        for (var k = 0; k < SAMPLES; k++) {
            final var meanAnomaly = 2 * Math.PI * k / SAMPLES;

            final var solution = solver.solve(meanAnomaly, eccentricity);
            final var recovered = solution.eccentricAnomaly()
                    - eccentricity * Math.sin(solution.eccentricAnomaly());

            assertThat(Math.abs(Math.IEEEremainder(recovered - meanAnomaly, 2 * Math.PI)))
                    .as("M=%s, e=%s", meanAnomaly, eccentricity)
                    .isLessThan(1e-6);
        }
    }

    @Test
    void iterationCountIsBoundedByTolerance() {
        assertThat(solver.maxIterations()).isEqualTo(23);

        for (final var eccentricity : new double[] {0.0, 0.5, 0.95, 0.999}) {
            for (final var meanAnomaly : new double[] {0.0, 1e-9, 1.0, Math.PI, 6.28}) {
                assertThat(solver.solve(meanAnomaly, eccentricity).iterations())
                        .isLessThanOrEqualTo(solver.maxIterations());
            }
        }
    }

    @Test
    void finestToleranceStillTerminatesWithinBound() {
        final var finest = new KeplerSolver(KeplerSolver.MIN_TOLERANCE);

        final var solution = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> finest.solve(6.0, 0.5));

        assertThat(solution.iterations()).isLessThanOrEqualTo(finest.maxIterations());
        assertThat(solution.eccentricAnomaly() - 0.5 * Math.sin(solution.eccentricAnomaly()))
                .isCloseTo(6.0, within(1e-12));
    }

    @Test
    void rejectsToleranceBelowDoubleResolution() {
        assertThatThrownBy(() -> new KeplerSolver(1e-16))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least");
        assertThatThrownBy(() -> new KeplerSolver(0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void looserToleranceNeedsFewerIterations() {
        final var coarse = new KeplerSolver(1e-3);

        assertThat(coarse.solve(1.0, 0.3).iterations()).isEqualTo(coarse.maxIterations());
        assertThat(coarse.maxIterations()).isLessThan(solver.maxIterations());
    }

    @Test
    void trueAnomalyMirrorsSecondHalfOfOrbit() {
        assertThat(KeplerSolver.trueAnomaly(Math.PI / 2, 0.5)).isCloseTo(2 * Math.PI / 3, within(1e-12));
        assertThat(KeplerSolver.trueAnomaly(1.5 * Math.PI, 0.5)).isCloseTo(4 * Math.PI / 3, within(1e-12));
    }

    @Test
    void circularOrbitAnomaliesCoincide() {
        final var solution = solver.solve(2.0, 0.0);

        assertThat(solution.eccentricAnomaly()).isCloseTo(2.0, within(1e-6));
        assertThat(solution.trueAnomaly()).isCloseTo(solution.eccentricAnomaly(), within(1e-9));
    }

    @Test
    void meanAnomalyInvertsSolution() {
        final var solution = solver.solve(4.2, 0.6);

        assertThat(KeplerSolver.meanAnomaly(solution.trueAnomaly(), 0.6)).isCloseTo(4.2, within(1e-6));
    }

    @Test
    void rejectsOpenOrbits() {
        assertThatThrownBy(() -> solver.solve(1.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> solver.solve(1.0, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
