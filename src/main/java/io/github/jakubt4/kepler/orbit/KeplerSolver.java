package io.github.jakubt4.kepler.orbit;

import io.github.jakubt4.kepler.geometry.Angles;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Solves Kepler's equation {@code M = E - e sin E} for elliptic orbits.
 *
 * <p>The right-hand side is strictly increasing in {@code E}, so a bisection over
 * {@code [0, 2π)} always converges. The number of steps depends only on the tolerance:
 * {@code ceil(log2(2π / tolerance))}, 23 for the default {@code 1e-6}.
 */
public class KeplerSolver {

    /**
     * Smallest usable tolerance. Below a few ulps of {@code 2π} the bracket ends become adjacent
     * doubles and the width stops shrinking.
     */
    public static final double MIN_TOLERANCE = 4.0 * FastMath.ulp(MathUtils.TWO_PI);

    private final double tolerance;

    public KeplerSolver(final double tolerance) {
        if (!(tolerance >= MIN_TOLERANCE) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException(
                    "Tolerance must be a finite value of at least " + MIN_TOLERANCE + ", got " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * @param meanAnomaly  mean anomaly in radians, wrapped into {@code [0, 2π)} first
     * @param eccentricity eccentricity in {@code [0, 1)}
     * @return eccentric and true anomaly, with the iteration count
     */
    public KeplerSolution solve(final double meanAnomaly, final double eccentricity) {
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw new IllegalArgumentException("Eccentricity must be in [0, 1), got " + eccentricity);
        }
        final var m = Angles.normalize(meanAnomaly);

        var low = 0.0;
        var high = MathUtils.TWO_PI;
        var iterations = 0;
        while (high - low > tolerance) {
            final var mid = 0.5 * (low + high);
            if (mid <= low || mid >= high) {
                break;
            }
            if (m < mid - eccentricity * FastMath.sin(mid)) {
                high = mid;
            } else {
                low = mid;
            }
            iterations++;
        }

        final var eccentricAnomaly = Angles.normalize(0.5 * (low + high));
        return new KeplerSolution(eccentricAnomaly, trueAnomaly(eccentricAnomaly, eccentricity), iterations);
    }

    /**
     * Upper bound on the bisection steps for this solver's tolerance.
     */
    public int maxIterations() {
        return (int) FastMath.ceil(FastMath.log(MathUtils.TWO_PI / tolerance) / FastMath.log(2.0));
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * True anomaly from the eccentric anomaly. The arc-cosine only covers {@code [0, π]}, so the
     * second half of the orbit is mirrored.
     */
    public static double trueAnomaly(final double eccentricAnomaly, final double eccentricity) {
        final var cosE = FastMath.cos(eccentricAnomaly);
        final var ratio = (cosE - eccentricity) / (1.0 - eccentricity * cosE);
        final var halfOrbit = FastMath.acos(FastMath.max(-1.0, FastMath.min(1.0, ratio)));
        if (eccentricAnomaly <= FastMath.PI) {
            return halfOrbit;
        }
        return Angles.normalize(MathUtils.TWO_PI - halfOrbit);
    }

    /**
     * Mean anomaly reached at a given true anomaly, the inverse of {@link #solve}.
     */
    public static double meanAnomaly(final double trueAnomaly, final double eccentricity) {
        final var eccentricAnomaly = FastMath.atan2(
                FastMath.sqrt(1.0 - eccentricity * eccentricity) * FastMath.sin(trueAnomaly),
                eccentricity + FastMath.cos(trueAnomaly));
        return Angles.normalize(eccentricAnomaly - eccentricity * FastMath.sin(eccentricAnomaly));
    }
}
