package io.github.jakubt4.kepler.geometry;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Angle helpers shared by the coordinate and orbit code.
 */
public final class Angles {

    private Angles() {
    }

    /**
     * Wraps an angle into {@code [0, 2π)}.
     *
     * <p>Tiny negative inputs can round up to exactly {@code 2π}; those are folded back to zero
     * so the upper bound stays open. Negative zero comes back as positive zero.
     *
     * @param angle angle in radians, any finite value
     * @return equivalent angle in {@code [0, 2π)}
     */
    public static double normalize(final double angle) {
        final var wrapped = MathUtils.normalizeAngle(angle, FastMath.PI);
        if (wrapped >= MathUtils.TWO_PI || wrapped <= 0.0) {
            return 0.0;
        }
        return wrapped;
    }
}
