package io.github.jakubt4.kepler.orbit.propagation;

import org.hipparchus.ode.OrdinaryDifferentialEquation;
import org.hipparchus.util.FastMath;

/**
 * Point-mass gravity {@code r'' = -μ r / |r|³} as a first-order system over
 * {@code (x, y, z, vx, vy, vz)}.
 */
class TwoBodyEquations implements OrdinaryDifferentialEquation {

    private final double mu;

    TwoBodyEquations(final double mu) {
        this.mu = mu;
    }

    @Override
    public int getDimension() {
        return 6;
    }

    @Override
    public double[] computeDerivatives(final double t, final double[] y) {
        final var r2 = y[0] * y[0] + y[1] * y[1] + y[2] * y[2];
        final var factor = -mu / (r2 * FastMath.sqrt(r2));
        return new double[] {
                y[3], y[4], y[5],
                factor * y[0], factor * y[1], factor * y[2]
        };
    }
}
