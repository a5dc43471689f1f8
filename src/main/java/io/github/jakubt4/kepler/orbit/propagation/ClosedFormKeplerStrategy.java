package io.github.jakubt4.kepler.orbit.propagation;

import io.github.jakubt4.kepler.geometry.Angles;
import io.github.jakubt4.kepler.orbit.Orbit;

/**
 * Analytical two-body stepping: the mean anomaly grows linearly with the mean motion.
 *
 * <p>Because {@code M} accumulates linearly modulo {@code 2π}, splitting a step in two gives
 * the same result as taking it at once.
 */
public class ClosedFormKeplerStrategy implements PropagationStrategy {

    @Override
    public double propagate(final Orbit orbit, final double dt) {
        return Angles.normalize(orbit.getMeanAnomaly() + orbit.getMeanMotion() * dt);
    }
}
