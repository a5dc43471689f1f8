package io.github.jakubt4.kepler.orbit.propagation;

import io.github.jakubt4.kepler.orbit.Orbit;

/**
 * Advances the anomaly of an orbit over a time step.
 *
 * <p>Implementations read the orbit but never mutate it; {@link Orbit} applies the returned
 * mean anomaly itself so that {@code M}, {@code E} and {@code v} stay consistent.
 */
public interface PropagationStrategy {

    /**
     * @param orbit orbit in its current state
     * @param dt    time step in seconds, may be negative
     * @return mean anomaly after the step, in {@code [0, 2π)}
     */
    double propagate(Orbit orbit, double dt);
}
