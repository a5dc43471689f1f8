package io.github.jakubt4.kepler.orbit;

/**
 * Result of solving Kepler's equation for one mean anomaly.
 *
 * @param eccentricAnomaly E in {@code [0, 2π)}
 * @param trueAnomaly      v in {@code [0, 2π)}
 * @param iterations       bisection steps taken
 */
public record KeplerSolution(double eccentricAnomaly, double trueAnomaly, int iterations) {
}
