package io.github.jakubt4.kepler.model;

import io.github.jakubt4.kepler.orbit.Orbit;
import io.github.jakubt4.kepler.orbit.PhysicalConstants;
import io.github.jakubt4.kepler.orbit.propagation.Integration;

/**
 * Flat view of one satellite as it appears in a saved simulation, fields in file order.
 *
 * @param name                satellite name
 * @param semiMajorAxis       a, km
 * @param eccentricity        e
 * @param inclination         i, rad
 * @param raan                Ω, rad
 * @param argumentOfPeriapsis ω, rad
 * @param epoch               tp, s
 * @param meanAnomaly         M, rad
 */
public record OrbitRecord(String name,
                          double semiMajorAxis,
                          double eccentricity,
                          double inclination,
                          double raan,
                          double argumentOfPeriapsis,
                          double epoch,
                          double meanAnomaly) {

    /**
     * Rebuilds the orbit and puts the body back at the stored mean anomaly rather than at the
     * epoch.
     *
     * @throws io.github.jakubt4.kepler.orbit.InvalidOrbitElementsException if the stored elements
     *         are not valid around {@code planet}
     */
    public Orbit toOrbit(final Planet planet, final PhysicalConstants constants, final Integration integration) {
        final var orbit = new Orbit(planet, semiMajorAxis, eccentricity, inclination, raan,
                argumentOfPeriapsis, epoch, constants, integration);
        orbit.setMeanAnomaly(meanAnomaly);
        return orbit;
    }

    public static OrbitRecord of(final String name, final Orbit orbit) {
        return new OrbitRecord(name,
                orbit.getSemiMajorAxis(),
                orbit.getEccentricity(),
                orbit.getInclination(),
                orbit.getRaan(),
                orbit.getArgumentOfPeriapsis(),
                orbit.getEpoch(),
                orbit.getMeanAnomaly());
    }
}
