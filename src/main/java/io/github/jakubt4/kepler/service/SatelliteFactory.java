package io.github.jakubt4.kepler.service;

import io.github.jakubt4.kepler.config.KeplerProperties;
import io.github.jakubt4.kepler.model.OrbitRecord;
import io.github.jakubt4.kepler.model.Planet;
import io.github.jakubt4.kepler.model.Propulsion;
import io.github.jakubt4.kepler.model.Satellite;
import io.github.jakubt4.kepler.orbit.Orbit;
import io.github.jakubt4.kepler.orbit.PhysicalConstants;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds orbits and satellites around the configured central body, with the configured
 * constants, propagation strategy and propulsion defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SatelliteFactory {

    private final KeplerProperties properties;
    private final PhysicalConstants constants;
    @Getter
    private final Planet planet;

    /**
     * @throws io.github.jakubt4.kepler.orbit.InvalidOrbitElementsException if the elements are
     *         not valid around the configured planet
     */
    public Orbit createOrbit(final double semiMajorAxis,
                             final double eccentricity,
                             final double inclination,
                             final double raan,
                             final double argumentOfPeriapsis,
                             final double epoch) {
        return new Orbit(planet, semiMajorAxis, eccentricity, inclination, raan, argumentOfPeriapsis, epoch,
                constants, properties.integration());
    }

    public Satellite createSatellite(final String name, final Orbit prototype) {
        final var satellite = new Satellite(prototype, planet, createPropulsion(), name);
        log.info("Satellite [{}] created — a={} km, e={}, propagation: {}",
                name, prototype.getSemiMajorAxis(), prototype.getEccentricity(), prototype.getIntegration());
        return satellite;
    }

    /**
     * Rebuilds a saved satellite with the stored mean anomaly.
     */
    public Satellite restore(final OrbitRecord record) {
        final var satellite = Satellite.restore(record, planet, createPropulsion(), constants, properties.integration());
        log.info("Satellite [{}] restored at M={} rad", record.name(), record.meanAnomaly());
        return satellite;
    }

    public Propulsion createPropulsion() {
        final var settings = properties.propulsion();
        return new Propulsion(settings.specificImpulse(), settings.thrust(), settings.mass(),
                constants.standardGravity());
    }
}
