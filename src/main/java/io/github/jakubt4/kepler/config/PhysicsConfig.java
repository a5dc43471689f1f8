package io.github.jakubt4.kepler.config;

import io.github.jakubt4.kepler.model.Planet;
import io.github.jakubt4.kepler.orbit.PhysicalConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns the bound {@link KeplerProperties} into the immutable values the orbit code works with.
 *
 * <p>Invalid values fail here, at startup, through the validating constructors of
 * {@link PhysicalConstants} and {@link Planet}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(KeplerProperties.class)
public class PhysicsConfig {

    @Bean
    PhysicalConstants physicalConstants(final KeplerProperties properties) {
        final var physics = properties.physics();
        final var drag = physics.drag();
        final var integrator = physics.integrator();

        final var constants = new PhysicalConstants(
                physics.j2(),
                physics.standardGravity(),
                physics.keplerTolerance(),
                new PhysicalConstants.DragModel(
                        drag.altitudeCeiling(),
                        drag.surfaceDensity(),
                        drag.scaleHeight(),
                        drag.dragCoefficient(),
                        drag.area(),
                        drag.mass()),
                new PhysicalConstants.IntegratorSettings(
                        integrator.fixedStep(),
                        integrator.minStep(),
                        integrator.maxStep(),
                        integrator.absoluteTolerance(),
                        integrator.relativeTolerance()));

        log.info("Physical constants loaded — J2={}, Kepler tolerance={}, drag ceiling={} km",
                constants.j2(), constants.keplerTolerance(), drag.altitudeCeiling());
        return constants;
    }

    @Bean
    Planet planet(final KeplerProperties properties) {
        final var settings = properties.planet();
        final var planet = new Planet(settings.name(), settings.mu(), settings.radius(), settings.siderealDay());
        planet.setDayTexture(settings.dayTexture());
        planet.setNightTexture(settings.nightTexture());

        log.info("Central body [{}] — mu={} km3/s2, radius={} km, geostationary radius={} km",
                planet.getName(), planet.getMu(), planet.getRadius(),
                String.format("%.1f", planet.geostationaryRadius()));
        return planet;
    }
}
