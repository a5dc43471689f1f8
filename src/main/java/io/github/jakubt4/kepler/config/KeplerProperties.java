package io.github.jakubt4.kepler.config;

import io.github.jakubt4.kepler.orbit.propagation.Integration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code kepler.*} namespace.
 *
 * @param planet      central body of new orbits
 * @param physics     physical constants and numerical tolerances
 * @param propulsion  defaults for new propulsion units
 * @param integration propagation strategy new orbits are bound to
 */
@ConfigurationProperties(prefix = "kepler")
public record KeplerProperties(PlanetSettings planet,
                               PhysicsSettings physics,
                               PropulsionSettings propulsion,
                               Integration integration) {

    public record PlanetSettings(String name,
                                 double mu,
                                 double radius,
                                 double siderealDay,
                                 String dayTexture,
                                 String nightTexture) {
    }

    public record PhysicsSettings(double j2,
                                  double standardGravity,
                                  double keplerTolerance,
                                  DragSettings drag,
                                  IntegratorSettings integrator) {
    }

    public record DragSettings(double altitudeCeiling,
                               double surfaceDensity,
                               double scaleHeight,
                               double dragCoefficient,
                               double area,
                               double mass) {
    }

    public record IntegratorSettings(double fixedStep,
                                     double minStep,
                                     double maxStep,
                                     double absoluteTolerance,
                                     double relativeTolerance) {
    }

    public record PropulsionSettings(double specificImpulse,
                                     double thrust,
                                     double mass) {
    }
}
