package io.github.jakubt4.kepler.orbit;

import org.hipparchus.util.FastMath;

/**
 * First-order perturbations: secular J2 drift of the node and periapsis, and drag from an
 * exponential atmosphere.
 *
 * <p>Rates only. {@link Orbit#update(double)} integrates them with a forward-Euler step, so
 * one large step and many small ones do not give the same result.
 */
public class PerturbationModel {

    private static final double METRES_PER_KM = 1000.0;

    private final PhysicalConstants constants;

    public PerturbationModel(final PhysicalConstants constants) {
        this.constants = constants;
    }

    /**
     * Common J2 factor {@code 1.5 J2 (R/r)² n}, in rad/s.
     *
     * @param planetRadius mean radius of the central body, km
     * @param radius       current orbital radius, km
     * @param meanMotion   mean motion, rad/s
     */
    public double oblatenessRate(final double planetRadius, final double radius, final double meanMotion) {
        final var ratio = planetRadius / radius;
        return 1.5 * constants.j2() * ratio * ratio * meanMotion;
    }

    /**
     * Drift of the longitude of the ascending node, rad/s. Negative for prograde orbits.
     */
    public double nodalRate(final double oblatenessRate, final double inclination) {
        return -oblatenessRate * FastMath.cos(inclination);
    }

    /**
     * Drift of the argument of periapsis, rad/s.
     */
    public double apsidalRate(final double oblatenessRate, final double inclination) {
        final var sinI = FastMath.sin(inclination);
        return -oblatenessRate * (2.5 * sinI * sinI - 1.0);
    }

    public boolean isDragActive(final double altitude) {
        return altitude < constants.drag().altitudeCeiling();
    }

    /**
     * Atmospheric density in kg/m³ at an altitude given in km.
     */
    public double density(final double altitude) {
        final var drag = constants.drag();
        return drag.surfaceDensity() * FastMath.exp(-altitude / drag.scaleHeight());
    }

    /**
     * Drag deceleration magnitude in km/s², zero above the altitude ceiling.
     *
     * @param altitude height above the planet surface, km
     * @param speed    current speed, km/s
     */
    public double dragDeceleration(final double altitude, final double speed) {
        if (!isDragActive(altitude)) {
            return 0.0;
        }
        final var drag = constants.drag();
        final var speedSi = speed * METRES_PER_KM;
        final var decelerationSi = 0.5 * drag.dragCoefficient() * drag.area() * density(altitude)
                * speedSi * speedSi / drag.mass();
        return decelerationSi / METRES_PER_KM;
    }
}
