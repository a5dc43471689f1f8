package io.github.jakubt4.kepler.model;

import lombok.Getter;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;
import org.orekit.utils.Constants;

/**
 * Central body of a simulation.
 *
 * <p>Read by every orbit during propagation; edits are expected between ticks only. Orbits
 * already built around this planet are not revalidated by the setters: growing the radius past a
 * periapsis makes the next {@code Orbit.update} fail, and {@code Orbit.validate()} checks it
 * up front.
 * Texture references belong to the rendering side and are carried here untouched.
 */
@Getter
public class Planet {

    private static final double METRES_PER_KM = 1000.0;

    private String name;
    /** Gravitational parameter, km³/s². */
    private double mu;
    /** Mean radius, km. */
    private double radius;
    /** Sidereal rotation period, s. */
    private double siderealDay;
    private String dayTexture;
    private String nightTexture;

    public Planet(final String name, final double mu, final double radius, final double siderealDay) {
        this.name = name;
        this.mu = requirePositive("mu", mu);
        this.radius = requirePositive("radius", radius);
        this.siderealDay = requirePositive("siderealDay", siderealDay);
    }

    /**
     * WGS-84 Earth built from Orekit's constants.
     */
    public static Planet earth() {
        return new Planet("Earth",
                Constants.WGS84_EARTH_MU / (METRES_PER_KM * METRES_PER_KM * METRES_PER_KM),
                Constants.WGS84_EARTH_EQUATORIAL_RADIUS / METRES_PER_KM,
                MathUtils.TWO_PI / Constants.WGS84_EARTH_ANGULAR_VELOCITY);
    }

    /**
     * Radius of the circular equatorial orbit whose period equals the sidereal day, km.
     */
    public double geostationaryRadius() {
        return FastMath.cbrt(mu * siderealDay * siderealDay / (4.0 * FastMath.PI * FastMath.PI));
    }

    public void setName(final String name) {
        this.name = name;
    }

    public void setMu(final double mu) {
        this.mu = requirePositive("mu", mu);
    }

    public void setRadius(final double radius) {
        this.radius = requirePositive("radius", radius);
    }

    public void setSiderealDay(final double siderealDay) {
        this.siderealDay = requirePositive("siderealDay", siderealDay);
    }

    public void setDayTexture(final String dayTexture) {
        this.dayTexture = dayTexture;
    }

    public void setNightTexture(final String nightTexture) {
        this.nightTexture = nightTexture;
    }

    @Override
    public String toString() {
        return "Name: " + name + "\n"
                + "Radius: " + radius + "\n"
                + "Mu: " + mu + "\n"
                + "Day: " + siderealDay + "\n"
                + "DayTexture: " + dayTexture + "\n"
                + "NightTexture: " + nightTexture + "\n";
    }

    private static double requirePositive(final String field, final double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Planet " + field + " must be a positive finite value, got " + value);
        }
        return value;
    }
}
