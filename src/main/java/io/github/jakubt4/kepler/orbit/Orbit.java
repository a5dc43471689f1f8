package io.github.jakubt4.kepler.orbit;

import io.github.jakubt4.kepler.geometry.Angles;
import io.github.jakubt4.kepler.geometry.PolarPoint;
import io.github.jakubt4.kepler.model.Planet;
import io.github.jakubt4.kepler.orbit.propagation.Integration;
import io.github.jakubt4.kepler.orbit.propagation.PropagationStrategy;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * Elliptic orbit around a {@link Planet}, described by Keplerian elements plus the current
 * anomaly of the orbiting body.
 *
 * <p>Angles are in radians and kept in {@code [0, 2π)}; distances in km, times in s.
 * The mean, eccentric and true anomalies are always recomputed together from {@code M}.
 *
 * <p>Two kinds of mutation happen on each tick:
 * <ul>
 *   <li>{@link #updatePosition(double)} advances the anomaly with the strategy this orbit was
 *       built with;</li>
 *   <li>{@link #update(double)} applies J2 drift to {@code Ω} and {@code ω} and drag to the
 *       auxiliary speed. It never changes {@code a}, {@code e} or the anomalies.</li>
 * </ul>
 *
 * <p>Not thread-safe. The owning scheduler is the only writer.
 */
@Slf4j
@Getter
public class Orbit {

    private final Planet planet;
    private final PhysicalConstants constants;
    private final Integration integration;

    @Getter(AccessLevel.NONE)
    private final PropagationStrategy strategy;
    @Getter(AccessLevel.NONE)
    private final KeplerSolver solver;
    @Getter(AccessLevel.NONE)
    private final PerturbationModel perturbations;

    private double semiMajorAxis;
    private double eccentricity;
    private double inclination;
    /** Longitude of the ascending node, Ω. */
    private double raan;
    /** Argument of periapsis, ω. */
    private double argumentOfPeriapsis;
    /** Epoch tp, s. */
    private double epoch;

    private double meanAnomaly;
    private double eccentricAnomaly;
    private double trueAnomaly;

    /** Speed lost to drag so far, km/s. */
    private double dragVelocityLoss;

    public Orbit(final Planet planet,
                 final double semiMajorAxis,
                 final double eccentricity,
                 final double inclination,
                 final double raan,
                 final double argumentOfPeriapsis,
                 final double epoch) {
        this(planet, semiMajorAxis, eccentricity, inclination, raan, argumentOfPeriapsis, epoch,
                PhysicalConstants.defaults(), Integration.CLOSED_FORM_KEPLER);
    }

    /**
     * @throws InvalidOrbitElementsException if the elements do not describe a closed orbit whose
     *                                       periapsis clears the planet
     */
    public Orbit(final Planet planet,
                 final double semiMajorAxis,
                 final double eccentricity,
                 final double inclination,
                 final double raan,
                 final double argumentOfPeriapsis,
                 final double epoch,
                 final PhysicalConstants constants,
                 final Integration integration) {
        validate(planet, semiMajorAxis, eccentricity);
        requireFinite("inclination", inclination);
        requireFinite("raan", raan);
        requireFinite("argumentOfPeriapsis", argumentOfPeriapsis);
        requireFinite("epoch", epoch);

        this.planet = planet;
        this.constants = constants;
        this.integration = integration;
        this.strategy = integration.createStrategy(constants);
        this.solver = new KeplerSolver(constants.keplerTolerance());
        this.perturbations = new PerturbationModel(constants);

        this.semiMajorAxis = semiMajorAxis;
        this.eccentricity = eccentricity;
        this.inclination = Angles.normalize(inclination);
        this.raan = Angles.normalize(raan);
        this.argumentOfPeriapsis = Angles.normalize(argumentOfPeriapsis);
        this.epoch = epoch;

        reset();
    }

    /**
     * Deep copy: elements, anomaly state and drag history are copied by value. The planet and
     * constants are shared.
     */
    public Orbit(final Orbit other) {
        this.planet = other.planet;
        this.constants = other.constants;
        this.integration = other.integration;
        this.strategy = other.integration.createStrategy(other.constants);
        this.solver = new KeplerSolver(other.constants.keplerTolerance());
        this.perturbations = new PerturbationModel(other.constants);

        this.semiMajorAxis = other.semiMajorAxis;
        this.eccentricity = other.eccentricity;
        this.inclination = other.inclination;
        this.raan = other.raan;
        this.argumentOfPeriapsis = other.argumentOfPeriapsis;
        this.epoch = other.epoch;
        this.meanAnomaly = other.meanAnomaly;
        this.eccentricAnomaly = other.eccentricAnomaly;
        this.trueAnomaly = other.trueAnomaly;
        this.dragVelocityLoss = other.dragVelocityLoss;
    }

    /**
     * Applies J2 secular drift and atmospheric drag over {@code dt} with one forward-Euler step.
     *
     * @throws InvalidOrbitElementsException if the planet was edited so that the orbit no longer
     *                                       clears it
     */
    public void update(final double dt) {
        validate();
        final var radius = getRadius();
        final var meanMotion = getMeanMotion();

        final var rate = perturbations.oblatenessRate(planet.getRadius(), radius, meanMotion);
        raan = Angles.normalize(raan + perturbations.nodalRate(rate, inclination) * dt);
        argumentOfPeriapsis = Angles.normalize(
                argumentOfPeriapsis + perturbations.apsidalRate(rate, inclination) * dt);

        final var altitude = radius - planet.getRadius();
        if (perturbations.isDragActive(altitude)) {
            final var deceleration = perturbations.dragDeceleration(altitude, getVelocity());
            dragVelocityLoss += deceleration * dt;
            log.debug("Drag active at {} km altitude, deceleration {} km/s2", altitude, deceleration);
        }
    }

    /**
     * Advances the anomaly by {@code dt} seconds with this orbit's propagation strategy.
     */
    public void updatePosition(final double dt) {
        applyMeanAnomaly(strategy.propagate(this, dt));
    }

    /**
     * Same as {@link #updatePosition(double)}, checking that the caller expects the strategy this
     * orbit is bound to.
     *
     * @throws IllegalArgumentException if {@code expected} differs from {@link #getIntegration()}
     */
    public void updatePosition(final double dt, final Integration expected) {
        if (expected != integration) {
            throw new IllegalArgumentException(
                    "Orbit is propagated with " + integration + ", cannot step it with " + expected);
        }
        updatePosition(dt);
    }

    /**
     * Puts the body back where it was at the epoch: {@code M = -n·tp}.
     */
    public void reset() {
        applyMeanAnomaly(-getMeanMotion() * epoch);
    }

    /**
     * Overrides the mean anomaly directly, bypassing {@link #reset()}. Used to restore a stored
     * state exactly.
     */
    public void setMeanAnomaly(final double meanAnomaly) {
        requireFinite("meanAnomaly", meanAnomaly);
        applyMeanAnomaly(meanAnomaly);
    }

    /**
     * Current position, derived from the elements and anomalies.
     */
    public PolarPoint getPositionPoint() {
        return pointAt(eccentricAnomaly, trueAnomaly);
    }

    /**
     * Position the body would have at an arbitrary mean anomaly. Does not touch the live state.
     */
    public PolarPoint getPointAt(final double meanAnomaly) {
        final var solution = solver.solve(meanAnomaly, eccentricity);
        return pointAt(solution.eccentricAnomaly(), solution.trueAnomaly());
    }

    /**
     * Re-checks the elements against the planet as it is now. {@link Planet} can be edited between
     * ticks, which the element setters never see.
     *
     * @throws InvalidOrbitElementsException if the periapsis no longer clears the planet
     */
    public void validate() {
        validate(planet, semiMajorAxis, eccentricity);
    }

    public double getMeanMotion() {
        return FastMath.sqrt(planet.getMu() / (semiMajorAxis * semiMajorAxis * semiMajorAxis));
    }

    public double getPeriod() {
        return MathUtils.TWO_PI / getMeanMotion();
    }

    public double getPeriapsisRadius() {
        return semiMajorAxis * (1.0 - eccentricity);
    }

    public double getApoapsisRadius() {
        return semiMajorAxis * (1.0 + eccentricity);
    }

    /**
     * Current distance to the planet centre, km.
     */
    public double getRadius() {
        return semiMajorAxis * (1.0 - eccentricity * FastMath.cos(eccentricAnomaly));
    }

    public double getAltitude() {
        return getRadius() - planet.getRadius();
    }

    /**
     * Vis-viva speed at the current radius minus the speed lost to drag, km/s.
     */
    public double getVelocity() {
        final var visViva = FastMath.sqrt(planet.getMu() * (2.0 / getRadius() - 1.0 / semiMajorAxis));
        return FastMath.max(0.0, visViva - dragVelocityLoss);
    }

    public void setSemiMajorAxis(final double semiMajorAxis) {
        validate(planet, semiMajorAxis, eccentricity);
        this.semiMajorAxis = semiMajorAxis;
    }

    /**
     * Changes the shape of the orbit, keeping the mean anomaly.
     */
    public void setEccentricity(final double eccentricity) {
        validate(planet, semiMajorAxis, eccentricity);
        this.eccentricity = eccentricity;
        applyMeanAnomaly(meanAnomaly);
    }

    public void setInclination(final double inclination) {
        requireFinite("inclination", inclination);
        this.inclination = Angles.normalize(inclination);
    }

    public void setRaan(final double raan) {
        requireFinite("raan", raan);
        this.raan = Angles.normalize(raan);
    }

    public void setArgumentOfPeriapsis(final double argumentOfPeriapsis) {
        requireFinite("argumentOfPeriapsis", argumentOfPeriapsis);
        this.argumentOfPeriapsis = Angles.normalize(argumentOfPeriapsis);
    }

    public void setEpoch(final double epoch) {
        requireFinite("epoch", epoch);
        this.epoch = epoch;
    }

    /**
     * Element listing in record order: a, e, i, Omega, omega, tp, M.
     */
    @Override
    public String toString() {
        return "a: " + semiMajorAxis + "\n"
                + "e: " + eccentricity + "\n"
                + "i: " + inclination + "\n"
                + "Omega: " + raan + "\n"
                + "omega: " + argumentOfPeriapsis + "\n"
                + "tp: " + epoch + "\n"
                + "M: " + meanAnomaly + "\n";
    }

    private void applyMeanAnomaly(final double meanAnomaly) {
        final var normalized = Angles.normalize(meanAnomaly);
        final var solution = solver.solve(normalized, eccentricity);
        this.meanAnomaly = normalized;
        this.eccentricAnomaly = solution.eccentricAnomaly();
        this.trueAnomaly = solution.trueAnomaly();
    }

    private PolarPoint pointAt(final double eccentricAnomaly, final double trueAnomaly) {
        final var radius = semiMajorAxis * (1.0 - eccentricity * FastMath.cos(eccentricAnomaly));
        final var argumentOfLatitude = argumentOfPeriapsis + trueAnomaly;
        final var sinU = FastMath.sin(argumentOfLatitude);
        final var cosU = FastMath.cos(argumentOfLatitude);

        final var azimuth = raan + FastMath.atan2(sinU * FastMath.cos(inclination), cosU);
        final var elevation = FastMath.asin(FastMath.sin(inclination) * sinU);
        return new PolarPoint(radius, azimuth, elevation);
    }

    private static void validate(final Planet planet, final double semiMajorAxis, final double eccentricity) {
        if (!Double.isFinite(semiMajorAxis) || semiMajorAxis <= 0.0) {
            throw new InvalidOrbitElementsException("Semi-major axis must be positive, got " + semiMajorAxis);
        }
        if (!(eccentricity >= 0.0 && eccentricity < 1.0)) {
            throw new InvalidOrbitElementsException("Eccentricity must be in [0, 1), got " + eccentricity);
        }
        final var periapsis = semiMajorAxis * (1.0 - eccentricity);
        if (periapsis <= planet.getRadius()) {
            throw new InvalidOrbitElementsException(String.format(
                    "Periapsis radius %.3f km does not clear %s (radius %.3f km)",
                    periapsis, planet.getName(), planet.getRadius()));
        }
    }

    private static void requireFinite(final String element, final double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidOrbitElementsException(element + " must be finite, got " + value);
        }
    }
}
