package io.github.jakubt4.kepler.model;

import io.github.jakubt4.kepler.geometry.PolarPoint;
import io.github.jakubt4.kepler.orbit.Orbit;
import io.github.jakubt4.kepler.orbit.PhysicalConstants;
import io.github.jakubt4.kepler.orbit.propagation.Integration;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Body moving on its own copy of an {@link Orbit}, with a propulsion unit and attitude angles.
 *
 * <p>The attitude angles are for display only and play no part in the physics.
 */
@Slf4j
@Getter
public class Satellite {

    private final Orbit orbit;
    private final Planet planet;
    private final Propulsion propulsion;

    @Setter
    private String name;
    @Setter
    private double rx;
    @Setter
    private double ry;
    @Setter
    private double rz;

    /**
     * @param prototype orbit to copy; later changes to it do not affect this satellite
     */
    public Satellite(final Orbit prototype, final Planet planet, final Propulsion propulsion, final String name) {
        this.orbit = new Orbit(prototype);
        this.planet = planet;
        this.propulsion = propulsion;
        this.name = name;
    }

    /**
     * Rebuilds a satellite from a saved record, restoring the stored mean anomaly exactly.
     */
    public static Satellite restore(final OrbitRecord record,
                                    final Planet planet,
                                    final Propulsion propulsion,
                                    final PhysicalConstants constants,
                                    final Integration integration) {
        return new Satellite(record.toOrbit(planet, constants, integration), planet, propulsion, record.name());
    }

    /**
     * One simulation tick: perturbations, then anomaly propagation, then due maneuvers.
     */
    public void update(final double dt) {
        orbit.update(dt);
        orbit.updatePosition(dt);

        final var executed = propulsion.executeManeuvers(dt);
        if (!executed.isEmpty()) {
            log.info("[{}] Executed {} maneuver(s)", name, executed.size());
        }
    }

    /**
     * Back to the epoch position; the mission clock restarts as well.
     */
    public void reset() {
        orbit.reset();
        propulsion.resetClock();
    }

    public PolarPoint getCurrentPosition() {
        return orbit.getPositionPoint();
    }

    public OrbitRecord toRecord() {
        return OrbitRecord.of(name, orbit);
    }

    @Override
    public String toString() {
        return "----------\n"
                + "Name: " + name + "\n"
                + orbit;
    }
}
