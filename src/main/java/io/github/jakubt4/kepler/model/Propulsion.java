package io.github.jakubt4.kepler.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Impulsive maneuver queue with delta-v bookkeeping.
 *
 * <p>Maneuvers fire against the cumulative mission clock, which {@link #executeManeuvers(double)}
 * advances by each tick's step. The unit only keeps the books: burns are not fed back into
 * the orbit.
 */
@Slf4j
@Getter
public class Propulsion {

    /** Specific impulse, s. */
    private final double specificImpulse;
    private final double thrust;
    /** Propellant mass, kg. */
    private final double mass;
    /** g₀ for the rocket equation, m/s². */
    private final double standardGravity;

    /** Delta-v of every maneuver ever queued, m/s. */
    private double requestedDeltaV;
    /** Delta-v of the maneuvers already executed, m/s. */
    private double appliedDeltaV;
    /** Seconds elapsed since the clock was last reset. */
    private double missionTime;

    @Getter(AccessLevel.NONE)
    private final List<Maneuver> pending = new ArrayList<>();

    public Propulsion(final double specificImpulse, final double thrust, final double mass,
                      final double standardGravity) {
        this.specificImpulse = requirePositive("specificImpulse", specificImpulse);
        this.thrust = requirePositive("thrust", thrust);
        this.mass = requirePositive("mass", mass);
        this.standardGravity = requirePositive("standardGravity", standardGravity);
    }

    /**
     * Queues a burn. The requested delta-v total grows immediately.
     */
    public Maneuver addManeuver(final double deltaV, final Vector3D direction, final double scheduledTime) {
        final var maneuver = new Maneuver(deltaV, direction, scheduledTime);
        pending.add(maneuver);
        requestedDeltaV += deltaV;
        return maneuver;
    }

    /**
     * Advances the mission clock by {@code dt} and executes every burn now due.
     *
     * @return executed maneuvers, earliest first
     */
    public List<Maneuver> executeManeuvers(final double dt) {
        missionTime += dt;

        final var due = pending.stream()
                .filter(maneuver -> maneuver.scheduledTime() <= missionTime)
                .sorted(Comparator.comparingDouble(Maneuver::scheduledTime))
                .toList();
        if (due.isEmpty()) {
            return List.of();
        }

        pending.removeIf(maneuver -> maneuver.scheduledTime() <= missionTime);
        for (final var maneuver : due) {
            appliedDeltaV += maneuver.deltaV();
            log.info("Maneuver executed at t={} s, dv={} m/s, scheduled for t={} s",
                    missionTime, maneuver.deltaV(), maneuver.scheduledTime());
        }
        return due;
    }

    /**
     * Delta-v capacity from the rocket equation, {@code Isp·g₀·ln((mass + thrust) / mass)}, m/s.
     * Independent of the queue.
     */
    public double calculateDv() {
        return specificImpulse * standardGravity * FastMath.log((mass + thrust) / mass);
    }

    public void resetClock() {
        missionTime = 0.0;
    }

    public List<Maneuver> getPendingManeuvers() {
        return Collections.unmodifiableList(pending);
    }

    private static double requirePositive(final String field, final double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Propulsion " + field + " must be a positive finite value, got " + value);
        }
        return value;
    }
}
