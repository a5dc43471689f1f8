package io.github.jakubt4.kepler.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Impulsive burn queued on a {@link Propulsion} unit.
 *
 * @param deltaV        magnitude, m/s
 * @param direction     unit thrust direction
 * @param scheduledTime mission time at which the burn fires, s
 */
public record Maneuver(double deltaV, Vector3D direction, double scheduledTime) {

    public Maneuver {
        if (!(deltaV >= 0.0) || Double.isInfinite(deltaV)) {
            throw new IllegalArgumentException("Maneuver delta-v must be a non-negative finite value, got " + deltaV);
        }
        if (direction == null || direction.getNorm() == 0.0) {
            throw new IllegalArgumentException("Maneuver direction must be a non-zero vector");
        }
        if (!Double.isFinite(scheduledTime)) {
            throw new IllegalArgumentException("Maneuver time must be finite, got " + scheduledTime);
        }
        direction = direction.normalize();
    }
}
