package io.github.jakubt4.kepler.geometry;

import org.hipparchus.util.FastMath;

/**
 * Point stored as spherical coordinates.
 *
 * <p>The azimuth is wrapped into {@code [0, 2π)} on construction. The elevation is stored as
 * given; points built from Cartesian components always carry an elevation in
 * {@code [-π/2, π/2]}.
 *
 * @param radius    distance from the origin in kilometres, must not be negative
 * @param azimuth   angle in the xy-plane from the x-axis, radians
 * @param elevation angle above the xy-plane, radians
 */
public record PolarPoint(double radius, double azimuth, double elevation) implements Point {

    public PolarPoint {
        if (radius < 0.0 || Double.isNaN(radius)) {
            throw new IllegalArgumentException("Polar radius must be non-negative, got " + radius);
        }
        azimuth = Angles.normalize(azimuth);
    }

    @Override
    public double x() {
        return radius * FastMath.cos(azimuth) * FastMath.cos(elevation);
    }

    @Override
    public double y() {
        return radius * FastMath.sin(azimuth) * FastMath.cos(elevation);
    }

    @Override
    public double z() {
        return radius * FastMath.sin(elevation);
    }

    @Override
    public PolarPoint add(final Point other) {
        return toCartesian().add(other).toPolar();
    }

    @Override
    public PolarPoint subtract(final Point other) {
        return toCartesian().subtract(other).toPolar();
    }

    @Override
    public PolarPoint toPolar() {
        return this;
    }

    @Override
    public boolean equals(final Object other) {
        return Point.sameCartesian(this, other);
    }

    @Override
    public int hashCode() {
        return Point.cartesianHash(this);
    }
}
