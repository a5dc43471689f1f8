package io.github.jakubt4.kepler.geometry;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Point stored as Cartesian components, in kilometres.
 *
 * @param x x component
 * @param y y component
 * @param z z component
 */
public record CartesianPoint(double x, double y, double z) implements Point {

    public static final CartesianPoint ORIGIN = new CartesianPoint(0.0, 0.0, 0.0);

    public static CartesianPoint of(final Vector3D vector) {
        return new CartesianPoint(vector.getX(), vector.getY(), vector.getZ());
    }

    @Override
    public double radius() {
        return toVector().getNorm();
    }

    @Override
    public double azimuth() {
        // Vector3D.getAlpha is atan2(y, x), in (-π, π]
        return Angles.normalize(toVector().getAlpha());
    }

    @Override
    public double elevation() {
        final var vector = toVector();
        if (vector.getNorm() == 0.0) {
            return 0.0;
        }
        return vector.getDelta();
    }

    @Override
    public CartesianPoint add(final Point other) {
        return of(toVector().add(other.toVector()));
    }

    @Override
    public CartesianPoint subtract(final Point other) {
        return of(toVector().subtract(other.toVector()));
    }

    @Override
    public CartesianPoint toCartesian() {
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
