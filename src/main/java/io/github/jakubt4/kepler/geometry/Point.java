package io.github.jakubt4.kepler.geometry;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * A position in space, readable both as Cartesian {@code (x, y, z)} and as polar
 * {@code (radius, azimuth, elevation)} coordinates.
 *
 * <p>Two implementations exist: {@link CartesianPoint} and {@link PolarPoint}. Each stores one
 * form and derives the other on demand. Arithmetic and equality always go through the Cartesian
 * components; results keep the representation of the receiver.
 */
public interface Point {

    double x();

    double y();

    double z();

    /** Distance from the origin, never negative. */
    double radius();

    /** Angle in the xy-plane from the x-axis, in {@code [0, 2π)}. */
    double azimuth();

    /** Angle above the xy-plane, in {@code [-π/2, π/2]}. */
    double elevation();

    Point add(Point other);

    Point subtract(Point other);

    default Vector3D toVector() {
        return new Vector3D(x(), y(), z());
    }

    default CartesianPoint toCartesian() {
        return new CartesianPoint(x(), y(), z());
    }

    default PolarPoint toPolar() {
        return new PolarPoint(radius(), azimuth(), elevation());
    }

    /**
     * Component-wise comparison of the Cartesian forms, shared by both implementations so that
     * equality is symmetric across representations. Signed zeros compare equal.
     */
    static boolean sameCartesian(final Point point, final Object other) {
        if (point == other) {
            return true;
        }
        if (!(other instanceof Point that)) {
            return false;
        }
        return point.x() == that.x()
                && point.y() == that.y()
                && point.z() == that.z();
    }

    static int cartesianHash(final Point point) {
        // + 0.0 folds -0.0 into 0.0 to stay consistent with sameCartesian
        var result = Double.hashCode(point.x() + 0.0);
        result = 31 * result + Double.hashCode(point.y() + 0.0);
        result = 31 * result + Double.hashCode(point.z() + 0.0);
        return result;
    }
}
