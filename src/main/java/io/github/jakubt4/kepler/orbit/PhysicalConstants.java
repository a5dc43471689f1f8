package io.github.jakubt4.kepler.orbit;

import org.orekit.utils.Constants;

/**
 * Immutable physical and numerical settings handed to every orbit.
 *
 * <p>Units follow the orbit state: kilometres and seconds, except for the drag model which is
 * expressed in SI (metres, kilograms) and converted where it meets the kilometre-based state.
 *
 * @param j2                oblateness coefficient of the central body (dimensionless), 0 for a
 *                          spherical body
 * @param standardGravity   g₀ used by the rocket equation, m/s²
 * @param keplerTolerance   bracket width at which the Kepler bisection stops, radians
 * @param drag              atmospheric drag model
 * @param integrator        settings for the numerical propagation strategies
 */
public record PhysicalConstants(double j2,
                                double standardGravity,
                                double keplerTolerance,
                                DragModel drag,
                                IntegratorSettings integrator) {

    public PhysicalConstants {
        if (!(j2 >= 0.0) || Double.isInfinite(j2)) {
            throw new IllegalArgumentException("j2 must be a non-negative finite value, got " + j2);
        }
        requirePositive("standardGravity", standardGravity);
        requirePositive("keplerTolerance", keplerTolerance);
        if (keplerTolerance < KeplerSolver.MIN_TOLERANCE) {
            throw new IllegalArgumentException("keplerTolerance must be at least "
                    + KeplerSolver.MIN_TOLERANCE + ", got " + keplerTolerance);
        }
        if (drag == null || integrator == null) {
            throw new IllegalArgumentException("Drag model and integrator settings are required");
        }
    }

    /**
     * Earth values: J2 and g₀ from Orekit, a 1000 km drag ceiling over an exponential
     * atmosphere with an 8.5 km scale height.
     */
    public static PhysicalConstants defaults() {
        return new PhysicalConstants(
                -Constants.WGS84_EARTH_C20,
                Constants.G0_STANDARD_GRAVITY,
                1.0e-6,
                new DragModel(1000.0, 1.225, 8.5, 2.2, 1.0, 1000.0),
                new IntegratorSettings(10.0, 1.0e-3, 300.0, 1.0e-6, 1.0e-10));
    }

    /**
     * Exponential atmosphere and ballistic properties of the body.
     *
     * @param altitudeCeiling   altitude above which drag is ignored, km
     * @param surfaceDensity    density at zero altitude, kg/m³
     * @param scaleHeight       density scale height, km
     * @param dragCoefficient   Cd, dimensionless
     * @param area              cross-section, m²
     * @param mass              body mass, kg
     */
    public record DragModel(double altitudeCeiling,
                            double surfaceDensity,
                            double scaleHeight,
                            double dragCoefficient,
                            double area,
                            double mass) {

        public DragModel {
            requirePositive("altitudeCeiling", altitudeCeiling);
            requirePositive("surfaceDensity", surfaceDensity);
            requirePositive("scaleHeight", scaleHeight);
            requirePositive("dragCoefficient", dragCoefficient);
            requirePositive("area", area);
            requirePositive("mass", mass);
        }
    }

    /**
     * Numerical integrator settings, all in seconds except the tolerances which are in km
     * (absolute) and dimensionless (relative).
     */
    public record IntegratorSettings(double fixedStep,
                                     double minStep,
                                     double maxStep,
                                     double absoluteTolerance,
                                     double relativeTolerance) {

        public IntegratorSettings {
            requirePositive("fixedStep", fixedStep);
            requirePositive("minStep", minStep);
            requirePositive("maxStep", maxStep);
            requirePositive("absoluteTolerance", absoluteTolerance);
            requirePositive("relativeTolerance", relativeTolerance);
            if (minStep > maxStep) {
                throw new IllegalArgumentException(
                        "minStep (" + minStep + ") must not exceed maxStep (" + maxStep + ")");
            }
        }
    }

    private static void requirePositive(final String name, final double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite value, got " + value);
        }
    }
}
