package io.github.jakubt4.kepler.orbit.propagation;

import io.github.jakubt4.kepler.orbit.KeplerSolver;
import io.github.jakubt4.kepler.orbit.Orbit;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.ode.ExpandableODE;
import org.hipparchus.ode.ODEIntegrator;
import org.hipparchus.ode.ODEState;
import org.hipparchus.util.FastMath;
import org.orekit.frames.FramesFactory;
import org.orekit.orbits.KeplerianOrbit;
import org.orekit.orbits.PositionAngleType;
import org.orekit.time.AbsoluteDate;

import java.util.function.Supplier;

/**
 * Integrates the two-body equations of motion numerically.
 *
 * <p>The orbit's elements are turned into a Cartesian state with Orekit, integrated over the
 * step with a Hipparchus integrator, and the final position is projected back onto the orbit's
 * own plane to read the argument of latitude. Only the anomaly comes back; the elements stay
 * owned by {@link Orbit}.
 *
 * <p>A fresh integrator is built for every step since Hipparchus integrators keep per-run state.
 */
@Slf4j
public class NumericalTwoBodyStrategy implements PropagationStrategy {

    private final String name;
    private final Supplier<ODEIntegrator> integratorFactory;

    public NumericalTwoBodyStrategy(final String name, final Supplier<ODEIntegrator> integratorFactory) {
        this.name = name;
        this.integratorFactory = integratorFactory;
    }

    @Override
    public double propagate(final Orbit orbit, final double dt) {
        if (dt == 0.0) {
            return orbit.getMeanAnomaly();
        }

        final var mu = orbit.getPlanet().getMu();
        final var initial = new KeplerianOrbit(
                orbit.getSemiMajorAxis(),
                orbit.getEccentricity(),
                orbit.getInclination(),
                orbit.getArgumentOfPeriapsis(),
                orbit.getRaan(),
                orbit.getMeanAnomaly(),
                PositionAngleType.MEAN,
                FramesFactory.getGCRF(),
                AbsoluteDate.J2000_EPOCH,
                mu
        ).getPVCoordinates();

        final var position = initial.getPosition();
        final var velocity = initial.getVelocity();
        final var y0 = new double[] {
                position.getX(), position.getY(), position.getZ(),
                velocity.getX(), velocity.getY(), velocity.getZ()
        };

        final var integrator = integratorFactory.get();
        final var end = integrator.integrate(new ExpandableODE(new TwoBodyEquations(mu)), new ODEState(0.0, y0), dt);
        final var y = end.getPrimaryState();

        log.debug("{} step of {} s finished after {} evaluations", name, dt, integrator.getEvaluations());

        return meanAnomalyAt(orbit, new Vector3D(y[0], y[1], y[2]));
    }

    /**
     * Mean anomaly of a position vector measured in the plane defined by the orbit's
     * inclination and ascending node.
     */
    static double meanAnomalyAt(final Orbit orbit, final Vector3D position) {
        final var raan = orbit.getRaan();
        final var inclination = orbit.getInclination();
        final var node = new Vector3D(FastMath.cos(raan), FastMath.sin(raan), 0.0);
        final var inPlaneNormal = new Vector3D(
                -FastMath.cos(inclination) * FastMath.sin(raan),
                FastMath.cos(inclination) * FastMath.cos(raan),
                FastMath.sin(inclination));

        final var argumentOfLatitude = FastMath.atan2(position.dotProduct(inPlaneNormal), position.dotProduct(node));
        final var trueAnomaly = argumentOfLatitude - orbit.getArgumentOfPeriapsis();
        return KeplerSolver.meanAnomaly(trueAnomaly, orbit.getEccentricity());
    }

    @Override
    public String toString() {
        return name;
    }
}
