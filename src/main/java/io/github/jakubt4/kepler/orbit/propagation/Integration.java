package io.github.jakubt4.kepler.orbit.propagation;

import io.github.jakubt4.kepler.orbit.PhysicalConstants;
import org.hipparchus.ode.nonstiff.ClassicalRungeKuttaIntegrator;
import org.hipparchus.ode.nonstiff.DormandPrince853Integrator;

/**
 * Propagation strategies an orbit can be bound to.
 */
public enum Integration {

    /** Mean anomaly advanced analytically. Default for every orbit. */
    CLOSED_FORM_KEPLER {
        @Override
        public PropagationStrategy createStrategy(final PhysicalConstants constants) {
            return new ClosedFormKeplerStrategy();
        }
    },

    /** Classical fourth-order Runge-Kutta with a constant step. */
    FIXED_STEP_RK4 {
        @Override
        public PropagationStrategy createStrategy(final PhysicalConstants constants) {
            final var settings = constants.integrator();
            return new NumericalTwoBodyStrategy("RK4",
                    () -> new ClassicalRungeKuttaIntegrator(settings.fixedStep()));
        }
    },

    /** Embedded Dormand-Prince 8(5,3) pair with step-size control. */
    ADAPTIVE_DORMAND_PRINCE_853 {
        @Override
        public PropagationStrategy createStrategy(final PhysicalConstants constants) {
            final var settings = constants.integrator();
            return new NumericalTwoBodyStrategy("DP853",
                    () -> new DormandPrince853Integrator(
                            settings.minStep(),
                            settings.maxStep(),
                            settings.absoluteTolerance(),
                            settings.relativeTolerance()));
        }
    };

    public abstract PropagationStrategy createStrategy(PhysicalConstants constants);
}
