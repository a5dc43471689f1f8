package io.github.jakubt4.kepler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Kepler: orbital state propagation engine.
 *
 * <p>Propagates satellites from Keplerian elements with an analytical Kepler solver or a
 * numerical two-body integrator, applies J2 and drag perturbations, and exposes positions in
 * polar or Cartesian form. Physical constants and defaults come from {@code application.yml}.
 *
 * @see io.github.jakubt4.kepler.orbit.Orbit
 * @see io.github.jakubt4.kepler.service.SatelliteFactory
 */
@SpringBootApplication
public class KeplerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeplerApplication.class, args);
    }
}
