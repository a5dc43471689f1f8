package io.github.jakubt4.kepler.orbit;

/**
 * Thrown when a set of Keplerian elements cannot describe a closed orbit that clears the
 * central body.
 */
public class InvalidOrbitElementsException extends RuntimeException {

    public InvalidOrbitElementsException(final String message) {
        super(message);
    }
}
