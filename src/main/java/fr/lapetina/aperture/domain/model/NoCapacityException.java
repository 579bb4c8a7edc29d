package fr.lapetina.aperture.domain.model;

/**
 * Raised by the synthetic failing node when the aperture has no capacity.
 *
 * This is never thrown by {@code pick()} itself; it surfaces when the caller
 * tries to use the node it was handed.
 */
public final class NoCapacityException extends RuntimeException {

    public NoCapacityException() {
        super("No nodes available in the aperture");
    }

    public NoCapacityException(String details) {
        super("No nodes available in the aperture - " + details);
    }
}
