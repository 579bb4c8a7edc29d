package fr.lapetina.aperture.domain.aperture;

/**
 * Live aperture settings, queried on every rebuild.
 *
 * Implementations must return current values on each call rather than values
 * captured at construction. Invalid values are tolerated here and sanitized
 * by the controller.
 */
public interface ApertureSettings {

    /**
     * Smallest window the controller may shrink to.
     */
    int minAperture();

    /**
     * Window size used until the load band adjusts it.
     */
    int initAperture();

    /**
     * Whether deterministic (ring-coordinated) windowing should be used when a
     * coordinate is available.
     */
    boolean dapertureActive();

    /**
     * Whether nodes entering the window are connected ahead of the first request.
     */
    boolean eagerConnections();

    /**
     * Settings with constant values.
     */
    static ApertureSettings of(int minAperture, int initAperture, boolean dapertureActive, boolean eagerConnections) {
        return new Fixed(minAperture, initAperture, dapertureActive, eagerConnections);
    }

    record Fixed(
            int minAperture,
            int initAperture,
            boolean dapertureActive,
            boolean eagerConnections
    ) implements ApertureSettings {
    }
}
