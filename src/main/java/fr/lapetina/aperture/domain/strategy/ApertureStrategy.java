package fr.lapetina.aperture.domain.strategy;

import java.util.Optional;

/**
 * Windowing strategy used for a rebuild.
 */
public enum ApertureStrategy {
    /** Token-sorted window, no fleet coordination. */
    RANDOM("random"),
    /** Ring-coordinated window, requires a {@link Coordinate}. */
    DETERMINISTIC("deterministic");

    private final String label;

    ApertureStrategy(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Selects the strategy for a rebuild. Deterministic windowing needs both the
     * flag and a coordinate; otherwise random windowing is used.
     */
    public static ApertureStrategy select(boolean dapertureActive, Optional<Coordinate> coordinate) {
        return dapertureActive && coordinate.isPresent() ? DETERMINISTIC : RANDOM;
    }
}
