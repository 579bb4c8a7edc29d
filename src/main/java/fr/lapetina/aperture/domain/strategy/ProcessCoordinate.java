package fr.lapetina.aperture.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of this process's {@link Coordinate}.
 *
 * Set once at startup and read-only afterwards. Distributors only read it.
 */
public final class ProcessCoordinate {

    private static final Logger log = LoggerFactory.getLogger(ProcessCoordinate.class);

    private static final AtomicReference<Coordinate> COORDINATE = new AtomicReference<>();

    private ProcessCoordinate() {
        // Utility class
    }

    /**
     * Installs the coordinate. Repeating the same value is a no-op.
     *
     * @throws IllegalStateException if a different coordinate is already set
     */
    public static void initialize(Coordinate coordinate) {
        if (COORDINATE.compareAndSet(null, coordinate)) {
            log.info("Process coordinate set: instanceId={}, totalInstances={}",
                    coordinate.instanceId(), coordinate.totalInstances());
            return;
        }
        Coordinate existing = COORDINATE.get();
        if (!existing.equals(coordinate)) {
            throw new IllegalStateException(
                    "Process coordinate already set to " + existing + ", refusing " + coordinate);
        }
    }

    /**
     * Returns the coordinate, or empty if this process is not part of a ring.
     */
    public static Optional<Coordinate> current() {
        return Optional.ofNullable(COORDINATE.get());
    }

    static void clear() {
        COORDINATE.set(null);
    }
}
