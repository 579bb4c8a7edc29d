package fr.lapetina.aperture.domain.distributor;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Thread-safe source of uniform random indices.
 *
 * Injected into pickers so tests can make selection deterministic.
 */
@FunctionalInterface
public interface IndexSource {

    /**
     * Returns a uniformly distributed index in {@code [0, bound)}.
     *
     * @param bound exclusive upper bound, must be positive
     */
    int nextInt(int bound);

    /**
     * Default source backed by {@link ThreadLocalRandom}.
     */
    static IndexSource threadLocal() {
        return bound -> ThreadLocalRandom.current().nextInt(bound);
    }

    /**
     * Reproducible source. {@link Random} is thread-safe, although contended
     * callers will serialize on its seed.
     */
    static IndexSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }
}
