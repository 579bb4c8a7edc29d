package fr.lapetina.aperture.domain.strategy;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable placement of nodes on the unit ring.
 *
 * Every process hashes the same address to the same position, which is what
 * lets deterministic apertures line up without talking to each other.
 */
final class RingPositions {

    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    // 2^-53, maps the top 53 bits of a long onto [0, 1)
    private static final double UNIT = 0x1.0p-53;

    private RingPositions() {
    }

    /**
     * Returns the ring position of {@code address}, in {@code [0, 1)}.
     */
    static double position(String address) {
        long hash = MURMUR3.hashString(address, StandardCharsets.UTF_8).asLong();
        return (hash >>> 11) * UNIT;
    }

    /**
     * Clockwise distance from {@code from} to {@code to}, in {@code [0, 1)}.
     */
    static double distance(double from, double to) {
        double d = to - from;
        return d < 0 ? d + 1.0 : d;
    }
}
