package fr.lapetina.aperture.domain.distributor;

import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;

import java.util.List;

/**
 * Power-of-two-choices selection over the first {@code bound} nodes of a vector.
 *
 * Two distinct indices are sampled uniformly. The node with the better status
 * wins; on equal status the lower {@link ApertureNode#load()} wins; on a full
 * tie the first sampled index wins. Because the first sample is itself
 * uniform, equal nodes are selected uniformly.
 *
 * Holds read-only references and never mutates shared state, so one instance
 * can serve any number of concurrent callers.
 */
public final class P2CPicker implements NodePicker {

    private final List<ApertureNode> vector;
    private final int bound;
    private final IndexSource rng;

    public P2CPicker(List<ApertureNode> vector, int bound, IndexSource rng) {
        if (bound < 1 || bound > vector.size()) {
            throw new IllegalArgumentException(
                    "bound must be in [1, " + vector.size() + "], got " + bound);
        }
        this.vector = vector;
        this.bound = bound;
        this.rng = rng;
    }

    @Override
    public ApertureNode pick() {
        return vector.get(pickIndex());
    }

    /**
     * Returns the index of the selected node, always in {@code [0, bound)}.
     */
    public int pickIndex() {
        if (bound == 1) {
            return 0;
        }

        int a = rng.nextInt(bound);
        // Draw from the remaining bound - 1 slots so that b != a
        int b = rng.nextInt(bound - 1);
        if (b >= a) {
            b++;
        }

        return preferred(a, b);
    }

    private int preferred(int a, int b) {
        ApertureNode nodeA = vector.get(a);
        ApertureNode nodeB = vector.get(b);

        // Status is live; read it once per candidate
        NodeStatus statusA = nodeA.status();
        NodeStatus statusB = nodeB.status();
        if (statusA != statusB) {
            return statusB.isBetterThan(statusA) ? b : a;
        }
        return nodeB.load() < nodeA.load() ? b : a;
    }

    public int bound() {
        return bound;
    }
}
