package fr.lapetina.aperture.domain.model;

/**
 * Health status of a node as seen by the distributor.
 *
 * OPEN: Node is healthy and accepting requests
 * BUSY: Node is usable but degraded (draining, partially failing)
 * CLOSED: Node is unusable
 *
 * Declaration order is preference order: OPEN beats BUSY beats CLOSED.
 */
public enum NodeStatus {
    OPEN,
    BUSY,
    CLOSED;

    /**
     * Returns true if this status is strictly preferred over {@code other}.
     */
    public boolean isBetterThan(NodeStatus other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Returns the preferred of two statuses.
     */
    public static NodeStatus best(NodeStatus a, NodeStatus b) {
        return b.isBetterThan(a) ? b : a;
    }
}
