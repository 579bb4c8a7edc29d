package fr.lapetina.aperture.domain.strategy;

/**
 * Position of this process on the ring shared by every client of a service.
 *
 * Instance {@code i} of {@code n} owns the slice starting at {@code i / n} with
 * width {@code 1 / n}.
 *
 * @param instanceId     zero-based index of this process
 * @param totalInstances number of processes sharing the ring
 */
public record Coordinate(int instanceId, int totalInstances) {

    public Coordinate {
        if (totalInstances < 1) {
            throw new IllegalArgumentException("totalInstances must be positive, got " + totalInstances);
        }
        if (instanceId < 0 || instanceId >= totalInstances) {
            throw new IllegalArgumentException(
                    "instanceId must be in [0, " + totalInstances + "), got " + instanceId);
        }
    }

    /**
     * Start of this process's slice, in {@code [0, 1)}.
     */
    public double offset() {
        return (double) instanceId / totalInstances;
    }

    /**
     * Width of one process's slice.
     */
    public double unitWidth() {
        return 1.0 / totalInstances;
    }
}
