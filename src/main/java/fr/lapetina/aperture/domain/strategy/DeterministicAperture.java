package fr.lapetina.aperture.domain.strategy;

import fr.lapetina.aperture.domain.distributor.BaseDistributor;
import fr.lapetina.aperture.domain.distributor.IndexSource;
import fr.lapetina.aperture.domain.model.ApertureNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Aperture distributor coordinated through a shared ring.
 *
 * Nodes are placed on the unit ring by hashing their address. This process
 * owns the arc that starts at its {@link Coordinate#offset()} and spans
 * {@code max(unitWidth, aperture / poolSize)}; the nodes falling in that arc
 * form the window. Since every process computes the same placement, the
 * windows of a fleet tile the ring and load spreads evenly without any
 * coordination beyond the coordinate itself.
 *
 * The vector is ordered clockwise from the offset. The window never holds
 * fewer nodes than the logical aperture, and grows past it when more nodes fall
 * inside the process's own slice.
 */
public final class DeterministicAperture extends BaseDistributor {

    private static final Logger log = LoggerFactory.getLogger(DeterministicAperture.class);

    private final Coordinate coordinate;
    private final double arcWidth;

    public DeterministicAperture(
            List<ApertureNode> vector,
            int logicalAperture,
            Coordinate coordinate,
            ApertureNode emptyNode,
            IndexSource rng,
            String label
    ) {
        this(place(requireNonEmpty(vector), logicalAperture, coordinate), coordinate, emptyNode, rng, label);
    }

    private DeterministicAperture(
            Placement placement,
            Coordinate coordinate,
            ApertureNode emptyNode,
            IndexSource rng,
            String label
    ) {
        super(placement.ordered(), placement.bound(), emptyNode, rng);
        this.coordinate = coordinate;
        this.arcWidth = placement.arcWidth();

        if (log.isDebugEnabled()) {
            log.debug("[DeterministicAperture.rebuild {}] offset={}, width={}, nodes={}",
                    label, coordinate.offset(), arcWidth, windowAsString());
        }
    }

    static Placement place(List<ApertureNode> vector, int logicalAperture, Coordinate coordinate) {
        int size = vector.size();
        int requested = Math.max(1, Math.min(logicalAperture, size));
        double width = Math.min(1.0, Math.max(coordinate.unitWidth(), (double) requested / size));

        List<Positioned> positioned = new ArrayList<>(size);
        for (ApertureNode node : vector) {
            double distance = RingPositions.distance(coordinate.offset(), RingPositions.position(node.address()));
            positioned.add(new Positioned(node, distance));
        }
        positioned.sort(Comparator.comparingDouble(Positioned::distance)
                .thenComparingInt(p -> p.node().token())
                .thenComparing(p -> p.node().address()));

        int inArc = 0;
        List<ApertureNode> ordered = new ArrayList<>(size);
        for (Positioned p : positioned) {
            if (p.distance() < width) {
                inArc++;
            }
            ordered.add(p.node());
        }

        int bound = Math.min(size, Math.max(requested, inArc));
        return new Placement(ordered, bound, width);
    }

    /**
     * Placement depends only on addresses and the coordinate, never on status,
     * so a rebuild cannot improve on this snapshot until the topology changes.
     */
    @Override
    public boolean needsRebuild() {
        return false;
    }

    @Override
    public Map<String, Object> additionalMetadata() {
        Map<String, Object> metadata = super.additionalMetadata();
        metadata.put("coordinate", coordinate.instanceId() + "/" + coordinate.totalInstances());
        metadata.put("arcWidth", arcWidth);
        return metadata;
    }

    public Coordinate coordinate() {
        return coordinate;
    }

    public double arcWidth() {
        return arcWidth;
    }

    record Placement(List<ApertureNode> ordered, int bound, double arcWidth) {
    }

    private record Positioned(ApertureNode node, double distance) {
    }
}
