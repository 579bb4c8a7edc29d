package fr.lapetina.aperture.domain.strategy;

import fr.lapetina.aperture.domain.distributor.BaseDistributor;
import fr.lapetina.aperture.domain.distributor.IndexSource;
import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Aperture distributor without fleet coordination.
 *
 * The vector is sorted by node token, which is stable across rebuilds of the
 * same pool but differs between processes since tokens are drawn randomly when
 * a node is created. Clients sharing a pool therefore pick different windows
 * and do not concentrate load on the same servers. Servers still land in a
 * given window with binomial probability; see {@link DeterministicAperture}
 * when the fleet size is known.
 *
 * After the token sort the vector is partitioned by status so that healthy
 * nodes fill the window first.
 */
public final class RandomAperture extends BaseDistributor {

    private static final Logger log = LoggerFactory.getLogger(RandomAperture.class);

    private static final Comparator<ApertureNode> BY_TOKEN = Comparator.comparingInt(ApertureNode::token);

    private final List<ApertureNode> busy;

    public RandomAperture(
            List<ApertureNode> vector,
            int logicalAperture,
            ApertureNode emptyNode,
            IndexSource rng,
            String label
    ) {
        this(statusOrder(sortByToken(requireNonEmpty(vector))), logicalAperture, emptyNode, rng, label);
    }

    private RandomAperture(
            Ordering ordering,
            int logicalAperture,
            ApertureNode emptyNode,
            IndexSource rng,
            String label
    ) {
        super(ordering.ordered(), clamp(logicalAperture, ordering.ordered().size()), emptyNode, rng);
        this.busy = ordering.busy();

        if (log.isDebugEnabled()) {
            log.debug("[RandomAperture.rebuild {}] nodes={}", label, windowAsString());
        }
    }

    /**
     * Returns a copy of {@code vector} sorted ascending by token. Stable.
     */
    static List<ApertureNode> sortByToken(List<ApertureNode> vector) {
        List<ApertureNode> sorted = new ArrayList<>(vector);
        sorted.sort(BY_TOKEN);
        return sorted;
    }

    /**
     * Groups {@code vector} as [OPEN][BUSY][CLOSED], each group keeping the
     * relative order it had in {@code vector}. Each node's status is read once;
     * the BUSY group doubles as the set watched by {@link #needsRebuild()}.
     */
    static Ordering statusOrder(List<ApertureNode> vector) {
        List<ApertureNode> ordered = new ArrayList<>(vector.size());
        List<ApertureNode> busyNodes = new ArrayList<>();
        List<ApertureNode> closedNodes = new ArrayList<>();

        for (ApertureNode node : vector) {
            switch (node.status()) {
                case OPEN -> ordered.add(node);
                case BUSY -> busyNodes.add(node);
                case CLOSED -> closedNodes.add(node);
            }
        }

        ordered.addAll(busyNodes);
        ordered.addAll(closedNodes);
        return new Ordering(ordered, List.copyOf(busyNodes));
    }

    static int clamp(int logicalAperture, int size) {
        return Math.max(1, Math.min(logicalAperture, size));
    }

    /**
     * True as soon as a node that was BUSY when this snapshot was built is OPEN
     * again, so the stable ordering can be restored.
     *
     * Only the captured subset is checked. Recoveries of nodes that were CLOSED
     * at build time are left to P2C and to whatever watches {@link #status()}.
     */
    @Override
    public boolean needsRebuild() {
        for (ApertureNode node : busy) {
            if (node.status() == NodeStatus.OPEN) {
                return true;
            }
        }
        return false;
    }

    record Ordering(List<ApertureNode> ordered, List<ApertureNode> busy) {
    }
}
