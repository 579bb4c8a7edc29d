package fr.lapetina.aperture.domain.distributor;

import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Common state of an aperture distributor: an ordered vector whose first
 * {@code bound} entries form the window, a P2C picker over that window and
 * the synthetic node returned when the window is empty.
 *
 * Subclasses decide the ordering and the bound before calling this constructor.
 */
public abstract class BaseDistributor implements Distributor {

    private final List<ApertureNode> vector;
    private final int bound;
    private final ApertureNode emptyNode;
    private final NodePicker picker;
    private final Set<Integer> indices;

    protected BaseDistributor(
            List<ApertureNode> vector,
            int bound,
            ApertureNode emptyNode,
            IndexSource rng
    ) {
        this.vector = List.copyOf(requireNonEmpty(vector));
        if (bound < 0 || bound > this.vector.size()) {
            throw new IllegalArgumentException(
                    "bound must be in [0, " + this.vector.size() + "], got " + bound);
        }
        this.bound = bound;
        this.emptyNode = Objects.requireNonNull(emptyNode, "emptyNode");
        this.picker = bound == 0 ? null : new P2CPicker(this.vector, bound, rng);
        this.indices = IntStream.range(0, bound).boxed().collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Rejects an empty vector. An empty pool reaching a strategy means the
     * resolver is misconfigured.
     */
    protected static List<ApertureNode> requireNonEmpty(List<ApertureNode> vector) {
        if (vector == null || vector.isEmpty()) {
            throw new IllegalArgumentException("vector must be non empty");
        }
        return vector;
    }

    @Override
    public ApertureNode pick() {
        if (picker == null) {
            return emptyNode;
        }
        return picker.pick();
    }

    @Override
    public NodeStatus status() {
        NodeStatus status = NodeStatus.CLOSED;
        for (int i = 0; i < bound && status != NodeStatus.OPEN; i++) {
            status = NodeStatus.best(status, vector.get(i).status());
        }
        return status;
    }

    @Override
    public Set<Integer> indices() {
        return indices;
    }

    @Override
    public List<ApertureNode> window() {
        return vector.subList(0, bound);
    }

    @Override
    public Map<String, Object> additionalMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("nodes", windowAsString());
        return metadata;
    }

    /**
     * The full ordered vector, window first.
     */
    public List<ApertureNode> vector() {
        return vector;
    }

    public int bound() {
        return bound;
    }

    protected ApertureNode emptyNode() {
        return emptyNode;
    }

    protected String windowAsString() {
        return window().stream()
                .map(ApertureNode::address)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
