package fr.lapetina.aperture.domain.distributor;

import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Distributor installed while the resolved pool is empty.
 *
 * Every pick returns the synthetic failing node and the aggregate status is
 * CLOSED. A rebuild is driven by the next topology update, not by this snapshot.
 */
public final class EmptyDistributor implements Distributor {

    private final ApertureNode emptyNode;

    public EmptyDistributor(ApertureNode emptyNode) {
        this.emptyNode = Objects.requireNonNull(emptyNode, "emptyNode");
    }

    @Override
    public ApertureNode pick() {
        return emptyNode;
    }

    @Override
    public NodeStatus status() {
        return NodeStatus.CLOSED;
    }

    @Override
    public boolean needsRebuild() {
        return false;
    }

    @Override
    public Set<Integer> indices() {
        return Set.of();
    }

    @Override
    public List<ApertureNode> window() {
        return List.of();
    }

    @Override
    public Map<String, Object> additionalMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("nodes", "[]");
        return metadata;
    }
}
