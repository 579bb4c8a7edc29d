package fr.lapetina.aperture.infrastructure.health;

import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of resolved nodes, keyed by address.
 *
 * Thread-safe storage and access for the node pool. Node instances are kept
 * across updates so that their tokens, and therefore their positions in a
 * random aperture, stay stable.
 */
public final class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, ApertureNode> nodes = new ConcurrentHashMap<>();
    private final List<Consumer<NodeRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new node or replaces the node at the same address.
     */
    public void registerNode(ApertureNode node) {
        ApertureNode previous = nodes.put(node.address(), node);
        if (previous == null) {
            log.info("Node registered: {}", node);
            notifyListeners(new NodeRegistryEvent(NodeRegistryEvent.Type.ADDED, node));
        } else {
            log.info("Node updated: {}", node);
            notifyListeners(new NodeRegistryEvent(NodeRegistryEvent.Type.UPDATED, node));
        }
    }

    /**
     * Removes a node by address.
     */
    public ApertureNode removeNode(String address) {
        ApertureNode removed = nodes.remove(address);
        if (removed != null) {
            log.info("Node removed: {}", removed);
            notifyListeners(new NodeRegistryEvent(NodeRegistryEvent.Type.REMOVED, removed));
        }
        return removed;
    }

    /**
     * Gets a node by address.
     */
    public Optional<ApertureNode> getNode(String address) {
        return Optional.ofNullable(nodes.get(address));
    }

    /**
     * Gets all registered nodes.
     */
    public List<ApertureNode> getAllNodes() {
        return new ArrayList<>(nodes.values());
    }

    /**
     * Announces that a node's status changed. The status itself lives in the
     * node's connection factory.
     */
    public void statusChanged(String address, NodeStatus previous, NodeStatus current) {
        ApertureNode node = nodes.get(address);
        if (node != null && previous != current) {
            log.info("Node status changed: address={}, {} -> {}", address, previous, current);
            notifyListeners(new NodeRegistryEvent(NodeRegistryEvent.Type.STATUS_CHANGED, node));
        }
    }

    /**
     * Replaces all nodes with a new set, as a single change.
     *
     * Addresses already registered keep their existing node instance. Listeners
     * receive one REPLACED event instead of one event per node.
     */
    public void replaceAll(Collection<ApertureNode> newNodes) {
        Set<String> newAddresses = new HashSet<>();

        for (ApertureNode node : newNodes) {
            newAddresses.add(node.address());
            nodes.putIfAbsent(node.address(), node);
        }

        // Remove nodes that are no longer resolved
        nodes.keySet().removeIf(address -> !newAddresses.contains(address));

        log.info("Node registry replaced: {} nodes", nodes.size());
        notifyListeners(new NodeRegistryEvent(NodeRegistryEvent.Type.REPLACED, null));
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<NodeRegistryEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Removes a listener.
     */
    public void removeListener(Consumer<NodeRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(NodeRegistryEvent event) {
        for (Consumer<NodeRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    /**
     * Returns the number of registered nodes.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Event for node registry changes. {@code node} is null for REPLACED.
     */
    public record NodeRegistryEvent(Type type, ApertureNode node) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            STATUS_CHANGED,
            REPLACED
        }
    }
}
