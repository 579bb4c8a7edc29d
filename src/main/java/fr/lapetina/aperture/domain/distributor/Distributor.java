package fr.lapetina.aperture.domain.distributor;

import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable snapshot of the nodes eligible for selection.
 *
 * A distributor is built by a rebuild and replaced, never mutated, when the
 * topology or node health changes. All methods are non-blocking and safe for
 * concurrent use.
 */
public interface Distributor {

    /**
     * Selects a node for the next request. Never returns null and never throws
     * for lack of capacity: when the window is empty a synthetic node is
     * returned whose connection attempts fail.
     */
    ApertureNode pick();

    /**
     * Aggregate health of the window: OPEN if any in-window node is OPEN,
     * otherwise BUSY if any is BUSY, otherwise CLOSED.
     */
    NodeStatus status();

    /**
     * Returns true when the snapshot has observed a change that a rebuild
     * would act upon.
     */
    boolean needsRebuild();

    /**
     * Indices of the in-window nodes, always {@code {0, ..., bound - 1}}.
     */
    Set<Integer> indices();

    /**
     * The in-window nodes in vector order.
     */
    List<ApertureNode> window();

    /**
     * Diagnostic metadata, containing at least {@code "nodes"}: the formatted
     * list of in-window addresses.
     */
    Map<String, Object> additionalMetadata();
}
