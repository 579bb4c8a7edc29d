package fr.lapetina.aperture.domain.model;

import java.util.concurrent.CompletableFuture;

/**
 * Transport-side handle for a single backend endpoint.
 *
 * Implementations own the node's live health and load; the distributor only
 * reads them. Must be thread-safe.
 */
public interface ConnectionFactory {

    /**
     * Returns the endpoint address, used for logging and ring placement.
     */
    String address();

    /**
     * Returns the current health of the endpoint.
     */
    NodeStatus status();

    /**
     * Returns a live load signal, lower is better. Used to break status ties
     * between two sampled nodes.
     */
    default int load() {
        return 0;
    }

    /**
     * Establishes a connection to the endpoint.
     *
     * @return future completing when the connection is ready, or exceptionally
     *         if it could not be established
     */
    CompletableFuture<Void> connect();
}
