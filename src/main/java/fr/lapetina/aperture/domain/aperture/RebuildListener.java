package fr.lapetina.aperture.domain.aperture;

import fr.lapetina.aperture.domain.distributor.Distributor;
import fr.lapetina.aperture.domain.strategy.ApertureStrategy;

/**
 * Callback invoked after a new distributor snapshot is installed.
 */
@FunctionalInterface
public interface RebuildListener {

    void onRebuild(RebuildEvent event);

    /**
     * A completed rebuild.
     *
     * @param label           controller label
     * @param strategy        strategy that built the snapshot
     * @param logicalAperture requested window size (0 for an empty pool)
     * @param poolSize        number of resolved nodes
     * @param distributor     the installed snapshot
     */
    record RebuildEvent(
            String label,
            ApertureStrategy strategy,
            int logicalAperture,
            int poolSize,
            Distributor distributor
    ) {
    }
}
