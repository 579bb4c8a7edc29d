package fr.lapetina.aperture.domain.strategy;

import fr.lapetina.aperture.domain.distributor.Distributor;
import fr.lapetina.aperture.domain.model.ApertureNode;

import java.util.List;

/**
 * Builds a distributor snapshot from the resolved pool and the logical aperture.
 */
@FunctionalInterface
public interface DistributorBuilder {

    /**
     * @param vector          resolved nodes, never empty
     * @param logicalAperture requested window size, already clamped to the pool
     */
    Distributor build(List<ApertureNode> vector, int logicalAperture);
}
