package fr.lapetina.aperture.domain.distributor;

import fr.lapetina.aperture.domain.model.ApertureNode;

/**
 * Selects one node from a fixed window.
 */
@FunctionalInterface
public interface NodePicker {

    ApertureNode pick();
}
