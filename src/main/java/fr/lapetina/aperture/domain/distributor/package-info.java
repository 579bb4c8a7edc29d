/**
 * Immutable distributor snapshots and the P2C picker they delegate to.
 *
 * <p>A {@link fr.lapetina.aperture.domain.distributor.Distributor} is built once per
 * rebuild and never mutated, so concurrent {@code pick()} calls need no locking.
 * Picking is composed in through {@link fr.lapetina.aperture.domain.distributor.NodePicker}
 * rather than inherited.
 *
 * @see fr.lapetina.aperture.domain.distributor.BaseDistributor
 * @see fr.lapetina.aperture.domain.distributor.P2CPicker
 */
package fr.lapetina.aperture.domain.distributor;
