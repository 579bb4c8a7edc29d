/**
 * Node model shared by every distributor.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aperture.domain.model.ApertureNode} - Immutable node with a stable random token</li>
 *   <li>{@link fr.lapetina.aperture.domain.model.ConnectionFactory} - Live status, load and connection establishment</li>
 *   <li>{@link fr.lapetina.aperture.domain.model.NodeStatus} - Node health states (OPEN, BUSY, CLOSED)</li>
 *   <li>{@link fr.lapetina.aperture.domain.model.NoCapacityException} - Failure carried by the synthetic no-capacity node</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code ApertureNode} is immutable. {@code ConnectionFactory} implementations
 * must tolerate concurrent status reads from many picking threads.
 */
package fr.lapetina.aperture.domain.model;
