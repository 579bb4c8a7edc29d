/**
 * Node pool tracking and the background tasks that keep the aperture current.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aperture.infrastructure.health.NodeRegistry} - Resolved nodes keyed by address, with change events</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.health.NodeHealthChecker} - TCP probing mapped to node status</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.health.RebuildScheduler} - Polls for recoveries that warrant a rebuild</li>
 * </ul>
 */
package fr.lapetina.aperture.infrastructure.health;
