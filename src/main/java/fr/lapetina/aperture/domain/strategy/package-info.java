/**
 * Windowing strategies that turn a resolved pool into a distributor snapshot.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Ordering</th><th>Needs</th></tr>
 *   <tr><td>{@code random}</td><td>Token sort, then stable status partition</td><td>Nothing</td></tr>
 *   <tr><td>{@code deterministic}</td><td>Clockwise from the process offset on a hashed ring</td><td>A {@link fr.lapetina.aperture.domain.strategy.Coordinate}</td></tr>
 * </table>
 *
 * <p>Both share the {@link fr.lapetina.aperture.domain.strategy.DistributorBuilder}
 * signature so the controller can switch between them on every rebuild.
 *
 * @see fr.lapetina.aperture.domain.strategy.RandomAperture
 * @see fr.lapetina.aperture.domain.strategy.DeterministicAperture
 */
package fr.lapetina.aperture.domain.strategy;
