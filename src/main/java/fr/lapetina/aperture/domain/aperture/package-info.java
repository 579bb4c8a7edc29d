/**
 * Aperture control: owning the current snapshot, rebuilding it and sizing it.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aperture.domain.aperture.ApertureController} - Selects the strategy and swaps snapshots</li>
 *   <li>{@link fr.lapetina.aperture.domain.aperture.ApertureSettings} - Live settings, re-read per rebuild</li>
 *   <li>{@link fr.lapetina.aperture.domain.aperture.LoadBand} - Widens or narrows the aperture from load</li>
 *   <li>{@link fr.lapetina.aperture.domain.aperture.RebuildListener} - Notified after each rebuild</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ApertureController controller = ApertureController.builder()
 *         .settings(ApertureSettings.of(1, 3, false, true))
 *         .build();
 * controller.update(nodes);
 * ApertureNode node = controller.pick();
 * }</pre>
 */
package fr.lapetina.aperture.domain.aperture;
