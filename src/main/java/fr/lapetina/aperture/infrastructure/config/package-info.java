/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing and runtime configuration updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aperture.infrastructure.config.ApertureConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.config.ConfigApertureSettings} - Live aperture settings for the controller</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code aperture} - Minimum and initial aperture, strategy and eager-connection flags</li>
 *   <li>{@code coordinate} - This process's position on the shared ring</li>
 *   <li>{@code loadBand} - Load thresholds driving aperture size</li>
 *   <li>{@code rebuild} - Rebuild polling interval</li>
 *   <li>{@code health} - TCP probe settings</li>
 *   <li>{@code admin} - Admin HTTP server</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code nodes} - Statically resolved backend addresses</li>
 * </ul>
 *
 * @see fr.lapetina.aperture.infrastructure.config.ConfigLoader
 */
package fr.lapetina.aperture.infrastructure.config;
