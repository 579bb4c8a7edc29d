/**
 * Aperture Balancer - an aperture-based connection distributor with P2C selection.
 *
 * <p>A client-side balancer that keeps a bounded window ("aperture") of backend nodes
 * out of a larger resolved pool and picks among them with power-of-two-choices.
 *
 * <h2>Architecture Overview</h2>
 * <pre>
 *   NodeRegistry ──events──▶ ApertureController ──rebuild──▶ RandomAperture | DeterministicAperture
 *        ▲                         │    ▲                              │
 *   NodeHealthChecker          pick()  RebuildScheduler (needsRebuild) │
 *                                  ▼                                   ▼
 *                            dispatch loop ◀──────────── immutable Distributor snapshot
 * </pre>
 *
 * <h2>Package Structure</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aperture.domain.model} - Nodes, statuses and connection factories</li>
 *   <li>{@link fr.lapetina.aperture.domain.distributor} - Immutable snapshots and P2C picking</li>
 *   <li>{@link fr.lapetina.aperture.domain.strategy} - Random and deterministic windowing</li>
 *   <li>{@link fr.lapetina.aperture.domain.aperture} - Controller, settings and load band</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.config} - YAML configuration with hot reload</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.health} - Node registry, probing and rebuild polling</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.metrics} - Micrometer/Prometheus metrics</li>
 *   <li>{@link fr.lapetina.aperture.infrastructure.net} - TCP connection factory</li>
 *   <li>{@link fr.lapetina.aperture.api} - Admin HTTP endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BalancerFactory factory = BalancerFactory.create("config.yaml").start()) {
 *     ApertureNode node = factory.getController().pick();
 * }
 * }</pre>
 *
 * @see fr.lapetina.aperture.BalancerFactory
 * @see fr.lapetina.aperture.domain.aperture.ApertureController
 */
package fr.lapetina.aperture;
