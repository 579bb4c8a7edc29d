package fr.lapetina.aperture.infrastructure.metrics;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import fr.lapetina.aperture.domain.aperture.RebuildListener;
import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Aperture metrics using Micrometer.
 *
 * Provides:
 * - Logical aperture, window size and pool size gauges
 * - A window hash gauge: equal across processes exactly when they window the
 *   same addresses in the same order
 * - Rebuild counters per strategy
 * - Aggregate status gauge
 * - Prometheus exposition
 */
public final class ApertureMetrics implements RebuildListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApertureMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> rebuildCounters = new ConcurrentHashMap<>();

    private final AtomicInteger logicalAperture = new AtomicInteger(0);
    private final AtomicInteger windowSize = new AtomicInteger(0);
    private final AtomicInteger poolSize = new AtomicInteger(0);
    private final AtomicInteger windowHash = new AtomicInteger(0);

    public ApertureMetrics(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        Gauge.builder(prefix + "_logical_aperture", logicalAperture, AtomicInteger::get)
                .description("Requested aperture size")
                .register(registry);

        Gauge.builder(prefix + "_window_size", windowSize, AtomicInteger::get)
                .description("Number of nodes in the window")
                .register(registry);

        Gauge.builder(prefix + "_pool_size", poolSize, AtomicInteger::get)
                .description("Number of resolved nodes")
                .register(registry);

        Gauge.builder(prefix + "_window_hash", windowHash, AtomicInteger::get)
                .description("Hash of the windowed addresses")
                .register(registry);

        log.info("ApertureMetrics initialized with prefix: {}", prefix);
    }

    public ApertureMetrics() {
        this("aperture");
    }

    @Override
    public void onRebuild(RebuildEvent event) {
        List<ApertureNode> window = event.distributor().window();
        logicalAperture.set(event.logicalAperture());
        windowSize.set(window.size());
        poolSize.set(event.poolSize());
        windowHash.set(hashOf(window));

        String strategy = event.strategy().getLabel();
        rebuildCounters.computeIfAbsent(strategy, k ->
                Counter.builder(prefix + "_rebuilds_total")
                        .description("Total number of aperture rebuilds")
                        .tag("strategy", strategy)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the aggregate status of the window.
     */
    public void registerStatus(Supplier<NodeStatus> status) {
        Gauge.builder(prefix + "_status", status, s -> statusValue(s.get()))
                .description("Aggregate window status (0=CLOSED, 1=BUSY, 2=OPEN)")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Hash of the windowed addresses in order. Each address is prefixed with
     * its length so that distinct windows never concatenate to the same input.
     */
    static int hashOf(List<ApertureNode> window) {
        Hasher hasher = Hashing.murmur3_32_fixed().newHasher();
        for (ApertureNode node : window) {
            String address = node.address();
            hasher.putInt(address.length()).putString(address, StandardCharsets.UTF_8);
        }
        return hasher.hash().asInt();
    }

    static double statusValue(NodeStatus status) {
        return switch (status) {
            case OPEN -> 2;
            case BUSY -> 1;
            case CLOSED -> 0;
        };
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
