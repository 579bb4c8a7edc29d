package fr.lapetina.aperture.domain.aperture;

import fr.lapetina.aperture.domain.distributor.Distributor;
import fr.lapetina.aperture.domain.distributor.EmptyDistributor;
import fr.lapetina.aperture.domain.distributor.IndexSource;
import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NoCapacityException;
import fr.lapetina.aperture.domain.model.NodeStatus;
import fr.lapetina.aperture.domain.strategy.ApertureStrategy;
import fr.lapetina.aperture.domain.strategy.Coordinate;
import fr.lapetina.aperture.domain.strategy.DeterministicAperture;
import fr.lapetina.aperture.domain.strategy.DistributorBuilder;
import fr.lapetina.aperture.domain.strategy.ProcessCoordinate;
import fr.lapetina.aperture.domain.strategy.RandomAperture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the current distributor snapshot and rebuilds it.
 *
 * A rebuild re-reads {@link ApertureSettings}, selects the windowing strategy,
 * builds a new immutable snapshot from the latest resolved pool and swaps it
 * in atomically. Rebuilds and aperture adjustments are serialized; reads
 * ({@link #pick()}, {@link #status()}, {@link #needsRebuild()}) go straight to
 * the current snapshot without locking.
 *
 * Thread-safe.
 */
public final class ApertureController implements Distributor {

    private static final Logger log = LoggerFactory.getLogger(ApertureController.class);

    private static final int UNSET = -1;

    private final ApertureSettings settings;
    private final Supplier<Optional<Coordinate>> coordinates;
    private final Function<Throwable, ApertureNode> failingNode;
    private final Supplier<? extends Throwable> emptyException;
    private final IndexSource rng;
    private final String label;
    private final List<RebuildListener> listeners = new CopyOnWriteArrayList<>();

    private final Object rebuildLock = new Object();
    private final AtomicReference<Distributor> current;

    private volatile List<ApertureNode> nodes = List.of();
    private volatile ApertureStrategy activeStrategy = ApertureStrategy.RANDOM;
    private volatile int logicalAperture;
    private volatile boolean warnedMissingCoordinate;

    // Target window size, adjusted by widen/narrow. Guarded by rebuildLock.
    private int aperture = UNSET;

    private ApertureController(Builder builder) {
        this.settings = Objects.requireNonNull(builder.settings, "Aperture settings are required");
        this.coordinates = builder.coordinates;
        this.failingNode = builder.failingNode;
        this.emptyException = builder.emptyException;
        this.rng = builder.rng;
        this.label = builder.label;
        this.current = new AtomicReference<>(new EmptyDistributor(emptyNode()));
    }

    /**
     * Replaces the resolved pool and rebuilds.
     */
    public Distributor update(List<ApertureNode> resolved) {
        synchronized (rebuildLock) {
            this.nodes = List.copyOf(resolved);
            return rebuild();
        }
    }

    /**
     * Rebuilds from the latest resolved pool and installs the result.
     *
     * @return the installed snapshot
     */
    public Distributor rebuild() {
        return rebuild(Level.INFO);
    }

    private Distributor rebuild(Level level) {
        synchronized (rebuildLock) {
            List<ApertureNode> pool = nodes;
            Distributor next;
            ApertureStrategy strategy = ApertureStrategy.RANDOM;
            int requested = 0;

            if (pool.isEmpty()) {
                next = new EmptyDistributor(emptyNode());
            } else {
                int min = minAperture();
                requested = clampAperture(targetAperture(min), min, pool.size());
                Optional<Coordinate> coordinate = coordinates.get();
                boolean daperture = settings.dapertureActive();
                strategy = ApertureStrategy.select(daperture, coordinate);
                if (daperture && coordinate.isEmpty() && !warnedMissingCoordinate) {
                    warnedMissingCoordinate = true;
                    log.warn("Deterministic aperture requested without a process coordinate, " +
                            "falling back to random aperture: label={}", label);
                }
                next = builderFor(strategy, coordinate).build(pool, requested);
            }

            Distributor previous = current.getAndSet(next);
            activeStrategy = strategy;
            logicalAperture = requested;

            log.atLevel(level).log("Aperture rebuilt: label={}, strategy={}, aperture={}, window={}, poolSize={}",
                    label, strategy.getLabel(), requested, next.window().size(), pool.size());

            if (settings.eagerConnections()) {
                connectNewlyWindowed(previous.window(), next.window());
            }
            notifyListeners(new RebuildListener.RebuildEvent(label, strategy, requested, pool.size(), next));
            return next;
        }
    }

    /**
     * Rebuilds if the current snapshot asks for it.
     *
     * @return true if a rebuild happened
     */
    public boolean rebuildIfNeeded() {
        if (!current.get().needsRebuild()) {
            return false;
        }
        log.debug("Snapshot requested rebuild: label={}", label);
        rebuild();
        return true;
    }

    /**
     * Grows the logical aperture by one node, up to the pool size.
     *
     * @return true if the aperture changed
     */
    public boolean widen() {
        return adjust(1, Level.INFO);
    }

    /**
     * Shrinks the logical aperture by one node, down to the minimum aperture.
     *
     * @return true if the aperture changed
     */
    public boolean narrow() {
        return adjust(-1, Level.INFO);
    }

    /**
     * Load-driven adjustment, called from the request path. Logged at DEBUG
     * since it can fire on every request.
     */
    boolean adjustForLoad(int delta) {
        return adjust(delta, Level.DEBUG);
    }

    private boolean adjust(int delta, Level level) {
        synchronized (rebuildLock) {
            int size = nodes.size();
            if (size == 0) {
                return false;
            }
            int min = minAperture();
            int before = clampAperture(targetAperture(min), min, size);
            int after = clampAperture(before + delta, min, size);
            if (after == before) {
                return false;
            }
            aperture = after;
            log.debug("Aperture adjusted: label={}, {} -> {}", label, before, after);
            rebuild(level);
            return true;
        }
    }

    private DistributorBuilder builderFor(ApertureStrategy strategy, Optional<Coordinate> coordinate) {
        ApertureNode emptyNode = emptyNode();
        return switch (strategy) {
            case DETERMINISTIC -> {
                Coordinate coord = coordinate.orElseThrow();
                yield (vector, bound) -> new DeterministicAperture(vector, bound, coord, emptyNode, rng, label);
            }
            case RANDOM -> (vector, bound) -> new RandomAperture(vector, bound, emptyNode, rng, label);
        };
    }

    private int minAperture() {
        return Math.max(1, settings.minAperture());
    }

    private int targetAperture(int min) {
        if (aperture == UNSET) {
            aperture = Math.max(min, settings.initAperture());
        }
        return aperture;
    }

    private static int clampAperture(int value, int min, int size) {
        return Math.max(1, Math.min(Math.max(value, min), size));
    }

    private ApertureNode emptyNode() {
        return failingNode.apply(emptyException.get());
    }

    private void connectNewlyWindowed(List<ApertureNode> before, List<ApertureNode> after) {
        Set<ApertureNode> alreadyWindowed = new HashSet<>(before);
        for (ApertureNode node : after) {
            if (alreadyWindowed.contains(node)) {
                continue;
            }
            try {
                node.factory().connect().whenComplete((ignored, ex) -> {
                    if (ex != null) {
                        log.warn("Eager connection failed: label={}, address={}, error={}",
                                label, node.address(), ex.getMessage());
                    } else {
                        log.debug("Eager connection established: label={}, address={}", label, node.address());
                    }
                });
            } catch (RuntimeException e) {
                log.warn("Eager connection failed: label={}, address={}", label, node.address(), e);
            }
        }
    }

    private void notifyListeners(RebuildListener.RebuildEvent event) {
        for (RebuildListener listener : listeners) {
            try {
                listener.onRebuild(event);
            } catch (Exception e) {
                log.error("Error notifying rebuild listener", e);
            }
        }
    }

    public void addListener(RebuildListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RebuildListener listener) {
        listeners.remove(listener);
    }

    // ==================== Distributor view of the current snapshot ====================

    @Override
    public ApertureNode pick() {
        return current.get().pick();
    }

    @Override
    public NodeStatus status() {
        return current.get().status();
    }

    @Override
    public boolean needsRebuild() {
        return current.get().needsRebuild();
    }

    @Override
    public Set<Integer> indices() {
        return current.get().indices();
    }

    @Override
    public List<ApertureNode> window() {
        return current.get().window();
    }

    @Override
    public Map<String, Object> additionalMetadata() {
        return current.get().additionalMetadata();
    }

    /**
     * Returns the installed snapshot.
     */
    public Distributor current() {
        return current.get();
    }

    public ApertureStrategy getActiveStrategy() {
        return activeStrategy;
    }

    /**
     * Logical aperture of the installed snapshot, 0 while the pool is empty.
     */
    public int getLogicalAperture() {
        return logicalAperture;
    }

    public int getPoolSize() {
        return nodes.size();
    }

    public String getLabel() {
        return label;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ApertureSettings settings;
        private Supplier<Optional<Coordinate>> coordinates = ProcessCoordinate::current;
        private Function<Throwable, ApertureNode> failingNode = ApertureNode::failing;
        private Supplier<? extends Throwable> emptyException = NoCapacityException::new;
        private IndexSource rng = IndexSource.threadLocal();
        private String label = "default";

        public Builder settings(ApertureSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder coordinates(Supplier<Optional<Coordinate>> coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder failingNode(Function<Throwable, ApertureNode> failingNode) {
            this.failingNode = failingNode;
            return this;
        }

        public Builder emptyException(Supplier<? extends Throwable> emptyException) {
            this.emptyException = emptyException;
            return this;
        }

        public Builder rng(IndexSource rng) {
            this.rng = rng;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public ApertureController build() {
            return new ApertureController(this);
        }
    }
}
