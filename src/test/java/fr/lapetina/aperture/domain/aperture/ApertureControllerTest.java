package fr.lapetina.aperture.domain.aperture;

import fr.lapetina.aperture.domain.distributor.EmptyDistributor;
import fr.lapetina.aperture.domain.distributor.IndexSource;
import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NoCapacityException;
import fr.lapetina.aperture.domain.model.NodeStatus;
import fr.lapetina.aperture.domain.model.StubConnectionFactory;
import fr.lapetina.aperture.domain.strategy.ApertureStrategy;
import fr.lapetina.aperture.domain.strategy.Coordinate;
import fr.lapetina.aperture.domain.strategy.DeterministicAperture;
import fr.lapetina.aperture.domain.strategy.RandomAperture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static fr.lapetina.aperture.domain.model.StubConnectionFactory.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApertureControllerTest {

    private MutableSettings settings;
    private AtomicReference<Optional<Coordinate>> coordinate;

    @BeforeEach
    void setUp() {
        settings = new MutableSettings(1, 3, false, false);
        coordinate = new AtomicReference<>(Optional.empty());
    }

    private ApertureController controller() {
        return ApertureController.builder()
                .settings(settings)
                .coordinates(coordinate::get)
                .rng(IndexSource.seeded(11))
                .label("test")
                .build();
    }

    private static List<ApertureNode> pool(int size) {
        List<ApertureNode> nodes = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            nodes.add(node("node-" + i + ":80", i, NodeStatus.OPEN));
        }
        return nodes;
    }

    @Nested
    @DisplayName("empty pool")
    class EmptyPoolTests {

        @Test
        @DisplayName("should start with an empty distributor")
        void shouldStartEmpty() {
            ApertureController controller = controller();

            assertThat(controller.current()).isInstanceOf(EmptyDistributor.class);
            assertThat(controller.status()).isEqualTo(NodeStatus.CLOSED);
            assertThat(controller.getLogicalAperture()).isZero();
            assertThat(controller.getPoolSize()).isZero();
        }

        @Test
        @DisplayName("picking from an empty pool should yield a failing node")
        void pickShouldYieldFailingNode() {
            ApertureController controller = controller();
            controller.update(List.of());

            ApertureNode picked = controller.pick();

            assertThat(picked.status()).isEqualTo(NodeStatus.CLOSED);
            assertThat(picked.factory().connect())
                    .failsWithin(1, TimeUnit.SECONDS)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(NoCapacityException.class);
        }

        @Test
        @DisplayName("should use the configured exception for the failing node")
        void shouldUseConfiguredException() {
            ApertureController controller = ApertureController.builder()
                    .settings(settings)
                    .coordinates(coordinate::get)
                    .emptyException(() -> new IllegalStateException("no backends"))
                    .build();

            assertThat(controller.pick().factory().connect())
                    .failsWithin(1, TimeUnit.SECONDS)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(IllegalStateException.class)
                    .withMessageContaining("no backends");
        }

        @Test
        @DisplayName("should go back to empty when the pool is drained")
        void shouldReturnToEmpty() {
            ApertureController controller = controller();
            controller.update(pool(3));

            controller.update(List.of());

            assertThat(controller.current()).isInstanceOf(EmptyDistributor.class);
            assertThat(controller.window()).isEmpty();
            assertThat(controller.getLogicalAperture()).isZero();
        }

        @Test
        @DisplayName("should require settings")
        void shouldRequireSettings() {
            assertThatThrownBy(() -> ApertureController.builder().build())
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("strategy selection")
    class StrategySelectionTests {

        @Test
        @DisplayName("should use random aperture by default")
        void shouldUseRandomByDefault() {
            ApertureController controller = controller();

            controller.update(pool(5));

            assertThat(controller.current()).isInstanceOf(RandomAperture.class);
            assertThat(controller.getActiveStrategy()).isEqualTo(ApertureStrategy.RANDOM);
        }

        @Test
        @DisplayName("should use deterministic aperture when active and coordinated")
        void shouldUseDeterministic() {
            settings.daperture = true;
            coordinate.set(Optional.of(new Coordinate(0, 2)));
            ApertureController controller = controller();

            controller.update(pool(5));

            assertThat(controller.current()).isInstanceOf(DeterministicAperture.class);
            assertThat(controller.getActiveStrategy()).isEqualTo(ApertureStrategy.DETERMINISTIC);
        }

        @Test
        @DisplayName("should fall back to random aperture without a coordinate")
        void shouldFallBackWithoutCoordinate() {
            settings.daperture = true;
            ApertureController controller = controller();

            controller.update(pool(5));
            controller.rebuild();

            assertThat(controller.current()).isInstanceOf(RandomAperture.class);
        }

        @Test
        @DisplayName("should pick up a settings change on the next rebuild")
        void shouldRereadSettings() {
            coordinate.set(Optional.of(new Coordinate(1, 3)));
            ApertureController controller = controller();
            controller.update(pool(6));
            assertThat(controller.getActiveStrategy()).isEqualTo(ApertureStrategy.RANDOM);

            settings.daperture = true;
            controller.rebuild();

            assertThat(controller.getActiveStrategy()).isEqualTo(ApertureStrategy.DETERMINISTIC);
        }
    }

    @Nested
    @DisplayName("aperture sizing")
    class SizingTests {

        @Test
        @DisplayName("should start from the initial aperture")
        void shouldStartFromInitialAperture() {
            ApertureController controller = controller();

            controller.update(pool(5));

            assertThat(controller.getLogicalAperture()).isEqualTo(3);
            assertThat(controller.window()).hasSize(3);
            assertThat(controller.indices()).containsExactlyInAnyOrder(0, 1, 2);
        }

        @Test
        @DisplayName("should clamp the aperture to the pool size")
        void shouldClampToPoolSize() {
            settings.init = 10;
            ApertureController controller = controller();

            controller.update(pool(4));

            assertThat(controller.getLogicalAperture()).isEqualTo(4);
        }

        @Test
        @DisplayName("should sanitize a misconfigured minimum and initial aperture")
        void shouldSanitizeSettings() {
            settings.min = -2;
            settings.init = 0;
            ApertureController controller = controller();

            controller.update(pool(4));

            assertThat(controller.getLogicalAperture()).isEqualTo(1);
        }

        @Test
        @DisplayName("should raise the initial aperture to the minimum")
        void shouldRaiseInitToMin() {
            settings.min = 3;
            settings.init = 1;
            ApertureController controller = controller();

            controller.update(pool(5));

            assertThat(controller.getLogicalAperture()).isEqualTo(3);
        }

        @Test
        @DisplayName("a raised minimum should apply on the next rebuild")
        void raisedMinimumShouldApply() {
            ApertureController controller = controller();
            controller.update(pool(6));

            settings.min = 5;
            controller.rebuild();

            assertThat(controller.getLogicalAperture()).isEqualTo(5);
        }

        @Test
        @DisplayName("widen and narrow should stay within bounds")
        void widenAndNarrowShouldStayInBounds() {
            settings.min = 2;
            ApertureController controller = controller();
            controller.update(pool(4));

            assertThat(controller.widen()).isTrue();
            assertThat(controller.getLogicalAperture()).isEqualTo(4);
            assertThat(controller.widen()).isFalse();

            assertThat(controller.narrow()).isTrue();
            assertThat(controller.narrow()).isTrue();
            assertThat(controller.getLogicalAperture()).isEqualTo(2);
            assertThat(controller.narrow()).isFalse();
        }

        @Test
        @DisplayName("widen should do nothing on an empty pool")
        void widenShouldIgnoreEmptyPool() {
            ApertureController controller = controller();

            assertThat(controller.widen()).isFalse();
            assertThat(controller.narrow()).isFalse();
        }

        @Test
        @DisplayName("adjusted aperture should survive pool updates")
        void adjustedApertureShouldSurviveUpdates() {
            ApertureController controller = controller();
            controller.update(pool(6));
            controller.widen();

            controller.update(pool(8));

            assertThat(controller.getLogicalAperture()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("rebuildIfNeeded")
    class RebuildIfNeededTests {

        @Test
        @DisplayName("should rebuild once a BUSY node recovers")
        void shouldRebuildOnRecovery() {
            List<ApertureNode> nodes = pool(4);
            StubConnectionFactory.of(nodes.get(0)).setStatus(NodeStatus.BUSY);
            ApertureController controller = controller();
            controller.update(nodes);
            assertThat(controller.window()).doesNotContain(nodes.get(0));
            assertThat(controller.rebuildIfNeeded()).isFalse();

            StubConnectionFactory.of(nodes.get(0)).setStatus(NodeStatus.OPEN);

            assertThat(controller.needsRebuild()).isTrue();
            assertThat(controller.rebuildIfNeeded()).isTrue();
            assertThat(controller.window()).contains(nodes.get(0));
            assertThat(controller.needsRebuild()).isFalse();
        }
    }

    @Nested
    @DisplayName("eager connections")
    class EagerConnectionTests {

        @Test
        @DisplayName("should connect nodes entering the window only once")
        void shouldConnectNewlyWindowedNodes() {
            settings.eager = true;
            settings.init = 2;
            List<ApertureNode> nodes = pool(5);
            ApertureController controller = controller();

            controller.update(nodes);
            controller.rebuild();
            controller.widen();

            assertThat(nodes).extracting(n -> StubConnectionFactory.of(n).getConnectCount())
                    .containsExactly(1, 1, 1, 0, 0);
        }

        @Test
        @DisplayName("should not connect when eager connections are off")
        void shouldNotConnectWhenDisabled() {
            List<ApertureNode> nodes = pool(3);
            ApertureController controller = controller();

            controller.update(nodes);

            assertThat(nodes).extracting(n -> StubConnectionFactory.of(n).getConnectCount())
                    .containsOnly(0);
        }

        @Test
        @DisplayName("a failed eager connection should not fail the rebuild")
        void failedConnectionShouldNotFailRebuild() {
            settings.eager = true;
            List<ApertureNode> nodes = pool(3);
            StubConnectionFactory.of(nodes.get(0)).failConnectsWith(new IllegalStateException("refused"));
            ApertureController controller = controller();

            controller.update(nodes);

            assertThat(controller.window()).hasSize(3);
            assertThat(StubConnectionFactory.of(nodes.get(0)).getConnectCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("listeners")
    class ListenerTests {

        @Test
        @DisplayName("should notify listeners after each rebuild")
        void shouldNotifyListeners() {
            List<RebuildListener.RebuildEvent> events = new ArrayList<>();
            ApertureController controller = controller();
            controller.addListener(events::add);

            controller.update(pool(4));
            controller.update(List.of());

            assertThat(events).hasSize(2);
            assertThat(events.get(0).label()).isEqualTo("test");
            assertThat(events.get(0).poolSize()).isEqualTo(4);
            assertThat(events.get(0).logicalAperture()).isEqualTo(3);
            assertThat(events.get(0).strategy()).isEqualTo(ApertureStrategy.RANDOM);
            assertThat(events.get(1).distributor()).isInstanceOf(EmptyDistributor.class);
        }

        @Test
        @DisplayName("a failing listener should not stop the others")
        void failingListenerShouldNotStopOthers() {
            List<RebuildListener.RebuildEvent> events = new ArrayList<>();
            ApertureController controller = controller();
            controller.addListener(event -> {
                throw new IllegalStateException("boom");
            });
            controller.addListener(events::add);

            controller.update(pool(2));

            assertThat(events).hasSize(1);
            assertThat(controller.window()).hasSize(2);
        }

        @Test
        @DisplayName("removed listeners should not be notified")
        void removedListenerShouldNotBeNotified() {
            List<RebuildListener.RebuildEvent> events = new ArrayList<>();
            RebuildListener listener = events::add;
            ApertureController controller = controller();
            controller.addListener(listener);
            controller.removeListener(listener);

            controller.update(pool(2));

            assertThat(events).isEmpty();
        }
    }

    @Test
    @DisplayName("readers should always see a complete snapshot during rebuilds")
    void readersShouldSeeCompleteSnapshots() throws Exception {
        ApertureController controller = controller();
        controller.update(pool(5));
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(4);
        ExecutorService executor = Executors.newFixedThreadPool(4);

        try {
            for (int t = 0; t < 4; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < 5_000; i++) {
                            ApertureNode picked = controller.pick();
                            assertThat(picked.status()).isEqualTo(NodeStatus.OPEN);
                        }
                    } catch (Throwable e) {
                        errors.add(e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            for (int i = 0; i < 200; i++) {
                controller.update(pool(2 + i % 6));
            }
            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        assertThat(errors).isEmpty();
    }

    /**
     * Settings whose values can be changed between rebuilds.
     */
    static final class MutableSettings implements ApertureSettings {
        volatile int min;
        volatile int init;
        volatile boolean daperture;
        volatile boolean eager;

        MutableSettings(int min, int init, boolean daperture, boolean eager) {
            this.min = min;
            this.init = init;
            this.daperture = daperture;
            this.eager = eager;
        }

        @Override
        public int minAperture() {
            return min;
        }

        @Override
        public int initAperture() {
            return init;
        }

        @Override
        public boolean dapertureActive() {
            return daperture;
        }

        @Override
        public boolean eagerConnections() {
            return eager;
        }
    }
}
