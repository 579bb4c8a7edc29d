package fr.lapetina.aperture.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {

        @Test
        @DisplayName("should load the configuration from the classpath")
        void shouldLoadFromClasspath() {
            try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
                ApertureConfig config = loader.load();

                assertThat(config.getLabel()).isEqualTo("test");
                assertThat(config.getAperture().getMinAperture()).isEqualTo(2);
                assertThat(config.getAperture().getInitAperture()).isEqualTo(4);
                assertThat(config.getAperture().isDapertureActive()).isTrue();
                assertThat(config.getAperture().isEagerConnections()).isFalse();
                assertThat(config.getCoordinate().isConfigured()).isTrue();
                assertThat(config.getCoordinate().getInstanceId()).isEqualTo(1);
                assertThat(config.getHealth().getBusyThreshold()).isEqualTo(2);
                assertThat(config.getMetrics().getPrefix()).isEqualTo("test_aperture");
                assertThat(config.getNodes()).extracting(ApertureConfig.NodeConfig::getAddress)
                        .containsExactly("127.0.0.1:1", "127.0.0.1:2", "127.0.0.1:3");
                assertThat(loader.getCurrentConfig()).isSameAs(config);
            }
        }

        @Test
        @DisplayName("should load the configuration from a file")
        void shouldLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("aperture.yaml");
            Files.writeString(file, "label: from-file\nnodes:\n  - address: \"db-1:5432\"\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                ApertureConfig config = loader.load();

                assertThat(config.getLabel()).isEqualTo("from-file");
                assertThat(config.getNodes()).hasSize(1);
            }
        }

        @Test
        @DisplayName("should fill missing sections with defaults")
        void shouldApplyDefaults() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");

            ApertureConfig config = loader.loadFromStream(yaml("label: partial\n"));

            assertThat(config.getAperture().getMinAperture()).isEqualTo(1);
            assertThat(config.getAperture().getInitAperture()).isEqualTo(3);
            assertThat(config.getAperture().isEagerConnections()).isTrue();
            assertThat(config.getCoordinate().isConfigured()).isFalse();
            assertThat(config.getNodes()).isEmpty();
        }

        @Test
        @DisplayName("an empty document should yield the defaults")
        void emptyDocumentShouldYieldDefaults() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");

            ApertureConfig config = loader.loadFromStream(yaml(""));

            assertThat(config.getLabel()).isEqualTo("default");
        }
    }

    @Nested
    @DisplayName("errors")
    class ErrorTests {

        @Test
        @DisplayName("should fail when the file cannot be found")
        void shouldFailOnMissingFile() {
            ConfigLoader loader = new ConfigLoader("does-not-exist.yaml");

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("aperture: [unclosed")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject an instance id outside the fleet")
        void shouldRejectInvalidCoordinate() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(
                    yaml("coordinate:\n  instanceId: 4\n  totalInstances: 4\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("instanceId");
        }

        @Test
        @DisplayName("should reject a node without address")
        void shouldRejectNodeWithoutAddress() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("nodes:\n  - address: \"\"\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("address");
        }

        @Test
        @DisplayName("a failed reload should keep the current configuration")
        void failedReloadShouldKeepCurrent(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("aperture.yaml");
            Files.writeString(file, "label: first\n");

            try (ConfigLoader loader = new ConfigLoader(file.toString())) {
                ApertureConfig first = loader.load();
                Files.writeString(file, "coordinate:\n  instanceId: 9\n  totalInstances: 2\n");

                assertThat(loader.reload()).isSameAs(first);
                assertThat(loader.getCurrentConfig()).isSameAs(first);
            }
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        private final ConfigLoader loader = new ConfigLoader("unused.yaml");

        @Test
        @DisplayName("should reject an address without port")
        void shouldRejectAddressWithoutPort() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("nodes:\n  - address: \"nohost\"\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("nodes[0] address must be host:port");
            assertThat(loader.getCurrentConfig()).isNull();
        }

        @Test
        @DisplayName("should reject an unparseable address")
        void shouldRejectUnparseableAddress() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("nodes:\n  - address: \"host:notaport\"\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("host:notaport");
        }

        @Test
        @DisplayName("should reject duplicate addresses")
        void shouldRejectDuplicateAddresses() {
            assertThatThrownBy(() -> loader.loadFromStream(
                    yaml("nodes:\n  - address: \"a:80\"\n  - address: \"a:80\"\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("duplicates");
        }

        @Test
        @DisplayName("should reject empty sections")
        void shouldRejectEmptySections() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("nodes:\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("'nodes'");
            assertThatThrownBy(() -> loader.loadFromStream(yaml("health:\nmetrics:\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("'health'")
                    .hasMessageContaining("'metrics'");
        }

        @Test
        @DisplayName("should reject inconsistent health thresholds")
        void shouldRejectHealthThresholds() {
            assertThatThrownBy(() -> loader.loadFromStream(
                    yaml("health:\n  busyThreshold: 4\n  closedThreshold: 2\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("busyThreshold");
        }

        @Test
        @DisplayName("should reject an enabled load band with inverted marks")
        void shouldRejectInvertedLoadBand() {
            assertThatThrownBy(() -> loader.loadFromStream(
                    yaml("loadBand:\n  lowLoad: 3.0\n  highLoad: 1.0\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("lowLoad");

            ApertureConfig disabled = loader.loadFromStream(
                    yaml("loadBand:\n  enabled: false\n  lowLoad: 3.0\n  highLoad: 1.0\n"));
            assertThat(disabled.getLoadBand().isEnabled()).isFalse();
        }

        @Test
        @DisplayName("should report every problem at once")
        void shouldReportEveryProblem() {
            assertThatThrownBy(() -> loader.loadFromStream(yaml(
                    "rebuild:\n  pollIntervalMs: 0\nadmin:\n  port: 70000\nnodes:\n  - address: \"nohost\"\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("pollIntervalMs")
                    .hasMessageContaining("admin.port")
                    .hasMessageContaining("nohost");
        }

        @Test
        @DisplayName("should accept aperture sizes the controller corrects")
        void shouldAcceptCorrectableApertureSizes() {
            ApertureConfig config = loader.loadFromStream(
                    yaml("aperture:\n  minAperture: 0\n  initAperture: -3\n"));

            assertThat(config.getAperture().getMinAperture()).isZero();
        }

        @Test
        @DisplayName("a rejected reload should keep every installed setting")
        void rejectedReloadShouldKeepSettings(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("aperture.yaml");
            Files.writeString(file, "aperture:\n  minAperture: 1\nnodes:\n  - address: \"a:80\"\n");

            try (ConfigLoader fileLoader = new ConfigLoader(file.toString())) {
                ConfigApertureSettings settings = new ConfigApertureSettings(fileLoader);
                List<ApertureConfig> notified = new ArrayList<>();
                fileLoader.load();
                fileLoader.addListener((oldConfig, newConfig) -> notified.add(newConfig));

                Files.writeString(file, "aperture:\n  minAperture: 2\nnodes:\n  - address: \"nohost\"\n");
                fileLoader.reload();

                assertThat(settings.minAperture()).isEqualTo(1);
                assertThat(fileLoader.getCurrentConfig().getNodes()).hasSize(1);
                assertThat(notified).isEmpty();
            }
        }

        @Test
        @DisplayName("a modified file should be reloaded by the watcher")
        void modifiedFileShouldBeReloaded(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("aperture.yaml");
            Files.writeString(file, "label: first\n");

            try (ConfigLoader fileLoader = new ConfigLoader(file.toString())) {
                fileLoader.load();
                fileLoader.reloadIfModified();
                assertThat(fileLoader.getCurrentConfig().getLabel()).isEqualTo("first");

                Files.writeString(file, "label: second\n");
                Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis() + 10_000));
                fileLoader.reloadIfModified();

                assertThat(fileLoader.getCurrentConfig().getLabel()).isEqualTo("second");
            }
        }
    }

    @Nested
    @DisplayName("listeners")
    class ListenerTests {

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyListeners() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");
            List<String> changes = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) ->
                    changes.add((oldConfig == null ? "none" : oldConfig.getLabel()) + "->" + newConfig.getLabel()));

            loader.loadFromStream(yaml("label: a\n"));
            loader.loadFromStream(yaml("label: b\n"));

            assertThat(changes).containsExactly("none->a", "a->b");
        }

        @Test
        @DisplayName("a failing listener should not prevent the update")
        void failingListenerShouldNotPreventUpdate() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");
            loader.addListener((oldConfig, newConfig) -> {
                throw new IllegalStateException("boom");
            });

            loader.loadFromStream(yaml("label: a\n"));

            assertThat(loader.getCurrentConfig().getLabel()).isEqualTo("a");
        }

        @Test
        @DisplayName("removed listeners should not be notified")
        void removedListenerShouldNotBeNotified() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");
            List<ApertureConfig> seen = new ArrayList<>();
            ConfigChangeListener listener = (oldConfig, newConfig) -> seen.add(newConfig);
            loader.addListener(listener);
            loader.removeListener(listener);

            loader.loadFromStream(yaml("label: a\n"));

            assertThat(seen).isEmpty();
        }
    }
}
