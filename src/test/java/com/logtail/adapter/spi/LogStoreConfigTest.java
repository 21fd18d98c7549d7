package com.logtail.adapter.spi;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LogStoreConfig")
class LogStoreConfigTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("should fall back to the syslog-ng defaults")
        void defaults_shouldUseSyslogNgLocations() {
            LogStoreConfig config = LogStoreConfig.defaults();

            assertThat(config.host()).isEqualTo("localhost");
            assertThat(config.database()).isEqualTo("syslog");
            assertThat(config.collection()).isEqualTo("messages");
            assertThat(config.port()).isEmpty();
            assertThat(config.username()).isEmpty();
            assertThat(config.password()).isEmpty();
            assertThat(config.options()).isEmpty();
        }

        @Test
        @DisplayName("should describe the target without credentials")
        void describeTarget_shouldOmitCredentials() {
            LogStoreConfig config = LogStoreConfig.builder()
                    .host("db.internal")
                    .port(27017)
                    .username("reader")
                    .password("s3cret")
                    .build();

            assertThat(config.describeTarget()).isEqualTo("db.internal:27017/syslog");
            assertThat(config.toString()).doesNotContain("s3cret");
        }

        @Test
        @DisplayName("should treat empty credentials as absent")
        void builder_emptyCredentials_shouldBeAbsent() {
            LogStoreConfig config = LogStoreConfig.builder().username("").password("").build();

            assertThat(config.username()).isEmpty();
            assertThat(config.password()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject a blank host")
        void build_blankHost_shouldThrow() {
            assertThatThrownBy(() -> LogStoreConfig.builder().host("  ").build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getKey())
                    .isEqualTo("host");
        }

        @Test
        @DisplayName("should reject a blank collection")
        void build_blankCollection_shouldThrow() {
            assertThatThrownBy(() -> LogStoreConfig.builder().collection("").build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("collection");
        }

        @Test
        @DisplayName("should reject a port out of range")
        void build_portOutOfRange_shouldThrow() {
            assertThatThrownBy(() -> LogStoreConfig.builder().port(70000).build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("70000");
        }

        @Test
        @DisplayName("should reject a password without a username")
        void build_passwordWithoutUser_shouldThrow() {
            assertThatThrownBy(() -> LogStoreConfig.builder().password("x").build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("password");
        }

        @Test
        @DisplayName("should reject non-positive timeouts")
        void build_zeroTailAwait_shouldThrow() {
            assertThatThrownBy(() -> LogStoreConfig.builder().tailAwaitMillis(0).build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("tailAwaitMillis");
        }
        @Test
        @DisplayName("should require the stop timeout to outlast a tail iteration")
        void build_stopTimeoutWithinTwoAwaits_shouldThrow() {
            assertThatThrownBy(() -> LogStoreConfig.builder()
                    .tailAwaitMillis(1_000)
                    .stopTimeoutMillis(2_000)
                    .build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getKey())
                    .isEqualTo("stopTimeoutMillis");
        }

        @Test
        @DisplayName("should accept a stop timeout above two awaits")
        void build_stopTimeoutAboveTwoAwaits_shouldSucceed() {
            LogStoreConfig config = LogStoreConfig.builder()
                    .tailAwaitMillis(1_000)
                    .stopTimeoutMillis(2_001)
                    .build();

            assertThat(config.stopTimeoutMillis()).isEqualTo(2_001);
        }
    }

    @Nested
    @DisplayName("Properties")
    class PropertiesTests {

        @AfterEach
        void clearSystemProperties() {
            System.clearProperty("logtail.store.collection");
        }

        @Test
        @DisplayName("should read every store key")
        void fromProperties_shouldReadAllKeys() {
            Properties props = new Properties();
            props.setProperty("logtail.store.host", " logs.example.com ");
            props.setProperty("logtail.store.port", "27018");
            props.setProperty("logtail.store.database", "syslog2");
            props.setProperty("logtail.store.collection", "auth");
            props.setProperty("logtail.store.username", "tail");
            props.setProperty("logtail.store.password", "pw");
            props.setProperty("logtail.store.tailAwaitMillis", "250");

            LogStoreConfig config = LogStoreConfig.fromProperties(props);

            assertThat(config.host()).isEqualTo("logs.example.com");
            assertThat(config.port()).contains(27018);
            assertThat(config.database()).isEqualTo("syslog2");
            assertThat(config.collection()).isEqualTo("auth");
            assertThat(config.username()).contains("tail");
            assertThat(config.password()).contains("pw");
            assertThat(config.tailAwaitMillis()).isEqualTo(250);
        }

        @Test
        @DisplayName("should collect options in name order")
        void fromProperties_options_shouldBeSortedByName() {
            Properties props = new Properties();
            props.setProperty("logtail.store.option.replicaSet", "rs0");
            props.setProperty("logtail.store.option.authSource", "admin");
            props.setProperty("logtail.store.option.", "ignored");

            LogStoreConfig config = LogStoreConfig.fromProperties(props);

            assertThat(config.options()).containsExactly(
                    entry("authSource", "admin"),
                    entry("replicaSet", "rs0"));
        }

        @Test
        @DisplayName("should report a malformed port with its key")
        void fromProperties_badPort_shouldThrow() {
            Properties props = new Properties();
            props.setProperty("logtail.store.port", "twenty");

            assertThatThrownBy(() -> LogStoreConfig.fromProperties(props))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("logtail.store.port")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        @DisplayName("should let system properties override the file")
        void load_systemProperty_shouldOverrideFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("logtail.properties");
            Files.writeString(file, "logtail.store.collection=kern\nlogtail.store.host=h1\n", StandardCharsets.UTF_8);
            System.setProperty("logtail.store.collection", "auth");

            LogStoreConfig config = LogStoreConfig.load(file);

            assertThat(config.host()).isEqualTo("h1");
            assertThat(config.collection()).isEqualTo("auth");
        }

        @Test
        @DisplayName("should fail on an unreadable file")
        void load_missingFile_shouldThrow(@TempDir Path dir) {
            assertThatThrownBy(() -> LogStoreConfig.load(dir.resolve("absent.properties")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should use defaults when the resource is absent")
        void loadResource_missing_shouldUseDefaults() {
            LogStoreConfig config = LogStoreConfig.loadResource("no-such-logtail.properties");

            assertThat(config.host()).isEqualTo(LogStoreConfig.DEFAULT_HOST);
            assertThat(config.collection()).isEqualTo(LogStoreConfig.DEFAULT_COLLECTION);
        }
    }
}
