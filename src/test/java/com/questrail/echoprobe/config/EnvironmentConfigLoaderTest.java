package com.questrail.echoprobe.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EnvironmentConfigLoaderTest {

    @Test
    void minimalEnvironmentUsesDefaults() {
        EchoProbeConfig config = new EnvironmentConfigLoader(Map.of("PORTS", "8000-8002,9000")).load();

        assertEquals(List.of("8000-8002", "9000"), config.listenPorts());
        assertFalse(config.active());
        assertEquals(List.of(), config.scanPorts());
        assertEquals(EchoProbeConfig.DEFAULT_CONNECTION_TIMEOUT, config.connectionTimeout());
        assertEquals(EchoProbeConfig.DEFAULT_LOG_DIRECTORY, config.logDirectory());
    }

    @Test
    void everyVariableIsHonoured() {
        EchoProbeConfig config = new EnvironmentConfigLoader(Map.of(
                "PORTS", " 2222 , 8080-8081 ",
                "ACTIVE", "true",
                "SCAN_PORTS", "22,80-81,,",
                "CONNECTION_TIMEOUT_SECS", "12",
                "SCAN_CONNECT_TIMEOUT_SECS", "3",
                "SCAN_READ_TIMEOUT_SECS", "2",
                "LOG_DIR", "/var/log/echoprobe",
                "SHUTDOWN_DRAIN_SECS", "0"
        )).load();

        assertEquals(List.of("2222", "8080-8081"), config.listenPorts());
        assertTrue(config.active());
        assertEquals(List.of("22", "80-81"), config.scanPorts());
        assertEquals(Duration.ofSeconds(12), config.connectionTimeout());
        assertEquals(Duration.ofSeconds(3), config.scanConnectTimeout());
        assertEquals(Duration.ofSeconds(2), config.scanReadTimeout());
        assertEquals(Path.of("/var/log/echoprobe"), config.logDirectory());
        assertEquals(Duration.ZERO, config.shutdownDrainTimeout());
    }

    @Test
    void activeIsTrueOnlyForExactLowercaseTrue() {
        for (String value : List.of("TRUE", "True", "1", "yes", " true")) {
            EchoProbeConfig config = new EnvironmentConfigLoader(Map.of("PORTS", "1", "ACTIVE", value)).load();
            assertFalse(config.active(), () -> "ACTIVE='" + value + "' must not enable scanning");
        }
    }

    @Test
    void missingOrBlankPortsIsFatal() {
        assertThrows(ConfigException.class, () -> new EnvironmentConfigLoader(Map.of()).load());
        assertThrows(ConfigException.class, () -> new EnvironmentConfigLoader(Map.of("PORTS", "  ")).load());
        assertThrows(ConfigException.class, () -> new EnvironmentConfigLoader(Map.of("PORTS", ", ,")).load());
    }

    @Test
    void nonNumericOrNonPositiveTimeoutIsFatal() {
        ConfigException e = assertThrows(ConfigException.class, () ->
                new EnvironmentConfigLoader(Map.of("PORTS", "1", "CONNECTION_TIMEOUT_SECS", "soon")).load());
        assertTrue(e.getMessage().contains("CONNECTION_TIMEOUT_SECS"));

        assertThrows(ConfigException.class, () ->
                new EnvironmentConfigLoader(Map.of("PORTS", "1", "SCAN_READ_TIMEOUT_SECS", "0")).load());
        assertThrows(ConfigException.class, () ->
                new EnvironmentConfigLoader(Map.of("PORTS", "1", "SHUTDOWN_DRAIN_SECS", "-1")).load());
    }

    @Test
    void dotEnvSuppliesValuesAndUnquotes(@TempDir Path dir) throws Exception {
        Path dotEnv = dir.resolve(".env");
        Files.writeString(dotEnv, String.join("\n",
                "# listener setup",
                "PORTS=\"7000-7001\"",
                "ACTIVE=true",
                "LOG_DIR='custom logs'",
                ""), StandardCharsets.UTF_8);

        Map<String, String> values = EnvironmentConfigLoader.readDotEnv(dotEnv);

        assertEquals("7000-7001", values.get("PORTS"));
        assertEquals("true", values.get("ACTIVE"));
        assertEquals("custom logs", values.get("LOG_DIR"));
        assertFalse(values.containsKey("# listener setup"));
    }

    @Test
    void missingDotEnvIsIgnored(@TempDir Path dir) {
        assertEquals(Map.of(), EnvironmentConfigLoader.readDotEnv(dir.resolve("absent.env")));
    }

    @Test
    void splitListDropsBlankEntries() {
        assertEquals(List.of("a", "b"), EnvironmentConfigLoader.splitList(" a ,, b ,"));
        assertEquals(List.of(), EnvironmentConfigLoader.splitList(""));
    }

    @Test
    void loggingVariablesFromDotEnvReachLogback(@TempDir Path dir) throws Exception {
        Path dotEnv = dir.resolve(".env");
        Files.writeString(dotEnv, "PORTS=7000\nLOG_DIR=/srv/echoprobe/logs\nLOG_LEVEL=DEBUG\n", StandardCharsets.UTF_8);

        EnvironmentConfigLoader loader = new EnvironmentConfigLoader(EnvironmentConfigLoader.readDotEnv(dotEnv));

        assertEquals(Map.of("LOG_DIR", "/srv/echoprobe/logs", "LOG_LEVEL", "DEBUG"), loader.loggingProperties());
        assertEquals(Path.of("/srv/echoprobe/logs"), loader.load().logDirectory());
    }

    @Test
    void exportLoggingPropertiesKeepsExplicitSystemProperties() {
        String previousDir = System.getProperty("LOG_DIR");
        String previousLevel = System.getProperty("LOG_LEVEL");
        try {
            System.setProperty("LOG_LEVEL", "WARN");
            System.clearProperty("LOG_DIR");

            new EnvironmentConfigLoader(Map.of("PORTS", "1", "LOG_DIR", " var/echo ", "LOG_LEVEL", "DEBUG"))
                    .exportLoggingProperties();

            assertEquals("var/echo", System.getProperty("LOG_DIR"));
            assertEquals("WARN", System.getProperty("LOG_LEVEL"));
        } finally {
            restore("LOG_DIR", previousDir);
            restore("LOG_LEVEL", previousLevel);
        }
    }

    @Test
    void blankLoggingVariablesAreNotExported() {
        EnvironmentConfigLoader loader = new EnvironmentConfigLoader(Map.of("PORTS", "1", "LOG_DIR", "  "));

        assertEquals(Map.of(), loader.loggingProperties());
    }

    private static void restore(String name, String value) {
        if (value == null) {
            System.clearProperty(name);
        } else {
            System.setProperty(name, value);
        }
    }
}
