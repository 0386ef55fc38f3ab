package com.questrail.echoprobe.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EchoProbeConfigTest {

    @Test
    void builderAppliesDefaults() {
        EchoProbeConfig config = EchoProbeConfig.builder()
                .addListenPort("8080")
                .build();

        assertEquals(List.of("8080"), config.listenPorts());
        assertFalse(config.active());
        assertEquals(List.of(), config.scanPorts());
        assertEquals(Duration.ofSeconds(30), config.connectionTimeout());
        assertEquals(Duration.ofSeconds(10), config.scanConnectTimeout());
        assertEquals(Duration.ofSeconds(5), config.scanReadTimeout());
        assertEquals(Path.of("logs"), config.logDirectory());
        assertEquals(Duration.ZERO, config.shutdownDrainTimeout());
    }

    @Test
    void listenPortsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> EchoProbeConfig.builder().build());
    }

    @Test
    void timeoutsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> EchoProbeConfig.builder()
                .addListenPort("1")
                .withConnectionTimeout(Duration.ZERO)
                .build());
        assertThrows(IllegalArgumentException.class, () -> EchoProbeConfig.builder()
                .addListenPort("1")
                .withScanReadTimeout(Duration.ofSeconds(-1))
                .build());
        assertThrows(IllegalArgumentException.class, () -> EchoProbeConfig.builder()
                .addListenPort("1")
                .withShutdownDrainTimeout(Duration.ofSeconds(-1))
                .build());
    }

    @Test
    void specListsAreDefensivelyCopied() {
        List<String> ports = new ArrayList<>(List.of("8080"));
        EchoProbeConfig config = EchoProbeConfig.builder().withListenPorts(ports).build();

        ports.add("9090");

        assertEquals(List.of("8080"), config.listenPorts());
        assertThrows(UnsupportedOperationException.class, () -> config.scanPorts().add("22"));
    }
}
