/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader();

    private static ConfigLayer upstreamOnly(String upstream) {
        return new ConfigLayer(null, null, null, upstream, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    void defaults() {
        ProxyConfig config = loader.load(null, Map.of(), upstreamOnly("amqp://broker"));

        assertEquals(ProxyConfig.DEFAULT_LISTEN_ADDRESS, config.listenAddress());
        assertEquals(5673, config.listenPort());
        assertEquals(15673, config.httpPort());
        assertTrue(config.isHttpEnabled());
        assertEquals(Duration.ofSeconds(5), config.idleConnectionTimeout());
        assertTrue(config.termTimeout().isEmpty());
        assertEquals(Duration.ZERO, config.termClientCloseTimeout());
        assertEquals("info", config.logLevel());
        assertEquals(ProxyConfig.DEFAULT_FRAME_MAX, config.frameMax());
    }

    @Test
    void upstreamIsRequired() {
        ConfigException e = assertThrows(ConfigException.class, () -> loader.load(null, Map.of(), ConfigLayer.EMPTY));

        assertTrue(e.getMessage().contains("Upstream"));
    }

    @Test
    void layersOverrideInOrder(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, """
                listenAddress: 0.0.0.0
                listenPort: 1111
                httpPort: 2222
                idleConnectionTimeout: 30
                upstream: amqp://file-broker
                """);
        Map<String, String> env = Map.of("AMQPROXY_LISTEN_PORT", "3333", "AMQPROXY_UPSTREAM", "amqps://env-broker");
        ConfigLayer cli = new ConfigLayer(null, 4444, null, null, null, null, null, null, null, null, null, null, null, null);

        ProxyConfig config = loader.load(file, env, cli);

        assertEquals("0.0.0.0", config.listenAddress());
        assertEquals(4444, config.listenPort());
        assertEquals(2222, config.httpPort());
        assertEquals(Duration.ofSeconds(30), config.idleConnectionTimeout());
        assertEquals("env-broker", config.upstream().hostPort().host());
        assertTrue(config.upstream().tls());
    }

    @Test
    void debugWinsOverLogLevel() {
        ProxyConfig config = loader.resolve(new ConfigLayer(null, null, null, "amqp://b", null, null, null, "error", true, null, null, null, null, null));

        assertEquals("debug", config.logLevel());
    }

    @Test
    void logLevelSpellings() {
        ProxyConfig config = loader.resolve(new ConfigLayer(null, null, null, "amqp://b", null, null, null, "WARNING", null, null, null, null, null, null));

        assertEquals("warn", config.logLevel());
        assertThrows(ConfigException.class,
                () -> loader.resolve(new ConfigLayer(null, null, null, "amqp://b", null, null, null, "loud", null, null, null, null, null, null)));
    }

    @Test
    void negativeHttpPortDisablesAdminEndpoint() {
        ProxyConfig config = loader.resolve(new ConfigLayer(null, null, -1, "amqp://b", null, null, null, null, null, null, null, null, null, null));

        assertFalse(config.isHttpEnabled());
    }

    @Test
    void negativeTermTimeoutWaitsForever() {
        ProxyConfig config = loader.resolve(new ConfigLayer(null, null, null, "amqp://b", null, -1, null, null, null, null, null, null, null, null));

        assertTrue(config.termTimeout().isEmpty());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(ConfigException.class,
                () -> loader.resolve(new ConfigLayer(null, 70000, null, "amqp://b", null, null, null, null, null, null, null, null, null, null)));
        assertThrows(ConfigException.class,
                () -> loader.resolve(new ConfigLayer(null, null, null, "amqp://b", -5, null, null, null, null, null, null, null, null, null)));
        assertThrows(ConfigException.class,
                () -> loader.resolve(new ConfigLayer(null, null, null, "amqp://b", null, null, null, null, null, 1024, null, null, null, null)));
    }

    @Test
    void unknownKeyInFileIsRejected() {
        assertThrows(ConfigException.class, () -> loader.parseYaml("listenPort: 1\nbogus: 2\n"));
    }

    @Test
    void emptyFileIsEmptyLayer() {
        assertEquals(ConfigLayer.EMPTY, loader.parseYaml(""));
    }

    @Test
    void missingFileIsConfigError(@TempDir Path dir) {
        assertThrows(ConfigException.class, () -> loader.readFile(dir.resolve("absent.yaml")));
    }

    @Test
    void unreadableFileIsConfigError(@TempDir Path dir) {
        ConfigException e = assertThrows(ConfigException.class, () -> loader.readFile(dir));
        assertTrue(e.getMessage().startsWith("Failed to read config file " + dir), e.getMessage());
    }

    @Test
    void nonNumericEnvironmentValueIsConfigError() {
        assertThrows(ConfigException.class, () -> ConfigLayer.fromEnvironment(Map.of("AMQPROXY_LISTEN_PORT", "abc")));
    }
}
