/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.app;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.qos.logback.classic.Level;
import io.amqproxy.proxy.config.ConfigLayer;
import io.amqproxy.proxy.config.ProxyConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AmqProxyTest {

    private static AmqProxy parse(Map<String, String> env, String... args) {
        AmqProxy command = new AmqProxy(env);
        new CommandLine(command).parseArgs(args);
        return command;
    }

    @Test
    void shortOptionsPopulateCommandLineLayer() {
        AmqProxy command = parse(Map.of(), "-l", "0.0.0.0", "-p", "5674", "-b", "15674", "-t", "9", "-d", "amqp://broker");

        ConfigLayer layer = command.commandLineLayer();

        assertEquals("0.0.0.0", layer.listenAddress());
        assertEquals(5674, layer.listenPort());
        assertEquals(15674, layer.httpPort());
        assertEquals(9, layer.idleConnectionTimeout());
        assertEquals(Boolean.TRUE, layer.debug());
        assertEquals("amqp://broker", layer.upstream());
    }

    @Test
    void absentOptionsStayUnset() {
        ConfigLayer layer = parse(Map.of(), "amqp://broker").commandLineLayer();

        assertNull(layer.listenPort());
        assertNull(layer.termTimeout());
        assertNull(layer.debug());
        assertNull(layer.logLevel());
    }

    @Test
    void longOptionsResolveIntoConfig() {
        ProxyConfig config = parse(Map.of(), "--listen=127.0.0.1", "--port=6000", "--term-timeout=30",
                "--term-client-close-timeout=3", "--log-level=warn", "amqps://broker").resolveConfig();

        assertEquals("127.0.0.1", config.listenAddress());
        assertEquals(6000, config.listenPort());
        assertEquals(Duration.ofSeconds(30), config.termTimeout().orElseThrow());
        assertEquals(Duration.ofSeconds(3), config.termClientCloseTimeout());
        assertEquals("warn", config.logLevel());
        assertTrue(config.upstream().tls());
    }

    @Test
    void commandLineWinsOverEnvironmentAndFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("amqproxy.yaml");
        Files.writeString(file, "listenPort: 7000\nhttpPort: 17000\nupstream: amqp://from-file\n");
        Map<String, String> env = Map.of("AMQPROXY_HTTP_PORT", "18000", "AMQPROXY_LISTEN_PORT", "8000");

        ProxyConfig config = parse(env, "-c", file.toString(), "-p", "9000").resolveConfig();

        assertEquals(9000, config.listenPort());
        assertEquals(18000, config.httpPort());
        assertEquals("from-file", config.upstream().hostPort().host());
    }

    @Test
    void missingUpstreamExitsWithConfigError() {
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new AmqProxy(Map.of()));
        commandLine.setErr(new PrintWriter(err));

        int status = commandLine.execute();

        assertEquals(AmqProxy.EXIT_CONFIG_ERROR, status);
        assertTrue(err.toString().contains("Upstream AMQP url is required"), err.toString());
    }

    @Test
    void invalidUpstreamSchemeExitsWithConfigError() {
        CommandLine commandLine = new CommandLine(new AmqProxy(Map.of()));
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertEquals(AmqProxy.EXIT_CONFIG_ERROR, commandLine.execute("http://broker"));
    }

    @Test
    void versionIsPrinted() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new AmqProxy(Map.of()));
        commandLine.setOut(new PrintWriter(out));

        int status = commandLine.execute("-V");

        assertEquals(0, status);
        assertTrue(out.toString().startsWith("amqproxy "), out.toString());
    }

    @Test
    void helpListsUpstreamParameter() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new AmqProxy(Map.of()));
        commandLine.setOut(new PrintWriter(out));

        assertEquals(0, commandLine.execute("--help"));
        assertTrue(out.toString().contains("UPSTREAM_URL"));
        assertTrue(out.toString().contains("--idle-connection-timeout"));
    }

    @Test
    void unknownOptionIsRejected() {
        CommandLine commandLine = new CommandLine(new AmqProxy(Map.of()));
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertFalse(commandLine.execute("--bogus", "amqp://broker") == 0);
    }

    @Test
    void logLevelNamesMapToLogback() {
        assertEquals(Level.WARN, LoggingConfigurator.toLevel("warn"));
        assertEquals(Level.OFF, LoggingConfigurator.toLevel("off"));
        assertEquals(Level.TRACE, LoggingConfigurator.toLevel("trace"));
    }
}
