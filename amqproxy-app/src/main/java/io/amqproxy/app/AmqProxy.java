/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.app;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.amqproxy.proxy.AmqpProxy;
import io.amqproxy.proxy.config.ConfigException;
import io.amqproxy.proxy.config.ConfigLayer;
import io.amqproxy.proxy.config.ConfigLoader;
import io.amqproxy.proxy.config.ProxyConfig;
import io.amqproxy.proxy.internal.shutdown.HaltingProcessTerminator;
import io.amqproxy.proxy.internal.shutdown.ShutdownCoordinator;

import edu.umd.cs.findbugs.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line entry point: {@code amqproxy [options] UPSTREAM_URL}.
 */
@Command(name = "amqproxy", mixinStandardHelpOptions = true, versionProvider = AmqProxy.VersionProvider.class, sortOptions = false, description = "Connection and channel pooling proxy for AMQP 0-9-1 brokers.")
public class AmqProxy implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AmqProxy.class);

    static final int EXIT_CONFIG_ERROR = 2;

    @Option(names = { "-l", "--listen" }, paramLabel = "ADDRESS", description = "Address to listen on (default is localhost)")
    @Nullable
    String listenAddress;

    @Option(names = { "-p", "--port" }, paramLabel = "PORT", description = "Port to listen on (default: 5673)")
    @Nullable
    Integer listenPort;

    @Option(names = { "-b", "--http-port" }, paramLabel = "PORT", description = "HTTP port to listen on, negative to disable (default: 15673)")
    @Nullable
    Integer httpPort;

    @Option(names = { "-t", "--idle-connection-timeout" }, paramLabel = "SECONDS", description = "Maximum time an unused pooled connection stays open (default: 5s)")
    @Nullable
    Integer idleConnectionTimeout;

    @Option(names = "--term-timeout", paramLabel = "SECONDS", description = "At TERM, how long to wait for clients to close their sockets after Close has been sent (default: infinite)")
    @Nullable
    Integer termTimeout;

    @Option(names = "--term-client-close-timeout", paramLabel = "SECONDS", description = "At TERM, how long to wait for clients to send Close before Close is sent to them (default: 0s)")
    @Nullable
    Integer termClientCloseTimeout;

    @Option(names = "--log-level", paramLabel = "LEVEL", description = "The log level (default: info)")
    @Nullable
    String logLevel;

    @Option(names = { "-d", "--debug" }, description = "Verbose logging")
    boolean debug;

    @Option(names = { "-c", "--config" }, paramLabel = "FILE", description = "Load config file (YAML)")
    @Nullable
    Path configFile;

    @Parameters(index = "0", arity = "0..1", paramLabel = "UPSTREAM_URL", description = "amqp:// or amqps:// URL of the upstream broker")
    @Nullable
    String upstream;

    private final Map<String, String> env;

    public AmqProxy() {
        this(System.getenv());
    }

    AmqProxy(Map<String, String> env) {
        this.env = env;
    }

    /**
     * @return the values given on the command line, {@code null} where an option is absent
     */
    ConfigLayer commandLineLayer() {
        return new ConfigLayer(listenAddress, listenPort, httpPort, upstream, idleConnectionTimeout,
                termTimeout, termClientCloseTimeout, logLevel, debug ? Boolean.TRUE : null,
                null, null, null, null, null);
    }

    /**
     * Resolves the configuration from the config file, the environment and the command line.
     *
     * @throws ConfigException if the result is not valid
     */
    ProxyConfig resolveConfig() {
        return new ConfigLoader().load(configFile, env, commandLineLayer());
    }

    @Override
    public Integer call() throws Exception {
        ProxyConfig config;
        try {
            config = resolveConfig();
        }
        catch (ConfigException e) {
            PrintWriter err = new CommandLine(this).getErr();
            err.println(e.getMessage() + ". Add -h switch for help.");
            err.flush();
            return EXIT_CONFIG_ERROR;
        }
        LoggingConfigurator.configure(config.logLevel(), env);
        LOGGER.debug("Starting with {}", config);

        try (AmqpProxy proxy = new AmqpProxy(config)) {
            proxy.startup();
            ShutdownCoordinator coordinator = new ShutdownCoordinator(proxy, config.termTimeout(),
                    config.termClientCloseTimeout(), new HaltingProcessTerminator());
            SignalHandlers.install(coordinator);
            LOGGER.info("Proxy upstream {} listening on {}{}", config.upstream(), proxy.clientAddress(),
                    proxy.adminAddress().map(a -> ", HTTP on " + a).orElse(""));
            return coordinator.awaitShutdown();
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new AmqProxy()).execute(args));
    }

    /**
     * Reports the version recorded in the jar manifest.
     */
    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = Optional.ofNullable(AmqpProxy.class.getPackage().getImplementationVersion()).orElse("dev");
            return new String[]{ "amqproxy " + version };
        }
    }
}
