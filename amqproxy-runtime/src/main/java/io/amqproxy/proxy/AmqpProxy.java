/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import io.amqproxy.proxy.config.ProxyConfig;
import io.amqproxy.proxy.internal.ClientConnectionTracker;
import io.amqproxy.proxy.internal.admin.AdminHttpHandler;
import io.amqproxy.proxy.internal.admin.AdminHttpServer;
import io.amqproxy.proxy.internal.net.ClientListener;
import io.amqproxy.proxy.internal.session.ClientSessionStateMachine;
import io.amqproxy.proxy.internal.upstream.UpstreamPool;
import io.amqproxy.proxy.internal.util.Metrics;
import io.amqproxy.proxy.service.HostPort;
import io.amqproxy.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A running proxy: the client listener, the upstream pool, the live sessions and the admin
 * endpoint, sharing one set of Netty event loops.
 *
 * <pre>{@code
 * try (AmqpProxy proxy = new AmqpProxy(config)) {
 *     proxy.startup();
 *     ...
 * }
 * }</pre>
 */
public final class AmqpProxy implements ProxyControl, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AmqpProxy.class);

    private final ProxyConfig config;
    private final PrometheusMeterRegistry meterRegistry;
    private final Metrics metrics;
    private final ClientConnectionTracker tracker = new ClientConnectionTracker();
    private final UpstreamPool pool;

    private @Nullable EventLoopGroup bossGroup;
    private @Nullable EventLoopGroup workerGroup;
    private @Nullable ClientListener listener;
    private @Nullable AdminHttpServer adminServer;
    private @Nullable InetSocketAddress clientAddress;
    private @Nullable InetSocketAddress adminAddress;
    private boolean running;

    public AmqpProxy(ProxyConfig config) {
        this.config = Objects.requireNonNull(config);
        this.meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.metrics = new Metrics(meterRegistry);
        this.pool = new UpstreamPool(config.idleConnectionTimeout(), config.frameMax(), metrics);
        metrics.bindClientConnections(tracker::liveConnections);
    }

    /**
     * Binds the client listener and, if enabled, the admin endpoint, and starts the idle sweep.
     *
     * @return this proxy
     * @throws InterruptedException if interrupted while binding
     * @throws IllegalStateException if already started or an address cannot be bound
     */
    public AmqpProxy startup() throws InterruptedException {
        if (running) {
            throw new IllegalStateException("This proxy is already running");
        }
        running = true;
        LOGGER.info("Starting proxy for upstream {}", config.upstream());
        EventLoopGroup boss = new NioEventLoopGroup(1, new DefaultThreadFactory("amqproxy-boss"));
        EventLoopGroup workers = new NioEventLoopGroup(0, new DefaultThreadFactory("amqproxy-worker"));
        this.bossGroup = boss;
        this.workerGroup = workers;
        try {
            ClientListener clientListener = new ClientListener(new HostPort(config.listenAddress(), config.listenPort()),
                    config.frameMax(), boss, workers, this::newSession);
            this.listener = clientListener;
            this.clientAddress = clientListener.bind();
            if (config.isHttpEnabled()) {
                AdminHttpServer admin = new AdminHttpServer(new HostPort(config.listenAddress(), config.httpPort()),
                        boss, workers, new AdminHttpHandler(meterRegistry, this));
                this.adminServer = admin;
                this.adminAddress = admin.bind();
            }
            pool.startIdleSweep(workers, config.idleSweepInterval());
        }
        catch (RuntimeException | InterruptedException e) {
            close();
            throw e;
        }
        return this;
    }

    private ClientSessionStateMachine newSession() {
        return new ClientSessionStateMachine(config, pool, tracker, metrics);
    }

    // ==================== ProxyControl ====================

    @Override
    public int liveClientConnections() {
        return tracker.liveConnections();
    }

    @Override
    public void stopAcceptingClients() {
        if (listener != null) {
            listener.stopAccepting();
        }
    }

    @Override
    public void disconnectClients() {
        tracker.closeAll();
    }

    // ==================== Accessors ====================

    public ProxyConfig config() {
        return config;
    }

    /**
     * @return the address clients connect to, once started
     */
    public InetSocketAddress clientAddress() {
        return Objects.requireNonNull(clientAddress, "Proxy not started");
    }

    /**
     * @return the admin endpoint address, empty when disabled or not started
     */
    public Optional<InetSocketAddress> adminAddress() {
        return Optional.ofNullable(adminAddress);
    }

    public PrometheusMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    @VisibleForTesting
    UpstreamPool pool() {
        return pool;
    }

    @VisibleForTesting
    ClientConnectionTracker tracker() {
        return tracker;
    }

    /**
     * Stops listening, closes every pooled upstream connection and shuts the event loops down.
     * Client sessions still open are cut off.
     */
    @Override
    public void close() {
        LOGGER.info("Stopping proxy");
        stopAcceptingClients();
        if (adminServer != null) {
            adminServer.close();
            adminServer = null;
        }
        pool.close();
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup = null;
        }
        meterRegistry.close();
        running = false;
    }
}
