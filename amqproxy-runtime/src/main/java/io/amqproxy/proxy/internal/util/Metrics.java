/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.util;

import java.util.Objects;
import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * The proxy's meters, bound to an explicitly supplied registry.
 */
public class Metrics {

    public static final String CLIENT_CONNECTIONS = "amqproxy_client_connections";
    public static final String CLIENT_CONNECTIONS_ACCEPTED_TOTAL = "amqproxy_client_connections_accepted_total";
    public static final String CLIENT_ERRORS_TOTAL = "amqproxy_client_errors_total";
    public static final String UPSTREAM_CONNECTIONS = "amqproxy_upstream_connections";
    public static final String UPSTREAM_CONNECTIONS_CREATED_TOTAL = "amqproxy_upstream_connections_created_total";
    public static final String UPSTREAM_CONNECTIONS_EVICTED_TOTAL = "amqproxy_upstream_connections_evicted_total";

    private static final String STATE_TAG = "state";

    private final MeterRegistry registry;
    private final Counter clientConnectionCounter;
    private final Counter clientErrorCounter;
    private final Counter upstreamCreatedCounter;
    private final Counter upstreamEvictedCounter;

    public Metrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
        this.clientConnectionCounter = Counter.builder(CLIENT_CONNECTIONS_ACCEPTED_TOTAL)
                .description("Client connections accepted")
                .register(registry);
        this.clientErrorCounter = Counter.builder(CLIENT_ERRORS_TOTAL)
                .description("Client sessions closed because of a protocol error")
                .register(registry);
        this.upstreamCreatedCounter = Counter.builder(UPSTREAM_CONNECTIONS_CREATED_TOTAL)
                .description("Upstream connections established")
                .register(registry);
        this.upstreamEvictedCounter = Counter.builder(UPSTREAM_CONNECTIONS_EVICTED_TOTAL)
                .description("Upstream connections removed from the pool")
                .register(registry);
    }

    /**
     * Meters that are not exported anywhere, for tests and embedded use.
     */
    public static Metrics noop() {
        return new Metrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public Counter clientConnectionCounter() {
        return clientConnectionCounter;
    }

    public Counter clientErrorCounter() {
        return clientErrorCounter;
    }

    public Counter upstreamCreatedCounter() {
        return upstreamCreatedCounter;
    }

    public Counter upstreamEvictedCounter() {
        return upstreamEvictedCounter;
    }

    public void bindClientConnections(Supplier<Number> liveClientConnections) {
        Gauge.builder(CLIENT_CONNECTIONS, liveClientConnections)
                .description("Live client sessions")
                .register(registry);
    }

    public void bindUpstreamConnections(Supplier<Number> idle, Supplier<Number> leased) {
        Gauge.builder(UPSTREAM_CONNECTIONS, idle)
                .description("Pooled upstream connections")
                .tag(STATE_TAG, "idle")
                .register(registry);
        Gauge.builder(UPSTREAM_CONNECTIONS, leased)
                .description("Pooled upstream connections")
                .tag(STATE_TAG, "leased")
                .register(registry);
    }
}
