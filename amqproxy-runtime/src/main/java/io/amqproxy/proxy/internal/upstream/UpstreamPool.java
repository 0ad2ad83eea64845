/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.EventLoop;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.EventExecutorGroup;

import io.amqproxy.proxy.internal.util.Metrics;
import io.amqproxy.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Pool of upstream connections grouped by {@link EndpointIdentity}.
 *
 * <p>A single lock guards the pool's bookkeeping. Connecting and negotiating a new connection
 * happens outside the lock, on the requesting session's event loop, so a slow broker only
 * delays the session that asked for the connection.</p>
 *
 * <p>Among several idle connections of one identity, the most recently released one is
 * leased first.</p>
 */
public class UpstreamPool implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpstreamPool.class);

    private final Duration idleTimeout;
    private final int frameMax;
    private final Metrics metrics;
    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<EndpointIdentity, Deque<UpstreamConnection>> idle = new HashMap<>();
    private final Set<UpstreamConnection> leased = new HashSet<>();
    private final Set<UpstreamConnection> handshaking = new HashSet<>();
    private final AtomicInteger connectionIds = new AtomicInteger();

    private @Nullable SslContext sslContext;
    private @Nullable ScheduledFuture<?> sweepTask;
    private boolean closed;

    public UpstreamPool(Duration idleTimeout, int frameMax, Metrics metrics) {
        this(idleTimeout, frameMax, metrics, System::nanoTime);
    }

    @VisibleForTesting
    UpstreamPool(Duration idleTimeout, int frameMax, Metrics metrics, LongSupplier nanoClock) {
        this.idleTimeout = Objects.requireNonNull(idleTimeout);
        this.frameMax = frameMax;
        this.metrics = Objects.requireNonNull(metrics);
        this.nanoClock = Objects.requireNonNull(nanoClock);
        metrics.bindUpstreamConnections(this::idleCount, this::leasedCount);
    }

    /**
     * Starts the idle sweep.
     *
     * @param executor runs the sweep
     * @param interval time between sweeps
     */
    public void startIdleSweep(EventExecutorGroup executor, Duration interval) {
        long millis = interval.toMillis();
        lock.lock();
        try {
            if (sweepTask != null) {
                throw new IllegalStateException("Idle sweep already running");
            }
            sweepTask = executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        }
        finally {
            lock.unlock();
        }
    }

    // ==================== Lease / Release / Evict ====================

    /**
     * Leases a connection for {@code identity}, reusing an idle one when possible.
     *
     * @param identity the endpoint identity
     * @param eventLoop event loop a new connection is created on
     * @param lessee receives the connection's events for the duration of the lease
     * @return future completing with a leased connection, or failing with an {@link UpstreamException}
     */
    public CompletableFuture<UpstreamConnection> lease(EndpointIdentity identity, EventLoop eventLoop, UpstreamListener lessee) {
        List<UpstreamConnection> stale = new ArrayList<>();
        UpstreamConnection connection;
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new UpstreamUnavailableException("Upstream pool is closed"));
            }
            Deque<UpstreamConnection> candidates = idle.get(identity);
            while (candidates != null && (connection = candidates.pollFirst()) != null) {
                if (connection.isUsable() && connection.markLeased(lessee)) {
                    leased.add(connection);
                    removeIfEmpty(identity, candidates);
                    LOGGER.debug("{}: Reusing idle connection for {}", connection.id(), identity);
                    return CompletableFuture.completedFuture(connection);
                }
                stale.add(connection);
            }
            removeIfEmpty(identity, candidates);
            connection = new UpstreamConnection("upstream-" + connectionIds.incrementAndGet(), identity, frameMax,
                    identity.tls() ? Optional.of(sslContext()) : Optional.empty(), this);
            handshaking.add(connection);
        }
        finally {
            lock.unlock();
        }
        stale.forEach(this::closeEvicted);

        UpstreamConnection created = connection;
        return created.connect(eventLoop).thenApply(c -> {
            lock.lock();
            try {
                handshaking.remove(c);
                if (closed || !c.markLeased(lessee)) {
                    throw new UpstreamUnavailableException(c.id() + " closed before it could be leased");
                }
                leased.add(c);
            }
            finally {
                lock.unlock();
            }
            metrics.upstreamCreatedCounter().increment();
            return c;
        }).whenComplete((c, error) -> {
            if (error != null) {
                lock.lock();
                try {
                    handshaking.remove(created);
                }
                finally {
                    lock.unlock();
                }
                created.close();
            }
        });
    }

    /**
     * Returns a leased connection to the pool. A connection that is no longer usable, or that
     * still has upstream channels open, is evicted instead.
     */
    public void release(UpstreamConnection connection) {
        boolean evict = false;
        lock.lock();
        try {
            if (!leased.remove(connection)) {
                LOGGER.debug("{}: Released connection that was not leased", connection.id());
                return;
            }
            if (!closed && connection.isUsable() && connection.openChannels() == 0 && connection.markIdle(nanoClock.getAsLong())) {
                idle.computeIfAbsent(connection.identity(), k -> new ArrayDeque<>()).addFirst(connection);
                LOGGER.debug("{}: Released to pool", connection.id());
            }
            else {
                evict = true;
            }
        }
        finally {
            lock.unlock();
        }
        if (evict) {
            LOGGER.debug("{}: Not reusable ({} open channels, state {}), evicting", connection.id(), connection.openChannels(),
                    connection.state().getClass().getSimpleName());
            closeEvicted(connection);
        }
    }

    /**
     * Removes a connection from the pool and closes it.
     */
    public void evict(UpstreamConnection connection) {
        remove(connection);
        closeEvicted(connection);
    }

    /**
     * Called by a connection that the broker or the network has closed.
     */
    void onConnectionLost(UpstreamConnection connection) {
        if (remove(connection)) {
            metrics.upstreamEvictedCounter().increment();
        }
    }

    private boolean remove(UpstreamConnection connection) {
        lock.lock();
        try {
            boolean removed = leased.remove(connection) | handshaking.remove(connection);
            Deque<UpstreamConnection> candidates = idle.get(connection.identity());
            if (candidates != null) {
                removed |= candidates.remove(connection);
                removeIfEmpty(connection.identity(), candidates);
            }
            return removed;
        }
        finally {
            lock.unlock();
        }
    }

    private void closeEvicted(UpstreamConnection connection) {
        metrics.upstreamEvictedCounter().increment();
        connection.close();
    }

    private void removeIfEmpty(EndpointIdentity identity, @Nullable Deque<UpstreamConnection> candidates) {
        if (candidates != null && candidates.isEmpty()) {
            idle.remove(identity);
        }
    }

    // ==================== Idle sweep ====================

    /**
     * Evicts every idle connection released longer than the idle timeout ago.
     *
     * @return number of connections evicted
     */
    @VisibleForTesting
    int sweep() {
        long now = nanoClock.getAsLong();
        long timeoutNanos = idleTimeout.toNanos();
        List<UpstreamConnection> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Deque<UpstreamConnection>> iterator = idle.values().iterator();
            while (iterator.hasNext()) {
                Deque<UpstreamConnection> candidates = iterator.next();
                candidates.removeIf(c -> {
                    Optional<Long> idleSince = c.idleSinceNanos();
                    boolean isExpired = idleSince.isEmpty() || now - idleSince.get() >= timeoutNanos;
                    if (isExpired) {
                        expired.add(c);
                    }
                    return isExpired;
                });
                if (candidates.isEmpty()) {
                    iterator.remove();
                }
            }
        }
        finally {
            lock.unlock();
        }
        for (UpstreamConnection connection : expired) {
            LOGGER.debug("{}: Idle for longer than {}s, evicting", connection.id(), idleTimeout.toSeconds());
            closeEvicted(connection);
        }
        return expired.size();
    }

    // ==================== Accessors ====================

    public int size() {
        lock.lock();
        try {
            return leased.size() + handshaking.size() + idleCountLocked();
        }
        finally {
            lock.unlock();
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return idleCountLocked();
        }
        finally {
            lock.unlock();
        }
    }

    public int leasedCount() {
        lock.lock();
        try {
            return leased.size();
        }
        finally {
            lock.unlock();
        }
    }

    @VisibleForTesting
    List<UpstreamConnection> idleConnections(EndpointIdentity identity) {
        lock.lock();
        try {
            Deque<UpstreamConnection> candidates = idle.get(identity);
            return candidates == null ? List.of() : List.copyOf(candidates);
        }
        finally {
            lock.unlock();
        }
    }

    private int idleCountLocked() {
        int count = 0;
        for (Deque<UpstreamConnection> candidates : idle.values()) {
            count += candidates.size();
        }
        return count;
    }

    /**
     * Replaces the client TLS context used for {@code amqps} upstreams.
     */
    @VisibleForTesting
    void sslContext(SslContext clientContext) {
        lock.lock();
        try {
            sslContext = Objects.requireNonNull(clientContext);
        }
        finally {
            lock.unlock();
        }
    }

    private SslContext sslContext() {
        if (sslContext == null) {
            try {
                sslContext = SslContextBuilder.forClient().build();
            }
            catch (SSLException e) {
                throw new UncheckedIOException("Failed to create upstream TLS context", e);
            }
        }
        return sslContext;
    }

    /**
     * Stops the idle sweep and closes every pooled connection.
     */
    @Override
    public void close() {
        List<UpstreamConnection> all = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (sweepTask != null) {
                sweepTask.cancel(false);
                sweepTask = null;
            }
            idle.values().forEach(all::addAll);
            idle.clear();
            all.addAll(leased);
            leased.clear();
            all.addAll(handshaking);
            handshaking.clear();
        }
        finally {
            lock.unlock();
        }
        LOGGER.debug("Closing {} upstream connections", all.size());
        all.forEach(UpstreamConnection::close);
    }
}
