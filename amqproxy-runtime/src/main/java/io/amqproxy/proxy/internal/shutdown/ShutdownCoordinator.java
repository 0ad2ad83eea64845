/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.shutdown;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.amqproxy.proxy.ProxyControl;
import io.amqproxy.proxy.tag.VisibleForTesting;

/**
 * Drives the graceful shutdown of a running proxy.
 *
 * <p>The first INT or TERM signal stops the listener. The coordinator then optionally waits
 * for clients to close on their own, sends connection.close to the rest and waits for the
 * live connection count to reach zero. A hard term timeout, or a second signal, ends the
 * process through the {@link ProcessTerminator} instead.</p>
 *
 * <p>{@link #onSignal(String)} may be called from any thread. {@link #awaitShutdown()} is
 * called once, from the main thread.</p>
 */
public class ShutdownCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ShutdownCoordinator.class);

    @VisibleForTesting
    static final long CLIENT_CLOSE_POLL_MILLIS = 100;
    @VisibleForTesting
    static final long DRAIN_POLL_MILLIS = 200;

    private final ProxyControl proxy;
    private final Optional<Duration> termTimeout;
    private final Duration termClientCloseTimeout;
    private final ProcessTerminator terminator;

    private final CountDownLatch shutdownRequested = new CountDownLatch(1);
    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "amqproxy-shutdown-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    private ShutdownState state = ShutdownState.Running.INSTANCE;

    /**
     * @param proxy the proxy being shut down
     * @param termTimeout how long to wait for clients after connection.close was sent, empty for no limit
     * @param termClientCloseTimeout how long to wait for clients to close on their own before sending connection.close
     * @param terminator ends the process when waiting is abandoned
     */
    public ShutdownCoordinator(ProxyControl proxy,
                               Optional<Duration> termTimeout,
                               Duration termClientCloseTimeout,
                               ProcessTerminator terminator) {
        this.proxy = Objects.requireNonNull(proxy);
        this.termTimeout = Objects.requireNonNull(termTimeout);
        this.termClientCloseTimeout = Objects.requireNonNull(termClientCloseTimeout);
        this.terminator = Objects.requireNonNull(terminator);
    }

    public synchronized ShutdownState state() {
        return state;
    }

    // ==================== Signals ====================

    /**
     * Handles a delivery of INT or TERM.
     *
     * @param signalName name of the signal, for logging
     */
    public void onSignal(String signalName) {
        synchronized (this) {
            if (state instanceof ShutdownState.Running running) {
                LOGGER.info("Received SIG{}, shutting down", signalName);
                proxy.stopAcceptingClients();
                setState(running.toDraining());
                shutdownRequested.countDown();
                return;
            }
            if (state.isFinal()) {
                return;
            }
        }
        abort("received SIG" + signalName + " during shutdown");
    }

    // ==================== Shutdown sequence ====================

    /**
     * Blocks until a shutdown has been requested and has finished.
     *
     * @return the process exit status: 0 once every client has gone, 1 if waiting was abandoned
     * @throws InterruptedException if the calling thread is interrupted
     */
    public int awaitShutdown() throws InterruptedException {
        shutdownRequested.await();
        try {
            return drain();
        }
        finally {
            watchdog.shutdownNow();
        }
    }

    private int drain() throws InterruptedException {
        if (proxy.liveClientConnections() > 0 && !termClientCloseTimeout.isZero() && !termClientCloseTimeout.isNegative()) {
            waitForClientsToClose();
        }
        if (proxy.liveClientConnections() > 0 && !isForced()) {
            synchronized (this) {
                if (state instanceof ShutdownState.Draining draining) {
                    setState(draining.toClosingClients());
                }
            }
            LOGGER.info("Closing {} client connections", proxy.liveClientConnections());
            proxy.disconnectClients();
        }

        if (proxy.liveClientConnections() > 0 && termTimeout.isPresent()) {
            long timeoutMillis = termTimeout.get().toMillis();
            LOGGER.debug("Waiting at most {}ms for clients to close", timeoutMillis);
            watchdog.schedule(this::onTermTimeout, timeoutMillis, TimeUnit.MILLISECONDS);
        }

        while (proxy.liveClientConnections() > 0) {
            if (isForced()) {
                return terminated(HaltingProcessTerminator.EXIT_STATUS);
            }
            Thread.sleep(DRAIN_POLL_MILLIS);
        }
        if (isForced()) {
            return terminated(HaltingProcessTerminator.EXIT_STATUS);
        }
        LOGGER.info("No clients left. Exiting.");
        return terminated(0);
    }

    private void waitForClientsToClose() throws InterruptedException {
        LOGGER.info("Waiting for clients to close their connections");
        long deadline = System.nanoTime() + termClientCloseTimeout.toNanos();
        while (proxy.liveClientConnections() > 0) {
            if (isForced()) {
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                LOGGER.info("Timeout waiting for clients to close their connections");
                return;
            }
            Thread.sleep(CLIENT_CLOSE_POLL_MILLIS);
        }
        LOGGER.info("All clients have closed their connections");
    }

    private void onTermTimeout() {
        if (proxy.liveClientConnections() > 0) {
            abort("term timeout of " + termTimeout.map(Duration::toSeconds).orElse(0L) + "s elapsed");
        }
    }

    private void abort(String reason) {
        int live = proxy.liveClientConnections();
        synchronized (this) {
            if (state.isFinal()) {
                return;
            }
            setState(new ShutdownState.ForceTimeout(live, reason));
        }
        terminator.terminate(live, reason);
    }

    private synchronized boolean isForced() {
        return state instanceof ShutdownState.ForceTimeout;
    }

    private synchronized int terminated(int exitStatus) {
        setState(new ShutdownState.Terminated(exitStatus));
        return exitStatus;
    }

    private void setState(ShutdownState newState) {
        LOGGER.trace("Shutdown state {} -> {}", state.getClass().getSimpleName(), newState.getClass().getSimpleName());
        this.state = newState;
    }
}
