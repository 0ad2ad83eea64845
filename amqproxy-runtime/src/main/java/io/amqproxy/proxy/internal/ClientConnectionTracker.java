/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.amqproxy.proxy.internal;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.amqproxy.proxy.internal.session.ClientSessionStateMachine;

/**
 * Tracks live client sessions to enable graceful shutdown and draining.
 * A session counts as live from the moment its socket is accepted until it has closed and
 * returned its upstream lease.
 * This class is thread-safe and can be used concurrently from multiple Netty event loops.
 */
public class ClientConnectionTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientConnectionTracker.class);

    private final Set<ClientSessionStateMachine> sessions = ConcurrentHashMap.newKeySet();
    private final AtomicInteger liveConnections = new AtomicInteger();

    /**
     * Records that a client session has started.
     */
    public void onSessionStarted(ClientSessionStateMachine session) {
        if (sessions.add(session)) {
            int live = liveConnections.incrementAndGet();
            LOGGER.debug("{}: Client connection established. Live: {}", session.sessionId(), live);
        }
    }

    /**
     * Records that a client session has finished.
     */
    public void onSessionClosed(ClientSessionStateMachine session) {
        if (sessions.remove(session)) {
            int live = liveConnections.decrementAndGet();
            LOGGER.debug("{}: Client connection closed. Live: {}", session.sessionId(), live);
        }
    }

    /**
     * @return the number of live client sessions
     */
    public int liveConnections() {
        return Math.max(0, liveConnections.get());
    }

    /**
     * @return a snapshot of the live sessions
     */
    public Set<ClientSessionStateMachine> sessions() {
        return Set.copyOf(sessions);
    }

    /**
     * Asks every live session to close its client connection.
     *
     * @return the number of sessions asked to close
     */
    public int closeAll() {
        Set<ClientSessionStateMachine> snapshot = sessions();
        LOGGER.debug("Closing {} client connections", snapshot.size());
        snapshot.forEach(ClientSessionStateMachine::requestClose);
        return snapshot.size();
    }
}
