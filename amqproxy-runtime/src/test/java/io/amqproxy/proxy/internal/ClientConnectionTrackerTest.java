/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.amqproxy.proxy.config.ProxyConfig;
import io.amqproxy.proxy.config.UpstreamUrl;
import io.amqproxy.proxy.internal.session.ClientSessionStateMachine;
import io.amqproxy.proxy.internal.upstream.UpstreamPool;
import io.amqproxy.proxy.internal.util.Metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientConnectionTrackerTest {

    private final ClientConnectionTracker tracker = new ClientConnectionTracker();
    private final ProxyConfig config = ProxyConfig.builder(UpstreamUrl.parse("amqp://127.0.0.1")).build();
    private final UpstreamPool pool = new UpstreamPool(Duration.ofSeconds(5), ProxyConfig.DEFAULT_FRAME_MAX, Metrics.noop());

    private ClientSessionStateMachine session() {
        return new ClientSessionStateMachine(config, pool, tracker, Metrics.noop());
    }

    @Test
    void countsLiveSessions() {
        ClientSessionStateMachine first = session();
        ClientSessionStateMachine second = session();

        tracker.onSessionStarted(first);
        tracker.onSessionStarted(second);
        assertEquals(2, tracker.liveConnections());

        tracker.onSessionClosed(first);
        assertEquals(1, tracker.liveConnections());
        assertEquals(java.util.Set.of(second), tracker.sessions());
    }

    @Test
    void repeatedNotificationsAreCountedOnce() {
        ClientSessionStateMachine session = session();

        tracker.onSessionStarted(session);
        tracker.onSessionStarted(session);
        assertEquals(1, tracker.liveConnections());

        tracker.onSessionClosed(session);
        tracker.onSessionClosed(session);
        assertEquals(0, tracker.liveConnections());
        assertTrue(tracker.sessions().isEmpty());
    }

    @Test
    void closeAllWithNoSessionsDoesNothing() {
        assertEquals(0, tracker.closeAll());
    }
}
