/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

import io.amqproxy.proxy.internal.upstream.EndpointIdentity;
import io.amqproxy.proxy.internal.upstream.UpstreamConnection;

/**
 * Sealed hierarchy representing client session states.
 * The first five states together make up the handshaking phase.
 *
 * <pre>
 *   Startup
 *      │ protocol header
 *      ▼
 *   AwaitingStartOk
 *      │ start-ok
 *      ▼
 *   AwaitingTuneOk
 *      │ tune-ok
 *      ▼
 *   AwaitingOpen
 *      │ open
 *      ▼
 *   Leasing ──────────────┐ lease failed
 *      │ lease granted    │
 *      ▼                  │
 *   Open                  │
 *      │                  │
 *      ▼                  │
 *   Closing ◄─────────────┘
 *      │
 *      ▼
 *   Closed
 * </pre>
 */
public sealed interface ClientSessionState permits
        ClientSessionState.Startup,
        ClientSessionState.AwaitingStartOk,
        ClientSessionState.AwaitingTuneOk,
        ClientSessionState.AwaitingOpen,
        ClientSessionState.Leasing,
        ClientSessionState.Open,
        ClientSessionState.Closing,
        ClientSessionState.Closed {

    SessionPhase phase();

    /**
     * Initial state - waiting for the client's protocol header.
     */
    record Startup() implements ClientSessionState {
        public static final Startup INSTANCE = new Startup();

        public AwaitingStartOk toAwaitingStartOk() {
            return new AwaitingStartOk();
        }

        @Override
        public SessionPhase phase() {
            return SessionPhase.HANDSHAKING;
        }
    }

    /**
     * connection.start sent.
     */
    record AwaitingStartOk() implements ClientSessionState {

        public AwaitingTuneOk toAwaitingTuneOk(Credentials credentials) {
            return new AwaitingTuneOk(credentials);
        }

        @Override
        public SessionPhase phase() {
            return SessionPhase.HANDSHAKING;
        }
    }

    /**
     * connection.tune sent.
     */
    record AwaitingTuneOk(Credentials credentials) implements ClientSessionState {

        public AwaitingOpen toAwaitingOpen(Tuning tuning) {
            return new AwaitingOpen(credentials, tuning);
        }

        @Override
        public SessionPhase phase() {
            return SessionPhase.HANDSHAKING;
        }
    }

    /**
     * Tuned, waiting for connection.open naming the virtual host.
     */
    record AwaitingOpen(Credentials credentials, Tuning tuning) implements ClientSessionState {

        public Leasing toLeasing(EndpointIdentity identity) {
            return new Leasing(identity, tuning);
        }

        @Override
        public SessionPhase phase() {
            return SessionPhase.HANDSHAKING;
        }
    }

    /**
     * Waiting for the pool to hand over an upstream connection.
     */
    record Leasing(EndpointIdentity identity, Tuning tuning) implements ClientSessionState {

        public Open toOpen(UpstreamConnection upstream) {
            return new Open(identity, tuning, upstream);
        }

        @Override
        public SessionPhase phase() {
            return SessionPhase.HANDSHAKING;
        }
    }

    /**
     * connection.open-ok sent; frames are relayed.
     * This is the steady state during normal operation.
     */
    record Open(EndpointIdentity identity, Tuning tuning, UpstreamConnection upstream) implements ClientSessionState {

        @Override
        public SessionPhase phase() {
            return SessionPhase.OPEN;
        }
    }

    /**
     * Tearing down. The client side is either already closed or waiting for the client's
     * close-ok, and upstream channels may still be closing.
     *
     * @param awaitingClientCloseOk whether the proxy sent connection.close and waits for the reply
     */
    record Closing(boolean awaitingClientCloseOk) implements ClientSessionState {

        public Closed toClosed() {
            return Closed.INSTANCE;
        }

        @Override
        public SessionPhase phase() {
            return SessionPhase.CLOSING;
        }
    }

    /**
     * Terminal state - client socket closed and lease returned.
     */
    record Closed() implements ClientSessionState {
        public static final Closed INSTANCE = new Closed();

        @Override
        public SessionPhase phase() {
            return SessionPhase.CLOSED;
        }
    }
}
