/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sealed hierarchy representing the lifecycle of one pooled broker connection.
 *
 * <pre>
 *   Handshaking(CONNECTING → AWAITING_START → AWAITING_TUNE → AWAITING_OPEN_OK)
 *      │
 *      ├──────────────► Closed (connect, TLS or handshake failure)
 *      │
 *      ▼ open-ok
 *   Leased ◄──────► Idle
 *      │              │
 *      ▼              ▼  evict / broker close / transport failure
 *   Closing ───────► Closed
 * </pre>
 */
public sealed interface UpstreamConnectionState permits
        UpstreamConnectionState.Handshaking,
        UpstreamConnectionState.Idle,
        UpstreamConnectionState.Leased,
        UpstreamConnectionState.Closing,
        UpstreamConnectionState.Closed {

    enum HandshakeStep {
        CONNECTING,
        AWAITING_START,
        AWAITING_TUNE,
        AWAITING_OPEN_OK
    }

    /**
     * TCP connect, TLS and the AMQP connection negotiation.
     */
    record Handshaking(HandshakeStep step) implements UpstreamConnectionState {
        public static final Handshaking CONNECTING = new Handshaking(HandshakeStep.CONNECTING);

        public Handshaking next(HandshakeStep nextStep) {
            if (nextStep.ordinal() != step.ordinal() + 1) {
                throw new IllegalStateException("Cannot move from " + step + " to " + nextStep);
            }
            return new Handshaking(nextStep);
        }

        public Leased toLeased(UpstreamListener lessee) {
            return new Leased(lessee);
        }
    }

    /**
     * In the pool, unleased.
     *
     * @param idleSinceNanos {@link System#nanoTime()} at release
     */
    record Idle(long idleSinceNanos) implements UpstreamConnectionState {

        public Leased toLeased(UpstreamListener lessee) {
            return new Leased(lessee);
        }
    }

    /**
     * Held by exactly one client session.
     */
    record Leased(UpstreamListener lessee) implements UpstreamConnectionState {

        public Idle toIdle(long nowNanos) {
            return new Idle(nowNanos);
        }
    }

    /**
     * connection.close sent, waiting for close-ok or the socket to go away.
     */
    record Closing(@Nullable Throwable cause) implements UpstreamConnectionState {}

    /**
     * Terminal state - socket closed.
     */
    record Closed() implements UpstreamConnectionState { public static final Closed INSTANCE = new Closed(); }

    default boolean isUsable() {
        return this instanceof Idle || this instanceof Leased;
    }

    default boolean isTerminal() {
        return this instanceof Closing || this instanceof Closed;
    }
}
