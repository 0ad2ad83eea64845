/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.shutdown;

/**
 * Phases of a graceful shutdown.
 *
 * <pre>
 *   Running ──signal──► Draining ──► ClosingClients ──► Terminated
 *                          │               │
 *                          └──timeout / second signal──► ForceTimeout
 * </pre>
 */
public sealed interface ShutdownState permits
        ShutdownState.Running,
        ShutdownState.Draining,
        ShutdownState.ClosingClients,
        ShutdownState.ForceTimeout,
        ShutdownState.Terminated {

    /**
     * Accepting clients; no signal received yet.
     */
    record Running() implements ShutdownState {
        public static final Running INSTANCE = new Running();

        public Draining toDraining() {
            return Draining.INSTANCE;
        }
    }

    /**
     * Listener closed; waiting for clients to leave on their own.
     */
    record Draining() implements ShutdownState {
        public static final Draining INSTANCE = new Draining();

        public ClosingClients toClosingClients() {
            return ClosingClients.INSTANCE;
        }
    }

    /**
     * connection.close sent to every remaining client.
     */
    record ClosingClients() implements ShutdownState {
        public static final ClosingClients INSTANCE = new ClosingClients();
    }

    /**
     * Gave up waiting.
     *
     * @param liveConnections client connections still open at that moment
     * @param reason why the wait was abandoned
     */
    record ForceTimeout(int liveConnections, String reason) implements ShutdownState {}

    /**
     * @param exitStatus process exit status
     */
    record Terminated(int exitStatus) implements ShutdownState {}

    default boolean isFinal() {
        return this instanceof ForceTimeout || this instanceof Terminated;
    }
}
