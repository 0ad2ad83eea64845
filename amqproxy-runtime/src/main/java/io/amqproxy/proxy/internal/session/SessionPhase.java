/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

/**
 * Coarse lifecycle of a client session, as seen from outside the session.
 */
public enum SessionPhase {
    HANDSHAKING,
    OPEN,
    CLOSING,
    CLOSED;

    /**
     * @return whether a session in this phase counts as a live client connection
     */
    public boolean isLive() {
        return this != CLOSED;
    }
}
