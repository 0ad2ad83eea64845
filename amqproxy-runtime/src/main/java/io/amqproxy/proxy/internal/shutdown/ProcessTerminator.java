/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.shutdown;

/**
 * Ends the process when a shutdown cannot complete gracefully.
 */
@FunctionalInterface
public interface ProcessTerminator {

    /**
     * @param liveConnections client connections still open
     * @param reason why the process is being ended
     */
    void terminate(int liveConnections, String reason);
}
