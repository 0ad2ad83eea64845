/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.shutdown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Halts the JVM with status 1. Shutdown hooks do not run; the process is being abandoned.
 */
public class HaltingProcessTerminator implements ProcessTerminator {

    private static final Logger LOGGER = LoggerFactory.getLogger(HaltingProcessTerminator.class);

    public static final int EXIT_STATUS = 1;

    @Override
    public void terminate(int liveConnections, String reason) {
        LOGGER.error("Exiting with {} client connections still open ({})", liveConnections, reason);
        Runtime.getRuntime().halt(EXIT_STATUS);
    }
}
