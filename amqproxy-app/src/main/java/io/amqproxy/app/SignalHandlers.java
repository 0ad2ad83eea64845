/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.app;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.amqproxy.proxy.internal.shutdown.ShutdownCoordinator;

import sun.misc.Signal;

/**
 * Routes INT and TERM to the shutdown coordinator. The first signal starts a graceful drain,
 * a second one aborts. A JVM shutdown hook could not see the second signal.
 */
final class SignalHandlers {

    private static final Logger LOGGER = LoggerFactory.getLogger(SignalHandlers.class);

    static final List<String> SIGNALS = List.of("INT", "TERM");

    private SignalHandlers() {
    }

    static void install(ShutdownCoordinator coordinator) {
        for (String name : SIGNALS) {
            try {
                Signal.handle(new Signal(name), signal -> coordinator.onSignal(signal.getName()));
            }
            catch (IllegalArgumentException e) {
                LOGGER.warn("Cannot handle SIG{} on this platform: {}", name, e.getMessage());
            }
        }
    }
}
