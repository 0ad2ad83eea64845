/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.frame;

/**
 * Anything that travels on an AMQP 0-9-1 socket: the protocol header sent once by the
 * connecting peer, followed by a sequence of frames.
 */
public sealed interface AmqpMessage permits ProtocolHeader, Frame {
}
