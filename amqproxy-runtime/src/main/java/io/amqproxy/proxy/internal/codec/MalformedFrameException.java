/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import io.netty.handler.codec.DecoderException;

/**
 * Raised when bytes on the wire cannot be a valid AMQP frame or method: a bad frame-end
 * octet, an unknown frame type, or a method payload shorter than its fields.
 */
public class MalformedFrameException extends DecoderException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
