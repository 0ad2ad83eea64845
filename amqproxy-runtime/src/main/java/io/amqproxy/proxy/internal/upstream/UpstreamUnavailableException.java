/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import io.amqproxy.proxy.frame.ReplyCode;

/**
 * The broker could not be reached, or the connection failed before the handshake completed.
 */
public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ReplyCode replyCode() {
        return ReplyCode.INTERNAL_ERROR;
    }
}
