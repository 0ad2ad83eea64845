/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import io.amqproxy.proxy.frame.ReplyCode;

/**
 * Failure to obtain or keep an upstream connection. Carries the reply code a client session
 * reports when closing its client because of it.
 */
public abstract class UpstreamException extends RuntimeException {

    protected UpstreamException(String message) {
        super(message);
    }

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ReplyCode replyCode();
}
