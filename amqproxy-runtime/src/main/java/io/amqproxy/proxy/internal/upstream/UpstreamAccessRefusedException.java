/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import io.amqproxy.proxy.frame.ReplyCode;

/**
 * The broker refused the credentials or the virtual host.
 */
public class UpstreamAccessRefusedException extends UpstreamException {

    public UpstreamAccessRefusedException(String message) {
        super(message);
    }

    @Override
    public ReplyCode replyCode() {
        return ReplyCode.ACCESS_REFUSED;
    }
}
