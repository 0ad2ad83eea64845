/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.frame;

/**
 * The AMQP 0-9-1 reply codes the proxy itself puts in connection.close and channel.close.
 */
public enum ReplyCode {
    REPLY_SUCCESS(200),
    CONNECTION_FORCED(320),
    ACCESS_REFUSED(403),
    FRAME_ERROR(501),
    SYNTAX_ERROR(502),
    COMMAND_INVALID(503),
    CHANNEL_ERROR(504),
    UNEXPECTED_FRAME(505),
    RESOURCE_ERROR(506),
    NOT_ALLOWED(530),
    NOT_IMPLEMENTED(540),
    INTERNAL_ERROR(541);

    private final int code;

    ReplyCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Reply text in the broker convention, e.g. {@code CHANNEL_ERROR - expected 'channel.open'}.
     */
    public String text(String detail) {
        return name() + " - " + detail;
    }
}
