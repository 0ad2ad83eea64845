/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

import java.util.Objects;

import io.amqproxy.proxy.frame.ReplyCode;

/**
 * A client broke the protocol. The session closes the client connection with
 * {@link #replyCode()}.
 */
public class ProtocolException extends RuntimeException {

    private final ReplyCode replyCode;
    private final int classId;
    private final int methodId;

    public ProtocolException(ReplyCode replyCode, String message) {
        this(replyCode, message, 0, 0);
    }

    /**
     * @param classId class of the offending method, 0 if not caused by a method
     * @param methodId offending method, 0 if not caused by a method
     */
    public ProtocolException(ReplyCode replyCode, String message, int classId, int methodId) {
        super(message);
        this.replyCode = Objects.requireNonNull(replyCode);
        this.classId = classId;
        this.methodId = methodId;
    }

    public ReplyCode replyCode() {
        return replyCode;
    }

    public int classId() {
        return classId;
    }

    public int methodId() {
        return methodId;
    }
}
