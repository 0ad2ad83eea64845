/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.frame;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * AMQP 0-9-1 frame types.
 */
public enum FrameType {
    METHOD(1),
    HEADER(2),
    BODY(3),
    HEARTBEAT(8);

    private final int code;

    FrameType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @param code the type octet read from the wire
     * @return the frame type, or null if the octet names no known type
     */
    @Nullable
    public static FrameType forCode(int code) {
        return switch (code) {
            case 1 -> METHOD;
            case 2 -> HEADER;
            case 3 -> BODY;
            case 8 -> HEARTBEAT;
            default -> null;
        };
    }

    /**
     * Header and body frames carry message content and must follow a content-bearing method
     * on the same channel.
     */
    public boolean isContent() {
        return this == HEADER || this == BODY;
    }
}
