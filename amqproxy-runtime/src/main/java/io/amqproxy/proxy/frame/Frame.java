/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.frame;

import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.DefaultByteBufHolder;
import io.netty.buffer.Unpooled;

/**
 * A single AMQP frame: type, channel id and an opaque payload.
 *
 * <p>The payload is reference counted. Whoever ends up holding a frame is responsible for
 * writing it (the encoder releases it) or releasing it.</p>
 */
public final class Frame extends DefaultByteBufHolder implements AmqpMessage {

    /** Size of type, channel and size fields. */
    public static final int HEADER_SIZE = 7;

    /** Header plus the trailing frame-end octet. */
    public static final int OVERHEAD = HEADER_SIZE + 1;

    public static final int FRAME_END = 0xCE;

    private final FrameType type;
    private final int channel;

    public Frame(FrameType type, int channel, ByteBuf payload) {
        super(payload);
        this.type = Objects.requireNonNull(type);
        if (channel < 0 || channel > 0xFFFF) {
            throw new IllegalArgumentException("channel id out of range: " + channel);
        }
        this.channel = channel;
    }

    public static Frame heartbeat() {
        return new Frame(FrameType.HEARTBEAT, 0, Unpooled.EMPTY_BUFFER);
    }

    public FrameType type() {
        return type;
    }

    public int channel() {
        return channel;
    }

    public ByteBuf payload() {
        return content();
    }

    public int payloadSize() {
        return content().readableBytes();
    }

    /**
     * Returns a frame carrying this frame's payload on another channel. Ownership of the payload
     * moves to the returned frame; this instance must not be released afterwards.
     */
    public Frame remap(int newChannel) {
        return new Frame(type, newChannel, content());
    }

    public boolean isMethod() {
        return type == FrameType.METHOD;
    }

    public boolean isHeartbeat() {
        return type == FrameType.HEARTBEAT;
    }

    /**
     * @return the class id of a method frame
     */
    public int methodClassId() {
        requireMethod();
        return content().getUnsignedShort(content().readerIndex());
    }

    /**
     * @return the method id of a method frame
     */
    public int methodId() {
        requireMethod();
        return content().getUnsignedShort(content().readerIndex() + 2);
    }

    private void requireMethod() {
        if (!isMethod() || content().readableBytes() < 4) {
            throw new IllegalStateException("not a method frame: " + this);
        }
    }

    @Override
    public Frame copy() {
        return replace(content().copy());
    }

    @Override
    public Frame duplicate() {
        return replace(content().duplicate());
    }

    @Override
    public Frame retainedDuplicate() {
        return replace(content().retainedDuplicate());
    }

    @Override
    public Frame replace(ByteBuf content) {
        return new Frame(type, channel, content);
    }

    @Override
    public Frame retain() {
        super.retain();
        return this;
    }

    @Override
    public Frame retain(int increment) {
        super.retain(increment);
        return this;
    }

    @Override
    public Frame touch() {
        super.touch();
        return this;
    }

    @Override
    public Frame touch(Object hint) {
        super.touch(hint);
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Frame{type=").append(type)
                .append(", channel=").append(channel)
                .append(", size=").append(refCnt() > 0 ? content().readableBytes() : -1);
        if (isMethod() && refCnt() > 0 && content().readableBytes() >= 4) {
            sb.append(", method=").append(methodClassId()).append('.').append(methodId());
        }
        return sb.append('}').toString();
    }
}
