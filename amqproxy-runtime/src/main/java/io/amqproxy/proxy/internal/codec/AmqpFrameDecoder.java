/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.FrameType;
import io.amqproxy.proxy.frame.ProtocolHeader;

/**
 * Decodes AMQP 0-9-1 frames.
 *
 * <pre>
 *   +------+---------+----------+------------------+-----------+
 *   | type | channel |   size   |     payload      | frame-end |
 *   |  1   |    2    |    4     |    size octets   |  1 (0xCE) |
 *   +------+---------+----------+------------------+-----------+
 * </pre>
 *
 * <p>Frames split across several socket reads are accumulated by the
 * {@link LengthFieldBasedFrameDecoder} base class. The payload of each emitted {@link Frame}
 * is a retained slice of the inbound buffer, so bodies are never copied.</p>
 *
 * <p>A decoder on the accepting side is created with {@code expectProtocolHeader} set, in which
 * case the first 8 bytes are emitted as a {@link ProtocolHeader}.</p>
 */
public class AmqpFrameDecoder extends LengthFieldBasedFrameDecoder {

    private static final int LENGTH_FIELD_OFFSET = 3;
    private static final int LENGTH_FIELD_LENGTH = 4;
    // the length field excludes the frame-end octet
    private static final int LENGTH_ADJUSTMENT = 1;
    private static final int INITIAL_BYTES_TO_STRIP = 0;

    private final int maxPayloadSize;
    private boolean expectProtocolHeader;

    public AmqpFrameDecoder(int maxPayloadSize, boolean expectProtocolHeader) {
        super(maxPayloadSize + Frame.OVERHEAD, LENGTH_FIELD_OFFSET, LENGTH_FIELD_LENGTH, LENGTH_ADJUSTMENT, INITIAL_BYTES_TO_STRIP, true);
        this.maxPayloadSize = maxPayloadSize;
        this.expectProtocolHeader = expectProtocolHeader;
    }

    public int maxPayloadSize() {
        return maxPayloadSize;
    }

    @Override
    protected Object decode(ChannelHandlerContext ctx, ByteBuf in) throws Exception {
        if (expectProtocolHeader) {
            if (in.readableBytes() < ProtocolHeader.LENGTH) {
                return null;
            }
            expectProtocolHeader = false;
            return ProtocolHeader.readFrom(in);
        }

        ByteBuf frame = (ByteBuf) super.decode(ctx, in);
        if (frame == null) {
            return null;
        }
        try {
            int typeCode = frame.readUnsignedByte();
            FrameType type = FrameType.forCode(typeCode);
            if (type == null) {
                throw new MalformedFrameException("unknown frame type " + typeCode);
            }
            int channel = frame.readUnsignedShort();
            int size = (int) frame.readUnsignedInt();
            int end = frame.getUnsignedByte(frame.readerIndex() + size);
            if (end != Frame.FRAME_END) {
                throw new MalformedFrameException("invalid frame end octet 0x" + Integer.toHexString(end)
                        + " for " + type + " frame on channel " + channel);
            }
            if (type == FrameType.HEARTBEAT && channel != 0) {
                throw new MalformedFrameException("heartbeat frame on channel " + channel);
            }
            return new Frame(type, channel, frame.readRetainedSlice(size));
        }
        finally {
            frame.release();
        }
    }
}
