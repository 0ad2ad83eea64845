/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.frame;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;

/**
 * The 8 byte header a client sends before its first frame, e.g. {@code AMQP\0\0\9\1}.
 *
 * @param protocolName the four ASCII characters identifying the protocol
 * @param protocolId protocol id octet, zero for AMQP 0-9-1
 * @param major major version
 * @param minor minor version
 * @param revision revision
 */
public record ProtocolHeader(String protocolName, int protocolId, int major, int minor, int revision) implements AmqpMessage {

    public static final int LENGTH = 8;

    public static final ProtocolHeader AMQP_0_9_1 = new ProtocolHeader("AMQP", 0, 0, 9, 1);

    public static ProtocolHeader readFrom(ByteBuf in) {
        String name = in.readCharSequence(4, StandardCharsets.US_ASCII).toString();
        return new ProtocolHeader(name,
                in.readUnsignedByte(),
                in.readUnsignedByte(),
                in.readUnsignedByte(),
                in.readUnsignedByte());
    }

    public void writeTo(ByteBuf out) {
        out.writeCharSequence(protocolName, StandardCharsets.US_ASCII);
        out.writeByte(protocolId);
        out.writeByte(major);
        out.writeByte(minor);
        out.writeByte(revision);
    }

    public boolean isSupported() {
        return AMQP_0_9_1.equals(this);
    }
}
