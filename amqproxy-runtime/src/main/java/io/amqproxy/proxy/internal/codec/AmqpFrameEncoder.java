/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import io.amqproxy.proxy.frame.AmqpMessage;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.ProtocolHeader;

/**
 * Writes {@link ProtocolHeader}s and {@link Frame}s. The payload is copied to the wire as is;
 * only the header fields come from the {@link Frame} itself.
 */
@ChannelHandler.Sharable
public class AmqpFrameEncoder extends MessageToByteEncoder<AmqpMessage> {

    public static final AmqpFrameEncoder INSTANCE = new AmqpFrameEncoder();

    public AmqpFrameEncoder() {
        super(AmqpMessage.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, AmqpMessage msg, ByteBuf out) {
        if (msg instanceof Frame frame) {
            ByteBuf payload = frame.payload();
            out.writeByte(frame.type().code());
            out.writeShort(frame.channel());
            out.writeInt(payload.readableBytes());
            out.writeBytes(payload, payload.readerIndex(), payload.readableBytes());
            out.writeByte(Frame.FRAME_END);
        }
        else if (msg instanceof ProtocolHeader header) {
            header.writeTo(out);
        }
    }

    @Override
    protected ByteBuf allocateBuffer(ChannelHandlerContext ctx, AmqpMessage msg, boolean preferDirect) {
        int size = msg instanceof Frame frame ? frame.payloadSize() + Frame.OVERHEAD : ProtocolHeader.LENGTH;
        return preferDirect ? ctx.alloc().ioBuffer(size) : ctx.alloc().heapBuffer(size);
    }
}
