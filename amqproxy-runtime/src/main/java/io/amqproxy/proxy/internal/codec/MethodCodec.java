/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelClose;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelCloseOk;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelOpenOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionBlocked;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionClose;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionCloseOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpenOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStart;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStartOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTune;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTuneOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionUnblocked;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.FrameType;
import io.amqproxy.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decodes and encodes the method payloads in {@link AmqpMethod}. Decoding never moves the
 * reader index of the frame payload, so a frame that turns out to be uninteresting can
 * still be relayed untouched.
 */
public final class MethodCodec {

    static final int MAX_SHORT_STRING_BYTES = 255;

    private MethodCodec() {
    }

    /**
     * @param frame a method frame
     * @return the decoded method, or null when the method is not one the proxy intercepts
     * @throws MalformedFrameException if the payload is too short for the method's fields
     */
    @Nullable
    public static AmqpMethod decode(Frame frame) {
        if (!frame.isMethod()) {
            throw new IllegalArgumentException("not a method frame: " + frame);
        }
        ByteBuf in = frame.payload().duplicate();
        try {
            int classId = in.readUnsignedShort();
            int methodId = in.readUnsignedShort();
            if (classId == AmqpMethod.CONNECTION_CLASS) {
                return decodeConnectionMethod(methodId, in);
            }
            else if (classId == AmqpMethod.CHANNEL_CLASS) {
                return decodeChannelMethod(methodId, in);
            }
            return null;
        }
        catch (IndexOutOfBoundsException e) {
            throw new MalformedFrameException("truncated method payload in " + frame, e);
        }
    }

    @Nullable
    private static AmqpMethod decodeConnectionMethod(int methodId, ByteBuf in) {
        return switch (methodId) {
            case 10 -> new ConnectionStart(in.readUnsignedByte(), in.readUnsignedByte(),
                    FieldTables.readTable(in),
                    new String(FieldTables.readLongString(in), StandardCharsets.UTF_8),
                    new String(FieldTables.readLongString(in), StandardCharsets.UTF_8));
            case 11 -> new ConnectionStartOk(FieldTables.readTable(in),
                    FieldTables.readShortString(in),
                    FieldTables.readLongString(in),
                    FieldTables.readShortString(in));
            case 30 -> new ConnectionTune(in.readUnsignedShort(), in.readUnsignedInt(), in.readUnsignedShort());
            case 31 -> new ConnectionTuneOk(in.readUnsignedShort(), in.readUnsignedInt(), in.readUnsignedShort());
            case 40 -> new ConnectionOpen(FieldTables.readShortString(in));
            case 41 -> new ConnectionOpenOk();
            case 50 -> new ConnectionClose(in.readUnsignedShort(), FieldTables.readShortString(in),
                    in.readUnsignedShort(), in.readUnsignedShort());
            case 51 -> new ConnectionCloseOk();
            case 60 -> new ConnectionBlocked(FieldTables.readShortString(in));
            case 61 -> new ConnectionUnblocked();
            default -> null;
        };
    }

    @Nullable
    private static AmqpMethod decodeChannelMethod(int methodId, ByteBuf in) {
        return switch (methodId) {
            case 10 -> new ChannelOpen();
            case 11 -> new ChannelOpenOk();
            case 40 -> new ChannelClose(in.readUnsignedShort(), FieldTables.readShortString(in),
                    in.readUnsignedShort(), in.readUnsignedShort());
            case 41 -> new ChannelCloseOk();
            default -> null;
        };
    }

    /**
     * Builds a method frame.
     *
     * @param channel channel id, 0 for connection class methods
     * @param method the method
     * @param alloc allocator for the payload
     * @return a new frame owning its payload
     */
    public static Frame frame(int channel, AmqpMethod method, ByteBufAllocator alloc) {
        return new Frame(FrameType.METHOD, channel, encode(method, alloc));
    }

    public static ByteBuf encode(AmqpMethod method, ByteBufAllocator alloc) {
        ByteBuf out = alloc.buffer();
        out.writeShort(method.classId());
        out.writeShort(method.methodId());
        if (method instanceof ConnectionStart start) {
            out.writeByte(start.versionMajor());
            out.writeByte(start.versionMinor());
            FieldTables.writeTable(out, start.serverProperties());
            FieldTables.writeLongString(out, start.mechanisms());
            FieldTables.writeLongString(out, start.locales());
        }
        else if (method instanceof ConnectionStartOk startOk) {
            FieldTables.writeTable(out, startOk.clientProperties());
            FieldTables.writeShortString(out, startOk.mechanism());
            FieldTables.writeLongString(out, startOk.response());
            FieldTables.writeShortString(out, startOk.locale());
        }
        else if (method instanceof ConnectionTune tune) {
            out.writeShort(tune.channelMax());
            out.writeInt((int) tune.frameMax());
            out.writeShort(tune.heartbeat());
        }
        else if (method instanceof ConnectionTuneOk tuneOk) {
            out.writeShort(tuneOk.channelMax());
            out.writeInt((int) tuneOk.frameMax());
            out.writeShort(tuneOk.heartbeat());
        }
        else if (method instanceof ConnectionOpen open) {
            FieldTables.writeShortString(out, open.virtualHost());
            // reserved capabilities shortstr and insist bit
            FieldTables.writeShortString(out, "");
            out.writeByte(0);
        }
        else if (method instanceof ConnectionOpenOk) {
            // reserved known-hosts
            FieldTables.writeShortString(out, "");
        }
        else if (method instanceof ConnectionClose close) {
            out.writeShort(close.replyCode());
            FieldTables.writeShortString(out, truncate(close.replyText()));
            out.writeShort(close.failingClassId());
            out.writeShort(close.failingMethodId());
        }
        else if (method instanceof ConnectionBlocked blocked) {
            FieldTables.writeShortString(out, truncate(blocked.reason()));
        }
        else if (method instanceof ChannelOpen) {
            // reserved out-of-band
            FieldTables.writeShortString(out, "");
        }
        else if (method instanceof ChannelOpenOk) {
            // reserved channel-id longstr
            out.writeInt(0);
        }
        else if (method instanceof ChannelClose close) {
            out.writeShort(close.replyCode());
            FieldTables.writeShortString(out, truncate(close.replyText()));
            out.writeShort(close.failingClassId());
            out.writeShort(close.failingMethodId());
        }
        // close-ok, unblocked and channel close-ok have no arguments
        return out;
    }

    /**
     * Cuts {@code text} to the 255 UTF-8 bytes a shortstr can hold, never splitting a code point.
     */
    @VisibleForTesting
    static String truncate(String text) {
        if (text.getBytes(StandardCharsets.UTF_8).length <= MAX_SHORT_STRING_BYTES) {
            return text;
        }
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            int encoded = utf8Length(codePoint);
            if (bytes + encoded > MAX_SHORT_STRING_BYTES) {
                break;
            }
            bytes += encoded;
            end += Character.charCount(codePoint);
        }
        return text.substring(0, end);
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        // lone surrogates are encoded as '?'
        if (Character.isSurrogate((char) codePoint)) {
            return 1;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
