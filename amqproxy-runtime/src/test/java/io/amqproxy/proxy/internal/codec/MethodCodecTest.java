/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelClose;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionClose;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStart;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTuneOk;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.FrameType;
import io.amqproxy.proxy.frame.ReplyCode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MethodCodecTest {

    private static AmqpMethod reencode(AmqpMethod method) {
        Frame frame = MethodCodec.frame(0, method, ByteBufAllocator.DEFAULT);
        try {
            return MethodCodec.decode(frame);
        }
        finally {
            frame.release();
        }
    }

    @Test
    void connectionStartCarriesServerProperties() {
        ConnectionStart start = new ConnectionStart(0, 9, Map.of("product", "AMQProxy",
                "capabilities", Map.of("connection.blocked", true)), "PLAIN AMQPLAIN", "en_US");

        ConnectionStart decoded = (ConnectionStart) reencode(start);

        assertEquals("AMQProxy", decoded.serverProperties().get("product"));
        assertEquals(Map.of("connection.blocked", true), decoded.serverProperties().get("capabilities"));
        assertEquals("PLAIN AMQPLAIN", decoded.mechanisms());
    }

    @Test
    void tuneOkKeepsUnsignedFrameMax() {
        ConnectionTuneOk decoded = (ConnectionTuneOk) reencode(new ConnectionTuneOk(2047, 0xFFFFFFF0L, 60));

        assertEquals(2047, decoded.channelMax());
        assertEquals(0xFFFFFFF0L, decoded.frameMax());
        assertEquals(60, decoded.heartbeat());
    }

    @Test
    void connectionCloseTextFollowsBrokerConvention() {
        ConnectionClose decoded = (ConnectionClose) reencode(ConnectionClose.of(ReplyCode.CONNECTION_FORCED, "Server shutdown"));

        assertEquals(320, decoded.replyCode());
        assertEquals("CONNECTION_FORCED - Server shutdown", decoded.replyText());
    }

    @Test
    void overlongReplyTextIsTruncated() {
        ChannelClose decoded = (ChannelClose) reencode(new ChannelClose(406, "x".repeat(300), 60, 40));

        assertEquals(255, decoded.replyText().length());
        assertEquals(60, decoded.failingClassId());
        assertEquals(40, decoded.failingMethodId());
    }

    @Test
    void multibyteReplyTextIsCutToShortStringBytes() {
        String text = "ACCESS_REFUSED - " + "\u00e9".repeat(150);

        ConnectionClose decoded = (ConnectionClose) reencode(new ConnectionClose(403, text, 10, 11));

        byte[] bytes = decoded.replyText().getBytes(StandardCharsets.UTF_8);
        assertTrue(bytes.length <= MethodCodec.MAX_SHORT_STRING_BYTES, "encoded " + bytes.length + " bytes");
        assertTrue(text.startsWith(decoded.replyText()));
        // 17 ASCII bytes leave room for 119 two-byte characters
        assertEquals(17 + 119, decoded.replyText().length());
    }

    @Test
    void truncationKeepsSurrogatePairsWhole() {
        String emoji = "\uD83D\uDE00";
        String text = "x".repeat(253) + emoji;

        assertEquals("x".repeat(253), MethodCodec.truncate(text));
        assertEquals("x".repeat(251) + emoji, MethodCodec.truncate("x".repeat(251) + emoji + "y"));
    }

    @Test
    void shortTextIsUnchanged() {
        String text = "\u00e9".repeat(127);

        assertSame(text, MethodCodec.truncate(text));
    }

    @Test
    void methodsOutsideConnectionAndChannelClassesAreNotDecoded() {
        // basic.publish
        Frame frame = new Frame(FrameType.METHOD, 1, Unpooled.wrappedBuffer(new byte[]{ 0, 60, 0, 40, 0, 0, 0, 0 }));

        assertNull(MethodCodec.decode(frame));
        frame.release();
    }

    @Test
    void unknownConnectionMethodIsNotDecoded() {
        // connection.update-secret
        Frame frame = new Frame(FrameType.METHOD, 0, Unpooled.wrappedBuffer(new byte[]{ 0, 10, 0, 70 }));

        assertNull(MethodCodec.decode(frame));
        frame.release();
    }

    @Test
    void truncatedPayloadIsMalformed() {
        // connection.tune-ok without arguments
        Frame frame = new Frame(FrameType.METHOD, 0, Unpooled.wrappedBuffer(new byte[]{ 0, 10, 0, 31, 0 }));

        assertThrows(MalformedFrameException.class, () -> MethodCodec.decode(frame));
        frame.release();
    }

    @Test
    void decodingLeavesPayloadUnread() {
        Frame frame = MethodCodec.frame(3, new AmqpMethod.ChannelOpen(), ByteBufAllocator.DEFAULT);
        int readable = frame.payloadSize();

        assertInstanceOf(AmqpMethod.ChannelOpen.class, MethodCodec.decode(frame));
        assertEquals(readable, frame.payloadSize());
        frame.release();
    }
}
