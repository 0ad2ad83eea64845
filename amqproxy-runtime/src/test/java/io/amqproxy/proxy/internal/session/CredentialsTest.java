/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStartOk;
import io.amqproxy.proxy.frame.ReplyCode;
import io.amqproxy.proxy.internal.codec.FieldTables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CredentialsTest {

    private static ConnectionStartOk startOk(String mechanism, byte[] response) {
        return new ConnectionStartOk(Map.of(), mechanism, response, "en_US");
    }

    private static byte[] amqPlain(Map<String, Object> fields) {
        ByteBuf buf = Unpooled.buffer();
        FieldTables.writeTable(buf, fields);
        buf.skipBytes(4);
        byte[] bytes = new byte[buf.readableBytes()];
        buf.readBytes(bytes);
        buf.release();
        return bytes;
    }

    @Test
    void plainResponse() {
        Credentials credentials = Credentials.from(startOk("PLAIN", "\0guest\0s3cret".getBytes(StandardCharsets.UTF_8)));

        assertEquals(new Credentials("guest", "s3cret"), credentials);
    }

    @Test
    void plainPasswordMayContainAnything() {
        Credentials credentials = Credentials.from(startOk("PLAIN", "authz\0user\0pa:ss@wo/rd".getBytes(StandardCharsets.UTF_8)));

        assertEquals("user", credentials.username());
        assertEquals("pa:ss@wo/rd", credentials.password());
    }

    @Test
    void amqPlainResponse() {
        Credentials credentials = Credentials.from(startOk("AMQPLAIN", amqPlain(Map.of("LOGIN", "bob", "PASSWORD", "pw"))));

        assertEquals(new Credentials("bob", "pw"), credentials);
    }

    @Test
    void amqPlainWithoutPasswordIsRefused() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> Credentials.from(startOk("AMQPLAIN", amqPlain(Map.of("LOGIN", "bob")))));

        assertEquals(ReplyCode.ACCESS_REFUSED, e.replyCode());
    }

    @Test
    void malformedPlainIsRefused() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> Credentials.from(startOk("PLAIN", "guest".getBytes(StandardCharsets.UTF_8))));

        assertEquals(ReplyCode.ACCESS_REFUSED, e.replyCode());
    }

    @Test
    void unsupportedMechanismIsRefused() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> Credentials.from(startOk("EXTERNAL", new byte[0])));

        assertEquals(ReplyCode.ACCESS_REFUSED, e.replyCode());
        assertEquals(10, e.classId());
        assertEquals(11, e.methodId());
    }

    @Test
    void toStringHidesPassword() {
        assertFalse(new Credentials("guest", "s3cret").toString().contains("s3cret"));
    }
}
