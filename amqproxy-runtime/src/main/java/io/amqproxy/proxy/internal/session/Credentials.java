/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStartOk;
import io.amqproxy.proxy.frame.ReplyCode;
import io.amqproxy.proxy.internal.codec.FieldTables;
import io.amqproxy.proxy.internal.codec.MalformedFrameException;

/**
 * User name and password a client presented in connection.start-ok.
 */
public record Credentials(String username, String password) {

    public static final String PLAIN = "PLAIN";
    public static final String AMQPLAIN = "AMQPLAIN";
    public static final String SUPPORTED_MECHANISMS = PLAIN + " " + AMQPLAIN;

    public Credentials {
        Objects.requireNonNull(username);
        Objects.requireNonNull(password);
    }

    /**
     * Extracts credentials from the SASL response of a start-ok.
     *
     * @throws ProtocolException with {@link ReplyCode#ACCESS_REFUSED} if the mechanism is not
     * supported or the response cannot be parsed
     */
    public static Credentials from(ConnectionStartOk startOk) {
        return switch (startOk.mechanism()) {
            case PLAIN -> fromPlain(startOk.response());
            case AMQPLAIN -> fromAmqPlain(startOk.response());
            default -> throw refused("unsupported authentication mechanism '" + startOk.mechanism() + "', use one of " + SUPPORTED_MECHANISMS);
        };
    }

    // [authzid] NUL authcid NUL passwd
    static Credentials fromPlain(byte[] response) {
        String text = new String(response, StandardCharsets.UTF_8);
        int first = text.indexOf('\0');
        int second = first < 0 ? -1 : text.indexOf('\0', first + 1);
        if (second < 0) {
            throw refused("malformed PLAIN response");
        }
        return new Credentials(text.substring(first + 1, second), text.substring(second + 1));
    }

    // a field table without its length prefix
    static Credentials fromAmqPlain(byte[] response) {
        ByteBuf table = Unpooled.buffer(response.length + 4);
        try {
            table.writeInt(response.length);
            table.writeBytes(response);
            Map<String, Object> fields = FieldTables.readTable(table);
            Object login = fields.get("LOGIN");
            Object password = fields.get("PASSWORD");
            if (login == null || password == null) {
                throw refused("AMQPLAIN response lacks LOGIN or PASSWORD");
            }
            return new Credentials(text(login), text(password));
        }
        catch (MalformedFrameException | IndexOutOfBoundsException e) {
            throw refused("malformed AMQPLAIN response");
        }
        finally {
            table.release();
        }
    }

    private static String text(Object value) {
        return value instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : value.toString();
    }

    private static ProtocolException refused(String message) {
        return new ProtocolException(ReplyCode.ACCESS_REFUSED, message, AmqpMethod.CONNECTION_CLASS, 11);
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + "]";
    }
}
