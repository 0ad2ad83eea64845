/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.frame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The connection and channel class methods the proxy intercepts. Every other method is
 * relayed as an opaque payload and never decoded.
 *
 * <pre>
 *   connection: start, start-ok, tune, tune-ok, open, open-ok, close, close-ok, blocked, unblocked
 *   channel:    open, open-ok, close, close-ok
 * </pre>
 */
public sealed interface AmqpMethod permits
        AmqpMethod.ConnectionStart,
        AmqpMethod.ConnectionStartOk,
        AmqpMethod.ConnectionTune,
        AmqpMethod.ConnectionTuneOk,
        AmqpMethod.ConnectionOpen,
        AmqpMethod.ConnectionOpenOk,
        AmqpMethod.ConnectionClose,
        AmqpMethod.ConnectionCloseOk,
        AmqpMethod.ConnectionBlocked,
        AmqpMethod.ConnectionUnblocked,
        AmqpMethod.ChannelOpen,
        AmqpMethod.ChannelOpenOk,
        AmqpMethod.ChannelClose,
        AmqpMethod.ChannelCloseOk {

    int CONNECTION_CLASS = 10;
    int CHANNEL_CLASS = 20;

    int classId();

    int methodId();

    record ConnectionStart(int versionMajor,
                           int versionMinor,
                           Map<String, Object> serverProperties,
                           String mechanisms,
                           String locales)
            implements AmqpMethod {
        public ConnectionStart {
            serverProperties = Collections.unmodifiableMap(new LinkedHashMap<>(serverProperties));
        }

        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 10;
        }
    }

    record ConnectionStartOk(Map<String, Object> clientProperties,
                             String mechanism,
                             byte[] response,
                             String locale)
            implements AmqpMethod {
        public ConnectionStartOk {
            Objects.requireNonNull(clientProperties);
            Objects.requireNonNull(mechanism);
            Objects.requireNonNull(response);
        }

        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 11;
        }

        @Override
        public String toString() {
            // response carries credentials
            return "ConnectionStartOk[mechanism=" + mechanism + ", locale=" + locale + "]";
        }
    }

    record ConnectionTune(int channelMax, long frameMax, int heartbeat) implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 30;
        }
    }

    record ConnectionTuneOk(int channelMax, long frameMax, int heartbeat) implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 31;
        }
    }

    record ConnectionOpen(String virtualHost) implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 40;
        }
    }

    record ConnectionOpenOk() implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 41;
        }
    }

    record ConnectionClose(int replyCode, String replyText, int failingClassId, int failingMethodId) implements AmqpMethod {

        public static ConnectionClose of(ReplyCode code, String detail) {
            return new ConnectionClose(code.code(), code.text(detail), 0, 0);
        }

        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 50;
        }
    }

    record ConnectionCloseOk() implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 51;
        }
    }

    record ConnectionBlocked(String reason) implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 60;
        }
    }

    record ConnectionUnblocked() implements AmqpMethod {
        @Override
        public int classId() {
            return CONNECTION_CLASS;
        }

        @Override
        public int methodId() {
            return 61;
        }
    }

    record ChannelOpen() implements AmqpMethod {
        @Override
        public int classId() {
            return CHANNEL_CLASS;
        }

        @Override
        public int methodId() {
            return 10;
        }
    }

    record ChannelOpenOk() implements AmqpMethod {
        @Override
        public int classId() {
            return CHANNEL_CLASS;
        }

        @Override
        public int methodId() {
            return 11;
        }
    }

    record ChannelClose(int replyCode, String replyText, int failingClassId, int failingMethodId) implements AmqpMethod {
        @Override
        public int classId() {
            return CHANNEL_CLASS;
        }

        @Override
        public int methodId() {
            return 40;
        }
    }

    record ChannelCloseOk() implements AmqpMethod {
        @Override
        public int classId() {
            return CHANNEL_CLASS;
        }

        @Override
        public int methodId() {
            return 41;
        }
    }
}
