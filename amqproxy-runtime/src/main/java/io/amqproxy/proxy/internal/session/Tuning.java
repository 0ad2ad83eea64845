/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

/**
 * Values negotiated with the client in connection.tune / tune-ok.
 *
 * @param channelMax highest channel id the client may use
 * @param frameMax largest frame the client may send, including frame overhead
 * @param heartbeatSeconds heartbeat interval, 0 when disabled
 */
public record Tuning(int channelMax, long frameMax, int heartbeatSeconds) {}
