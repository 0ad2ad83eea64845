/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

/**
 * Links a client channel to the upstream channel allocated for it, and tracks who is
 * closing the channel.
 */
public final class ChannelMapping {

    public enum State {
        OPEN,
        /** the client sent channel.close, waiting for the broker's close-ok */
        CLIENT_CLOSING,
        /** the broker sent channel.close, waiting for the client's close-ok */
        BROKER_CLOSING,
        /** the proxy sent channel.close because the session is ending */
        PROXY_CLOSING
    }

    private final int clientChannel;
    private final int upstreamChannel;
    private State state = State.OPEN;

    ChannelMapping(int clientChannel, int upstreamChannel) {
        this.clientChannel = clientChannel;
        this.upstreamChannel = upstreamChannel;
    }

    public int clientChannel() {
        return clientChannel;
    }

    public int upstreamChannel() {
        return upstreamChannel;
    }

    public State state() {
        return state;
    }

    void state(State state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return clientChannel + "->" + upstreamChannel + "(" + state + ")";
    }
}
