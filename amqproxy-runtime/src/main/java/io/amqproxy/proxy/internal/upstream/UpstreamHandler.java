/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;

import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.tag.VisibleForTesting;

/**
 * Netty channel handler for a pooled broker connection.
 *
 * <p>Translates Netty I/O callbacks into {@link UpstreamConnection} events:</p>
 * <ul>
 *   <li>Connection lifecycle (handler added, inactive)</li>
 *   <li>TLS handshake completion</li>
 *   <li>Decoded frames and read completion</li>
 *   <li>Backpressure via writability changes</li>
 *   <li>Heartbeat timeouts from the {@link io.netty.handler.timeout.IdleStateHandler}</li>
 *   <li>Exceptions</li>
 * </ul>
 */
public class UpstreamHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpstreamHandler.class);

    @VisibleForTesting
    final UpstreamConnection connection;

    public UpstreamHandler(UpstreamConnection connection) {
        this.connection = Objects.requireNonNull(connection);
    }

    /**
     * The handler is added by the channel initializer, so the channel is already registered.
     */
    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        connection.setChannel(ctx.channel());
    }

    /**
     * Netty callback for custom events like SSL Handshake completion and idle timeouts.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object event) throws Exception {
        if (event instanceof SslHandshakeCompletionEvent sslEvt) {
            if (sslEvt.isSuccess()) {
                connection.onConnectionActive();
            }
            else {
                connection.onConnectionFailed(sslEvt.cause());
            }
        }
        else if (event instanceof IdleStateEvent idleEvt) {
            connection.onIdle(idleEvt.state());
        }
        super.userEventTriggered(ctx, event);
    }

    /**
     * Netty callback that the broker socket has disconnected.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        connection.onConnectionInactive();
    }

    /**
     * Netty callback indicating that an exception reached Netty.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        connection.onConnectionError(cause);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof Frame frame) {
            connection.onFrame(frame);
        }
        else {
            LOGGER.warn("{}: Unexpected message {}", connection.id(), msg.getClass().getName());
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
        super.channelReadComplete(ctx);
        connection.onReadComplete();
    }

    /**
     * Propagates backpressure to the lessee's client connection.
     */
    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        super.channelWritabilityChanged(ctx);
        connection.onWritabilityChanged(ctx.channel().isWritable());
    }

    @Override
    public String toString() {
        return "UpstreamHandler{" +
                "connection=" + connection +
                '}';
    }
}
