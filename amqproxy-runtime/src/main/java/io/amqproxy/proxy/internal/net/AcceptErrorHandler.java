/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.net;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import io.amqproxy.proxy.tag.VisibleForTesting;

/**
 * Sits on the listening channel and keeps accept failures from being fatal. Running out of
 * file descriptors pauses accepting for a moment instead of spinning on the error.
 */
class AcceptErrorHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AcceptErrorHandler.class);

    @VisibleForTesting
    static final long BACKOFF_MILLIS = 1_000;

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Channel serverChannel = ctx.channel();
        if (isResourceExhaustion(cause)) {
            LOGGER.warn("Accept failed: {}, pausing for {}ms", cause.getMessage(), BACKOFF_MILLIS);
            serverChannel.config().setAutoRead(false);
            serverChannel.eventLoop().schedule(() -> {
                if (serverChannel.isOpen()) {
                    serverChannel.config().setAutoRead(true);
                }
            }, BACKOFF_MILLIS, TimeUnit.MILLISECONDS);
        }
        else {
            LOGGER.warn("Accept failed: {}", cause.getMessage());
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Accept failure details", cause);
            }
        }
    }

    @VisibleForTesting
    static boolean isResourceExhaustion(Throwable cause) {
        return cause instanceof IOException
                && cause.getMessage() != null
                && cause.getMessage().contains("Too many open files");
    }
}
