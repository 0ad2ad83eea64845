/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.admin;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import io.amqproxy.proxy.ProxyControl;

/**
 * Serves {@value #HEALTH_PATH} and {@value #METRICS_PATH}.
 */
@Sharable
public class AdminHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdminHttpHandler.class);

    public static final String HEALTH_PATH = "/healthz";
    public static final String METRICS_PATH = "/metrics";

    static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

    private final PrometheusMeterRegistry registry;
    private final ProxyControl proxy;

    public AdminHttpHandler(PrometheusMeterRegistry registry, ProxyControl proxy) {
        this.registry = Objects.requireNonNull(registry);
        this.proxy = Objects.requireNonNull(proxy);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        FullHttpResponse response;
        if (!HEALTH_PATH.equals(path) && !METRICS_PATH.equals(path)) {
            response = text(HttpResponseStatus.NOT_FOUND, "Not Found");
        }
        else if (!HttpMethod.GET.equals(request.method())) {
            response = text(HttpResponseStatus.METHOD_NOT_ALLOWED, "Method Not Allowed");
            response.headers().set(HttpHeaderNames.ALLOW, HttpMethod.GET.name());
        }
        else if (HEALTH_PATH.equals(path)) {
            response = text(HttpResponseStatus.OK, "OK");
        }
        else {
            response = response(HttpResponseStatus.OK, PROMETHEUS_CONTENT_TYPE, registry.scrape());
        }
        LOGGER.trace("{} {} -> {} ({} live clients)", request.method(), request.uri(), response.status().code(), proxy.liveClientConnections());

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        }
        else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Admin endpoint error: {}", cause.getMessage());
        ctx.close();
    }

    private static FullHttpResponse text(HttpResponseStatus status, String body) {
        return response(status, TEXT_CONTENT_TYPE, body + "\n");
    }

    private static FullHttpResponse response(HttpResponseStatus status, String contentType, String body) {
        ByteBuf content = Unpooled.copiedBuffer(body, StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, contentType)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        return response;
    }
}
