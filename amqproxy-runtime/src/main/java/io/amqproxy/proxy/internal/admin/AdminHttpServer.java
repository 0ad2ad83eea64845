/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.admin;

import java.net.InetSocketAddress;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

import io.amqproxy.proxy.service.HostPort;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * HTTP endpoint for health checks and metrics scraping.
 */
public class AdminHttpServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdminHttpServer.class);

    static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final HostPort bindAddress;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final AdminHttpHandler handler;

    private @Nullable Channel serverChannel;

    public AdminHttpServer(HostPort bindAddress, EventLoopGroup bossGroup, EventLoopGroup workerGroup, AdminHttpHandler handler) {
        this.bindAddress = Objects.requireNonNull(bindAddress);
        this.bossGroup = Objects.requireNonNull(bossGroup);
        this.workerGroup = Objects.requireNonNull(workerGroup);
        this.handler = Objects.requireNonNull(handler);
    }

    /**
     * @return the bound address
     * @throws InterruptedException if interrupted while binding
     * @throws IllegalStateException if the address cannot be bound
     */
    public InetSocketAddress bind() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        ch.pipeline().addLast(handler);
                    }
                });
        ChannelFuture bindFuture = bootstrap.bind(bindAddress.host(), bindAddress.port()).await();
        if (!bindFuture.isSuccess()) {
            throw new IllegalStateException("Failed to bind HTTP endpoint " + bindAddress + ": " + bindFuture.cause().getMessage(),
                    bindFuture.cause());
        }
        serverChannel = bindFuture.channel();
        InetSocketAddress localAddress = (InetSocketAddress) serverChannel.localAddress();
        LOGGER.info("HTTP endpoint listening on {}", new HostPort(localAddress.getHostString(), localAddress.getPort()));
        return localAddress;
    }

    @Override
    public void close() {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.close().syncUninterruptibly();
            serverChannel = null;
        }
    }
}
