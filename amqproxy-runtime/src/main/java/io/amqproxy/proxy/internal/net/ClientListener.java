/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.net;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import io.amqproxy.proxy.internal.ClientFrontendHandler;
import io.amqproxy.proxy.internal.codec.AmqpFrameDecoder;
import io.amqproxy.proxy.internal.codec.AmqpFrameEncoder;
import io.amqproxy.proxy.internal.session.ClientSessionStateMachine;
import io.amqproxy.proxy.service.HostPort;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Accepts client sockets and gives each one its own session.
 *
 * <p>{@link #stopAccepting()} closes the listening socket only; sessions already accepted
 * carry on until they close.</p>
 */
public class ClientListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientListener.class);

    private final HostPort bindAddress;
    private final int frameMax;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Supplier<ClientSessionStateMachine> sessionFactory;

    private volatile @Nullable Channel serverChannel;

    /**
     * @param bindAddress address to listen on; port 0 picks a free port
     * @param frameMax largest frame accepted from clients
     * @param bossGroup accepts connections
     * @param workerGroup serves accepted connections
     * @param sessionFactory creates the state machine of each accepted client
     */
    public ClientListener(HostPort bindAddress,
                          int frameMax,
                          EventLoopGroup bossGroup,
                          EventLoopGroup workerGroup,
                          Supplier<ClientSessionStateMachine> sessionFactory) {
        this.bindAddress = Objects.requireNonNull(bindAddress);
        this.frameMax = frameMax;
        this.bossGroup = Objects.requireNonNull(bossGroup);
        this.workerGroup = Objects.requireNonNull(workerGroup);
        this.sessionFactory = Objects.requireNonNull(sessionFactory);
    }

    /**
     * Binds the listening socket.
     *
     * @return the bound address
     * @throws InterruptedException if interrupted while binding
     * @throws IllegalStateException if the address cannot be bound
     */
    public InetSocketAddress bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Listener already bound");
        }
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new AcceptErrorHandler())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                })
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        ChannelFuture bindFuture = bootstrap.bind(bindAddress.host(), bindAddress.port()).await();
        if (!bindFuture.isSuccess()) {
            throw new IllegalStateException("Failed to bind " + bindAddress + ": " + bindFuture.cause().getMessage(), bindFuture.cause());
        }
        Channel channel = bindFuture.channel();
        this.serverChannel = channel;
        InetSocketAddress localAddress = (InetSocketAddress) channel.localAddress();
        LOGGER.info("Proxy listening on {}", new HostPort(localAddress.getHostString(), localAddress.getPort()));
        return localAddress;
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast("frameDecoder", new AmqpFrameDecoder(frameMax, true));
        pipeline.addLast("frameEncoder", AmqpFrameEncoder.INSTANCE);
        pipeline.addLast("frontendHandler", new ClientFrontendHandler(sessionFactory.get()));
    }

    public boolean isAccepting() {
        Channel channel = serverChannel;
        return channel != null && channel.isOpen();
    }

    /**
     * Closes the listening socket. Connection attempts are refused from here on.
     */
    public void stopAccepting() {
        Channel channel = serverChannel;
        if (channel != null && channel.isOpen()) {
            LOGGER.info("Proxy stops accepting new clients");
            channel.close().syncUninterruptibly();
        }
    }
}
