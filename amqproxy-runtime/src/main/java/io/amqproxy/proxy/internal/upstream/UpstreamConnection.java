/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateHandler;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionBlocked;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionClose;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionCloseOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpenOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStart;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStartOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTune;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTuneOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionUnblocked;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.ProtocolHeader;
import io.amqproxy.proxy.frame.ReplyCode;
import io.amqproxy.proxy.internal.codec.AmqpFrameDecoder;
import io.amqproxy.proxy.internal.codec.AmqpFrameEncoder;
import io.amqproxy.proxy.internal.codec.MethodCodec;
import io.amqproxy.proxy.internal.upstream.UpstreamConnectionState.HandshakeStep;
import io.amqproxy.proxy.service.HostPort;
import io.amqproxy.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One pooled connection to the broker.
 *
 * <p>This class encapsulates:</p>
 * <ul>
 *   <li>Connection state (Handshaking → Idle ⇄ Leased → Closing → Closed)</li>
 *   <li>The Netty channel and pipeline of the broker socket</li>
 *   <li>The client side of the AMQP connection negotiation, using the credentials and
 *   virtual host of the {@link EndpointIdentity}</li>
 *   <li>The allocator for upstream channel ids</li>
 *   <li>Delivery of upstream frames to the current lessee</li>
 * </ul>
 *
 * <p>Works with {@link UpstreamHandler} for Netty I/O. Network callbacks arrive on the
 * connection's own event loop; lease transitions are made by the {@link UpstreamPool} under
 * its lock, so every state change is synchronized on this instance.</p>
 */
public class UpstreamConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpstreamConnection.class);

    static final String PRODUCT = "AMQProxy";
    static final String LOCALE = "en_US";
    static final String PLAIN = "PLAIN";
    static final long HANDSHAKE_TIMEOUT_MILLIS = 10_000;
    static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    static final long CLOSE_OK_TIMEOUT_MILLIS = 1_000;

    private final String id;
    private final EndpointIdentity identity;
    private final int proxyFrameMax;
    private final Optional<SslContext> sslContext;
    private final UpstreamPool pool;
    private final CompletableFuture<UpstreamConnection> handshakeFuture = new CompletableFuture<>();

    private volatile UpstreamConnectionState state = UpstreamConnectionState.Handshaking.CONNECTING;
    private volatile @Nullable Channel channel;
    private volatile @Nullable ChannelIdAllocator channelIds;
    private int heartbeatSeconds;
    private long frameMax;

    UpstreamConnection(String id,
                       EndpointIdentity identity,
                       int proxyFrameMax,
                       Optional<SslContext> sslContext,
                       UpstreamPool pool) {
        this.id = Objects.requireNonNull(id);
        this.identity = Objects.requireNonNull(identity);
        this.proxyFrameMax = proxyFrameMax;
        this.sslContext = Objects.requireNonNull(sslContext);
        this.pool = Objects.requireNonNull(pool);
    }

    // ==================== Accessors ====================

    /**
     * Unique tag of this connection, e.g. {@code upstream-3}.
     */
    public String id() {
        return id;
    }

    public EndpointIdentity identity() {
        return identity;
    }

    public UpstreamConnectionState state() {
        return state;
    }

    public boolean isUsable() {
        Channel ch = channel;
        return state.isUsable() && ch != null && ch.isActive();
    }

    public int heartbeatSeconds() {
        return heartbeatSeconds;
    }

    public long frameMax() {
        return frameMax;
    }

    /**
     * @return number of upstream channels currently allocated to sessions
     */
    public int openChannels() {
        ChannelIdAllocator ids = channelIds;
        return ids == null ? 0 : ids.leasedCount();
    }

    // ==================== Connection Lifecycle ====================

    /**
     * Connects and negotiates with the broker.
     *
     * @param eventLoop event loop the broker socket is registered with
     * @return future completed once connection.open-ok has been received
     */
    CompletableFuture<UpstreamConnection> connect(EventLoop eventLoop) {
        if (!(state instanceof UpstreamConnectionState.Handshaking handshaking)
                || handshaking.step() != HandshakeStep.CONNECTING
                || channel != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Cannot connect from state: " + state));
        }
        LOGGER.debug("{}: Connecting to {}", id, identity);

        Bootstrap bootstrap = configureBootstrap(eventLoop);
        ChannelFuture connectFuture = bootstrap.connect(identity.hostPort().host(), identity.hostPort().port());
        this.channel = connectFuture.channel();

        connectFuture.addListener((ChannelFuture f) -> {
            if (f.isSuccess()) {
                LOGGER.trace("{}: TCP connected to {}", id, identity.hostPort());
                // with TLS the handshake completion event triggers the protocol negotiation
                if (sslContext.isEmpty()) {
                    onConnectionActive();
                }
            }
            else {
                failHandshake(new UpstreamUnavailableException(
                        "Failed to connect to " + identity.hostPort() + ": " + f.cause().getMessage(), f.cause()));
            }
        });
        eventLoop.schedule(() -> {
            if (state instanceof UpstreamConnectionState.Handshaking) {
                failHandshake(new UpstreamUnavailableException("Handshake with " + identity.hostPort() + " timed out"));
            }
        }, HANDSHAKE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        return handshakeFuture;
    }

    @VisibleForTesting
    Bootstrap configureBootstrap(EventLoop eventLoop) {
        return new Bootstrap()
                .group(eventLoop)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                })
                .option(ChannelOption.AUTO_READ, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addFirst("upstreamHandler", new UpstreamHandler(this));
        pipeline.addFirst("frameEncoder", AmqpFrameEncoder.INSTANCE);
        pipeline.addFirst("frameDecoder", new AmqpFrameDecoder(proxyFrameMax, false));
        sslContext.ifPresent(ssl -> pipeline.addFirst("ssl", newSslHandler(ssl, pipeline.channel().alloc(), identity.hostPort())));
        LOGGER.debug("{}: Configured pipeline: {}", id, pipeline);
    }

    /**
     * Creates a client TLS handler whose engine verifies that the broker certificate
     * matches the host we dialled.
     */
    @VisibleForTesting
    static SslHandler newSslHandler(SslContext ssl, ByteBufAllocator alloc, HostPort hostPort) {
        SslHandler handler = ssl.newHandler(alloc, hostPort.host(), hostPort.port());
        SSLEngine engine = handler.engine();
        SSLParameters parameters = engine.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        engine.setSSLParameters(parameters);
        return handler;
    }

    /**
     * Called when the broker socket has been registered with its event loop, which may be
     * before {@link #connect(EventLoop)} has returned on the calling thread.
     */
    void setChannel(Channel ch) {
        this.channel = ch;
    }

    /**
     * Called when TCP, and TLS if configured, are established.
     */
    void onConnectionActive() {
        if (state instanceof UpstreamConnectionState.Handshaking handshaking
                && handshaking.step() == HandshakeStep.CONNECTING) {
            setState(handshaking.next(HandshakeStep.AWAITING_START));
            Objects.requireNonNull(channel).writeAndFlush(ProtocolHeader.AMQP_0_9_1);
        }
        else {
            LOGGER.warn("{}: Unexpected onConnectionActive in state {}", id, state);
        }
    }

    /**
     * Called when TCP connect or the TLS handshake failed.
     */
    void onConnectionFailed(Throwable cause) {
        failHandshake(new UpstreamUnavailableException(
                "Failed to connect to " + identity.hostPort() + ": " + cause.getMessage(), cause));
    }

    /**
     * Called when the broker socket has closed, for whatever reason.
     */
    void onConnectionInactive() {
        UpstreamConnectionState previous;
        synchronized (this) {
            previous = state;
            if (previous instanceof UpstreamConnectionState.Closed) {
                return;
            }
            setState(UpstreamConnectionState.Closed.INSTANCE);
        }
        if (previous instanceof UpstreamConnectionState.Handshaking) {
            handshakeFuture.completeExceptionally(
                    new UpstreamUnavailableException("Connection to " + identity.hostPort() + " closed during handshake"));
        }
        else {
            LOGGER.debug("{}: Connection to {} closed", id, identity.hostPort());
            pool.onConnectionLost(this);
            if (previous instanceof UpstreamConnectionState.Leased leased) {
                leased.lessee().onUpstreamClosed(null,
                        new UpstreamUnavailableException("Connection to " + identity.hostPort() + " lost"));
            }
        }
    }

    /**
     * Called when an exception reached the end of the broker pipeline.
     */
    void onConnectionError(Throwable cause) {
        LOGGER.warn("{}: Error on connection to {}: {}", id, identity.hostPort(), cause.getMessage());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{}: Connection error details", id, cause);
        }
        if (state instanceof UpstreamConnectionState.Handshaking) {
            failHandshake(new UpstreamUnavailableException("Handshake with " + identity.hostPort() + " failed: " + cause.getMessage(), cause));
        }
        else {
            closeChannel();
        }
    }

    /**
     * Called by the {@link IdleStateHandler} installed once a heartbeat has been negotiated.
     */
    void onIdle(IdleState idleState) {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (idleState == IdleState.WRITER_IDLE) {
            ch.writeAndFlush(Frame.heartbeat(), ch.voidPromise());
        }
        else if (idleState == IdleState.READER_IDLE) {
            LOGGER.warn("{}: No traffic from {} for {}s, treating connection as broken", id, identity.hostPort(), heartbeatSeconds * 2);
            closeChannel();
        }
    }

    /**
     * Ends this connection: sends connection.close when the socket is still usable and closes the
     * socket once the broker confirms or after a short grace period.
     */
    public void close() {
        Channel ch;
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            setState(new UpstreamConnectionState.Closing(null));
            ch = channel;
        }
        handshakeFuture.completeExceptionally(new UpstreamUnavailableException("Connection closed before handshake completed"));
        if (ch == null) {
            return;
        }
        LOGGER.debug("{}: Closing connection to {}", id, identity.hostPort());
        if (ch.isActive() && ch.isWritable() && frameMax > 0) {
            ch.writeAndFlush(MethodCodec.frame(0, new ConnectionClose(ReplyCode.REPLY_SUCCESS.code(), "Goodbye", 0, 0), ch.alloc()));
            ch.eventLoop().schedule(() -> {
                if (ch.isOpen()) {
                    LOGGER.debug("{}: No close-ok from broker, closing socket", id);
                    ch.close();
                }
            }, CLOSE_OK_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
        else {
            ch.close();
        }
    }

    private void closeChannel() {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    private void failHandshake(UpstreamException cause) {
        synchronized (this) {
            if (!(state instanceof UpstreamConnectionState.Handshaking)) {
                return;
            }
            setState(new UpstreamConnectionState.Closing(cause));
        }
        LOGGER.warn("{}: {}", id, cause.getMessage());
        handshakeFuture.completeExceptionally(cause);
        closeChannel();
    }

    // ==================== Lease transitions (called by UpstreamPool) ====================

    synchronized boolean markLeased(UpstreamListener lessee) {
        if (state instanceof UpstreamConnectionState.Idle idle) {
            setState(idle.toLeased(lessee));
            return true;
        }
        else if (state instanceof UpstreamConnectionState.Handshaking handshaking
                && handshaking.step() == HandshakeStep.AWAITING_OPEN_OK) {
            setState(handshaking.toLeased(lessee));
            return true;
        }
        return false;
    }

    synchronized boolean markIdle(long nowNanos) {
        if (state instanceof UpstreamConnectionState.Leased leased) {
            setState(leased.toIdle(nowNanos));
            relieveBackpressure();
            return true;
        }
        return false;
    }

    /**
     * @return when this connection became idle, or empty if it is not idle
     */
    Optional<Long> idleSinceNanos() {
        return state instanceof UpstreamConnectionState.Idle idle ? Optional.of(idle.idleSinceNanos()) : Optional.empty();
    }

    // ==================== Channel ids (called by the lessee) ====================

    /**
     * @return a fresh upstream channel id, or empty if all ids up to channel-max are in use
     */
    public OptionalInt allocateChannel() {
        ChannelIdAllocator ids = channelIds;
        if (ids == null) {
            throw new IllegalStateException(id + ": channel allocation before handshake completed");
        }
        return ids.allocate();
    }

    /**
     * Returns an upstream channel id once its close handshake has completed.
     */
    public void releaseChannel(int channelId) {
        ChannelIdAllocator ids = channelIds;
        if (ids != null && !ids.release(channelId)) {
            LOGGER.warn("{}: Released channel {} which was not allocated", id, channelId);
        }
    }

    // ==================== Writing (called by the lessee) ====================

    /**
     * Writes a frame without flushing. Frames written from one thread reach the broker in
     * the order written.
     */
    public void write(Frame frame) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            frame.release();
            return;
        }
        ch.write(frame, ch.voidPromise());
    }

    public void flush() {
        Channel ch = channel;
        if (ch != null) {
            ch.flush();
        }
    }

    public void writeAndFlush(Frame frame) {
        write(frame);
        flush();
    }

    /**
     * Stops reading from the broker while the lessee's client cannot keep up.
     */
    public void applyBackpressure() {
        Channel ch = channel;
        if (ch != null) {
            ch.config().setAutoRead(false);
        }
    }

    public void relieveBackpressure() {
        Channel ch = channel;
        if (ch != null) {
            ch.config().setAutoRead(true);
        }
    }

    public boolean isWritable() {
        Channel ch = channel;
        return ch != null && ch.isWritable();
    }

    // ==================== Reading (from UpstreamHandler) ====================

    void onFrame(Frame frame) {
        if (frame.channel() != 0) {
            UpstreamConnectionState current = state;
            if (current instanceof UpstreamConnectionState.Leased leased) {
                leased.lessee().onUpstreamFrame(frame);
            }
            else {
                LOGGER.debug("{}: Dropping {} received in state {}", id, frame, current.getClass().getSimpleName());
                frame.release();
            }
            return;
        }
        try {
            if (frame.isHeartbeat()) {
                return;
            }
            if (!frame.isMethod()) {
                LOGGER.warn("{}: Unexpected {} on channel 0", id, frame);
                closeChannel();
                return;
            }
            AmqpMethod method = MethodCodec.decode(frame);
            if (method == null) {
                LOGGER.warn("{}: Ignoring unsupported method {}.{} on channel 0", id, frame.methodClassId(), frame.methodId());
                return;
            }
            onConnectionMethod(method);
        }
        finally {
            frame.release();
        }
    }

    void onReadComplete() {
        if (state instanceof UpstreamConnectionState.Leased leased) {
            leased.lessee().onUpstreamReadComplete();
        }
    }

    void onWritabilityChanged(boolean writable) {
        if (state instanceof UpstreamConnectionState.Leased leased) {
            leased.lessee().onUpstreamWritabilityChanged(writable);
        }
    }

    private void onConnectionMethod(AmqpMethod method) {
        UpstreamConnectionState current = state;
        if (method instanceof ConnectionClose close) {
            onBrokerClose(close, current);
        }
        else if (method instanceof ConnectionCloseOk) {
            if (current instanceof UpstreamConnectionState.Closing) {
                closeChannel();
            }
        }
        else if (current instanceof UpstreamConnectionState.Handshaking handshaking) {
            onHandshakeMethod(handshaking, method);
        }
        else if (method instanceof ConnectionBlocked || method instanceof ConnectionUnblocked) {
            LOGGER.info("{}: Broker {}", id, method instanceof ConnectionBlocked blocked ? "blocked connection: " + blocked.reason() : "unblocked connection");
            if (current instanceof UpstreamConnectionState.Leased leased) {
                leased.lessee().onUpstreamFlowControl(method);
            }
        }
        else {
            LOGGER.warn("{}: Unexpected {} in state {}", id, method, current.getClass().getSimpleName());
        }
    }

    private void onBrokerClose(ConnectionClose close, UpstreamConnectionState current) {
        Channel ch = Objects.requireNonNull(channel);
        ch.writeAndFlush(MethodCodec.frame(0, new ConnectionCloseOk(), ch.alloc()))
                .addListener(ChannelFutureListener.CLOSE);
        if (current instanceof UpstreamConnectionState.Handshaking) {
            UpstreamException cause = close.replyCode() == ReplyCode.ACCESS_REFUSED.code()
                    ? new UpstreamAccessRefusedException("Broker refused access: " + close.replyText())
                    : new UpstreamUnavailableException("Broker closed connection during handshake: " + close.replyCode() + " " + close.replyText());
            failHandshake(cause);
            return;
        }
        UpstreamConnectionState previous;
        synchronized (this) {
            previous = state;
            if (previous.isTerminal()) {
                return;
            }
            setState(UpstreamConnectionState.Closed.INSTANCE);
        }
        LOGGER.warn("{}: Broker closed connection: {} {}", id, close.replyCode(), close.replyText());
        pool.onConnectionLost(this);
        if (previous instanceof UpstreamConnectionState.Leased leased) {
            leased.lessee().onUpstreamClosed(close,
                    new UpstreamUnavailableException("Broker closed connection: " + close.replyCode() + " " + close.replyText()));
        }
    }

    private void onHandshakeMethod(UpstreamConnectionState.Handshaking handshaking, AmqpMethod method) {
        Channel ch = Objects.requireNonNull(channel);
        if (handshaking.step() == HandshakeStep.AWAITING_START && method instanceof ConnectionStart start) {
            if (!start.mechanisms().contains(PLAIN)) {
                failHandshake(new UpstreamAccessRefusedException("Broker does not offer PLAIN authentication: " + start.mechanisms()));
                return;
            }
            byte[] response = ("\0" + identity.username() + "\0" + identity.password()).getBytes(StandardCharsets.UTF_8);
            ch.writeAndFlush(MethodCodec.frame(0, new ConnectionStartOk(clientProperties(), PLAIN, response, LOCALE), ch.alloc()));
            setState(handshaking.next(HandshakeStep.AWAITING_TUNE));
        }
        else if (handshaking.step() == HandshakeStep.AWAITING_TUNE && method instanceof ConnectionTune tune) {
            long negotiatedFrameMax = tune.frameMax() == 0 ? proxyFrameMax : Math.min(tune.frameMax(), proxyFrameMax);
            this.frameMax = negotiatedFrameMax;
            this.heartbeatSeconds = tune.heartbeat();
            this.channelIds = new ChannelIdAllocator(tune.channelMax());
            ch.write(MethodCodec.frame(0, new ConnectionTuneOk(tune.channelMax(), negotiatedFrameMax, tune.heartbeat()), ch.alloc()));
            ch.writeAndFlush(MethodCodec.frame(0, new ConnectionOpen(identity.virtualHost()), ch.alloc()));
            if (heartbeatSeconds > 0) {
                ch.pipeline().addAfter("frameEncoder", "idleState",
                        new IdleStateHandler(heartbeatSeconds * 2, heartbeatSeconds, 0, TimeUnit.SECONDS));
            }
            LOGGER.debug("{}: Tuned channelMax={} frameMax={} heartbeat={}", id, tune.channelMax(), negotiatedFrameMax, heartbeatSeconds);
            setState(handshaking.next(HandshakeStep.AWAITING_OPEN_OK));
        }
        else if (handshaking.step() == HandshakeStep.AWAITING_OPEN_OK && method instanceof ConnectionOpenOk) {
            LOGGER.info("{}: Connected to {}", id, identity);
            // the pool marks the connection leased from within this completion
            handshakeFuture.complete(this);
        }
        else {
            failHandshake(new UpstreamUnavailableException("Unexpected " + method + " during handshake step " + handshaking.step()));
        }
    }

    private Map<String, Object> clientProperties() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("authentication_failure_close", true);
        capabilities.put("basic.nack", true);
        capabilities.put("connection.blocked", true);
        capabilities.put("consumer_cancel_notify", true);
        capabilities.put("exchange_exchange_bindings", true);
        capabilities.put("per_consumer_qos", true);
        capabilities.put("publisher_confirms", true);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("product", PRODUCT);
        properties.put("platform", "Java");
        properties.put("connection_name", id);
        properties.put("capabilities", capabilities);
        return properties;
    }

    private void setState(UpstreamConnectionState newState) {
        LOGGER.trace("{}: State {} -> {}", id, state.getClass().getSimpleName(), newState.getClass().getSimpleName());
        this.state = newState;
    }

    @Override
    public String toString() {
        return "UpstreamConnection{" +
                "id=" + id +
                ", identity=" + identity +
                ", state=" + state.getClass().getSimpleName() +
                ", openChannels=" + openChannels() +
                '}';
    }
}
