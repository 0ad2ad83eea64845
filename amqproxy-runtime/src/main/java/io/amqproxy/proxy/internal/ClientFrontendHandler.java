/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoop;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;

import io.amqproxy.proxy.frame.AmqpMessage;
import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.internal.session.ClientSessionStateMachine;
import io.amqproxy.proxy.internal.upstream.UpstreamListener;
import io.amqproxy.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Handles the client side of a proxied connection.
 *
 * <p>This handler manages:</p>
 * <ul>
 *   <li>Client connection lifecycle (active, inactive, exceptions)</li>
 *   <li>Buffering of client frames while the upstream lease is pending</li>
 *   <li>Writes and flushes towards the client</li>
 *   <li>Backpressure on the client socket</li>
 *   <li>Handing upstream events over to the client's event loop</li>
 * </ul>
 *
 * <p>Protocol decisions are made by the {@link ClientSessionStateMachine}.</p>
 */
public class ClientFrontendHandler
        extends ChannelInboundHandlerAdapter
        implements UpstreamListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientFrontendHandler.class);

    private final ClientSessionStateMachine sessionStateMachine;

    // Client channel context
    private @Nullable ChannelHandlerContext clientCtx;

    // Frames read while the upstream lease is pending
    @VisibleForTesting
    @Nullable
    List<Frame> bufferedMsgs;

    // Client write state
    private boolean pendingClientFlushes;

    public ClientFrontendHandler(ClientSessionStateMachine sessionStateMachine) {
        this.sessionStateMachine = Objects.requireNonNull(sessionStateMachine);
    }

    // ==================== Accessors ====================

    public Channel clientChannel() {
        return clientCtx().channel();
    }

    public EventLoop eventLoop() {
        return clientChannel().eventLoop();
    }

    public ByteBufAllocator alloc() {
        return clientCtx().alloc();
    }

    public String remoteAddress() {
        return String.valueOf(clientChannel().remoteAddress());
    }

    public ClientSessionStateMachine sessionStateMachine() {
        return sessionStateMachine;
    }

    private ChannelHandlerContext clientCtx() {
        return Objects.requireNonNull(clientCtx, "Client channel not yet active");
    }

    @Override
    public String toString() {
        return "ClientFrontendHandler{" +
                "clientCtx=" + clientCtx +
                ", sessionState=" + sessionStateMachine.currentStateName() +
                ", bufferedMsgs=" + (bufferedMsgs == null ? 0 : bufferedMsgs.size()) +
                ", pendingClientFlushes=" + pendingClientFlushes +
                '}';
    }

    // ==================== Netty Channel Callbacks ====================

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.clientCtx = ctx;
        sessionStateMachine.onClientActive(this);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.trace("INACTIVE on inbound {}", ctx.channel());
        sessionStateMachine.onClientInactive();
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        super.channelWritabilityChanged(ctx);
        sessionStateMachine.onClientWritabilityChanged(ctx.channel().isWritable());
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        sessionStateMachine.onClientMessage(msg);
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        sessionStateMachine.onClientReadComplete();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        sessionStateMachine.onClientException(cause);
    }

    /**
     * Handles the idle events of the heartbeat negotiated with the client.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object event) throws Exception {
        if (event instanceof IdleStateEvent idleStateEvent) {
            if (idleStateEvent.state() == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(Frame.heartbeat(), ctx.voidPromise());
            }
            else if (idleStateEvent.state() == IdleState.READER_IDLE) {
                sessionStateMachine.onClientHeartbeatTimeout();
            }
            return;
        }
        super.userEventTriggered(ctx, event);
    }

    // ==================== Callbacks from ClientSessionStateMachine ====================

    /**
     * Starts sending heartbeats every {@code seconds} and treats the client as dead after two
     * silent intervals.
     */
    public void enableHeartbeat(int seconds) {
        ChannelHandlerContext ctx = clientCtx();
        if (ctx.pipeline().get(IdleStateHandler.class) == null) {
            ctx.pipeline().addBefore(ctx.name(), "idleState", new IdleStateHandler(2L * seconds, seconds, 0, TimeUnit.SECONDS));
        }
    }

    /**
     * Writes a message to the client without flushing.
     */
    public void writeToClient(AmqpMessage msg) {
        clientCtx().write(msg, clientCtx().voidPromise());
        pendingClientFlushes = true;
    }

    /**
     * Forwards a relayed frame to the client. Flushes right away when the client cannot keep up,
     * so the outbound buffer does not grow without bound.
     */
    public void forwardToClient(Frame frame) {
        final Channel inboundChannel = clientChannel();
        if (inboundChannel.isWritable()) {
            inboundChannel.write(frame, clientCtx().voidPromise());
            pendingClientFlushes = true;
        }
        else {
            inboundChannel.writeAndFlush(frame, clientCtx().voidPromise());
            pendingClientFlushes = false;
        }
    }

    /**
     * Flush pending writes to client.
     */
    public void flushToClient() {
        final Channel inboundChannel = clientChannel();
        if (pendingClientFlushes) {
            pendingClientFlushes = false;
            inboundChannel.flush();
        }
        if (!inboundChannel.isWritable()) {
            sessionStateMachine.onClientWritabilityChanged(false);
        }
    }

    /**
     * Flushes what has been written and closes the client socket afterwards.
     */
    public void closeAfterFlush() {
        Channel inboundChannel = clientChannel();
        pendingClientFlushes = false;
        if (inboundChannel.isActive()) {
            inboundChannel.writeAndFlush(Unpooled.EMPTY_BUFFER)
                    .addListener(ChannelFutureListener.CLOSE);
        }
        else {
            inboundChannel.close();
        }
    }

    public void closeClient() {
        if (clientCtx != null) {
            clientCtx.channel().close();
        }
    }

    /**
     * Buffer a frame for later forwarding (before the upstream lease completes).
     */
    public void bufferMsg(Frame frame) {
        if (bufferedMsgs == null) {
            bufferedMsgs = new ArrayList<>();
        }
        bufferedMsgs.add(frame);
    }

    /**
     * @return the buffered frames, which now belong to the caller
     */
    public List<Frame> takeBufferedMsgs() {
        List<Frame> msgs = bufferedMsgs == null ? List.of() : bufferedMsgs;
        bufferedMsgs = null;
        return msgs;
    }

    public void releaseBufferedMsgs() {
        takeBufferedMsgs().forEach(Frame::release);
    }

    /**
     * Runs {@code task} on the client's event loop, inline when already there.
     */
    public void runOnClientLoop(Runnable task) {
        EventLoop eventLoop = eventLoop();
        if (eventLoop.inEventLoop()) {
            task.run();
        }
        else {
            eventLoop.execute(task);
        }
    }

    // ==================== Backpressure ====================

    /**
     * Apply backpressure to client (stop reading).
     */
    public void applyBackpressure() {
        if (clientCtx != null) {
            this.clientCtx.channel().config().setAutoRead(false);
        }
    }

    /**
     * Relieve backpressure from client (resume reading).
     */
    public void relieveBackpressure() {
        if (clientCtx != null) {
            this.clientCtx.channel().config().setAutoRead(true);
        }
    }

    // ==================== UpstreamListener (upstream event loop) ====================

    @Override
    public void onUpstreamFrame(Frame frame) {
        try {
            runOnClientLoop(() -> sessionStateMachine.onUpstreamFrame(frame));
        }
        catch (RejectedExecutionException e) {
            LOGGER.debug("{}: Client event loop is shut down, dropping {}", sessionStateMachine.sessionId(), frame);
            frame.release();
        }
    }

    @Override
    public void onUpstreamReadComplete() {
        runOnClientLoop(sessionStateMachine::onUpstreamReadComplete);
    }

    @Override
    public void onUpstreamWritabilityChanged(boolean writable) {
        runOnClientLoop(() -> sessionStateMachine.onUpstreamWritabilityChanged(writable));
    }

    @Override
    public void onUpstreamFlowControl(AmqpMethod method) {
        runOnClientLoop(() -> sessionStateMachine.onUpstreamFlowControl(method));
    }

    @Override
    public void onUpstreamClosed(@Nullable AmqpMethod.ConnectionClose brokerClose, Throwable cause) {
        runOnClientLoop(() -> sessionStateMachine.onUpstreamClosed(brokerClose, cause));
    }
}
