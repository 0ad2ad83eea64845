/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.session;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;

import io.amqproxy.proxy.config.ProxyConfig;
import io.amqproxy.proxy.config.UpstreamUrl;
import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelClose;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelCloseOk;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionClose;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionCloseOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpenOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStart;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStartOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTune;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTuneOk;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.ProtocolHeader;
import io.amqproxy.proxy.frame.ReplyCode;
import io.amqproxy.proxy.internal.ClientConnectionTracker;
import io.amqproxy.proxy.internal.ClientFrontendHandler;
import io.amqproxy.proxy.internal.codec.MalformedFrameException;
import io.amqproxy.proxy.internal.codec.MethodCodec;
import io.amqproxy.proxy.internal.upstream.EndpointIdentity;
import io.amqproxy.proxy.internal.upstream.UpstreamConnection;
import io.amqproxy.proxy.internal.upstream.UpstreamException;
import io.amqproxy.proxy.internal.upstream.UpstreamPool;
import io.amqproxy.proxy.internal.util.Metrics;
import io.amqproxy.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * State machine managing a single client session.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li><b>Handshake:</b> plays the broker's role in the connection negotiation with the client</li>
 *   <li><b>Lease:</b> obtains an upstream connection for the client's endpoint identity and
 *   returns it to the pool when the session ends</li>
 *   <li><b>Relay:</b> remaps channel ids in both directions, leaving payloads untouched</li>
 *   <li><b>Channel lifecycle:</b> tracks which side is closing each channel so crossed
 *   channel.close exchanges are acknowledged correctly</li>
 *   <li><b>Backpressure:</b> couples the readability of each side to the writability of the other</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 *   ClientFrontendHandler (Netty I/O, client socket)
 *           │
 *           ▼
 *   ClientSessionStateMachine (Session Lifecycle)
 *           │
 *           ▼
 *   UpstreamPool ──► UpstreamConnection (broker socket)
 * </pre>
 *
 * <p>Every method runs on the client channel's event loop. Upstream events are handed over
 * to that loop by the {@link ClientFrontendHandler}.</p>
 */
public class ClientSessionStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientSessionStateMachine.class);

    static final String PRODUCT = "AMQProxy";
    static final String LOCALE = "en_US";
    static final long MIN_FRAME_MAX = 4096;

    // channel class method ids
    private static final int CHANNEL_OPEN = 10;
    private static final int CHANNEL_CLOSE = 40;
    private static final int CHANNEL_CLOSE_OK = 41;

    private final ProxyConfig config;
    private final UpstreamPool pool;
    private final ClientConnectionTracker tracker;
    private final Metrics metrics;

    // Session identity
    private @Nullable String sessionId;

    // State
    private ClientSessionState state = ClientSessionState.Startup.INSTANCE;

    // Handlers
    private @Nullable ClientFrontendHandler frontendHandler;

    // Upstream connection, held from lease completion until it is released or evicted
    private @Nullable UpstreamConnection upstream;
    private boolean leasePending;

    // Channel mappings, by client channel id and by upstream channel id
    private final Map<Integer, ChannelMapping> clientChannels = new HashMap<>();
    private final Map<Integer, ChannelMapping> upstreamChannels = new HashMap<>();

    private boolean clientSupportsBlocked;
    private boolean clientClosed;
    private @Nullable ScheduledFuture<?> channelCloseTimer;

    public ClientSessionStateMachine(ProxyConfig config,
                                     UpstreamPool pool,
                                     ClientConnectionTracker tracker,
                                     Metrics metrics) {
        this.config = Objects.requireNonNull(config);
        this.pool = Objects.requireNonNull(pool);
        this.tracker = Objects.requireNonNull(tracker);
        this.metrics = Objects.requireNonNull(metrics);
    }

    // ==================== Accessors ====================

    public String sessionId() {
        return Objects.requireNonNull(sessionId, "Session ID not yet allocated");
    }

    public ClientSessionState state() {
        return state;
    }

    public SessionPhase phase() {
        return state.phase();
    }

    public String currentStateName() {
        return state.getClass().getSimpleName();
    }

    @VisibleForTesting
    @Nullable
    UpstreamConnection upstream() {
        return upstream;
    }

    @VisibleForTesting
    Map<Integer, ChannelMapping> channelMappings() {
        return Map.copyOf(clientChannels);
    }

    // ==================== Client Lifecycle Events ====================

    /**
     * Called when client TCP connection becomes active.
     */
    public void onClientActive(ClientFrontendHandler frontend) {
        if (!(state instanceof ClientSessionState.Startup)) {
            illegalState("Client activation in wrong state");
            return;
        }
        this.frontendHandler = frontend;
        this.sessionId = "client-" + frontend.clientChannel().id().asShortText();
        LOGGER.debug("{}: Session started from {}", sessionId, frontend.remoteAddress());
        metrics.clientConnectionCounter().increment();
        tracker.onSessionStarted(this);
    }

    /**
     * Called when client connection becomes inactive.
     */
    public void onClientInactive() {
        clientClosed = true;
        if (state instanceof ClientSessionState.Closed) {
            return;
        }
        if (!(state instanceof ClientSessionState.Closing)) {
            LOGGER.debug("{}: Client disconnected in state {}", sessionId, currentStateName());
            setState(new ClientSessionState.Closing(false));
            teardownUpstream();
        }
        frontend().releaseBufferedMsgs();
        maybeFinish();
    }

    /**
     * Called when an exception reached the end of the client pipeline.
     */
    public void onClientException(Throwable cause) {
        if (cause instanceof DecoderException) {
            closeWithError(new ProtocolException(ReplyCode.FRAME_ERROR, String.valueOf(cause.getMessage())));
        }
        else if (cause instanceof IOException) {
            LOGGER.debug("{}: Client connection error: {}", sessionId, cause.getMessage());
            frontend().closeClient();
        }
        else {
            LOGGER.warn("{}: Client exception: {}", sessionId, cause.getMessage());
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{}: Client exception details", sessionId, cause);
            }
            closeWithError(new ProtocolException(ReplyCode.INTERNAL_ERROR, "internal error"));
        }
    }

    /**
     * Called when nothing was read from a client that negotiated heartbeats for two intervals.
     */
    public void onClientHeartbeatTimeout() {
        if (state instanceof ClientSessionState.Closed) {
            return;
        }
        LOGGER.warn("{}: Missed heartbeats from client, closing connection", sessionId);
        frontend().closeClient();
    }

    /**
     * Called when a message is received from the client. Takes ownership of the message.
     */
    public void onClientMessage(Object msg) {
        if (state instanceof ClientSessionState.Closed) {
            ReferenceCountUtil.release(msg);
            return;
        }
        if (msg instanceof ProtocolHeader header) {
            onProtocolHeader(header);
            return;
        }
        if (!(msg instanceof Frame frame)) {
            ReferenceCountUtil.release(msg);
            illegalState("Unexpected message type: " + (msg == null ? "null" : msg.getClass().getName()));
            return;
        }
        boolean forwarded = false;
        try {
            forwarded = onClientFrame(frame);
        }
        catch (ProtocolException e) {
            closeWithError(e);
        }
        finally {
            if (!forwarded) {
                frame.release();
            }
        }
    }

    /**
     * Called when client read batch is complete.
     */
    public void onClientReadComplete() {
        frontend().flushToClient();
        UpstreamConnection conn = upstream;
        if (conn != null) {
            conn.flush();
        }
    }

    /**
     * Client socket writability changed: a slow client stops reads from the broker.
     */
    public void onClientWritabilityChanged(boolean writable) {
        UpstreamConnection conn = upstream;
        if (conn == null || !(state instanceof ClientSessionState.Open)) {
            return;
        }
        if (writable) {
            conn.relieveBackpressure();
        }
        else {
            conn.applyBackpressure();
        }
    }

    /**
     * Closes the session on behalf of the proxy, e.g. at shutdown. The client is sent
     * connection.close and the socket stays open until the client's close-ok arrives.
     */
    public void closeByProxy() {
        if (state instanceof ClientSessionState.Closing || state instanceof ClientSessionState.Closed) {
            return;
        }
        if (state instanceof ClientSessionState.Startup) {
            setState(new ClientSessionState.Closing(false));
            frontend().closeClient();
            return;
        }
        LOGGER.info("{}: Closing client connection for shutdown", sessionId);
        closeClient(ConnectionClose.of(ReplyCode.CONNECTION_FORCED, "Server shutdown"), true);
    }

    /**
     * Thread-safe variant of {@link #closeByProxy()}.
     */
    public void requestClose() {
        frontend().runOnClientLoop(this::closeByProxy);
    }

    // ==================== Handshake ====================

    private void onProtocolHeader(ProtocolHeader header) {
        if (!(state instanceof ClientSessionState.Startup startup)) {
            illegalState("Protocol header in wrong state");
            return;
        }
        ClientFrontendHandler frontend = frontend();
        if (!header.isSupported()) {
            LOGGER.info("{}: Unsupported protocol header {}, replying with {}", sessionId, header, ProtocolHeader.AMQP_0_9_1);
            setState(new ClientSessionState.Closing(false));
            frontend.writeToClient(ProtocolHeader.AMQP_0_9_1);
            frontend.closeAfterFlush();
            return;
        }
        ConnectionStart start = new ConnectionStart(0, 9, serverProperties(), Credentials.SUPPORTED_MECHANISMS, LOCALE);
        frontend.writeToClient(MethodCodec.frame(0, start, frontend.alloc()));
        setState(startup.toAwaitingStartOk());
    }

    private void onStartOk(ClientSessionState.AwaitingStartOk awaiting, ConnectionStartOk startOk) {
        Credentials credentials = Credentials.from(startOk);
        clientSupportsBlocked = hasCapability(startOk.clientProperties(), "connection.blocked");
        LOGGER.debug("{}: Client authenticating as '{}' using {}", sessionId, credentials.username(), startOk.mechanism());
        ConnectionTune tune = new ConnectionTune(config.channelMax(), config.frameMax(), (int) config.heartbeat().toSeconds());
        frontend().writeToClient(MethodCodec.frame(0, tune, frontend().alloc()));
        setState(awaiting.toAwaitingTuneOk(credentials));
    }

    private void onTuneOk(ClientSessionState.AwaitingTuneOk awaiting, ConnectionTuneOk tuneOk) {
        int channelMax = tuneOk.channelMax() == 0 ? config.channelMax() : Math.min(tuneOk.channelMax(), config.channelMax());
        long frameMax = tuneOk.frameMax() == 0 ? config.frameMax() : Math.min(tuneOk.frameMax(), config.frameMax());
        if (frameMax < MIN_FRAME_MAX) {
            throw new ProtocolException(ReplyCode.NOT_ALLOWED, "frame_max=" + frameMax + " < " + MIN_FRAME_MAX + " min_size",
                    AmqpMethod.CONNECTION_CLASS, tuneOk.methodId());
        }
        Tuning tuning = new Tuning(channelMax, frameMax, tuneOk.heartbeat());
        if (tuning.heartbeatSeconds() > 0) {
            frontend().enableHeartbeat(tuning.heartbeatSeconds());
        }
        LOGGER.debug("{}: Tuned {}", sessionId, tuning);
        setState(awaiting.toAwaitingOpen(tuning));
    }

    private void onOpen(ClientSessionState.AwaitingOpen awaiting, ConnectionOpen open) {
        UpstreamUrl upstreamUrl = config.upstream();
        Credentials credentials = awaiting.credentials();
        EndpointIdentity identity = new EndpointIdentity(upstreamUrl.hostPort(), upstreamUrl.tls(), open.virtualHost(),
                credentials.username(), credentials.password());
        setState(awaiting.toLeasing(identity));
        leasePending = true;
        LOGGER.debug("{}: Leasing upstream connection for {}", sessionId, identity);
        ClientFrontendHandler frontend = frontend();
        // frames that arrive before open-ok are buffered, so stop reading until the lease completes
        frontend.applyBackpressure();
        pool.lease(identity, frontend.eventLoop(), frontend)
                .whenComplete((conn, error) -> frontend.runOnClientLoop(() -> onLeaseComplete(conn, error)));
    }

    @VisibleForTesting
    void onLeaseComplete(@Nullable UpstreamConnection conn, @Nullable Throwable error) {
        leasePending = false;
        if (error != null || conn == null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (state instanceof ClientSessionState.Leasing) {
                ReplyCode code = cause instanceof UpstreamException upstreamException ? upstreamException.replyCode() : ReplyCode.INTERNAL_ERROR;
                String message = cause == null ? "no upstream connection" : String.valueOf(cause.getMessage());
                LOGGER.warn("{}: Could not obtain upstream connection: {}", sessionId, message);
                closeClient(ConnectionClose.of(code, message), false);
            }
            maybeFinish();
            return;
        }
        this.upstream = conn;
        if (!(state instanceof ClientSessionState.Leasing leasing)) {
            LOGGER.debug("{}: Lease of {} completed after session ended, returning it", sessionId, conn.id());
            teardownUpstream();
            return;
        }
        if (!conn.isUsable()) {
            LOGGER.warn("{}: Leased {} was lost before use", sessionId, conn.id());
            returnUpstream(false);
            closeClient(ConnectionClose.of(ReplyCode.INTERNAL_ERROR, "upstream connection lost"), false);
            return;
        }
        LOGGER.debug("{}: Leased {}", sessionId, conn.id());
        setState(leasing.toOpen(conn));
        ClientFrontendHandler frontend = frontend();
        frontend.writeToClient(MethodCodec.frame(0, new ConnectionOpenOk(), frontend.alloc()));
        List<Frame> buffered = frontend.takeBufferedMsgs();
        if (!buffered.isEmpty()) {
            LOGGER.debug("{}: Replaying {} buffered frames", sessionId, buffered.size());
        }
        for (Frame frame : buffered) {
            onClientMessage(frame);
        }
        onClientReadComplete();
        if (state instanceof ClientSessionState.Open && conn.isWritable()) {
            frontend.relieveBackpressure();
        }
    }

    // ==================== Client Frames ====================

    /**
     * @return true if ownership of the frame passed on
     */
    private boolean onClientFrame(Frame frame) {
        if (frame.isMethod() && frame.payloadSize() < 4) {
            throw new ProtocolException(ReplyCode.FRAME_ERROR, "method frame too short on channel " + frame.channel());
        }
        if (frame.isHeartbeat()) {
            // answered here, the upstream connection keeps its own heartbeat
            if (!(state instanceof ClientSessionState.Closing)) {
                frontend().writeToClient(Frame.heartbeat());
            }
            return false;
        }
        if (state instanceof ClientSessionState.Closing closing) {
            onClientFrameWhileClosing(frame, closing);
            return false;
        }
        if (state instanceof ClientSessionState.Leasing) {
            frontend().bufferMsg(frame);
            return true;
        }
        if (frame.channel() == 0) {
            onClientConnectionFrame(frame);
            return false;
        }
        if (state instanceof ClientSessionState.Open open) {
            return onClientChannelFrame(frame, open);
        }
        throw new ProtocolException(ReplyCode.COMMAND_INVALID, "frame on channel " + frame.channel() + " before connection.open-ok");
    }

    private void onClientConnectionFrame(Frame frame) {
        if (!frame.isMethod()) {
            throw new ProtocolException(ReplyCode.UNEXPECTED_FRAME, frame.type() + " frame on channel 0");
        }
        AmqpMethod method = decode(frame);
        if (method == null) {
            throw new ProtocolException(ReplyCode.NOT_IMPLEMENTED, "method " + frame.methodClassId() + "." + frame.methodId() + " is not supported",
                    frame.methodClassId(), frame.methodId());
        }
        if (method instanceof ConnectionClose close) {
            onClientConnectionClose(close);
        }
        else if (state instanceof ClientSessionState.AwaitingStartOk awaiting && method instanceof ConnectionStartOk startOk) {
            onStartOk(awaiting, startOk);
        }
        else if (state instanceof ClientSessionState.AwaitingTuneOk awaiting && method instanceof ConnectionTuneOk tuneOk) {
            onTuneOk(awaiting, tuneOk);
        }
        else if (state instanceof ClientSessionState.AwaitingOpen awaiting && method instanceof ConnectionOpen open) {
            onOpen(awaiting, open);
        }
        else {
            throw new ProtocolException(ReplyCode.COMMAND_INVALID, "unexpected " + methodName(method) + " in state " + currentStateName(),
                    method.classId(), method.methodId());
        }
    }

    private void onClientConnectionClose(ConnectionClose close) {
        LOGGER.debug("{}: Client closed connection: {} {}", sessionId, close.replyCode(), close.replyText());
        setState(new ClientSessionState.Closing(false));
        ClientFrontendHandler frontend = frontend();
        frontend.writeToClient(MethodCodec.frame(0, new ConnectionCloseOk(), frontend.alloc()));
        frontend.closeAfterFlush();
        teardownUpstream();
    }

    private void onClientFrameWhileClosing(Frame frame, ClientSessionState.Closing closing) {
        if (frame.channel() != 0 || !frame.isMethod() || !closing.awaitingClientCloseOk()) {
            return;
        }
        AmqpMethod method = decode(frame);
        if (method instanceof ConnectionCloseOk) {
            LOGGER.debug("{}: Client confirmed connection close", sessionId);
            frontend().closeClient();
        }
        else if (method instanceof ConnectionClose) {
            // crossed with our own connection.close
            setState(new ClientSessionState.Closing(false));
            frontend().writeToClient(MethodCodec.frame(0, new ConnectionCloseOk(), frontend().alloc()));
            frontend().closeAfterFlush();
        }
    }

    private boolean onClientChannelFrame(Frame frame, ClientSessionState.Open open) {
        int clientChannel = frame.channel();
        if (clientChannel > open.tuning().channelMax()) {
            throw new ProtocolException(ReplyCode.CHANNEL_ERROR,
                    "channel " + clientChannel + " exceeds negotiated channel_max " + open.tuning().channelMax());
        }
        ChannelMapping mapping = clientChannels.get(clientChannel);
        if (frame.isMethod() && frame.methodClassId() == AmqpMethod.CHANNEL_CLASS) {
            int methodId = frame.methodId();
            if (methodId == CHANNEL_OPEN) {
                openChannel(clientChannel, mapping, open.upstream());
                return false;
            }
            if (mapping != null && methodId == CHANNEL_CLOSE) {
                return onClientChannelClose(frame, mapping, open.upstream());
            }
            if (mapping != null && methodId == CHANNEL_CLOSE_OK) {
                return onClientChannelCloseOk(frame, mapping, open.upstream());
            }
        }
        if (mapping == null) {
            throw new ProtocolException(ReplyCode.CHANNEL_ERROR, "expected 'channel.open' on channel " + clientChannel);
        }
        if (mapping.state() != ChannelMapping.State.OPEN) {
            LOGGER.trace("{}: Discarding {} for closing channel {}", sessionId, frame, mapping);
            return false;
        }
        open.upstream().write(frame.remap(mapping.upstreamChannel()));
        return true;
    }

    private void openChannel(int clientChannel, @Nullable ChannelMapping existing, UpstreamConnection conn) {
        ChannelOpen channelOpen = new ChannelOpen();
        if (existing != null) {
            throw new ProtocolException(ReplyCode.CHANNEL_ERROR, "second 'channel.open' seen on channel " + clientChannel,
                    channelOpen.classId(), channelOpen.methodId());
        }
        OptionalInt upstreamChannel = conn.allocateChannel();
        if (upstreamChannel.isEmpty()) {
            throw new ProtocolException(ReplyCode.NOT_ALLOWED, "no free channels on upstream connection",
                    channelOpen.classId(), channelOpen.methodId());
        }
        ChannelMapping mapping = new ChannelMapping(clientChannel, upstreamChannel.getAsInt());
        clientChannels.put(clientChannel, mapping);
        upstreamChannels.put(mapping.upstreamChannel(), mapping);
        LOGGER.trace("{}: Opening channel {}", sessionId, mapping);
        conn.write(MethodCodec.frame(mapping.upstreamChannel(), channelOpen, frontend().alloc()));
    }

    private boolean onClientChannelClose(Frame frame, ChannelMapping mapping, UpstreamConnection conn) {
        switch (mapping.state()) {
            case OPEN -> {
                mapping.state(ChannelMapping.State.CLIENT_CLOSING);
                conn.write(frame.remap(mapping.upstreamChannel()));
                return true;
            }
            case BROKER_CLOSING -> {
                // crossed close, the client still owes the broker a close-ok
                frontend().writeToClient(MethodCodec.frame(mapping.clientChannel(), new ChannelCloseOk(), frontend().alloc()));
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    private boolean onClientChannelCloseOk(Frame frame, ChannelMapping mapping, UpstreamConnection conn) {
        switch (mapping.state()) {
            case BROKER_CLOSING -> {
                conn.write(frame.remap(mapping.upstreamChannel()));
                removeMapping(mapping, conn);
                return true;
            }
            case OPEN -> throw new ProtocolException(ReplyCode.COMMAND_INVALID, "unexpected channel.close-ok on channel " + mapping.clientChannel(),
                    AmqpMethod.CHANNEL_CLASS, CHANNEL_CLOSE_OK);
            default -> {
                return false;
            }
        }
    }

    // ==================== Upstream Events ====================

    /**
     * A frame for one of this session's upstream channels. Takes ownership of the frame.
     */
    public void onUpstreamFrame(Frame frame) {
        boolean forwarded = false;
        try {
            forwarded = relayUpstreamFrame(frame);
        }
        finally {
            if (!forwarded) {
                frame.release();
            }
        }
    }

    private boolean relayUpstreamFrame(Frame frame) {
        UpstreamConnection conn = upstream;
        if (conn == null) {
            return false;
        }
        ChannelMapping mapping = upstreamChannels.get(frame.channel());
        if (mapping == null) {
            LOGGER.debug("{}: Dropping {} for unmapped upstream channel", sessionId, frame);
            return false;
        }
        if (frame.isMethod() && frame.payloadSize() >= 4 && frame.methodClassId() == AmqpMethod.CHANNEL_CLASS) {
            int methodId = frame.methodId();
            if (methodId == CHANNEL_CLOSE) {
                return onBrokerChannelClose(frame, mapping, conn);
            }
            if (methodId == CHANNEL_CLOSE_OK) {
                return onBrokerChannelCloseOk(frame, mapping, conn);
            }
        }
        if (mapping.state() == ChannelMapping.State.PROXY_CLOSING || !(state instanceof ClientSessionState.Open)) {
            return false;
        }
        frontend().forwardToClient(frame.remap(mapping.clientChannel()));
        return true;
    }

    private boolean onBrokerChannelClose(Frame frame, ChannelMapping mapping, UpstreamConnection conn) {
        switch (mapping.state()) {
            case OPEN -> {
                LOGGER.debug("{}: Broker closed channel {}", sessionId, mapping);
                mapping.state(ChannelMapping.State.BROKER_CLOSING);
                frontend().forwardToClient(frame.remap(mapping.clientChannel()));
                return true;
            }
            case CLIENT_CLOSING, PROXY_CLOSING -> {
                // crossed close, our close-ok is owed and the broker's is still expected
                conn.writeAndFlush(MethodCodec.frame(mapping.upstreamChannel(), new ChannelCloseOk(), frontend().alloc()));
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    private boolean onBrokerChannelCloseOk(Frame frame, ChannelMapping mapping, UpstreamConnection conn) {
        switch (mapping.state()) {
            case CLIENT_CLOSING -> {
                removeMapping(mapping, conn);
                frontend().forwardToClient(frame.remap(mapping.clientChannel()));
                return true;
            }
            case PROXY_CLOSING -> {
                removeMapping(mapping, conn);
                if (upstreamChannels.isEmpty()) {
                    returnUpstream(true);
                }
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    public void onUpstreamReadComplete() {
        if (state instanceof ClientSessionState.Open) {
            frontend().flushToClient();
        }
    }

    /**
     * Broker socket writability changed: a slow broker stops reads from the client.
     */
    public void onUpstreamWritabilityChanged(boolean writable) {
        if (!(state instanceof ClientSessionState.Open)) {
            return;
        }
        if (writable) {
            frontend().relieveBackpressure();
        }
        else {
            frontend().applyBackpressure();
        }
    }

    /**
     * connection.blocked or connection.unblocked from the broker, passed on to clients that
     * announced the capability.
     */
    public void onUpstreamFlowControl(AmqpMethod method) {
        if (state instanceof ClientSessionState.Open && clientSupportsBlocked) {
            ClientFrontendHandler frontend = frontend();
            frontend.writeToClient(MethodCodec.frame(0, method, frontend.alloc()));
            frontend.flushToClient();
        }
    }

    /**
     * The leased connection is gone; the pool has already dropped it.
     */
    public void onUpstreamClosed(@Nullable ConnectionClose brokerClose, Throwable cause) {
        UpstreamConnection conn = upstream;
        if (conn == null) {
            return;
        }
        LOGGER.debug("{}: Upstream {} closed: {}", sessionId, conn.id(), cause.getMessage());
        upstream = null;
        cancelChannelCloseTimer();
        clientChannels.clear();
        upstreamChannels.clear();
        if (state instanceof ClientSessionState.Open) {
            closeClient(brokerClose != null ? brokerClose : ConnectionClose.of(ReplyCode.CONNECTION_FORCED, "upstream connection closed"), false);
        }
        else {
            maybeFinish();
        }
    }

    // ==================== Closing ====================

    private void closeWithError(ProtocolException e) {
        metrics.clientErrorCounter().increment();
        LOGGER.warn("{}: Closing client connection with {} {}: {}", sessionId, e.replyCode().code(), e.replyCode(), e.getMessage());
        if (state instanceof ClientSessionState.Closing || state instanceof ClientSessionState.Closed) {
            frontend().closeClient();
            return;
        }
        closeClient(new ConnectionClose(e.replyCode().code(), e.replyCode().text(e.getMessage()), e.classId(), e.methodId()), false);
    }

    private void closeClient(ConnectionClose close, boolean awaitClientCloseOk) {
        ClientFrontendHandler frontend = frontend();
        Frame closeFrame;
        try {
            closeFrame = MethodCodec.frame(0, close, frontend.alloc());
        }
        catch (RuntimeException e) {
            LOGGER.error("{}: Could not encode {}, dropping the client connection", sessionId, close, e);
            setState(new ClientSessionState.Closing(false));
            frontend.closeClient();
            teardownUpstream();
            return;
        }
        setState(new ClientSessionState.Closing(awaitClientCloseOk));
        frontend.writeToClient(closeFrame);
        if (awaitClientCloseOk) {
            frontend.relieveBackpressure();
            frontend.flushToClient();
        }
        else {
            frontend.closeAfterFlush();
        }
        teardownUpstream();
    }

    /**
     * Closes this session's upstream channels, keeping the connection itself open, and returns
     * the connection to the pool once the broker has confirmed every close.
     */
    private void teardownUpstream() {
        frontend().releaseBufferedMsgs();
        UpstreamConnection conn = upstream;
        if (conn == null) {
            // a pending lease is returned when it completes
            maybeFinish();
            return;
        }
        conn.relieveBackpressure();
        clientChannels.clear();
        for (ChannelMapping mapping : new ArrayList<>(upstreamChannels.values())) {
            switch (mapping.state()) {
                case OPEN -> {
                    conn.write(MethodCodec.frame(mapping.upstreamChannel(),
                            new ChannelClose(ReplyCode.REPLY_SUCCESS.code(), ReplyCode.REPLY_SUCCESS.text("client connection closed"), 0, 0),
                            frontend().alloc()));
                    mapping.state(ChannelMapping.State.PROXY_CLOSING);
                }
                case CLIENT_CLOSING -> mapping.state(ChannelMapping.State.PROXY_CLOSING);
                case BROKER_CLOSING -> {
                    conn.write(MethodCodec.frame(mapping.upstreamChannel(), new ChannelCloseOk(), frontend().alloc()));
                    removeMapping(mapping, conn);
                }
                case PROXY_CLOSING -> {
                }
            }
        }
        conn.flush();
        if (upstreamChannels.isEmpty()) {
            returnUpstream(true);
        }
        else if (channelCloseTimer == null) {
            LOGGER.debug("{}: Waiting for broker to confirm close of {} channels", sessionId, upstreamChannels.size());
            channelCloseTimer = frontend().eventLoop().schedule(this::onChannelCloseTimeout,
                    config.channelCloseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void onChannelCloseTimeout() {
        channelCloseTimer = null;
        if (upstream == null || upstreamChannels.isEmpty()) {
            return;
        }
        LOGGER.warn("{}: Broker did not confirm close of {} channels within {}ms, evicting {}", sessionId,
                upstreamChannels.size(), config.channelCloseTimeout().toMillis(), upstream.id());
        upstreamChannels.clear();
        returnUpstream(false);
    }

    private void returnUpstream(boolean reusable) {
        UpstreamConnection conn = Objects.requireNonNull(upstream);
        upstream = null;
        cancelChannelCloseTimer();
        if (reusable) {
            pool.release(conn);
        }
        else {
            pool.evict(conn);
        }
        maybeFinish();
    }

    private void removeMapping(ChannelMapping mapping, UpstreamConnection conn) {
        clientChannels.remove(mapping.clientChannel(), mapping);
        upstreamChannels.remove(mapping.upstreamChannel());
        conn.releaseChannel(mapping.upstreamChannel());
    }

    private void cancelChannelCloseTimer() {
        if (channelCloseTimer != null) {
            channelCloseTimer.cancel(false);
            channelCloseTimer = null;
        }
    }

    private void maybeFinish() {
        if (state instanceof ClientSessionState.Closing closing && clientClosed && upstream == null && !leasePending) {
            setState(closing.toClosed());
            tracker.onSessionClosed(this);
            LOGGER.debug("{}: Session closed", sessionId);
        }
    }

    // ==================== Helpers ====================

    @Nullable
    private AmqpMethod decode(Frame frame) {
        try {
            return MethodCodec.decode(frame);
        }
        catch (MalformedFrameException e) {
            throw new ProtocolException(ReplyCode.FRAME_ERROR, e.getMessage());
        }
    }

    private ClientFrontendHandler frontend() {
        return Objects.requireNonNull(frontendHandler, "Client not yet active");
    }

    private void setState(ClientSessionState newState) {
        LOGGER.trace("{}: State {} -> {}", sessionId, currentStateName(), newState.getClass().getSimpleName());
        this.state = newState;
    }

    private void illegalState(String msg) {
        LOGGER.error("{}: {} in state {}", sessionId, msg, currentStateName());
        if (frontendHandler != null) {
            frontendHandler.closeClient();
        }
    }

    private static String methodName(AmqpMethod method) {
        return method.getClass().getSimpleName();
    }

    private static boolean hasCapability(Map<String, Object> clientProperties, String capability) {
        return clientProperties.get("capabilities") instanceof Map<?, ?> capabilities
                && Boolean.TRUE.equals(capabilities.get(capability));
    }

    static Map<String, Object> serverProperties() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("publisher_confirms", true);
        capabilities.put("exchange_exchange_bindings", true);
        capabilities.put("basic.nack", true);
        capabilities.put("per_consumer_qos", true);
        capabilities.put("authentication_failure_close", true);
        capabilities.put("consumer_cancel_notify", true);
        capabilities.put("connection.blocked", true);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("product", PRODUCT);
        properties.put("version", version());
        properties.put("platform", "Java " + System.getProperty("java.version"));
        properties.put("capabilities", capabilities);
        return properties;
    }

    static String version() {
        String version = ClientSessionStateMachine.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }

    @Override
    public String toString() {
        return "ClientSessionStateMachine{" +
                "sessionId=" + sessionId +
                ", state=" + currentStateName() +
                ", upstream=" + (upstream == null ? null : upstream.id()) +
                ", channels=" + clientChannels.size() +
                '}';
    }
}
