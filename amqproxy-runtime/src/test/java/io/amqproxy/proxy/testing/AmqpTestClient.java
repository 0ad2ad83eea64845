/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.testing;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ChannelOpenOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionClose;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionCloseOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpen;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionOpenOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStart;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionStartOk;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTune;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionTuneOk;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.frame.FrameType;
import io.amqproxy.proxy.frame.ProtocolHeader;
import io.amqproxy.proxy.internal.codec.MethodCodec;

/**
 * A blocking AMQP client speaking raw frames over a plain socket.
 */
public final class AmqpTestClient implements AutoCloseable {

    private static final int READ_TIMEOUT_MILLIS = 5000;

    /**
     * A frame read from the proxy.
     */
    public record Received(FrameType type, int channel, byte[] payload) {

        public AmqpMethod method() {
            Frame frame = new Frame(type, channel, Unpooled.wrappedBuffer(payload));
            try {
                AmqpMethod method = MethodCodec.decode(frame);
                if (method == null) {
                    throw new AssertionError("Not a connection or channel method: " + frame);
                }
                return method;
            }
            finally {
                frame.release();
            }
        }
    }

    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;

    private AmqpTestClient(Socket socket) throws IOException {
        this.socket = socket;
        socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        socket.setTcpNoDelay(true);
        this.in = new DataInputStream(socket.getInputStream());
        this.out = new DataOutputStream(socket.getOutputStream());
    }

    public static AmqpTestClient connect(InetSocketAddress address) throws IOException {
        Socket socket = new Socket();
        socket.connect(address, READ_TIMEOUT_MILLIS);
        return new AmqpTestClient(socket);
    }

    // ==================== Writing ====================

    public void sendProtocolHeader() throws IOException {
        sendRaw(new byte[]{ 'A', 'M', 'Q', 'P', 0, 0, 9, 1 });
    }

    public void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    public void send(int channel, AmqpMethod method) throws IOException {
        ByteBuf payload = MethodCodec.encode(method, ByteBufAllocator.DEFAULT);
        try {
            sendFrame(FrameType.METHOD, channel, ByteBufUtil.getBytes(payload));
        }
        finally {
            payload.release();
        }
    }

    public void sendFrame(FrameType type, int channel, byte[] payload) throws IOException {
        out.writeByte(type.code());
        out.writeShort(channel);
        out.writeInt(payload.length);
        out.write(payload);
        out.writeByte(Frame.FRAME_END);
        out.flush();
    }

    public void sendHeartbeat() throws IOException {
        sendFrame(FrameType.HEARTBEAT, 0, new byte[0]);
    }

    // ==================== Reading ====================

    /**
     * @return the next frame, heartbeats included
     * @throws EOFException if the proxy closed the connection
     */
    public Received readFrame() throws IOException {
        FrameType type = FrameType.forCode(in.readUnsignedByte());
        int channel = in.readUnsignedShort();
        int size = in.readInt();
        byte[] payload = new byte[size];
        in.readFully(payload);
        int end = in.readUnsignedByte();
        if (type == null || end != Frame.FRAME_END) {
            throw new IOException("Malformed frame from proxy");
        }
        return new Received(type, channel, payload);
    }

    /**
     * @return the next frame that is not a heartbeat
     */
    public Received readNonHeartbeat() throws IOException {
        Received frame;
        do {
            frame = readFrame();
        } while (frame.type() == FrameType.HEARTBEAT);
        return frame;
    }

    public <T extends AmqpMethod> T expectMethod(int channel, Class<T> type) throws IOException {
        Received frame = readNonHeartbeat();
        if (frame.channel() != channel) {
            throw new AssertionError("Expected " + type.getSimpleName() + " on channel " + channel + " but got a frame on channel " + frame.channel()
                    + ": " + frame.method());
        }
        AmqpMethod method = frame.method();
        if (!type.isInstance(method)) {
            throw new AssertionError("Expected " + type.getSimpleName() + " but got " + method);
        }
        return type.cast(method);
    }

    public ProtocolHeader readProtocolHeader() throws IOException {
        byte[] bytes = new byte[ProtocolHeader.LENGTH];
        in.readFully(bytes);
        return new ProtocolHeader(new String(bytes, 0, 4, StandardCharsets.US_ASCII), bytes[4], bytes[5], bytes[6], bytes[7]);
    }

    /**
     * @return true if the proxy closes the socket before anything else arrives
     */
    public boolean awaitClosedByPeer() throws IOException {
        try {
            while (true) {
                readFrame();
            }
        }
        catch (EOFException e) {
            return true;
        }
        catch (SocketTimeoutException e) {
            return false;
        }
        catch (SocketException e) {
            // connection reset
            return true;
        }
    }

    // ==================== Conversations ====================

    /**
     * Runs the connection handshake up to connection.open-ok.
     *
     * @return the tune the proxy proposed
     */
    public ConnectionTune handshake(String username, String password, String virtualHost, int heartbeat) throws IOException {
        sendProtocolHeader();
        expectMethod(0, ConnectionStart.class);
        byte[] response = ("\0" + username + "\0" + password).getBytes(StandardCharsets.UTF_8);
        send(0, new ConnectionStartOk(Map.of("product", "AmqpTestClient", "capabilities", Map.of("connection.blocked", true)),
                "PLAIN", response, "en_US"));
        ConnectionTune tune = expectMethod(0, ConnectionTune.class);
        send(0, new ConnectionTuneOk(tune.channelMax(), tune.frameMax(), heartbeat));
        send(0, new ConnectionOpen(virtualHost));
        expectMethod(0, ConnectionOpenOk.class);
        return tune;
    }

    public ConnectionTune handshake(String username, String password, String virtualHost) throws IOException {
        return handshake(username, password, virtualHost, 0);
    }

    public void openChannel(int channel) throws IOException {
        send(channel, new ChannelOpen());
        expectMethod(channel, ChannelOpenOk.class);
    }

    public void closeConnection() throws IOException {
        send(0, new ConnectionClose(200, "REPLY_SUCCESS - bye", 0, 0));
        expectMethod(0, ConnectionCloseOk.class);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
