/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.EventLoop;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.SelfSignedCertificate;

import io.amqproxy.proxy.frame.AmqpMethod;
import io.amqproxy.proxy.frame.AmqpMethod.ConnectionClose;
import io.amqproxy.proxy.frame.Frame;
import io.amqproxy.proxy.internal.codec.MethodCodec;
import io.amqproxy.proxy.internal.util.Metrics;
import io.amqproxy.proxy.service.HostPort;
import io.amqproxy.proxy.testing.FakeBroker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpstreamPoolTest {

    private static final Duration IDLE_TIMEOUT = Duration.ofSeconds(5);

    private FakeBroker broker;
    private NioEventLoopGroup group;
    private EventLoop eventLoop;
    private Metrics metrics;
    private AtomicLong clock;
    private UpstreamPool pool;

    @BeforeEach
    void setUp() throws Exception {
        broker = new FakeBroker(Map.of("guest", "guest", "alice", "wonderland"), 2047).start();
        group = new NioEventLoopGroup(1);
        eventLoop = group.next();
        metrics = Metrics.noop();
        clock = new AtomicLong();
        pool = new UpstreamPool(IDLE_TIMEOUT, FakeBroker.FRAME_MAX, metrics, clock::get);
    }

    @AfterEach
    void tearDown() {
        pool.close();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        broker.close();
    }

    private EndpointIdentity identity(String vhost, String username, String password) {
        return new EndpointIdentity(broker.address(), false, vhost, username, password);
    }

    private EndpointIdentity guest() {
        return identity("/", "guest", "guest");
    }

    private UpstreamConnection lease(EndpointIdentity identity, UpstreamListener listener) throws Exception {
        return pool.lease(identity, eventLoop, listener).get(5, TimeUnit.SECONDS);
    }

    private UpstreamConnection lease(EndpointIdentity identity) throws Exception {
        return lease(identity, new RecordingListener());
    }

    @Test
    void releasedConnectionIsReused() throws Exception {
        UpstreamConnection first = lease(guest());
        assertEquals(1, pool.leasedCount());

        pool.release(first);
        assertEquals(1, pool.idleCount());
        UpstreamConnection second = lease(guest());

        assertSame(first, second);
        assertEquals(1, broker.connections().size());
        assertEquals(1.0, metrics.upstreamCreatedCounter().count());
    }

    @Test
    void connectionNegotiatesIdentityWithBroker() throws Exception {
        UpstreamConnection connection = lease(identity("orders", "alice", "wonderland"));

        assertTrue(connection.isUsable());
        FakeBroker.Connection brokerSide = broker.connection(0);
        FakeBroker.await("broker handshake", () -> "orders".equals(brokerSide.virtualHost()));
        assertEquals("alice", brokerSide.username());
    }

    @Test
    void mostRecentlyReleasedIdleConnectionIsLeasedFirst() throws Exception {
        UpstreamConnection a = lease(guest());
        UpstreamConnection b = lease(guest());
        assertNotSame(a, b);

        pool.release(a);
        clock.addAndGet(TimeUnit.SECONDS.toNanos(1));
        pool.release(b);

        assertSame(b, lease(guest()));
        assertSame(a, lease(guest()));
    }

    @Test
    void identitiesDoNotShareConnections() throws Exception {
        UpstreamConnection guestConnection = lease(guest());
        pool.release(guestConnection);

        UpstreamConnection otherVhost = lease(identity("other", "guest", "guest"));
        UpstreamConnection otherUser = lease(identity("/", "alice", "wonderland"));

        assertNotSame(guestConnection, otherVhost);
        assertNotSame(guestConnection, otherUser);
        assertEquals(3, broker.connections().size());
        assertEquals(1, pool.idleCount());
    }

    @Test
    void sweepEvictsConnectionsIdleForTheTimeout() throws Exception {
        UpstreamConnection connection = lease(guest());
        pool.release(connection);

        clock.addAndGet(IDLE_TIMEOUT.minusMillis(1).toNanos());
        assertEquals(0, pool.sweep());
        assertEquals(1, pool.idleCount());

        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(1));
        assertEquals(1, pool.sweep());
        assertEquals(0, pool.size());
        FakeBroker.await("broker connection closed", () -> broker.openConnections() == 0);
        assertEquals(1.0, metrics.upstreamEvictedCounter().count());
    }

    @Test
    void leasingResetsIdleClock() throws Exception {
        UpstreamConnection connection = lease(guest());
        pool.release(connection);
        clock.addAndGet(IDLE_TIMEOUT.toNanos() - 1);
        assertSame(connection, lease(guest()));

        clock.addAndGet(IDLE_TIMEOUT.toNanos());
        pool.release(connection);
        assertEquals(0, pool.sweep());
    }

    @Test
    void connectionWithOpenChannelIsNotPooled() throws Exception {
        UpstreamConnection connection = lease(guest());
        OptionalInt channel = connection.allocateChannel();
        assertTrue(channel.isPresent());

        pool.release(connection);

        assertEquals(0, pool.size());
        FakeBroker.await("broker connection closed", () -> broker.openConnections() == 0);
    }

    @Test
    void refusedCredentialsFailTheLease() {
        CompletableFuture<UpstreamConnection> lease = pool.lease(identity("/", "guest", "wrong"), eventLoop, new RecordingListener());

        ExecutionException e = assertThrows(ExecutionException.class, () -> lease.get(5, TimeUnit.SECONDS));
        assertInstanceOf(UpstreamAccessRefusedException.class, e.getCause());
        assertEquals(0, pool.size());
    }

    @Test
    void unreachableBrokerFailsTheLease() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        EndpointIdentity nowhere = new EndpointIdentity(new HostPort("127.0.0.1", port), false, "/", "guest", "guest");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> pool.lease(nowhere, eventLoop, new RecordingListener()).get(15, TimeUnit.SECONDS));
        assertInstanceOf(UpstreamUnavailableException.class, e.getCause());
        assertEquals(0, pool.size());
    }

    @Test
    void amqpsBrokerWithCertificateForAnotherHostFailsTheLease() throws Exception {
        SelfSignedCertificate certificate = new SelfSignedCertificate("amqp.example.com");
        FakeBroker tlsBroker = new FakeBroker(Map.of("guest", "guest"), 2047)
                .tls(SslContextBuilder.forServer(certificate.certificate(), certificate.privateKey()).build())
                .start();
        try {
            pool.sslContext(SslContextBuilder.forClient().trustManager(certificate.cert()).build());
            EndpointIdentity mismatched = new EndpointIdentity(tlsBroker.address(), true, "/", "guest", "guest");

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> pool.lease(mismatched, eventLoop, new RecordingListener()).get(15, TimeUnit.SECONDS));
            assertInstanceOf(UpstreamUnavailableException.class, e.getCause());
            assertEquals(0, pool.size());
        }
        finally {
            tlsBroker.close();
            certificate.delete();
        }
    }

    @Test
    void lesseeReceivesFramesOfItsChannels() throws Exception {
        RecordingListener listener = new RecordingListener();
        UpstreamConnection connection = lease(guest(), listener);
        int channel = connection.allocateChannel().getAsInt();

        connection.writeAndFlush(MethodCodec.frame(channel, new AmqpMethod.ChannelOpen(), ByteBufAllocator.DEFAULT));

        Frame reply = listener.frames.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply);
        try {
            assertEquals(channel, reply.channel());
            assertInstanceOf(AmqpMethod.ChannelOpenOk.class, MethodCodec.decode(reply));
        }
        finally {
            reply.release();
        }
    }

    @Test
    void brokerCloseIsReportedToLesseeAndDropsConnection() throws Exception {
        RecordingListener listener = new RecordingListener();
        lease(guest(), listener);

        broker.connection(0).closeConnection(320, "CONNECTION_FORCED - broker forced connection closure");

        ConnectionClose close = listener.closed.get(5, TimeUnit.SECONDS);
        assertEquals(320, close.replyCode());
        assertEquals(0, pool.size());
    }

    @Test
    void flowControlIsReportedToLessee() throws Exception {
        RecordingListener listener = new RecordingListener();
        lease(guest(), listener);

        broker.connection(0).blocked("low on memory");

        AmqpMethod method = listener.flowControl.poll(5, TimeUnit.SECONDS);
        assertInstanceOf(AmqpMethod.ConnectionBlocked.class, method);
    }

    @Test
    void closedPoolRefusesLeases() throws Exception {
        lease(guest());

        pool.close();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> pool.lease(guest(), eventLoop, new RecordingListener()).get(5, TimeUnit.SECONDS));
        assertInstanceOf(UpstreamUnavailableException.class, e.getCause());
        FakeBroker.await("broker connections closed", () -> broker.openConnections() == 0);
    }

    static final class RecordingListener implements UpstreamListener {
        final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
        final BlockingQueue<AmqpMethod> flowControl = new LinkedBlockingQueue<>();
        final CompletableFuture<ConnectionClose> closed = new CompletableFuture<>();

        @Override
        public void onUpstreamFrame(Frame frame) {
            frames.add(frame);
        }

        @Override
        public void onUpstreamReadComplete() {
        }

        @Override
        public void onUpstreamWritabilityChanged(boolean writable) {
        }

        @Override
        public void onUpstreamFlowControl(AmqpMethod method) {
            flowControl.add(method);
        }

        @Override
        public void onUpstreamClosed(AmqpMethod.ConnectionClose brokerClose, Throwable cause) {
            if (brokerClose != null) {
                closed.complete(brokerClose);
            }
            else {
                closed.completeExceptionally(cause);
            }
        }
    }
}
