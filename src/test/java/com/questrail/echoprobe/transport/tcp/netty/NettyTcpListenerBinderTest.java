package com.questrail.echoprobe.transport.tcp.netty;

import com.questrail.echoprobe.transport.BoundListener;
import com.questrail.echoprobe.transport.ConnectionListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class NettyTcpListenerBinderTest {

    /**
     * Listener that echoes and records every callback.
     */
    private static final class RecordingConnection implements ConnectionListener {
        private final boolean accept;
        final List<String> calls = new CopyOnWriteArrayList<>();
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch ended = new CountDownLatch(1);
        volatile SocketAddress remote;
        volatile int bytesSeen;

        RecordingConnection(boolean accept) {
            this.accept = accept;
        }

        @Override
        public boolean onOpen(SocketAddress remote) {
            this.remote = remote;
            calls.add("open");
            opened.countDown();
            return accept;
        }

        @Override
        public byte[] onData(byte[] payload) {
            bytesSeen += payload.length;
            calls.add("data");
            return payload;
        }

        @Override
        public void onPeerClosed() {
            calls.add("peerClosed");
            ended.countDown();
        }

        @Override
        public void onIdleTimeout() {
            calls.add("idle");
            ended.countDown();
        }

        @Override
        public void onTransportShutdown() {
            calls.add("transportShutdown");
            ended.countDown();
        }

        @Override
        public void onFailure(Throwable cause) {
            calls.add("failure");
            ended.countDown();
        }
    }

    private NettyTcpListenerBinder binder;

    @AfterEach
    void tearDown() {
        if (binder != null) {
            binder.shutdown();
        }
    }

    private static byte[] readExactly(InputStream in, int n) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[512];
        while (out.size() < n) {
            int r = in.read(buf, 0, Math.min(buf.length, n - out.size()));
            if (r < 0) {
                break;
            }
            out.write(buf, 0, r);
        }
        return out.toByteArray();
    }

    @Test
    void echoesBytesBackUnchanged() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofSeconds(30));
        RecordingConnection connection = new RecordingConnection(true);
        BoundListener bound = binder.bind(0, () -> connection);

        assertTrue(bound.localPort() > 0);
        assertTrue(bound.isOpen());

        try (Socket socket = new Socket("127.0.0.1", bound.localPort())) {
            socket.setSoTimeout(5000);
            byte[] hello = "hello".getBytes(StandardCharsets.US_ASCII);
            socket.getOutputStream().write(hello);

            assertArrayEquals(hello, readExactly(socket.getInputStream(), hello.length));
        }

        assertTrue(connection.ended.await(5, TimeUnit.SECONDS));
        assertEquals("open", connection.calls.get(0));
        assertEquals("peerClosed", connection.calls.get(connection.calls.size() - 1));
        assertEquals("127.0.0.1", ((InetSocketAddress) connection.remote).getAddress().getHostAddress());
    }

    @Test
    void largePayloadIsEchoedInFull() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofSeconds(30));
        RecordingConnection connection = new RecordingConnection(true);
        BoundListener bound = binder.bind(0, () -> connection);

        byte[] payload = new byte[5000];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }

        try (Socket socket = new Socket("127.0.0.1", bound.localPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(payload);
            out.flush();

            assertArrayEquals(payload, readExactly(socket.getInputStream(), payload.length));
        }

        assertTrue(connection.ended.await(5, TimeUnit.SECONDS));
        assertEquals(payload.length, connection.bytesSeen);
    }

    @Test
    void idleConnectionIsClosedWithoutFailure() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofMillis(200));
        RecordingConnection connection = new RecordingConnection(true);
        BoundListener bound = binder.bind(0, () -> connection);

        try (Socket socket = new Socket("127.0.0.1", bound.localPort())) {
            socket.setSoTimeout(5000);

            // Server closes the idle connection: end of stream.
            assertEquals(-1, socket.getInputStream().read());
        }

        assertTrue(connection.ended.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("open", "idle"), connection.calls);
    }

    @Test
    void refusedConnectionIsClosedImmediately() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofSeconds(30));
        RecordingConnection connection = new RecordingConnection(false);
        BoundListener bound = binder.bind(0, () -> connection);

        try (Socket socket = new Socket("127.0.0.1", bound.localPort())) {
            socket.setSoTimeout(5000);
            assertEquals(-1, socket.getInputStream().read());
        }

        assertTrue(connection.opened.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("open"), connection.calls);
    }

    @Test
    void shutdownEndsOpenConnectionsWithoutReportingPeerClose() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofSeconds(30));
        RecordingConnection connection = new RecordingConnection(true);
        BoundListener bound = binder.bind(0, () -> connection);

        try (Socket socket = new Socket("127.0.0.1", bound.localPort())) {
            socket.setSoTimeout(5000);
            assertTrue(connection.opened.await(5, TimeUnit.SECONDS));

            // Client stays connected while the transport goes away.
            binder.shutdown();
            binder = null;

            assertTrue(connection.ended.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("open", "transportShutdown"), connection.calls);
            assertEquals(-1, socket.getInputStream().read());
        }
    }

    @Test
    void closedListenerRefusesNewConnections() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofSeconds(30));
        BoundListener bound = binder.bind(0, () -> new RecordingConnection(true));
        int port = bound.localPort();

        bound.close();

        assertFalse(bound.isOpen());
        assertThrows(IOException.class, () -> {
            try (Socket ignored = new Socket("127.0.0.1", port)) {
                fail("connection accepted after close");
            }
        });
    }

    @Test
    void portAlreadyInUseFailsToBind() throws Exception {
        binder = new NettyTcpListenerBinder(Duration.ofSeconds(30));
        BoundListener first = binder.bind(0, () -> new RecordingConnection(true));

        IOException e = assertThrows(IOException.class,
                () -> binder.bind(first.localPort(), () -> new RecordingConnection(true)));
        assertTrue(e.getMessage().contains(Integer.toString(first.localPort())));
    }
}
