package com.example.striprequest.clients;

import com.example.striprequest.config.ProbeProperties;
import com.example.striprequest.model.ProbeTarget;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SocketTransportTest {

    private static SocketTransport transport(int readTimeoutMs) {
        ProbeProperties properties = new ProbeProperties();
        properties.setConnectTimeoutMs(1_000);
        properties.setReadTimeoutMs(readTimeoutMs);
        return new SocketTransport(properties);
    }

    @Test
    void returnsHeaderBlockWithoutBody() throws Exception {
        try (StubHttpServer server = new StubHttpServer(raw -> StubHttpServer.response(200, "OK", "hello"))) {
            String headerBlock = transport(1_000).exchange(
                    new ProbeTarget(server.host(), server.port(), false),
                    "GET / HTTP/1.1\nHost: localhost\n\n");

            assertTrue(headerBlock.startsWith("HTTP/1.1 200 OK\n"));
            assertThat(headerBlock).contains("Content-Length: 5\n").endsWith("\n\n").doesNotContain("hello");
        }
    }

    @Test
    void writesRequestBytesUnchanged() throws Exception {
        try (StubHttpServer server = new StubHttpServer(raw -> StubHttpServer.response(204, "No Content", ""))) {
            transport(1_000).exchange(new ProbeTarget(server.host(), server.port(), false),
                    "GET /a?b=c HTTP/1.1\nHost: localhost\nX-Test: 1\n\n");

            assertEquals(1, server.receivedRequests().size());
            assertEquals("GET /a?b=c HTTP/1.1\nHost: localhost\nX-Test: 1\n\n", server.receivedRequests().get(0));
        }
    }

    @Test
    void readTimeoutSurfacesAsTransportException() throws Exception {
        try (StubHttpServer server = new StubHttpServer(raw -> {
            try {
                TimeUnit.SECONDS.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        })) {
            long start = System.nanoTime();
            assertThatThrownBy(() -> transport(200).exchange(
                    new ProbeTarget(server.host(), server.port(), false), "GET / HTTP/1.1\n\n"))
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("Timed out");
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 3_000);
        }
    }

    @Test
    void refusedConnectionSurfacesAsTransportException() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }
        ProbeTarget target = new ProbeTarget("127.0.0.1", port, false);

        assertThatThrownBy(() -> transport(500).exchange(target, "GET / HTTP/1.1\n\n"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Connection error to 127.0.0.1:" + port);
    }

    @Test
    void closedWithoutResponseSurfacesAsTransportException() throws IOException {
        try (StubHttpServer server = new StubHttpServer(raw -> null)) {
            assertThatThrownBy(() -> transport(1_000).exchange(
                    new ProbeTarget(server.host(), server.port(), false), "GET / HTTP/1.1\n\n"))
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("closed");
        }
    }

    @Test
    void tlsExchangeAcceptsSelfSignedCertificate() throws Exception {
        try (StubHttpServer server = StubHttpServer.tls(raw -> StubHttpServer.response(201, "Created", "done"))) {
            String headerBlock = transport(2_000).exchange(
                    new ProbeTarget(server.host(), server.port(), true),
                    "POST /items HTTP/1.1\nHost: localhost\n\n");

            assertTrue(headerBlock.startsWith("HTTP/1.1 201 Created\n"));
            assertThat(headerBlock).contains("Content-Length: 4\n").endsWith("\n\n").doesNotContain("done");
            assertEquals(List.of("POST /items HTTP/1.1\nHost: localhost\n\n"), server.receivedRequests());
        }
    }

    @Test
    void tlsAgainstPlaintextEndpointFails() throws IOException {
        try (StubHttpServer server = new StubHttpServer(raw -> StubHttpServer.response(200, "OK", ""))) {
            assertThatThrownBy(() -> transport(1_000).exchange(
                    new ProbeTarget(server.host(), server.port(), true), "GET / HTTP/1.1\n\n"))
                    .isInstanceOf(TransportException.class);
        }
    }

    @Test
    void oversizedHeaderBlockIsRejected() throws Exception {
        String hugeHeader = "X-Padding: " + "a".repeat(2_000) + "\r\n";
        try (StubHttpServer server = new StubHttpServer(raw -> "HTTP/1.1 200 OK\r\n" + hugeHeader + "\r\n")) {
            ProbeProperties properties = new ProbeProperties();
            properties.setMaxHeaderBytes(512);
            SocketTransport small = new SocketTransport(properties);

            assertThatThrownBy(() -> small.exchange(
                    new ProbeTarget(server.host(), server.port(), false), "GET / HTTP/1.1\n\n"))
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("exceeded 512 bytes");
        }
    }
}
