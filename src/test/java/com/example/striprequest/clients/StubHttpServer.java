package com.example.striprequest.clients;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;

/**
 * Plain-socket HTTP stub for tests. Reads the request head (LF or CRLF line endings) plus any
 * {@code Content-Length} body and answers with whatever the handler returns.
 */
public class StubHttpServer implements AutoCloseable {

    private static final String KEY_STORE = "/tls/stub-server.p12";
    private static final char[] KEY_STORE_PASSWORD = "changeit".toCharArray();

    private final ServerSocket serverSocket;
    private final ExecutorService workers = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "stub-http-server");
        thread.setDaemon(true);
        return thread;
    });
    private final Function<String, String> handler;
    private final List<String> receivedRequests = new CopyOnWriteArrayList<>();

    public StubHttpServer(Function<String, String> handler) throws IOException {
        this(handler, new ServerSocket(0, 50, InetAddress.getLoopbackAddress()));
    }

    private StubHttpServer(Function<String, String> handler, ServerSocket serverSocket) {
        this.handler = handler;
        this.serverSocket = serverSocket;
        workers.execute(this::acceptLoop);
    }

    /**
     * TLS variant serving the self-signed {@code tls/stub-server.p12} certificate, which no default trust
     * store accepts.
     */
    public static StubHttpServer tls(Function<String, String> handler) throws IOException {
        try (InputStream keyStoreStream = StubHttpServer.class.getResourceAsStream(KEY_STORE)) {
            if (keyStoreStream == null) {
                throw new IOException("Missing test key store " + KEY_STORE);
            }
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(keyStoreStream, KEY_STORE_PASSWORD);
            KeyManagerFactory keyManagers = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagers.init(keyStore, KEY_STORE_PASSWORD);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagers.getKeyManagers(), null, null);
            ServerSocket serverSocket = context.getServerSocketFactory()
                    .createServerSocket(0, 50, InetAddress.getLoopbackAddress());
            return new StubHttpServer(handler, serverSocket);
        } catch (GeneralSecurityException e) {
            throw new IOException("Unable to build TLS stub server", e);
        }
    }

    public static String response(int status, String message, String body) {
        return "HTTP/1.1 " + status + " " + message + "\r\n"
                + "Content-Length: " + body.getBytes(StandardCharsets.UTF_8).length + "\r\n"
                + "Date: " + System.nanoTime() + "\r\n"
                + "Connection: close\r\n"
                + "\r\n"
                + body;
    }

    public String host() {
        return serverSocket.getInetAddress().getHostAddress();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public List<String> receivedRequests() {
        return receivedRequests;
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                workers.execute(() -> handle(socket));
            } catch (SocketException closed) {
                return;
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    private void handle(Socket socket) {
        try (socket) {
            var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            var request = new StringBuilder();
            int contentLength = 0;
            String line;
            while ((line = reader.readLine()) != null && !line.isEmpty()) {
                request.append(line).append('\n');
                if (line.regionMatches(true, 0, "Content-Length:", 0, 15)) {
                    contentLength = Integer.parseInt(line.substring(15).trim());
                }
            }
            request.append('\n');
            if (contentLength > 0) {
                char[] body = new char[contentLength];
                int read = 0;
                while (read < contentLength) {
                    int n = reader.read(body, read, contentLength - read);
                    if (n < 0) {
                        break;
                    }
                    read += n;
                }
                request.append(body, 0, read);
            }
            String raw = request.toString();
            receivedRequests.add(raw);

            String reply = handler.apply(raw);
            if (reply != null) {
                OutputStream out = socket.getOutputStream();
                out.write(reply.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException ignored) {
            // client went away
        }
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        workers.shutdownNow();
        try {
            workers.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
