package com.example.striprequest.clients;

import com.example.striprequest.config.ProbeProperties;
import com.example.striprequest.model.ProbeTarget;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Blocking socket transport. Every call opens its own connection, so concurrent probes never share
 * connection state; the socket is closed on every exit path.
 */
@Component
public class SocketTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

  private final int connectTimeoutMs;
  private final int readTimeoutMs;
  private final int maxHeaderBytes;

  public SocketTransport(ProbeProperties properties) {
    Objects.requireNonNull(properties, "Probe properties cannot be null");
    this.connectTimeoutMs = properties.getConnectTimeoutMs();
    this.readTimeoutMs = properties.getReadTimeoutMs();
    this.maxHeaderBytes = properties.getMaxHeaderBytes();

    log.info(
        "SocketTransport initialized - Connect timeout: {}ms, Read timeout: {}ms, Max header bytes: {}",
        connectTimeoutMs,
        readTimeoutMs,
        maxHeaderBytes);
  }

  @Override
  public String exchange(ProbeTarget target, String rawRequest) throws TransportException {
    Objects.requireNonNull(target, "Target cannot be null");
    Objects.requireNonNull(rawRequest, "Request cannot be null");

    try (Socket socket = openSocket(target)) {
      connect(socket, target);
      socket.setSoTimeout(readTimeoutMs);

      OutputStream out = socket.getOutputStream();
      out.write(rawRequest.getBytes(StandardCharsets.UTF_8));
      out.flush();

      return readHeaderBlock(socket, target);
    } catch (SocketTimeoutException e) {
      throw new TransportException(
          "Timed out after " + readTimeoutMs + "ms reading from " + target.authority(), e);
    } catch (SSLException e) {
      throw new TransportException(
          "TLS failure talking to " + target.authority()
              + "; the endpoint may not speak TLS: " + e.getMessage(),
          e);
    } catch (TransportException e) {
      throw e;
    } catch (IOException e) {
      throw new TransportException(
          "Connection to " + target.authority() + " closed unexpectedly: " + e.getMessage(), e);
    }
  }

  private Socket openSocket(ProbeTarget target) throws TransportException {
    try {
      return target.tls() ? TrustAllSslContext.socketFactory().createSocket() : new Socket();
    } catch (IOException e) {
      throw new TransportException("Unable to create socket for " + target.authority(), e);
    }
  }

  private void connect(Socket socket, ProbeTarget target) throws IOException {
    try {
      socket.connect(new InetSocketAddress(target.host(), target.port()), connectTimeoutMs);
    } catch (IOException e) {
      throw new TransportException(
          "Connection error to " + target.authority() + ": " + e.getMessage(), e);
    }
    if (target.tls()) {
      socket.setSoTimeout(readTimeoutMs);
      ((SSLSocket) socket).startHandshake();
    }
    log.trace("Connected to {} (tls={})", target.authority(), target.tls());
  }

  private String readHeaderBlock(Socket socket, ProbeTarget target) throws IOException {
    var reader =
        new BufferedReader(
            new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
    var headerBlock = new StringBuilder();
    String line;
    while ((line = reader.readLine()) != null) {
      if (line.isEmpty()) {
        return headerBlock.append('\n').toString();
      }
      headerBlock.append(line).append('\n');
      if (headerBlock.length() > maxHeaderBytes) {
        throw new TransportException(
            "Response headers from " + target.authority() + " exceeded " + maxHeaderBytes + " bytes");
      }
    }
    if (headerBlock.length() == 0) {
      throw new TransportException(
          "Connection to " + target.authority() + " closed before any response was received");
    }
    // peer closed without the blank terminator; keep what was sent
    return headerBlock.append('\n').toString();
  }
}
