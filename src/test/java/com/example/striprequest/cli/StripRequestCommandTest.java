package com.example.striprequest.cli;

import com.example.striprequest.clients.StubHttpServer;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class StripRequestCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final StringWriter stderr = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(
                new StripRequestCommand(new PrintStream(stdout, true, StandardCharsets.UTF_8)));
        commandLine.setErr(new PrintWriter(stderr));
        return commandLine.execute(args);
    }

    private Path capture(String content) throws Exception {
        Path file = tempDir.resolve("request.txt");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void printsReportForSuccessfulRun() throws Exception {
        Path request = capture("GET /?a=1 HTTP/1.1\nHost: example.com\nUser-Agent: X\nAccept-Encoding: gzip, deflate\n\n");
        try (StubHttpServer server = new StubHttpServer(raw -> raw.contains("Accept-Encoding")
                ? StubHttpServer.response(200, "OK", "hello")
                : StubHttpServer.response(406, "Not Acceptable", ""))) {

            int exitCode = run("--http", "-t", server.host(), "-p", String.valueOf(server.port()),
                    "-r", request.toString(), "--read-timeout", "1000");

            String output = stdout.toString(StandardCharsets.UTF_8);
            assertEquals(StripRequestCommand.EXIT_OK, exitCode);
            assertThat(output)
                    .contains("Target: " + server.host() + ":" + server.port() + " (plain), Host header: example.com")
                    .contains("Original request:")
                    .contains("Base response:")
                    .contains("\"statusCode\" : 200")
                    .contains("Stripped request:\n-----------------\nGET / HTTP/1.1\nAccept-Encoding: gzip, deflate\n\n")
                    .contains("Stripped response:")
                    .contains("Removed 3 of 4 elements");
        }
    }

    @Test
    void baselineFailureExitsWithError() throws Exception {
        Path request = capture("GET / HTTP/1.1\nHost: a\n\n");
        int closedPort;
        try (var unused = new java.net.ServerSocket(0)) {
            closedPort = unused.getLocalPort();
        }

        int exitCode = run("-u", "-t", "127.0.0.1", "-p", String.valueOf(closedPort), "-r", request.toString(),
                "--connect-timeout", "500");

        assertEquals(StripRequestCommand.EXIT_FAILED, exitCode);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).startsWith("Error: Connection error");
    }

    @Test
    void portOutOfRangeIsUsageError() throws Exception {
        Path request = capture("GET / HTTP/1.1\n\n");

        int exitCode = run("-p", "70000", "-r", request.toString());

        assertEquals(2, exitCode);
        assertThat(stderr.toString()).contains("Port number must be between 0 and 65536");
    }

    @Test
    void missingRequestOptionIsUsageError() {
        int exitCode = run("-t", "127.0.0.1");

        assertEquals(2, exitCode);
        assertThat(stderr.toString()).contains("--req");
    }

    @Test
    void emptyRequestFileIsUsageError() throws Exception {
        Path request = capture("  \n");

        int exitCode = run("-u", "-p", "80", "-r", request.toString());

        assertEquals(2, exitCode);
        assertThat(stderr.toString()).contains("Need to specify a request to send");
    }

    @Test
    void unreadableRequestFileFails() {
        int exitCode = run("-u", "-p", "80", "-r", tempDir.resolve("missing.txt").toString());

        assertEquals(StripRequestCommand.EXIT_FAILED, exitCode);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("unable to read request file");
    }
}
