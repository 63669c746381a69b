package com.example.striprequest.cli;

import ch.qos.logback.classic.Level;
import com.example.striprequest.clients.SocketTransport;
import com.example.striprequest.codec.HttpMessageCodec;
import com.example.striprequest.config.ProbeProperties;
import com.example.striprequest.model.ProbeTarget;
import com.example.striprequest.service.StripReport;
import com.example.striprequest.service.StripRequestService;
import com.example.striprequest.service.processor.FingerprintMatcher;
import com.example.striprequest.service.processor.RequestMinimizer;
import com.example.striprequest.service.processor.RequestProber;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * strip-request command line tool.
 */
@Command(
    name = "strip-request",
    version = "0.1.0",
    description = "Strips unnecessary headers, query parameters, cookies and form fields from a captured HTTP request.",
    mixinStandardHelpOptions = true,
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  strip-request -t example.com -p 443 -r captured.txt",
        "  strip-request --http -t 10.0.0.5 -p 8080 -r captured.txt -vv",
        ""
    }
)
public class StripRequestCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private static final String LOGGER_ROOT = "com.example.striprequest";

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-u", "--http"},
        description = "Make the request over plain HTTP (defaults to TLS)"
    )
    private boolean http;

    @Option(
        names = {"-t", "--host"},
        description = "Host to make the request to (default: ${DEFAULT-VALUE})",
        defaultValue = "127.0.0.1"
    )
    private String host;

    @Option(
        names = {"-p", "--port"},
        description = "Port number to connect to (default: ${DEFAULT-VALUE})",
        defaultValue = "443"
    )
    private int port;

    @Option(
        names = {"-r", "--req"},
        description = "File containing the captured HTTP request",
        required = true
    )
    private Path requestFile;

    @Option(
        names = {"--connect-timeout"},
        description = "Connect timeout in milliseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "5000"
    )
    private int connectTimeoutMs;

    @Option(
        names = {"--read-timeout"},
        description = "Read timeout in milliseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "5000"
    )
    private int readTimeoutMs;

    @Option(
        names = {"-v"},
        description = "Verbose mode; more v's -> more verbose"
    )
    private boolean[] verbosity = new boolean[0];

    private final PrintStream out;

    public StripRequestCommand() {
        this(System.out);
    }

    StripRequestCommand(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new StripRequestCommand()).execute(args));
    }

    @Override
    public Integer call() {
        validateInputs();
        applyVerbosity();

        String rawRequest;
        try {
            rawRequest = Files.readString(requestFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            out.println("Error: unable to read request file " + requestFile + ": " + e.getMessage());
            return EXIT_FAILED;
        }
        if (rawRequest.isBlank()) {
            throw new ParameterException(spec.commandLine(), "Need to specify a request to send");
        }

        StripReport report = buildService().strip(new ProbeTarget(host, port, !http), rawRequest);
        new ReportPrinter(out).print(report);
        return report.completed() ? EXIT_OK : EXIT_FAILED;
    }

    private void validateInputs() {
        if (port <= 0 || port >= 0x10000) {
            throw new ParameterException(spec.commandLine(), "Port number must be between 0 and 65536");
        }
        if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
            throw new ParameterException(spec.commandLine(), "Timeouts must be positive");
        }
        try {
            InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new ParameterException(spec.commandLine(), "Unknown host: " + host);
        }
    }

    private void applyVerbosity() {
        if (verbosity.length == 0) {
            return;
        }
        var logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_ROOT);
        logger.setLevel(verbosity.length == 1 ? Level.DEBUG : Level.TRACE);
    }

    private StripRequestService buildService() {
        ProbeProperties properties = new ProbeProperties();
        properties.setConnectTimeoutMs(connectTimeoutMs);
        properties.setReadTimeoutMs(readTimeoutMs);

        HttpMessageCodec codec = new HttpMessageCodec();
        RequestProber prober = new RequestProber(new SocketTransport(properties), codec);
        RequestMinimizer minimizer = new RequestMinimizer(prober, new FingerprintMatcher());
        return new StripRequestService(codec, prober, minimizer);
    }
}
