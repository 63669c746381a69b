package com.example.striprequest.cli;

import com.example.striprequest.clients.utils.JsonUtil;
import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.service.StripReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.PrintStream;
import java.util.stream.Collectors;

/**
 * Console rendering of a {@link StripReport}.
 */
class ReportPrinter {

    private static final String RULE = "-----------------";

    private final PrintStream out;

    ReportPrinter(PrintStream out) {
        this.out = out;
    }

    void print(StripReport report) {
        if (!report.completed()) {
            out.println("Error: " + report.baseline().error());
            return;
        }
        out.println("Target: " + report.target().authority() + (report.target().tls() ? " (TLS)" : " (plain)")
                + ", Host header: " + (report.requestedHost() != null ? report.requestedHost() : "<none>"));
        out.println();
        section("Original request:", report.originalRequest());
        section("Base response:", describe(report.baseline()));
        out.println();
        section("Stripped request:", report.strippedRequest());
        section("Stripped response:", describe(report.strippedResponse()));
        out.println();
        out.println("Removed " + report.removed().size() + " of " + report.candidates() + " elements"
                + (report.failedProbes() > 0 ? " (" + report.failedProbes() + " probes failed)" : "")
                + " in " + report.elapsed().toMillis() + " ms");
        if (!report.removed().isEmpty()) {
            out.println(report.removed().stream()
                    .map(removal -> "  - " + removal)
                    .collect(Collectors.joining(System.lineSeparator())));
        }
    }

    private void section(String title, String body) {
        out.println(title);
        out.println(RULE);
        out.print(body.endsWith("\n") ? body : body + "\n");
        out.println(RULE);
    }

    private static String describe(ProbeOutcome outcome) {
        if (outcome == null) {
            return "";
        }
        if (!outcome.succeeded()) {
            return "Error: " + outcome.error();
        }
        try {
            return JsonUtil.toJson(outcome.fingerprint());
        } catch (JsonProcessingException e) {
            return outcome.fingerprint().toString();
        }
    }
}
