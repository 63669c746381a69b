package com.example.striprequest.web;

import com.example.striprequest.dto.ErrorResponse;
import com.example.striprequest.dto.HealthResponse;
import com.example.striprequest.dto.StripResponse;
import com.example.striprequest.dto.StripSubmissionRequest;
import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ProbeTarget;
import com.example.striprequest.model.ResponseFingerprint;
import com.example.striprequest.service.StripReport;
import com.example.striprequest.service.StripRequestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Strip", description = "Minimize a captured HTTP request against its live target")
@RestController
@RequestMapping("/api/strip")
@Validated
public class StripRequestController {

    private final StripRequestService stripRequestService;
    private final StripMapper stripMapper;

    public StripRequestController(StripRequestService stripRequestService, StripMapper stripMapper) {
        this.stripRequestService = stripRequestService;
        this.stripMapper = stripMapper;
    }

    @Operation(
            summary = "Strip a captured request",
            description = "Sends the captured request for a baseline, probes every single-element removal "
                    + "concurrently and returns the request with all non-essential elements removed.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Request minimized",
                            content = @Content(schema = @Schema(implementation = StripResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid request payload",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "502", description = "Baseline probe failed",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    @PostMapping
    public ResponseEntity<?> strip(@Valid @RequestBody StripSubmissionRequest request) {
        ProbeTarget target = stripMapper.toTarget(request);
        StripReport report = stripRequestService.strip(target, request.getRequest());

        if (!report.completed()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponse("Baseline probe failed", report.baseline().error()));
        }
        return ResponseEntity.ok(mapToResponse(report));
    }

    @Operation(summary = "Health check", description = "Simple health endpoint to verify the service is running.")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.up());
    }

    private StripResponse mapToResponse(StripReport report) {
        StripResponse resp = new StripResponse();
        resp.setHost(report.target().host());
        resp.setPort(report.target().port());
        resp.setTls(report.target().tls());
        resp.setOriginalRequest(report.originalRequest());
        resp.setRequestedHost(report.requestedHost());
        resp.setBaseline(mapFingerprint(report.baseline().fingerprint()));
        resp.setStrippedRequest(report.strippedRequest());
        ProbeOutcome stripped = report.strippedResponse();
        if (stripped != null && stripped.succeeded()) {
            resp.setStrippedResponse(mapFingerprint(stripped.fingerprint()));
        } else if (stripped != null) {
            resp.setStrippedResponseError(stripped.error());
        }
        resp.setRemoved(report.removed().stream()
                .map(removal -> {
                    StripResponse.RemovedElement element = new StripResponse.RemovedElement();
                    element.setKey(removal.key());
                    element.setLocation(removal.location().name());
                    return element;
                })
                .collect(Collectors.toList()));
        resp.setCandidates(report.candidates());
        resp.setFailedProbes(report.failedProbes());
        resp.setStartedAt(report.startedAt());
        resp.setElapsedMs(report.elapsed().toMillis());
        return resp;
    }

    private StripResponse.Fingerprint mapFingerprint(ResponseFingerprint fingerprint) {
        StripResponse.Fingerprint view = new StripResponse.Fingerprint();
        view.setStatusCode(fingerprint.statusCode());
        view.setStatusMessage(fingerprint.statusMessage());
        view.setContentLength(fingerprint.contentLength());
        view.setHeaders(fingerprint.headers());
        return view;
    }
}
