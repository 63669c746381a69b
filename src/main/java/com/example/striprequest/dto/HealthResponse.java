package com.example.striprequest.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "Liveness of the strip service")
public record HealthResponse(String status, Instant checkedAt) {

    public static HealthResponse up() {
        return new HealthResponse("UP", Instant.now());
    }
}
