package com.example.striprequest.dto;

public record ErrorResponse(String error, String message) {
}
