package com.example.ttsgateway.api.common;

public record ErrorResponse(String display, int code) {
}
