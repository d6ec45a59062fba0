package com.example.authservice.web.dto;

public record MessageResponse(String message, boolean success) {

    public static MessageResponse ok(String message) {
        return new MessageResponse(message, true);
    }
}
