package com.openforge.dnd.auth.dto;

/**
 * JSON error body used for 401s so clients always see the same shape.
 */
public record ErrorResponse(String error, String message) {

    public static ErrorResponse unauthorized(String message) {
        return new ErrorResponse("Unauthorized", message);
    }
}
