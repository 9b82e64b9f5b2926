package com.openforge.connectors.web.dto;

import com.openforge.connectors.error.ConnectorException;

/** {@code {"error": {"kind": "...", "message": "..."}}} */
public record ErrorResponse(Error error) {

    public record Error(String kind, String message) {}

    public static ErrorResponse of(ConnectorException e) {
        return of(e.kind().code(), e.getMessage());
    }

    public static ErrorResponse of(String kind, String message) {
        return new ErrorResponse(new Error(kind, message));
    }
}
