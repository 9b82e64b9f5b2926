package com.openforge.connectors.web.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record InvokeToolRequest(
        @NotBlank String name,
        Map<String, Object> arguments
) {

    public Map<String, Object> argumentsOrEmpty() {
        return arguments == null ? Map.of() : arguments;
    }
}
