package com.casebrain.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
