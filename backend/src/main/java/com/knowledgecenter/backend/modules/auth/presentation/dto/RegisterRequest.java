package com.knowledgecenter.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Registration payload. Fields are validated by the session service so that failures carry
 * the exact client-facing messages; {@code loginId} falls back to the email when absent.
 */
public record RegisterRequest(
        @Schema(example = "a@x.io") String email,
        @Schema(example = "passw0rd!") String password,
        @Schema(description = "Locale keyed display name", example = "{\"en-US\": \"A\"}") JsonNode name,
        String loginId
) {
}
