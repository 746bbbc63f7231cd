package com.knowledgecenter.backend.modules.access.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateRolesRequest(
        @NotNull List<@NotBlank String> roleNames
) {
}
