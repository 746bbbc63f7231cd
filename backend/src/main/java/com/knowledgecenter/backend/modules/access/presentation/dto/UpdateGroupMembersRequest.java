package com.knowledgecenter.backend.modules.access.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record UpdateGroupMembersRequest(
        @NotNull List<@NotNull UUID> userIds
) {
}
