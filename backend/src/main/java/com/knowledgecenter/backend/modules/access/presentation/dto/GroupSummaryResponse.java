package com.knowledgecenter.backend.modules.access.presentation.dto;

import java.util.Map;

import com.knowledgecenter.backend.modules.auth.domain.UserGroup;

public record GroupSummaryResponse(
        String id,
        Map<String, String> name,
        Map<String, String> description
) {

    public static GroupSummaryResponse from(UserGroup group) {
        return new GroupSummaryResponse(group.publicId(), group.name(), group.description());
    }
}
