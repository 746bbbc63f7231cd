package com.knowledgecenter.backend.modules.access.presentation.dto;

import java.util.List;

public record UserGroupsResponse(List<GroupSummaryResponse> groups) {
}
