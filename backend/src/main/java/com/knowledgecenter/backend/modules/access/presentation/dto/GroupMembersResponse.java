package com.knowledgecenter.backend.modules.access.presentation.dto;

import java.util.List;
import java.util.UUID;

public record GroupMembersResponse(String groupId, List<UUID> userIds) {
}
