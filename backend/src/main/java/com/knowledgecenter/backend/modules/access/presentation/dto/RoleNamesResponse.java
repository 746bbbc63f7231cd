package com.knowledgecenter.backend.modules.access.presentation.dto;

import java.util.List;

public record RoleNamesResponse(List<String> roleNames) {
}
