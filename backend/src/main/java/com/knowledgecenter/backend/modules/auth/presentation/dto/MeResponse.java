package com.knowledgecenter.backend.modules.auth.presentation.dto;

import java.util.List;

public record MeResponse(UserInfoResponse user, List<String> roles) {
}
