package com.knowledgecenter.backend.modules.auth.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.knowledgecenter.backend.modules.auth.domain.AuthUser;

public record UserInfoResponse(UUID id, String loginId, Map<String, String> name, String email) {

    public static UserInfoResponse from(AuthUser user) {
        return new UserInfoResponse(user.publicId(), user.loginId(), user.name(), user.email());
    }
}
