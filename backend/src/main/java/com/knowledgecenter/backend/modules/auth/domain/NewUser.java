package com.knowledgecenter.backend.modules.auth.domain;

import java.util.Map;

public record NewUser(String loginId, String email, Map<String, String> name, String passwordHash) {
}
