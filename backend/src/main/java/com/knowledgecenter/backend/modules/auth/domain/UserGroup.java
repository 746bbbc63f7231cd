package com.knowledgecenter.backend.modules.auth.domain;

import java.util.Map;

public record UserGroup(long id, String publicId, Map<String, String> name, Map<String, String> description) {

    public static final String PUBLIC_GROUP_ID = "public";
}
