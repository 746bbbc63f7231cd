package com.knowledgecenter.backend.modules.auth.domain;

public final class Roles {

    /** Holders pass every permission check. */
    public static final String FULL_ACCESS = "full_access";

    private Roles() {
    }
}
