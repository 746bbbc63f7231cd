package com.knowledgecenter.backend.modules.rbac.application;

/**
 * Outcome of an authorization check; {@code reason} is the client-facing denial message.
 */
public record AccessDecision(boolean granted, String reason) {

    private static final AccessDecision GRANTED = new AccessDecision(true, null);

    public static AccessDecision grant() {
        return GRANTED;
    }

    public static AccessDecision deny(String reason) {
        return new AccessDecision(false, reason);
    }
}
