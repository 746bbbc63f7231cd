package com.knowledgecenter.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client address recorded on refresh tokens: first {@code X-Forwarded-For} hop, then
 * {@code X-Real-IP}, then the peer address.
 */
public final class ClientIpResolver {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_REAL_IP = "X-Real-IP";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwardedFor = request.getHeader(X_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return cleanIp(forwardedFor.split(",", -1)[0].trim());
        }

        String realIp = request.getHeader(X_REAL_IP);
        if (realIp != null && !realIp.isEmpty()) {
            return cleanIp(realIp);
        }

        // The servlet container already strips the port from the peer address.
        String remoteAddr = request.getRemoteAddr();
        if (remoteAddr != null && remoteAddr.startsWith("[")) {
            int end = remoteAddr.indexOf(']');
            if (end != -1) {
                return remoteAddr.substring(1, end);
            }
        }
        return remoteAddr;
    }

    /**
     * Unwraps {@code [v6]} and {@code [v6]:port}, and strips the port of {@code v4:port}.
     */
    static String cleanIp(String ip) {
        String cleaned = ip;
        if (cleaned.startsWith("[")) {
            int end = cleaned.indexOf(']');
            if (end != -1) {
                return cleaned.substring(1, end);
            }
            cleaned = cleaned.substring(1);
        }
        if (cleaned.endsWith("]")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        int lastColon = cleaned.lastIndexOf(':');
        if (lastColon != -1 && cleaned.indexOf(':') == lastColon) {
            cleaned = cleaned.substring(0, lastColon);
        }
        return cleaned;
    }
}
