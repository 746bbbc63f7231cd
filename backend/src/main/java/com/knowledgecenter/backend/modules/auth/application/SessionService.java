package com.knowledgecenter.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.knowledgecenter.backend.modules.auth.domain.AuthUser;
import com.knowledgecenter.backend.modules.auth.domain.NewUser;
import com.knowledgecenter.backend.modules.auth.domain.UserGroup;
import com.knowledgecenter.backend.modules.auth.presentation.dto.LoginRequest;
import com.knowledgecenter.backend.modules.auth.presentation.dto.MeResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.RegisterRequest;
import com.knowledgecenter.backend.modules.auth.presentation.dto.TokenResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.UserInfoResponse;
import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Register, login, refresh, logout and profile flows on top of the credential vault,
 * the token authority and the identity store.
 *
 * <p>Refresh keeps its writes when it fails with an {@link AuthException}: the reuse
 * detection revocation must survive the rejected request.
 */
@Service
@Transactional(noRollbackFor = AuthException.class)
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    public static final String REGISTERED_MESSAGE = "User registered successfully";

    private static final int MIN_EMAIL_LENGTH = 3;
    private static final int MAX_EMAIL_LENGTH = 254;
    private static final int MIN_PASSWORD_BYTES = 8;

    private final IdentityStore identityStore;
    private final CredentialVault credentialVault;
    private final TokenAuthority tokenAuthority;

    public SessionService(IdentityStore identityStore, CredentialVault credentialVault, TokenAuthority tokenAuthority) {
        this.identityStore = identityStore;
        this.credentialVault = credentialVault;
        this.tokenAuthority = tokenAuthority;
    }

    /**
     * Creates the account, joins it to the public group and opens a session. Nothing is kept
     * when any step fails.
     */
    @Transactional
    public AuthenticatedSession register(RegisterRequest request, String clientIp, String userAgent) {
        String email = request.email() == null ? "" : request.email().trim();
        if (!isValidEmail(email)) {
            throw new AuthException(AuthErrorKind.INVALID_EMAIL);
        }
        Map<String, String> name = toLocaleMap(request.name());
        if (name.isEmpty()) {
            throw new AuthException(AuthErrorKind.INVALID_NAME);
        }
        String password = request.password() == null ? "" : request.password();
        if (password.getBytes(StandardCharsets.UTF_8).length < MIN_PASSWORD_BYTES) {
            throw new AuthException(AuthErrorKind.INVALID_PASSWORD);
        }
        if (identityStore.findUserByEmail(email).isPresent()) {
            throw new AuthException(AuthErrorKind.EMAIL_EXISTS);
        }

        String loginId = request.loginId() == null || request.loginId().isBlank() ? email : request.loginId().trim();
        if (identityStore.findUserByLoginId(loginId).isPresent()) {
            throw new AuthException(AuthErrorKind.LOGIN_ID_EXISTS);
        }

        String passwordHash = credentialVault.hashPassword(password);
        AuthUser user = identityStore.createUser(new NewUser(loginId, email, name, passwordHash));

        UserGroup publicGroup = identityStore.findGroupByPublicId(UserGroup.PUBLIC_GROUP_ID)
                .orElseThrow(() -> {
                    log.error("Group '{}' is missing; registration cannot assign default roles", UserGroup.PUBLIC_GROUP_ID);
                    return new AuthException(AuthErrorKind.PUBLIC_GROUP_NOT_FOUND);
                });
        identityStore.addUserToGroup(user.id(), publicGroup.id(), null);

        List<String> roles = identityStore.findEffectiveRoles(user.id());
        IssuedTokens issued = tokenAuthority.issueTokens(user, roles, null, clientIp, userAgent);
        log.info("Registered user public_id={} login_id={}", user.publicId(), user.loginId());
        return toSession(user, issued);
    }

    /**
     * Unknown account, missing password and wrong password all fail the same way.
     */
    public AuthenticatedSession login(LoginRequest request, String clientIp, String userAgent) {
        String loginId = request.loginId() == null ? "" : request.loginId();
        String password = request.password() == null ? "" : request.password();
        AuthUser user = identityStore.findUserByLoginId(loginId)
                .or(() -> identityStore.findUserByEmail(loginId))
                .orElseThrow(() -> new AuthException(AuthErrorKind.INVALID_CREDENTIALS));

        if (!user.hasPassword() || !credentialVault.verifyPassword(password, user.passwordHash())) {
            log.debug("Rejected login for login_id={}", loginId);
            throw new AuthException(AuthErrorKind.INVALID_CREDENTIALS);
        }

        List<String> roles = identityStore.findEffectiveRoles(user.id());
        IssuedTokens issued = tokenAuthority.issueTokens(user, roles, null, clientIp, userAgent);
        return toSession(user, issued);
    }

    public RotatedTokens refresh(String refreshSecret, String clientIp, String userAgent) {
        IssuedTokens issued = tokenAuthority.rotate(refreshSecret, clientIp, userAgent);
        return new RotatedTokens(toTokenResponse(issued), issued.refreshSecret());
    }

    public void logout(String refreshSecret) {
        if (refreshSecret == null || refreshSecret.isEmpty()) {
            return;
        }
        tokenAuthority.revoke(refreshSecret);
    }

    public void logoutAll(String userPublicId) {
        AuthUser user = requireUser(userPublicId);
        int revoked = tokenAuthority.revokeAll(user.id());
        log.info("Revoked {} refresh tokens for public_id={}", revoked, user.publicId());
    }

    @Transactional(readOnly = true)
    public MeResponse getMe(String userPublicId) {
        AuthUser user = requireUser(userPublicId);
        return new MeResponse(UserInfoResponse.from(user), identityStore.findEffectiveRoles(user.id()));
    }

    private AuthUser requireUser(String userPublicId) {
        UUID publicId;
        try {
            publicId = UUID.fromString(userPublicId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new AuthException(AuthErrorKind.USER_NOT_FOUND);
        }
        return identityStore.findUserByPublicId(publicId)
                .orElseThrow(() -> new AuthException(AuthErrorKind.USER_NOT_FOUND));
    }

    private static AuthenticatedSession toSession(AuthUser user, IssuedTokens issued) {
        return new AuthenticatedSession(UserInfoResponse.from(user), toTokenResponse(issued), issued.refreshSecret());
    }

    private static TokenResponse toTokenResponse(IssuedTokens issued) {
        return new TokenResponse(issued.accessToken(), TokenAuthority.TOKEN_TYPE, issued.expiresInSeconds());
    }

    // Length is counted in UTF-8 bytes; the domain must contain a dot after the last '@'.
    static boolean isValidEmail(String email) {
        int length = email.getBytes(StandardCharsets.UTF_8).length;
        if (length < MIN_EMAIL_LENGTH || length > MAX_EMAIL_LENGTH) {
            return false;
        }
        int at = email.lastIndexOf('@');
        if (at < 1 || at >= email.length() - 1) {
            return false;
        }
        return email.indexOf('.', at) >= 0;
    }

    static Map<String, String> toLocaleMap(JsonNode name) {
        Map<String, String> locales = new LinkedHashMap<>();
        if (name == null || !name.isObject()) {
            return locales;
        }
        name.fields().forEachRemaining(entry -> {
            // Locale values are strings; anything else is not a name.
            if (entry.getValue().isTextual()) {
                locales.put(entry.getKey(), entry.getValue().asText());
            }
        });
        return locales;
    }
}
