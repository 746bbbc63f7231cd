package com.knowledgecenter.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;

import javax.crypto.SecretKey;

import com.knowledgecenter.backend.modules.auth.domain.AuthUser;
import com.knowledgecenter.backend.modules.auth.domain.NewRefreshToken;
import com.knowledgecenter.backend.modules.auth.domain.RefreshTokenRecord;
import com.knowledgecenter.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Issues and validates HS256 access tokens and runs the refresh token lifecycle.
 *
 * <p>Refresh tokens form a lineage: every rotation stores the new record with the presented
 * record as parent, then marks the presented record revoked and replaced. Presenting a
 * revoked secret means the lineage leaked, so every token of the owner is revoked.
 */
@Service
public class TokenAuthority {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthority.class);

    public static final String ISSUER = "knowledgecenter-api";
    public static final String TOKEN_TYPE = "Bearer";
    public static final Duration ACCESS_TOKEN_TTL = Duration.ofMinutes(15);
    public static final Duration REFRESH_TOKEN_TTL = Duration.ofDays(7);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_LOGIN_ID = "login_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final CredentialVault credentialVault;
    private final IdentityStore identityStore;
    private final Clock clock;

    public TokenAuthority(
            JwtTokenProvider tokenProvider,
            CredentialVault credentialVault,
            IdentityStore identityStore,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.credentialVault = credentialVault;
        this.identityStore = identityStore;
        this.clock = clock;
    }

    public String issueAccessToken(AuthUser user, List<String> roles) {
        Instant now = clock.instant();
        String publicId = user.publicId().toString();
        return Jwts.builder()
                .subject(publicId)
                .claim(CLAIM_USER_ID, publicId)
                .claim(CLAIM_LOGIN_ID, user.loginId())
                .claim(CLAIM_EMAIL, user.email())
                .claim(CLAIM_ROLES, List.copyOf(roles))
                .id(credentialVault.generateTokenId())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ACCESS_TOKEN_TTL)))
                .issuer(ISSUER)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    /**
     * Verifies signature, algorithm and expiry. A token is rejected once {@code exp <= now}.
     *
     * @throws InvalidTokenException for every kind of failure
     */
    public AccessTokenClaims validateAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Invalid access token");
        }
        SecretKey key = tokenProvider.getSecretKey();
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }

        if (!SIG.HS256.getId().equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidTokenException("Invalid access token");
        }

        Claims claims = jws.getPayload();
        Date expiration = claims.getExpiration();
        if (expiration == null || !expiration.toInstant().isAfter(clock.instant())) {
            throw new InvalidTokenException("Invalid access token");
        }

        return new AccessTokenClaims(
                Objects.toString(claims.getSubject(), ""),
                stringClaim(claims, CLAIM_USER_ID),
                stringClaim(claims, CLAIM_LOGIN_ID),
                stringClaim(claims, CLAIM_EMAIL),
                rolesClaim(claims),
                Objects.toString(claims.getId(), ""),
                claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                expiration.toInstant(),
                Objects.toString(claims.getIssuer(), "")
        );
    }

    /**
     * Issues an access token and stores a fresh refresh record for the user.
     */
    public IssuedTokens issueTokens(AuthUser user, List<String> roles, Long parentTokenId,
                                    String clientIp, String userAgent) {
        String accessToken = issueAccessToken(user, roles);
        String refreshSecret = credentialVault.generateRefreshSecret();
        RefreshTokenRecord stored = identityStore.createToken(new NewRefreshToken(
                user.id(),
                credentialVault.digest(refreshSecret),
                OffsetDateTime.now(clock).plus(REFRESH_TOKEN_TTL),
                parentTokenId,
                blankToNull(clientIp),
                blankToNull(userAgent)
        ));
        return new IssuedTokens(accessToken, ACCESS_TOKEN_TTL.toSeconds(), refreshSecret, stored);
    }

    /**
     * Exchanges a refresh secret for a new token pair.
     *
     * @throws AuthException {@code INVALID_TOKEN}, {@code TOKEN_REVOKED} or {@code TOKEN_EXPIRED}
     */
    public IssuedTokens rotate(String refreshSecret, String clientIp, String userAgent) {
        RefreshTokenRecord current = identityStore.findTokenByHash(credentialVault.digest(refreshSecret))
                .orElseThrow(() -> new AuthException(AuthErrorKind.INVALID_TOKEN));

        if (current.revoked()) {
            log.warn("Refresh token reuse detected: token_id={} user_id={} client_ip={}",
                    current.id(), current.userId(), clientIp);
            revokeLineageQuietly(current.userId());
            throw new AuthException(AuthErrorKind.TOKEN_REVOKED);
        }

        if (current.isExpiredAt(OffsetDateTime.now(clock))) {
            throw new AuthException(AuthErrorKind.TOKEN_EXPIRED);
        }

        AuthUser user = identityStore.findUserById(current.userId())
                .filter(candidate -> !candidate.deleted())
                .orElseThrow(() -> new AuthException(AuthErrorKind.INVALID_TOKEN));
        List<String> roles = identityStore.findEffectiveRoles(user.id());

        IssuedTokens issued = issueTokens(user, roles, current.id(), clientIp, userAgent);
        identityStore.markTokenReplaced(current.id(), issued.refreshToken().id());
        return issued;
    }

    /**
     * Revokes the record behind the secret; unknown secrets are ignored.
     */
    public void revoke(String refreshSecret) {
        identityStore.findTokenByHash(credentialVault.digest(refreshSecret))
                .ifPresent(record -> identityStore.revokeToken(record.id()));
    }

    public int revokeAll(long userId) {
        return identityStore.revokeAllUserTokens(userId);
    }

    // The caller is rejected either way; a failed mass revocation is only logged.
    private void revokeLineageQuietly(long userId) {
        try {
            int revoked = identityStore.revokeAllUserTokens(userId);
            log.info("Revoked {} refresh tokens after reuse detection for user_id={}", revoked, userId);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to revoke refresh tokens after reuse detection for user_id={}", userId, ex);
        }
    }

    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value instanceof String text ? text : "";
    }

    private static List<String> rolesClaim(Claims claims) {
        Object value = claims.get(CLAIM_ROLES);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
