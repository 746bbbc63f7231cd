package com.knowledgecenter.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgecenter.backend.modules.auth.domain.AuthUser;
import com.knowledgecenter.backend.modules.auth.domain.NewUser;
import com.knowledgecenter.backend.modules.auth.domain.RefreshTokenRecord;
import com.knowledgecenter.backend.modules.auth.domain.UserGroup;
import com.knowledgecenter.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.knowledgecenter.backend.modules.auth.presentation.dto.LoginRequest;
import com.knowledgecenter.backend.modules.auth.presentation.dto.MeResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.RegisterRequest;
import com.knowledgecenter.backend.support.InMemoryIdentityStore;
import com.knowledgecenter.backend.support.MutableClock;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SessionServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MutableClock clock;
    private InMemoryIdentityStore store;
    private TokenAuthority tokenAuthority;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
        store = InMemoryIdentityStore.withPublicGroup(clock);
        CredentialVault vault = new CredentialVault(CredentialVault.argon2idEncoder(), 2);
        tokenAuthority = new TokenAuthority(
                new JwtTokenProvider("test-secret-key-for-knowledgecenter-unit-tests-0123456789"), vault, store, clock);
        sessionService = new SessionService(store, vault, tokenAuthority);
    }

    @Test
    @DisplayName("register creates the user, joins the public group and opens a session")
    void registerOpensSession() {
        AuthenticatedSession session = sessionService.register(
                new RegisterRequest(" a@x.io ", "passw0rd!", name("en-US", "A"), null), "203.0.113.9", "junit");

        assertThat(session.user().email()).isEqualTo("a@x.io");
        assertThat(session.user().loginId()).isEqualTo("a@x.io");
        assertThat(session.user().name()).containsEntry("en-US", "A");
        assertThat(session.tokens().tokenType()).isEqualTo("Bearer");
        assertThat(session.tokens().expiresIn()).isEqualTo(900);
        assertThat(session.refreshSecret()).isNotBlank();

        AuthUser stored = store.findUserByEmail("a@x.io").orElseThrow();
        assertThat(stored.passwordHash()).startsWith("$argon2id$");
        UserGroup publicGroup = store.findGroupByPublicId(UserGroup.PUBLIC_GROUP_ID).orElseThrow();
        assertThat(store.membersOf(publicGroup.id())).containsExactly(stored.id());
        assertThat(tokenAuthority.validateAccessToken(session.tokens().accessToken()).roles()).containsExactly("user");
        assertThat(store.tokensOf(stored.id())).singleElement()
                .extracting(RefreshTokenRecord::clientIp)
                .isEqualTo("203.0.113.9");
    }

    @Test
    void registerKeepsAnExplicitLoginId() {
        AuthenticatedSession session = sessionService.register(
                new RegisterRequest("b@x.io", "passw0rd!", name("ko-KR", "비"), "  bee  "), null, null);

        assertThat(session.user().loginId()).isEqualTo("bee");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a@", "@x.io", "ax.io", "a@xio", "a@x"})
    void registerRejectsInvalidEmails(String email) {
        assertKind(() -> sessionService.register(new RegisterRequest(email, "passw0rd!", name("en-US", "A"), null), null, null),
                AuthErrorKind.INVALID_EMAIL);
    }

    @Test
    void registerRejectsOverlongEmail() {
        String email = "a".repeat(250) + "@x.io";

        assertKind(() -> sessionService.register(new RegisterRequest(email, "passw0rd!", name("en-US", "A"), null), null, null),
                AuthErrorKind.INVALID_EMAIL);
    }

    @Test
    @DisplayName("email is validated before name and password")
    void validationOrder() {
        assertKind(() -> sessionService.register(new RegisterRequest("bad", "short", null, null), null, null),
                AuthErrorKind.INVALID_EMAIL);
        assertKind(() -> sessionService.register(new RegisterRequest("a@x.io", "short", null, null), null, null),
                AuthErrorKind.INVALID_NAME);
        assertKind(() -> sessionService.register(new RegisterRequest("a@x.io", "short", name("en-US", "A"), null), null, null),
                AuthErrorKind.INVALID_PASSWORD);
    }

    @Test
    void registerRejectsEmptyOrNonObjectNames() throws Exception {
        for (String json : List.of("{}", "[\"A\"]", "\"A\"", "null")) {
            JsonNode name = MAPPER.readTree(json);
            assertKind(() -> sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", name, null), null, null),
                    AuthErrorKind.INVALID_NAME);
        }
    }

    @Test
    @DisplayName("locale values that are not strings are not stored as names")
    void nonStringLocaleValuesAreIgnored() throws Exception {
        JsonNode onlyNonStrings = MAPPER.readTree("{\"en-US\": null, \"ko-KR\": 5, \"fr-FR\": {\"x\": 1}}");
        assertKind(() -> sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", onlyNonStrings, null), null, null),
                AuthErrorKind.INVALID_NAME);

        JsonNode mixed = MAPPER.readTree("{\"en-US\": \"A\", \"ko-KR\": null}");
        AuthenticatedSession session = sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", mixed, null), null, null);

        assertThat(session.user().name()).containsOnly(Map.entry("en-US", "A"));
    }

    @Test
    @DisplayName("password length is measured in UTF-8 bytes")
    void passwordLengthCountsBytes() {
        assertKind(() -> sessionService.register(new RegisterRequest("a@x.io", "1234567", name("en-US", "A"), null), null, null),
                AuthErrorKind.INVALID_PASSWORD);

        AuthenticatedSession session = sessionService.register(
                new RegisterRequest("a@x.io", "비밀번호", name("en-US", "A"), null), null, null);
        assertThat(session.user().email()).isEqualTo("a@x.io");
    }

    @Test
    void registerRejectsDuplicateEmailAndLoginId() {
        sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), "alpha"), null, null);

        assertKind(() -> sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), null), null, null),
                AuthErrorKind.EMAIL_EXISTS);
        assertKind(() -> sessionService.register(new RegisterRequest("c@x.io", "passw0rd!", name("en-US", "C"), "alpha"), null, null),
                AuthErrorKind.LOGIN_ID_EXISTS);
    }

    @Test
    void registerFailsWithoutPublicGroup() {
        InMemoryIdentityStore bare = new InMemoryIdentityStore(clock);
        CredentialVault vault = new CredentialVault(CredentialVault.argon2idEncoder(), 1);
        SessionService service = new SessionService(bare, vault, new TokenAuthority(
                new JwtTokenProvider("test-secret-key-for-knowledgecenter-unit-tests-0123456789"), vault, bare, clock));

        assertKind(() -> service.register(new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), null), null, null),
                AuthErrorKind.PUBLIC_GROUP_NOT_FOUND);
    }

    @Test
    void loginAcceptsLoginIdOrEmail() {
        sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), "alpha"), null, null);

        assertThat(sessionService.login(new LoginRequest("alpha", "passw0rd!"), null, null).user().email())
                .isEqualTo("a@x.io");
        assertThat(sessionService.login(new LoginRequest("a@x.io", "passw0rd!"), null, null).user().loginId())
                .isEqualTo("alpha");
    }

    @Test
    @DisplayName("every login failure looks the same to the caller")
    void loginFailuresAreIndistinguishable() {
        sessionService.register(new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), null), null, null);
        store.createUser(new NewUser("no-password", "np@x.io", Map.of("en-US", "N"), null));

        assertKind(() -> sessionService.login(new LoginRequest("a@x.io", "wrong-pass"), null, null),
                AuthErrorKind.INVALID_CREDENTIALS);
        assertKind(() -> sessionService.login(new LoginRequest("nobody", "passw0rd!"), null, null),
                AuthErrorKind.INVALID_CREDENTIALS);
        assertKind(() -> sessionService.login(new LoginRequest("no-password", ""), null, null),
                AuthErrorKind.INVALID_CREDENTIALS);
        assertKind(() -> sessionService.login(new LoginRequest(null, null), null, null),
                AuthErrorKind.INVALID_CREDENTIALS);
    }

    @Test
    void refreshRotatesAndLogoutRevokes() {
        AuthenticatedSession session = sessionService.register(
                new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), null), null, null);

        RotatedTokens rotated = sessionService.refresh(session.refreshSecret(), null, null);
        assertThat(rotated.refreshSecret()).isNotEqualTo(session.refreshSecret());
        assertThat(rotated.tokens().accessToken()).isNotBlank();

        sessionService.logout(rotated.refreshSecret());
        sessionService.logout(null);
        sessionService.logout("");

        long userId = store.findUserByEmail("a@x.io").orElseThrow().id();
        assertThat(store.tokensOf(userId)).allMatch(RefreshTokenRecord::revoked);
    }

    @Test
    void logoutAllRevokesEverySession() {
        AuthenticatedSession first = sessionService.register(
                new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), null), null, null);
        sessionService.login(new LoginRequest("a@x.io", "passw0rd!"), null, null);

        sessionService.logoutAll(first.user().id().toString());

        long userId = store.findUserByEmail("a@x.io").orElseThrow().id();
        assertThat(store.tokensOf(userId)).hasSize(2).allMatch(RefreshTokenRecord::revoked);
    }

    @Test
    void meReturnsProfileAndEffectiveRoles() {
        AuthenticatedSession session = sessionService.register(
                new RegisterRequest("a@x.io", "passw0rd!", name("en-US", "A"), null), null, null);
        long userId = store.findUserByEmail("a@x.io").orElseThrow().id();
        store.grantUserRole(userId, "admin");

        MeResponse me = sessionService.getMe(session.user().id().toString());

        assertThat(me.user().email()).isEqualTo("a@x.io");
        assertThat(me.roles()).containsExactly("admin", "user");
    }

    @Test
    void meRejectsUnknownUsers() {
        assertKind(() -> sessionService.getMe(UUID.randomUUID().toString()), AuthErrorKind.USER_NOT_FOUND);
        assertKind(() -> sessionService.getMe("not-a-uuid"), AuthErrorKind.USER_NOT_FOUND);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a@x.io", "first.last@sub.example.com", "a@b@c.io", "x@y.z"})
    void acceptsEmailsWithDomainDot(String email) {
        assertThat(SessionService.isValidEmail(email)).isTrue();
    }

    private static JsonNode name(String locale, String value) {
        return MAPPER.createObjectNode().put(locale, value);
    }

    private static void assertKind(ThrowingCallable call, AuthErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOf(AuthException.class)
                .extracting(ex -> ((AuthException) ex).getKind())
                .isEqualTo(kind);
    }
}
