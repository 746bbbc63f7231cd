package com.knowledgecenter.backend.modules.auth.presentation;

import com.knowledgecenter.backend.global.error.ProblemException;
import com.knowledgecenter.backend.global.security.SecurityUtils;
import com.knowledgecenter.backend.global.web.ClientIpResolver;
import com.knowledgecenter.backend.modules.auth.application.AuthenticatedSession;
import com.knowledgecenter.backend.modules.auth.application.RotatedTokens;
import com.knowledgecenter.backend.modules.auth.application.SessionService;
import com.knowledgecenter.backend.modules.auth.presentation.dto.LoginRequest;
import com.knowledgecenter.backend.modules.auth.presentation.dto.LoginResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.MeResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.MessageResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.RegisterRequest;
import com.knowledgecenter.backend.modules.auth.presentation.dto.RegisterResponse;
import com.knowledgecenter.backend.modules.auth.presentation.dto.TokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "auth")
public class AuthController {

    private final SessionService sessionService;
    private final RefreshTokenCookieFactory cookieFactory;

    public AuthController(SessionService sessionService, RefreshTokenCookieFactory cookieFactory) {
        this.sessionService = sessionService;
        this.cookieFactory = cookieFactory;
    }

    @PostMapping("/auth/register")
    @Operation(summary = "Register a user and open a session")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered; refresh cookie set"),
            @ApiResponse(responseCode = "400", description = "Invalid email, name or password"),
            @ApiResponse(responseCode = "409", description = "Email or login id already in use")
    })
    public ResponseEntity<RegisterResponse> register(@RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
        AuthenticatedSession session = sessionService.register(request, ClientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.status(HttpStatus.CREATED)
                .header(HttpHeaders.SET_COOKIE, cookieFactory.issue(session.refreshSecret()).toString())
                .body(new RegisterResponse(session.user(), session.tokens(), SessionService.REGISTERED_MESSAGE));
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Log in with login id or email")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in; refresh cookie set"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    public ResponseEntity<LoginResponse> login(@RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        AuthenticatedSession session = sessionService.login(request, ClientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.issue(session.refreshSecret()).toString())
                .body(new LoginResponse(session.user(), session.tokens()));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "Rotate the refresh cookie and issue a new access token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rotated; new refresh cookie set"),
            @ApiResponse(responseCode = "401", description = "Missing, invalid, revoked or expired refresh token")
    })
    public ResponseEntity<TokenResponse> refresh(
            @CookieValue(name = RefreshTokenCookieFactory.COOKIE_NAME, required = false) String refreshToken,
            HttpServletRequest httpRequest
    ) {
        if (refreshToken == null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized", "Refresh token not found");
        }
        RotatedTokens rotated = sessionService.refresh(refreshToken, ClientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.issue(rotated.refreshSecret()).toString())
                .body(rotated.tokens());
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "Revoke the current refresh token and clear the cookie")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = RefreshTokenCookieFactory.COOKIE_NAME, required = false) String refreshToken
    ) {
        sessionService.logout(refreshToken);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clear().toString())
                .body(new MessageResponse("Logged out successfully"));
    }

    @PostMapping("/auth/logout-all")
    @Operation(summary = "Revoke every refresh token of the caller")
    public ResponseEntity<MessageResponse> logoutAll() {
        sessionService.logoutAll(SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clear().toString())
                .body(new MessageResponse("Logged out from all devices successfully"));
    }

    @GetMapping("/auth/me")
    @Operation(summary = "Current user and effective roles")
    public ResponseEntity<MeResponse> me() {
        return ResponseEntity.ok(sessionService.getMe(SecurityUtils.getCurrentUserId()));
    }
}
