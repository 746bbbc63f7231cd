package com.knowledgecenter.backend.support;

import java.time.Clock;

import com.knowledgecenter.backend.global.common.time.TimeConfig;
import com.knowledgecenter.backend.global.config.WebMvcConfig;
import com.knowledgecenter.backend.global.error.RestExceptionHandler;
import com.knowledgecenter.backend.global.security.JwtAuthenticationFilter;
import com.knowledgecenter.backend.global.security.RestAccessDeniedHandler;
import com.knowledgecenter.backend.global.security.RestAuthenticationEntryPoint;
import com.knowledgecenter.backend.global.security.SecurityConfig;
import com.knowledgecenter.backend.modules.auth.application.CredentialVault;
import com.knowledgecenter.backend.modules.auth.application.SessionService;
import com.knowledgecenter.backend.modules.auth.application.TokenAuthority;
import com.knowledgecenter.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.knowledgecenter.backend.modules.auth.presentation.AuthExceptionHandler;
import com.knowledgecenter.backend.modules.auth.presentation.RefreshTokenCookieFactory;
import com.knowledgecenter.backend.modules.rbac.application.PermissionService;
import com.knowledgecenter.backend.modules.rbac.application.PermissionTable;
import com.knowledgecenter.backend.modules.rbac.application.RbacAuthorizer;
import com.knowledgecenter.backend.modules.rbac.presentation.RbacAuthorizationInterceptor;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Security chain, token services and RBAC gate for {@code @WebMvcTest} slices, backed by an
 * in-memory identity store instead of the database.
 */
@TestConfiguration(proxyBeanMethods = false)
@Import({
        SecurityConfig.class,
        JwtAuthenticationFilter.class,
        RestAuthenticationEntryPoint.class,
        RestAccessDeniedHandler.class,
        RestExceptionHandler.class,
        TimeConfig.class,
        JwtTokenProvider.class,
        CredentialVault.class,
        TokenAuthority.class,
        SessionService.class,
        RefreshTokenCookieFactory.class,
        AuthExceptionHandler.class,
        PermissionTable.class,
        PermissionService.class,
        RbacAuthorizer.class,
        RbacAuthorizationInterceptor.class,
        WebMvcConfig.class
})
public class WebLayerTestConfig {

    @Bean
    InMemoryIdentityStore identityStore(Clock clock) {
        return InMemoryIdentityStore.withPublicGroup(clock);
    }
}
