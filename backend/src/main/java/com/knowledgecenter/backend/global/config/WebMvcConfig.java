package com.knowledgecenter.backend.global.config;

import com.knowledgecenter.backend.modules.rbac.presentation.RbacAuthorizationInterceptor;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    // Routes reachable without a bearer token are not role checked.
    static final String[] PUBLIC_PATHS = {
        "/",
        "/auth/register",
        "/auth/login",
        "/auth/refresh",
        "/auth/logout",
        "/health",
        "/healthz",
        "/readyz",
        "/error",
        "/v3/api-docs/**",
        "/swagger-ui/**",
        "/swagger-ui.html",
        "/actuator/**"
    };

    private final RbacAuthorizationInterceptor rbacAuthorizationInterceptor;

    public WebMvcConfig(RbacAuthorizationInterceptor rbacAuthorizationInterceptor) {
        this.rbacAuthorizationInterceptor = rbacAuthorizationInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rbacAuthorizationInterceptor)
                .addPathPatterns("/**")
                .excludePathPatterns(PUBLIC_PATHS);
    }
}
