package com.knowledgecenter.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void passesWithCompleteConfiguration() {
        assertThat(new EnvironmentValidator(validEnvironment()).validate()).isEmpty();
    }

    @Test
    void rejectsMissingSecret() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.secret", " ");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("missing required property jwt.secret");
    }

    @Test
    void rejectsPlaceholderSecret() {
        MockEnvironment environment = validEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.PLACEHOLDER_SECRET);

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("jwt.secret still holds the placeholder value");
    }

    @Test
    void rejectsInvalidHashingConcurrency() {
        assertThat(new EnvironmentValidator(validEnvironment()
                .withProperty("app.security.password-hashing.max-concurrent", "-1")).validate())
                .containsExactly("app.security.password-hashing.max-concurrent must be >= 0");
        assertThat(new EnvironmentValidator(validEnvironment()
                .withProperty("app.security.password-hashing.max-concurrent", "many")).validate())
                .containsExactly("app.security.password-hashing.max-concurrent must be a number");
    }

    @Test
    void startupFailsWhenAnythingIsMissing() {
        MockEnvironment environment = new MockEnvironment();

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.url")
                .hasMessageContaining("app.env")
                .hasMessageContaining("jwt.secret");
    }

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/knowledgecenter")
                .withProperty("app.env", "production")
                .withProperty("jwt.secret", "a-real-secret-that-is-long-enough-for-hs256");
    }
}
