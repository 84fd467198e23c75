package com.expertagent.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("redact()")
    class Redact {

        @Test
        @DisplayName("replaces sensitive values and keeps the rest")
        void replacesSensitiveValues() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "email", "alice@example.com",
                    "accessToken", "abc",
                    "roles", "owner"));

            assertThat(result)
                    .containsEntry("email", SensitiveDataRedactor.REDACTED)
                    .containsEntry("accessToken", SensitiveDataRedactor.REDACTED)
                    .containsEntry("roles", "owner");
        }

        @Test
        @DisplayName("redacts nested maps")
        void redactsNested() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "session", Map.of("ipAddress", "10.0.0.1", "userAgent", "curl")));

            assertThat(result.get("session")).isInstanceOf(Map.class);
            @SuppressWarnings("unchecked")
            Map<String, Object> nested = (Map<String, Object>) result.get("session");
            assertThat(nested)
                    .containsEntry("ipAddress", SensitiveDataRedactor.REDACTED)
                    .containsEntry("userAgent", "curl");
        }

        @Test
        @DisplayName("returns an empty map for null input")
        void nullInput() {
            assertThat(redactor.redact(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("custom patterns")
    class CustomPatterns {

        @Test
        @DisplayName("matches case-insensitively by substring")
        void caseInsensitive() {
            var custom = new SensitiveDataRedactor(Set.of("ssn"));

            assertThat(custom.isSensitive("customerSSN")).isTrue();
            assertThat(custom.isSensitive("email")).isFalse();
            assertThat(custom.isSensitive(null)).isFalse();
        }

        @Test
        @DisplayName("rejects empty pattern set")
        void rejectsEmpty() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
