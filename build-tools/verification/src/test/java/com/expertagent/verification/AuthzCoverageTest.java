package com.expertagent.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Every HTTP handler in every service must be authorized: guarded by {@code @RequiresAuthorization},
 * inside a controller that calls the authorizer itself, or listed with a reason in
 * {@code authz-exceptions.json} at the repository root.
 */
@DisplayName("Route authorization coverage")
class AuthzCoverageTest {

    private static Path projectRoot;
    private static List<RouteScanner.Handler> handlers;
    private static JsonNode exceptions;

    @BeforeAll
    static void scan() throws IOException {
        projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();
        handlers = RouteScanner.scanServices(projectRoot.resolve("services"));
        exceptions = new ObjectMapper().readTree(projectRoot.resolve("authz-exceptions.json").toFile());
    }

    @Test
    @DisplayName("finds the known service handlers")
    void scanIsNotVacuous() {
        assertThat(handlers)
                .extracting(RouteScanner.Handler::qualifiedName)
                .contains("HealthController.health", "PolicyController.policies", "DecisionController.decide");
    }

    @Test
    @DisplayName("every handler is guarded, calls the authorizer, or is a listed exception")
    void everyHandlerIsAuthorized() {
        Set<String> excepted = exceptedHandlers();

        List<String> uncovered = handlers.stream()
                .filter(h -> !h.guarded() && !h.callsAuthorizer() && !excepted.contains(h.qualifiedName()))
                .map(h -> h.qualifiedName() + " " + h.mapping())
                .toList();

        assertThat(uncovered)
                .as("Handlers without authorization; add @RequiresAuthorization or an entry in authz-exceptions.json")
                .isEmpty();
    }

    @Nested
    @DisplayName("authz-exceptions.json")
    class ExceptionsFile {

        @Test
        @DisplayName("has an 'exceptions' array")
        void shape() {
            assertThat(exceptions.path("exceptions").isArray()).isTrue();
        }

        @Test
        @DisplayName("gives a route and a reason for every entry")
        void reasons() {
            for (JsonNode entry : exceptions.path("exceptions")) {
                assertThat(entry.path("handler").asText()).as("handler").isNotBlank();
                assertThat(entry.path("route").asText()).as("route of %s", entry).isNotBlank();
                assertThat(entry.path("reason").asText()).as("reason of %s", entry).isNotBlank();
            }
        }

        @Test
        @DisplayName("lists no handler that no longer exists")
        void noStaleEntries() {
            Set<String> existing = new HashSet<>();
            handlers.forEach(h -> existing.add(h.qualifiedName()));

            assertThat(exceptedHandlers()).isSubsetOf(existing);
        }
    }

    private static Set<String> exceptedHandlers() {
        Set<String> names = new HashSet<>();
        exceptions.path("exceptions").forEach(e -> names.add(e.path("handler").asText()));
        return names;
    }
}
