package com.expertagent.authz.audit;

import com.expertagent.authz.AuthorizationRequest;
import com.expertagent.authz.Decision;
import com.expertagent.authz.model.Actions;
import com.expertagent.authz.model.Resource;
import com.expertagent.authz.testing.TestPrincipals;
import com.expertagent.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthorizationMetrics")
class AuthorizationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AuthorizationMetrics metrics = new AuthorizationMetrics(new MetricFactory(registry, "authz-test"));

    @Test
    @DisplayName("counts decisions by outcome and action")
    void countsDecisions() {
        var request = AuthorizationRequest.of(TestPrincipals.member(), Actions.GET_ORG, Resource.org("org-1"));

        metrics.record(request, Decision.permit("member-view-org", "ok", 2), Duration.ofMillis(1));
        metrics.record(request, Decision.defaultDeny(5), Duration.ofMillis(1));
        metrics.record(request, Decision.defaultDeny(5), Duration.ofMillis(1));

        assertThat(registry.get(AuthorizationMetrics.DECISIONS)
                .tag("decision", "deny").tag("action", Actions.GET_ORG).tag("service", "authz-test")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(AuthorizationMetrics.DECISIONS)
                .tag("decision", "permit").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("times evaluations by outcome")
    void timesEvaluations() {
        var request = AuthorizationRequest.of(TestPrincipals.member(), Actions.GET_ORG, Resource.org("org-1"));

        metrics.record(request, Decision.defaultDeny(1), Duration.ofMillis(3));

        var timer = registry.get(AuthorizationMetrics.EVALUATION).tag("decision", "deny").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("tags a request without an action as unknown")
    void nullRequest() {
        metrics.record(null, Decision.malformed("request must not be null"), Duration.ZERO);

        assertThat(registry.get(AuthorizationMetrics.DECISIONS).tag("action", "unknown").counter().count())
                .isEqualTo(1.0);
    }
}
