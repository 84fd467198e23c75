package com.expertagent.authz.audit;

import com.expertagent.authz.AuthorizationRequest;
import com.expertagent.authz.Decision;
import com.expertagent.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Decision counters and evaluation latency.
 * <ul>
 *   <li>{@value #DECISIONS} counter, tagged {@code decision} (permit/deny) and {@code action}</li>
 *   <li>{@value #EVALUATION} timer, tagged {@code decision}</li>
 * </ul>
 */
public class AuthorizationMetrics {

    public static final String DECISIONS = "authz.decisions";
    public static final String EVALUATION = "authz.evaluation";

    private final MetricFactory metrics;

    public AuthorizationMetrics(MetricFactory metrics) {
        this.metrics = metrics;
    }

    /** Metrics recorded into a throwaway registry, for callers that do not export metrics. */
    public static AuthorizationMetrics inMemory(String serviceName) {
        return new AuthorizationMetrics(new MetricFactory(new SimpleMeterRegistry(), serviceName));
    }

    public void record(AuthorizationRequest request, Decision decision, Duration elapsed) {
        String outcome = decision.isAuthorized() ? "permit" : "deny";
        String action = request == null || request.action() == null ? "unknown" : request.action().id();
        metrics.counter(DECISIONS, "Authorization decisions", "decision", outcome, "action", action).increment();
        metrics.timer(EVALUATION, "Authorization evaluation latency", "decision", outcome).record(elapsed);
    }

    public MetricFactory metricFactory() {
        return metrics;
    }
}
