package com.expertagent.authz;

import com.expertagent.authz.audit.AuthorizationMetrics;
import com.expertagent.authz.audit.DecisionAuditLogger;

import java.time.Duration;

/**
 * Entry point for application code: evaluates a request, records the decision in the audit
 * log and metrics, and optionally enforces it.
 * <pre>{@code
 * authorizer.require(AuthorizationRequest.of(principal, Actions.VIEW_AUDIT_LOG, Resource.org(orgId)));
 * }</pre>
 */
public class Authorizer {

    private final PolicyEngine engine;
    private final DecisionAuditLogger auditLogger;
    private final AuthorizationMetrics metrics;

    public Authorizer(PolicyEngine engine, DecisionAuditLogger auditLogger, AuthorizationMetrics metrics) {
        this.engine = engine;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
    }

    public Decision isAuthorized(AuthorizationRequest request) {
        long start = System.nanoTime();
        Decision decision = engine.isAuthorized(request);
        metrics.record(request, decision, Duration.ofNanos(System.nanoTime() - start));
        auditLogger.record(request, decision);
        return decision;
    }

    /**
     * @return the permit decision
     * @throws AccessDeniedException if the request is denied
     */
    public Decision require(AuthorizationRequest request) {
        Decision decision = isAuthorized(request);
        if (!decision.isAuthorized()) {
            String action = request == null || request.action() == null ? "unknown" : request.action().id();
            String resource = request == null || request.resource() == null ? "unknown" : request.resource().describe();
            throw new AccessDeniedException(action, resource, decision);
        }
        return decision;
    }

    public PolicyEngine engine() {
        return engine;
    }
}
