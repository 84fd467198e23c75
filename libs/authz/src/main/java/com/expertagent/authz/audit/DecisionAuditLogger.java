package com.expertagent.authz.audit;

import com.expertagent.authz.AuthorizationRequest;
import com.expertagent.authz.Decision;
import com.expertagent.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one structured log line per authorization decision.
 * <p>
 * Permits log at INFO, denials at WARN. Principal attributes are only logged at DEBUG, with
 * sensitive values (emails, addresses) redacted. Correlation and principal ids come from the MDC.
 */
public class DecisionAuditLogger {

    private static final Logger log = LoggerFactory.getLogger("authz.audit");

    private final boolean enabled;
    private final SensitiveDataRedactor redactor;

    public DecisionAuditLogger() {
        this(true, new SensitiveDataRedactor());
    }

    public DecisionAuditLogger(boolean enabled, SensitiveDataRedactor redactor) {
        this.enabled = enabled;
        this.redactor = redactor;
    }

    public static DecisionAuditLogger disabled() {
        return new DecisionAuditLogger(false, new SensitiveDataRedactor());
    }

    public void record(AuthorizationRequest request, Decision decision) {
        if (!enabled) {
            return;
        }
        String principal = request == null || request.principal() == null ? "-" : request.principal().describe();
        String action = request == null || request.action() == null ? "-" : request.action().id();
        String resource = request == null || request.resource() == null ? "-" : request.resource().describe();
        String policy = decision.diagnostics().matchedPolicy().orElse("-");
        if (decision.isAuthorized()) {
            log.info("authz decision=permit principal={} action={} resource={} policy={} evaluated={}",
                    principal, action, resource, policy, decision.diagnostics().policiesEvaluated());
        } else {
            log.warn("authz decision=deny principal={} action={} resource={} policy={} evaluated={} reason=\"{}\"",
                    principal, action, resource, policy, decision.diagnostics().policiesEvaluated(),
                    decision.reason());
        }
        if (log.isDebugEnabled() && request != null && request.principal() != null) {
            log.debug("authz principal attributes principal={} attributes={}",
                    principal, redactor.redact(request.principal().attributes()));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
