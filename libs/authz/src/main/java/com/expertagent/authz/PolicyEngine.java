package com.expertagent.authz;

import com.expertagent.authz.condition.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates authorization requests against a {@link PolicyStore}.
 * <p>
 * Decision procedure:
 * <ol>
 *   <li>If any applicable forbid policy matches, deny with that policy's description.</li>
 *   <li>Otherwise, if any applicable permit policy matches, permit with its description.</li>
 *   <li>Otherwise deny with {@value Decision#DEFAULT_DENY_REASON}.</li>
 * </ol>
 * Within each pass the first match in declaration order decides the reported policy. Evaluation
 * reads only the request and the store, so the same request always yields the same decision.
 * It never throws: malformed requests and evaluation failures are denied.
 */
public final class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final PolicyStore store;

    public PolicyEngine(PolicyStore store) {
        if (store == null) {
            throw new IllegalArgumentException("policy store must not be null");
        }
        this.store = store;
    }

    public Decision isAuthorized(AuthorizationRequest request) {
        String problem = malformation(request);
        if (problem != null) {
            return Decision.malformed(problem);
        }
        List<CompiledPolicy> candidates = store.policiesFor(
                request.principal().type(), request.action().id(), request.resource().type());
        EvaluationContext context = new EvaluationContext(
                request.principal(), request.action(), request.resource(), request.contextOrEmpty());
        int evaluated = 0;
        try {
            for (CompiledPolicy candidate : candidates) {
                if (candidate.policy().isForbid()) {
                    evaluated++;
                    if (candidate.applies(request, context)) {
                        return Decision.deny(candidate.id(), candidate.policy().description(), evaluated);
                    }
                }
            }
            for (CompiledPolicy candidate : candidates) {
                if (!candidate.policy().isForbid()) {
                    evaluated++;
                    if (candidate.applies(request, context)) {
                        return Decision.permit(candidate.id(), candidate.policy().description(), evaluated);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Policy evaluation failed principal={} action={} resource={}",
                    request.principal().describe(), request.action().id(), request.resource().describe(), e);
            return Decision.evaluationFailed(evaluated);
        }
        return Decision.defaultDeny(evaluated);
    }

    public PolicyStore store() {
        return store;
    }

    private static String malformation(AuthorizationRequest request) {
        if (request == null) {
            return "request is missing";
        }
        if (request.principal() == null) {
            return "principal is missing";
        }
        if (request.action() == null) {
            return "action is missing";
        }
        if (request.resource() == null) {
            return "resource is missing";
        }
        return null;
    }
}
