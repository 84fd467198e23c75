package com.expertagent.authz;

/**
 * Thrown by {@link Authorizer#require(AuthorizationRequest)} when a request is denied.
 * <p>
 * The message names the action and resource only. The decision, with its reason and matched
 * policy, is kept for audit and must not be echoed to the caller.
 */
public class AccessDeniedException extends RuntimeException {

    private final Decision decision;

    public AccessDeniedException(String actionId, String resource, Decision decision) {
        super("Access denied: action '%s' on %s".formatted(actionId, resource));
        this.decision = decision;
    }

    public Decision decision() {
        return decision;
    }
}
