package com.expertagent.authz;

import com.expertagent.authz.model.Action;
import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.RequestContext;
import com.expertagent.authz.model.Resource;

/**
 * A single authorization question: may {@code principal} perform {@code action} on
 * {@code resource}?
 * <p>
 * Components are not null-checked here. The engine treats a request with a missing component as
 * malformed and denies it.
 */
public record AuthorizationRequest(
        Principal principal,
        Action action,
        Resource resource,
        RequestContext context
) {

    public AuthorizationRequest(Principal principal, Action action, Resource resource) {
        this(principal, action, resource, RequestContext.empty());
    }

    public static AuthorizationRequest of(Principal principal, String actionId, Resource resource) {
        return new AuthorizationRequest(principal, Action.of(actionId), resource);
    }

    /** Context, or {@link RequestContext#empty()} when none was supplied. */
    public RequestContext contextOrEmpty() {
        return context == null ? RequestContext.empty() : context;
    }
}
