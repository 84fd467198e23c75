package com.expertagent.authz.condition;

import com.expertagent.authz.model.Action;
import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.RequestContext;
import com.expertagent.authz.model.Resource;

import java.util.Map;

/**
 * Read-only view of one request, as seen by condition evaluation.
 */
public final class EvaluationContext {

    private final Principal principal;
    private final Action action;
    private final Resource resource;
    private final Map<String, Object> contextAttributes;

    public EvaluationContext(Principal principal, Action action, Resource resource, RequestContext context) {
        this.principal = principal;
        this.action = action;
        this.resource = resource;
        this.contextAttributes = context == null ? Map.of() : context.asAttributes();
    }

    /**
     * Resolves the first segment of a path: an entity field or a top-level attribute.
     *
     * @return the value, or {@code null} when absent
     */
    Object lookup(Root root, String name) {
        switch (root) {
            case PRINCIPAL:
                if ("id".equals(name)) {
                    return principal.id();
                }
                if ("type".equals(name)) {
                    return principal.type().value();
                }
                return principal.attributes().get(name);
            case RESOURCE:
                if ("id".equals(name)) {
                    return resource.id();
                }
                if ("type".equals(name)) {
                    return resource.type();
                }
                return resource.attributes().get(name);
            case ACTION:
                return "id".equals(name) ? action.id() : null;
            case CONTEXT:
                return contextAttributes.get(name);
            default:
                return null;
        }
    }
}
