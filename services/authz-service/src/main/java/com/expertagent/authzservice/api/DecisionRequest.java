package com.expertagent.authzservice.api;

import com.expertagent.authz.AuthorizationRequest;
import com.expertagent.authz.model.Action;
import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.PrincipalType;
import com.expertagent.authz.model.RequestContext;
import com.expertagent.authz.model.Resource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

/**
 * Request body of the decision endpoint.
 *
 * <pre>
 * {
 *   "principal": { "type": "User", "id": "u1", "attributes": { "roles": { "org-1": "MEMBER" } } },
 *   "action":    { "id": "QueryAgent" },
 *   "resource":  { "type": "Agent", "id": "ux-analyst", "attributes": { "isPublic": true } },
 *   "context":   { "activeOrgId": "org-1" }
 * }
 * </pre>
 */
public record DecisionRequest(
        @NotNull @Valid PrincipalBody principal,
        @NotNull @Valid ActionBody action,
        @NotNull @Valid ResourceBody resource,
        ContextBody context) {

    /**
     * @param environment the service's deployment environment; callers cannot choose it
     * @throws IllegalArgumentException if the principal type is unknown
     */
    public AuthorizationRequest toAuthorizationRequest(String environment) {
        PrincipalType type = PrincipalType.fromString(principal.type())
                .orElseThrow(() -> new IllegalArgumentException("Unknown principal type '" + principal.type() + "'"));
        RequestContext requestContext = context == null
                ? RequestContext.forEnvironment(environment)
                : new RequestContext(context.activeOrgId(), context.ipAddress(), context.userAgent(), null, environment);
        return new AuthorizationRequest(
                new Principal(type, principal.id(), principal.attributes()),
                Action.of(action.id()),
                new Resource(resource.type(), resource.id(), resource.attributes()),
                requestContext);
    }

    public record PrincipalBody(@NotBlank String type, @NotBlank String id, Map<String, Object> attributes) {
    }

    public record ActionBody(@NotBlank String id) {
    }

    public record ResourceBody(@NotBlank String type, @NotBlank String id, Map<String, Object> attributes) {
    }

    public record ContextBody(String activeOrgId, String ipAddress, String userAgent) {
    }
}
