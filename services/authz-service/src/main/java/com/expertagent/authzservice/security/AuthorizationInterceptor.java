package com.expertagent.authzservice.security;

import com.expertagent.authz.AuthorizationRequest;
import com.expertagent.authz.Authorizer;
import com.expertagent.authz.model.Action;
import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.RequestContext;
import com.expertagent.authz.model.Resource;
import com.expertagent.authz.principal.PrincipalHeaderCodec;
import com.expertagent.observability.CorrelationContextHolder;
import com.expertagent.observability.SpanHelper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces {@link RequiresAuthorization} on handler methods.
 *
 * <p>The principal comes from the {@value PrincipalHeaderCodec#HEADER} header set by the
 * authenticating edge. Without the header the caller is anonymous, which is only accepted when the
 * route allows it. Denials surface as {@code AccessDeniedException} and are mapped to 403 by the
 * global exception handler.
 */
public class AuthorizationInterceptor implements HandlerInterceptor {

    /** Request attribute under which the resolved principal is exposed to handlers. */
    public static final String PRINCIPAL_ATTRIBUTE = AuthorizationInterceptor.class.getName() + ".principal";

    public static final String ACTIVE_ORG_HEADER = "X-Org-Id";

    private final Authorizer authorizer;
    private final SpanHelper spanHelper;
    private final String environment;

    public AuthorizationInterceptor(Authorizer authorizer, SpanHelper spanHelper, String environment) {
        this.authorizer = authorizer;
        this.spanHelper = spanHelper;
        this.environment = environment;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RequiresAuthorization guard = handlerMethod.getMethodAnnotation(RequiresAuthorization.class);
        if (guard == null) {
            return true;
        }

        Principal principal = resolvePrincipal(request, guard);
        String activeOrgId = request.getHeader(ACTIVE_ORG_HEADER);
        CorrelationContextHolder.attachPrincipal(principal.id(), activeOrgId);

        var authorizationRequest = new AuthorizationRequest(
                principal,
                Action.of(guard.action()),
                Resource.of(guard.resourceType(), resolveResourceId(request, guard)),
                new RequestContext(
                        activeOrgId,
                        request.getRemoteAddr(),
                        request.getHeader("User-Agent"),
                        Instant.now(),
                        environment));

        spanHelper.inSpan(
                "authz.evaluate",
                Map.of("authz.action", guard.action(), "authz.resource.type", guard.resourceType()),
                () -> authorizer.require(authorizationRequest));

        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        return true;
    }

    private static Principal resolvePrincipal(HttpServletRequest request, RequiresAuthorization guard) {
        String header = request.getHeader(PrincipalHeaderCodec.HEADER);
        if (header == null || header.isBlank()) {
            if (!guard.allowAnonymous()) {
                throw new AuthenticationRequiredException("Authentication required");
            }
            return Principal.anonymous(guard.anonymousId());
        }
        return PrincipalHeaderCodec.decode(header.strip());
    }

    private static String resolveResourceId(HttpServletRequest request, RequiresAuthorization guard) {
        if (guard.resourceIdVariable().isEmpty()) {
            return guard.resourceId();
        }
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        Object raw = variables instanceof Map<?, ?> map ? map.get(guard.resourceIdVariable()) : null;
        String value = raw == null ? null : String.valueOf(raw);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing path variable '" + guard.resourceIdVariable() + "'");
        }
        return value;
    }
}
