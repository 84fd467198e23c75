package com.expertagent.authzservice.security;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.Resource;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Guards a controller handler method with an authorization check, evaluated by {@link
 * AuthorizationInterceptor} before the handler runs.
 *
 * <pre>
 * &#64;RequiresAuthorization(action = Actions.GET_ORG, resourceType = ResourceTypes.ORG,
 *         resourceIdVariable = "orgId")
 * &#64;GetMapping("/orgs/{orgId}")
 * </pre>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresAuthorization {

    /** Action id, see {@code Actions}. */
    String action();

    /** Resource type, see {@code ResourceTypes}. */
    String resourceType();

    /** Fixed resource id, used when {@link #resourceIdVariable()} is empty. */
    String resourceId() default Resource.ANY_ID;

    /** Name of the URI template variable holding the resource id. */
    String resourceIdVariable() default "";

    /** Whether callers without a principal are evaluated as anonymous instead of rejected with 401. */
    boolean allowAnonymous() default false;

    /** Id given to the anonymous principal, so audit logs show which route it came through. */
    String anonymousId() default Principal.ANONYMOUS_ID;
}
