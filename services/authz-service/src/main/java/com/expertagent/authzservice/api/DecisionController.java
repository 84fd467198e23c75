package com.expertagent.authzservice.api;

import com.expertagent.authz.Authorizer;
import com.expertagent.authzservice.config.AuthzServiceProperties;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Policy decision point for other platform components.
 *
 * <p>Answers "may this principal perform this action on this resource?" for a caller-supplied
 * request. A deny is a normal 200 response with {@code isAuthorized=false}. The endpoint is only
 * reachable on the internal network and carries no route guard of its own.
 */
@RestController
@RequestMapping("/api/v1/authz")
public class DecisionController {

    private final Authorizer authorizer;
    private final AuthzServiceProperties properties;

    public DecisionController(Authorizer authorizer, AuthzServiceProperties properties) {
        this.authorizer = authorizer;
        this.properties = properties;
    }

    @PostMapping("/decisions")
    public DecisionResponse decide(@Valid @RequestBody DecisionRequest body) {
        return DecisionResponse.from(
                authorizer.isAuthorized(body.toAuthorizationRequest(properties.environment())));
    }
}
