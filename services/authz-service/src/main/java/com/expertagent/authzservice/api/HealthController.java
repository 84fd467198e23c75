package com.expertagent.authzservice.api;

import com.expertagent.authz.PolicyStore;
import com.expertagent.authz.model.Actions;
import com.expertagent.authz.model.ResourceTypes;
import com.expertagent.authzservice.config.AuthzServiceProperties;
import com.expertagent.authzservice.security.RequiresAuthorization;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for load balancers and uptime checks. Reports the loaded policy set version.
 */
@RestController
public class HealthController {

    private final AuthzServiceProperties properties;
    private final PolicyStore policyStore;

    public HealthController(AuthzServiceProperties properties, PolicyStore policyStore) {
        this.properties = properties;
        this.policyStore = policyStore;
    }

    @RequiresAuthorization(
            action = Actions.HEALTH_CHECK,
            resourceType = ResourceTypes.AGENT,
            resourceId = "system",
            allowAnonymous = true,
            anonymousId = "health-check")
    @GetMapping("/api/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", properties.serviceName(),
                "environment", properties.environment(),
                "policyVersion", policyStore.version(),
                "timestamp", Instant.now().toString());
    }
}
