package com.expertagent.authzservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the authorization service, bound from {@code expertagent.authz.*}:
 *
 * <pre>
 * expertagent:
 *   authz:
 *     service-name: authz-service
 *     environment: production
 *     policy-location: classpath:policies/default-policies.json
 *     audit-logging: true
 * </pre>
 *
 * @param serviceName    service name used for logging, metrics and tracing. Required.
 * @param environment    deployment environment, exposed to conditions as {@code context.environment}
 * @param policyLocation Spring resource location of the policy document
 * @param auditLogging   whether every decision is written to the audit log
 */
@ConfigurationProperties(prefix = "expertagent.authz")
@Validated
public record AuthzServiceProperties(
        @NotBlank String serviceName, String environment, String policyLocation, Boolean auditLogging) {

    public static final String DEFAULT_POLICY_LOCATION = "classpath:policies/default-policies.json";

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public AuthzServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (policyLocation == null || policyLocation.isBlank()) {
            policyLocation = DEFAULT_POLICY_LOCATION;
        }
        if (auditLogging == null) {
            auditLogging = Boolean.TRUE;
        }
    }
}
