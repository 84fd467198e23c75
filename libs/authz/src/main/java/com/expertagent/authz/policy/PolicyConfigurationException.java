package com.expertagent.authz.policy;

import java.util.List;

/**
 * Thrown when a policy set is rejected at load time. Carries every problem found.
 * <p>
 * Invalid policies are a deployment error: the service refuses to start rather than run with a
 * partial or misread policy set.
 */
public class PolicyConfigurationException extends RuntimeException {

    private final List<String> errors;

    public PolicyConfigurationException(List<String> errors) {
        super("Invalid policy configuration (%d error(s)): %s".formatted(errors.size(), String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
