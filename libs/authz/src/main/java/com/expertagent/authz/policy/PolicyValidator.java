package com.expertagent.authz.policy;

import com.expertagent.authz.condition.AttributeSchema;
import com.expertagent.authz.condition.ConditionParser;
import com.expertagent.authz.condition.InvalidConditionException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a policy set for structural problems before it is loaded.
 * <p>
 * Every problem in the set is reported, not only the first, so a broken policy document can be
 * fixed in one pass.
 */
public final class PolicyValidator {

    private PolicyValidator() {
        // utility class
    }

    public static ValidationResult validate(List<Policy> policies, AttributeSchema schema) {
        List<String> errors = new ArrayList<>();
        if (policies == null) {
            return ValidationResult.fail(List.of("policy list must not be null"));
        }
        ConditionParser parser = new ConditionParser(schema);
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < policies.size(); i++) {
            Policy policy = policies.get(i);
            if (policy == null) {
                errors.add("policy #" + i + " must not be null");
                continue;
            }
            String label = isBlank(policy.id()) ? "policy #" + i : "policy '" + policy.id() + "'";
            if (isBlank(policy.id())) {
                errors.add(label + ": id must not be null or blank");
            } else if (!seenIds.add(policy.id())) {
                errors.add(label + ": duplicate policy id");
            }
            if (isBlank(policy.description())) {
                errors.add(label + ": description must not be null or blank");
            }
            if (policy.effect() == null) {
                errors.add(label + ": effect must be permit or forbid");
            }
            if (!policy.actions().anyAction() && policy.actions().actionIds().isEmpty()) {
                errors.add(label + ": action list must not be empty");
            }
            if (policy.condition() != null) {
                try {
                    parser.parse(policy.condition());
                } catch (InvalidConditionException e) {
                    errors.add(label + ": " + e.getMessage());
                }
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
