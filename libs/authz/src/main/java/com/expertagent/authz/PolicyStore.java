package com.expertagent.authz;

import com.expertagent.authz.condition.AttributeSchema;
import com.expertagent.authz.condition.ConditionParser;
import com.expertagent.authz.model.PrincipalType;
import com.expertagent.authz.policy.Policy;
import com.expertagent.authz.policy.PolicyConfigurationException;
import com.expertagent.authz.policy.PolicyDocument;
import com.expertagent.authz.policy.PolicyValidator;
import com.expertagent.authz.policy.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, validated policy set.
 * <p>
 * Policies keep their declaration order. A store is built once at startup and shared by every
 * request thread; it has no mutators, so concurrent reads need no locking.
 */
public final class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final String version;
    private final List<CompiledPolicy> policies;
    private final Map<PrincipalType, List<CompiledPolicy>> byPrincipalType;

    private PolicyStore(String version, List<CompiledPolicy> policies) {
        this.version = version;
        this.policies = List.copyOf(policies);
        Map<PrincipalType, List<CompiledPolicy>> index = new EnumMap<>(PrincipalType.class);
        for (PrincipalType type : PrincipalType.values()) {
            List<CompiledPolicy> forType = new ArrayList<>();
            for (CompiledPolicy compiled : this.policies) {
                if (compiled.policy().principal().matchesType(type)) {
                    forType.add(compiled);
                }
            }
            index.put(type, List.copyOf(forType));
        }
        this.byPrincipalType = index;
    }

    public static PolicyStore load(List<Policy> policies) {
        return load("unversioned", policies, AttributeSchema.defaults());
    }

    public static PolicyStore load(PolicyDocument document) {
        return load(document.version(), document.policies(), AttributeSchema.defaults());
    }

    /**
     * Validates and compiles a policy set.
     *
     * @throws PolicyConfigurationException listing every problem when any policy is invalid
     */
    public static PolicyStore load(String version, List<Policy> policies, AttributeSchema schema) {
        ValidationResult result = PolicyValidator.validate(policies, schema);
        if (!result.valid()) {
            log.error("Rejected policy set version={} errors={}", version, result.errors());
            throw new PolicyConfigurationException(result.errors());
        }
        ConditionParser parser = new ConditionParser(schema);
        List<CompiledPolicy> compiled = new ArrayList<>(policies.size());
        for (Policy policy : policies) {
            compiled.add(new CompiledPolicy(policy,
                    policy.condition() == null ? null : parser.parse(policy.condition())));
        }
        PolicyStore store = new PolicyStore(version, compiled);
        log.info("Loaded policy set version={} policies={} forbids={}",
                version, compiled.size(), store.forbidCount());
        return store;
    }

    /**
     * Policies whose principal type, action and resource type could match, in declaration order.
     * Principal and resource ids and conditions are not checked here.
     */
    public List<CompiledPolicy> policiesFor(PrincipalType principalType, String actionId, String resourceType) {
        List<CompiledPolicy> candidates = new ArrayList<>();
        for (CompiledPolicy compiled : byPrincipalType.getOrDefault(principalType, List.of())) {
            Policy policy = compiled.policy();
            if (policy.actions().matches(actionId) && policy.resource().matchesType(resourceType)) {
                candidates.add(compiled);
            }
        }
        return candidates;
    }

    public List<CompiledPolicy> policies() {
        return policies;
    }

    public String version() {
        return version;
    }

    public int size() {
        return policies.size();
    }

    private long forbidCount() {
        return policies.stream().filter(p -> p.policy().isForbid()).count();
    }
}
