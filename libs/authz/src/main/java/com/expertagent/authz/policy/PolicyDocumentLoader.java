package com.expertagent.authz.policy;

import com.expertagent.authz.model.PrincipalType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads policy documents from JSON.
 * <pre>{@code
 * {
 *   "version": "2024-06-01",
 *   "policies": [
 *     {
 *       "id": "member-read-org",
 *       "description": "Members can view their organization",
 *       "effect": "permit",
 *       "principal": { "type": "User" },
 *       "actions": ["GetOrg"],
 *       "resource": { "type": "Org" },
 *       "condition": "principal.roles[resource.id] >= \"MEMBER\""
 *     }
 *   ]
 * }
 * }</pre>
 * {@code "actions": "*"} or a missing {@code actions} matches every action. A missing
 * principal or resource type matches any type. Structural problems are collected and reported
 * together in a {@link PolicyConfigurationException}; conditions are checked later, when the
 * policies load into a store.
 */
public final class PolicyDocumentLoader {

    public static final String DEFAULT_POLICIES = "policies/default-policies.json";

    private static final String WILDCARD = "*";

    private final ObjectMapper mapper;

    public PolicyDocumentLoader() {
        this(new ObjectMapper());
    }

    public PolicyDocumentLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Loads the policy document bundled with this library. */
    public PolicyDocument loadDefaults() {
        return loadClasspath(DEFAULT_POLICIES);
    }

    public PolicyDocument loadClasspath(String resource) {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader loader = PolicyDocumentLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                throw new PolicyDocumentException("Policy document not found on classpath: " + name, null);
            }
            return load(in);
        } catch (IOException e) {
            throw new PolicyDocumentException("Failed to read policy document " + name, e);
        }
    }

    public PolicyDocument load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new PolicyDocumentException("Failed to read policy document " + path, e);
        }
    }

    public PolicyDocument load(InputStream in) {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new PolicyDocumentException("Policy document is not valid JSON", e);
        }
        return parse(root);
    }

    public PolicyDocument parse(String json) {
        try {
            return parse(mapper.readTree(json));
        } catch (IOException e) {
            throw new PolicyDocumentException("Policy document is not valid JSON", e);
        }
    }

    private PolicyDocument parse(JsonNode root) {
        List<String> errors = new ArrayList<>();
        if (root == null || !root.isObject()) {
            throw new PolicyConfigurationException(List.of("policy document must be a JSON object"));
        }
        String version = text(root, "version");
        JsonNode policiesNode = root.get("policies");
        if (policiesNode == null || !policiesNode.isArray()) {
            throw new PolicyConfigurationException(List.of("policy document must contain a 'policies' array"));
        }
        List<Policy> policies = new ArrayList<>();
        for (int i = 0; i < policiesNode.size(); i++) {
            JsonNode node = policiesNode.get(i);
            String label = node.hasNonNull("id") ? "policy '" + node.get("id").asText() + "'" : "policy #" + i;
            if (!node.isObject()) {
                errors.add(label + ": must be a JSON object");
                continue;
            }
            policies.add(toPolicy(node, label, errors));
        }
        if (!errors.isEmpty()) {
            throw new PolicyConfigurationException(errors);
        }
        return new PolicyDocument(version == null ? "unversioned" : version, policies);
    }

    private Policy toPolicy(JsonNode node, String label, List<String> errors) {
        String effectText = text(node, "effect");
        Effect effect = Effect.fromString(effectText).orElse(null);
        if (effect == null) {
            errors.add(label + ": effect must be 'permit' or 'forbid' but was '" + effectText + "'");
        }
        return new Policy(
                text(node, "id"),
                text(node, "description"),
                effect,
                principalPattern(node.get("principal"), label, errors),
                actionPattern(node.get("actions"), label, errors),
                resourcePattern(node.get("resource"), label, errors),
                text(node, "condition"));
    }

    private PrincipalPattern principalPattern(JsonNode node, String label, List<String> errors) {
        if (node == null || node.isNull()) {
            return PrincipalPattern.any();
        }
        if (!node.isObject()) {
            errors.add(label + ": principal must be an object");
            return PrincipalPattern.any();
        }
        String typeText = text(node, "type");
        PrincipalType type = null;
        if (typeText != null && !WILDCARD.equals(typeText)) {
            type = PrincipalType.fromString(typeText).orElse(null);
            if (type == null) {
                errors.add(label + ": unknown principal type '" + typeText + "'");
            }
        }
        return new PrincipalPattern(type, text(node, "id"));
    }

    private ActionPattern actionPattern(JsonNode node, String label, List<String> errors) {
        if (node == null || node.isNull() || (node.isTextual() && WILDCARD.equals(node.asText()))) {
            return ActionPattern.any();
        }
        if (!node.isArray()) {
            errors.add(label + ": actions must be \"*\" or an array of action ids");
            return ActionPattern.any();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                errors.add(label + ": action ids must be non-blank strings");
            } else {
                ids.add(item.asText());
            }
        }
        return ActionPattern.of(ids);
    }

    private ResourcePattern resourcePattern(JsonNode node, String label, List<String> errors) {
        if (node == null || node.isNull()) {
            return ResourcePattern.any();
        }
        if (!node.isObject()) {
            errors.add(label + ": resource must be an object");
            return ResourcePattern.any();
        }
        String type = text(node, "type");
        return new ResourcePattern(WILDCARD.equals(type) ? null : type, text(node, "id"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Exception thrown when a policy document cannot be read or is not JSON.
     */
    public static class PolicyDocumentException extends RuntimeException {
        public PolicyDocumentException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
