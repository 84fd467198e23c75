package com.expertagent.authz.policy;

import java.util.List;

/**
 * A parsed policy document: the policies in declaration order plus the document's version label.
 */
public record PolicyDocument(String version, List<Policy> policies) {

    public PolicyDocument {
        policies = List.copyOf(policies);
    }
}
