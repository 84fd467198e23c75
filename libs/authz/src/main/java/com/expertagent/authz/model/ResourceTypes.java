package com.expertagent.authz.model;

import java.util.List;

/**
 * Resource type names used by platform routes.
 */
public final class ResourceTypes {

    public static final String AGENT = "Agent";
    public static final String ORG = "Org";
    public static final String FILE = "File";
    public static final String SESSION = "Session";
    public static final String MESSAGE = "Message";
    public static final String USER = "User";
    public static final String INVITE = "Invite";
    public static final String REPORT = "Report";
    public static final String POLICY = "Policy";

    private static final List<String> ALL =
            List.of(AGENT, ORG, FILE, SESSION, MESSAGE, USER, INVITE, REPORT, POLICY);

    private ResourceTypes() {
        // constants
    }

    public static List<String> all() {
        return ALL;
    }
}
