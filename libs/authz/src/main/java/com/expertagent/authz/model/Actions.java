package com.expertagent.authz.model;

import java.util.List;

/**
 * Registry of the action ids used by platform routes. Add the id here when a new route is
 * introduced, then grant it in the policy document.
 */
public final class Actions {

    // Agents
    public static final String LIST_AGENTS = "ListAgents";
    public static final String GET_AGENT = "GetAgent";
    public static final String QUERY_AGENT = "QueryAgent";

    // Organizations
    public static final String CREATE_ORG = "CreateOrg";
    public static final String GET_ORG = "GetOrg";
    public static final String UPDATE_ORG = "UpdateOrg";
    public static final String DELETE_ORG = "DeleteOrg";
    public static final String INVITE_MEMBER = "InviteMember";
    public static final String REMOVE_MEMBER = "RemoveMember";
    public static final String UPDATE_MEMBER_ROLE = "UpdateMemberRole";
    public static final String CONFIGURE_SSO = "ConfigureSSO";
    public static final String VERIFY_DOMAIN = "VerifyDomain";
    public static final String MANAGE_CONTEXT_FILES = "ManageContextFiles";
    public static final String SSO_CALLBACK = "SSOCallback";

    // Users
    public static final String GET_PROFILE = "GetProfile";
    public static final String UPDATE_PROFILE = "UpdateProfile";
    public static final String GET_MEMBERSHIPS = "GetMemberships";

    // Sessions
    public static final String CREATE_SESSION = "CreateSession";
    public static final String GET_SESSION = "GetSession";
    public static final String LIST_SESSIONS = "ListSessions";
    public static final String DELETE_SESSION = "DeleteSession";

    // Files
    public static final String UPLOAD_FILE = "UploadFile";
    public static final String GET_FILE = "GetFile";
    public static final String DELETE_FILE = "DeleteFile";
    public static final String LIST_FILES = "ListFiles";

    // Billing
    public static final String VIEW_BILLING = "ViewBilling";
    public static final String MANAGE_BILLING = "ManageBilling";
    public static final String VIEW_USAGE = "ViewUsage";
    public static final String TOP_UP = "TopUp";

    // Administration
    public static final String VIEW_AUDIT_LOG = "ViewAuditLog";
    public static final String MANAGE_SETTINGS = "ManageSettings";
    public static final String VIEW_POLICIES = "ViewPolicies";

    // System
    public static final String HEALTH_CHECK = "HealthCheck";
    public static final String TRIGGER_SUMMARIZATION = "TriggerSummarization";

    private static final List<String> ALL = List.of(
            LIST_AGENTS, GET_AGENT, QUERY_AGENT,
            CREATE_ORG, GET_ORG, UPDATE_ORG, DELETE_ORG, INVITE_MEMBER, REMOVE_MEMBER,
            UPDATE_MEMBER_ROLE, CONFIGURE_SSO, VERIFY_DOMAIN, MANAGE_CONTEXT_FILES, SSO_CALLBACK,
            GET_PROFILE, UPDATE_PROFILE, GET_MEMBERSHIPS,
            CREATE_SESSION, GET_SESSION, LIST_SESSIONS, DELETE_SESSION,
            UPLOAD_FILE, GET_FILE, DELETE_FILE, LIST_FILES,
            VIEW_BILLING, MANAGE_BILLING, VIEW_USAGE, TOP_UP,
            VIEW_AUDIT_LOG, MANAGE_SETTINGS, VIEW_POLICIES,
            HEALTH_CHECK, TRIGGER_SUMMARIZATION);

    private Actions() {
        // constants
    }

    /** Every registered action id, in declaration order. */
    public static List<String> all() {
        return ALL;
    }

    public static boolean isKnown(String actionId) {
        return ALL.contains(actionId);
    }
}
