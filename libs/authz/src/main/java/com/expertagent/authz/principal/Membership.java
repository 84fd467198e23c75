package com.expertagent.authz.principal;

/**
 * A user's membership in one organization.
 *
 * @param orgId organization id
 * @param role  role name as stored (e.g., "owner", "billing_manager")
 */
public record Membership(String orgId, String role) {
}
