package com.expertagent.authz.principal;

import java.util.List;

/**
 * Source of organization memberships, typically backed by the platform database.
 */
@FunctionalInterface
public interface MembershipLookup {

    /**
     * @return the user's memberships; empty when the user belongs to no organization
     */
    List<Membership> membershipsFor(String userId);
}
