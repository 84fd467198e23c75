package com.expertagent.authz.principal;

/**
 * The authenticated user as the session layer reports it. Any field may be null.
 *
 * @param id           user id
 * @param email        primary email
 * @param authProvider identity provider that authenticated the session (e.g., "google", "saml")
 */
public record SessionUser(String id, String email, String authProvider) {
}
