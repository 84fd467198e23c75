package com.expertagent.authzservice.security;

/**
 * Thrown when a guarded route that does not allow anonymous callers receives no principal.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
