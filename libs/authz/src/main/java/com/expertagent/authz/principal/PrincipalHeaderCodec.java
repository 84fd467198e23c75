package com.expertagent.authz.principal;

import com.expertagent.authz.model.Principal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * Encodes a {@link Principal} for propagation between services in the {@value #HEADER} header.
 * <p>
 * The principal is written as JSON, then Base64-encoded so it is safe in an HTTP header value.
 * Only trusted upstream components (the session layer or the gateway) may set the header.
 */
public final class PrincipalHeaderCodec {

    public static final String HEADER = "X-Principal";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PrincipalHeaderCodec() {
        // utility class
    }

    /**
     * @throws PrincipalEncodingException if serialization fails
     */
    public static String encode(Principal principal) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(principal);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new PrincipalEncodingException("Failed to encode principal", e);
        }
    }

    /**
     * @throws PrincipalEncodingException if the value is not Base64, not JSON, or not a valid principal
     */
    public static Principal decode(String encoded) {
        try {
            byte[] json = Base64.getDecoder().decode(encoded);
            return MAPPER.readValue(json, Principal.class);
        } catch (Exception e) {
            throw new PrincipalEncodingException("Failed to decode principal header", e);
        }
    }

    /**
     * Exception thrown when principal encoding or decoding fails.
     */
    public static class PrincipalEncodingException extends RuntimeException {
        public PrincipalEncodingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
