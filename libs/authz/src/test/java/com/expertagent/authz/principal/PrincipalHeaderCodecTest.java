package com.expertagent.authz.principal;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.PrincipalType;
import com.expertagent.authz.model.Role;
import com.expertagent.authz.testing.TestPrincipals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PrincipalHeaderCodec")
class PrincipalHeaderCodecTest {

    @Test
    @DisplayName("decode(encode(p)) restores type, id and attributes")
    void roundTrip() {
        var original = TestPrincipals.user("u1", Map.of("org-1", Role.ADMIN));

        var decoded = PrincipalHeaderCodec.decode(PrincipalHeaderCodec.encode(original));

        assertThat(decoded.type()).isEqualTo(PrincipalType.USER);
        assertThat(decoded.id()).isEqualTo("u1");
        assertThat(decoded.attributes().get(Principal.ATTR_ROLES)).isEqualTo(Map.of("org-1", "ADMIN"));
        assertThat(decoded.attributes().get(Principal.ATTR_MEMBERSHIP_ORG_IDS)).isEqualTo(List.of("org-1"));
    }

    @Test
    @DisplayName("the encoded value is Base64 JSON")
    void base64Json() {
        var encoded = PrincipalHeaderCodec.encode(Principal.service("cloud-scheduler"));

        var json = new String(Base64.getDecoder().decode(encoded));
        assertThat(json).contains("\"id\":\"cloud-scheduler\"").contains("\"type\":\"SERVICE\"");
    }

    @Test
    @DisplayName("garbage input fails with PrincipalEncodingException")
    void garbage() {
        assertThatThrownBy(() -> PrincipalHeaderCodec.decode("%%%not-base64"))
                .isInstanceOf(PrincipalHeaderCodec.PrincipalEncodingException.class);
        var notAPrincipal = Base64.getEncoder().encodeToString("{\"type\":\"USER\"}".getBytes());
        assertThatThrownBy(() -> PrincipalHeaderCodec.decode(notAPrincipal))
                .isInstanceOf(PrincipalHeaderCodec.PrincipalEncodingException.class);
    }
}
