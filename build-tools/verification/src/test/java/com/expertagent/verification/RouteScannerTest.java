package com.expertagent.verification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RouteScanner")
class RouteScannerTest {

    @Test
    @DisplayName("ignores classes that are not REST controllers")
    void ignoresNonControllers() {
        var lines = List.of(
                "@Component",
                "public class Helper {",
                "    @GetMapping(\"/x\")",
                "    public String x() { return \"\"; }",
                "}");

        assertThat(RouteScanner.scan("Helper", lines)).isEmpty();
    }

    @Test
    @DisplayName("treats class-level @RequestMapping as a prefix, not a handler")
    void classLevelMapping() {
        var lines = List.of(
                "@RestController",
                "@RequestMapping(\"/api/v1/orgs\")",
                "public class OrgController {",
                "    public OrgController(Authz a) {",
                "    }",
                "",
                "    @GetMapping(\"/{orgId}\")",
                "    public Org get(@PathVariable String orgId) {",
                "        return null;",
                "    }",
                "}");

        var handlers = RouteScanner.scan("OrgController", lines);

        assertThat(handlers).singleElement().satisfies(h -> {
            assertThat(h.method()).isEqualTo("get");
            assertThat(h.mapping()).isEqualTo("@GetMapping(\"/{orgId}\")");
            assertThat(h.guarded()).isFalse();
            assertThat(h.callsAuthorizer()).isFalse();
        });
    }

    @Test
    @DisplayName("recognises a guard annotation spanning several lines")
    void multiLineGuard() {
        var lines = List.of(
                "@RestController",
                "public class OrgController {",
                "    /** Deletes an organization. */",
                "    @DeleteMapping(\"/orgs/{orgId}\")",
                "    @RequiresAuthorization(",
                "            action = Actions.DELETE_ORG,",
                "            resourceType = ResourceTypes.ORG,",
                "            resourceIdVariable = \"orgId\")",
                "    public void delete(@PathVariable String orgId) {",
                "    }",
                "}");

        assertThat(RouteScanner.scan("OrgController", lines))
                .singleElement()
                .satisfies(h -> assertThat(h.guarded()).isTrue());
    }

    @Test
    @DisplayName("notices controllers that call the authorizer directly")
    void authorizerCall() {
        var lines = List.of(
                "@RestController",
                "public class FileController {",
                "    @PostMapping(\"/files\")",
                "    public void upload() {",
                "        authorizer.require(request);",
                "    }",
                "}");

        assertThat(RouteScanner.scan("FileController", lines))
                .singleElement()
                .satisfies(h -> assertThat(h.callsAuthorizer()).isTrue());
    }

    @Test
    @DisplayName("does not attribute annotations across non-handler members")
    void pendingAnnotationsReset() {
        var lines = List.of(
                "@RestController",
                "public class X {",
                "    @Autowired",
                "    private Service service;",
                "    public record Body(String a) {",
                "    }",
                "}");

        assertThat(RouteScanner.scan("X", lines)).isEmpty();
    }
}
