package io.usermn.sdk.rbac;

import io.usermn.sdk.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoleHierarchyLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsCustomHierarchyFromFile() throws Exception {
        Path file = tempDir.resolve("roles.json");
        Files.writeString(file, "{\"roles\":["
            + "{\"name\":\"viewer\",\"permissions\":[\"reports:view\"]},"
            + "{\"name\":\"editor\",\"inherits\":[\"viewer\"],\"permissions\":[\"reports:edit\"]}"
            + "]}");

        RoleHierarchy hierarchy = RoleHierarchyLoader.fromFile(file);
        PermissionEngine engine = new PermissionEngine(hierarchy);

        assertEquals(Set.of(Permission.of("reports:view"), Permission.of("reports:edit")),
            engine.effectivePermissions(Set.of(Role.of("editor"))));
    }

    @Test
    void reportsCyclesInJson() {
        String json = "{\"roles\":["
            + "{\"name\":\"a\",\"inherits\":[\"b\"]},"
            + "{\"name\":\"b\",\"inherits\":[\"a\"]}"
            + "]}";

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> RoleHierarchyLoader.fromJson(stream(json)));
        assertTrue(ex.getMessage().contains("a -> b -> a") || ex.getMessage().contains("b -> a -> b"), ex.getMessage());
    }

    @Test
    void rejectsStructurallyInvalidDocuments() {
        assertThrows(ConfigurationException.class, () -> RoleHierarchyLoader.fromJson(stream("{\"roles\":{}}")));
        assertThrows(ConfigurationException.class, () -> RoleHierarchyLoader.fromJson(stream("not json")));
        assertThrows(ConfigurationException.class, () -> RoleHierarchyLoader.fromJson(stream("{\"roles\":[{}]}")));
        assertThrows(ConfigurationException.class, () -> RoleHierarchyLoader.fromClasspath("missing/roles.json"));
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
