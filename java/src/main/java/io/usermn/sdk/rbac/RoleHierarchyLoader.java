package io.usermn.sdk.rbac;

import com.fasterxml.jackson.databind.JsonNode;
import io.usermn.sdk.ConfigurationException;
import io.usermn.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link RoleHierarchy} from JSON:
 *
 * <pre>{@code
 * {"roles": [
 *   {"name": "user", "inherits": ["public"], "permissions": ["profile:view_own"]},
 *   ...
 * ]}
 * }</pre>
 */
public final class RoleHierarchyLoader {

    private RoleHierarchyLoader() {
    }

    public static RoleHierarchy fromClasspath(String resource) {
        ClassLoader loader = RoleHierarchyLoader.class.getClassLoader();
        try (InputStream stream = loader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new ConfigurationException("role hierarchy resource " + resource + " not found");
            }
            return fromJson(stream);
        } catch (IOException ex) {
            throw new ConfigurationException("read role hierarchy " + resource + ": " + ex.getMessage(), ex);
        }
    }

    public static RoleHierarchy fromFile(Path file) {
        try (InputStream stream = Files.newInputStream(file)) {
            return fromJson(stream);
        } catch (IOException ex) {
            throw new ConfigurationException("read role hierarchy " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static RoleHierarchy fromJson(InputStream stream) {
        JsonNode root;
        try {
            root = Json.mapper().readTree(stream);
        } catch (IOException ex) {
            throw new ConfigurationException("decode role hierarchy: " + ex.getMessage(), ex);
        }
        if (root == null || !root.path("roles").isArray()) {
            throw new ConfigurationException("role hierarchy must declare a roles array");
        }

        RoleHierarchy.Builder builder = RoleHierarchy.builder();
        for (JsonNode node : root.path("roles")) {
            String name = Json.text(node, "name");
            if (name == null) {
                throw new ConfigurationException("role entry without a name: " + node);
            }
            builder.role(name, Json.textArray(node, "inherits"), Json.textArray(node, "permissions"));
        }
        return builder.build();
    }
}
