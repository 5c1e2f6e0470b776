package io.usermn.sdk.rbac;

import java.util.Arrays;

/**
 * Permission of the form {@code resource:action}, or a pattern whose final segment is {@code *}.
 *
 * <p>Matching is case-sensitive and segment based: a pattern only matches permissions with the same number of
 * segments, so {@code users:*} matches {@code users:delete} but not {@code users:roles:delete}. The only pattern
 * allowed to carry a wildcard outside the final segment is the global {@code *:*}. Multi-level patterns such as
 * {@code users:*:*} are rejected.</p>
 */
public final class Permission implements Comparable<Permission> {

    public static final String WILDCARD = "*";
    public static final Permission ALL = new Permission("*:*");

    private final String value;
    private final String[] segments;
    private final boolean pattern;

    private Permission(String value) {
        this.value = value;
        this.segments = value.split(":", -1);
        this.pattern = Arrays.asList(segments).contains(WILDCARD);
    }

    /**
     * @throws IllegalArgumentException when the value is blank, has an empty segment, or places a wildcard anywhere
     *                                  but the final segment (other than {@code *:*})
     */
    public static Permission of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("permission is required");
        }
        String trimmed = value.trim();
        if (ALL.value.equals(trimmed)) {
            return ALL;
        }
        String[] parts = trimmed.split(":", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty()) {
                throw new IllegalArgumentException("permission " + trimmed + " has an empty segment");
            }
            if (part.contains(WILDCARD) && (!WILDCARD.equals(part) || i != parts.length - 1)) {
                throw new IllegalArgumentException(
                    "permission " + trimmed + " may only use a wildcard as its final segment");
            }
        }
        return new Permission(trimmed);
    }

    public String value() {
        return value;
    }

    public boolean isPattern() {
        return pattern;
    }

    public String resource() {
        return segments[0];
    }

    /**
     * @return whether holding this permission satisfies a check for {@code required}
     */
    public boolean implies(Permission required) {
        if (value.equals(required.value)) {
            return true;
        }
        if (!pattern || segments.length != required.segments.length) {
            return false;
        }
        for (int i = 0; i < segments.length; i++) {
            if (!WILDCARD.equals(segments[i]) && !segments[i].equals(required.segments[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(Permission other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Permission)) {
            return false;
        }
        return value.equals(((Permission) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
