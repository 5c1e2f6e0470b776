package io.usermn.sdk.rbac;

/**
 * Role identifier. Names are case-sensitive; the shipped roles are exposed as constants and custom roles are created
 * with {@link #of(String)}.
 */
public record Role(String name) implements Comparable<Role> {

    public static final Role PUBLIC = new Role("public");
    public static final Role USER = new Role("user");
    public static final Role EMPLOYEE = new Role("employee");
    public static final Role MANAGER = new Role("manager");
    public static final Role ADMIN = new Role("admin");
    public static final Role SUPER_ADMIN = new Role("super_admin");
    public static final Role AUDITOR = new Role("auditor");

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("role name is required");
        }
        name = name.trim();
    }

    public static Role of(String name) {
        return new Role(name);
    }

    @Override
    public int compareTo(Role other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
