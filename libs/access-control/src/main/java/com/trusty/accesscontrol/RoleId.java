package com.trusty.accesscontrol;

/**
 * Identifier of a role in the directory.
 *
 * <p>WHY a record instead of a bare String: role ids travel through sets and across the store
 * boundary next to user ids and tenant ids, which are strings too. A dedicated type keeps them
 * from being mixed up.
 *
 * @param value the opaque role id assigned by the directory
 */
public record RoleId(String value) {

    public RoleId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role id must not be null or blank");
        }
    }

    public static RoleId of(String value) {
        return new RoleId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
