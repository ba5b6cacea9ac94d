package com.trusty.directory;

/** A tenant, user or role referenced by an admin operation does not exist. */
public class DirectoryEntityNotFoundException extends RuntimeException {

    private final String entityType;
    private final String entityId;

    public DirectoryEntityNotFoundException(String entityType, String entityId) {
        super("%s '%s' not found".formatted(entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }
}
