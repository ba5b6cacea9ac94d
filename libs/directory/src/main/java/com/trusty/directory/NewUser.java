package com.trusty.directory;

/**
 * Input for {@link DirectoryRepository#createUser(NewUser)}. Tenants and roles are attached
 * afterwards.
 */
public record NewUser(String externalUserId, String email, String name) {

    public NewUser {
        if (externalUserId == null || externalUserId.isBlank()) {
            throw new IllegalArgumentException("externalUserId must not be null or blank");
        }
    }
}
