package com.trusty.directory;

/** Input for {@link DirectoryRepository#createTenant(NewTenant)}. */
public record NewTenant(String name) {

    public NewTenant {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }
}
