package com.trusty.directory;

/**
 * An admin write would break a directory rule: a duplicate external user id or role name, or a
 * role assigned outside the user's tenants.
 */
public class DirectoryConflictException extends RuntimeException {

    public DirectoryConflictException(String message) {
        super(message);
    }

    public DirectoryConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
