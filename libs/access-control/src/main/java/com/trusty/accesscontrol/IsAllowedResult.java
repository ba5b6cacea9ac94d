package com.trusty.accesscontrol;

/**
 * Outcome of a decision. Deliberately carries nothing but the boolean: no reason code and no
 * matched role is surfaced to callers.
 *
 * @param result {@code true} if at least one of the actor's roles grants the request
 */
public record IsAllowedResult(boolean result) {

    public static final IsAllowedResult ALLOWED = new IsAllowedResult(true);
    public static final IsAllowedResult DENIED = new IsAllowedResult(false);

    public static IsAllowedResult of(boolean allowed) {
        return allowed ? ALLOWED : DENIED;
    }
}
