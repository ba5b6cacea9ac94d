package com.trusty.accesscontrol;

/**
 * Base type for errors surfaced by the decision engine instead of a decision.
 *
 * <p>WHY unchecked: neither subtype is something the engine's direct caller can recover from in
 * place. Invalid input is a client bug and a store outage is for the transport layer to map to a
 * 5xx. What matters is that neither is ever turned into {@link IsAllowedResult#DENIED}.
 */
public abstract class AccessControlException extends RuntimeException {

    protected AccessControlException(String message) {
        super(message);
    }

    protected AccessControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
