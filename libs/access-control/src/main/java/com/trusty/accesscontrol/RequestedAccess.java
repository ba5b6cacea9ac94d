package com.trusty.accesscontrol;

/**
 * The action/resource half of an access question, as handed to the directory store for matching.
 *
 * @param action   operation being attempted (e.g. "read")
 * @param resource {@code /}-delimited resource path (e.g. "invoices/123")
 */
public record RequestedAccess(String action, String resource) {

    public static RequestedAccess of(IsAllowedRequest request) {
        return new RequestedAccess(request.action(), request.resource());
    }
}
