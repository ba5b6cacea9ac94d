package com.trusty.accesscontrol;

/**
 * The question being asked of the decision engine: may this actor perform this action on this
 * resource within this namespace?
 *
 * <p>No validation happens here. {@link IsAllowedRequestValidator} reports every problem at once
 * so callers get a complete error list instead of the first failure.
 *
 * @param externalUserId actor id issued by the upstream identity system (already authenticated)
 * @param namespace      scoping label; only roles in the same namespace take part in the decision
 * @param action         operation name, compared case-sensitively
 * @param resource       {@code /}-delimited resource path
 */
public record IsAllowedRequest(
        String externalUserId, String namespace, String action, String resource) {}
