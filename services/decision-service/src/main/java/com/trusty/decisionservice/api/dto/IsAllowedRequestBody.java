package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.accesscontrol.IsAllowedRequest;

/**
 * Body of {@code POST /v1/isallowed}. Fields are not bean-validated here; the engine reports every
 * missing field in one {@code 400}.
 */
public record IsAllowedRequestBody(
        @JsonProperty("external_user_id") String externalUserId,
        String namespace,
        String action,
        String resource) {

    public IsAllowedRequest toRequest() {
        return new IsAllowedRequest(externalUserId, namespace, action, resource);
    }
}
