package com.trusty.decisionservice.api.dto;

import com.trusty.accesscontrol.IsAllowedResult;

/** {@code {"result": true|false}} */
public record IsAllowedResponse(boolean result) {

    public static IsAllowedResponse from(IsAllowedResult result) {
        return new IsAllowedResponse(result.result());
    }
}
