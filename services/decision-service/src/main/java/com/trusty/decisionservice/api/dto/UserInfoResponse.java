package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.directory.User;
import java.util.List;

/** A user with its tenants and roles expanded, as returned by {@code GET /v1/userinfo/{id}}. */
public record UserInfoResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("external_user_id") String externalUserId,
        String email,
        String name,
        List<TenantResponse> tenants,
        List<RoleResponse> roles) {

    public static UserInfoResponse from(
            User user, List<TenantResponse> tenants, List<RoleResponse> roles) {
        return new UserInfoResponse(
                user.userId(), user.externalUserId(), user.email(), user.name(), tenants, roles);
    }
}
