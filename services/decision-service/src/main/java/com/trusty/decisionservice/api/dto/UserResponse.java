package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.accesscontrol.RoleId;
import com.trusty.directory.User;
import java.util.List;

public record UserResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("external_user_id") String externalUserId,
        String email,
        String name,
        @JsonProperty("tenant_ids") List<String> tenantIds,
        @JsonProperty("role_ids") List<String> roleIds) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.userId(),
                user.externalUserId(),
                user.email(),
                user.name(),
                user.tenantIds().stream().sorted().toList(),
                user.roleIds().stream().map(RoleId::value).sorted().toList());
    }
}
