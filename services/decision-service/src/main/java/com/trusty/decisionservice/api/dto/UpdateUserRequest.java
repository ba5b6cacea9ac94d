package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.accesscontrol.RoleId;
import com.trusty.directory.UserUpdate;
import jakarta.validation.constraints.Email;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Body of {@code PATCH /v1/users/{userId}}. Omitted fields stay unchanged; {@code role_ids}, when
 * present, replaces the user's roles.
 */
public record UpdateUserRequest(
        @Email String email, String name, @JsonProperty("role_ids") List<String> roleIds) {

    public UserUpdate toUpdate() {
        return new UserUpdate(
                email,
                name,
                roleIds == null
                        ? null
                        : roleIds.stream().map(RoleId::of).collect(Collectors.toSet()));
    }
}
