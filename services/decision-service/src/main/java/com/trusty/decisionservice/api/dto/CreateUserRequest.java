package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.directory.NewUser;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CreateUserRequest(
        @JsonProperty("external_user_id") @NotBlank String externalUserId,
        @Email String email,
        String name) {

    public NewUser toNewUser() {
        return new NewUser(externalUserId, email, name);
    }
}
