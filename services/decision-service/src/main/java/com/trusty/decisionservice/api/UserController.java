package com.trusty.decisionservice.api;

import com.trusty.decisionservice.api.dto.CreateUserRequest;
import com.trusty.decisionservice.api.dto.RoleResponse;
import com.trusty.decisionservice.api.dto.TenantResponse;
import com.trusty.decisionservice.api.dto.UpdateUserRequest;
import com.trusty.decisionservice.api.dto.UserInfoResponse;
import com.trusty.decisionservice.api.dto.UserResponse;
import com.trusty.directory.DirectoryEntityNotFoundException;
import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.User;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class UserController {

    private final DirectoryRepository directory;

    public UserController(DirectoryRepository directory) {
        this.directory = directory;
    }

    @PostMapping("/users")
    public ResponseEntity<UserResponse> create(@Valid @RequestBody CreateUserRequest body) {
        User user = directory.createUser(body.toNewUser());
        return ResponseEntity.created(URI.create("/v1/users/" + user.userId()))
                .body(UserResponse.from(user));
    }

    @PatchMapping("/users/{userId}")
    public UserResponse update(
            @PathVariable String userId, @Valid @RequestBody UpdateUserRequest body) {
        return UserResponse.from(directory.updateUser(userId, body.toUpdate()));
    }

    @PatchMapping("/users/{userId}/associate/{tenantId}")
    public UserResponse associate(@PathVariable String userId, @PathVariable String tenantId) {
        return UserResponse.from(directory.associateUser(userId, tenantId));
    }

    @GetMapping("/users/{userId}")
    public UserResponse get(@PathVariable String userId) {
        return UserResponse.from(requireUser(directory.findUser(userId), userId));
    }

    @GetMapping("/users")
    public List<UserResponse> list(@RequestParam(required = false) String tenantId) {
        return directory.listUsers(tenantId).stream().map(UserResponse::from).toList();
    }

    @DeleteMapping("/users/{userId}")
    public ResponseEntity<Void> delete(@PathVariable String userId) {
        directory.deleteUser(userId);
        return ResponseEntity.noContent().build();
    }

    /** The user behind an external id, with tenants and roles expanded. */
    @GetMapping("/userinfo/{externalUserId}")
    public UserInfoResponse userInfo(@PathVariable String externalUserId) {
        User user = requireUser(directory.findUserByExternalId(externalUserId), externalUserId);
        List<TenantResponse> tenants =
                user.tenantIds().stream()
                        .sorted()
                        .map(directory::findTenant)
                        .flatMap(Optional::stream)
                        .map(TenantResponse::from)
                        .toList();
        List<RoleResponse> roles =
                user.roleIds().stream()
                        .map(directory::findRole)
                        .flatMap(Optional::stream)
                        .map(RoleResponse::from)
                        .sorted((a, b) -> a.roleId().compareTo(b.roleId()))
                        .toList();
        return UserInfoResponse.from(user, tenants, roles);
    }

    private static User requireUser(Optional<User> user, String id) {
        return user.orElseThrow(() -> new DirectoryEntityNotFoundException("user", id));
    }
}
