package com.trusty.decisionservice.api;

import com.trusty.accesscontrol.RoleId;
import com.trusty.decisionservice.api.dto.CreateRoleRequest;
import com.trusty.decisionservice.api.dto.RoleResponse;
import com.trusty.decisionservice.api.dto.UpdateRoleRequest;
import com.trusty.directory.DirectoryEntityNotFoundException;
import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.Role;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
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

/**
 * Role administration. Permission patterns are parsed on write, so a stored role always holds
 * patterns the matcher accepts.
 */
@RestController
@RequestMapping("/v1/roles")
public class RoleController {

    private final DirectoryRepository directory;

    public RoleController(DirectoryRepository directory) {
        this.directory = directory;
    }

    @PostMapping
    public ResponseEntity<RoleResponse> create(@Valid @RequestBody CreateRoleRequest body) {
        Role role = directory.createRole(body.toNewRole());
        return ResponseEntity.created(URI.create("/v1/roles/" + role.roleId().value()))
                .body(RoleResponse.from(role));
    }

    @PatchMapping("/{roleId}")
    public RoleResponse update(
            @PathVariable String roleId, @Valid @RequestBody UpdateRoleRequest body) {
        return RoleResponse.from(directory.updateRole(RoleId.of(roleId), body.toUpdate()));
    }

    @GetMapping("/{roleId}")
    public RoleResponse get(@PathVariable String roleId) {
        return directory
                .findRole(RoleId.of(roleId))
                .map(RoleResponse::from)
                .orElseThrow(() -> new DirectoryEntityNotFoundException("role", roleId));
    }

    @GetMapping
    public List<RoleResponse> list(
            @RequestParam(required = false) String tenantId,
            @RequestParam(required = false) String namespace) {
        return directory.listRoles(tenantId, namespace).stream().map(RoleResponse::from).toList();
    }

    @DeleteMapping("/{roleId}")
    public ResponseEntity<Void> delete(@PathVariable String roleId) {
        directory.deleteRole(RoleId.of(roleId));
        return ResponseEntity.noContent().build();
    }
}
