package com.trusty.decisionservice.api;

import com.trusty.decisionservice.api.dto.TenantRequest;
import com.trusty.decisionservice.api.dto.TenantResponse;
import com.trusty.directory.DirectoryEntityNotFoundException;
import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.NewTenant;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tenants")
public class TenantController {

    private final DirectoryRepository directory;

    public TenantController(DirectoryRepository directory) {
        this.directory = directory;
    }

    @PostMapping
    public ResponseEntity<TenantResponse> create(@Valid @RequestBody TenantRequest body) {
        var tenant = directory.createTenant(new NewTenant(body.name()));
        return ResponseEntity.created(URI.create("/v1/tenants/" + tenant.tenantId()))
                .body(TenantResponse.from(tenant));
    }

    @PatchMapping("/{tenantId}")
    public TenantResponse rename(
            @PathVariable String tenantId, @Valid @RequestBody TenantRequest body) {
        return TenantResponse.from(directory.renameTenant(tenantId, body.name()));
    }

    @PatchMapping("/{tenantId}/subscribe/{product}")
    public TenantResponse subscribe(@PathVariable String tenantId, @PathVariable String product) {
        return TenantResponse.from(directory.subscribeTenant(tenantId, product));
    }

    @GetMapping("/{tenantId}")
    public TenantResponse get(@PathVariable String tenantId) {
        return directory
                .findTenant(tenantId)
                .map(TenantResponse::from)
                .orElseThrow(() -> new DirectoryEntityNotFoundException("tenant", tenantId));
    }

    @GetMapping
    public List<TenantResponse> list() {
        return directory.listTenants().stream().map(TenantResponse::from).toList();
    }

    @DeleteMapping("/{tenantId}")
    public ResponseEntity<Void> delete(@PathVariable String tenantId) {
        directory.deleteTenant(tenantId);
        return ResponseEntity.noContent().build();
    }
}
