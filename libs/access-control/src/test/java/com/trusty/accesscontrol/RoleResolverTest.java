package com.trusty.accesscontrol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.trusty.accesscontrol.testing.FakeDirectoryStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RoleResolver")
class RoleResolverTest {

    @Test
    @DisplayName("returns the deduplicated role ids of a user")
    void returnsRoleIds() {
        var store = new FakeDirectoryStore().assign("u1", "r1", "r2", "r1").assign("u1", "r2");

        assertThat(new RoleResolver(store).resolve("u1"))
                .containsExactlyInAnyOrder(RoleId.of("r1"), RoleId.of("r2"));
    }

    @Test
    @DisplayName("includes roles from every namespace")
    void namespaceIndependent() {
        var store =
                new FakeDirectoryStore()
                        .withRole("billing-reader", "billing", Permission.of("read", "**"))
                        .withRole("support-reader", "support", Permission.of("read", "**"))
                        .assign("u1", "billing-reader", "support-reader");

        assertThat(new RoleResolver(store).resolve("u1")).hasSize(2);
    }

    @Test
    @DisplayName("unknown user resolves to the empty set")
    void unknownUserIsEmpty() {
        assertThat(new RoleResolver(new FakeDirectoryStore()).resolve("ghost")).isEmpty();
    }

    @Test
    @DisplayName("store failure propagates instead of resolving to empty")
    void failurePropagates() {
        var store = new FakeDirectoryStore().assign("u1", "r1").failRoleLookup("socket closed");

        assertThatThrownBy(() -> new RoleResolver(store).resolve("u1"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessage("socket closed");
    }

    @Test
    @DisplayName("rejects a null store")
    void rejectsNullStore() {
        assertThatThrownBy(() -> new RoleResolver(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
