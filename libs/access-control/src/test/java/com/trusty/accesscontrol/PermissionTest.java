package com.trusty.accesscontrol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Permission")
class PermissionTest {

    @Test
    @DisplayName("validates the resource pattern at construction")
    void validatesPattern() {
        assertThatThrownBy(() -> Permission.of("read", "a/**/b"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Permission.of("read", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects a blank action")
    void rejectsBlankAction() {
        assertThatThrownBy(() -> Permission.of(" ", "orders/*"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("action");
    }

    @Test
    @DisplayName("exposes the parsed pattern")
    void exposesParsedPattern() {
        assertThat(Permission.of("*", "orders/**").resourcePattern().matchesRemaining()).isTrue();
    }
}
