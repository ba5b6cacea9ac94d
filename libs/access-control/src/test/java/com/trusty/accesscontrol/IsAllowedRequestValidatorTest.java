package com.trusty.accesscontrol;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link IsAllowedRequestValidator}.
 *
 * <p>WHY: validation runs before any store access, so every field it misses costs a wasted
 * round trip at best and an ambiguous decision at worst.
 */
@DisplayName("IsAllowedRequestValidator")
class IsAllowedRequestValidatorTest {

    @Nested
    @DisplayName("valid requests")
    class Valid {

        @Test
        @DisplayName("fully populated request passes")
        void fullyPopulated() {
            var result =
                    IsAllowedRequestValidator.validate(
                            new IsAllowedRequest("u1", "billing", "read", "invoices/1"));
            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("request without namespace passes when one is supplied separately")
        void namespaceSuppliedSeparately() {
            var result =
                    IsAllowedRequestValidator.validate(
                            new IsAllowedRequest("u1", null, "read", "invoices/1"), "billing");
            assertThat(result.valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("invalid requests")
    class Invalid {

        @Test
        @DisplayName("blank external_user_id fails")
        void blankUser() {
            var result =
                    IsAllowedRequestValidator.validate(
                            new IsAllowedRequest("  ", "billing", "read", "invoices/1"));
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(1).allMatch(e -> e.contains("external_user_id"));
        }

        @Test
        @DisplayName("missing namespace fails")
        void missingNamespace() {
            var result =
                    IsAllowedRequestValidator.validate(
                            new IsAllowedRequest("u1", "", "read", "invoices/1"));
            assertThat(result.errors()).anyMatch(e -> e.contains("namespace"));
        }

        @Test
        @DisplayName("missing action and resource both fail")
        void missingActionAndResource() {
            var result =
                    IsAllowedRequestValidator.validate(
                            new IsAllowedRequest("u1", "billing", null, ""));
            assertThat(result.errors())
                    .hasSize(2)
                    .anyMatch(e -> e.contains("action"))
                    .anyMatch(e -> e.contains("resource"));
        }

        @Test
        @DisplayName("mismatched namespaces fail")
        void mismatchedNamespaces() {
            var result =
                    IsAllowedRequestValidator.validate(
                            new IsAllowedRequest("u1", "billing", "read", "invoices/1"), "support");
            assertThat(result.valid()).isFalse();
        }

        @Test
        @DisplayName("null request fails")
        void nullRequest() {
            assertThat(IsAllowedRequestValidator.validate(null).valid()).isFalse();
        }
    }
}
