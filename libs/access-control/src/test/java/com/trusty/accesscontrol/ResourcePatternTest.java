package com.trusty.accesscontrol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link ResourcePattern}, the segment grammar behind every resource match.
 */
@DisplayName("ResourcePattern")
class ResourcePatternTest {

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("accepts literal, single-segment and trailing wildcards")
        void acceptsValidPatterns() {
            assertThat(ResourcePattern.parse("orders/42").matchesRemaining()).isFalse();
            assertThat(ResourcePattern.parse("orders/*").matchesRemaining()).isFalse();
            assertThat(ResourcePattern.parse("orders/**").matchesRemaining()).isTrue();
            assertThat(ResourcePattern.parse("**").matchesRemaining()).isTrue();
        }

        @Test
        @DisplayName("rejects '**' before the final segment")
        void rejectsInnerMultiSegmentWildcard() {
            assertThatThrownBy(() -> ResourcePattern.parse("orders/**/items"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("orders/**/items");
            assertThatThrownBy(() -> ResourcePattern.parse("**/**"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects null")
        void rejectsNull() {
            assertThatThrownBy(() -> ResourcePattern.parse(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("keeps the pattern text")
        void keepsPatternText() {
            assertThat(ResourcePattern.parse("tenants/*/users").pattern())
                    .isEqualTo("tenants/*/users");
            assertThat(ResourcePattern.parse("a/*")).isEqualTo(ResourcePattern.parse("a/*"));
        }
    }

    @Nested
    @DisplayName("matches()")
    class Matches {

        @ParameterizedTest(name = "''{0}'' vs ''{1}'' -> {2}")
        @CsvSource({
            "orders/42,       orders/42,       true",
            "orders/42,       orders/43,       false",
            "orders/*,        orders/42,       true",
            "orders/*,        orders/42/items, false",
            "orders/*,        orders,          false",
            "orders/**,       orders/42,       true",
            "orders/**,       orders/42/items, true",
            "orders/**,       orders,          true",
            "orders/**,       invoices/42,     false",
            "*/items,         orders/items,    true",
            "*/items,         orders/lines,    false",
            "tenants/*/users, tenants/t1/users, true",
            "ord*,            orders,          false",
            "ord*,            ord*,            true",
            "**,              anything/at/all, true",
        })
        void matchesSegmentWise(String pattern, String resource, boolean expected) {
            assertThat(ResourcePattern.parse(pattern).matches(resource)).isEqualTo(expected);
        }

        @Test
        @DisplayName("'**' alone matches the empty path")
        void bareTrailingWildcardMatchesEmptyPath() {
            assertThat(ResourcePattern.parse("**").matches("")).isTrue();
        }

        @Test
        @DisplayName("literal segments compare case-sensitively")
        void literalsAreCaseSensitive() {
            assertThat(ResourcePattern.parse("Orders/*").matches("orders/1")).isFalse();
        }

        @Test
        @DisplayName("a null resource never matches")
        void nullResourceNeverMatches() {
            assertThat(ResourcePattern.parse("**").matches(null)).isFalse();
        }

        @Test
        @DisplayName("empty segments are literals, not skipped")
        void emptySegmentsAreLiterals() {
            assertThat(ResourcePattern.parse("a/*/c").matches("a//c")).isTrue();
            assertThat(ResourcePattern.parse("a/c").matches("a//c")).isFalse();
            assertThat(ResourcePattern.parse("orders/*").matches("orders/")).isTrue();
        }
    }
}
