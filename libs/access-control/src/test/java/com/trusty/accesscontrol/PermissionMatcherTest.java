package com.trusty.accesscontrol;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PermissionMatcher}.
 *
 * <p>WHY: the matcher is where a decision is actually made. Namespace isolation, action wildcards
 * and OR-ing of permissions are each checked on their own.
 */
@DisplayName("PermissionMatcher")
class PermissionMatcherTest {

    private final PermissionMatcher matcher = new PermissionMatcher();

    private static ScopedRole role(String id, String namespace, Permission... permissions) {
        return new ScopedRole(RoleId.of(id), namespace, List.of(permissions));
    }

    private static Set<RoleId> ids(String... ids) {
        return Stream.of(ids).map(RoleId::of).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("namespace scoping")
    class NamespaceScoping {

        @Test
        @DisplayName("role in another namespace never matches, even with a matching permission")
        void otherNamespaceNeverMatches() {
            var r1 = role("r1", "billing", Permission.of("read", "invoices/*"));

            var matched =
                    matcher.match(
                            ids("r1"),
                            "support",
                            new RequestedAccess("read", "invoices/1"),
                            List.of(r1));

            assertThat(matched).isEmpty();
        }

        @Test
        @DisplayName("namespace comparison is exact")
        void namespaceIsExact() {
            var r1 = role("r1", "Billing", Permission.of("*", "**"));
            assertThat(matcher.grants(r1, "billing", new RequestedAccess("read", "x"))).isFalse();
        }
    }

    @Nested
    @DisplayName("action matching")
    class ActionMatching {

        @Test
        @DisplayName("'*' action grants any action on a matching resource")
        void wildcardActionGrantsAnyAction() {
            var admin = role("admin", "billing", Permission.of("*", "invoices/**"));

            for (String action : List.of("read", "write", "delete", "Approve")) {
                assertThat(
                                matcher.grants(
                                        admin, "billing", new RequestedAccess(action, "invoices/9")))
                        .as("action %s", action)
                        .isTrue();
            }
        }

        @Test
        @DisplayName("actions are compared case-sensitively")
        void actionsAreCaseSensitive() {
            var reader = role("r", "billing", Permission.of("read", "**"));
            assertThat(matcher.grants(reader, "billing", new RequestedAccess("READ", "a")))
                    .isFalse();
        }

        @Test
        @DisplayName("a requested action of '*' is not a wildcard")
        void requestedWildcardIsLiteral() {
            var reader = role("r", "billing", Permission.of("read", "**"));
            assertThat(matcher.grants(reader, "billing", new RequestedAccess("*", "a"))).isFalse();
        }
    }

    @Nested
    @DisplayName("role evaluation")
    class RoleEvaluation {

        @Test
        @DisplayName("a role without permissions grants nothing")
        void emptyRoleGrantsNothing() {
            var empty = role("empty", "billing");
            assertThat(matcher.grants(empty, "billing", new RequestedAccess("read", "a")))
                    .isFalse();
        }

        @Test
        @DisplayName("permissions inside a role are OR'd")
        void permissionsAreOred() {
            var clerk =
                    role(
                            "clerk",
                            "billing",
                            Permission.of("read", "invoices/*"),
                            Permission.of("write", "drafts/**"));

            assertThat(matcher.grants(clerk, "billing", new RequestedAccess("write", "drafts/a/b")))
                    .isTrue();
            assertThat(matcher.grants(clerk, "billing", new RequestedAccess("read", "invoices/1")))
                    .isTrue();
            assertThat(matcher.grants(clerk, "billing", new RequestedAccess("write", "invoices/1")))
                    .isFalse();
        }

        @Test
        @DisplayName("both action and resource must match in the same permission")
        void actionAndResourceFromSamePermission() {
            var split =
                    role(
                            "split",
                            "billing",
                            Permission.of("read", "invoices/*"),
                            Permission.of("write", "payments/*"));

            assertThat(matcher.grants(split, "billing", new RequestedAccess("write", "invoices/1")))
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("match()")
    class Match {

        @Test
        @DisplayName("returns the union of matching roles only")
        void returnsUnionOfMatchingRoles() {
            var reader = role("reader", "billing", Permission.of("read", "invoices/*"));
            var admin = role("admin", "billing", Permission.of("*", "**"));
            var payments = role("payments", "billing", Permission.of("read", "payments/*"));
            var support = role("support", "support", Permission.of("*", "**"));

            var matched =
                    matcher.match(
                            ids("reader", "admin", "payments", "support"),
                            "billing",
                            new RequestedAccess("read", "invoices/7"),
                            List.of(reader, admin, payments, support));

            assertThat(matched).containsExactlyInAnyOrder(RoleId.of("reader"), RoleId.of("admin"));
        }

        @Test
        @DisplayName("ignores candidate documents that were not requested")
        void ignoresUnrequestedCandidates() {
            var admin = role("admin", "billing", Permission.of("*", "**"));

            var matched =
                    matcher.match(
                            ids("reader"),
                            "billing",
                            new RequestedAccess("read", "invoices/7"),
                            List.of(admin));

            assertThat(matched).isEmpty();
        }

        @Test
        @DisplayName("empty role set matches nothing")
        void emptyRoleSet() {
            var admin = role("admin", "billing", Permission.of("*", "**"));
            assertThat(
                            matcher.match(
                                    Set.of(),
                                    "billing",
                                    new RequestedAccess("read", "a"),
                                    List.of(admin)))
                    .isEmpty();
        }
    }
}
