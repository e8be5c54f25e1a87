package com.stratum.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SpecResolver}: latest-version derivation and the choice of the next step for
 * every combination of database state and available scripts.
 */
@DisplayName("SpecResolver")
class SpecResolverTest {

    private final SpecResolver resolver = new SpecResolver();

    private static final SchemaSpec FULL = SchemaSpec.builder()
            .latestVersion(3)
            .install("CREATE TABLE t1 (id INT)")
            .installAtVersion(1, "CREATE TABLE t0 (id INT)")
            .installAtVersion(2, "CREATE TABLE t0 (id INT)", "CREATE TABLE t1 (id INT)")
            .upgradeToVersion(1, "CREATE TABLE t0 (id INT)")
            .upgradeToVersion(2, "CREATE TABLE t1 (id INT)")
            .upgradeToVersion(3, "DROP TABLE t0")
            .build();

    @Nested
    @DisplayName("resolveLatestVersion")
    class LatestVersion {

        @Test
        @DisplayName("uses the declared latest version")
        void usesDeclared() {
            assertThat(resolver.resolveLatestVersion(FULL)).isEqualTo(3);
        }

        @Test
        @DisplayName("falls back to the highest upgrade step")
        void usesHighestUpgrade() {
            var spec = SchemaSpec.builder()
                    .upgradeToVersion(2, "x")
                    .upgradeToVersion(7, "y")
                    .build();

            assertThat(resolver.resolveLatestVersion(spec)).isEqualTo(7);
        }

        @Test
        @DisplayName("defaults to 1 without declaration or upgrade steps")
        void defaultsToOne() {
            var spec = SchemaSpec.builder().install("CREATE TABLE t1 (id INT)").build();

            assertThat(resolver.resolveLatestVersion(spec)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("resolveStep on a virgin database")
    class VirginDatabase {

        @Test
        @DisplayName("bootstrap override installs at the requested version")
        void bootstrapOverride() throws Exception {
            MigrationStep step = resolver
                    .resolveStep(FULL, SchemaState.virgin(), OptionalInt.of(2))
                    .orElseThrow();

            assertThat(step.kind()).isEqualTo(StepKind.INSTALL_AT_VERSION);
            assertThat(step.targetVersion()).isEqualTo(2);
            assertThat(step.statements()).hasSize(2);
            assertThat(step.createBookkeepingTable()).isTrue();
        }

        @Test
        @DisplayName("install script goes straight to the latest version")
        void installToLatest() throws Exception {
            MigrationStep step = resolver
                    .resolveStep(FULL, SchemaState.virgin(), OptionalInt.empty())
                    .orElseThrow();

            assertThat(step.kind()).isEqualTo(StepKind.INSTALL);
            assertThat(step.fromVersion()).isZero();
            assertThat(step.targetVersion()).isEqualTo(3);
            assertThat(step.statements()).containsExactly("CREATE TABLE t1 (id INT)");
            assertThat(step.createBookkeepingTable()).isTrue();
        }

        @Test
        @DisplayName("upgrade to version 1 is used when there is no install script")
        void upgradeToOneFallback() throws Exception {
            var spec = SchemaSpec.sequential(List.of(List.of("a"), List.of("b")));

            MigrationStep step = resolver
                    .resolveStep(spec, SchemaState.virgin(), OptionalInt.empty())
                    .orElseThrow();

            assertThat(step.kind()).isEqualTo(StepKind.UPGRADE);
            assertThat(step.targetVersion()).isEqualTo(1);
            assertThat(step.statements()).containsExactly("a");
            assertThat(step.createBookkeepingTable()).isTrue();
        }

        @Test
        @DisplayName("an existing bookkeeping table at version 0 is not created again")
        void existingBookkeepingTable() throws Exception {
            MigrationStep step = resolver
                    .resolveStep(FULL, new SchemaState(0, true), OptionalInt.empty())
                    .orElseThrow();

            assertThat(step.createBookkeepingTable()).isFalse();
        }

        @Test
        @DisplayName("missing install-at-version script is a spec error")
        void missingInstallAtVersion() {
            var spec = SchemaSpec.builder().latestVersion(3).install("x").build();

            assertThatThrownBy(() ->
                    resolver.resolveStep(spec, SchemaState.virgin(), OptionalInt.of(2)))
                    .isInstanceOf(SchemaSpecException.class)
                    .hasMessageContaining("install-at-version 2");
        }

        @Test
        @DisplayName("no install path is a spec error")
        void noInstallPath() {
            var spec = SchemaSpec.builder().upgradeToVersion(2, "x").build();

            assertThatThrownBy(() ->
                    resolver.resolveStep(spec, SchemaState.virgin(), OptionalInt.empty()))
                    .isInstanceOf(SchemaSpecException.class)
                    .hasMessageContaining("no install path");
        }
    }

    @Nested
    @DisplayName("resolveStep on an existing database")
    class ExistingDatabase {

        @Test
        @DisplayName("steps to the next version")
        void nextVersion() throws Exception {
            MigrationStep step = resolver
                    .resolveStep(FULL, new SchemaState(2, true), OptionalInt.empty())
                    .orElseThrow();

            assertThat(step.kind()).isEqualTo(StepKind.UPGRADE);
            assertThat(step.fromVersion()).isEqualTo(2);
            assertThat(step.targetVersion()).isEqualTo(3);
            assertThat(step.statements()).containsExactly("DROP TABLE t0");
            assertThat(step.createBookkeepingTable()).isFalse();
        }

        @Test
        @DisplayName("ignores the bootstrap override")
        void ignoresBootstrap() throws Exception {
            MigrationStep step = resolver
                    .resolveStep(FULL, new SchemaState(1, true), OptionalInt.of(2))
                    .orElseThrow();

            assertThat(step.kind()).isEqualTo(StepKind.UPGRADE);
            assertThat(step.targetVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("returns no step at the latest version")
        void completeAtLatest() throws Exception {
            assertThat(resolver.resolveStep(FULL, new SchemaState(3, true), OptionalInt.empty()))
                    .isEmpty();
        }

        @Test
        @DisplayName("missing upgrade step is a spec error")
        void missingUpgrade() {
            var spec = SchemaSpec.builder().latestVersion(3).upgradeToVersion(2, "x").build();

            assertThatThrownBy(() ->
                    resolver.resolveStep(spec, new SchemaState(2, true), OptionalInt.empty()))
                    .isInstanceOf(SchemaSpecException.class)
                    .hasMessageContaining("version 3");
        }

        @Test
        @DisplayName("database newer than the spec is an execution error")
        void versionSkew() {
            assertThatThrownBy(() ->
                    resolver.resolveStep(FULL, new SchemaState(5, true), OptionalInt.empty()))
                    .isInstanceOf(MigrationExecutionException.class)
                    .hasMessageContaining("newer");
        }
    }

    @Nested
    @DisplayName("validateBootstrapVersion")
    class BootstrapValidation {

        @Test
        @DisplayName("accepts versions within range and no override")
        void acceptsInRange() {
            assertThatCode(() -> resolver.validateBootstrapVersion(FULL, OptionalInt.of(1)))
                    .doesNotThrowAnyException();
            assertThatCode(() -> resolver.validateBootstrapVersion(FULL, OptionalInt.of(3)))
                    .doesNotThrowAnyException();
            assertThatCode(() -> resolver.validateBootstrapVersion(FULL, OptionalInt.empty()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects versions outside 1..latest")
        void rejectsOutOfRange() {
            assertThatThrownBy(() -> resolver.validateBootstrapVersion(FULL, OptionalInt.of(0)))
                    .isInstanceOf(SchemaSpecException.class);
            assertThatThrownBy(() -> resolver.validateBootstrapVersion(FULL, OptionalInt.of(4)))
                    .isInstanceOf(SchemaSpecException.class);
        }
    }
}
