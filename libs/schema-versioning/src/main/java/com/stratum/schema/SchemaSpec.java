package com.stratum.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Declarative description of every schema version a database can be brought to.
 *
 * <p>Statements are opaque SQL strings, executed in list order. Scripts are keyed by the integer
 * version they produce:
 *
 * <pre>{@code
 * SchemaSpec spec = SchemaSpec.builder()
 *         .latestVersion(3)
 *         .install("CREATE TABLE t1 (id INT)", "CREATE TABLE t4 (id INT)")
 *         .installAtVersion(1, "CREATE TABLE t1 (id INT)", "CREATE TABLE t2 (id INT)")
 *         .upgradeToVersion(2, "CREATE TABLE t4 (id INT)")
 *         .upgradeToVersion(3, "DROP TABLE t2")
 *         .build();
 * }</pre>
 *
 * @param latestVersion explicit latest version, or {@code null} to derive it from the highest
 *     upgrade step (see {@link SpecResolver#resolveLatestVersion(SchemaSpec)})
 * @param install statements building the schema directly at the latest version, or {@code null}
 * @param installAtVersion statements building the schema at an earlier version K, keyed by K
 * @param upgradeToVersion statements transforming version K-1 into K, keyed by K
 */
public record SchemaSpec(
        Integer latestVersion,
        List<String> install,
        Map<Integer, List<String>> installAtVersion,
        Map<Integer, List<String>> upgradeToVersion) {

    public SchemaSpec {
        if (latestVersion != null && latestVersion < 1) {
            throw new IllegalArgumentException("latestVersion must be >= 1, got " + latestVersion);
        }
        install = install == null ? null : copyStatements("install", install);
        installAtVersion = copyScripts("installAtVersion", installAtVersion);
        upgradeToVersion = copyScripts("upgradeToVersion", upgradeToVersion);
    }

    /**
     * Builds a spec from the plain "list of lists" convention: element {@code i} upgrades the
     * schema to version {@code i + 1}. There is no install script, so a virgin database is walked
     * through every version in turn.
     *
     * @param versions statements per version, starting with version 1
     */
    public static SchemaSpec sequential(List<List<String>> versions) {
        if (versions == null || versions.isEmpty()) {
            throw new IllegalArgumentException("versions must not be null or empty");
        }
        Map<Integer, List<String>> upgrades = new TreeMap<>();
        for (int i = 0; i < versions.size(); i++) {
            upgrades.put(i + 1, versions.get(i));
        }
        return new SchemaSpec(versions.size(), null, Map.of(), upgrades);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the explicit latest version, if one was declared. */
    public OptionalInt declaredLatestVersion() {
        return latestVersion == null ? OptionalInt.empty() : OptionalInt.of(latestVersion);
    }

    public Optional<List<String>> installScript() {
        return Optional.ofNullable(install);
    }

    public Optional<List<String>> installScriptAt(int version) {
        return Optional.ofNullable(installAtVersion.get(version));
    }

    public Optional<List<String>> upgradeScriptTo(int version) {
        return Optional.ofNullable(upgradeToVersion.get(version));
    }

    private static Map<Integer, List<String>> copyScripts(
            String field, Map<Integer, List<String>> scripts) {
        if (scripts == null || scripts.isEmpty()) {
            return Map.of();
        }
        Map<Integer, List<String>> copy = new TreeMap<>();
        for (Map.Entry<Integer, List<String>> entry : scripts.entrySet()) {
            Integer version = entry.getKey();
            if (version == null || version < 1) {
                throw new IllegalArgumentException(
                        field + " keys must be versions >= 1, got " + version);
            }
            copy.put(version, copyStatements(field + "[" + version + "]", entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static List<String> copyStatements(String field, List<String> statements) {
        if (statements == null) {
            throw new IllegalArgumentException(field + " must not be null");
        }
        for (String statement : statements) {
            if (statement == null) {
                throw new IllegalArgumentException(field + " must not contain null statements");
            }
        }
        return List.copyOf(statements);
    }

    /** Fluent builder for {@link SchemaSpec}. */
    public static final class Builder {

        private Integer latestVersion;
        private List<String> install;
        private final Map<Integer, List<String>> installAtVersion = new TreeMap<>();
        private final Map<Integer, List<String>> upgradeToVersion = new TreeMap<>();

        private Builder() {}

        public Builder latestVersion(int latestVersion) {
            this.latestVersion = latestVersion;
            return this;
        }

        public Builder install(String... statements) {
            return install(List.of(statements));
        }

        public Builder install(List<String> statements) {
            this.install = new ArrayList<>(statements);
            return this;
        }

        public Builder installAtVersion(int version, String... statements) {
            return installAtVersion(version, List.of(statements));
        }

        public Builder installAtVersion(int version, List<String> statements) {
            installAtVersion.put(version, new ArrayList<>(statements));
            return this;
        }

        public Builder upgradeToVersion(int version, String... statements) {
            return upgradeToVersion(version, List.of(statements));
        }

        public Builder upgradeToVersion(int version, List<String> statements) {
            upgradeToVersion.put(version, new ArrayList<>(statements));
            return this;
        }

        public SchemaSpec build() {
            return new SchemaSpec(latestVersion, install, installAtVersion, upgradeToVersion);
        }
    }
}
