package com.stratum.schema.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.stratum.schema.DatabaseException;
import com.stratum.schema.SchemaSpec;
import com.stratum.schema.jdbc.JdbcDatabaseCapability;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaSpecVerifier")
class SchemaSpecVerifierTest {

    private static final String CREATE_T1 = "CREATE TABLE t1 (id INT)";
    private static final String CREATE_T2 = "CREATE TABLE t2 (id INT)";
    private static final String CREATE_T3 = "CREATE TABLE t3 (id INT)";
    private static final String CREATE_T4 = "CREATE TABLE t4 (id INT)";

    private static final SchemaSpec VALID = SchemaSpec.builder()
            .latestVersion(3)
            .install(CREATE_T1, CREATE_T4)
            .installAtVersion(1, CREATE_T1, CREATE_T2, CREATE_T3)
            .upgradeToVersion(2, CREATE_T4, "DROP TABLE t3")
            .upgradeToVersion(3, "DROP TABLE t2")
            .build();

    /** Same tables on both paths, but the upgrade path never adds {@code email}. */
    private static final SchemaSpec MISSING_COLUMN = SchemaSpec.builder()
            .latestVersion(2)
            .install("CREATE TABLE account (id INT, email VARCHAR(255))")
            .installAtVersion(1, "CREATE TABLE account (id INT)")
            .upgradeToVersion(2, "CREATE INDEX account_id ON account (id)")
            .build();

    private static final SchemaSpec ADDED_COLUMN = SchemaSpec.builder()
            .latestVersion(2)
            .install("CREATE TABLE account (id INT, email VARCHAR(255), name VARCHAR(64))")
            .installAtVersion(1, "CREATE TABLE account (id INT, name VARCHAR(64))")
            .upgradeToVersion(2, "ALTER TABLE account ADD COLUMN email VARCHAR(255)")
            .build();

    private final SchemaSpecVerifier verifier = new SchemaSpecVerifier();

    @Nested
    @DisplayName("In memory")
    class InMemory {

        @Test
        @DisplayName("accepts a spec whose install paths agree")
        void acceptsValidSpec() {
            VerificationResult result = verifier.verify(VALID, InMemoryDatabaseCapability::new);

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("requires an install script")
        void requiresInstall() {
            SchemaSpec spec = SchemaSpec.sequential(List.of(List.of(CREATE_T1)));

            VerificationResult result = verifier.verify(spec, InMemoryDatabaseCapability::new);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("spec has no install script");
        }

        @Test
        @DisplayName("requires install-at-version 1 when there are upgrades")
        void requiresInstallAtVersionOne() {
            SchemaSpec spec = SchemaSpec.builder()
                    .latestVersion(2)
                    .install(CREATE_T1)
                    .upgradeToVersion(2, CREATE_T2)
                    .build();

            VerificationResult result = verifier.verify(spec, InMemoryDatabaseCapability::new);

            assertThat(result.errors()).singleElement().asString()
                    .contains("no install-at-version 1 script");
        }

        @Test
        @DisplayName("reports diverging install paths")
        void reportsDivergence() {
            SchemaSpec spec = SchemaSpec.builder()
                    .latestVersion(2)
                    .install(CREATE_T1, CREATE_T4)
                    .installAtVersion(1, CREATE_T1)
                    .upgradeToVersion(2, CREATE_T2)
                    .build();

            VerificationResult result = verifier.verify(spec, InMemoryDatabaseCapability::new);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().asString()
                    .contains("install produced tables [meta, t1, t4]")
                    .contains("[meta, t1, t2]");
        }

        @Test
        @DisplayName("reports a table whose columns differ between install paths")
        void reportsColumnDivergence() {
            VerificationResult result =
                    verifier.verify(MISSING_COLUMN, InMemoryDatabaseCapability::new);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("table account has columns [email, id] "
                    + "after install but [id] after upgrading from version 1");
        }

        @Test
        @DisplayName("ignores column order")
        void ignoresColumnOrder() {
            VerificationResult result =
                    verifier.verify(ADDED_COLUMN, InMemoryDatabaseCapability::new);

            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("reports a failing install")
        void reportsFailingInstall() {
            SchemaSpec spec = SchemaSpec.builder()
                    .latestVersion(1)
                    .install("THIS IS NOT SQL")
                    .build();

            VerificationResult result = verifier.verify(spec, InMemoryDatabaseCapability::new);

            assertThat(result.errors()).singleElement().asString()
                    .startsWith("install failed: ");
        }

        @Test
        @DisplayName("reports databases that cannot be opened")
        void reportsUnavailableDatabase() {
            VerificationResult result = verifier.verify(VALID, () -> {
                throw new DatabaseException("connection refused");
            });

            assertThat(result.errors()).hasSize(2)
                    .allSatisfy(error -> assertThat(error).contains("connection refused"));
        }
    }

    @Nested
    @DisplayName("On H2")
    class OnH2 {

        private final List<Connection> connections = new ArrayList<>();

        @AfterEach
        void closeConnections() throws SQLException {
            for (Connection connection : connections) {
                connection.close();
            }
        }

        private JdbcDatabaseCapability freshDatabase() throws DatabaseException {
            try {
                Connection connection = DriverManager.getConnection(
                        "jdbc:h2:mem:" + UUID.randomUUID() + ";NON_KEYWORDS=VALUE", "sa", "");
                connections.add(connection);
                return new JdbcDatabaseCapability(connection);
            } catch (SQLException e) {
                throw new DatabaseException(e.getMessage(), e.getSQLState(), e);
            }
        }

        @Test
        @DisplayName("accepts a spec whose install paths agree")
        void acceptsValidSpec() {
            VerificationResult result = verifier.verify(VALID, this::freshDatabase);

            assertThat(result.errors()).isEmpty();
            assertThat(result.valid()).isTrue();
        }

        @Test
        @DisplayName("reports a table whose columns differ between install paths")
        void reportsColumnDivergence() {
            VerificationResult result = verifier.verify(MISSING_COLUMN, this::freshDatabase);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("table account has columns [email, id] "
                    + "after install but [id] after upgrading from version 1");
        }

        @Test
        @DisplayName("accepts a column added by an upgrade")
        void acceptsAddedColumn() {
            VerificationResult result = verifier.verify(ADDED_COLUMN, this::freshDatabase);

            assertThat(result.errors()).isEmpty();
        }
    }
}
