package com.stratum.migrator.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the schema migrator, bound from {@code stratum.migrator.*}.
 *
 * <pre>
 * stratum:
 *   migrator:
 *     spec-location: classpath:db/schema-spec.yml
 *     bootstrap-at-version: 1
 *     fail-on-error: true
 *     service-name: billing-db-migrator
 * </pre>
 *
 * <p>The database itself is Spring Boot's auto-configured {@code DataSource}
 * ({@code spring.datasource.*}).
 *
 * @param specLocation Spring resource location of the YAML or JSON schema spec. Required.
 * @param bootstrapAtVersion Version to install an empty database at before upgrading, or null to
 *     install the latest version directly.
 * @param failOnError Whether a failed migration aborts startup (default true).
 * @param serviceName Service name used as the metrics {@code service} tag (default
 *     {@code schema-migrator}).
 */
@ConfigurationProperties(prefix = "stratum.migrator")
@Validated
public record SchemaMigratorProperties(
        @NotBlank String specLocation,
        @Positive Integer bootstrapAtVersion,
        Boolean failOnError,
        String serviceName) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean Validation, so
     * defaults satisfy constraints.
     */
    public SchemaMigratorProperties {
        if (failOnError == null) {
            failOnError = Boolean.TRUE;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "schema-migrator";
        }
    }
}
