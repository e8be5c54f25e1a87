package com.stratum.schema.diagnostics;

import com.stratum.schema.MigrationDiagnostics;
import com.stratum.schema.MigrationResult;
import com.stratum.schema.MigrationStep;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records migration activity as Micrometer meters.
 *
 * <ul>
 *   <li>{@value #STEPS} counter, tagged {@code outcome=committed|failed}
 *   <li>{@value #STEP_DURATION} timer of committed steps, tagged with the step {@code kind}
 *   <li>{@value #RUNS} counter, tagged with the result {@code status}
 *   <li>{@value #VERSION} gauge holding the last known schema version
 * </ul>
 *
 * <p>Every meter carries a {@code service} tag.
 */
public final class MeteredMigrationDiagnostics implements MigrationDiagnostics {

    public static final String STEPS = "schema.migration.steps";
    public static final String STEP_DURATION = "schema.migration.step.duration";
    public static final String RUNS = "schema.migration.runs";
    public static final String VERSION = "schema.version";

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;
    private final AtomicInteger version = new AtomicInteger();

    /**
     * @param registry the meter registry to register with
     * @param serviceName logical service name included as a tag on every meter
     */
    public MeteredMigrationDiagnostics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        Gauge.builder(VERSION, version, AtomicInteger::doubleValue)
                .description("Last known database schema version")
                .tags(baseTags())
                .register(registry);
    }

    @Override
    public void migrationStarted(int currentVersion, int latestVersion) {
        version.set(currentVersion);
    }

    @Override
    public void stepCommitted(MigrationStep step, Duration elapsed) {
        version.set(step.targetVersion());
        stepCounter("committed").increment();
        Timer.builder(STEP_DURATION)
                .description("Duration of committed schema migration steps")
                .tags(baseTags("kind", tagValue(step.kind().name())))
                .register(registry)
                .record(elapsed);
    }

    @Override
    public void stepFailed(MigrationStep step, String error) {
        stepCounter("failed").increment();
    }

    @Override
    public void migrationFinished(MigrationResult result) {
        if (result.versionKnown()) {
            version.set(result.achievedVersion());
        }
        Counter.builder(RUNS)
                .description("Schema migration runs by outcome")
                .tags(baseTags("status", tagValue(result.status().name())))
                .register(registry)
                .increment();
    }

    private Counter stepCounter(String outcome) {
        return Counter.builder(STEPS)
                .description("Schema migration steps by outcome")
                .tags(baseTags("outcome", outcome))
                .register(registry);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }

    private static String tagValue(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
