package villagecompute.screening.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime tuning for the background job engine.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code screening.jobs.queue-capacity} - Per-kind queue bound, {@code 0} for unbounded</li>
 * <li>{@code screening.jobs.poll-interval} - How often an idle worker loop re-checks its stop flag</li>
 * <li>{@code screening.jobs.shutdown-timeout} - How long shutdown waits for in-flight jobs</li>
 * <li>{@code screening.ingestion.batch-size} - Rows per dataset insert batch</li>
 * <li>{@code screening.ingestion.source-cache-size} - Entries kept by the source descriptor cache</li>
 * <li>{@code screening.sources.directory} - Root directory of uploaded CSV sources</li>
 * <li>{@code screening.scoring.pool-size} - Threads in the fuzzy scoring pool</li>
 * <li>{@code screening.matching.entity-ref-column} - Dataset column holding the entity reference</li>
 * <li>{@code screening.notifications.max-retries} - Default delivery attempts before a notification fails</li>
 * <li>{@code screening.notifications.backoff-base-seconds} - Base of the exponential retry delay</li>
 * <li>{@code screening.notifications.from} - Sender address of outgoing mail</li>
 * <li>{@code screening.notifications.sweep-interval} - Period of the due-notification sweep (read by the scheduler)</li>
 * </ul>
 *
 * <p>
 * Fields are package-private so unit tests in this package can populate them without a CDI container.
 */
@ApplicationScoped
public class JobsConfig {

    @ConfigProperty(
            name = "screening.jobs.queue-capacity",
            defaultValue = "0")
    int queueCapacity;

    @ConfigProperty(
            name = "screening.jobs.poll-interval",
            defaultValue = "PT0.5S")
    Duration pollInterval;

    @ConfigProperty(
            name = "screening.jobs.shutdown-timeout",
            defaultValue = "PT30S")
    Duration shutdownTimeout;

    @ConfigProperty(
            name = "screening.ingestion.batch-size",
            defaultValue = "1000")
    int batchSize;

    @ConfigProperty(
            name = "screening.ingestion.source-cache-size",
            defaultValue = "128")
    int sourceCacheSize;

    @ConfigProperty(
            name = "screening.sources.directory",
            defaultValue = "uploads")
    String sourcesDirectory;

    @ConfigProperty(
            name = "screening.scoring.pool-size",
            defaultValue = "4")
    int scoringPoolSize;

    @ConfigProperty(
            name = "screening.matching.entity-ref-column",
            defaultValue = "Entity_LogicalId")
    String entityRefColumn;

    @ConfigProperty(
            name = "screening.notifications.max-retries",
            defaultValue = "3")
    int maxRetries;

    @ConfigProperty(
            name = "screening.notifications.backoff-base-seconds",
            defaultValue = "30")
    long backoffBaseSeconds;

    @ConfigProperty(
            name = "screening.notifications.from",
            defaultValue = "noreply@screening.local")
    String fromEmail;

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getSourceCacheSize() {
        return sourceCacheSize;
    }

    public Path getSourcesDirectory() {
        return Path.of(sourcesDirectory);
    }

    public int getScoringPoolSize() {
        return scoringPoolSize;
    }

    public String getEntityRefColumn() {
        return entityRefColumn;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBackoffBaseSeconds() {
        return backoffBaseSeconds;
    }

    public String getFromEmail() {
        return fromEmail;
    }
}
