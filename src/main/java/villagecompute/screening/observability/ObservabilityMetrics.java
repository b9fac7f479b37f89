package villagecompute.screening.observability;

import java.util.List;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.quarkus.runtime.StartupEvent;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.jobs.JobKind;
import villagecompute.screening.services.BackgroundJobService;

/**
 * Registers the job engine gauges.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code screening.jobs.depth{kind}} - Jobs waiting in the queue of each kind</li>
 * <li>{@code screening.jobs.busy{kind}} - 1 while the loop of that kind executes a job, else 0</li>
 * </ul>
 *
 * <p>
 * Counters and timers are registered by the worker loops and job handlers themselves. Metrics are exported in
 * Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    BackgroundJobService jobService;

    void onStart(@Observes StartupEvent event) {
        registerMetrics();
    }

    /**
     * Registers one depth gauge and one busy gauge per job kind.
     */
    public void registerMetrics() {
        for (JobKind kind : JobKind.values()) {
            List<Tag> tags = List.of(Tag.of("kind", kind.getTag()));

            Gauge.builder("screening.jobs.depth", jobService, service -> service.getQueueDepth(kind))
                    .description("Number of jobs waiting in the " + kind.name() + " queue").tags(tags)
                    .register(registry);

            Gauge.builder("screening.jobs.busy", jobService, service -> isBusy(service, kind) ? 1 : 0)
                    .description("Whether the " + kind.name() + " loop is executing a job").tags(tags)
                    .register(registry);

            LOG.debugf("Registered gauges: screening.jobs.depth/busy{kind=%s}", kind.getTag());
        }
        LOG.infof("Observability metrics registration complete. Access metrics at /q/metrics");
    }

    static boolean isBusy(BackgroundJobService service, JobKind kind) {
        return switch (kind) {
            case INGESTION -> service.currentIngestionJob().isPresent();
            case SEARCH -> service.currentSearchJob().isPresent();
            case NOTIFICATION -> service.currentNotificationJob().isPresent();
        };
    }
}
