package villagecompute.screening.jobs;

/**
 * Defines the job families processed by the background engine.
 *
 * <p>
 * Each kind owns exactly one {@link JobQueue} and one {@link WorkerLoop}. Kinds progress independently of each other,
 * while jobs of the same kind execute strictly one at a time.
 *
 * @see JobHandler for handler contract
 * @see villagecompute.screening.services.BackgroundJobService for the loop owner
 */
public enum JobKind {

    /**
     * CSV source ingestion into the dataset store.
     * <p>
     * <b>Handler:</b> IngestionJobHandler
     */
    INGESTION("ingestion", "CSV ingestion (on-demand)"),

    /**
     * Fuzzy name screening against an ingested dataset.
     * <p>
     * <b>Handler:</b> SearchJobHandler
     * <p>
     * Scoring work is offloaded to the bounded scoring pool.
     */
    SEARCH("search", "Name screening (on-demand, CPU pool)"),

    /**
     * Outbound email delivery with bounded retry.
     * <p>
     * <b>Handler:</b> NotificationJobHandler
     */
    NOTIFICATION("notification", "Email delivery (on-demand, retried by sweep)");

    private final String tag;
    private final String description;

    JobKind(String tag, String description) {
        this.tag = tag;
        this.description = description;
    }

    /**
     * Returns the lowercase tag used for thread names, metric tags and log fields.
     */
    public String getTag() {
        return tag;
    }

    /**
     * Returns a human-readable description of the kind.
     */
    public String getDescription() {
        return description;
    }
}
