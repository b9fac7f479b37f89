package villagecompute.screening.jobs;

import java.util.Objects;
import java.util.UUID;

import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.data.models.SearchRecord.SearchKind;

/**
 * Parameters of a search job.
 *
 * @param searchId
 *            search record the job fills in
 * @param kind
 *            single, bulk or advanced
 * @param params
 *            dataset, columns, threshold and queries
 */
public record SearchJobPayload(UUID searchId, SearchKind kind, SearchParamsType params) {

    public SearchJobPayload {
        Objects.requireNonNull(searchId, "searchId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(params, "params");
    }
}
