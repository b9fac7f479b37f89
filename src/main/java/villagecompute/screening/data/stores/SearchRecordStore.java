package villagecompute.screening.data.stores;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.data.models.SearchRecord;
import villagecompute.screening.data.models.SearchRecord.SearchKind;
import villagecompute.screening.data.models.SearchRecord.SearchResults;

/**
 * Persistence of search records and their results.
 */
public interface SearchRecordStore {

    SearchRecord create(SearchKind kind, SearchParamsType params);

    Optional<SearchRecord> read(UUID searchId);

    void markProcessing(UUID searchId);

    void markCompleted(UUID searchId, SearchResults results);

    void markFailed(UUID searchId, String errorMessage, double executionTimeMs);

    /**
     * Searches still PENDING or PROCESSING, oldest first.
     */
    List<SearchRecord> listNonTerminal();

    List<SearchRecord> listByTask(UUID taskRef);

    long deleteByTask(UUID taskRef);
}
