package villagecompute.screening.testing;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.data.models.SearchRecord;
import villagecompute.screening.data.models.SearchRecord.SearchKind;
import villagecompute.screening.data.models.SearchRecord.SearchResults;
import villagecompute.screening.data.stores.SearchRecordStore;
import villagecompute.screening.exceptions.StorageFailureException;

/**
 * Map-backed {@link SearchRecordStore} for unit tests.
 */
public class InMemorySearchRecordStore implements SearchRecordStore {

    private final Map<UUID, SearchRecord> searches = new ConcurrentHashMap<>();

    @Override
    public SearchRecord create(SearchKind kind, SearchParamsType params) {
        SearchRecord record = SearchRecord.newPending(kind, params);
        record.id = UUID.randomUUID();
        searches.put(record.id, record);
        return record;
    }

    @Override
    public Optional<SearchRecord> read(UUID searchId) {
        return Optional.ofNullable(searches.get(searchId));
    }

    @Override
    public void markProcessing(UUID searchId) {
        require(searchId).markProcessing();
    }

    @Override
    public void markCompleted(UUID searchId, SearchResults results) {
        require(searchId).complete(results);
    }

    @Override
    public void markFailed(UUID searchId, String errorMessage, double executionTimeMs) {
        require(searchId).fail(errorMessage, executionTimeMs);
    }

    @Override
    public List<SearchRecord> listNonTerminal() {
        return searches.values().stream().filter(s -> !s.status.isTerminal())
                .sorted(Comparator.comparing((SearchRecord s) -> s.createdAt)).toList();
    }

    @Override
    public List<SearchRecord> listByTask(UUID taskRef) {
        return searches.values().stream().filter(s -> taskRef.equals(s.taskRef))
                .sorted(Comparator.comparing((SearchRecord s) -> s.createdAt).reversed()).toList();
    }

    @Override
    public long deleteByTask(UUID taskRef) {
        List<UUID> ids = listByTask(taskRef).stream().map(s -> s.id).toList();
        ids.forEach(searches::remove);
        return ids.size();
    }

    private SearchRecord require(UUID searchId) {
        SearchRecord record = searches.get(searchId);
        if (record == null) {
            throw new StorageFailureException("Search not found: " + searchId);
        }
        return record;
    }
}
