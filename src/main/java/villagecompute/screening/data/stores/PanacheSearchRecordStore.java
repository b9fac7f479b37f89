package villagecompute.screening.data.stores;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.data.models.SearchRecord;
import villagecompute.screening.data.models.SearchRecord.SearchKind;
import villagecompute.screening.data.models.SearchRecord.SearchResults;
import villagecompute.screening.exceptions.StorageFailureException;

/**
 * {@link SearchRecordStore} backed by the {@code search_records} table.
 */
@ApplicationScoped
public class PanacheSearchRecordStore implements SearchRecordStore {

    private static final Logger LOG = Logger.getLogger(PanacheSearchRecordStore.class);

    @Override
    @Transactional
    public SearchRecord create(SearchKind kind, SearchParamsType params) {
        SearchRecord record = SearchRecord.newPending(kind, params);
        record.persist();
        LOG.infof("Created %s search %s on task %s", kind, record.id, params.taskRef());
        return record;
    }

    @Override
    @Transactional
    public Optional<SearchRecord> read(UUID searchId) {
        return SearchRecord.findByIdOptional(searchId);
    }

    @Override
    @Transactional
    public void markProcessing(UUID searchId) {
        require(searchId).markProcessing();
    }

    @Override
    @Transactional
    public void markCompleted(UUID searchId, SearchResults results) {
        require(searchId).complete(results);
    }

    @Override
    @Transactional
    public void markFailed(UUID searchId, String errorMessage, double executionTimeMs) {
        require(searchId).fail(errorMessage, executionTimeMs);
    }

    @Override
    @Transactional
    public List<SearchRecord> listNonTerminal() {
        return SearchRecord.find("#" + SearchRecord.QUERY_FIND_NON_TERMINAL).list();
    }

    @Override
    @Transactional
    public List<SearchRecord> listByTask(UUID taskRef) {
        return SearchRecord.find("#" + SearchRecord.QUERY_FIND_BY_TASK, taskRef).list();
    }

    @Override
    @Transactional
    public long deleteByTask(UUID taskRef) {
        return SearchRecord.delete("taskRef", taskRef);
    }

    private SearchRecord require(UUID searchId) {
        SearchRecord record = SearchRecord.findById(searchId);
        if (record == null) {
            throw new StorageFailureException("Search not found: " + searchId);
        }
        return record;
    }
}
