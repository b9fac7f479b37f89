package villagecompute.screening.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import villagecompute.screening.api.types.SearchParamsType;
import villagecompute.screening.data.models.IngestionTask;
import villagecompute.screening.data.models.NotificationRecord;
import villagecompute.screening.data.models.NotificationRecord.NotificationPriority;
import villagecompute.screening.data.models.NotificationRecord.NotificationStatus;
import villagecompute.screening.data.models.SearchRecord;
import villagecompute.screening.data.models.SearchRecord.SearchKind;
import villagecompute.screening.exceptions.QueueCapacityException;
import villagecompute.screening.jobs.RecoveryLoader.RecoverySummary;
import villagecompute.screening.services.BackgroundJobService;
import villagecompute.screening.testing.InMemoryNotificationRecordStore;
import villagecompute.screening.testing.InMemorySearchRecordStore;
import villagecompute.screening.testing.InMemoryTaskRecordStore;

/**
 * Unit tests for {@link RecoveryLoader}.
 */
@ExtendWith(MockitoExtension.class)
class RecoveryLoaderTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    BackgroundJobService jobService;

    private RecoveryLoader loader;
    private InMemoryTaskRecordStore taskStore;
    private InMemorySearchRecordStore searchStore;
    private InMemoryNotificationRecordStore notificationStore;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskRecordStore();
        searchStore = new InMemorySearchRecordStore();
        notificationStore = new InMemoryNotificationRecordStore();

        loader = new RecoveryLoader();
        loader.taskStore = taskStore;
        loader.searchStore = searchStore;
        loader.notificationStore = notificationStore;
        loader.jobService = jobService;
        loader.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private NotificationRecord notification(NotificationPriority priority, Instant createdAt) {
        return notificationStore.save(NotificationRecord.newPending(List.of("analyst@example.com"), "Subject",
                "Body", priority, 3, createdAt));
    }

    @Test
    void testRecover_enqueuesOnlyNonTerminalRecords() {
        IngestionTask pendingTask = taskStore.create("pending.csv");
        IngestionTask doneTask = taskStore.create("done.csv");
        taskStore.markCompleted(doneTask.id, List.of("a"), 1, 0.1);

        SearchParamsType params = SearchParamsType.single(pendingTask.id, "John Smith", List.of("a"), 80);
        SearchRecord pendingSearch = searchStore.create(SearchKind.SINGLE, params);
        SearchRecord interruptedSearch = searchStore.create(SearchKind.BULK, params);
        searchStore.markProcessing(interruptedSearch.id);
        SearchRecord failedSearch = searchStore.create(SearchKind.SINGLE, params);
        searchStore.markFailed(failedSearch.id, "boom", 1.0);

        NotificationRecord sent = notification(NotificationPriority.NORMAL, NOW.minusSeconds(30));
        notificationStore.markProcessing(sent.id, NOW);
        notificationStore.markSent(sent.id, NOW);

        RecoverySummary summary = loader.recover();

        assertEquals(new RecoverySummary(1, 2, 0, 0, 0), summary);
        verify(jobService).enqueueIngestion(pendingTask.id, "pending.csv");
        verify(jobService, never()).enqueueIngestion(eq(doneTask.id), any());
        verify(jobService).enqueueSearch(eq(pendingSearch.id), eq(SearchKind.SINGLE), any());
        verify(jobService).enqueueSearch(eq(interruptedSearch.id), eq(SearchKind.BULK), any());
        verify(jobService, never()).enqueueSearch(eq(failedSearch.id), any(), any());
        verify(jobService, never()).enqueueNotification(any());
    }

    @Test
    void testRecover_resetsInterruptedNotificationsAndEnqueuesByPriority() {
        NotificationRecord oldLow = notification(NotificationPriority.LOW, NOW.minusSeconds(300));
        NotificationRecord newUrgent = notification(NotificationPriority.URGENT, NOW.minusSeconds(10));
        NotificationRecord interrupted = notification(NotificationPriority.NORMAL, NOW.minusSeconds(200));
        notificationStore.markProcessing(interrupted.id, NOW.minusSeconds(5));

        RecoverySummary summary = loader.recover();

        assertEquals(new RecoverySummary(0, 0, 3, 1, 0), summary);
        NotificationRecord reset = notificationStore.read(interrupted.id).orElseThrow();
        assertEquals(NotificationStatus.RETRY, reset.status);
        assertEquals(0, reset.retryCount);
        assertNull(reset.scheduledAt);

        InOrder order = inOrder(jobService);
        order.verify(jobService).enqueueNotification(newUrgent.id);
        order.verify(jobService).enqueueNotification(interrupted.id);
        order.verify(jobService).enqueueNotification(oldLow.id);
    }

    @Test
    void testRecover_fullQueueIsCountedAndRecoveryContinues() {
        IngestionTask first = taskStore.create("first.csv");
        IngestionTask second = taskStore.create("second.csv");
        when(jobService.enqueueIngestion(any(), any())).thenAnswer(invocation -> {
            if (first.id.equals(invocation.getArgument(0))) {
                throw new QueueCapacityException("Ingestion queue is full", 1);
            }
            return invocation.getArgument(0).toString();
        });
        UUID notificationId = notification(NotificationPriority.HIGH, NOW).id;

        RecoverySummary summary = loader.recover();

        assertEquals(1, summary.tasks());
        assertEquals(1, summary.skipped());
        assertEquals(1, summary.notifications());
        verify(jobService).enqueueIngestion(second.id, "second.csv");
        verify(jobService).enqueueNotification(notificationId);
    }
}
