package villagecompute.screening.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import villagecompute.screening.exceptions.QueueCapacityException;

/**
 * Unit tests for {@link JobQueue}.
 */
class JobQueueTest {

    private static Job<NotificationJobPayload> notificationJob(UUID id) {
        return Job.of(id.toString(), JobKind.NOTIFICATION, new NotificationJobPayload(id));
    }

    @Test
    void testDequeue_fifoOrder() throws Exception {
        JobQueue<NotificationJobPayload> queue = JobQueue.unbounded(JobKind.NOTIFICATION);
        List<UUID> ids = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        ids.forEach(id -> queue.enqueue(notificationJob(id)));

        List<String> dequeued = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            dequeued.add(queue.dequeue().jobId());
        }

        assertEquals(ids.stream().map(UUID::toString).toList(), dequeued);
        assertEquals(0, queue.size());
    }

    @Test
    void testPoll_returnsNullWhenEmpty() throws Exception {
        JobQueue<NotificationJobPayload> queue = JobQueue.unbounded(JobKind.NOTIFICATION);

        assertNull(queue.poll(Duration.ofMillis(10)));
    }

    @Test
    void testDequeue_blocksUntilJobArrives() throws Exception {
        JobQueue<NotificationJobPayload> queue = JobQueue.unbounded(JobKind.NOTIFICATION);
        UUID id = UUID.randomUUID();
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            producer.submit(() -> {
                Thread.sleep(50);
                queue.enqueue(notificationJob(id));
                return null;
            });

            assertEquals(id.toString(), queue.dequeue().jobId());
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    void testEnqueue_boundedQueueRejectsWhenFull() {
        JobQueue<NotificationJobPayload> queue = new JobQueue<>(JobKind.NOTIFICATION, 1);
        queue.enqueue(notificationJob(UUID.randomUUID()));

        QueueCapacityException e = assertThrows(QueueCapacityException.class,
                () -> queue.enqueue(notificationJob(UUID.randomUUID())));

        assertEquals(1, e.getCapacity());
        assertEquals(1, queue.size());
    }

    @Test
    void testEnqueue_rejectsWrongKind() {
        JobQueue<NotificationJobPayload> queue = JobQueue.unbounded(JobKind.SEARCH);

        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(notificationJob(UUID.randomUUID())));
    }

    @Test
    void testNegativeCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JobQueue<NotificationJobPayload>(JobKind.SEARCH, -1));
    }

    @Test
    void testEnqueueIfAbsent_skipsWaitingDuplicate() throws Exception {
        JobQueue<NotificationJobPayload> queue = JobQueue.unbounded(JobKind.NOTIFICATION);
        UUID id = UUID.randomUUID();

        assertTrue(queue.enqueueIfAbsent(notificationJob(id)));
        assertFalse(queue.enqueueIfAbsent(notificationJob(id)));
        assertEquals(1, queue.size());
        assertTrue(queue.isWaiting(id.toString()));

        queue.dequeue();

        assertFalse(queue.isWaiting(id.toString()));
        assertTrue(queue.enqueueIfAbsent(notificationJob(id)));
    }

    @Test
    void testEnqueueIfAbsent_rejectedJobIsNotLeftWaiting() {
        JobQueue<NotificationJobPayload> queue = new JobQueue<>(JobKind.NOTIFICATION, 1);
        queue.enqueue(notificationJob(UUID.randomUUID()));
        UUID rejected = UUID.randomUUID();

        assertThrows(QueueCapacityException.class, () -> queue.enqueueIfAbsent(notificationJob(rejected)));

        assertFalse(queue.isWaiting(rejected.toString()));
    }

    @Test
    void testEnqueue_concurrentProducersLoseNothing() throws Exception {
        JobQueue<NotificationJobPayload> queue = JobQueue.unbounded(JobKind.NOTIFICATION);
        int producers = 4;
        int perProducer = 250;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int p = 0; p < producers; p++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        queue.enqueue(notificationJob(UUID.randomUUID()));
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(producers * perProducer, queue.size());
    }
}
