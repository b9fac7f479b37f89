package villagecompute.screening.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import villagecompute.screening.exceptions.JobExecutionException;

/**
 * Unit tests for {@link WorkerLoop}.
 */
class WorkerLoopTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    private SimpleMeterRegistry meterRegistry;
    private JobQueue<NotificationJobPayload> queue;
    private WorkerLoop<NotificationJobPayload> loop;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queue = JobQueue.unbounded(JobKind.NOTIFICATION);
    }

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.stop(Duration.ofSeconds(2));
        }
    }

    private static Job<NotificationJobPayload> job(UUID id) {
        return Job.of(id.toString(), JobKind.NOTIFICATION, new NotificationJobPayload(id));
    }

    @Test
    void testProcess_success_countsAndClearsCurrentJob() {
        RecordingHandler handler = new RecordingHandler();
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry);
        UUID id = UUID.randomUUID();

        loop.process(job(id));

        assertEquals(List.of(id.toString()), handler.executed);
        assertEquals(Optional.empty(), loop.currentJobId());
        assertEquals(1.0, meterRegistry.get("screening.jobs.executed").tag("outcome", "completed").counter().count());
    }

    @Test
    void testProcess_handlerFailure_callsOnFailureAndContinues() {
        RecordingHandler handler = new RecordingHandler();
        handler.failWith = new IllegalStateException("boom");
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry);
        UUID id = UUID.randomUUID();

        loop.process(job(id));

        assertEquals(1, handler.failures.size());
        assertSame(handler.failWith, handler.failures.get(0));
        assertEquals(Optional.empty(), loop.currentJobId());
        assertEquals(1.0, meterRegistry.get("screening.jobs.executed").tag("outcome", "failed").counter().count());
    }

    @Test
    void testProcess_handlerFailure_reportsElapsedTime() {
        RecordingHandler handler = new RecordingHandler();
        handler.failWith = new IllegalStateException("slow failure");
        handler.busyMillis = 30;
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry);

        loop.process(job(UUID.randomUUID()));

        assertEquals(1, handler.failureElapsed.size());
        Duration elapsed = handler.failureElapsed.get(0);
        assertTrue(elapsed.toMillis() >= 30, "elapsed was " + elapsed);
    }

    @Test
    void testProcess_handlerError_isWrappedForOnFailure() {
        RecordingHandler handler = new RecordingHandler();
        AssertionError error = new AssertionError("invariant broken");
        handler.errorFirst = error;
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry);

        loop.process(job(UUID.randomUUID()));

        assertEquals(1, handler.failures.size());
        JobExecutionException wrapped = assertInstanceOf(JobExecutionException.class, handler.failures.get(0));
        assertSame(error, wrapped.getCause());
        assertEquals(Optional.empty(), loop.currentJobId());
        assertEquals(1.0, meterRegistry.get("screening.jobs.executed").tag("outcome", "failed").counter().count());
    }

    @Test
    void testProcess_onFailureErrorIsContained() {
        RecordingHandler handler = new RecordingHandler();
        handler.failWith = new IllegalStateException("boom");
        handler.failOnFailure = true;
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry);

        loop.process(job(UUID.randomUUID()));

        assertEquals(Optional.empty(), loop.currentJobId());
    }

    @Test
    void testRun_failedJobDoesNotStopLoop() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        handler.failFirst = true;
        handler.expected = new CountDownLatch(2);
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry, Duration.ofMillis(20));
        loop.start();

        queue.enqueue(job(UUID.randomUUID()));
        queue.enqueue(job(UUID.randomUUID()));

        assertTrue(handler.expected.await(5, TimeUnit.SECONDS));
        assertTrue(loop.isRunning());
        assertEquals(2, handler.executed.size());
    }

    @Test
    void testRun_errorInHandlerDoesNotStopLoop() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        handler.errorFirst = new AssertionError("first job breaks");
        handler.expected = new CountDownLatch(2);
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry, Duration.ofMillis(20));
        loop.start();

        queue.enqueue(job(UUID.randomUUID()));
        UUID second = UUID.randomUUID();
        queue.enqueue(job(second));

        assertTrue(handler.expected.await(5, TimeUnit.SECONDS));
        assertTrue(loop.isRunning());
        assertEquals(second.toString(), handler.executed.get(1));
        assertEquals(1, handler.failures.size());
        assertInstanceOf(JobExecutionException.class, handler.failures.get(0));
    }

    @Test
    void testRun_jobsExecuteOneAtATimeAndExposeCurrentJob() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(3);

        JobHandler<NotificationJobPayload> handler = new JobHandler<>() {
            @Override
            public JobKind handlesKind() {
                return JobKind.NOTIFICATION;
            }

            @Override
            public void execute(Job<NotificationJobPayload> job) throws Exception {
                int now = concurrent.incrementAndGet();
                maxConcurrent.accumulateAndGet(now, Math::max);
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                concurrent.decrementAndGet();
                done.countDown();
            }
        };
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry, Duration.ofMillis(20));
        loop.start();

        UUID first = UUID.randomUUID();
        queue.enqueue(job(first));
        queue.enqueue(job(UUID.randomUUID()));
        queue.enqueue(job(UUID.randomUUID()));

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(first.toString()), loop.currentJobId());
        assertEquals(2, queue.size());

        release.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxConcurrent.get());
    }

    @Test
    void testStop_letsInFlightJobFinish() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        JobHandler<NotificationJobPayload> handler = new JobHandler<>() {
            @Override
            public JobKind handlesKind() {
                return JobKind.NOTIFICATION;
            }

            @Override
            public void execute(Job<NotificationJobPayload> job) throws Exception {
                entered.countDown();
                Thread.sleep(150);
                finished.incrementAndGet();
            }
        };
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry, Duration.ofMillis(20));
        loop.start();
        queue.enqueue(job(UUID.randomUUID()));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(loop.stop(Duration.ofSeconds(5)));

        assertEquals(1, finished.get());
        assertFalse(loop.isRunning());
    }

    @Test
    void testStart_refusedWhileStoppedThreadIsStillBusy() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> executed = new CopyOnWriteArrayList<>();
        CountDownLatch secondDone = new CountDownLatch(1);
        JobHandler<NotificationJobPayload> handler = new JobHandler<>() {
            @Override
            public JobKind handlesKind() {
                return JobKind.NOTIFICATION;
            }

            @Override
            public void execute(Job<NotificationJobPayload> job) throws Exception {
                executed.add(job.jobId());
                if (executed.size() == 1) {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } else {
                    secondDone.countDown();
                }
            }
        };
        loop = new WorkerLoop<>(queue, handler, tracer, meterRegistry, Duration.ofMillis(20));
        loop.start();
        queue.enqueue(job(UUID.randomUUID()));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertFalse(loop.stop(Duration.ofMillis(50)));
        loop.start();
        assertFalse(loop.isRunning());

        UUID waiting = UUID.randomUUID();
        queue.enqueue(job(waiting));
        release.countDown();
        assertTrue(loop.stop(Duration.ofSeconds(5)));
        assertEquals(1, executed.size());
        assertEquals(1, queue.size());

        loop.start();
        assertTrue(loop.isRunning());
        assertTrue(secondDone.await(5, TimeUnit.SECONDS));
        assertEquals(waiting.toString(), executed.get(1));
    }

    @Test
    void testStop_beforeStartIsNoop() {
        loop = new WorkerLoop<>(queue, new RecordingHandler(), tracer, meterRegistry);

        assertTrue(loop.stop(Duration.ofMillis(10)));
    }

    private static final class RecordingHandler implements JobHandler<NotificationJobPayload> {

        final List<String> executed = new CopyOnWriteArrayList<>();
        final List<Exception> failures = new CopyOnWriteArrayList<>();
        final List<Duration> failureElapsed = new CopyOnWriteArrayList<>();
        Exception failWith;
        Error errorFirst;
        long busyMillis;
        boolean failFirst;
        boolean failOnFailure;
        CountDownLatch expected = new CountDownLatch(0);

        @Override
        public JobKind handlesKind() {
            return JobKind.NOTIFICATION;
        }

        @Override
        public void execute(Job<NotificationJobPayload> job) throws Exception {
            executed.add(job.jobId());
            expected.countDown();
            if (busyMillis > 0) {
                Thread.sleep(busyMillis);
            }
            if (errorFirst != null && executed.size() == 1) {
                throw errorFirst;
            }
            if (failWith != null) {
                throw failWith;
            }
            if (failFirst && executed.size() == 1) {
                throw new IllegalStateException("first job fails");
            }
        }

        @Override
        public void onFailure(Job<NotificationJobPayload> job, Exception cause, Duration elapsed) {
            failures.add(cause);
            failureElapsed.add(elapsed);
            if (failOnFailure) {
                throw new IllegalStateException("cannot finalize");
            }
        }
    }
}
