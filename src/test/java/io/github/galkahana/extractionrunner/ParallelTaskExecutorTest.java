package io.github.galkahana.extractionrunner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

public class ParallelTaskExecutorTest {

    private static final int NUM_WORKERS = 4;

    @TempDir
    Path dir;

    private final JsonArrayResultSink sink = new JsonArrayResultSink();

    private static List<Task> tasks(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> new Task("id-" + i, "doc-" + i, "application/pdf"))
            .collect(Collectors.toList());
    }

    private static TaskResult extracted(String displayName) {
        return new TaskResult(null, displayName, TaskStatus.SUCCESS, null,
            new TaskResult.Usage(100, 20), Map.of("patient", "Jane Doe"));
    }

    private ExecutionContext.ExecutionContextBuilder context(RepositoryClient repository, ExtractionClient extraction) {
        return ExecutionContext.builder()
            .repository(WorkerLocal.shared(repository))
            .extraction(WorkerLocal.shared(extraction))
            .repositoryLimiter(new RateLimiter("repository", 10_000))
            .extractionLimiter(new RateLimiter("extraction", 10_000))
            .retryPolicy(new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5)))
            .progressTracker(new ProgressTracker())
            .resultSink(sink);
    }

    @Test
    public void testOneExtractionAlwaysFails_OneFailedAndTwoSuccesses() throws Exception {
        // Arrange
        List<Task> tasks = tasks(3);
        AtomicInteger badAttempts = new AtomicInteger();
        ExtractionClient extraction = (content, name) -> {
            if (name.equals("doc-1")) {
                badAttempts.incrementAndGet();
                throw new IllegalStateException("unreadable scan");
            }
            return extracted(name);
        };
        RepositoryClient repository = task -> task.id().getBytes(StandardCharsets.UTF_8);
        Path output = dir.resolve("results.json");

        // Act
        RunSummary summary = new ParallelTaskExecutor(context(repository, extraction).build(), NUM_WORKERS)
            .execute(tasks, output);

        // Assert
        assertEquals(2, summary.success());
        assertEquals(1, summary.failed());
        assertEquals(3, badAttempts.get(), "Extraction should be retried up to maxAttempts");

        List<TaskResult> results = sink.readAll(output);
        assertEquals(3, results.size());
        List<TaskResult> failed = results.stream().filter(r -> r.status() == TaskStatus.FAILED).toList();
        assertEquals(1, failed.size());
        assertEquals("extraction failed: unreadable scan", failed.get(0).note());
        assertEquals("id-1", failed.get(0).taskId());
        assertEquals("doc-1", failed.get(0).displayName());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 8, 30})
    public void testAnyWorkerCount_CountsAddUp(int workers) throws Exception {
        // Arrange - 30 tasks, 5 already processed, every 4th fails and every 7th is partial
        List<Task> tasks = tasks(30);
        CheckpointStore checkpoint = new CheckpointStore(dir.resolve("checkpoint.json"));
        for (int i = 0; i < 5; i++) checkpoint.markProcessed("id-" + (i * 6), TaskStatus.SUCCESS);

        ExtractionClient extraction = (content, name) -> {
            int index = Integer.parseInt(name.substring(4));
            if (index % 4 == 0) throw new IOException("corrupt");
            TaskStatus status = index % 7 == 0 ? TaskStatus.PARTIAL_SUCCESS : TaskStatus.SUCCESS;
            return new TaskResult(null, name, status, null, null, Map.of());
        };

        // Act
        RunSummary summary = new ParallelTaskExecutor(
            context(task -> new byte[]{1}, extraction).checkpoint(checkpoint).build(), workers)
            .execute(tasks, dir.resolve("results.json"));

        // Assert
        assertEquals(5, summary.skipped());
        assertEquals(tasks.size(), summary.processed() + summary.skipped(), "processed + skipped should equal N");
        assertEquals(summary.processed(), summary.success() + summary.partial() + summary.failed());
        assertEquals(summary.processed(), sink.readAll(dir.resolve("results.json")).size());
        assertEquals(0, summary.cancelled());
        assertFalse(summary.wasCancelled());
    }

    @Test
    public void testResume_NeverRefetchesProcessedTask() throws Exception {
        // Arrange - a previous run completed id-2
        Path checkpointFile = dir.resolve("checkpoint.json");
        CheckpointStore previous = new CheckpointStore(checkpointFile);
        previous.markProcessed("id-2", TaskStatus.SUCCESS);
        previous.finalizeCheckpoint();

        RepositoryClient repository = mock(RepositoryClient.class);
        when(repository.fetch(any())).thenReturn(new byte[]{42});
        List<Task> tasks = tasks(5);

        // Act
        RunSummary summary = new ParallelTaskExecutor(
            context(repository, (content, name) -> extracted(name))
                .checkpoint(new CheckpointStore(checkpointFile)).build(), NUM_WORKERS)
            .execute(tasks, dir.resolve("results.json"));

        // Assert
        verify(repository, never()).fetch(argThat(task -> task.id().equals("id-2")));
        verify(repository, times(4)).fetch(any());
        assertEquals(1, summary.skipped());
        assertEquals(4, summary.processed());
        assertTrue(sink.readAll(dir.resolve("results.json")).stream().noneMatch(r -> r.taskId().equals("id-2")),
            "Skipped tasks emit no result");
    }

    @Test
    public void testCancellation_StopsDispatchAndFinalizesOnce() throws Exception {
        // Arrange
        List<Task> tasks = tasks(20);
        CheckpointStore checkpoint = spy(new CheckpointStore(dir.resolve("checkpoint.json")));
        AtomicReference<TaskExecutor> executor = new AtomicReference<>();
        ExtractionClient extraction = (content, name) -> {
            if (name.equals("doc-4")) {
                executor.get().cancel();   // the 5th task
            } else {
                Thread.sleep(20);
            }
            return extracted(name);
        };
        executor.set(new ParallelTaskExecutor(
            context(task -> new byte[]{1}, extraction).checkpoint(checkpoint).build(), NUM_WORKERS));

        // Act
        RunSummary summary = executor.get().execute(tasks, dir.resolve("results.json"));

        // Assert
        assertTrue(summary.wasCancelled());
        assertTrue(summary.processed() < tasks.size(), "Cancelled run should not process every task");
        assertTrue(summary.cancelled() > 0);
        assertEquals(tasks.size(), summary.processed() + summary.skipped() + summary.cancelled());
        verify(checkpoint, times(1)).finalizeCheckpoint();
        assertEquals(summary.processed(), new CheckpointStore(dir.resolve("checkpoint.json")).processedCount(),
            "Completed work should survive cancellation");
    }

    @Test
    public void testFetchFailure_ProducesSyntheticResultWithoutExtraction() throws Exception {
        // Arrange
        RepositoryClient repository = mock(RepositoryClient.class);
        when(repository.fetch(any())).thenThrow(new IOException("connection reset"));
        ExtractionClient extraction = mock(ExtractionClient.class);
        CheckpointStore checkpoint = new CheckpointStore(dir.resolve("checkpoint.json"));

        // Act
        RunSummary summary = new ParallelTaskExecutor(
            context(repository, extraction).checkpoint(checkpoint).build(), NUM_WORKERS)
            .execute(tasks(1), dir.resolve("results.json"));

        // Assert
        verify(repository, times(3)).fetch(any());
        verifyNoInteractions(extraction);
        assertEquals(1, summary.failed());
        TaskResult result = sink.readAll(dir.resolve("results.json")).get(0);
        assertEquals("fetch failed: connection reset", result.note());
        assertEquals(Map.of("id-0", "fetch failed: connection reset"), checkpoint.failedTasks());
    }

    @Test
    public void testEmptyDownload_IsAFetchFailure() throws Exception {
        // Arrange
        ExtractionClient extraction = mock(ExtractionClient.class);

        // Act
        RunSummary summary = new ParallelTaskExecutor(context(task -> null, extraction).build(), NUM_WORKERS)
            .execute(tasks(2), dir.resolve("results.json"));

        // Assert
        assertEquals(2, summary.failed());
        verifyNoInteractions(extraction);
    }

    @Test
    public void testExtractionReportsFailure_RecordedWithoutRetry() throws Exception {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        ExtractionClient extraction = (content, name) -> {
            calls.incrementAndGet();
            return new TaskResult(null, name, TaskStatus.FAILED, "JSON parsing error", null, Map.of());
        };
        CheckpointStore checkpoint = new CheckpointStore(dir.resolve("checkpoint.json"));

        // Act
        RunSummary summary = new ParallelTaskExecutor(
            context(task -> new byte[]{1}, extraction).checkpoint(checkpoint).build(), NUM_WORKERS)
            .execute(tasks(1), dir.resolve("results.json"));

        // Assert
        assertEquals(1, calls.get(), "A returned failure is terminal, not retried");
        assertEquals(1, summary.failed());
        assertEquals("JSON parsing error", checkpoint.failedTasks().get("id-0"));
    }

    @Test
    public void testThrottledFetch_BacksOffAndRecovers() throws Exception {
        // Arrange
        RateLimiter repositoryLimiter = spy(new RateLimiter("repository", 10_000));
        AtomicInteger calls = new AtomicInteger();
        RepositoryClient repository = task -> {
            if (calls.incrementAndGet() == 1) throw new IOException("HTTP 429 Too Many Requests");
            return new byte[]{1};
        };

        // Act
        RunSummary summary = new ParallelTaskExecutor(
            context(repository, (content, name) -> extracted(name)).repositoryLimiter(repositoryLimiter).build(), 1)
            .execute(tasks(1), dir.resolve("results.json"));

        // Assert
        assertEquals(1, summary.success());
        verify(repositoryLimiter).setBackoff(any(Duration.class));
    }

    @Test
    public void testProgressListener_CalledOncePerCompletedTask() throws Exception {
        // Arrange
        CheckpointStore checkpoint = new CheckpointStore(dir.resolve("checkpoint.json"));
        checkpoint.markProcessed("id-0", TaskStatus.SUCCESS);
        List<ProgressSnapshot> snapshots = new java.util.concurrent.CopyOnWriteArrayList<>();

        // Act
        new ParallelTaskExecutor(context(task -> new byte[]{1}, (content, name) -> extracted(name))
            .checkpoint(checkpoint).progressListener(snapshots::add).build(), NUM_WORKERS)
            .execute(tasks(10), dir.resolve("results.json"));

        // Assert
        assertEquals(9, snapshots.size());
        assertEquals(9, snapshots.stream().mapToInt(ProgressSnapshot::processed).max().orElse(0));
        assertTrue(snapshots.stream().allMatch(s -> s.total() == 9), "Total should exclude already processed tasks");
    }

    @Test
    public void testFailingListener_DoesNotAbortRun() throws Exception {
        // Act
        RunSummary summary = new ParallelTaskExecutor(context(task -> new byte[]{1}, (content, name) -> extracted(name))
            .progressListener(snapshot -> {
                throw new IllegalStateException("ui gone");
            }).build(), NUM_WORKERS)
            .execute(tasks(5), dir.resolve("results.json"));

        // Assert
        assertEquals(5, summary.success());
    }

    @Test
    public void testUsage_AccumulatesIntoCost() throws Exception {
        // Act
        RunSummary summary = new ParallelTaskExecutor(
            context(task -> new byte[]{1}, (content, name) -> extracted(name)).build(), NUM_WORKERS)
            .execute(tasks(3), dir.resolve("results.json"));

        // Assert
        assertEquals(300, summary.progress().inputUnits());
        assertEquals(60, summary.progress().outputUnits());
        assertEquals(300 / 1e6 * 3.0 + 60 / 1e6 * 15.0, summary.cost().currentCost(), 1e-12);
    }

    @Test
    public void testUnwritableDestination_FailsBeforeAnyTask() throws Exception {
        // Arrange - the destination is a directory
        RepositoryClient repository = mock(RepositoryClient.class);
        ParallelTaskExecutor executor = new ParallelTaskExecutor(
            context(repository, (content, name) -> extracted(name)).build(), NUM_WORKERS);

        // Act & Assert
        assertThrows(BatchSetupException.class, () -> executor.execute(tasks(3), dir));
        verifyNoInteractions(repository);
    }

    @Test
    public void testPerWorkerClients_OneInstancePerWorkerThread() throws Exception {
        // Arrange
        Map<String, RepositoryClient> clientByThread = new ConcurrentHashMap<>();
        WorkerLocal<RepositoryClient> repositories = WorkerLocal.perWorker(() -> task -> {
            Thread.sleep(5);
            return new byte[]{1};
        });
        ExecutionContext context = context(task -> null, (content, name) -> extracted(name))
            .repository(() -> {
                RepositoryClient client = repositories.get();
                RepositoryClient previous = clientByThread.putIfAbsent(Thread.currentThread().getName(), client);
                assertTrue(previous == null || previous == client, "A worker must keep its own client");
                return client;
            })
            .build();

        // Act
        RunSummary summary = new ParallelTaskExecutor(context, NUM_WORKERS).execute(tasks(40), dir.resolve("results.json"));

        // Assert
        assertEquals(40, summary.success());
        int created = repositories.createdInstances().size();
        assertTrue(created >= 1 && created <= NUM_WORKERS, "Created " + created + " clients for " + NUM_WORKERS + " workers");
        assertEquals(created, clientByThread.size());
    }

    @Test
    public void testReuse_IsRejected() throws Exception {
        // Arrange
        ParallelTaskExecutor executor = new ParallelTaskExecutor(
            context(task -> new byte[]{1}, (content, name) -> extracted(name)).build(), NUM_WORKERS);
        executor.execute(tasks(1), dir.resolve("results.json"));

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> executor.execute(tasks(1), dir.resolve("again.json")));
    }

    @Test
    public void testWorkerCount_IsClamped() {
        ExecutionContext context = context(task -> new byte[]{1}, (content, name) -> extracted(name)).build();
        assertEquals(1, new ParallelTaskExecutor(context, 0).numWorkers());
        assertEquals(50, new ParallelTaskExecutor(context, 200).numWorkers());
        assertEquals(10, new ParallelTaskExecutor(context).numWorkers());
    }

    @Test
    public void testDriverInterrupted_InFlightTasksFinishAndAreCheckpointed() throws Exception {
        // Arrange - extractions ignore interrupts and run for 400 ms
        CountDownLatch started = new CountDownLatch(1);
        ExtractionClient extraction = (content, name) -> {
            started.countDown();
            long end = System.nanoTime() + Duration.ofMillis(400).toNanos();
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
            return extracted(name);
        };
        Path checkpointFile = dir.resolve("checkpoint.json");
        CheckpointStore checkpoint = new CheckpointStore(checkpointFile);
        TaskExecutor executor = new ParallelTaskExecutor(
            context(task -> new byte[]{1}, extraction).checkpoint(checkpoint).build(), NUM_WORKERS);
        AtomicReference<RunSummary> summary = new AtomicReference<>();
        AtomicReference<Boolean> interruptRestored = new AtomicReference<>();
        Thread driver = new Thread(() -> {
            summary.set(executor.execute(tasks(12), dir.resolve("results.json")));
            interruptRestored.set(Thread.currentThread().isInterrupted());
        });

        // Act
        driver.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        driver.interrupt();
        driver.join(10_000);

        // Assert
        assertFalse(driver.isAlive());
        RunSummary result = summary.get();
        assertTrue(result.wasCancelled());
        assertTrue(interruptRestored.get(), "Interrupt flag should be restored for the caller");
        assertTrue(result.processed() >= 1, "Tasks already extracting should complete");
        assertEquals(12, result.processed() + result.skipped() + result.cancelled());
        assertEquals(result.processed(), checkpoint.processedCount());
        assertEquals(result.processed(), new CheckpointStore(checkpointFile).processedCount(),
            "Completions of in-flight tasks should reach the checkpoint file");
        assertEquals(result.processed(), sink.readAll(dir.resolve("results.json")).size());
    }
}
