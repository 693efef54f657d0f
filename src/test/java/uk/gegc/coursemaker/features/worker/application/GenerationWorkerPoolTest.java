package uk.gegc.coursemaker.features.worker.application;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.coursemaker.BaseUnitTest;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.worker.config.WorkerProperties;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("GenerationWorkerPool")
class GenerationWorkerPoolTest extends BaseUnitTest {

    private static final List<String> TASK_TYPES = List.of("generation:lesson_content");

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private GenerationTaskProcessor processor;

    @Mock
    private JobHandlerRegistry handlerRegistry;

    private WorkerProperties properties;
    private GenerationWorkerPool pool;

    @BeforeEach
    void setUp() {
        properties = new WorkerProperties();
        properties.setConcurrency(1);
        properties.setPollIntervalMs(10);
        properties.setConsumerId("test-worker");
        pool = new GenerationWorkerPool(taskQueue, processor, handlerRegistry, properties);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(Duration.ofMillis(100));
    }

    private QueueTask task() {
        QueueTask task = new QueueTask();
        task.setId(UUID.randomUUID());
        task.setTaskType("generation:lesson_content");
        task.setSubjectId(UUID.randomUUID().toString());
        return task;
    }

    @Test
    @DisplayName("a dequeued task is handed to the processor")
    void pollOnce_processesTask() {
        QueueTask task = task();
        when(taskQueue.dequeue(TASK_TYPES, Duration.ofSeconds(60), "w-0")).thenReturn(Optional.of(task));

        boolean worked = pool.pollOnce("w-0", TASK_TYPES, Duration.ofSeconds(60));

        assertThat(worked).isTrue();
        verify(processor).process(task);
        verify(processor, never()).pollJobTable();
        assertThat(pool.inFlightCount()).isZero();
    }

    @Test
    @DisplayName("an empty queue falls back to the job table")
    void pollOnce_emptyQueue_pollsTable() {
        when(taskQueue.dequeue(TASK_TYPES, Duration.ofSeconds(60), "w-0")).thenReturn(Optional.empty());
        when(processor.pollJobTable()).thenReturn(false);

        boolean worked = pool.pollOnce("w-0", TASK_TYPES, Duration.ofSeconds(60));

        assertThat(worked).isFalse();
        verify(processor).pollJobTable();
    }

    @Test
    @DisplayName("start runs workers until shutdown")
    void start_runsWorkers() throws InterruptedException {
        QueueTask task = task();
        CountDownLatch processed = new CountDownLatch(1);
        when(handlerRegistry.taskTypes()).thenReturn(TASK_TYPES);
        when(taskQueue.dequeue(any(), any(), anyString())).thenReturn(Optional.of(task), Optional.empty());
        lenient().when(processor.pollJobTable()).thenReturn(false);
        doAnswer(inv -> {
            processed.countDown();
            return null;
        }).when(processor).process(task);

        pool.start();

        assertThat(pool.isRunning()).isTrue();
        assertThat(processed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(pool.shutdown(Duration.ofSeconds(2))).isZero();
        assertThat(pool.isRunning()).isFalse();
    }

    @Test
    @DisplayName("shutdown reports handlers still running at the deadline")
    void shutdown_reportsInFlight() throws InterruptedException {
        QueueTask task = task();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(handlerRegistry.taskTypes()).thenReturn(TASK_TYPES);
        lenient().when(taskQueue.dequeue(any(), any(), anyString())).thenReturn(Optional.of(task), Optional.empty());
        lenient().when(processor.pollJobTable()).thenReturn(false);
        doAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(processor).process(task);

        pool.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        int stillRunning = pool.shutdown(Duration.ofMillis(100));

        assertThat(stillRunning).isEqualTo(1);
        release.countDown();
    }

    @Test
    @DisplayName("auto startup follows the enabled flag")
    void autoStartup_followsProperty() {
        properties.setEnabled(false);

        assertThat(pool.isAutoStartup()).isFalse();
    }
}
