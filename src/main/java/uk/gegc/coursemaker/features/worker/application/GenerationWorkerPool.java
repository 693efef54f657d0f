package uk.gegc.coursemaker.features.worker.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.worker.config.WorkerProperties;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker loops that drain the task queue and fall back to polling the job table.
 *
 * <p>Workers share nothing in memory; every hand-off is a conditional update in the database,
 * so several application instances can run pools against the same tables.
 */
@Slf4j
@Component
public class GenerationWorkerPool implements SmartLifecycle {

    private final TaskQueue taskQueue;
    private final GenerationTaskProcessor processor;
    private final JobHandlerRegistry handlerRegistry;
    private final WorkerProperties properties;

    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean running;
    private volatile ThreadPoolTaskExecutor executor;

    public GenerationWorkerPool(TaskQueue taskQueue,
                                GenerationTaskProcessor processor,
                                JobHandlerRegistry handlerRegistry,
                                WorkerProperties properties) {
        this.taskQueue = taskQueue;
        this.processor = processor;
        this.handlerRegistry = handlerRegistry;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        int concurrency = Math.max(1, properties.getConcurrency());
        String consumerPrefix = properties.getConsumerId() != null
                ? properties.getConsumerId()
                : "worker-" + UUID.randomUUID().toString().substring(0, 8);

        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(concurrency);
        pool.setMaxPoolSize(concurrency);
        pool.setQueueCapacity(0);
        pool.setThreadNamePrefix("gen-worker-");
        pool.setWaitForTasksToCompleteOnShutdown(false);
        pool.initialize();

        running = true;
        executor = pool;
        List<String> taskTypes = handlerRegistry.taskTypes();
        for (int i = 0; i < concurrency; i++) {
            String consumerId = consumerPrefix + "-" + i;
            pool.execute(() -> workLoop(consumerId, taskTypes));
        }
        log.info("Generation worker pool started with {} worker(s) for task types {}", concurrency, taskTypes);
    }

    @Override
    public void stop() {
        int stillRunning = shutdown(Duration.ofSeconds(properties.getShutdownDeadlineSeconds()));
        if (stillRunning > 0) {
            log.warn("{} job(s) still running at shutdown; the stale-job watchdog will recover them", stillRunning);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isEnabled();
    }

    /**
     * Stop taking new work and wait up to {@code deadline} for running handlers.
     *
     * @return number of handlers still running when the deadline passed
     */
    public synchronized int shutdown(Duration deadline) {
        running = false;
        ThreadPoolTaskExecutor pool = executor;
        if (pool == null) {
            return 0;
        }
        ThreadPoolExecutor threads = pool.getThreadPoolExecutor();
        threads.shutdown();
        try {
            if (!threads.awaitTermination(deadline.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not drain within {}", deadline);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers to finish");
        }
        int remaining = inFlight.get();
        threads.shutdownNow();
        executor = null;
        log.info("Generation worker pool stopped; {} handler(s) still in flight", remaining);
        return remaining;
    }

    int inFlightCount() {
        return inFlight.get();
    }

    private void workLoop(String consumerId, List<String> taskTypes) {
        Duration visibilityTimeout = Duration.ofSeconds(properties.getVisibilityTimeoutSeconds());
        log.debug("Worker {} started", consumerId);
        while (running) {
            try {
                if (!pollOnce(consumerId, taskTypes, visibilityTimeout)) {
                    Thread.sleep(properties.getPollIntervalMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Worker {} loop error; backing off", consumerId, e);
                try {
                    Thread.sleep(properties.getPollIntervalMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.debug("Worker {} stopped", consumerId);
    }

    /**
     * One iteration of a worker loop: a queued task first, otherwise a job from the table.
     *
     * @return true if any work was done
     */
    boolean pollOnce(String consumerId, List<String> taskTypes, Duration visibilityTimeout) {
        Optional<QueueTask> task = taskQueue.dequeue(taskTypes, visibilityTimeout, consumerId);
        inFlight.incrementAndGet();
        try {
            if (task.isPresent()) {
                processor.process(task.get());
                return true;
            }
            return processor.pollJobTable();
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
