package uk.gegc.coursemaker.features.queue.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.coursemaker.features.queue.application.EnqueueOptions;
import uk.gegc.coursemaker.features.queue.config.QueueProperties;
import uk.gegc.coursemaker.features.queue.domain.model.QueueName;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTaskStatus;
import uk.gegc.coursemaker.features.queue.domain.repository.QueueTaskRepository;
import uk.gegc.coursemaker.shared.exception.ValidationException;
import uk.gegc.coursemaker.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({JpaTaskQueue.class, QueueProperties.class, JpaTaskQueueTest.QueueTestConfig.class})
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@DisplayName("JpaTaskQueue")
class JpaTaskQueueTest {

    private static final String LESSON_TASK = "generation:lesson_content";
    private static final String PROVISION_TASK = "billing:provision";
    private static final Duration LEASE = Duration.ofMinutes(5);

    @TestConfiguration
    static class QueueTestConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private JpaTaskQueue queue;

    @Autowired
    private QueueTaskRepository taskRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("a dequeued task is leased to one consumer and counted as a delivery")
    void dequeue_leasesTask() {
        UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.defaults());

        Optional<QueueTask> leased = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a");

        assertThat(leased).isPresent();
        assertThat(leased.get().getId()).isEqualTo(id);
        assertThat(leased.get().getSubjectId()).isEqualTo("job-1");
        assertThat(leased.get().getStatus()).isEqualTo(QueueTaskStatus.IN_FLIGHT);
        assertThat(leased.get().getDeliveries()).isEqualTo(1);
        assertThat(leased.get().getLockedBy()).isEqualTo("worker-a");
        assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-b")).isEmpty();
    }

    @Test
    @DisplayName("only the requested task types are delivered")
    void dequeue_filtersByType() {
        queue.enqueue(PROVISION_TASK, "cs_1", EnqueueOptions.defaults());

        assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a")).isEmpty();
        assertThat(queue.dequeue(List.of(), LEASE, "worker-a")).isEmpty();
    }

    @Test
    @DisplayName("critical tasks are delivered before default ones")
    void dequeue_criticalFirst() {
        queue.enqueue(LESSON_TASK, "job-default", EnqueueOptions.defaults());
        clock.advance(Duration.ofSeconds(1));
        queue.enqueue(PROVISION_TASK, "cs_critical", EnqueueOptions.on(QueueName.CRITICAL, 10));

        QueueTask first = queue.dequeue(List.of(LESSON_TASK, PROVISION_TASK), LEASE, "worker-a").orElseThrow();

        assertThat(first.getSubjectId()).isEqualTo("cs_critical");
        assertThat(first.getMaxRetries()).isEqualTo(10);
    }

    @Test
    @DisplayName("a delayed task stays invisible until its delay has passed")
    void enqueue_withDelay() {
        queue.enqueue(LESSON_TASK, "job-later", EnqueueOptions.defaults().withDelay(Duration.ofSeconds(30)));

        assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a")).isEmpty();

        clock.advance(Duration.ofSeconds(30));
        assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a")).isPresent();
    }

    @Test
    @DisplayName("an unacknowledged task is redelivered after its lease expires")
    void dequeue_redeliversAfterLeaseExpiry() {
        UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.defaults());
        queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();

        clock.advance(LEASE.plusSeconds(1));
        QueueTask redelivered = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-b").orElseThrow();

        assertThat(redelivered.getId()).isEqualTo(id);
        assertThat(redelivered.getDeliveries()).isEqualTo(2);
        assertThat(redelivered.getLockedBy()).isEqualTo("worker-b");
    }

    @Test
    @DisplayName("ack removes the task")
    void ack_removesTask() {
        UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.defaults());
        QueueTask lease = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();

        queue.ack(lease);
        queue.ack(lease);

        assertThat(taskRepository.findById(id)).isEmpty();
    }

    @Test
    @DisplayName("a consumer whose lease expired cannot ack or nack the redelivered task")
    void expiredLease_cannotSettleRedelivery() {
        UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.defaults());
        QueueTask staleLease = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();
        clock.advance(LEASE.plusSeconds(1));
        QueueTask currentLease = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-b").orElseThrow();

        queue.ack(staleLease);
        queue.nack(staleLease, "late failure from worker-a");

        QueueTask stored = taskRepository.findById(id).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(QueueTaskStatus.IN_FLIGHT);
        assertThat(stored.getLockedBy()).isEqualTo("worker-b");
        assertThat(stored.getDeliveries()).isEqualTo(2);
        assertThat(stored.getLastError()).isNull();

        queue.ack(currentLease);
        assertThat(taskRepository.findById(id)).isEmpty();
    }

    @Test
    @DisplayName("the same consumer cannot settle an earlier delivery of a task it holds again")
    void sameConsumer_earlierDelivery_ignored() {
        UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.defaults());
        QueueTask first = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();
        clock.advance(LEASE.plusSeconds(1));
        queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();

        queue.ack(first);

        assertThat(taskRepository.findById(id)).isPresent();
    }

    @Test
    @DisplayName("enqueue requires a task type and a subject")
    void enqueue_validates() {
        assertThatThrownBy(() -> queue.enqueue(" ", "job-1", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> queue.enqueue(LESSON_TASK, null, null)).isInstanceOf(ValidationException.class);
    }

    @Nested
    @DisplayName("nack and dead letters")
    class NackAndDeadLetters {

        @Test
        @DisplayName("a nack with budget left makes the task visible again after backoff")
        void nack_withBudget_redeliversLater() {
            UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.on(QueueName.DEFAULT, 2));
            QueueTask lease = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();

            queue.nack(lease, "provider timeout");

            QueueTask released = taskRepository.findById(id).orElseThrow();
            assertThat(released.getStatus()).isEqualTo(QueueTaskStatus.PENDING);
            assertThat(released.getLastError()).isEqualTo("provider timeout");
            assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a")).isEmpty();

            clock.advance(Duration.ofSeconds(13));
            assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a"))
                    .hasValueSatisfying(t -> assertThat(t.getDeliveries()).isEqualTo(2));
        }

        @Test
        @DisplayName("a nack on the final delivery dead-letters the task")
        void nack_finalDelivery_deadLetters() {
            UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.on(QueueName.DEFAULT, 0));
            QueueTask lease = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();

            queue.nack(lease, "gave up");

            QueueTask dead = taskRepository.findById(id).orElseThrow();
            assertThat(dead.getStatus()).isEqualTo(QueueTaskStatus.DEAD_LETTER);
            assertThat(dead.getDeadLetteredAt()).isNotNull();
            assertThat(queue.listDeadLetters(PageRequest.of(0, 10)).getContent())
                    .extracting(QueueTask::getId)
                    .containsExactly(id);
            assertThat(meterRegistry.counter("queue.tasks.dead_lettered").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an expired lease on the final delivery dead-letters instead of redelivering")
        void expiredFinalLease_deadLetters() {
            UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.on(QueueName.DEFAULT, 0));
            queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();

            clock.advance(LEASE.plusSeconds(1));

            assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-b")).isEmpty();
            assertThat(taskRepository.findById(id).orElseThrow().getStatus()).isEqualTo(QueueTaskStatus.DEAD_LETTER);
        }

        @Test
        @DisplayName("a dead-lettered task can be requeued with a fresh budget")
        void requeueDeadLetter_resetsDeliveries() {
            UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.on(QueueName.DEFAULT, 0));
            QueueTask lease = queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a").orElseThrow();
            queue.nack(lease, "gave up");

            QueueTask requeued = queue.requeueDeadLetter(id);

            assertThat(requeued.getStatus()).isEqualTo(QueueTaskStatus.PENDING);
            assertThat(requeued.getDeliveries()).isZero();
            assertThat(queue.dequeue(List.of(LESSON_TASK), LEASE, "worker-a")).isPresent();
        }

        @Test
        @DisplayName("only dead-lettered tasks can be requeued")
        void requeueDeadLetter_rejectsLiveTask() {
            UUID id = queue.enqueue(LESSON_TASK, "job-1", EnqueueOptions.defaults());

            assertThatThrownBy(() -> queue.requeueDeadLetter(id)).isInstanceOf(ValidationException.class);
        }
    }
}
