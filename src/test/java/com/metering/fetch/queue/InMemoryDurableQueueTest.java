package com.metering.fetch.queue;

import com.metering.fetch.domain.JobPriority;
import com.metering.fetch.jobs.FetchOptions;
import com.metering.fetch.jobs.JobMessage;
import com.metering.fetch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryDurableQueue Tests")
class InMemoryDurableQueueTest {

    private static final Duration VISIBILITY = Duration.ofMinutes(15);

    private MutableClock clock;
    private List<Delivery<JobMessage>> deadLettered;
    private List<DeadLetterReason> reasons;
    private InMemoryDurableQueue<JobMessage> queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        deadLettered = new ArrayList<>();
        reasons = new ArrayList<>();
        queue = new InMemoryDurableQueue<>("jobs", clock, VISIBILITY, 3, (delivery, reason) -> {
            deadLettered.add(delivery);
            reasons.add(reason);
        });
    }

    private static JobMessage job(String id, JobPriority priority) {
        return new JobMessage(id, "site-1", List.of("a"), Instant.EPOCH, Instant.EPOCH.plusSeconds(60), null,
            new FetchOptions("json", true, null, priority));
    }

    @Test
    @DisplayName("Should deliver a sent message once and remove it on ack")
    void testSendReceiveAck() {
        queue.send(job("job_1", JobPriority.NORMAL));

        List<Delivery<JobMessage>> first = queue.receive(10);
        assertThat(first).singleElement().satisfies(delivery -> {
            assertThat(delivery.body().jobId()).isEqualTo("job_1");
            assertThat(delivery.attempt()).isEqualTo(1);
            assertThat(delivery.retryCount()).isZero();
        });
        assertThat(queue.receive(10)).as("leased message stays invisible").isEmpty();

        queue.ack(first.get(0));
        assertThat(queue.depth()).isZero();
    }

    @Test
    @DisplayName("Should redeliver with an incremented attempt when the lease expires")
    void testVisibilityTimeout() {
        queue.send(job("job_1", JobPriority.NORMAL));
        queue.receive(1);

        clock.advance(VISIBILITY.plusSeconds(1));

        assertThat(queue.receive(1)).singleElement()
            .satisfies(delivery -> assertThat(delivery.attempt()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should hold retried messages until the delay passes")
    void testRetryDelay() {
        queue.send(job("job_1", JobPriority.NORMAL));
        Delivery<JobMessage> delivery = queue.receive(1).get(0);

        queue.retry(delivery, Duration.ofSeconds(30));

        assertThat(queue.receive(1)).isEmpty();
        clock.advance(Duration.ofSeconds(30));
        assertThat(queue.receive(1)).singleElement()
            .satisfies(redelivered -> assertThat(redelivered.retryCount()).isEqualTo(1));
    }

    @Test
    @DisplayName("Should ignore an ack that holds a stale receipt")
    void testStaleAck() {
        queue.send(job("job_1", JobPriority.NORMAL));
        Delivery<JobMessage> stale = queue.receive(1).get(0);
        clock.advance(VISIBILITY.plusSeconds(1));
        queue.receive(1);

        queue.ack(stale);

        assertThat(queue.depth()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should dead-letter a message past the delivery limit")
    void testDeliveryLimit() {
        queue.send(job("job_1", JobPriority.NORMAL));
        for (int i = 0; i < 3; i++) {
            assertThat(queue.receive(1)).hasSize(1);
            clock.advance(VISIBILITY.plusSeconds(1));
        }

        assertThat(queue.receive(1)).isEmpty();
        assertThat(queue.depth()).isZero();
        assertThat(deadLettered).singleElement()
            .satisfies(delivery -> assertThat(delivery.attempt()).isEqualTo(4));
        assertThat(reasons.get(0).error()).contains("Delivery limit of 3");
    }

    @Test
    @DisplayName("Should pass explicit dead-letter reasons to the sink")
    void testExplicitDeadLetter() {
        queue.send(job("job_1", JobPriority.NORMAL));
        Delivery<JobMessage> delivery = queue.receive(1).get(0);

        queue.deadLetter(delivery, new DeadLetterReason("boom", null, "trace"));

        assertThat(queue.depth()).isZero();
        assertThat(reasons).extracting(DeadLetterReason::error).containsExactly("boom");
    }

    @Test
    @DisplayName("Should receive higher priority messages first")
    void testPriorityOrder() {
        queue.send(job("low", JobPriority.LOW));
        queue.send(job("normal", JobPriority.NORMAL));
        queue.send(job("high", JobPriority.HIGH));

        assertThat(queue.receive(3)).extracting(delivery -> delivery.body().jobId())
            .containsExactly("high", "normal", "low");
    }

    @Test
    @DisplayName("Should empty the queue on purge")
    void testPurge() {
        queue.send(job("job_1", JobPriority.NORMAL));
        queue.send(job("job_2", JobPriority.NORMAL));

        assertThat(queue.purge()).isEqualTo(2);
        assertThat(queue.receive(10)).isEmpty();
    }
}
