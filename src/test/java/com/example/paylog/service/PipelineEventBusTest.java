package com.example.paylog.service;

import com.example.paylog.model.PipelineEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineEventBusTest {

    private PipelineEventBus bus;

    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.stop();
        }
    }

    @Test
    void listenersSeeEventsInPublishOrder() throws InterruptedException {
        List<PipelineEvent.Type> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        bus = new PipelineEventBus(16, List.of(event -> {
            seen.add(event.getType());
            done.countDown();
        }));
        bus.start();

        bus.publish(PipelineEvent.financialDetected("VM-HDFCBK", "h1"));
        bus.publish(PipelineEvent.persisted("t1", "h1"));
        bus.publish(PipelineEvent.syncCompleted("t1"));

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly(
                PipelineEvent.Type.FINANCIAL_MESSAGE_DETECTED,
                PipelineEvent.Type.PERSISTED,
                PipelineEvent.Type.SYNC_COMPLETED);
        assertThat(bus.getPublishedEvents()).isEqualTo(3);
    }

    @Test
    void failingListenerDoesNotStopOthers() throws InterruptedException {
        CountDownLatch delivered = new CountDownLatch(1);
        bus = new PipelineEventBus(16, List.of());
        bus.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(event -> delivered.countDown());
        bus.start();

        bus.publish(PipelineEvent.error("VM-HDFCBK", "oops"));

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void fullRingDropsInsteadOfBlocking() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch firstTaken = new CountDownLatch(1);
        bus = new PipelineEventBus(4, List.of(event -> {
            firstTaken.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        bus.start();

        try {
            int accepted = 0;
            for (int i = 0; i < 6; i++) {
                if (bus.publish(PipelineEvent.queued("t" + i, "offline"))) {
                    accepted++;
                }
            }

            assertThat(firstTaken.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(accepted).isEqualTo(4);
            assertThat(bus.getDroppedEvents()).isEqualTo(2);
        } finally {
            release.countDown();
        }
    }

    @Test
    void stoppedBusRejectsEvents() {
        bus = new PipelineEventBus(8, List.of());

        assertThat(bus.publish(PipelineEvent.nonFinancial("FRIEND"))).isFalse();
    }

    @Test
    void statisticsCountLifecycleEvents() {
        PipelineStatistics statistics = new PipelineStatistics();
        statistics.recordReceived();
        statistics.recordReceived();
        statistics.onEvent(PipelineEvent.financialDetected("VM-HDFCBK", "h1"));
        statistics.onEvent(PipelineEvent.parsed("VM-HDFCBK", "h1", "1500 DEBIT"));
        statistics.onEvent(PipelineEvent.parsed("VM-HDFCBK", "h2", "20 DEBIT"));
        statistics.onEvent(PipelineEvent.validationFailed("VM-HDFCBK", "h2", List.of("Amount is required")));
        statistics.onEvent(PipelineEvent.duplicate("VM-HDFCBK", "h1"));

        PipelineStatistics.Snapshot snapshot = statistics.snapshot();

        assertThat(snapshot.getReceived()).isEqualTo(2);
        assertThat(snapshot.getFinancial()).isEqualTo(1);
        assertThat(snapshot.getParsed()).isEqualTo(2);
        assertThat(snapshot.getValidationPassed()).isEqualTo(1);
        assertThat(snapshot.getValidationFailed()).isEqualTo(1);
        assertThat(snapshot.getDuplicates()).isEqualTo(1);

        statistics.reset();
        assertThat(statistics.snapshot().getReceived()).isZero();
    }
}
