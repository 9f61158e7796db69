package com.example.paylog.service;

import com.example.paylog.model.PipelineEvent;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broadcasts {@link PipelineEvent}s to every registered listener through a Disruptor ring.
 * Publishing never blocks: when the ring is full the event is dropped and counted.
 */
@Slf4j
@Component
public class PipelineEventBus {

    private final int ringBufferSize;
    private final List<PipelineEventListener> listeners = new CopyOnWriteArrayList<>();

    private Disruptor<PipelineEvent> disruptor;
    private RingBuffer<PipelineEvent> ringBuffer;
    private volatile boolean running;

    private final AtomicLong publishedEvents = new AtomicLong(0);
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public PipelineEventBus(@Value("${paylog.events.ring-buffer-size:1024}") int ringBufferSize,
                            List<PipelineEventListener> listeners) {
        this.ringBufferSize = ringBufferSize;
        this.listeners.addAll(listeners);
    }

    @PostConstruct
    public void start() {
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger threadCount = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "pipeline-events-" + threadCount.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };

        // ring size must be a power of 2
        int bufferSize = Integer.bitCount(ringBufferSize) == 1 ? ringBufferSize : Integer.highestOneBit(ringBufferSize) << 1;

        // several ingestion workers publish concurrently
        disruptor = new Disruptor<>(
                PipelineEvent::new,
                bufferSize,
                threadFactory,
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        disruptor.handleEventsWith(new DispatchingHandler());
        ringBuffer = disruptor.start();
        running = true;

        log.info("Pipeline event bus started: ringBufferSize={}, listeners={}", bufferSize, listeners.size());
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (disruptor != null) {
            disruptor.shutdown();
        }
        log.info("Pipeline event bus stopped - published: {}, dropped: {}", publishedEvents.get(), droppedEvents.get());
    }

    public void subscribe(PipelineEventListener listener) {
        listeners.add(listener);
    }

    /**
     * @return false if the bus is stopped or the ring is full
     */
    public boolean publish(PipelineEvent event) {
        if (!running) {
            log.debug("Event bus not running, discarding {}", event.getType());
            return false;
        }
        boolean published = ringBuffer.tryPublishEvent((slot, sequence, source) -> slot.copyFrom(source), event);
        if (published) {
            publishedEvents.incrementAndGet();
        } else {
            droppedEvents.incrementAndGet();
            log.warn("Pipeline event ring is full! Dropping event: {}", event);
        }
        return published;
    }

    public long getPublishedEvents() {
        return publishedEvents.get();
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    private class DispatchingHandler implements EventHandler<PipelineEvent> {
        @Override
        public void onEvent(PipelineEvent event, long sequence, boolean endOfBatch) {
            for (PipelineEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Listener {} failed on {}", listener.getClass().getSimpleName(), event.getType(), e);
                }
            }
        }
    }
}
