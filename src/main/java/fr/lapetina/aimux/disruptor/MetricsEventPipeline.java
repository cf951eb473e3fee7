package fr.lapetina.aimux.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.aimux.disruptor.handlers.MetricsEventHandler;
import fr.lapetina.aimux.domain.event.DispatchEvent;
import fr.lapetina.aimux.domain.event.DispatchEventFactory;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.CompletionResponse;
import fr.lapetina.aimux.domain.model.ErrorType;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves metrics recording off the request path.
 *
 * <p>Dispatcher threads publish one event per outcome with {@code tryNext()}; when the ring
 * buffer is full the event is dropped and counted rather than delaying the caller. A single
 * consumer thread feeds the Micrometer registry.
 *
 * <p>Producer type is MULTI since every HTTP worker thread publishes.
 */
public final class MetricsEventPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsEventPipeline.class);

    private final Disruptor<DispatchEvent> disruptor;
    private final RingBuffer<DispatchEvent> ringBuffer;
    private final MetricsEventHandler handler;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private MetricsEventPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.handler = new MetricsEventHandler(builder.metricsRegistry);

        this.disruptor = new Disruptor<>(
                new DispatchEventFactory(),
                builder.ringBufferSize,
                new MetricsThreadFactory("metrics-events"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new MetricsExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("MetricsEventPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("MetricsEventPipeline started");
        }
    }

    /**
     * Publishes the terminal outcome of a request.
     *
     * @return false when the event was dropped
     */
    public boolean publishCompleted(CompletionRequest request, CompletionResponse response) {
        long sequence = claim();
        if (sequence < 0) {
            return false;
        }
        try {
            DispatchEvent event = ringBuffer.get(sequence);
            event.initializeCompleted(
                    request.requestId(),
                    request.correlationId(),
                    request.model(),
                    response.provider(),
                    request.type().label(),
                    response.statusCode(),
                    response.errorType(),
                    response.elapsedMs(),
                    response.retryCount(),
                    response.cacheHit()
            );
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    /**
     * Publishes a failed provider attempt.
     *
     * @return false when the event was dropped
     */
    public boolean publishAttemptFailed(
            CompletionRequest request,
            String provider,
            ErrorType errorType,
            long latencyMs
    ) {
        long sequence = claim();
        if (sequence < 0) {
            return false;
        }
        try {
            ringBuffer.get(sequence).initializeAttemptFailed(
                    request.requestId(), request.correlationId(), request.model(),
                    provider, errorType, latencyMs
            );
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    private long claim() {
        if (!running.get()) {
            return -1;
        }
        try {
            long sequence = ringBuffer.tryNext();
            metricsRegistry.setRingBufferRemaining(ringBuffer.remainingCapacity());
            return sequence;
        } catch (InsufficientCapacityException e) {
            metricsRegistry.incrementDroppedEvents();
            log.debug("Metrics ring buffer full, event dropped");
            return -1;
        }
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getProcessedCount() {
        return handler.getProcessedCount();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down MetricsEventPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("MetricsEventPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("MetricsEventPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class MetricsThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        MetricsThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class MetricsExceptionHandler implements ExceptionHandler<DispatchEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, DispatchEvent event) {
            log.error("Exception in metrics handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during metrics pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during metrics pipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(AimuxConfig.MetricsConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public MetricsEventPipeline build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new MetricsEventPipeline(this);
        }
    }
}
