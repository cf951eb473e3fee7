package fr.lapetina.aimux.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.aimux.domain.event.DispatchEvent;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.atomic.LongAdder;

/**
 * Consumes dispatch events and records them in the metrics registry.
 */
public final class MetricsEventHandler implements EventHandler<DispatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsEventHandler.class);

    private final MetricsRegistry metricsRegistry;
    private final LongAdder processed = new LongAdder();

    public MetricsEventHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(DispatchEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);
        try {
            if (event.getKind() == DispatchEvent.Kind.ATTEMPT_FAILED) {
                recordAttemptFailure(event);
            } else if (event.getKind() == DispatchEvent.Kind.REQUEST_COMPLETED) {
                recordCompletion(event);
            }
        } finally {
            processed.increment();
            event.clear();
            clearMDC();
        }
    }

    private void recordCompletion(DispatchEvent event) {
        String model = event.getModel() != null ? event.getModel() : "unknown";
        String provider = event.getProvider() != null ? event.getProvider() : "none";

        String outcome;
        if (!event.isSuccess()) {
            outcome = "error";
        } else if (event.isCacheHit()) {
            outcome = "cache_hit";
        } else {
            outcome = "success";
        }

        metricsRegistry.incrementRequestCount(model, provider, outcome);
        metricsRegistry.recordLatency(model, provider, Duration.ofMillis(event.getLatencyMs()));
        metricsRegistry.incrementRetries(event.getRetryCount());

        if (!event.isSuccess()) {
            metricsRegistry.incrementErrorCount(model, provider, event.getErrorType());
            log.debug("Request error recorded: model={}, provider={}, errorType={}, status={}",
                    model, provider, event.getErrorType(), event.getStatusCode());
        }
    }

    private void recordAttemptFailure(DispatchEvent event) {
        String provider = event.getProvider() != null ? event.getProvider() : "none";
        metricsRegistry.incrementAttemptFailure(provider, event.getErrorType());
    }

    private void setupMDC(DispatchEvent event) {
        if (event.getRequestId() != null) {
            MDC.put("requestId", event.getRequestId());
        }
        if (event.getCorrelationId() != null) {
            MDC.put("correlationId", event.getCorrelationId());
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("correlationId");
    }

    public long getProcessedCount() {
        return processed.sum();
    }
}
