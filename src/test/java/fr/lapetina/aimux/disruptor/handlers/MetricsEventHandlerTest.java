package fr.lapetina.aimux.disruptor.handlers;

import fr.lapetina.aimux.domain.event.DispatchEvent;
import fr.lapetina.aimux.domain.model.ErrorType;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsEventHandlerTest {

    private MetricsRegistry metricsRegistry;
    private MetricsEventHandler handler;
    private DispatchEvent event;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("handler_test");
        handler = new MetricsEventHandler(metricsRegistry);
        event = new DispatchEvent();
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private double requests(String outcome) {
        MeterRegistry registry = metricsRegistry.getRegistry();
        var counter = registry.find("handler_test_requests_total").tag("outcome", outcome).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    @DisplayName("should count a successful request with its latency")
    void shouldRecordSuccess() {
        event.initializeCompleted("r1", "c1", "m", "provider-a", "regular", 200, null, 150, 0, false);

        handler.onEvent(event, 0, true);

        assertThat(requests("success")).isEqualTo(1.0);
        assertThat(metricsRegistry.getRegistry().find("handler_test_request_latency")
                .tag("provider", "provider-a").timer().count()).isEqualTo(1);
        assertThat(handler.getProcessedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should count cache hits separately")
    void shouldRecordCacheHit() {
        event.initializeCompleted("r1", "c1", "m", "provider-a", "regular", 200, null, 1, 0, true);

        handler.onEvent(event, 0, true);

        assertThat(requests("cache_hit")).isEqualTo(1.0);
        assertThat(requests("success")).isZero();
    }

    @Test
    @DisplayName("should count errors by type and label a missing provider")
    void shouldRecordError() {
        event.initializeCompleted("r1", "c1", "m", null, "regular", 503, ErrorType.NO_AVAILABLE_PROVIDER, 2, 0, false);

        handler.onEvent(event, 0, true);

        assertThat(requests("error")).isEqualTo(1.0);
        assertThat(metricsRegistry.getRegistry().find("handler_test_errors_total")
                .tag("provider", "none")
                .tag("type", "NO_AVAILABLE_PROVIDER")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count failed attempts per provider")
    void shouldRecordAttemptFailure() {
        event.initializeAttemptFailed("r1", "c1", "m", "provider-a", ErrorType.TIMEOUT, 300);

        handler.onEvent(event, 0, true);

        assertThat(metricsRegistry.getRegistry().find("handler_test_provider_failures_total")
                .tag("provider", "provider-a").counter().count()).isEqualTo(1.0);
        assertThat(requests("error")).isZero();
    }

    @Test
    @DisplayName("should clear the slot and the MDC after processing")
    void shouldClearAfterProcessing() {
        event.initializeCompleted("r1", "c1", "m", "p", "regular", 200, null, 1, 2, false);

        handler.onEvent(event, 0, true);

        assertThat(event.getRequestId()).isNull();
        assertThat(MDC.get("requestId")).isNull();
        assertThat(MDC.get("correlationId")).isNull();
    }
}
