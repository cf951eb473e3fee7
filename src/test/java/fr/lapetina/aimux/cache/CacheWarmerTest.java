package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.CompletionResponse;
import fr.lapetina.aimux.domain.model.ErrorType;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class CacheWarmerTest {

    private ResponseCache cache;
    private List<CompletionRequest> dispatched;
    private AimuxConfig.WarmupConfig config;

    @BeforeEach
    void setUp() {
        cache = ResponseCache.builder().build();
        dispatched = new ArrayList<>();
        config = new AimuxConfig.WarmupConfig();
    }

    /**
     * Stands in for the dispatcher: records the query and caches a canned answer.
     */
    private Function<CompletionRequest, CompletionResponse> cachingDispatch() {
        return request -> {
            dispatched.add(request);
            String key = cache.generateKey(request.model(), request.payload());
            cache.put(key, JsonNodeFactory.instance.objectNode().put("ok", true), Duration.ofMinutes(5));
            return CompletionResponse.success(request.requestId(), request.model(),
                    JsonNodeFactory.instance.objectNode(), "p1", 1, 0, false);
        };
    }

    private static ProviderDescriptor provider(String name, Set<String> models, boolean enabled) {
        return ProviderDescriptor.builder()
                .name(name)
                .endpoint("http://localhost:9999")
                .models(models)
                .enabled(enabled)
                .build();
    }

    @Test
    @DisplayName("should issue built-in queries once per enabled provider model")
    void shouldIssueBuiltInQueriesPerModel() {
        CacheWarmer warmer = new CacheWarmer(cache, cachingDispatch(), List.of(
                provider("a", Set.of("model-b", "model-a"), true),
                provider("b", Set.of("model-c"), true),
                provider("c", Set.of("model-d"), false)
        ), config);

        CacheWarmer.WarmupReport report = warmer.warm();

        assertThat(report.attempted()).isEqualTo(10);
        assertThat(report.warmed()).isEqualTo(10);
        assertThat(dispatched).extracting(CompletionRequest::model)
                .containsOnly("model-a", "model-c");
        assertThat(dispatched.get(0).payload().get("max_tokens").asInt()).isEqualTo(100);
        assertThat(dispatched.get(0).correlationId()).isEqualTo("cache-warmup");
    }

    @Test
    @DisplayName("should skip queries that are already cached")
    void shouldSkipCachedQueries() {
        CacheWarmer warmer = new CacheWarmer(cache, cachingDispatch(),
                List.of(provider("a", Set.of("m"), true)), config);

        warmer.warm();
        dispatched.clear();
        CacheWarmer.WarmupReport second = warmer.warm();

        assertThat(second.skipped()).isEqualTo(5);
        assertThat(second.warmed()).isZero();
        assertThat(dispatched).isEmpty();
    }

    @Test
    @DisplayName("should add configured queries and fall back to the default model")
    void shouldAddConfiguredQueries() {
        config.setBuiltInQueries(false);
        config.setDefaultModel("default-model");
        AimuxConfig.WarmupQuery withModel = new AimuxConfig.WarmupQuery();
        withModel.setModel("custom");
        withModel.setPrompt("Summarize this");
        AimuxConfig.WarmupQuery withoutModel = new AimuxConfig.WarmupQuery();
        withoutModel.setPrompt("Translate this");
        AimuxConfig.WarmupQuery incomplete = new AimuxConfig.WarmupQuery();
        incomplete.setModel("custom");
        config.setQueries(List.of(withModel, withoutModel, incomplete));

        List<CompletionRequest> queries = new CacheWarmer(cache, cachingDispatch(), List.of(), config).buildQueries();

        assertThat(queries).extracting(CompletionRequest::model).containsExactly("custom", "default-model");
    }

    @Test
    @DisplayName("should count failures without aborting the run")
    void shouldCountFailures() {
        Function<CompletionRequest, CompletionResponse> flaky = request -> {
            if (request.payload().toString().contains("weather")) {
                throw new IllegalStateException("boom");
            }
            if (request.payload().toString().contains("debug")) {
                return CompletionResponse.error(request.requestId(), request.model(),
                        ErrorType.ALL_PROVIDERS_FAILED, "down");
            }
            return CompletionResponse.success(request.requestId(), request.model(),
                    JsonNodeFactory.instance.objectNode(), "p1", 1, 0, false);
        };
        CacheWarmer warmer = new CacheWarmer(cache, flaky, List.of(provider("a", Set.of("m"), true)), config);

        CacheWarmer.WarmupReport report = warmer.warm();

        assertThat(report.attempted()).isEqualTo(5);
        assertThat(report.failed()).isEqualTo(2);
        assertThat(report.warmed()).isEqualTo(3);
    }
}
