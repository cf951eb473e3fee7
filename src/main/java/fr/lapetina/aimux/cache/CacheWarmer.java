package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.CompletionResponse;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Pre-populates the cache by sending representative queries through the normal dispatch path.
 *
 * <p>Queries come from a built-in set, issued once per model served by the configured
 * providers, and from operator-supplied {@code warmup.queries}. Queries whose key is already
 * cached are skipped. A failing query is logged and counted; warming never aborts.
 */
public final class CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    static final List<String> BUILT_IN_PROMPTS = List.of(
            "Hello, how are you?",
            "What is the weather today?",
            "Explain machine learning",
            "Write a simple function",
            "Help me debug this code"
    );
    static final int BUILT_IN_MAX_TOKENS = 100;
    static final double BUILT_IN_TEMPERATURE = 0.7;

    private final ResponseCache cache;
    private final Function<CompletionRequest, CompletionResponse> dispatch;
    private final List<ProviderDescriptor> providers;
    private final AimuxConfig.WarmupConfig config;

    public CacheWarmer(
            ResponseCache cache,
            Function<CompletionRequest, CompletionResponse> dispatch,
            List<ProviderDescriptor> providers,
            AimuxConfig.WarmupConfig config
    ) {
        this.cache = cache;
        this.dispatch = dispatch;
        this.providers = List.copyOf(providers);
        this.config = config;
    }

    /**
     * Runs every warm-up query once.
     */
    public WarmupReport warm() {
        List<CompletionRequest> queries = buildQueries();
        log.info("Cache warm-up started: queries={}", queries.size());

        int warmed = 0;
        int skipped = 0;
        int failed = 0;

        for (CompletionRequest query : queries) {
            String key = cache.generateKey(query.model(), query.payload());
            if (cache.contains(key)) {
                skipped++;
                continue;
            }
            try {
                CompletionResponse response = dispatch.apply(query);
                if (response.isSuccess()) {
                    warmed++;
                    log.debug("Warm-up query cached: model={}, provider={}", query.model(), response.provider());
                } else {
                    failed++;
                    log.warn("Warm-up query failed: model={}, errorType={}, message={}",
                            query.model(), response.errorType(), response.errorMessage());
                }
            } catch (Exception e) {
                failed++;
                log.warn("Warm-up query threw: model={}, error={}", query.model(), e.getMessage(), e);
            }
        }

        WarmupReport report = new WarmupReport(queries.size(), warmed, skipped, failed);
        log.info("Cache warm-up finished: attempted={}, warmed={}, skipped={}, failed={}",
                report.attempted(), report.warmed(), report.skipped(), report.failed());
        return report;
    }

    List<CompletionRequest> buildQueries() {
        List<CompletionRequest> queries = new ArrayList<>();

        if (config.isBuiltInQueries()) {
            for (String model : warmupModels()) {
                for (String prompt : BUILT_IN_PROMPTS) {
                    queries.add(query(model, prompt, BUILT_IN_MAX_TOKENS, BUILT_IN_TEMPERATURE));
                }
            }
        }

        for (AimuxConfig.WarmupQuery configured : config.getQueries()) {
            String model = configured.getModel() != null ? configured.getModel() : config.getDefaultModel();
            if (model == null || configured.getPrompt() == null) {
                log.warn("Skipping incomplete warm-up query: model={}, prompt={}", model, configured.getPrompt());
                continue;
            }
            queries.add(query(model, configured.getPrompt(), configured.getMaxTokens(), configured.getTemperature()));
        }
        return queries;
    }

    /**
     * One model per enabled provider: its first declared model in sorted order, or the
     * configured default model when it declares none.
     */
    private Set<String> warmupModels() {
        Set<String> models = new LinkedHashSet<>();
        for (ProviderDescriptor provider : providers) {
            if (!provider.enabled()) {
                continue;
            }
            if (!provider.models().isEmpty()) {
                models.add(new TreeSet<>(provider.models()).first());
            } else if (config.getDefaultModel() != null) {
                models.add(config.getDefaultModel());
            } else {
                log.debug("No warm-up model for provider: provider={}", provider.name());
            }
        }
        return models;
    }

    private static CompletionRequest query(String model, String prompt, int maxTokens, double temperature) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("model", model);
        payload.putArray("messages").addObject()
                .put("role", "user")
                .put("content", prompt);
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);
        return CompletionRequest.builder()
                .payload(payload)
                .correlationId("cache-warmup")
                .build();
    }

    /**
     * Outcome of one warm-up run.
     */
    public record WarmupReport(int attempted, int warmed, int skipped, int failed) {
    }
}
