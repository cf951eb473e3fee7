package fr.lapetina.aimux.domain.provider;

import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Capability exposed by every upstream provider.
 *
 * <p>Implementations must be thread-safe; the dispatcher calls {@link #forward} from
 * many request threads and the health checker calls {@link #healthCheck} from its own.
 * Transport failures complete the future exceptionally. Any HTTP answer, including
 * error statuses, completes it normally with a {@link ProviderReply}.
 */
public interface Provider {

    /**
     * Returns the static description this provider was built from.
     */
    ProviderDescriptor descriptor();

    /**
     * Unique provider name, as used by failover and load-balancing state.
     */
    default String getName() {
        return descriptor().name();
    }

    /**
     * Sends a completion request upstream.
     */
    CompletableFuture<ProviderReply> forward(CompletionRequest request);

    /**
     * Probes the provider. Completes with {@code false} rather than exceptionally
     * when the provider is unreachable.
     */
    CompletableFuture<Boolean> healthCheck();
}
