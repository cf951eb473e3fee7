/**
 * aimux - caching, failover-aware dispatcher in front of OpenAI-compatible AI providers.
 *
 * <p>Incoming completion requests are validated, answered from the response cache when
 * possible, and otherwise routed to one of the configured providers. A provider that fails
 * is put into cooldown and the request moves on to the next one.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aimux.DispatcherFactory} - builds a fully wired dispatcher from
 *       YAML configuration</li>
 *   <li>{@link fr.lapetina.aimux.AimuxApplication} - standalone HTTP server exposing
 *       {@code /v1/chat/completions}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("config.yaml").start()) {
 *     Dispatcher dispatcher = factory.getDispatcher();
 *
 *     CompletionRequest request = CompletionRequest.ofChat("gpt-4o-mini", "Hello!");
 *     CompletionResponse response = dispatcher.dispatch(request);
 *
 *     System.out.println(response.body());
 * }
 * }</pre>
 *
 * @see fr.lapetina.aimux.dispatch.Dispatcher
 * @see fr.lapetina.aimux.cache.ResponseCache
 * @see fr.lapetina.aimux.infrastructure.health.FailoverManager
 */
package fr.lapetina.aimux;
