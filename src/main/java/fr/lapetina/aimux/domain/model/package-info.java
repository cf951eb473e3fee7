/**
 * Domain model classes shared by the dispatcher, the cache and the provider layer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aimux.domain.model.CompletionRequest} - Immutable inbound request with its JSON payload</li>
 *   <li>{@link fr.lapetina.aimux.domain.model.CompletionResponse} - Immutable dispatch outcome</li>
 *   <li>{@link fr.lapetina.aimux.domain.model.ProviderDescriptor} - Static provider description from configuration</li>
 *   <li>{@link fr.lapetina.aimux.domain.model.RequestType} - Request classification (regular, thinking, vision, tools)</li>
 *   <li>{@link fr.lapetina.aimux.domain.model.ErrorType} - Categorized error types mapped to HTTP statuses</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types are records or enums. JSON payloads are deep-copied on the way in and out,
 * so a caller mutating a returned tree never affects shared state.
 */
package fr.lapetina.aimux.domain.model;
