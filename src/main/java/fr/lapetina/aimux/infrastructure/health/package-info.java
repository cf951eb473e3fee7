/**
 * Provider health: the failover state machine, cooldown backoff, the provider registry and
 * the background health checker.
 *
 * <h2>States</h2>
 * <pre>
 *   AVAILABLE --markFailed(cooldown)--> FAILED(until = failedAt + cooldown)
 *   FAILED    --markHealthy-----------> AVAILABLE
 *   FAILED, now >= until: selectable, failure history kept until markHealthy
 * </pre>
 */
package fr.lapetina.aimux.infrastructure.health;
