/**
 * Configuration loading and validation.
 *
 * <p>Configuration is read once at startup from YAML. Invalid configuration is fatal:
 * {@link fr.lapetina.aimux.infrastructure.config.ConfigLoader.ConfigurationException} stops the process
 * before any request is served.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, worker threads, body size limit)</li>
 *   <li>{@code providers} - Ordered upstream provider list; order drives failover fallback</li>
 *   <li>{@code strategy} - Load balancing strategy and moving-average weight</li>
 *   <li>{@code cache} - Key strategy, capacity limits, TTL policy and cleanup interval</li>
 *   <li>{@code failover} - Cooldown and exponential backoff</li>
 *   <li>{@code timeouts} - Request, connect and health-check timeouts</li>
 *   <li>{@code healthCheck} - Background provider probing</li>
 *   <li>{@code validation} - Request shape limits</li>
 *   <li>{@code metrics} - Prometheus prefix and metrics ring buffer</li>
 *   <li>{@code warmup} - Cache warm-up queries</li>
 * </ul>
 */
package fr.lapetina.aimux.infrastructure.config;
