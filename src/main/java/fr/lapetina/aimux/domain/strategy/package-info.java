/**
 * Provider selection: strategies and the metrics-aware {@link fr.lapetina.aimux.domain.strategy.LoadBalancer}.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round_robin}</td><td>Cycles through candidates in order</td></tr>
 *   <tr><td>{@code least_connections}</td><td>Fewest open connections, ties to list order</td></tr>
 *   <tr><td>{@code fastest_response}</td><td>Lowest moving-average response time, unsampled first</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random choice</td></tr>
 *   <tr><td>{@code weighted_response}</td><td>Random choice weighted by inverse response time</td></tr>
 *   <tr><td>{@code adaptive}</td><td>Combined speed and spare-capacity score</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.aimux.domain.strategy.LoadBalancingStrategy} and register
 * with {@link fr.lapetina.aimux.domain.strategy.StrategyFactory}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancer balancer = new LoadBalancer(StrategyFactory.create("fastest_response").orElseThrow());
 * balancer.updateResponseTime("openai", 120);
 * Optional<String> provider = balancer.selectProvider(List.of("openai", "anthropic"));
 * }</pre>
 */
package fr.lapetina.aimux.domain.strategy;
