/**
 * Response caching: key derivation, the bounded LRU/TTL store, warm-up and background cleanup.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aimux.cache.KeyGenerator} - Hashing, semantic and parameter key strategies</li>
 *   <li>{@link fr.lapetina.aimux.cache.ResponseCache} - Thread-safe store with adaptive TTL and LRU eviction</li>
 *   <li>{@link fr.lapetina.aimux.cache.CacheWarmer} - Issues representative queries through the dispatcher</li>
 *   <li>{@link fr.lapetina.aimux.cache.CacheCleaner} - Scheduled removal of expired entries</li>
 * </ul>
 *
 * <h2>Limits</h2>
 * <p>The cache is bounded both by entry count and by estimated memory (serialized size plus a
 * fixed overhead per entry). Whenever either limit is exceeded after an insert, least recently
 * used entries are evicted until both hold again.
 */
package fr.lapetina.aimux.cache;
