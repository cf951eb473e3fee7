/**
 * Request routing: validation, cache lookup, provider selection with failover, and the
 * JSON envelope returned to callers.
 */
package fr.lapetina.aimux.dispatch;
