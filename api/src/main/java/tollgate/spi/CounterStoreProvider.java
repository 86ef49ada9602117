package tollgate.spi;

import tollgate.core.port.out.CounterStore;

/**
 * Service Provider Interface for rate limit counter stores.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * selected based on priority. Higher priority providers are preferred.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Default, single-instance only</li>
 *   <li>Redis (priority 10) - Shared across instances, recommended for production</li>
 * </ul>
 *
 * <p>To create a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Register in {@code META-INF/services/tollgate.spi.CounterStoreProvider}</li>
 *   <li>Return appropriate priority</li>
 * </ol>
 *
 * <p>Every store returned by a provider must increment and set expiry as one
 * atomic unit. Stores that cannot guarantee this must not be registered.
 *
 * @see tollgate.core.port.out.CounterStore
 */
public interface CounterStoreProvider {

    /**
     * Return the priority of this provider.
     *
     * <p>Standard priorities:
     * <ul>
     *   <li>0 - In-memory (fallback)</li>
     *   <li>10 - Redis (production default)</li>
     *   <li>100+ - Custom implementations</li>
     * </ul>
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider is available in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create a counter store instance.
     *
     * <p>Called once during application startup. The returned instance must be
     * thread-safe.
     *
     * @return the counter store
     */
    CounterStore createCounterStore();
}
