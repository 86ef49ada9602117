package tollgate.core.port.out;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.common.StorageHealth;

/**
 * Health check for the backend holding usage records and daily aggregates.
 *
 * <p>Implementations report an unreachable backend as an unhealthy
 * {@link StorageHealth} rather than a failed {@code Uni}; the readiness check
 * still treats a failure as down.
 */
@FunctionalInterface
public interface StorageHealthIndicator {

    Uni<StorageHealth> check();
}
