package tollgate.adapter.out.counter.redis;

import java.time.Duration;
import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import tollgate.core.model.ratelimit.CounterStoreUnavailableException;
import tollgate.core.port.out.CounterStore;

/**
 * Redis-backed counter store shared by all instances.
 *
 * <p>Increment and expiry run in one Lua script, so a counter can never be left
 * without a TTL, and concurrent increments of the same key are serialized by
 * Redis.
 *
 * <p>Key format: {@code {prefix}{identity}:{window}:{windowStartEpochSecond}}
 */
public final class RedisCounterStore implements CounterStore {

    private static final String NAME = "redis";

    /**
     * Lua script for atomic increment with expiry on creation.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - time to live in milliseconds</li>
     * </ol>
     *
     * <p>Returns the counter value after incrementing.
     */
    static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            if redis.call('PTTL', KEYS[1]) < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return count
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveValueCommands<String, Long> valueCommands;

    public RedisCounterStore(ReactiveRedisDataSource redisDataSource) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.valueCommands = redisDataSource.value(String.class, Long.class);
    }

    @Override
    public Uni<Long> incrementAndGet(String key, Duration ttl) {
        // EVAL script numkeys key [key...] arg [arg...]
        return redisDataSource
                .execute(
                        "EVAL",
                        INCREMENT_SCRIPT,
                        "1", // numkeys
                        key, // KEYS[1]
                        String.valueOf(Math.max(1, ttl.toMillis())) // ARGV[1]
                        )
                .map(RedisCounterStore::toCount)
                .onFailure(error -> !(error instanceof CounterStoreUnavailableException))
                .transform(error -> new CounterStoreUnavailableException("Redis increment failed for " + key, error));
    }

    @Override
    public Uni<Long> get(String key) {
        return valueCommands
                .get(key)
                .map(value -> value != null ? value : 0L)
                .onFailure()
                .transform(error -> new CounterStoreUnavailableException("Redis read failed for " + key, error));
    }

    @Override
    public Uni<Void> delete(List<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return keyCommands
                .del(keys.toArray(new String[0]))
                .replaceWithVoid()
                .onFailure()
                .transform(error -> new CounterStoreUnavailableException("Redis delete failed", error));
    }

    @Override
    public String name() {
        return NAME;
    }

    private static Long toCount(Response response) {
        if (response == null) {
            throw new CounterStoreUnavailableException("Null response from Redis");
        }
        return response.toLong();
    }
}
