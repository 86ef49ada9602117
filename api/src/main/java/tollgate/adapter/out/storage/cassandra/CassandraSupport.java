package tollgate.adapter.out.storage.cassandra;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.Statement;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;

/**
 * Async statement execution shared by the Cassandra repositories.
 *
 * <p>Results are emitted on the caller's Vert.x context when there is one, so
 * downstream stages keep running where the request started.
 */
final class CassandraSupport {

    private final CqlSession session;

    CassandraSupport(CqlSession session) {
        this.session = session;
    }

    CqlSession session() {
        return session;
    }

    Uni<AsyncResultSet> execute(Statement<?> statement) {
        final var executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(statement).toCompletableFuture())
                .emitOn(executor);
    }

    /**
     * Execute and collect rows from every page.
     */
    Uni<List<Row>> executeAll(Statement<?> statement) {
        return execute(statement).flatMap(rs -> collect(rs, new ArrayList<>()));
    }

    private Uni<List<Row>> collect(AsyncResultSet rs, List<Row> rows) {
        for (var row : rs.currentPage()) {
            rows.add(row);
        }
        if (!rs.hasMorePages()) {
            return Uni.createFrom().item(rows);
        }
        final var executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> rs.fetchNextPage().toCompletableFuture())
                .emitOn(executor)
                .flatMap(next -> collect(next, rows));
    }

    /**
     * Gets an executor that will run on the Vert.x context if available,
     * otherwise falls back to the default worker pool.
     */
    static Executor getContextExecutor() {
        Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
