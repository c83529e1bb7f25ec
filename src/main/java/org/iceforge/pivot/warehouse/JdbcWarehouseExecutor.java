package org.iceforge.pivot.warehouse;

import org.iceforge.pivot.error.ExecutionTimeoutException;
import org.iceforge.pivot.error.WarehouseExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Blocking JDBC wrapped for the reactive callers. Statements run on the bounded elastic
 * scheduler with both a driver-side query timeout and a reactive timeout; whichever fires
 * first ends the request, and a cancelled subscription cancels the statement.
 */
@Component
public class JdbcWarehouseExecutor implements WarehouseExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcWarehouseExecutor.class);

    private final DataSource dataSource;

    public JdbcWarehouseExecutor(DataSource warehouseDataSource) {
        this.dataSource = Objects.requireNonNull(warehouseDataSource);
    }

    @Override
    public Mono<QueryResult> execute(String sql, Duration timeout) {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(timeout, "timeout");
        return Mono.defer(() -> {
            AtomicReference<Statement> running = new AtomicReference<>();
            return Mono.fromCallable(() -> run(sql, timeout, running))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnCancel(() -> cancel(running.get()))
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new ExecutionTimeoutException(timeout, e))
                    .onErrorMap(SQLTimeoutException.class, e -> new ExecutionTimeoutException(timeout, e))
                    .onErrorMap(SQLException.class,
                            e -> new WarehouseExecutionException(e.getMessage(), e));
        });
    }

    private QueryResult run(String sql, Duration timeout, AtomicReference<Statement> running) throws SQLException {
        long start = System.nanoTime();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            running.set(stmt);
            stmt.setQueryTimeout(timeoutSeconds(timeout));
            try (ResultSet rs = stmt.executeQuery(sql)) {
                ResultSetMetaData meta = rs.getMetaData();
                int count = meta.getColumnCount();
                List<String> columns = new ArrayList<>(count);
                for (int i = 1; i <= count; i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= count; i++) {
                        row.put(columns.get(i - 1), readValue(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                log.info("Warehouse query returned {} rows in {} ms", rows.size(), elapsedMs);
                return new QueryResult(sql, columns, rows, rows.size(), elapsedMs);
            }
        } finally {
            running.set(null);
        }
    }

    private static Object readValue(Object value) {
        if (value instanceof java.sql.Date d) {
            return d.toLocalDate();
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime();
        }
        return value;
    }

    private static void cancel(Statement stmt) {
        if (stmt == null) {
            return;
        }
        try {
            stmt.cancel();
            log.info("Cancelled running warehouse statement");
        } catch (SQLException e) {
            log.warn("Failed to cancel warehouse statement: {}", e.getMessage());
        }
    }

    private static int timeoutSeconds(Duration timeout) {
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }
}
