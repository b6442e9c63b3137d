package com.hpcwatch.source;

import com.hpcwatch.config.SourceConfig.WarehouseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Runs parameterized SQL against the job-accounting warehouse.
 * <p>
 * The wait-time column of the job table is not fixed across warehouse versions, so it is
 * discovered through {@code information_schema} on first use and remembered for the lifetime
 * of the process.
 */
@Slf4j
@Component
public class WarehouseSourceAdapter {

    static final String WAIT_COLUMN_SQL =
            "SELECT column_name FROM information_schema.columns "
                    + "WHERE table_schema = ? AND table_name = ? AND LOWER(column_name) LIKE '%wait%' "
                    + "ORDER BY ordinal_position";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    private final JdbcTemplate jdbcTemplate;
    private final ExecutorService fetchExecutor;
    private final WarehouseProperties properties;

    private volatile String waitColumn;

    public WarehouseSourceAdapter(JdbcTemplate jdbcTemplate, @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
                                  WarehouseProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public CompletableFuture<FetchResult<List<Map<String, Object>>>> query(String name, String sql, Object... args) {
        try {
            return CompletableFuture.supplyAsync(() -> queryNow(name, sql, args), fetchExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(FetchResult.failure(FetchError.unreachable(name, e)));
        }
    }

    FetchResult<List<Map<String, Object>>> queryNow(String name, String sql, Object... args) {
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, args);
            log.debug("Warehouse query '{}' returned {} rows", name, rows.size());
            return FetchResult.success(rows);
        } catch (DataAccessException e) {
            return FetchResult.failure(classify(name, e));
        }
    }

    public synchronized FetchResult<String> waitTimeColumn() {
        if (waitColumn != null) {
            return FetchResult.success(waitColumn);
        }

        String source = "introspect " + properties.getSchema() + "." + properties.getJobTable();
        List<String> candidates;
        try {
            candidates = jdbcTemplate.queryForList(WAIT_COLUMN_SQL, String.class,
                    properties.getSchema(), properties.getJobTable());
        } catch (DataAccessException e) {
            return FetchResult.failure(classify(source, e));
        }

        if (candidates.isEmpty()) {
            return FetchResult.failure(FetchError.schemaMismatch(source,
                    "no wait-time column in " + properties.getSchema() + "." + properties.getJobTable()));
        }

        String preferred = properties.getPreferredWaitColumn();
        String chosen = candidates.stream()
                .filter(c -> preferred != null && c.equalsIgnoreCase(preferred))
                .findFirst()
                .orElse(candidates.get(0));

        if (!IDENTIFIER.matcher(chosen).matches()) {
            return FetchResult.failure(FetchError.schemaMismatch(source, "unusable column name '" + chosen + "'"));
        }

        waitColumn = chosen.toLowerCase(Locale.ROOT);
        log.info("Discovered wait-time column {}.{}.{} (candidates: {})",
                properties.getSchema(), properties.getJobTable(), waitColumn, candidates);
        return FetchResult.success(waitColumn);
    }

    static FetchError classify(String source, DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException || e instanceof QueryTimeoutException) {
            return FetchError.unreachable(source, e.getMostSpecificCause());
        }
        return FetchError.rejected(source, e.getMostSpecificCause());
    }
}
