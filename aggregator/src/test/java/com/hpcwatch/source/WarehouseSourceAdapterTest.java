package com.hpcwatch.source;

import com.hpcwatch.config.SourceConfig.WarehouseProperties;
import com.hpcwatch.support.FakeJdbcTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WarehouseSourceAdapterTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final FakeJdbcTemplate jdbc = new FakeJdbcTemplate();
    private final WarehouseSourceAdapter adapter = new WarehouseSourceAdapter(jdbc, executor, new WarehouseProperties());

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void returnsRowsAndPassesParameters() throws Exception {
        jdbc.rows("FROM modw.job_tasks", List.of(Map.of("job_date", "2026-03-09", "num_jobs", 4)));

        FetchResult<List<Map<String, Object>>> result =
                adapter.query("job-stats-7d", "SELECT * FROM modw.job_tasks WHERE x >= ?", 7).get();

        assertEquals(1, result.getValue().size());
        assertEquals(List.of(7), jdbc.executed().get(0).args());
    }

    @Test
    void classifiesConnectivityFailuresAsUnreachable() throws Exception {
        jdbc.failure("job_tasks", new DataAccessResourceFailureException("Communications link failure"));

        FetchResult<List<Map<String, Object>>> result = adapter.query("q", "SELECT 1 FROM job_tasks").get();

        assertEquals(FetchErrorType.SOURCE_UNREACHABLE, result.getError().type());
        assertEquals("q", result.getError().source());
    }

    @Test
    void classifiesOtherFailuresAsRejected() throws Exception {
        jdbc.failure("job_tasks", new BadSqlGrammarException("q", "SELECT nope FROM job_tasks",
                new SQLException("Unknown column 'nope'")));

        FetchResult<List<Map<String, Object>>> result = adapter.query("q", "SELECT nope FROM job_tasks").get();

        assertEquals(FetchErrorType.SOURCE_REJECTED, result.getError().type());
    }

    @Test
    void discoversPreferredWaitColumnOnce() {
        jdbc.rows("information_schema", List.of(
                Map.of("column_name", "queue_wait"),
                Map.of("column_name", "WaitDuration")));

        assertEquals("waitduration", adapter.waitTimeColumn().getValue());
        assertEquals("waitduration", adapter.waitTimeColumn().getValue());
        assertEquals(1, jdbc.count("information_schema"));
        assertEquals(List.of("modw", "job_tasks"), jdbc.executed().get(0).args());
    }

    @Test
    void fallsBackToFirstWaitColumn() {
        jdbc.rows("information_schema", List.of(Map.of("column_name", "wait_seconds")));

        assertEquals("wait_seconds", adapter.waitTimeColumn().getValue());
    }

    @Test
    void missingWaitColumnIsSchemaMismatchAndRetried() {
        FetchResult<String> first = adapter.waitTimeColumn();

        assertEquals(FetchErrorType.SCHEMA_MISMATCH, first.getError().type());

        jdbc.rows("information_schema", List.of(Map.of("column_name", "waitduration")));
        assertEquals("waitduration", adapter.waitTimeColumn().getValue());
        assertEquals(2, jdbc.count("information_schema"));
    }
}
