package com.hpcwatch.support;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * JdbcTemplate that answers by SQL fragment instead of talking to a database. The first
 * registered fragment contained in the statement decides the answer.
 */
public class FakeJdbcTemplate extends JdbcTemplate {

    private final Map<String, Object> answers = new LinkedHashMap<>();
    private final List<Executed> executed = new CopyOnWriteArrayList<>();

    public synchronized FakeJdbcTemplate rows(String sqlFragment, List<Map<String, Object>> rows) {
        answers.put(sqlFragment, rows);
        return this;
    }

    public synchronized FakeJdbcTemplate failure(String sqlFragment, DataAccessException failure) {
        answers.put(sqlFragment, failure);
        return this;
    }

    public List<Executed> executed() {
        return executed;
    }

    public long count(String sqlFragment) {
        return executed.stream().filter(e -> e.sql().contains(sqlFragment)).count();
    }

    @Override
    public List<Map<String, Object>> queryForList(String sql, Object... args) {
        return answer(sql, args);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> queryForList(String sql, Class<T> elementType, Object... args) {
        List<Map<String, Object>> rows = answer(sql, args);
        List<T> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add((T) row.values().iterator().next());
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private synchronized List<Map<String, Object>> answer(String sql, Object[] args) {
        executed.add(new Executed(sql, args == null ? List.of() : List.of(args)));
        for (Map.Entry<String, Object> answer : answers.entrySet()) {
            if (sql.contains(answer.getKey())) {
                if (answer.getValue() instanceof DataAccessException) {
                    throw (DataAccessException) answer.getValue();
                }
                return (List<Map<String, Object>>) answer.getValue();
            }
        }
        return List.of();
    }

    public record Executed(String sql, List<Object> args) {}
}
