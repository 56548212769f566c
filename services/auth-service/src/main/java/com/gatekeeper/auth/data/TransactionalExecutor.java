package com.gatekeeper.auth.data;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * TransactionalExecutor - Runs built statements, one transaction per call.
 *
 * Every public method:
 * 1. Checks out a pooled connection (via {@link JdbcTemplate})
 * 2. Translates {@code %(name)s} placeholders and binds the payload
 * 3. Executes, commits, and returns a {@link QueryResult}
 *
 * Failure Policy:
 * - Any execution or commit error rolls the transaction back
 * - The error is logged at ERROR with the statement text (never the parameters)
 * - The caller receives {@link QueryResult#failure()}, distinct from an empty result
 *
 * The connection goes back to the pool on every exit path. Statement and
 * transaction timeouts come from {@code spring.jdbc.template.query-timeout}
 * and {@code spring.transaction.default-timeout}.
 *
 * Thread Safety: stateless apart from the injected templates, safe to share.
 *
 * @see StatementBuilder for producing statements
 */
@Component
@Slf4j
public class TransactionalExecutor {

    private static final TemporalColumnMapRowMapper COLUMN_MAP_ROW_MAPPER = new TemporalColumnMapRowMapper();

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public TransactionalExecutor(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Execute a single statement.
     *
     * @param sql    SQL text with {@code %(name)s} placeholders
     * @param params placeholder values (may be null when there are none)
     * @param fetch  whether to read the rows the statement returns
     * @return committed rows (empty when {@code fetch} is false) or the failure
     */
    public QueryResult execute(String sql, Map<String, ?> params, boolean fetch) {
        return inTransaction(sql, () -> {
            PlaceholderTranslator.Translated translated = PlaceholderTranslator.translate(sql);
            return run(translated.sql(), translated.bind(params), fetch);
        });
    }

    public QueryResult execute(Statement statement, boolean fetch) {
        return execute(statement.text(), statement.params(), fetch);
    }

    /**
     * Same as {@link #execute(String, Map, boolean)}, binding every map or
     * collection value as a JSON column value.
     */
    public QueryResult executeWithJsonParams(String sql, Map<String, ?> params, boolean fetch) {
        return inTransaction(sql, () -> {
            PlaceholderTranslator.Translated translated = PlaceholderTranslator.translate(sql);
            return run(translated.sql(), translated.bind(JsonParameters.wrap(params)), fetch);
        });
    }

    public QueryResult executeWithJsonParams(Statement statement, boolean fetch) {
        return executeWithJsonParams(statement.text(), statement.params(), fetch);
    }

    /**
     * JSON-aware variant of {@link #executeBatchInsert}: each payload is
     * wrapped, then placeholder group <i>i</i> is bound to payload <i>i</i>.
     */
    public QueryResult executeWithJsonParams(BatchStatement statement, boolean fetch) {
        return inTransaction(statement.text(), () -> {
            PlaceholderTranslator.Translated translated = PlaceholderTranslator.translate(statement.text());
            return run(translated.sql(), translated.bindGroups(JsonParameters.wrapAll(statement.params())), fetch);
        });
    }

    /**
     * JSON-aware variant for a batch: each payload is wrapped, then the
     * statement runs once per payload as with {@link #executeBatchUpdate}.
     * A multi-row statement from {@link StatementBuilder#bulkInsert} goes
     * through {@link #executeWithJsonParams(BatchStatement, boolean)} instead.
     */
    public QueryResult executeWithJsonParams(String sql, List<? extends Map<String, ?>> batch, boolean fetch) {
        return executeBatchUpdate(sql, JsonParameters.wrapAll(batch), fetch);
    }

    /**
     * Execute a multi-row insert built by {@link StatementBuilder#bulkInsert}
     * in one round trip, binding placeholder group <i>i</i> to payload <i>i</i>.
     */
    public QueryResult executeBatchInsert(BatchStatement statement, boolean fetch) {
        return inTransaction(statement.text(), () -> {
            PlaceholderTranslator.Translated translated = PlaceholderTranslator.translate(statement.text());
            return run(translated.sql(), translated.bindGroups(statement.params()), fetch);
        });
    }

    /**
     * Apply one statement to each payload of {@code batch} inside a single
     * transaction. Without {@code fetch} the payloads go to the driver as one
     * JDBC batch; with {@code fetch} the rows of every execution are collected
     * in order.
     */
    public QueryResult executeBatchUpdate(String sql, List<? extends Map<String, ?>> batch, boolean fetch) {
        return inTransaction(sql, () -> {
            PlaceholderTranslator.Translated translated = PlaceholderTranslator.translate(sql);
            List<Object[]> args = new ArrayList<>(batch.size());
            for (Map<String, ?> params : batch) {
                args.add(translated.bind(params));
            }
            if (!fetch) {
                int total = 0;
                for (int count : jdbcTemplate.batchUpdate(translated.sql(), args)) {
                    total += Math.max(count, 0);
                }
                return QueryResult.success(Rows.none(), total);
            }
            List<Map<String, Object>> collected = new ArrayList<>();
            int total = 0;
            for (Object[] rowArgs : args) {
                QueryResult result = run(translated.sql(), rowArgs, true);
                collected.addAll(result.rows().all());
                total += result.updateCount();
            }
            return QueryResult.success(Rows.of(collected), total);
        });
    }

    /** {@code execute(sql, params, true)}. */
    public QueryResult fetchOne(String sql, Map<String, ?> params) {
        return execute(sql, params, true);
    }

    public QueryResult fetchOne(Statement statement) {
        return execute(statement, true);
    }

    /** {@code execute(sql, params, true)}; the tri-state shape is on {@link Rows}. */
    public QueryResult fetchAll(String sql, Map<String, ?> params) {
        return execute(sql, params, true);
    }

    public QueryResult fetchAll(Statement statement) {
        return execute(statement, true);
    }

    private QueryResult inTransaction(String sql, Supplier<QueryResult> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Statement failed and was rolled back: {}", sql, e);
            return QueryResult.failure(new StorageFailure(sql, e.getMessage(), e));
        }
    }

    private QueryResult run(String jdbcSql, Object[] args, boolean fetch) {
        return jdbcTemplate.execute(jdbcSql, (PreparedStatementCallback<QueryResult>) ps -> {
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            boolean hasResultSet = ps.execute();
            if (!hasResultSet) {
                return QueryResult.success(Rows.none(), Math.max(ps.getUpdateCount(), 0));
            }
            if (!fetch) {
                return QueryResult.success(Rows.none(), 0);
            }
            return QueryResult.success(Rows.of(readRows(ps)), 0);
        });
    }

    private static List<Map<String, Object>> readRows(PreparedStatement ps) throws SQLException {
        try (var resultSet = ps.getResultSet()) {
            return new RowMapperResultSetExtractor<>(COLUMN_MAP_ROW_MAPPER).extractData(resultSet);
        }
    }
}
