package org.javai.sqlguard.execution;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import org.javai.sqlguard.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ExecutionGateway} over a pooled JDBC {@link DataSource}.
 * <p>
 * Each call borrows a connection, marks it read-only, runs one statement under the configured
 * query timeout and returns the connection to the pool. Cancelling the request's token cancels
 * the running statement.
 */
public class JdbcExecutionGateway implements ExecutionGateway, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JdbcExecutionGateway.class);

	private final DataSource dataSource;
	private final JdbcGatewayOptions options;

	public JdbcExecutionGateway(DataSource dataSource, JdbcGatewayOptions options) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Create a gateway backed by its own HikariCP pool.
	 */
	public static JdbcExecutionGateway pooled(JdbcGatewayOptions options) {
		HikariConfig config = new HikariConfig();
		config.setPoolName("sqlguard-gateway");
		config.setJdbcUrl(options.jdbcUrl());
		config.setUsername(options.username());
		config.setPassword(options.password());
		config.setMaximumPoolSize(options.maximumPoolSize());
		config.setMinimumIdle(1);
		config.setInitializationFailTimeout(-1);
		config.setConnectionTimeout(Math.max(250, options.connectionTimeout().toMillis()));
		config.setReadOnly(true);
		config.setAutoCommit(true);
		return new JdbcExecutionGateway(new HikariDataSource(config), options);
	}

	@Override
	public ExecutionResult execute(String sql, CancellationToken cancellation) {
		Objects.requireNonNull(sql, "sql must not be null");
		CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
		if (token.isCancelled()) {
			throw new QueryExecutionException(QueryExecutionException.Reason.CANCELLED, "Request was cancelled", null);
		}

		long start = System.nanoTime();
		try (Connection conn = dataSource.getConnection()) {
			conn.setReadOnly(true);
			try (Statement stmt = conn.createStatement();
					CancellationToken.Registration ignored = token.onCancel(() -> cancelStatement(stmt))) {
				stmt.setQueryTimeout(options.queryTimeoutSeconds());
				stmt.setMaxRows(options.maxRows() + 1);
				try (ResultSet rs = stmt.executeQuery(sql)) {
					ExecutionResult result = readResult(rs, Duration.ofNanos(System.nanoTime() - start));
					logger.debug("Executed query in {} ms, {} rows{}", result.elapsed().toMillis(), result.rowCount(),
							result.truncated() ? " (truncated)" : "");
					return result;
				}
			}
		}
		catch (SQLTimeoutException e) {
			logger.warn("Query timed out after {} s: {}", options.queryTimeoutSeconds(), e.getMessage());
			throw new QueryExecutionException(QueryExecutionException.Reason.TIMEOUT,
					"Query exceeded the " + options.queryTimeoutSeconds() + " s time limit", e);
		}
		catch (SQLTransientConnectionException e) {
			logger.warn("No database connection available: {}", e.getMessage());
			throw new QueryExecutionException(QueryExecutionException.Reason.UNAVAILABLE,
					"Database is unavailable", e);
		}
		catch (SQLException e) {
			if (token.isCancelled()) {
				throw new QueryExecutionException(QueryExecutionException.Reason.CANCELLED, "Request was cancelled", e);
			}
			logger.warn("Query failed (SQLState: {}, Error Code: {}): {}", e.getSQLState(), e.getErrorCode(),
					e.getMessage());
			throw new QueryExecutionException(e.getMessage(), e);
		}
	}

	@Override
	public boolean isHealthy() {
		try (Connection conn = dataSource.getConnection()) {
			return conn.isValid(2);
		}
		catch (SQLException e) {
			logger.warn("Health check failed: {}", e.getMessage());
			return false;
		}
	}

	@Override
	public void close() {
		if (dataSource instanceof HikariDataSource hikari) {
			hikari.close();
		}
	}

	private ExecutionResult readResult(ResultSet rs, Duration elapsed) throws SQLException {
		ResultSetMetaData rsmd = rs.getMetaData();
		int columnCount = rsmd.getColumnCount();

		List<String> columns = new ArrayList<>(columnCount);
		for (int i = 1; i <= columnCount; i++) {
			columns.add(rsmd.getColumnLabel(i));
		}

		List<List<Object>> rows = new ArrayList<>();
		boolean truncated = false;
		while (rs.next()) {
			if (rows.size() >= options.maxRows()) {
				truncated = true;
				break;
			}
			List<Object> row = new ArrayList<>(columnCount);
			for (int i = 1; i <= columnCount; i++) {
				row.add(rs.getObject(i));
			}
			rows.add(row);
		}
		return new ExecutionResult(columns, rows, elapsed, truncated);
	}

	private void cancelStatement(Statement stmt) {
		try {
			stmt.cancel();
			logger.debug("Cancelled running statement");
		}
		catch (SQLException e) {
			logger.warn("Failed to cancel statement: {}", e.getMessage());
		}
	}
}
