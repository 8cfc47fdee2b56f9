package org.javai.sqlguard.execution;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and limits for {@link JdbcExecutionGateway}.
 *
 * @param jdbcUrl JDBC URL of the analytics store
 * @param username database user, may be {@code null}
 * @param password database password, may be {@code null}
 * @param maximumPoolSize upper bound on pooled connections
 * @param connectionTimeout how long to wait for a pooled connection
 * @param queryTimeout per-statement time limit, rounded up to whole seconds
 * @param maxRows rows kept per result; further rows mark the result truncated
 */
public record JdbcGatewayOptions(
		String jdbcUrl,
		String username,
		String password,
		int maximumPoolSize,
		Duration connectionTimeout,
		Duration queryTimeout,
		int maxRows
) {

	public JdbcGatewayOptions {
		Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
		if (maximumPoolSize <= 0) {
			throw new IllegalArgumentException("maximumPoolSize must be positive");
		}
		if (maxRows <= 0) {
			throw new IllegalArgumentException("maxRows must be positive");
		}
		connectionTimeout = connectionTimeout != null ? connectionTimeout : Duration.ofSeconds(10);
		queryTimeout = queryTimeout != null ? queryTimeout : Duration.ofSeconds(30);
	}

	public static JdbcGatewayOptions defaults(String jdbcUrl) {
		return new JdbcGatewayOptions(jdbcUrl, null, null, 5, Duration.ofSeconds(10), Duration.ofSeconds(30), 10_000);
	}

	public JdbcGatewayOptions withCredentials(String username, String password) {
		return new JdbcGatewayOptions(jdbcUrl, username, password, maximumPoolSize, connectionTimeout,
				queryTimeout, maxRows);
	}

	public JdbcGatewayOptions withMaxRows(int maxRows) {
		return new JdbcGatewayOptions(jdbcUrl, username, password, maximumPoolSize, connectionTimeout,
				queryTimeout, maxRows);
	}

	int queryTimeoutSeconds() {
		long millis = queryTimeout.toMillis();
		return millis <= 0 ? 0 : (int) Math.max(1, (millis + 999) / 1000);
	}
}
