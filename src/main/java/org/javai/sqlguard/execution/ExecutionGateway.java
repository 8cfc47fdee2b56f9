package org.javai.sqlguard.execution;

import org.javai.sqlguard.CancellationToken;

/**
 * Runs an already-validated query against the analytics store.
 * <p>
 * Implementations must execute read-only, bound their own run time and release every
 * resource they acquire, whether the query succeeds, fails or is cancelled.
 */
public interface ExecutionGateway {

	ExecutionResult execute(String sql, CancellationToken cancellation);

	default ExecutionResult execute(String sql) {
		return execute(sql, CancellationToken.none());
	}

	/**
	 * Cheap liveness probe for health reporting.
	 */
	default boolean isHealthy() {
		return true;
	}
}
