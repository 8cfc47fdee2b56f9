package org.javai.sqlguard.execution;

/**
 * Thrown by an {@link ExecutionGateway} when the engine cannot complete a query.
 */
public class QueryExecutionException extends RuntimeException {

	public enum Reason {
		ENGINE_ERROR,
		TIMEOUT,
		CANCELLED,
		UNAVAILABLE
	}

	private final Reason reason;

	public QueryExecutionException(String message) {
		this(Reason.ENGINE_ERROR, message, null);
	}

	public QueryExecutionException(String message, Throwable cause) {
		this(Reason.ENGINE_ERROR, message, cause);
	}

	public QueryExecutionException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason != null ? reason : Reason.ENGINE_ERROR;
	}

	public Reason reason() {
		return reason;
	}
}
