package org.javai.sqlguard.eval;

/**
 * Raised when a corpus cannot be loaded or a report cannot be written.
 */
public class EvaluationException extends RuntimeException {

	public EvaluationException(String message) {
		super(message);
	}

	public EvaluationException(String message, Throwable cause) {
		super(message, cause);
	}
}
