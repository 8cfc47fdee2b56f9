package org.javai.sqlguard.generate;

/**
 * Thrown when a generation service cannot be reached or answers with something unusable.
 */
public class GenerationException extends RuntimeException {

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
