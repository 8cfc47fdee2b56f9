package org.javai.sqlguard.grammar;

/**
 * Thrown when a grammar cannot be derived from a schema, or the derived grammar fails
 * its structural checks.
 */
public class GrammarConstructionException extends RuntimeException {

	public GrammarConstructionException(String message) {
		super(message);
	}

	public GrammarConstructionException(String message, Throwable cause) {
		super(message, cause);
	}
}
