package org.javai.sqlguard.schema;

/**
 * Thrown when a schema definition cannot be loaded or is internally inconsistent.
 */
public class SchemaDefinitionException extends RuntimeException {

	public SchemaDefinitionException(String message) {
		super(message);
	}

	public SchemaDefinitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
