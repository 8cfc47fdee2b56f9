package org.javai.sqlguard.config;

/**
 * Raised when settings cannot be loaded or hold invalid values.
 */
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
