package org.javai.sqlguard.compiler;

import java.util.Objects;

/**
 * The single error of a failed compilation.
 *
 * @param kind failure class
 * @param message human-readable detail, safe to show to callers
 */
public record QueryError(QueryErrorKind kind, String message) {

	private static final int MAX_MESSAGE_LENGTH = 240;

	public QueryError {
		Objects.requireNonNull(kind, "kind must not be null");
		message = sanitize(message);
	}

	/**
	 * First line of a raw diagnostic, truncated. Engine and transport messages can carry stack
	 * fragments and connection details that callers should not see.
	 */
	static String sanitize(String raw) {
		if (raw == null || raw.isBlank()) {
			return "";
		}
		String line = raw.strip().lines().findFirst().orElse("").strip();
		if (line.length() > MAX_MESSAGE_LENGTH) {
			line = line.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
		}
		return line;
	}
}
