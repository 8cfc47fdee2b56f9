package org.javai.sqlguard.compiler;

/**
 * Where a candidate stands with respect to the grammar.
 */
public sealed interface ValidationStatus
		permits ValidationStatus.Unvalidated, ValidationStatus.Valid, ValidationStatus.Invalid {

	record Unvalidated() implements ValidationStatus {
	}

	record Valid() implements ValidationStatus {
	}

	record Invalid(String reason) implements ValidationStatus {
	}
}
