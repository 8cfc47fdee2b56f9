package org.javai.sqlguard.schema;

import java.util.Locale;

/**
 * Value kind of a schema column. Drives which filter shapes and aggregates the grammar offers.
 */
public enum ColumnKind {

	NUMERIC,
	BOOLEAN,
	CATEGORICAL;

	public static ColumnKind fromString(String value) {
		if (value == null || value.isBlank()) {
			throw new SchemaDefinitionException("Column kind must not be blank");
		}
		try {
			return ColumnKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new SchemaDefinitionException("Unknown column kind: " + value, e);
		}
	}
}
