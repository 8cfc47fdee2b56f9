package org.javai.sqlguard.schema;

import java.util.List;
import java.util.Objects;

/**
 * A typed column of the registered table.
 *
 * @param name column name, matched case-sensitively
 * @param kind value kind
 * @param nullable whether the column admits NULL
 * @param description human-readable description used in the tool description
 * @param groupable whether the column may be selected bare and used in GROUP BY / ORDER BY
 * @param filterable whether the column may appear in a WHERE condition
 * @param aggregatable whether the column may be the argument of an aggregate function
 * @param values closed list of permitted literals for categorical columns
 * @param literalPattern regular expression for numeric or boolean filter literals
 */
public record SchemaColumn(
		String name,
		ColumnKind kind,
		boolean nullable,
		String description,
		boolean groupable,
		boolean filterable,
		boolean aggregatable,
		List<String> values,
		String literalPattern
) {

	public SchemaColumn {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		description = description != null ? description : "";
		values = values != null ? List.copyOf(values) : List.of();
	}

	public static SchemaColumn numeric(String name, String description, String literalPattern) {
		return new SchemaColumn(name, ColumnKind.NUMERIC, false, description, false, literalPattern != null,
				true, List.of(), literalPattern);
	}

	public static SchemaColumn categorical(String name, String description, List<String> values) {
		return new SchemaColumn(name, ColumnKind.CATEGORICAL, false, description, true, !values.isEmpty(),
				false, values, null);
	}

	public boolean isCategorical() {
		return kind == ColumnKind.CATEGORICAL;
	}

	public boolean supportsRangeFilters() {
		return kind == ColumnKind.NUMERIC;
	}
}
