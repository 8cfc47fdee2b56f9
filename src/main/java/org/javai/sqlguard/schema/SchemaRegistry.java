package org.javai.sqlguard.schema;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of the single table queries may read.
 * <p>
 * Built once at start-up and shared by the grammar builder, the validator and the
 * generation prompt. Lookups are case-sensitive.
 */
public final class SchemaRegistry {

	public static final String DEFAULT_RESOURCE = "META-INF/sqlguard/schema.yml";

	private final String tableName;
	private final String tableDescription;
	private final Map<String, SchemaColumn> columns;
	private final List<String> exampleQueries;

	public SchemaRegistry(String tableName, String tableDescription, List<SchemaColumn> columns) {
		this(tableName, tableDescription, columns, List.of());
	}

	public SchemaRegistry(String tableName, String tableDescription, List<SchemaColumn> columns,
			List<String> exampleQueries) {
		Objects.requireNonNull(tableName, "tableName must not be null");
		Objects.requireNonNull(columns, "columns must not be null");
		if (tableName.isBlank()) {
			throw new SchemaDefinitionException("Table name must not be blank");
		}
		if (columns.isEmpty()) {
			throw new SchemaDefinitionException("Table '" + tableName + "' declares no columns");
		}
		Map<String, SchemaColumn> byName = new LinkedHashMap<>();
		for (SchemaColumn column : columns) {
			if (byName.putIfAbsent(column.name(), column) != null) {
				throw new SchemaDefinitionException("Duplicate column '" + column.name() + "' in table " + tableName);
			}
			if (column.isCategorical() && column.filterable() && column.values().isEmpty()) {
				throw new SchemaDefinitionException(
						"Filterable categorical column '" + column.name() + "' must declare its values");
			}
			if (!column.isCategorical() && column.filterable() && column.literalPattern() == null) {
				throw new SchemaDefinitionException(
						"Filterable column '" + column.name() + "' must declare a literal pattern");
			}
		}
		this.tableName = tableName;
		this.tableDescription = tableDescription != null ? tableDescription : "";
		this.columns = Collections.unmodifiableMap(byName);
		this.exampleQueries = exampleQueries != null ? List.copyOf(exampleQueries) : List.of();
	}

	/**
	 * Load the bundled default schema from the classpath.
	 */
	public static SchemaRegistry loadDefault() {
		return load(DEFAULT_RESOURCE);
	}

	public static SchemaRegistry load(String classpathResource) {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = SchemaRegistry.class.getClassLoader();
		}
		try (InputStream in = classLoader.getResourceAsStream(classpathResource)) {
			if (in == null) {
				throw new SchemaDefinitionException("Schema resource not found: " + classpathResource);
			}
			return new SchemaRegistryParser().parse(in);
		}
		catch (java.io.IOException e) {
			throw new SchemaDefinitionException("Failed to read schema resource: " + classpathResource, e);
		}
	}

	public String table() {
		return tableName;
	}

	public String tableDescription() {
		return tableDescription;
	}

	/**
	 * Known-good queries over this table, shown to the generation service and used as smoke fixtures.
	 */
	public List<String> exampleQueries() {
		return exampleQueries;
	}

	public List<SchemaColumn> columns() {
		return List.copyOf(columns.values());
	}

	public Optional<SchemaColumn> column(String name) {
		return Optional.ofNullable(columns.get(name));
	}

	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}

	public List<SchemaColumn> groupableColumns() {
		return columns.values().stream().filter(SchemaColumn::groupable).toList();
	}

	public List<SchemaColumn> filterableColumns() {
		return columns.values().stream().filter(SchemaColumn::filterable).toList();
	}

	public List<SchemaColumn> aggregatableColumns() {
		return columns.values().stream().filter(SchemaColumn::aggregatable).toList();
	}

	public List<SchemaColumn> numericColumns() {
		return columns.values().stream().filter(c -> c.kind() == ColumnKind.NUMERIC).toList();
	}

	/**
	 * Compact textual description of the table, for prompts and diagnostics.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		sb.append("Table ").append(tableName);
		if (!tableDescription.isBlank()) {
			sb.append(": ").append(tableDescription);
		}
		sb.append('\n');
		for (SchemaColumn column : columns.values()) {
			sb.append("- ").append(column.name())
					.append(" (").append(column.kind().name().toLowerCase(java.util.Locale.ROOT)).append(')');
			if (!column.description().isBlank()) {
				sb.append(": ").append(column.description());
			}
			sb.append('\n');
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "SchemaRegistry[" + tableName + ", columns=" + columns.keySet() + "]";
	}
}
