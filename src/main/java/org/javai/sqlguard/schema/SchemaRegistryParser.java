package org.javai.sqlguard.schema;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for schema definition YAML files.
 * <p>
 * Expected layout:
 * <pre>
 * table:
 *   name: Transactions
 *   description: ...
 *   columns:
 *     - name: step
 *       kind: numeric
 *       filterable: true
 *       literal: "[1-9][0-9]{0,2}"
 * </pre>
 */
public class SchemaRegistryParser {

	private final Yaml yaml = new Yaml();

	public SchemaRegistry parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		}
		catch (SchemaDefinitionException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SchemaDefinitionException("Failed to parse schema from path: " + path, e);
		}
	}

	public SchemaRegistry parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		}
		catch (SchemaDefinitionException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SchemaDefinitionException("Failed to parse schema from input stream", e);
		}
	}

	public SchemaRegistry parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		}
		catch (SchemaDefinitionException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SchemaDefinitionException("Failed to parse schema from reader", e);
		}
	}

	public SchemaRegistry parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		}
		catch (SchemaDefinitionException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SchemaDefinitionException("Failed to parse schema from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private SchemaRegistry build(Object document) {
		if (!(document instanceof Map<?, ?> root)) {
			throw new SchemaDefinitionException("Schema document must be a mapping");
		}
		if (root.containsKey("tables")) {
			throw new SchemaDefinitionException("Exactly one table may be registered; use 'table' instead of 'tables'");
		}
		Object tableObj = root.get("table");
		if (!(tableObj instanceof Map<?, ?>)) {
			throw new SchemaDefinitionException("Schema document must declare a 'table' mapping");
		}
		Map<String, Object> table = (Map<String, Object>) tableObj;
		String name = requireString(table, "name", "table");
		String description = optionalString(table, "description");

		Object columnsObj = table.get("columns");
		if (!(columnsObj instanceof List<?> columnList) || columnList.isEmpty()) {
			throw new SchemaDefinitionException("Table '" + name + "' must declare a non-empty 'columns' list");
		}
		List<SchemaColumn> columns = new ArrayList<>();
		for (Object entry : columnList) {
			if (!(entry instanceof Map<?, ?>)) {
				throw new SchemaDefinitionException("Column entries of table '" + name + "' must be mappings");
			}
			columns.add(buildColumn((Map<String, Object>) entry));
		}
		List<String> examples = new ArrayList<>();
		if (root.get("examples") instanceof List<?> exampleList) {
			for (Object example : exampleList) {
				examples.add(String.valueOf(example).trim());
			}
		}
		return new SchemaRegistry(name, description, columns, examples);
	}

	private SchemaColumn buildColumn(Map<String, Object> map) {
		String name = requireString(map, "name", "column");
		ColumnKind kind = ColumnKind.fromString(requireString(map, "kind", "column '" + name + "'"));
		boolean nullable = booleanValue(map, "nullable", false);
		String description = optionalString(map, "description");
		boolean groupable = booleanValue(map, "groupable", false);
		boolean filterable = booleanValue(map, "filterable", false);
		boolean aggregatable = booleanValue(map, "aggregatable", kind != ColumnKind.CATEGORICAL);
		String literal = optionalString(map, "literal");

		List<String> values = new ArrayList<>();
		Object valuesObj = map.get("values");
		if (valuesObj instanceof List<?> list) {
			for (Object value : list) {
				values.add(String.valueOf(value));
			}
		}
		else if (valuesObj != null) {
			throw new SchemaDefinitionException("Column '" + name + "' values must be a list");
		}
		if (kind == ColumnKind.CATEGORICAL && aggregatable) {
			throw new SchemaDefinitionException("Categorical column '" + name + "' cannot be aggregatable");
		}
		if (kind != ColumnKind.CATEGORICAL && !values.isEmpty()) {
			throw new SchemaDefinitionException("Only categorical columns may declare values: " + name);
		}
		return new SchemaColumn(name, kind, nullable, description, groupable, filterable, aggregatable, values,
				literal);
	}

	private static String requireString(Map<String, Object> map, String key, String context) {
		Object value = map.get(key);
		if (value == null || String.valueOf(value).isBlank()) {
			throw new SchemaDefinitionException("Missing '" + key + "' for " + context);
		}
		return String.valueOf(value).trim();
	}

	private static String optionalString(Map<String, Object> map, String key) {
		Object value = map.get(key);
		return value != null ? String.valueOf(value).trim() : null;
	}

	private static boolean booleanValue(Map<String, Object> map, String key, boolean defaultValue) {
		Object value = map.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		return Boolean.parseBoolean(String.valueOf(value));
	}
}
