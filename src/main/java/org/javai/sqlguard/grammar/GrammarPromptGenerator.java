package org.javai.sqlguard.grammar;

import java.util.Optional;
import java.util.stream.Collectors;
import org.javai.sqlguard.schema.SchemaColumn;
import org.javai.sqlguard.schema.SchemaRegistry;

/**
 * Generates the tool description handed to the generation service alongside the grammar.
 * <p>
 * The description is derived from the same artifact as the grammar, so column lists and
 * filter shapes never drift from what the validator accepts.
 */
public class GrammarPromptGenerator {

	/**
	 * Generate the tool description for the given grammar.
	 *
	 * @param artifact the grammar to describe
	 * @return prompt text listing allowed operations, columns, filter patterns and examples
	 */
	public String generate(GrammarArtifact artifact) {
		SchemaRegistry schema = artifact.schema();

		StringBuilder sb = new StringBuilder();
		sb.append("Generates safe, read-only SQL queries for the ").append(schema.table()).append(" table.\n\n");
		sb.append("You MUST produce exactly one query that conforms to the grammar. ")
				.append("If the question cannot be answered with the allowed operations, reply with REFUSE.\n\n");

		appendSection(sb, "ALLOWED OPERATIONS", formatOperations(artifact));
		appendSection(sb, "COLUMN REFERENCE", formatColumns(schema));
		appendSection(sb, "SUPPORTED FILTER PATTERNS", formatFilters(schema));
		appendSection(sb, "EXAMPLE VALID QUERIES", formatExamples(schema));

		return sb.toString().trim();
	}

	private void appendSection(StringBuilder sb, String title, Optional<String> content) {
		if (content.isEmpty() || content.get().isBlank()) {
			return;
		}
		sb.append(title).append(":\n");
		sb.append(content.get().trim()).append("\n\n");
	}

	private Optional<String> formatOperations(GrammarArtifact artifact) {
		SchemaRegistry schema = artifact.schema();
		StringBuilder sb = new StringBuilder();
		String aggregated = names(schema.aggregatableColumns());
		sb.append("- SELECT with aggregations: count(*)");
		if (!aggregated.isEmpty()) {
			sb.append(", count(col), sum(col), avg(col), min(col), max(col) over ").append(aggregated);
		}
		sb.append('\n');
		String groupable = names(schema.groupableColumns());
		if (!groupable.isEmpty()) {
			sb.append("- SELECT with groupable columns: ").append(groupable).append('\n');
		}
		sb.append("- FROM ").append(schema.table()).append(" (the only allowed table)\n");
		String filterable = names(schema.filterableColumns());
		if (!filterable.isEmpty()) {
			sb.append("- WHERE with conditions joined by AND on: ").append(filterable).append('\n');
		}
		if (!groupable.isEmpty()) {
			sb.append("- GROUP BY: ").append(groupable).append('\n');
		}
		sb.append("- ORDER BY: columns or aggregations, with ASC/DESC\n");
		sb.append("- LIMIT: 1-9999\n");
		sb.append("- End the query with a single ;\n");
		sb.append("- Separate keywords, names and numbers with spaces or newlines; no comments\n");
		return Optional.of(sb.toString());
	}

	private Optional<String> formatColumns(SchemaRegistry schema) {
		String body = schema.columns().stream()
				.filter(c -> c.groupable() || c.filterable() || c.aggregatable())
				.map(c -> {
					String line = "- " + c.name() + ": " + c.description();
					if (c.isCategorical() && !c.values().isEmpty()) {
						line += " (" + c.values().stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ")) + ")";
					}
					return line;
				})
				.collect(Collectors.joining("\n"));
		return Optional.of(body);
	}

	private Optional<String> formatFilters(SchemaRegistry schema) {
		StringBuilder sb = new StringBuilder();
		for (SchemaColumn column : schema.filterableColumns()) {
			switch (column.kind()) {
				case NUMERIC -> sb.append("- ").append(column.name()).append(" >= N, ")
						.append(column.name()).append(" BETWEEN N AND M (N matching /")
						.append(column.literalPattern()).append("/)\n");
				case CATEGORICAL -> {
					String first = column.values().get(0);
					sb.append("- ").append(column.name()).append(" = '").append(first).append("', ")
							.append(column.name()).append(" != '").append(first).append("', ")
							.append(column.name()).append(" IN ('").append(first).append("', ...)\n");
				}
				case BOOLEAN -> sb.append("- ").append(column.name()).append(" = V, ")
						.append(column.name()).append(" != V (V matching /").append(column.literalPattern()).append("/)\n");
			}
		}
		return Optional.of(sb.toString());
	}

	private Optional<String> formatExamples(SchemaRegistry schema) {
		if (schema.exampleQueries().isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(schema.exampleQueries().stream().map(q -> "- " + q).collect(Collectors.joining("\n")));
	}

	private static String names(java.util.List<SchemaColumn> columns) {
		return columns.stream().map(SchemaColumn::name).collect(Collectors.joining(", "));
	}
}
