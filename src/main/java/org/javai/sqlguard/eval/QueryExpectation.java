package org.javai.sqlguard.eval;

import java.util.List;

/**
 * Semantic elements a candidate is expected to contain.
 *
 * @param metric aggregate function name such as {@code count} or {@code sum}, or {@code null}
 * @param columns columns that must be referenced in the select list
 * @param filters WHERE conditions that must be present
 * @param groupBy columns that must appear in GROUP BY
 */
public record QueryExpectation(String metric, List<String> columns, List<FilterExpectation> filters,
		List<String> groupBy) {

	public QueryExpectation {
		columns = columns != null ? List.copyOf(columns) : List.of();
		filters = filters != null ? List.copyOf(filters) : List.of();
		groupBy = groupBy != null ? List.copyOf(groupBy) : List.of();
	}

	/**
	 * An expected condition. Operator and values are optional; when given they must match.
	 */
	public record FilterExpectation(String column, String operator, List<String> values) {

		public FilterExpectation {
			values = values != null ? List.copyOf(values) : List.of();
		}
	}
}
