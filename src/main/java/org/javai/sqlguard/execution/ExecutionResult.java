package org.javai.sqlguard.execution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tabular result of an executed query.
 *
 * @param columns column labels in select-list order
 * @param rows row values, each row aligned with {@code columns}
 * @param elapsed wall-clock time spent in the engine
 * @param truncated whether rows beyond the gateway's row cap were dropped
 */
public record ExecutionResult(List<String> columns, List<List<Object>> rows, Duration elapsed, boolean truncated) {

	public ExecutionResult {
		Objects.requireNonNull(columns, "columns must not be null");
		Objects.requireNonNull(rows, "rows must not be null");
		columns = List.copyOf(columns);
		List<List<Object>> copy = new ArrayList<>(rows.size());
		for (List<Object> row : rows) {
			copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}
		rows = Collections.unmodifiableList(copy);
		elapsed = elapsed != null ? elapsed : Duration.ZERO;
	}

	public int rowCount() {
		return rows.size();
	}

	/**
	 * The single value of a one-row, one-column result.
	 *
	 * @throws IllegalStateException if the result is not scalar
	 */
	public Object singleValue() {
		if (rows.size() != 1 || columns.size() != 1) {
			throw new IllegalStateException(
					"Expected a 1x1 result but got " + rows.size() + "x" + columns.size());
		}
		return rows.get(0).get(0);
	}
}
