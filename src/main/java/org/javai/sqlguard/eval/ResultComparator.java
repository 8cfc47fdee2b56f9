package org.javai.sqlguard.eval;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.javai.sqlguard.execution.ExecutionResult;

/**
 * Compares an executed result with a reference result.
 * <p>
 * Row order is ignored; column labels are ignored, only positions matter. Numbers compare by
 * value, so {@code 5}, {@code 5L} and {@code 5.00} are equal.
 */
final class ResultComparator {

	private ResultComparator() {
	}

	/**
	 * @return a description of the first difference, or empty when the results are equal
	 */
	static Optional<String> exactDifference(ExecutionResult actual, ExecutionResult expected) {
		Optional<String> shape = shapeDifference(actual, expected);
		if (shape.isPresent()) {
			return shape;
		}
		List<List<Object>> actualRows = sorted(actual.rows());
		List<List<Object>> expectedRows = sorted(expected.rows());
		for (int r = 0; r < expectedRows.size(); r++) {
			for (int c = 0; c < expected.columns().size(); c++) {
				Object a = actualRows.get(r).get(c);
				Object e = expectedRows.get(r).get(c);
				if (!sameValue(a, e)) {
					return Optional.of("row " + r + " column " + c + ": expected " + e + " but got " + a);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Like {@link #exactDifference} but numeric cells may differ by {@code relativeTolerance}
	 * of the larger magnitude.
	 */
	static Optional<String> toleranceDifference(ExecutionResult actual, ExecutionResult expected,
			double relativeTolerance) {
		Optional<String> shape = shapeDifference(actual, expected);
		if (shape.isPresent()) {
			return shape;
		}
		List<List<Object>> actualRows = sortedByNonNumeric(actual.rows());
		List<List<Object>> expectedRows = sortedByNonNumeric(expected.rows());
		for (int r = 0; r < expectedRows.size(); r++) {
			for (int c = 0; c < expected.columns().size(); c++) {
				Object a = actualRows.get(r).get(c);
				Object e = expectedRows.get(r).get(c);
				if (a instanceof Number an && e instanceof Number en) {
					if (!withinTolerance(an.doubleValue(), en.doubleValue(), relativeTolerance)) {
						return Optional.of("row " + r + " column " + c + ": expected " + e + " within "
								+ relativeTolerance + " but got " + a);
					}
				}
				else if (!sameValue(a, e)) {
					return Optional.of("row " + r + " column " + c + ": expected " + e + " but got " + a);
				}
			}
		}
		return Optional.empty();
	}

	static boolean withinTolerance(double actual, double expected, double relativeTolerance) {
		double scale = Math.max(Math.abs(actual), Math.abs(expected));
		if (scale == 0.0) {
			return true;
		}
		return Math.abs(actual - expected) <= relativeTolerance * scale;
	}

	private static Optional<String> shapeDifference(ExecutionResult actual, ExecutionResult expected) {
		if (actual.columns().size() != expected.columns().size()) {
			return Optional.of("expected " + expected.columns().size() + " columns but got "
					+ actual.columns().size());
		}
		if (actual.rowCount() != expected.rowCount()) {
			return Optional.of("expected " + expected.rowCount() + " rows but got " + actual.rowCount());
		}
		return Optional.empty();
	}

	private static boolean sameValue(Object a, Object e) {
		return canonical(a).equals(canonical(e));
	}

	private static String canonical(Object value) {
		if (value == null) {
			return "NULL";
		}
		if (value instanceof Number number) {
			BigDecimal decimal = toBigDecimal(number);
			return decimal != null ? decimal.stripTrailingZeros().toPlainString() : number.toString();
		}
		if (value instanceof Boolean bool) {
			return bool ? "1" : "0";
		}
		return value.toString();
	}

	private static BigDecimal toBigDecimal(Number number) {
		if (number instanceof BigDecimal decimal) {
			return decimal;
		}
		if (number instanceof Double || number instanceof Float) {
			double d = number.doubleValue();
			return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
		}
		return new BigDecimal(number.toString());
	}

	private static List<List<Object>> sorted(List<List<Object>> rows) {
		List<List<Object>> copy = new ArrayList<>(rows);
		copy.sort(Comparator.comparing(ResultComparator::rowKey));
		return copy;
	}

	private static List<List<Object>> sortedByNonNumeric(List<List<Object>> rows) {
		List<List<Object>> copy = new ArrayList<>(rows);
		copy.sort(Comparator.comparing(ResultComparator::nonNumericKey));
		return copy;
	}

	private static String rowKey(List<Object> row) {
		StringBuilder key = new StringBuilder();
		for (Object value : row) {
			key.append(canonical(value)).append('\u0001');
		}
		return key.toString();
	}

	private static String nonNumericKey(List<Object> row) {
		StringBuilder key = new StringBuilder();
		for (Object value : row) {
			key.append(value instanceof Number ? "#" : canonical(value)).append('\u0001');
		}
		return key.toString();
	}
}
