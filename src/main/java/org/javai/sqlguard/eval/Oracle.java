package org.javai.sqlguard.eval;

import java.util.List;
import java.util.Objects;

/**
 * How an evaluation case decides pass or fail.
 */
public sealed interface Oracle
		permits Oracle.ExactResult, Oracle.Tolerance, Oracle.RowCount, Oracle.ShapeEquivalence, Oracle.Structural,
		Oracle.ExpectedOutcome {

	/**
	 * The executed result must equal the result of the golden query, row for row.
	 */
	record ExactResult(String goldenSql) implements Oracle {

		public ExactResult {
			Objects.requireNonNull(goldenSql, "goldenSql must not be null");
		}
	}

	/**
	 * Numeric values must match the golden query's within a relative tolerance.
	 */
	record Tolerance(String goldenSql, double relativeTolerance) implements Oracle {

		public Tolerance {
			Objects.requireNonNull(goldenSql, "goldenSql must not be null");
			if (relativeTolerance < 0) {
				throw new IllegalArgumentException("relativeTolerance must not be negative");
			}
		}
	}

	/**
	 * The executed result must have exactly this many rows.
	 */
	record RowCount(int expectedRows) implements Oracle {
	}

	/**
	 * The candidate must normalize to one of the acceptable query shapes.
	 */
	record ShapeEquivalence(List<String> acceptableSql) implements Oracle {

		public ShapeEquivalence {
			acceptableSql = List.copyOf(acceptableSql);
			if (acceptableSql.isEmpty()) {
				throw new IllegalArgumentException("At least one acceptable query is required");
			}
		}
	}

	/**
	 * The candidate's parse tree must contain the expected metric, columns, filters and grouping.
	 */
	record Structural(QueryExpectation expectation) implements Oracle {

		public Structural {
			Objects.requireNonNull(expectation, "expectation must not be null");
		}
	}

	/**
	 * The compilation must end in an outcome of the given class.
	 */
	record ExpectedOutcome(OutcomeClass outcome) implements Oracle {

		public ExpectedOutcome {
			Objects.requireNonNull(outcome, "outcome must not be null");
		}
	}

	enum OutcomeClass {

		/** A grammar-valid candidate, or a structured failure without any candidate. */
		VALID_OR_CLEAN_FAILURE,
		/** A grammar-valid candidate. */
		VALID_QUERY,
		/** A grammar-valid candidate, or an explicit refusal. */
		VALID_OR_REFUSAL,
		/** Rejected as unsupported before the generation service was consulted. */
		UNSUPPORTED,
		/** No candidate, or a candidate free of anything outside the permitted language. */
		SAFE
	}
}
