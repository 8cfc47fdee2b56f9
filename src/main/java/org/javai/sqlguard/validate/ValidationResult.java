package org.javai.sqlguard.validate;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of validating a candidate query against the grammar.
 */
public sealed interface ValidationResult permits ValidationResult.Accept, ValidationResult.Reject {

	boolean accepted();

	/**
	 * The candidate belongs to the language.
	 */
	record Accept(ParseTree parseTree) implements ValidationResult {

		public Accept {
			Objects.requireNonNull(parseTree, "parseTree must not be null");
		}

		@Override
		public boolean accepted() {
			return true;
		}
	}

	/**
	 * The candidate does not belong to the language.
	 *
	 * @param position character offset of the first divergence
	 * @param expected terminals that would have been accepted at that position
	 * @param found the offending token text
	 * @param message human-readable diagnostic
	 */
	record Reject(int position, Set<String> expected, String found, String message) implements ValidationResult {

		public Reject {
			expected = Collections.unmodifiableSortedSet(expected != null ? new TreeSet<>(expected) : new TreeSet<>());
		}

		@Override
		public boolean accepted() {
			return false;
		}

		/**
		 * Compact diagnostic suitable for retry feedback.
		 */
		public String describe() {
			StringBuilder sb = new StringBuilder();
			sb.append(message).append(" at position ").append(position);
			if (!expected.isEmpty()) {
				sb.append("; expected one of ").append(expected);
			}
			return sb.toString();
		}
	}
}
