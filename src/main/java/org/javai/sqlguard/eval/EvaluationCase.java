package org.javai.sqlguard.eval;

import java.util.Map;
import java.util.Objects;

/**
 * A single question of an evaluation corpus with its oracle.
 *
 * @param id unique case id within the suite
 * @param question the natural-language question
 * @param category grouping label, e.g. {@code filter} or {@code prompt_injection}
 * @param oracle how the case is judged
 * @param details free-form metadata copied to the result
 */
public record EvaluationCase(String id, String question, String category, Oracle oracle, Map<String, Object> details) {

	public EvaluationCase {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(oracle, "oracle must not be null");
		question = question != null ? question : "";
		category = category != null ? category : "general";
		details = details != null ? Map.copyOf(details) : Map.of();
	}

	public EvaluationCase(String id, String question, String category, Oracle oracle) {
		this(id, question, category, oracle, Map.of());
	}
}
