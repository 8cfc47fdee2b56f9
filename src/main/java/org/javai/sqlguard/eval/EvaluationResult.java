package org.javai.sqlguard.eval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one evaluation case.
 *
 * @param caseId id of the case
 * @param category the case's category
 * @param question the question asked
 * @param passed whether the oracle was satisfied
 * @param generatedSql final candidate text, or {@code null} when none was produced
 * @param diagnostic short explanation of the verdict
 * @param elapsed wall-clock time for the case
 * @param details informational checks and metadata
 */
public record EvaluationResult(
		@JsonProperty("case_id") String caseId,
		String category,
		String question,
		boolean passed,
		@JsonProperty("generated_sql") String generatedSql,
		String diagnostic,
		@JsonIgnore Duration elapsed,
		Map<String, Object> details
) {

	public EvaluationResult {
		Objects.requireNonNull(caseId, "caseId must not be null");
		elapsed = elapsed != null ? elapsed : Duration.ZERO;
		details = details != null ? Map.copyOf(details) : Map.of();
	}

	public static EvaluationResult failure(EvaluationCase evaluationCase, String diagnostic, Duration elapsed) {
		return new EvaluationResult(evaluationCase.id(), evaluationCase.category(), evaluationCase.question(), false,
				null, diagnostic, elapsed, evaluationCase.details());
	}

	@JsonProperty("elapsed_ms")
	public long elapsedMillis() {
		return elapsed.toMillis();
	}
}
