package org.javai.sqlguard.eval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated results of one suite run.
 */
@JsonPropertyOrder({"suite", "timestamp", "total", "passed", "failed", "pass_rate", "status", "by_category",
		"results"})
public record SuiteReport(@JsonProperty("suite") String name, Instant timestamp, List<EvaluationResult> results) {

	public SuiteReport {
		Objects.requireNonNull(name, "name must not be null");
		timestamp = timestamp != null ? timestamp : Instant.now();
		results = results != null ? List.copyOf(results) : List.of();
	}

	@JsonProperty
	public int total() {
		return results.size();
	}

	@JsonProperty
	public int passed() {
		return (int) results.stream().filter(EvaluationResult::passed).count();
	}

	@JsonProperty
	public int failed() {
		return total() - passed();
	}

	/**
	 * Fraction of passing cases; an empty suite scores zero.
	 */
	@JsonProperty("pass_rate")
	public double passRate() {
		return total() == 0 ? 0.0 : (double) passed() / total();
	}

	@JsonProperty
	public SuiteStatus status() {
		return SuiteStatus.forPassRate(passRate());
	}

	@JsonProperty("by_category")
	public Map<String, String> byCategory() {
		Map<String, int[]> counts = new LinkedHashMap<>();
		for (EvaluationResult result : results) {
			int[] count = counts.computeIfAbsent(result.category(), k -> new int[2]);
			count[1]++;
			if (result.passed()) {
				count[0]++;
			}
		}
		Map<String, String> summary = new LinkedHashMap<>();
		counts.forEach((category, count) -> summary.put(category, count[0] + "/" + count[1]));
		return summary;
	}

	public List<EvaluationResult> failures() {
		return results.stream().filter(r -> !r.passed()).toList();
	}
}
