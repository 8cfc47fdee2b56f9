package org.javai.sqlguard.eval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Results of all suites of one harness run.
 *
 * @param timestamp when the run finished
 * @param grammarFingerprint fingerprint of the grammar the cases ran against
 * @param suites per-suite reports in execution order
 */
@JsonPropertyOrder({"timestamp", "grammar_fingerprint", "total", "passed", "pass_rate", "status", "summaries"})
public record EvaluationReport(
		Instant timestamp,
		@JsonProperty("grammar_fingerprint") String grammarFingerprint,
		@JsonIgnore List<SuiteReport> suites
) {

	public EvaluationReport {
		timestamp = timestamp != null ? timestamp : Instant.now();
		suites = suites != null ? List.copyOf(suites) : List.of();
	}

	@JsonProperty
	public int total() {
		return suites.stream().mapToInt(SuiteReport::total).sum();
	}

	@JsonProperty
	public int passed() {
		return suites.stream().mapToInt(SuiteReport::passed).sum();
	}

	@JsonProperty("pass_rate")
	public double passRate() {
		int total = total();
		return total == 0 ? 0.0 : (double) passed() / total;
	}

	@JsonProperty
	public SuiteStatus status() {
		return SuiteStatus.forPassRate(passRate());
	}

	public Optional<SuiteReport> suite(String name) {
		return suites.stream().filter(s -> s.name().equals(name)).findFirst();
	}

	@JsonProperty("summaries")
	public List<SuiteSummary> summaries() {
		return suites.stream()
				.map(s -> new SuiteSummary(s.name(), s.total(), s.passed(), s.failed(), s.passRate(), s.status()))
				.toList();
	}

	public record SuiteSummary(
			String suite,
			int total,
			int passed,
			int failed,
			@JsonProperty("pass_rate") double passRate,
			SuiteStatus status
	) {
	}
}
