package org.javai.sqlguard.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.javai.sqlguard.compiler.CandidateQuery;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.compiler.QueryErrorKind;
import org.javai.sqlguard.execution.ExecutionResult;

/**
 * What a caller receives for a question. Exactly one of {@code result} and {@code error} is non-null.
 * {@code generated_sql} is present whenever a validated query exists, including when its
 * execution failed. Result rows are positional: labels may repeat, as in
 * {@code SELECT count(*), count(*)}, so {@code data[i][j]} belongs to {@code columns[j]}.
 */
public record QueryResponse(
		@JsonProperty("success") boolean success,
		@JsonProperty("question") String question,
		@JsonProperty("generated_sql") String generatedSql,
		@JsonProperty("result") Result result,
		@JsonProperty("error") ErrorDetail error
) {

	public QueryResponse {
		if ((result == null) == (error == null)) {
			throw new IllegalArgumentException("Exactly one of result and error must be set");
		}
	}

	public static QueryResponse from(CompilationResult compilation) {
		Objects.requireNonNull(compilation, "compilation must not be null");
		if (compilation.success()) {
			return new QueryResponse(true, compilation.question(), compilation.sql(),
					Result.from(compilation.execution()), null);
		}
		String validSql = compilation.finalCandidate()
				.filter(CandidateQuery::isValid)
				.map(CandidateQuery::text)
				.orElse(null);
		return new QueryResponse(false, compilation.question(), validSql, null,
				new ErrorDetail(compilation.error().kind(), compilation.error().message()));
	}

	public record Result(
			@JsonProperty("columns") List<String> columns,
			@JsonProperty("data") List<List<Object>> data,
			@JsonProperty("row_count") int rowCount,
			@JsonProperty("execution_time_ms") long executionTimeMs,
			@JsonProperty("truncated") boolean truncated
	) {

		static Result from(ExecutionResult execution) {
			return new Result(execution.columns(), execution.rows(), execution.rowCount(),
					execution.elapsed().toMillis(), execution.truncated());
		}
	}

	public record ErrorDetail(
			@JsonProperty("kind") QueryErrorKind kind,
			@JsonProperty("message") String message
	) {
	}
}
