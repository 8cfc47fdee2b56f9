package org.javai.sqlguard.compiler;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.javai.sqlguard.execution.ExecutionResult;

/**
 * Uniform outcome of one compilation. Exactly one of {@code execution} and {@code error} is set.
 *
 * @param question the question as submitted
 * @param success whether a validated query was executed
 * @param sql the executed query text, present on success
 * @param execution engine result, present on success
 * @param error the single failure, present otherwise
 * @param candidates every candidate produced, in attempt order
 * @param states the states visited, ending in DONE or FAILED
 * @param elapsed wall-clock time of the compilation
 */
public record CompilationResult(
		String question,
		boolean success,
		String sql,
		ExecutionResult execution,
		QueryError error,
		List<CandidateQuery> candidates,
		List<CompilerState> states,
		Duration elapsed
) {

	public CompilationResult {
		if (success == (error != null) || success != (execution != null)) {
			throw new IllegalArgumentException("A result carries either an execution result or an error");
		}
		candidates = candidates != null ? List.copyOf(candidates) : List.of();
		states = states != null ? List.copyOf(states) : List.of();
		elapsed = elapsed != null ? elapsed : Duration.ZERO;
	}

	/**
	 * The last candidate produced, if the generation service produced any.
	 */
	public Optional<CandidateQuery> finalCandidate() {
		return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(candidates.size() - 1));
	}

	public int attempts() {
		return candidates.size();
	}

	public Optional<QueryErrorKind> errorKind() {
		return error != null ? Optional.of(error.kind()) : Optional.empty();
	}

	public boolean failedWith(QueryErrorKind kind) {
		return error != null && error.kind() == kind;
	}
}
