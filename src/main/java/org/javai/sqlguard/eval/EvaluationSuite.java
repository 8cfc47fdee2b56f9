package org.javai.sqlguard.eval;

import java.util.List;
import org.javai.sqlguard.CancellationToken;

/**
 * A named corpus of cases and the rules that judge them.
 * <p>
 * Implementations must be thread-safe: the runner evaluates cases concurrently.
 */
public interface EvaluationSuite {

	String name();

	List<EvaluationCase> cases();

	/**
	 * Runs and judges one case. Implementations should honour {@code cancellation}; the runner
	 * cancels it when the per-case timeout elapses.
	 */
	EvaluationResult evaluate(EvaluationCase evaluationCase, EvaluationContext context, CancellationToken cancellation);
}
