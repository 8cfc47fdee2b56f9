package org.javai.sqlguard.eval;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.CandidateQuery;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.validate.ParseTree;
import org.javai.sqlguard.validate.ValidationResult;

/**
 * Compiles the case's question and delegates the verdict to {@link #judge}.
 */
public abstract class AbstractEvaluationSuite implements EvaluationSuite {

	private final String name;
	private final List<EvaluationCase> cases;

	protected AbstractEvaluationSuite(String name, List<EvaluationCase> cases) {
		this.name = name;
		this.cases = List.copyOf(cases);
		Set<String> ids = new LinkedHashSet<>();
		for (EvaluationCase evaluationCase : this.cases) {
			if (!ids.add(evaluationCase.id())) {
				throw new EvaluationException("Duplicate case id '" + evaluationCase.id() + "' in suite " + name);
			}
			if (!supports(evaluationCase.oracle())) {
				throw new EvaluationException("Suite " + name + " cannot judge case '" + evaluationCase.id()
						+ "' with oracle " + evaluationCase.oracle().getClass().getSimpleName());
			}
		}
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public List<EvaluationCase> cases() {
		return cases;
	}

	@Override
	public EvaluationResult evaluate(EvaluationCase evaluationCase, EvaluationContext context,
			CancellationToken cancellation) {
		long start = System.nanoTime();
		CompilationResult compilation = context.compiler().compile(evaluationCase.question(), cancellation);
		Verdict verdict = judge(evaluationCase, compilation, context, cancellation);
		Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

		Map<String, Object> details = new LinkedHashMap<>(evaluationCase.details());
		details.put("attempts", compilation.attempts());
		compilation.errorKind().ifPresent(kind -> details.put("error_kind", kind.name()));
		details.putAll(verdict.details());
		String sql = compilation.finalCandidate().map(CandidateQuery::text).orElse(null);
		return new EvaluationResult(evaluationCase.id(), evaluationCase.category(), evaluationCase.question(),
				verdict.passed(), sql, verdict.diagnostic(), elapsed, details);
	}

	/**
	 * Whether this suite knows how to judge the given oracle.
	 */
	protected abstract boolean supports(Oracle oracle);

	protected abstract Verdict judge(EvaluationCase evaluationCase, CompilationResult compilation,
			EvaluationContext context, CancellationToken cancellation);

	/**
	 * Re-validates the final candidate with the context's validator.
	 *
	 * @return the validation result, or empty when no candidate was produced
	 */
	protected static Optional<ValidationResult> revalidateFinalCandidate(CompilationResult compilation,
			EvaluationContext context) {
		return compilation.finalCandidate().map(candidate -> context.validator().validate(candidate.text()));
	}

	protected static Optional<ParseTree> acceptedTree(CompilationResult compilation, EvaluationContext context) {
		return revalidateFinalCandidate(compilation, context)
				.filter(ValidationResult::accepted)
				.map(result -> ((ValidationResult.Accept) result).parseTree());
	}

	protected static String describeFailure(CompilationResult compilation) {
		return compilation.error() != null
				? compilation.error().kind() + ": " + compilation.error().message()
				: "no error";
	}

	/**
	 * A pass/fail decision with its explanation.
	 */
	protected record Verdict(boolean passed, String diagnostic, Map<String, Object> details) {

		protected Verdict {
			details = details != null ? Map.copyOf(details) : Map.of();
		}

		static Verdict pass(String diagnostic) {
			return new Verdict(true, diagnostic, Map.of());
		}

		static Verdict fail(String diagnostic) {
			return new Verdict(false, diagnostic, Map.of());
		}

		Verdict withDetails(Map<String, Object> extra) {
			Map<String, Object> merged = new LinkedHashMap<>(details);
			merged.putAll(extra);
			return new Verdict(passed, diagnostic, merged);
		}
	}
}
