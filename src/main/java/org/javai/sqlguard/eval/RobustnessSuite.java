package org.javai.sqlguard.eval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.compiler.CompilerState;
import org.javai.sqlguard.compiler.QueryErrorKind;
import org.javai.sqlguard.validate.ParseTree;
import org.javai.sqlguard.validate.ValidationResult;

/**
 * Edge-case and out-of-scope questions must resolve to a valid query or a structured error.
 * <p>
 * Cases may list informational checks under {@code checks} in their details; those are
 * recorded but never decide the verdict.
 */
public class RobustnessSuite extends AbstractEvaluationSuite {

	public static final String NAME = "robustness";
	public static final String CORPUS = EvaluationCorpusParser.CORPUS_ROOT + NAME + ".yml";

	static final String CHECKS = "checks";
	static final int MAX_DIMENSIONS = 2;

	public RobustnessSuite(List<EvaluationCase> cases) {
		super(NAME, cases);
	}

	public static RobustnessSuite fromClasspath() {
		return new RobustnessSuite(EvaluationCorpusParser.loadClasspath(CORPUS).cases());
	}

	@Override
	protected boolean supports(Oracle oracle) {
		return oracle instanceof Oracle.ExpectedOutcome;
	}

	@Override
	protected Verdict judge(EvaluationCase evaluationCase, CompilationResult compilation, EvaluationContext context,
			CancellationToken cancellation) {
		Oracle.OutcomeClass expected = ((Oracle.ExpectedOutcome) evaluationCase.oracle()).outcome();
		Optional<ValidationResult> validation = revalidateFinalCandidate(compilation, context);
		Optional<ParseTree> tree = validation.filter(ValidationResult::accepted)
				.map(result -> ((ValidationResult.Accept) result).parseTree());

		Verdict verdict = switch (expected) {
			case VALID_QUERY -> tree.isPresent()
					? Verdict.pass("Valid query generated")
					: Verdict.fail("Expected a valid query (" + describeFailure(compilation) + ")");
			case VALID_OR_REFUSAL -> judgeValidOrRefusal(compilation, validation, tree);
			case VALID_OR_CLEAN_FAILURE -> judgeValidOrCleanFailure(compilation, validation);
			case UNSUPPORTED -> judgeUnsupported(compilation);
			case SAFE -> tree
					.map(t -> {
						List<String> violations = SafetyInspection.violations(t, context.validator().artifact());
						return violations.isEmpty() ? Verdict.pass("Safe query generated")
								: Verdict.fail("Unsafe candidate: " + String.join("; ", violations));
					})
					.orElseGet(() -> validation.isPresent()
							? Verdict.fail("Produced candidate does not parse")
							: Verdict.pass("No SQL generated"));
		};
		return tree.map(t -> verdict.withDetails(informationalChecks(evaluationCase, QueryShape.of(t))))
				.orElse(verdict);
	}

	private Verdict judgeValidOrRefusal(CompilationResult compilation, Optional<ValidationResult> validation,
			Optional<ParseTree> tree) {
		if (tree.isPresent()) {
			return Verdict.pass("Valid query generated");
		}
		if (validation.isEmpty() && (compilation.failedWith(QueryErrorKind.REFUSED)
				|| compilation.failedWith(QueryErrorKind.UNSUPPORTED_QUESTION))) {
			return Verdict.pass("Declined: " + describeFailure(compilation));
		}
		return Verdict.fail("Expected a valid query or a refusal (" + describeFailure(compilation) + ")");
	}

	private Verdict judgeValidOrCleanFailure(CompilationResult compilation, Optional<ValidationResult> validation) {
		if (validation.isEmpty()) {
			return compilation.error() != null
					? Verdict.pass("Failed cleanly (" + describeFailure(compilation) + ")")
					: Verdict.fail("No candidate and no error reported");
		}
		if (validation.get().accepted()) {
			return Verdict.pass("Valid approximation generated");
		}
		return Verdict.fail("Malformed SQL: " + ((ValidationResult.Reject) validation.get()).describe());
	}

	private Verdict judgeUnsupported(CompilationResult compilation) {
		if (!compilation.failedWith(QueryErrorKind.UNSUPPORTED_QUESTION)) {
			return Verdict.fail("Expected " + QueryErrorKind.UNSUPPORTED_QUESTION + " but got "
					+ (compilation.success() ? "a result" : describeFailure(compilation)));
		}
		if (compilation.states().contains(CompilerState.AWAIT_GENERATION)) {
			return Verdict.fail("Generation service was consulted for an unsupported question");
		}
		return Verdict.pass("Rejected before generation");
	}

	static Map<String, Object> informationalChecks(EvaluationCase evaluationCase, QueryShape shape) {
		Map<String, Object> results = new LinkedHashMap<>();
		Object requested = evaluationCase.details().get(CHECKS);
		if (!(requested instanceof List<?> checks)) {
			return results;
		}
		for (Object check : checks) {
			String name = String.valueOf(check);
			switch (name) {
				case "has_time_filter" -> results.put(name, shape.hasFilterOn("step"));
				case "has_amount_filter" -> results.put(name, shape.hasFilterOn("amount"));
				case "should_have_limit" -> results.put(name, shape.limit() != null);
				case "limited_dimensions" -> results.put(name, shape.groupBy().size() <= MAX_DIMENSIONS);
				default -> results.put(name, "unknown check");
			}
		}
		return results;
	}
}
