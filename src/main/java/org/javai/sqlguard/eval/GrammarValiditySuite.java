package org.javai.sqlguard.eval;

import java.util.List;
import java.util.Optional;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.validate.ValidationResult;

/**
 * Every final candidate the compiler produces must be accepted by the grammar.
 * <p>
 * A compilation that produced no candidate at all is a clean pass.
 */
public class GrammarValiditySuite extends AbstractEvaluationSuite {

	public static final String NAME = "grammar_validity";
	public static final String CORPUS = EvaluationCorpusParser.CORPUS_ROOT + NAME + ".yml";

	public GrammarValiditySuite(List<EvaluationCase> cases) {
		super(NAME, cases);
	}

	public static GrammarValiditySuite fromClasspath() {
		return new GrammarValiditySuite(EvaluationCorpusParser.loadClasspath(CORPUS).cases());
	}

	@Override
	protected boolean supports(Oracle oracle) {
		return oracle instanceof Oracle.ExpectedOutcome;
	}

	@Override
	protected Verdict judge(EvaluationCase evaluationCase, CompilationResult compilation, EvaluationContext context,
			CancellationToken cancellation) {
		Optional<ValidationResult> validation = revalidateFinalCandidate(compilation, context);
		if (validation.isEmpty()) {
			return Verdict.pass("No SQL generated (" + describeFailure(compilation) + ")");
		}
		ValidationResult result = validation.get();
		if (result.accepted()) {
			return Verdict.pass("Final candidate accepted by grammar");
		}
		return Verdict.fail("Final candidate rejected: " + ((ValidationResult.Reject) result).describe());
	}
}
