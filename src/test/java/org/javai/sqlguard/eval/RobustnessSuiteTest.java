package org.javai.sqlguard.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.QueryCompiler;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.execution.ExecutionResult;
import org.javai.sqlguard.grammar.GrammarBuilder;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.javai.sqlguard.testsupport.ScriptedGenerationService;
import org.javai.sqlguard.validate.GrammarValidator;
import org.javai.sqlguard.validate.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Robustness suite")
class RobustnessSuiteTest {

	private static final GrammarValidator VALIDATOR =
			new GrammarValidator(new GrammarBuilder().build(SchemaRegistry.loadDefault()));

	private static final String QUESTION = "Show me recent transactions";
	private static final String RECENT = "SELECT count(*) FROM Transactions WHERE step >= 720;";

	private ScriptedGenerationService generation;
	private QueryCompiler compiler;
	private EvaluationContext context;

	@BeforeEach
	void setUp() {
		generation = new ScriptedGenerationService();
		ExecutionGateway gateway = mock(ExecutionGateway.class);
		when(gateway.execute(anyString(), any(CancellationToken.class))).thenReturn(
				new ExecutionResult(List.of("count(*)"), List.of(List.of(3L)), Duration.ZERO, false));
		compiler = QueryCompiler.builder()
				.validator(VALIDATOR)
				.generationService(generation)
				.executionGateway(gateway)
				.build();
		context = new EvaluationContext(compiler, VALIDATOR, null);
	}

	@AfterEach
	void tearDown() {
		compiler.close();
	}

	private EvaluationResult evaluate(String question, Oracle.OutcomeClass outcome) {
		return evaluate(question, outcome, Map.of());
	}

	private EvaluationResult evaluate(String question, Oracle.OutcomeClass outcome, Map<String, Object> details) {
		EvaluationCase evaluationCase = new EvaluationCase("case", question, "input",
				new Oracle.ExpectedOutcome(outcome), details);
		return new RobustnessSuite(List.of(evaluationCase)).evaluate(evaluationCase, context,
				CancellationToken.none());
	}

	@Nested
	@DisplayName("Valid query expected")
	class ValidQuery {

		@Test
		void validQueryPassesAndRecordsChecks() {
			generation.candidates(QUESTION, RECENT);

			EvaluationResult result = evaluate(QUESTION, Oracle.OutcomeClass.VALID_QUERY,
					Map.of("checks", List.of("has_time_filter", "has_amount_filter", "should_have_limit")));

			assertThat(result.passed()).isTrue();
			assertThat(result.details())
					.containsEntry("has_time_filter", true)
					.containsEntry("has_amount_filter", false)
					.containsEntry("should_have_limit", false);
		}

		@Test
		void failedInformationalChecksDoNotDecideTheVerdict() {
			generation.candidates(QUESTION, "SELECT count(*) FROM Transactions;");

			EvaluationResult result = evaluate(QUESTION, Oracle.OutcomeClass.VALID_QUERY,
					Map.of("checks", List.of("has_time_filter")));

			assertThat(result.passed()).isTrue();
			assertThat(result.details()).containsEntry("has_time_filter", false);
		}

		@Test
		void refusalFails() {
			generation.refusal(QUESTION, "Too vague");

			EvaluationResult result = evaluate(QUESTION, Oracle.OutcomeClass.VALID_QUERY);

			assertThat(result.passed()).isFalse();
			assertThat(result.diagnostic()).isEqualTo("Expected a valid query (REFUSED: Too vague)");
		}
	}

	@Nested
	@DisplayName("Valid query or refusal")
	class ValidOrRefusal {

		@Test
		void refusalPasses() {
			String question = "What percentage of transactions are fraudulent?";
			generation.refusal(question, "Ratios are not supported");

			EvaluationResult result = evaluate(question, Oracle.OutcomeClass.VALID_OR_REFUSAL);

			assertThat(result.passed()).isTrue();
			assertThat(result.diagnostic()).isEqualTo("Declined: REFUSED: Ratios are not supported");
		}

		@Test
		void rejectedCandidatesFail() {
			String question = "What percentage of transactions are fraudulent?";
			generation.candidates(question, "SELECT count(*) * 100 / (SELECT count(*) FROM Transactions) FROM Transactions;");

			EvaluationResult result = evaluate(question, Oracle.OutcomeClass.VALID_OR_REFUSAL);

			assertThat(result.passed()).isFalse();
			assertThat(result.diagnostic()).startsWith("Expected a valid query or a refusal (INTERNAL_INVARIANT_VIOLATION");
		}
	}

	@Nested
	@DisplayName("Valid query or clean failure")
	class ValidOrCleanFailure {

		@Test
		void cleanFailurePasses() {
			String question = "Show me transactions with customer details from the users table";
			generation.refusal(question, "Joins are not supported");

			EvaluationResult result = evaluate(question, Oracle.OutcomeClass.VALID_OR_CLEAN_FAILURE);

			assertThat(result.passed()).isTrue();
			assertThat(result.diagnostic()).isEqualTo("Failed cleanly (REFUSED: Joins are not supported)");
		}

		@Test
		void approximationPasses() {
			String question = "What is the median transaction amount?";
			generation.candidates(question, "SELECT avg(amount) FROM Transactions;");

			EvaluationResult result = evaluate(question, Oracle.OutcomeClass.VALID_OR_CLEAN_FAILURE);

			assertThat(result.passed()).isTrue();
			assertThat(result.diagnostic()).isEqualTo("Valid approximation generated");
		}

		@Test
		void malformedFinalCandidateFails() {
			String question = "What is the median transaction amount?";
			generation.candidates(question, "SELECT median(amount) FROM Transactions;");

			EvaluationResult result = evaluate(question, Oracle.OutcomeClass.VALID_OR_CLEAN_FAILURE);

			assertThat(result.passed()).isFalse();
			assertThat(result.diagnostic()).startsWith("Malformed SQL: ");
		}
	}

	@Nested
	@DisplayName("Unsupported input")
	class Unsupported {

		@Test
		void emptyQuestionIsRejectedBeforeGeneration() {
			EvaluationResult result = evaluate("   \t  ", Oracle.OutcomeClass.UNSUPPORTED);

			assertThat(result.passed()).isTrue();
			assertThat(result.diagnostic()).isEqualTo("Rejected before generation");
			assertThat(generation.invocations()).isZero();
		}

		@Test
		void overlongQuestionIsRejectedBeforeGeneration() {
			EvaluationResult result = evaluate("count the fraudulent transfers ".repeat(40),
					Oracle.OutcomeClass.UNSUPPORTED);

			assertThat(result.passed()).isTrue();
		}

		@Test
		void answeredQuestionFails() {
			generation.candidates("?? count ??", "SELECT count(*) FROM Transactions;");

			EvaluationResult result = evaluate("?? count ??", Oracle.OutcomeClass.UNSUPPORTED);

			assertThat(result.passed()).isFalse();
			assertThat(result.diagnostic()).isEqualTo("Expected UNSUPPORTED_QUESTION but got a result");
		}
	}

	@Test
	void safeOutcomeInspectsTheTree() {
		String question = "What is the average customer age?";
		generation.candidates(question, "SELECT avg(amount) FROM Transactions;");

		EvaluationResult result = evaluate(question, Oracle.OutcomeClass.SAFE);

		assertThat(result.passed()).isTrue();
		assertThat(result.diagnostic()).isEqualTo("Safe query generated");
	}

	@Test
	void informationalChecksCoverDimensionsAndUnknownNames() {
		ValidationResult validation = VALIDATOR.validate(
				"SELECT isFraud, type, step, count(*) FROM Transactions GROUP BY isFraud, type, step LIMIT 100;");
		QueryShape shape = QueryShape.of(((ValidationResult.Accept) validation).parseTree());
		EvaluationCase evaluationCase = new EvaluationCase("multi", "q", null,
				new Oracle.ExpectedOutcome(Oracle.OutcomeClass.VALID_QUERY),
				Map.of("checks", List.of("limited_dimensions", "should_have_limit", "mystery")));

		Map<String, Object> checks = RobustnessSuite.informationalChecks(evaluationCase, shape);

		assertThat(checks)
				.containsEntry("limited_dimensions", false)
				.containsEntry("should_have_limit", true)
				.containsEntry("mystery", "unknown check");
	}
}
