package org.javai.sqlguard.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import org.apache.logging.log4j.Level;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.QueryCompiler;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.grammar.GrammarBuilder;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.javai.sqlguard.testsupport.LogCaptorAppender;
import org.javai.sqlguard.testsupport.ScriptedGenerationService;
import org.javai.sqlguard.validate.GrammarValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Evaluation runner")
class EvaluationRunnerTest {

	private static final GrammarValidator VALIDATOR =
			new GrammarValidator(new GrammarBuilder().build(SchemaRegistry.loadDefault()));

	private static final Oracle ANY = new Oracle.ExpectedOutcome(Oracle.OutcomeClass.VALID_OR_CLEAN_FAILURE);

	private QueryCompiler compiler;
	private EvaluationContext context;

	@BeforeEach
	void setUp() {
		compiler = QueryCompiler.builder()
				.validator(VALIDATOR)
				.generationService(new ScriptedGenerationService())
				.executionGateway(mock(ExecutionGateway.class))
				.build();
		context = new EvaluationContext(compiler, VALIDATOR, null);
	}

	@AfterEach
	void tearDown() {
		compiler.close();
	}

	private static HarnessOptions options(int workers, Duration caseTimeout) {
		return new HarnessOptions(workers, caseTimeout, Path.of("target", "eval-results"));
	}

	private static List<EvaluationCase> cases(int count) {
		List<EvaluationCase> cases = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			cases.add(new EvaluationCase("case_" + i, "question " + i, i % 2 == 0 ? "even" : "odd", ANY));
		}
		return cases;
	}

	private static EvaluationResult pass(EvaluationCase evaluationCase) {
		return new EvaluationResult(evaluationCase.id(), evaluationCase.category(), evaluationCase.question(), true,
				null, "ok", Duration.ZERO, Map.of());
	}

	private static void pause(long millis) {
		try {
			Thread.sleep(millis);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@Test
	void keepsCaseOrderRegardlessOfCompletionOrder() {
		List<EvaluationCase> cases = cases(6);
		StubSuite suite = new StubSuite("ordered", cases, (c, token) -> {
			int index = Integer.parseInt(c.id().substring("case_".length()));
			pause((cases.size() - index) * 20L);
			return pass(c);
		});

		try (EvaluationRunner runner = new EvaluationRunner(context, options(4, Duration.ofSeconds(5)))) {
			SuiteReport report = runner.run(suite);

			assertThat(report.results()).extracting(EvaluationResult::caseId)
					.containsExactly("case_0", "case_1", "case_2", "case_3", "case_4", "case_5");
			assertThat(report.passRate()).isEqualTo(1.0);
			assertThat(report.status()).isEqualTo(SuiteStatus.PASS);
		}
	}

	@Test
	void neverRunsMoreCasesThanWorkers() {
		AtomicInteger running = new AtomicInteger();
		AtomicInteger peak = new AtomicInteger();
		StubSuite suite = new StubSuite("bounded", cases(8), (c, token) -> {
			int now = running.incrementAndGet();
			peak.accumulateAndGet(now, Math::max);
			pause(40);
			running.decrementAndGet();
			return pass(c);
		});

		try (EvaluationRunner runner = new EvaluationRunner(context, options(2, Duration.ofSeconds(5)))) {
			runner.run(suite);
		}

		assertThat(peak.get()).isBetween(1, 2);
	}

	@Test
	void overrunningCaseIsCancelledAndFails() {
		List<EvaluationCase> cases = cases(2);
		AtomicInteger sawCancellation = new AtomicInteger();
		StubSuite suite = new StubSuite("slow", cases, (c, token) -> {
			if (c.id().equals("case_1")) {
				long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
				while (!token.isCancelled() && System.nanoTime() < deadline) {
					pause(5);
				}
				if (token.isCancelled()) {
					sawCancellation.incrementAndGet();
				}
			}
			return pass(c);
		});

		try (EvaluationRunner runner = new EvaluationRunner(context, options(2, Duration.ofMillis(100)))) {
			SuiteReport report = runner.run(suite);

			assertThat(report.results().get(0).passed()).isTrue();
			EvaluationResult slow = report.results().get(1);
			assertThat(slow.passed()).isFalse();
			assertThat(slow.diagnostic()).isEqualTo("Timed out after 100 ms");
			assertThat(sawCancellation.get()).isEqualTo(1);
		}
	}

	@Test
	void exceptionBecomesFailedResultWithoutRetry() {
		Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
		StubSuite suite = new StubSuite("faulty", cases(3), (c, token) -> {
			invocations.computeIfAbsent(c.id(), k -> new AtomicInteger()).incrementAndGet();
			if (c.id().equals("case_1")) {
				throw new IllegalStateException("boom");
			}
			return pass(c);
		});

		try (EvaluationRunner runner = new EvaluationRunner(context, options(2, Duration.ofSeconds(5)))) {
			SuiteReport report = runner.run(suite);

			assertThat(report.results()).extracting(EvaluationResult::passed).containsExactly(true, false, true);
			assertThat(report.results().get(1).diagnostic())
					.isEqualTo("Case raised java.lang.IllegalStateException: boom");
			assertThat(report.results().get(1).category()).isEqualTo("odd");
		}
		assertThat(invocations).hasSize(3);
		assertThat(invocations.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
	}

	@Test
	void logsCaseFailuresAndSuiteSummary() {
		StubSuite suite = new StubSuite("logged", cases(3), (c, token) -> {
			if (c.id().equals("case_2")) {
				return new EvaluationResult(c.id(), c.category(), c.question(), false, "SELECT 1;", "wrong",
						Duration.ofMillis(7), Map.of());
			}
			return pass(c);
		});

		try (LogCaptorAppender appender = LogCaptorAppender.create(EvaluationRunner.class, Level.INFO);
				EvaluationRunner runner = new EvaluationRunner(context, options(1, Duration.ofSeconds(5)))) {
			runner.run(suite);

			assertThat(appender.messagesAt(Level.WARN)).containsExactly(
					"[logged] case='case_2' category=even FAIL 7 ms (question='question 2', sql='SELECT 1;'): wrong");
			assertThat(appender.messagesAt(Level.INFO))
					.contains("[logged] 2/3 passed (66.7%) status=FAIL by category {even=1/2, odd=1/1}");
		}
	}

	@Test
	void runAllReportsEverySuiteWithGrammarFingerprint() {
		StubSuite first = new StubSuite("first", cases(2), (c, token) -> pass(c));
		StubSuite second = new StubSuite("second", cases(1), (c, token) -> {
			throw new IllegalArgumentException("bad");
		});

		try (EvaluationRunner runner = new EvaluationRunner(context, options(2, Duration.ofSeconds(5)))) {
			EvaluationReport report = runner.runAll(List.of(first, second));

			assertThat(report.grammarFingerprint()).isEqualTo(VALIDATOR.artifact().fingerprint());
			assertThat(report.suites()).extracting(SuiteReport::name).containsExactly("first", "second");
			assertThat(report.total()).isEqualTo(3);
			assertThat(report.passed()).isEqualTo(2);
			assertThat(report.suite("second")).hasValueSatisfying(s -> assertThat(s.failed()).isEqualTo(1));
			assertThat(report.suite("third")).isEmpty();
		}
	}

	@Test
	void defaultsApplyWhenNoOptionsGiven() {
		try (EvaluationRunner runner = new EvaluationRunner(context, null)) {
			assertThat(runner.options()).isEqualTo(HarnessOptions.defaults());
		}
	}

	@Test
	void optionsAreValidated() {
		assertThatThrownBy(() -> options(0, Duration.ofSeconds(1)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("workers must be at least 1");
		assertThatThrownBy(() -> options(1, Duration.ZERO))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("caseTimeout must be positive");
		assertThat(HarnessOptions.defaults().withWorkers(8).withCaseTimeout(Duration.ofSeconds(30)))
				.isEqualTo(new HarnessOptions(8, Duration.ofSeconds(30), Path.of("eval-results")));
	}

	private static final class StubSuite implements EvaluationSuite {

		private final String name;
		private final List<EvaluationCase> cases;
		private final BiFunction<EvaluationCase, CancellationToken, EvaluationResult> behaviour;

		StubSuite(String name, List<EvaluationCase> cases,
				BiFunction<EvaluationCase, CancellationToken, EvaluationResult> behaviour) {
			this.name = name;
			this.cases = cases;
			this.behaviour = behaviour;
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
			return behaviour.apply(evaluationCase, cancellation);
		}
	}
}
