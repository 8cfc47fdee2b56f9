package org.javai.sqlguard.eval;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.sqlguard.CancellationToken;

/**
 * Runs suites on a bounded worker pool.
 * <p>
 * Each case gets its own cancellation token which is cancelled once the per-case timeout
 * elapses; a case that overruns is recorded as failed. Cases are never retried, and an exception
 * raised by a case becomes a failed result rather than aborting the suite.
 */
public class EvaluationRunner implements AutoCloseable {

	private final EvaluationContext context;
	private final HarnessOptions options;
	private final ExecutorService workers;
	private final ScheduledExecutorService watchdog;
	private final EvaluationLogger logger = new EvaluationLogger(EvaluationRunner.class);

	public EvaluationRunner(EvaluationContext context, HarnessOptions options) {
		this.context = Objects.requireNonNull(context, "context must not be null");
		this.options = options != null ? options : HarnessOptions.defaults();
		this.workers = Executors.newFixedThreadPool(this.options.workers(), new NamedThreadFactory("sqlguard-eval"));
		this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("sqlguard-eval-watchdog"));
	}

	public HarnessOptions options() {
		return options;
	}

	public SuiteReport run(EvaluationSuite suite) {
		logger.debug("Running suite {} with {} cases on {} workers", suite.name(), suite.cases().size(),
				options.workers());
		List<Future<EvaluationResult>> futures = new ArrayList<>();
		for (EvaluationCase evaluationCase : suite.cases()) {
			futures.add(workers.submit(() -> runCase(suite, evaluationCase)));
		}

		List<EvaluationResult> results = new ArrayList<>(futures.size());
		for (int i = 0; i < futures.size(); i++) {
			try {
				results.add(futures.get(i).get());
			}
			catch (InterruptedException e) {
				futures.forEach(f -> f.cancel(true));
				Thread.currentThread().interrupt();
				throw new EvaluationException("Interrupted while running suite " + suite.name(), e);
			}
			catch (ExecutionException e) {
				EvaluationCase evaluationCase = suite.cases().get(i);
				Throwable cause = e.getCause() != null ? e.getCause() : e;
				logger.logCaseError(suite.name(), evaluationCase, cause, Duration.ZERO);
				results.add(EvaluationResult.failure(evaluationCase, "Case raised " + cause, Duration.ZERO));
			}
		}

		SuiteReport report = new SuiteReport(suite.name(), Instant.now(), results);
		logger.logSuiteSummary(report);
		return report;
	}

	public EvaluationReport runAll(List<? extends EvaluationSuite> suites) {
		List<SuiteReport> reports = new ArrayList<>();
		for (EvaluationSuite suite : suites) {
			reports.add(run(suite));
		}
		return new EvaluationReport(Instant.now(), context.validator().artifact().fingerprint(), reports);
	}

	@Override
	public void close() {
		workers.shutdownNow();
		watchdog.shutdownNow();
	}

	private EvaluationResult runCase(EvaluationSuite suite, EvaluationCase evaluationCase) {
		CancellationToken token = CancellationToken.create();
		AtomicBoolean timedOut = new AtomicBoolean();
		Duration timeout = options.caseTimeout();
		ScheduledFuture<?> alarm = watchdog.schedule(() -> {
			timedOut.set(true);
			token.cancel();
		}, timeout.toMillis(), TimeUnit.MILLISECONDS);

		long start = System.nanoTime();
		try {
			EvaluationResult result = suite.evaluate(evaluationCase, context, token);
			if (timedOut.get()) {
				return timedOut(suite, evaluationCase, start);
			}
			logger.logCaseResult(suite.name(), result);
			return result;
		}
		catch (RuntimeException e) {
			if (timedOut.get()) {
				return timedOut(suite, evaluationCase, start);
			}
			Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
			logger.logCaseError(suite.name(), evaluationCase, e, elapsed);
			return EvaluationResult.failure(evaluationCase, "Case raised " + e, elapsed);
		}
		finally {
			alarm.cancel(false);
		}
	}

	private EvaluationResult timedOut(EvaluationSuite suite, EvaluationCase evaluationCase, long start) {
		logger.logCaseTimeout(suite.name(), evaluationCase, options.caseTimeout());
		return EvaluationResult.failure(evaluationCase,
				"Timed out after " + options.caseTimeout().toMillis() + " ms",
				Duration.ofNanos(System.nanoTime() - start));
	}

	private static final class NamedThreadFactory implements ThreadFactory {

		private final String prefix;
		private final AtomicInteger counter = new AtomicInteger();

		NamedThreadFactory(String prefix) {
			this.prefix = prefix;
		}

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
