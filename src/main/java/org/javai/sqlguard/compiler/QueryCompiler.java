package org.javai.sqlguard.compiler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.execution.ExecutionResult;
import org.javai.sqlguard.execution.QueryExecutionException;
import org.javai.sqlguard.generate.GenerationException;
import org.javai.sqlguard.generate.GenerationRequest;
import org.javai.sqlguard.generate.GenerationResponse;
import org.javai.sqlguard.generate.GenerationService;
import org.javai.sqlguard.grammar.GrammarArtifact;
import org.javai.sqlguard.validate.GrammarValidator;
import org.javai.sqlguard.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a natural-language question into an executed, grammar-validated query.
 * <p>
 * Each request runs the {@link CompilerState} machine on the calling thread; only the
 * generation call is handed to an executor so it can be bounded by a timeout and abandoned on
 * cancellation. Every candidate is validated locally whatever the generation service claims,
 * and only validated text reaches the {@link ExecutionGateway}. {@link #compile(String)} never
 * throws: every outcome is a {@link CompilationResult}.
 * <p>
 * Instances are thread-safe; request state lives in the call.
 */
public class QueryCompiler implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(QueryCompiler.class);

	private final GrammarValidator validator;
	private final GenerationService generationService;
	private final ExecutionGateway executionGateway;
	private final CompilerOptions options;
	private final ExecutorService generationExecutor;
	private final boolean ownsExecutor;

	private QueryCompiler(Builder builder) {
		this.validator = Objects.requireNonNull(builder.validator, "validator must not be null");
		this.generationService = Objects.requireNonNull(builder.generationService, "generationService must not be null");
		this.executionGateway = Objects.requireNonNull(builder.executionGateway, "executionGateway must not be null");
		this.options = builder.options != null ? builder.options : CompilerOptions.defaults();
		this.ownsExecutor = builder.generationExecutor == null;
		this.generationExecutor = ownsExecutor ? Executors.newCachedThreadPool(new GenerationThreadFactory())
				: builder.generationExecutor;
	}

	public static Builder builder() {
		return new Builder();
	}

	public CompilationResult compile(String question) {
		return compile(question, CancellationToken.none());
	}

	public CompilationResult compile(String question, CancellationToken cancellation) {
		Request request = new Request(question, cancellation != null ? cancellation : CancellationToken.none());
		CompilerState state = CompilerState.START;
		while (!state.isTerminal()) {
			request.states.add(state);
			if (request.token.isCancelled()) {
				state = request.fail(QueryErrorKind.CANCELLED, "The request was cancelled");
				continue;
			}
			try {
				state = step(state, request);
			}
			catch (RuntimeException e) {
				state = classifyUnexpected(state, request, e);
			}
		}
		request.states.add(state);
		return request.toResult(state == CompilerState.DONE);
	}

	public GrammarArtifact artifact() {
		return validator.artifact();
	}

	public CompilerOptions options() {
		return options;
	}

	@Override
	public void close() {
		if (ownsExecutor) {
			generationExecutor.shutdownNow();
		}
	}

	private CompilerState step(CompilerState state, Request request) {
		return switch (state) {
			case START -> start(request);
			case AWAIT_GENERATION -> awaitGeneration(request);
			case VALIDATING -> validate(request);
			case RETRY -> retry(request);
			case EXECUTING -> execute(request);
			case DONE, FAILED -> state;
		};
	}

	private CompilerState start(Request request) {
		Optional<String> rejection = QuestionScreen.rejectionReason(request.question, options);
		if (rejection.isPresent()) {
			logger.info("Question rejected before generation: {}", rejection.get());
			return request.fail(QueryErrorKind.UNSUPPORTED_QUESTION, rejection.get());
		}
		request.generation = GenerationRequest.first(request.question.strip(), validator.artifact());
		return CompilerState.AWAIT_GENERATION;
	}

	private CompilerState awaitGeneration(Request request) {
		GenerationRequest generationRequest = request.generation;
		Future<GenerationResponse> future = generationExecutor.submit(() -> generationService.generate(generationRequest));
		GenerationResponse response;
		try (CancellationToken.Registration ignored = request.token.onCancel(() -> future.cancel(true))) {
			response = future.get(options.generationTimeout().toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("Generation attempt {} timed out after {} ms", generationRequest.attempt(),
					options.generationTimeout().toMillis());
			return request.fail(QueryErrorKind.DECODER_TIMEOUT,
					"Query generation did not finish within " + options.generationTimeout().toSeconds()
							+ " s; please resubmit the question");
		}
		catch (CancellationException e) {
			return request.fail(QueryErrorKind.CANCELLED, "The request was cancelled");
		}
		catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			return request.fail(QueryErrorKind.CANCELLED, "The request was interrupted");
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			logger.warn("Generation attempt {} failed: {}", generationRequest.attempt(), cause.toString(), cause);
			String detail = cause instanceof GenerationException ? cause.getMessage() : "Query generation failed";
			return request.fail(QueryErrorKind.GENERATION_FAILED, detail);
		}

		if (response instanceof GenerationResponse.Refusal refusal) {
			logger.info("Generation service refused: {}", refusal.reason());
			return request.fail(QueryErrorKind.REFUSED, refusal.reason());
		}
		String text = ((GenerationResponse.Candidate) response).text();
		logger.debug("Attempt {} candidate: {}", generationRequest.attempt(), text);
		request.candidates.add(CandidateQuery.unvalidated(text, generationRequest.attempt()));
		return CompilerState.VALIDATING;
	}

	private CompilerState validate(Request request) {
		CandidateQuery candidate = request.lastCandidate();
		ValidationResult result = validator.validate(candidate.text());
		if (result instanceof ValidationResult.Accept accept) {
			request.replaceLastCandidate(candidate.valid(accept.parseTree()));
			return CompilerState.EXECUTING;
		}

		ValidationResult.Reject reject = (ValidationResult.Reject) result;
		request.replaceLastCandidate(candidate.invalid(reject.describe()));
		request.lastRejection = reject;
		logger.warn("Attempt {} rejected by grammar ({}): {}", candidate.attempt(), QueryErrorKind.GRAMMAR_REJECTED,
				reject.describe());

		if (candidate.attempt() >= options.maxAttempts()) {
			logger.error("Generation drift: {} consecutive candidates rejected by grammar {}; last: '{}' ({})",
					candidate.attempt(), validator.artifact().fingerprint(), candidate.text(), reject.describe());
			return request.fail(QueryErrorKind.INTERNAL_INVARIANT_VIOLATION,
					"No valid query could be produced after " + candidate.attempt() + " attempts");
		}
		return CompilerState.RETRY;
	}

	private CompilerState retry(Request request) {
		String feedback = options.feedbackPolicy().feedbackFor(request.lastRejection);
		request.generation = request.generation.retry(feedback);
		return CompilerState.AWAIT_GENERATION;
	}

	private CompilerState execute(Request request) {
		CandidateQuery candidate = request.lastCandidate();
		if (!candidate.isValid()) {
			logger.error("Refusing to execute unvalidated candidate '{}'", candidate.text());
			return request.fail(QueryErrorKind.INTERNAL_INVARIANT_VIOLATION, "Candidate reached execution unvalidated");
		}
		try {
			request.execution = Objects.requireNonNull(executionGateway.execute(candidate.text(), request.token),
					"execution gateway returned no result");
			request.sql = candidate.text();
			return CompilerState.DONE;
		}
		catch (QueryExecutionException e) {
			if (e.reason() == QueryExecutionException.Reason.CANCELLED) {
				return request.fail(QueryErrorKind.CANCELLED, "The request was cancelled");
			}
			logger.warn("Execution of '{}' failed ({}): {}", candidate.text(), e.reason(), e.getMessage());
			return request.fail(QueryErrorKind.EXECUTION_ERROR, executionMessage(e));
		}
	}

	private String executionMessage(QueryExecutionException e) {
		return switch (e.reason()) {
			case TIMEOUT -> "The query exceeded its time limit";
			case UNAVAILABLE -> "The database is unavailable";
			default -> "The query failed: " + e.getMessage();
		};
	}

	private CompilerState classifyUnexpected(CompilerState state, Request request, RuntimeException e) {
		logger.error("Unexpected failure in state {}", state, e);
		QueryErrorKind kind = switch (state) {
			case AWAIT_GENERATION -> QueryErrorKind.GENERATION_FAILED;
			case EXECUTING -> QueryErrorKind.EXECUTION_ERROR;
			default -> QueryErrorKind.INTERNAL_INVARIANT_VIOLATION;
		};
		return request.fail(kind, "Unexpected failure while " + state.name().toLowerCase(Locale.ROOT).replace('_', ' '));
	}

	/**
	 * Mutable state of one compilation; never shared between threads.
	 */
	private static final class Request {

		final String question;
		final CancellationToken token;
		final long startNanos = System.nanoTime();
		final List<CandidateQuery> candidates = new ArrayList<>();
		final List<CompilerState> states = new ArrayList<>();
		GenerationRequest generation;
		ValidationResult.Reject lastRejection;
		ExecutionResult execution;
		String sql;
		QueryError error;

		Request(String question, CancellationToken token) {
			this.question = question;
			this.token = token;
		}

		CompilerState fail(QueryErrorKind kind, String message) {
			error = new QueryError(kind, message);
			return CompilerState.FAILED;
		}

		CandidateQuery lastCandidate() {
			return candidates.get(candidates.size() - 1);
		}

		void replaceLastCandidate(CandidateQuery candidate) {
			candidates.set(candidates.size() - 1, candidate);
		}

		CompilationResult toResult(boolean success) {
			Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
			if (success) {
				return new CompilationResult(question, true, sql, execution, null, candidates, states, elapsed);
			}
			return new CompilationResult(question, false, null, null, error, candidates, states, elapsed);
		}
	}

	private static final class GenerationThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "sqlguard-generation-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}

	public static class Builder {

		private GrammarValidator validator;
		private GenerationService generationService;
		private ExecutionGateway executionGateway;
		private CompilerOptions options;
		private ExecutorService generationExecutor;

		private Builder() {
		}

		public Builder validator(GrammarValidator validator) {
			this.validator = validator;
			return this;
		}

		public Builder generationService(GenerationService generationService) {
			this.generationService = generationService;
			return this;
		}

		public Builder executionGateway(ExecutionGateway executionGateway) {
			this.executionGateway = executionGateway;
			return this;
		}

		public Builder options(CompilerOptions options) {
			this.options = options;
			return this;
		}

		/**
		 * Executor for generation calls. When omitted the compiler creates and owns one.
		 */
		public Builder generationExecutor(ExecutorService generationExecutor) {
			this.generationExecutor = generationExecutor;
			return this;
		}

		public QueryCompiler build() {
			return new QueryCompiler(this);
		}
	}
}
