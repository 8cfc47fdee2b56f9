package org.javai.sqlguard.config;

import java.nio.file.Path;
import java.time.Duration;
import org.javai.sqlguard.compiler.CompilerOptions;
import org.javai.sqlguard.compiler.RetryFeedbackPolicy;
import org.javai.sqlguard.eval.HarnessOptions;
import org.javai.sqlguard.execution.JdbcGatewayOptions;
import org.javai.sqlguard.validate.GrammarValidator;

/**
 * Deployment settings, normally loaded from {@code sqlguard.yml} by {@link SqlGuardSettingsLoader}.
 */
public record SqlGuardSettings(Compiler compiler, Gateway gateway, Generation generation, Harness harness) {

	public SqlGuardSettings {
		compiler = compiler != null ? compiler : Compiler.defaults();
		generation = generation != null ? generation : Generation.defaults();
		harness = harness != null ? harness : Harness.defaults();
	}

	public static SqlGuardSettings defaults() {
		return new SqlGuardSettings(Compiler.defaults(), null, Generation.defaults(), Harness.defaults());
	}

	public boolean hasGateway() {
		return gateway != null;
	}

	/**
	 * @param maxRetries regenerations after a rejected candidate
	 * @param generationTimeout bound on one generation call
	 * @param minQuestionLength shortest accepted question
	 * @param maxQuestionLength longest accepted question
	 * @param feedbackPolicy what retries are told about a rejection
	 * @param maxCandidateLength longest candidate the validator will parse
	 */
	public record Compiler(
			int maxRetries,
			Duration generationTimeout,
			int minQuestionLength,
			int maxQuestionLength,
			RetryFeedbackPolicy feedbackPolicy,
			int maxCandidateLength
	) {

		public static Compiler defaults() {
			CompilerOptions options = CompilerOptions.defaults();
			return new Compiler(options.maxRetries(), options.generationTimeout(), options.minQuestionLength(),
					options.maxQuestionLength(), options.feedbackPolicy(), GrammarValidator.DEFAULT_MAX_LENGTH);
		}

		public CompilerOptions toOptions() {
			return new CompilerOptions(maxRetries, generationTimeout, minQuestionLength, maxQuestionLength,
					feedbackPolicy);
		}
	}

	public record Gateway(
			String jdbcUrl,
			String username,
			String password,
			int maximumPoolSize,
			Duration connectionTimeout,
			Duration queryTimeout,
			int maxRows
	) {

		public JdbcGatewayOptions toOptions() {
			return new JdbcGatewayOptions(jdbcUrl, username, password, maximumPoolSize, connectionTimeout,
					queryTimeout, maxRows);
		}
	}

	/**
	 * @param endpoint responses API endpoint
	 * @param model model name sent with each request
	 * @param apiKey credential; blank when generation is not configured
	 * @param requestTimeout HTTP request timeout
	 */
	public record Generation(String endpoint, String model, String apiKey, Duration requestTimeout) {

		public static Generation defaults() {
			return new Generation(null, "gpt-5", null, Duration.ofSeconds(90));
		}

		public boolean hasApiKey() {
			return apiKey != null && !apiKey.isBlank();
		}
	}

	public record Harness(int workers, Duration caseTimeout, Path reportDirectory) {

		public static Harness defaults() {
			HarnessOptions options = HarnessOptions.defaults();
			return new Harness(options.workers(), options.caseTimeout(), options.reportDirectory());
		}

		public HarnessOptions toOptions() {
			return new HarnessOptions(workers, caseTimeout, reportDirectory);
		}
	}
}
