package org.javai.sqlguard.compiler;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits and policies for the query compiler.
 *
 * @param maxRetries regenerations allowed after a rejected candidate; attempts are {@code maxRetries + 1}
 * @param generationTimeout bound on a single generation call
 * @param minQuestionLength shortest accepted question, in characters after trimming
 * @param maxQuestionLength longest accepted question, in characters after trimming
 * @param feedbackPolicy what a retry is told about the rejection
 */
public record CompilerOptions(
		int maxRetries,
		Duration generationTimeout,
		int minQuestionLength,
		int maxQuestionLength,
		RetryFeedbackPolicy feedbackPolicy
) {

	public CompilerOptions {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative");
		}
		Objects.requireNonNull(generationTimeout, "generationTimeout must not be null");
		if (generationTimeout.isNegative() || generationTimeout.isZero()) {
			throw new IllegalArgumentException("generationTimeout must be positive");
		}
		if (minQuestionLength < 1 || maxQuestionLength < minQuestionLength) {
			throw new IllegalArgumentException("Question length bounds are inconsistent");
		}
		feedbackPolicy = feedbackPolicy != null ? feedbackPolicy : RetryFeedbackPolicy.DIAGNOSTIC;
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(2, Duration.ofSeconds(60), 3, 500, RetryFeedbackPolicy.DIAGNOSTIC);
	}

	public CompilerOptions withMaxRetries(int maxRetries) {
		return new CompilerOptions(maxRetries, generationTimeout, minQuestionLength, maxQuestionLength, feedbackPolicy);
	}

	public CompilerOptions withGenerationTimeout(Duration generationTimeout) {
		return new CompilerOptions(maxRetries, generationTimeout, minQuestionLength, maxQuestionLength, feedbackPolicy);
	}

	public CompilerOptions withFeedbackPolicy(RetryFeedbackPolicy feedbackPolicy) {
		return new CompilerOptions(maxRetries, generationTimeout, minQuestionLength, maxQuestionLength, feedbackPolicy);
	}

	public int maxAttempts() {
		return maxRetries + 1;
	}
}
