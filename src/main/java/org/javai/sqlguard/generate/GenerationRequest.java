package org.javai.sqlguard.generate;

import java.util.Objects;
import org.javai.sqlguard.grammar.GrammarArtifact;

/**
 * What a generation service receives for one attempt.
 *
 * @param question the caller's natural-language question
 * @param artifact the grammar the candidate must conform to
 * @param schemaContext human-readable table description
 * @param feedback diagnostic from the previous rejected attempt, or {@code null}
 * @param attempt 1-based attempt number within the request
 */
public record GenerationRequest(
		String question,
		GrammarArtifact artifact,
		String schemaContext,
		String feedback,
		int attempt
) {

	public GenerationRequest {
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(artifact, "artifact must not be null");
		schemaContext = schemaContext != null ? schemaContext : artifact.schema().describe();
		if (attempt < 1) {
			throw new IllegalArgumentException("attempt must be at least 1");
		}
	}

	public static GenerationRequest first(String question, GrammarArtifact artifact) {
		return new GenerationRequest(question, artifact, null, null, 1);
	}

	public GenerationRequest retry(String nextFeedback) {
		return new GenerationRequest(question, artifact, schemaContext, nextFeedback, attempt + 1);
	}

	public boolean hasFeedback() {
		return feedback != null && !feedback.isBlank();
	}
}
