package org.javai.sqlguard.generate;

import java.util.Objects;

/**
 * What a generation service returned. Candidate text is untrusted until validated.
 */
public sealed interface GenerationResponse permits GenerationResponse.Candidate, GenerationResponse.Refusal {

	record Candidate(String text) implements GenerationResponse {

		public Candidate {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	/**
	 * The service declined to produce a query.
	 */
	record Refusal(String reason) implements GenerationResponse {

		public Refusal {
			reason = reason != null && !reason.isBlank() ? reason : "The question cannot be answered with the allowed queries";
		}
	}
}
