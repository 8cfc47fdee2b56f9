package org.javai.sqlguard.compiler;

import java.util.Objects;
import java.util.Optional;
import org.javai.sqlguard.validate.ParseTree;

/**
 * One generated query text and what validation made of it.
 *
 * @param text the text as returned by the generation service
 * @param attempt 1-based generation attempt that produced it
 * @param status validation status
 * @param parseTree derivation, present only when {@code status} is valid
 */
public record CandidateQuery(String text, int attempt, ValidationStatus status, ParseTree parseTree) {

	public CandidateQuery {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(status, "status must not be null");
		if (status instanceof ValidationStatus.Valid && parseTree == null) {
			throw new IllegalArgumentException("A valid candidate must carry its parse tree");
		}
	}

	static CandidateQuery unvalidated(String text, int attempt) {
		return new CandidateQuery(text, attempt, new ValidationStatus.Unvalidated(), null);
	}

	CandidateQuery valid(ParseTree tree) {
		return new CandidateQuery(text, attempt, new ValidationStatus.Valid(), tree);
	}

	CandidateQuery invalid(String reason) {
		return new CandidateQuery(text, attempt, new ValidationStatus.Invalid(reason), null);
	}

	public boolean isValid() {
		return status instanceof ValidationStatus.Valid;
	}

	public Optional<ParseTree> tree() {
		return Optional.ofNullable(parseTree);
	}
}
