package org.javai.sqlguard.compiler;

import java.util.Optional;

/**
 * Rejects questions that cannot produce a meaningful query before any generation is spent on them.
 */
final class QuestionScreen {

	private QuestionScreen() {
	}

	static Optional<String> rejectionReason(String question, CompilerOptions options) {
		if (question == null || question.isBlank()) {
			return Optional.of("The question is empty");
		}
		String trimmed = question.strip();
		if (trimmed.length() < options.minQuestionLength()) {
			return Optional.of("The question must be at least " + options.minQuestionLength() + " characters");
		}
		if (trimmed.length() > options.maxQuestionLength()) {
			return Optional.of("The question must be at most " + options.maxQuestionLength() + " characters");
		}
		if (trimmed.codePoints().noneMatch(Character::isLetterOrDigit)) {
			return Optional.of("The question contains no words");
		}
		return Optional.empty();
	}
}
