package org.javai.sqlguard.validate;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.sqlguard.grammar.GrammarArtifact;
import org.javai.sqlguard.grammar.SqlToken;
import org.javai.sqlguard.grammar.SqlTokenizer;

/**
 * Decides whether a candidate query belongs to the grammar's language.
 * <p>
 * A pure function of the artifact and the text: no I/O, no mutable state, safe to share
 * between threads. Every input terminates; inputs beyond {@link #maxLength()} characters are
 * rejected before tokenization.
 */
public final class GrammarValidator {

	public static final int DEFAULT_MAX_LENGTH = 4096;

	private final GrammarArtifact artifact;
	private final EarleyParser parser;
	private final Set<String> declaredWords;
	private final int maxLength;

	public GrammarValidator(GrammarArtifact artifact) {
		this(artifact, DEFAULT_MAX_LENGTH);
	}

	public GrammarValidator(GrammarArtifact artifact, int maxLength) {
		this.artifact = Objects.requireNonNull(artifact, "artifact must not be null");
		if (maxLength <= 0) {
			throw new IllegalArgumentException("maxLength must be positive");
		}
		this.parser = new EarleyParser(artifact);
		this.declaredWords = artifact.declaredWords();
		this.maxLength = maxLength;
	}

	public ValidationResult validate(String candidate) {
		if (candidate == null) {
			return new ValidationResult.Reject(0, Set.of(), "<none>", "No candidate text");
		}
		if (candidate.length() > maxLength) {
			return new ValidationResult.Reject(maxLength, Set.of(), "<truncated>",
					"Candidate exceeds " + maxLength + " characters");
		}

		List<SqlToken> tokens = new SqlTokenizer(candidate).tokenize();
		List<SqlToken> input = tokens.subList(0, tokens.size() - 1);
		EarleyParser.Outcome outcome = parser.parse(input);
		if (outcome.succeeded()) {
			return new ValidationResult.Accept(new ParseTree(outcome.root(), candidate));
		}

		SqlToken offending = tokens.get(outcome.failedTokenIndex());
		return new ValidationResult.Reject(offending.position(), outcome.expected(), offending.text(),
				outcome.missingWhitespace() ? "Missing whitespace before '" + offending.value() + "'" : describe(offending));
	}

	public boolean accepts(String candidate) {
		return validate(candidate).accepted();
	}

	public GrammarArtifact artifact() {
		return artifact;
	}

	public int maxLength() {
		return maxLength;
	}

	private String describe(SqlToken token) {
		return switch (token.type()) {
			case EOF -> "Unexpected end of input";
			case INVALID -> "Unexpected character sequence '" + token.value() + "'";
			case WHITESPACE -> "Unexpected whitespace";
			case WORD -> declaredWords.contains(token.value())
					? "Unexpected token '" + token.value() + "'"
					: "Identifier '" + token.value() + "' is not declared in the grammar";
			default -> "Unexpected token " + token.text();
		};
	}
}
