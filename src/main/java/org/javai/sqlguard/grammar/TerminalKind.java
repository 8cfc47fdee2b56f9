package org.javai.sqlguard.grammar;

/**
 * Classification of terminals. Literal kinds match one exact token; {@link #NUMBER_PATTERN}
 * matches any number token satisfying a bounded regular expression; {@link #WHITESPACE}
 * matches one run of separator characters.
 */
public enum TerminalKind {

	KEYWORD,
	FUNCTION,
	OPERATOR,
	PUNCTUATION,
	TABLE,
	COLUMN,
	STRING_LITERAL,
	NUMBER_PATTERN,
	WHITESPACE;

	public boolean isWord() {
		return this == KEYWORD || this == FUNCTION || this == TABLE || this == COLUMN;
	}

	/**
	 * Whether tokens of this kind begin and end with identifier characters, so that two of them
	 * written back to back would lex as one token.
	 */
	public boolean isWordShaped() {
		return isWord() || this == NUMBER_PATTERN;
	}
}
