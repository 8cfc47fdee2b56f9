package org.javai.sqlguard.grammar;

/**
 * A lexical token of a candidate query.
 *
 * @param type the token type
 * @param value the token text; for strings the content between the quotes
 * @param position the character offset in the input string
 */
public record SqlToken(TokenType type, String value, int position) {

	public enum TokenType {
		WORD,          // keywords, function names, identifiers
		STRING,        // 'quoted strings'
		NUMBER,        // unsigned integers and decimals
		OPERATOR,      // = != <> < <= > >=
		PUNCTUATION,   // ( ) , * ;
		WHITESPACE,    // a run of spaces, tabs and line breaks
		INVALID,       // anything the lexical grammar does not know
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING('" + value + "')";
			case EOF -> "EOF";
			default -> type + "(" + value + ")";
		};
	}

	/**
	 * The token as it appears in the source text.
	 */
	public String text() {
		return switch (type) {
			case STRING -> "'" + value + "'";
			case EOF -> "<end of input>";
			case WHITESPACE -> "<whitespace>";
			default -> value;
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
