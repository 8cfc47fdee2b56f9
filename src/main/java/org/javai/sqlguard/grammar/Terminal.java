package org.javai.sqlguard.grammar;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A leaf token of the grammar.
 * <p>
 * Literal terminals match exactly one token text, case-sensitively. Pattern terminals
 * match number tokens whose whole text satisfies the pattern. The whitespace terminal matches
 * a separator run; it is hidden from parse trees, following the Lark convention for names that
 * start with an underscore.
 */
public final class Terminal implements GrammarSymbol {

	/**
	 * Characters that separate tokens, identical on the Lark and the tokenizer side.
	 */
	public static final String WHITESPACE_PATTERN = "[ \\t\\r\\n]+";

	private final String name;
	private final TerminalKind kind;
	private final String literal;
	private final Pattern pattern;

	private Terminal(String name, TerminalKind kind, String literal, Pattern pattern) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.literal = literal;
		this.pattern = pattern;
	}

	public static Terminal keyword(String word) {
		return new Terminal(word, TerminalKind.KEYWORD, word, null);
	}

	public static Terminal function(String word) {
		return new Terminal(word, TerminalKind.FUNCTION, word, null);
	}

	public static Terminal operator(String symbol) {
		return new Terminal(symbol, TerminalKind.OPERATOR, symbol, null);
	}

	public static Terminal punctuation(String symbol) {
		return new Terminal(symbol, TerminalKind.PUNCTUATION, symbol, null);
	}

	public static Terminal table(String tableName) {
		return new Terminal(tableName, TerminalKind.TABLE, tableName, null);
	}

	public static Terminal column(String columnName) {
		return new Terminal(columnName, TerminalKind.COLUMN, columnName, null);
	}

	public static Terminal stringLiteral(String value) {
		return new Terminal("'" + value + "'", TerminalKind.STRING_LITERAL, value, null);
	}

	public static Terminal numberPattern(String name, String regex) {
		Objects.requireNonNull(regex, "regex must not be null");
		return new Terminal(name, TerminalKind.NUMBER_PATTERN, null, Pattern.compile(regex));
	}

	public static Terminal whitespace() {
		return new Terminal("_WS", TerminalKind.WHITESPACE, null, Pattern.compile(WHITESPACE_PATTERN));
	}

	@Override
	public String name() {
		return name;
	}

	public TerminalKind kind() {
		return kind;
	}

	/**
	 * The exact token text for literal terminals; {@code null} for pattern and whitespace terminals.
	 */
	public String literal() {
		return literal;
	}

	public String regex() {
		return pattern != null ? pattern.pattern() : null;
	}

	public boolean isPattern() {
		return pattern != null;
	}

	public boolean isWhitespace() {
		return kind == TerminalKind.WHITESPACE;
	}

	public boolean matches(SqlToken token) {
		return switch (kind) {
			case KEYWORD, FUNCTION, TABLE, COLUMN -> token.isType(SqlToken.TokenType.WORD) && literal.equals(token.value());
			case OPERATOR -> token.isType(SqlToken.TokenType.OPERATOR) && literal.equals(token.value());
			case PUNCTUATION -> token.isType(SqlToken.TokenType.PUNCTUATION) && literal.equals(token.value());
			case STRING_LITERAL -> token.isType(SqlToken.TokenType.STRING) && literal.equals(token.value());
			case NUMBER_PATTERN -> token.isType(SqlToken.TokenType.NUMBER) && pattern.matcher(token.value()).matches();
			case WHITESPACE -> token.isType(SqlToken.TokenType.WHITESPACE);
		};
	}

	/**
	 * How the terminal is shown in diagnostics and expected-token sets.
	 */
	public String display() {
		return switch (kind) {
			case STRING_LITERAL -> "'" + literal + "'";
			case WHITESPACE -> "whitespace";
			default -> name;
		};
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Terminal other)) return false;
		return name.equals(other.name) && kind == other.kind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind);
	}

	@Override
	public String toString() {
		return kind + "(" + display() + ")";
	}
}
