package org.javai.sqlguard.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for candidate queries.
 * <p>
 * Total: never throws on any input. Characters outside the lexical grammar become
 * {@link SqlToken.TokenType#INVALID} tokens so the parser can report them with a position.
 * Whitespace runs are tokens too: the grammar decides where a separator is required, allowed
 * or forbidden. Only the characters of {@link Terminal#WHITESPACE_PATTERN} separate tokens.
 */
public class SqlTokenizer {

	private final String input;
	private int pos = 0;

	public SqlTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens, terminated by an EOF token
	 */
	public List<SqlToken> tokenize() {
		List<SqlToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			tokens.add(isWhitespace(peek()) ? scanWhitespace() : nextToken());
		}

		tokens.add(new SqlToken(SqlToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private SqlToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(', ')', ',', '*', ';' -> {
				advance();
				yield new SqlToken(SqlToken.TokenType.PUNCTUATION, String.valueOf(c), start);
			}
			case '=' -> {
				advance();
				yield new SqlToken(SqlToken.TokenType.OPERATOR, "=", start);
			}
			case '<', '>', '!' -> scanOperator();
			case '\'' -> scanString();
			default -> {
				if (isDigit(c)) {
					yield scanNumber();
				}
				else if (isIdentifierStart(c)) {
					yield scanWord();
				}
				else {
					yield scanInvalid();
				}
			}
		};
	}

	private SqlToken scanOperator() {
		int start = pos;
		char first = advance();
		if (!isAtEnd() && (peek() == '=' || (first == '<' && peek() == '>'))) {
			advance();
		}
		String value = input.substring(start, pos);
		if (value.equals("!")) {
			return new SqlToken(SqlToken.TokenType.INVALID, value, start);
		}
		return new SqlToken(SqlToken.TokenType.OPERATOR, value, start);
	}

	private SqlToken scanString() {
		int start = pos;
		advance(); // opening quote

		while (!isAtEnd() && peek() != '\'') {
			advance();
		}

		if (isAtEnd()) {
			return new SqlToken(SqlToken.TokenType.INVALID, input.substring(start, pos), start);
		}

		advance(); // closing quote
		return new SqlToken(SqlToken.TokenType.STRING, input.substring(start + 1, pos - 1), start);
	}

	private SqlToken scanNumber() {
		int start = pos;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
			advance(); // '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		return new SqlToken(SqlToken.TokenType.NUMBER, input.substring(start, pos), start);
	}

	private SqlToken scanWord() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		return new SqlToken(SqlToken.TokenType.WORD, input.substring(start, pos), start);
	}

	// Comment openers, quoted identifiers, dots and the like: consumed up to the next boundary.
	private SqlToken scanInvalid() {
		int start = pos;
		advance();
		while (!isAtEnd() && !isWhitespace(peek()) && !startsValidToken(peek())) {
			advance();
		}
		return new SqlToken(SqlToken.TokenType.INVALID, input.substring(start, pos), start);
	}

	private boolean startsValidToken(char c) {
		return isIdentifierStart(c) || isDigit(c) || "(),*;=<>'".indexOf(c) >= 0;
	}

	private SqlToken scanWhitespace() {
		int start = pos;
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
		return new SqlToken(SqlToken.TokenType.WHITESPACE, input.substring(start, pos), start);
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
