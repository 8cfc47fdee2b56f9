package org.javai.sqlguard.grammar;

/**
 * A symbol on the right-hand side of a production.
 */
public sealed interface GrammarSymbol permits Terminal, NonTerminal {

	String name();

	default boolean isTerminal() {
		return this instanceof Terminal;
	}
}
