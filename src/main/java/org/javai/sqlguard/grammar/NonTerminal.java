package org.javai.sqlguard.grammar;

import java.util.Objects;

/**
 * Reference to a production by name.
 */
public record NonTerminal(String name) implements GrammarSymbol {

	public NonTerminal {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public String toString() {
		return name;
	}
}
