package org.javai.sqlguard.grammar;

import java.util.List;
import java.util.Objects;

/**
 * A named non-terminal and its ordered alternatives.
 */
public record Production(String name, List<Alternative> alternatives) {

	public Production {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(alternatives, "alternatives must not be null");
		if (alternatives.isEmpty()) {
			throw new GrammarConstructionException("Production '" + name + "' has no alternatives");
		}
		alternatives = List.copyOf(alternatives);
	}

	public NonTerminal symbol() {
		return new NonTerminal(name);
	}

	public boolean hasEmptyAlternative() {
		return alternatives.stream().anyMatch(Alternative::isEmpty);
	}
}
