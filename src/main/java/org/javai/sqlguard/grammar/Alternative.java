package org.javai.sqlguard.grammar;

import java.util.List;
import java.util.Objects;

/**
 * One right-hand side of a production. An empty symbol list derives the empty string.
 */
public record Alternative(List<GrammarSymbol> symbols) {

	public Alternative {
		Objects.requireNonNull(symbols, "symbols must not be null");
		symbols = List.copyOf(symbols);
	}

	public static Alternative of(GrammarSymbol... symbols) {
		return new Alternative(List.of(symbols));
	}

	public static Alternative empty() {
		return new Alternative(List.of());
	}

	public boolean isEmpty() {
		return symbols.isEmpty();
	}

	public int size() {
		return symbols.size();
	}

	public GrammarSymbol symbolAt(int index) {
		return symbols.get(index);
	}
}
