package org.javai.sqlguard.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.sqlguard.grammar.GrammarSymbol;
import org.javai.sqlguard.grammar.NonTerminal;
import org.javai.sqlguard.grammar.SqlToken;
import org.javai.sqlguard.grammar.Terminal;

/**
 * A node of a derivation.
 * <p>
 * Leaves pair a {@link Terminal} with the token it matched; inner nodes name the production
 * and the alternative used.
 *
 * @param symbol the grammar symbol this node derives
 * @param alternative index of the production alternative used; -1 for leaves
 * @param children child nodes in source order
 * @param token the matched token for leaves, {@code null} otherwise
 */
public record ParseNode(GrammarSymbol symbol, int alternative, List<ParseNode> children, SqlToken token) {

	public ParseNode {
		Objects.requireNonNull(symbol, "symbol must not be null");
		children = children != null ? List.copyOf(children) : List.of();
	}

	public static ParseNode leaf(Terminal terminal, SqlToken token) {
		return new ParseNode(terminal, -1, List.of(), token);
	}

	public static ParseNode branch(NonTerminal symbol, int alternative, List<ParseNode> children) {
		return new ParseNode(symbol, alternative, children, null);
	}

	public boolean isLeaf() {
		return symbol instanceof Terminal;
	}

	public Terminal terminal() {
		return isLeaf() ? (Terminal) symbol : null;
	}

	public String name() {
		return symbol.name();
	}

	/**
	 * Leaves of this subtree in source order.
	 */
	public List<ParseNode> leaves() {
		if (isLeaf()) {
			return List.of(this);
		}
		List<ParseNode> leaves = new ArrayList<>();
		for (ParseNode child : children) {
			leaves.addAll(child.leaves());
		}
		return leaves;
	}

	/**
	 * Source text of this subtree, tokens separated by single spaces.
	 */
	public String text() {
		if (isLeaf()) {
			return token.text();
		}
		StringBuilder sb = new StringBuilder();
		for (ParseNode child : children) {
			String childText = child.text();
			if (childText.isEmpty()) {
				continue;
			}
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append(childText);
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return isLeaf() ? symbol.name() + "=" + token.text() : symbol.name() + children;
	}
}
