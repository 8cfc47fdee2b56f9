package org.javai.sqlguard.validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.javai.sqlguard.grammar.Terminal;
import org.javai.sqlguard.grammar.TerminalKind;

/**
 * The derivation of an accepted query.
 * <p>
 * Safety checks inspect the tree rather than the raw text: what a query references is
 * exactly what its terminal leaves say.
 */
public final class ParseTree {

	private final ParseNode root;
	private final String source;

	public ParseTree(ParseNode root, String source) {
		this.root = Objects.requireNonNull(root, "root must not be null");
		this.source = source != null ? source : "";
	}

	public ParseNode root() {
		return root;
	}

	/**
	 * The candidate text this tree was parsed from.
	 */
	public String source() {
		return source;
	}

	/**
	 * Leaves in source order.
	 */
	public List<ParseNode> leaves() {
		List<ParseNode> leaves = new ArrayList<>();
		walk(node -> {
			if (node.isLeaf()) {
				leaves.add(node);
			}
		});
		return leaves;
	}

	public List<Terminal> terminals() {
		return leaves().stream().map(ParseNode::terminal).toList();
	}

	/**
	 * Names of the productions used, in pre-order.
	 */
	public List<String> productions() {
		List<String> names = new ArrayList<>();
		walk(node -> {
			if (!node.isLeaf()) {
				names.add(node.name());
			}
		});
		return names;
	}

	/**
	 * All inner nodes derived from the named production, in pre-order.
	 */
	public List<ParseNode> nodes(String productionName) {
		List<ParseNode> found = new ArrayList<>();
		walk(node -> {
			if (!node.isLeaf() && node.name().equals(productionName)) {
				found.add(node);
			}
		});
		return found;
	}

	public List<String> tableReferences() {
		return literalsOfKind(TerminalKind.TABLE);
	}

	public Set<String> columnReferences() {
		return new LinkedHashSet<>(literalsOfKind(TerminalKind.COLUMN));
	}

	/**
	 * Whether any leaf token spells the given word, ignoring case.
	 */
	public boolean containsTerminal(String text) {
		String wanted = text.toUpperCase(Locale.ROOT);
		return leaves().stream().anyMatch(leaf -> leaf.token().value().toUpperCase(Locale.ROOT).equals(wanted));
	}

	public long countTerminal(String literal) {
		return leaves().stream().filter(leaf -> literal.equals(leaf.terminal().literal())).count();
	}

	/**
	 * Normalized text: tokens of the derivation separated by single spaces.
	 */
	public String text() {
		return root.text();
	}

	private List<String> literalsOfKind(TerminalKind kind) {
		return leaves().stream()
				.map(ParseNode::terminal)
				.filter(t -> t.kind() == kind)
				.map(Terminal::literal)
				.toList();
	}

	private void walk(Consumer<ParseNode> visitor) {
		Deque<ParseNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			ParseNode node = stack.pop();
			visitor.accept(node);
			List<ParseNode> children = node.children();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
	}

	@Override
	public String toString() {
		return "ParseTree[" + text() + "]";
	}
}
