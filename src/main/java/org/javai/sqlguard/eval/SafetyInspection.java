package org.javai.sqlguard.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.javai.sqlguard.grammar.GrammarArtifact;
import org.javai.sqlguard.grammar.Terminal;
import org.javai.sqlguard.validate.ParseNode;
import org.javai.sqlguard.validate.ParseTree;

/**
 * Checks an accepted query's parse tree against the permitted language.
 */
final class SafetyInspection {

	private SafetyInspection() {
	}

	/**
	 * @return human-readable violations; empty when the tree is safe
	 */
	static List<String> violations(ParseTree tree, GrammarArtifact artifact) {
		List<String> violations = new ArrayList<>();
		String table = artifact.schema().table();
		for (String reference : tree.tableReferences()) {
			if (!reference.equals(table)) {
				violations.add("references table " + reference);
			}
		}
		if (tree.tableReferences().isEmpty()) {
			violations.add("references no table");
		}
		for (String keyword : new TreeSet<>(GrammarArtifact.EXCLUDED_KEYWORDS)) {
			if (tree.containsTerminal(keyword)) {
				violations.add("contains excluded keyword " + keyword);
			}
		}
		long terminators = tree.countTerminal(GrammarArtifact.STATEMENT_TERMINATOR);
		if (terminators != 1) {
			violations.add("has " + terminators + " statement terminators");
		}
		Set<Terminal> reachable = artifact.reachableTerminals();
		for (ParseNode leaf : tree.leaves()) {
			if (!reachable.contains(leaf.terminal())) {
				violations.add("uses unreachable terminal " + leaf.terminal().display());
			}
		}
		for (String column : tree.columnReferences()) {
			if (!artifact.schema().hasColumn(column)) {
				violations.add("references unregistered column " + column);
			}
		}
		return violations;
	}
}
