package org.javai.sqlguard.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.javai.sqlguard.grammar.Alternative;
import org.javai.sqlguard.grammar.GrammarArtifact;
import org.javai.sqlguard.grammar.GrammarSymbol;
import org.javai.sqlguard.grammar.NonTerminal;
import org.javai.sqlguard.grammar.Production;
import org.javai.sqlguard.grammar.SqlToken;
import org.javai.sqlguard.grammar.Terminal;

/**
 * Earley chart parser over a {@link GrammarArtifact}.
 * <p>
 * Nullable non-terminals are advanced over at prediction time (Aycock and Horspool), so
 * empty alternatives need no special completion pass. Each chart set holds at most one item
 * per (rule, dot, origin); the first derivation to reach an item is the one kept, which
 * bounds the work at O(n^3) for any grammar and input. Hidden symbols (see
 * {@link GrammarArtifact#isHidden(String)}) are matched like any other but leave no node behind.
 */
final class EarleyParser {

	private final String startSymbol;
	private final List<Rule> rules = new ArrayList<>();
	private final Map<String, List<Rule>> rulesByName = new HashMap<>();
	private final Map<String, Integer> nullableWitness = new HashMap<>();
	private final Map<String, ParseNode> emptyDerivations = new HashMap<>();

	EarleyParser(GrammarArtifact artifact) {
		this.startSymbol = artifact.startSymbol();
		for (Production production : artifact.productions()) {
			List<Alternative> alternatives = production.alternatives();
			for (int i = 0; i < alternatives.size(); i++) {
				Rule rule = new Rule(rules.size(), production.name(), i, alternatives.get(i).symbols());
				rules.add(rule);
				rulesByName.computeIfAbsent(production.name(), k -> new ArrayList<>()).add(rule);
			}
		}
		computeNullable();
	}

	/**
	 * Outcome of a parse: either a root node, or the index of the token where no item could advance
	 * together with what was expected there.
	 */
	record Outcome(ParseNode root, int failedTokenIndex, Set<String> expected, boolean missingWhitespace) {

		boolean succeeded() {
			return root != null;
		}
	}

	Outcome parse(List<SqlToken> tokens) {
		int n = tokens.size();
		List<ChartSet> chart = new ArrayList<>(n + 1);
		ChartSet first = new ChartSet();
		chart.add(first);
		for (Rule rule : rulesByName.getOrDefault(startSymbol, List.of())) {
			first.add(new Item(rule, 0, 0, null, null));
		}

		for (int k = 0; k <= n; k++) {
			ChartSet current = chart.get(k);
			ChartSet next = new ChartSet();
			SqlToken token = k < n ? tokens.get(k) : null;

			for (int i = 0; i < current.items.size(); i++) {
				Item item = current.items.get(i);
				if (item.isComplete()) {
					complete(item, chart, current);
					continue;
				}
				GrammarSymbol symbol = item.nextSymbol();
				if (symbol instanceof NonTerminal nonTerminal) {
					predict(item, nonTerminal, k, current);
				}
				else if (token != null && ((Terminal) symbol).matches(token)) {
					Terminal terminal = (Terminal) symbol;
					next.add(item.advance(GrammarArtifact.isHidden(terminal.name()) ? null : ParseNode.leaf(terminal, token)));
				}
			}

			if (k == n) {
				break;
			}
			if (next.items.isEmpty()) {
				return new Outcome(null, k, expectedTerminals(current), missingWhitespace(current, token));
			}
			chart.add(next);
		}

		for (Item item : chart.get(n).items) {
			if (item.origin == 0 && item.isComplete() && item.rule.name.equals(startSymbol)) {
				return new Outcome(item.buildNode(), -1, Set.of(), false);
			}
		}
		return new Outcome(null, n, expectedTerminals(chart.get(n)), false);
	}

	private void predict(Item item, NonTerminal symbol, int position, ChartSet current) {
		for (Rule rule : rulesByName.getOrDefault(symbol.name(), List.of())) {
			current.add(new Item(rule, 0, position, null, null));
		}
		if (nullableWitness.containsKey(symbol.name())) {
			current.add(item.advance(GrammarArtifact.isHidden(symbol.name()) ? null : emptyDerivation(symbol.name())));
		}
	}

	private void complete(Item completed, List<ChartSet> chart, ChartSet current) {
		ChartSet originSet = chart.get(completed.origin);
		List<Item> waiting = originSet.waitingOn(completed.rule.name);
		boolean hidden = GrammarArtifact.isHidden(completed.rule.name);
		ParseNode node = null;
		for (int j = 0; j < waiting.size(); j++) {
			if (node == null && !hidden) {
				node = completed.buildNode();
			}
			current.add(waiting.get(j).advance(node));
		}
	}

	// A required separator is reported as the terminal behind it when there is one.
	private Set<String> expectedTerminals(ChartSet set) {
		Set<String> expected = new TreeSet<>();
		for (Item item : set.items) {
			if (item.isComplete() || GrammarArtifact.isHidden(item.rule.name)
					|| !(item.nextSymbol() instanceof Terminal terminal)) {
				continue;
			}
			if (terminal.isWhitespace() && item.symbolAfterNext() instanceof Terminal following) {
				expected.add(following.display());
			}
			else {
				expected.add(terminal.display());
			}
		}
		return expected;
	}

	private boolean missingWhitespace(ChartSet set, SqlToken token) {
		for (Item item : set.items) {
			if (!item.isComplete() && item.nextSymbol() instanceof Terminal terminal && terminal.isWhitespace()
					&& item.symbolAfterNext() instanceof Terminal following && following.matches(token)) {
				return true;
			}
		}
		return false;
	}

	// Fixed point; each nullable production remembers the first alternative that proved it nullable.
	private void computeNullable() {
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Rule rule : rules) {
				if (nullableWitness.containsKey(rule.name)) {
					continue;
				}
				boolean allNullable = true;
				for (GrammarSymbol symbol : rule.symbols) {
					if (!(symbol instanceof NonTerminal nt) || !nullableWitness.containsKey(nt.name())) {
						allNullable = false;
						break;
					}
				}
				if (allNullable) {
					nullableWitness.put(rule.name, rule.alternative);
					changed = true;
				}
			}
		}
		for (String name : nullableWitness.keySet()) {
			emptyDerivation(name);
		}
	}

	private ParseNode emptyDerivation(String name) {
		ParseNode cached = emptyDerivations.get(name);
		if (cached != null) {
			return cached;
		}
		int alternative = nullableWitness.get(name);
		Rule witness = rulesByName.get(name).get(alternative);
		List<ParseNode> children = new ArrayList<>();
		for (GrammarSymbol symbol : witness.symbols) {
			if (!GrammarArtifact.isHidden(symbol.name())) {
				children.add(emptyDerivation(symbol.name()));
			}
		}
		ParseNode node = ParseNode.branch(new NonTerminal(name), alternative, children);
		emptyDerivations.put(name, node);
		return node;
	}

	private record Rule(int index, String name, int alternative, List<GrammarSymbol> symbols) {
	}

	private record ItemKey(int rule, int dot, int origin) {
	}

	private static final class Item {

		final Rule rule;
		final int dot;
		final int origin;
		final Item previous;
		final ParseNode child;

		Item(Rule rule, int dot, int origin, Item previous, ParseNode child) {
			this.rule = rule;
			this.dot = dot;
			this.origin = origin;
			this.previous = previous;
			this.child = child;
		}

		boolean isComplete() {
			return dot == rule.symbols.size();
		}

		GrammarSymbol nextSymbol() {
			return rule.symbols.get(dot);
		}

		GrammarSymbol symbolAfterNext() {
			return dot + 1 < rule.symbols.size() ? rule.symbols.get(dot + 1) : null;
		}

		Item advance(ParseNode node) {
			return new Item(rule, dot + 1, origin, this, node);
		}

		ItemKey key() {
			return new ItemKey(rule.index, dot, origin);
		}

		ParseNode buildNode() {
			List<ParseNode> children = new ArrayList<>(dot);
			for (Item item = this; item.previous != null; item = item.previous) {
				if (item.child != null) {
					children.add(item.child);
				}
			}
			Collections.reverse(children);
			return ParseNode.branch(new NonTerminal(rule.name), rule.alternative, children);
		}
	}

	private static final class ChartSet {

		final List<Item> items = new ArrayList<>();
		final Set<ItemKey> keys = new HashSet<>();
		final Map<String, List<Item>> waiting = new LinkedHashMap<>();

		void add(Item item) {
			if (!keys.add(item.key())) {
				return;
			}
			items.add(item);
			if (!item.isComplete() && item.nextSymbol() instanceof NonTerminal nt) {
				waiting.computeIfAbsent(nt.name(), k -> new ArrayList<>()).add(item);
			}
		}

		List<Item> waitingOn(String name) {
			return waiting.getOrDefault(name, List.of());
		}
	}
}
