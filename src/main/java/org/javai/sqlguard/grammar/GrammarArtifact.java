package org.javai.sqlguard.grammar;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.javai.sqlguard.schema.SchemaRegistry;

/**
 * The immutable grammar of permitted queries.
 * <p>
 * One instance is handed both to the generation service (rendered as Lark) and to the
 * validator, so the two can never disagree about the rule set. Whitespace is part of that rule
 * set: separators are ordinary symbols of the productions, so the Lark text needs no ignored
 * terminals and the validator accepts exactly the strings the Lark text describes. Instances
 * are created through {@link #create(String, List, SchemaRegistry)}, which verifies the
 * structural guarantees before the artifact becomes visible.
 */
public final class GrammarArtifact {

	/**
	 * Words that no terminal may spell, in any letter case.
	 */
	public static final Set<String> EXCLUDED_KEYWORDS = Set.of(
			"DROP", "DELETE", "UPDATE", "INSERT", "ALTER", "ATTACH", "DETACH", "CREATE", "TRUNCATE",
			"RENAME", "GRANT", "REVOKE", "UNION", "INTO", "SYSTEM", "KILL", "OPTIMIZE", "EXEC", "EXECUTE");

	public static final String STATEMENT_TERMINATOR = ";";

	private final String startSymbol;
	private final Map<String, Production> productions;
	private final Set<Terminal> reachableTerminals;
	private final SchemaRegistry schema;
	private final String lark;
	private final String fingerprint;

	private GrammarArtifact(String startSymbol, Map<String, Production> productions, SchemaRegistry schema) {
		this.startSymbol = startSymbol;
		this.productions = Collections.unmodifiableMap(productions);
		this.schema = schema;
		this.reachableTerminals = Collections.unmodifiableSet(collectReachableTerminals());
		this.lark = new LarkGrammarWriter().write(this);
		this.fingerprint = sha256(lark);
	}

	/**
	 * Assemble and verify an artifact.
	 *
	 * @throws GrammarConstructionException if the productions break any structural guarantee
	 */
	public static GrammarArtifact create(String startSymbol, List<Production> productions, SchemaRegistry schema) {
		Objects.requireNonNull(startSymbol, "startSymbol must not be null");
		Objects.requireNonNull(productions, "productions must not be null");
		Objects.requireNonNull(schema, "schema must not be null");

		Map<String, Production> byName = new LinkedHashMap<>();
		for (Production production : productions) {
			if (byName.putIfAbsent(production.name(), production) != null) {
				throw new GrammarConstructionException("Duplicate production: " + production.name());
			}
		}
		if (!byName.containsKey(startSymbol)) {
			throw new GrammarConstructionException("Start symbol '" + startSymbol + "' has no production");
		}
		GrammarArtifact artifact = new GrammarArtifact(startSymbol, byName, schema);
		artifact.verify();
		return artifact;
	}

	/**
	 * Symbols whose names start with an underscore only lay out the text; like Lark, parse trees
	 * leave them out.
	 */
	public static boolean isHidden(String symbolName) {
		return symbolName.startsWith("_");
	}

	public String startSymbol() {
		return startSymbol;
	}

	public List<Production> productions() {
		return List.copyOf(productions.values());
	}

	public Optional<Production> production(String name) {
		return Optional.ofNullable(productions.get(name));
	}

	/**
	 * Every terminal that can appear in some sentence of the language.
	 */
	public Set<Terminal> reachableTerminals() {
		return reachableTerminals;
	}

	/**
	 * Exact texts of all reachable literal terminals.
	 */
	public Set<String> terminalLiterals() {
		Set<String> literals = new LinkedHashSet<>();
		for (Terminal terminal : reachableTerminals) {
			if (!terminal.isPattern()) {
				literals.add(terminal.literal());
			}
		}
		return literals;
	}

	/**
	 * Word-shaped vocabulary: keywords, functions, the table and the columns.
	 */
	public Set<String> declaredWords() {
		Set<String> words = new LinkedHashSet<>();
		for (Terminal terminal : reachableTerminals) {
			if (terminal.kind().isWord()) {
				words.add(terminal.literal());
			}
		}
		return words;
	}

	public SchemaRegistry schema() {
		return schema;
	}

	/**
	 * The grammar in Lark syntax, as consumed by constrained decoders.
	 */
	public String toLark() {
		return lark;
	}

	/**
	 * SHA-256 of the Lark rendering; identifies this exact rule set in logs and reports.
	 */
	public String fingerprint() {
		return fingerprint;
	}

	private Set<Terminal> collectReachableTerminals() {
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (String name : reachableProductions()) {
			Production production = productions.get(name);
			if (production == null) {
				continue;
			}
			for (Alternative alternative : production.alternatives()) {
				for (GrammarSymbol symbol : alternative.symbols()) {
					if (symbol instanceof Terminal terminal) {
						terminals.add(terminal);
					}
				}
			}
		}
		return terminals;
	}

	private Set<String> reachableProductions() {
		Set<String> seen = new LinkedHashSet<>();
		Deque<String> work = new ArrayDeque<>();
		work.add(startSymbol);
		while (!work.isEmpty()) {
			String name = work.poll();
			if (!seen.add(name)) {
				continue;
			}
			Production production = productions.get(name);
			if (production == null) {
				continue;
			}
			for (Alternative alternative : production.alternatives()) {
				for (GrammarSymbol symbol : alternative.symbols()) {
					if (symbol instanceof NonTerminal nonTerminal) {
						work.add(nonTerminal.name());
					}
				}
			}
		}
		return seen;
	}

	private void verify() {
		for (Production production : productions.values()) {
			for (Alternative alternative : production.alternatives()) {
				for (GrammarSymbol symbol : alternative.symbols()) {
					if (symbol instanceof NonTerminal ref && !productions.containsKey(ref.name())) {
						throw new GrammarConstructionException(
								"Production '" + production.name() + "' references undefined symbol '" + ref.name() + "'");
					}
				}
			}
		}

		Set<String> reachable = reachableProductions();
		for (String name : productions.keySet()) {
			if (!reachable.contains(name)) {
				throw new GrammarConstructionException("Production '" + name + "' is unreachable from " + startSymbol);
			}
		}

		long tables = reachableTerminals.stream().filter(t -> t.kind() == TerminalKind.TABLE).count();
		if (tables != 1) {
			throw new GrammarConstructionException("Grammar must reach exactly one table terminal, found " + tables);
		}
		Terminal table = reachableTerminals.stream()
				.filter(t -> t.kind() == TerminalKind.TABLE)
				.findFirst()
				.orElseThrow();
		if (!table.literal().equals(schema.table())) {
			throw new GrammarConstructionException(
					"Table terminal '" + table.literal() + "' does not match registered table " + schema.table());
		}

		for (Terminal terminal : reachableTerminals) {
			if (terminal.kind() == TerminalKind.COLUMN && !schema.hasColumn(terminal.literal())) {
				throw new GrammarConstructionException("Column terminal '" + terminal.literal() + "' is not registered");
			}
			if (!terminal.isPattern()) {
				String upper = terminal.literal().toUpperCase(Locale.ROOT);
				for (String word : upper.split("[^A-Z0-9_]+")) {
					if (EXCLUDED_KEYWORDS.contains(word)) {
						throw new GrammarConstructionException(
								"Terminal " + terminal.display() + " spells excluded keyword " + word);
					}
				}
			}
		}

		verifySingleTerminator();
		verifySeparation();
	}

	private void verifySingleTerminator() {
		int occurrences = 0;
		boolean atEndOfStart = false;
		for (Production production : productions.values()) {
			for (Alternative alternative : production.alternatives()) {
				for (int i = 0; i < alternative.size(); i++) {
					if (alternative.symbolAt(i) instanceof Terminal t && STATEMENT_TERMINATOR.equals(t.literal())) {
						occurrences++;
						atEndOfStart = production.name().equals(startSymbol) && onlyHiddenAfter(alternative, i);
					}
				}
			}
		}
		if (occurrences != 1 || !atEndOfStart) {
			throw new GrammarConstructionException(
					"Statement terminator must appear exactly once, at the end of " + startSymbol);
		}
	}

	private static boolean onlyHiddenAfter(Alternative alternative, int index) {
		for (int i = index + 1; i < alternative.size(); i++) {
			if (!isHidden(alternative.symbolAt(i).name())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Two word-shaped tokens written back to back lex as one word, while a Lark decoder would
	 * read them as two. Every place where such tokens can meet must therefore require whitespace.
	 * Two whitespace runs may not meet either, since the tokenizer reads them as one.
	 */
	private void verifySeparation() {
		checkAdjacent(t -> t.kind().isWordShaped(), "may meet without whitespace");
		checkAdjacent(Terminal::isWhitespace, "may place whitespace next to whitespace");
	}

	private void checkAdjacent(Predicate<Terminal> edge, String problem) {
		Set<String> nullable = new HashSet<>();
		Set<String> startsWith = new HashSet<>();
		Set<String> endsWith = new HashSet<>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Production production : productions.values()) {
				String name = production.name();
				for (Alternative alternative : production.alternatives()) {
					List<GrammarSymbol> symbols = alternative.symbols();
					if (!nullable.contains(name) && symbols.stream().allMatch(s -> isNullable(s, nullable))) {
						changed |= nullable.add(name);
					}
					if (!startsWith.contains(name) && edgeMatches(symbols, edge, nullable, startsWith)) {
						changed |= startsWith.add(name);
					}
					if (!endsWith.contains(name) && edgeMatches(reversed(symbols), edge, nullable, endsWith)) {
						changed |= endsWith.add(name);
					}
				}
			}
		}

		for (Production production : productions.values()) {
			for (Alternative alternative : production.alternatives()) {
				for (int i = 0; i < alternative.size(); i++) {
					GrammarSymbol left = alternative.symbolAt(i);
					if (!isEdge(left, edge, endsWith)) {
						continue;
					}
					for (int j = i + 1; j < alternative.size(); j++) {
						GrammarSymbol right = alternative.symbolAt(j);
						if (isEdge(right, edge, startsWith)) {
							throw new GrammarConstructionException("Symbols " + left.name() + " and " + right.name()
									+ " " + problem + " in production '" + production.name() + "'");
						}
						if (!isNullable(right, nullable)) {
							break;
						}
					}
				}
			}
		}
	}

	private static boolean isNullable(GrammarSymbol symbol, Set<String> nullable) {
		return symbol instanceof NonTerminal && nullable.contains(symbol.name());
	}

	private static boolean isEdge(GrammarSymbol symbol, Predicate<Terminal> edge, Set<String> edged) {
		if (symbol instanceof Terminal terminal) {
			return edge.test(terminal);
		}
		return edged.contains(symbol.name());
	}

	private static boolean edgeMatches(List<GrammarSymbol> symbols, Predicate<Terminal> edge, Set<String> nullable,
			Set<String> edged) {
		for (GrammarSymbol symbol : symbols) {
			if (isEdge(symbol, edge, edged)) {
				return true;
			}
			if (!isNullable(symbol, nullable)) {
				return false;
			}
		}
		return false;
	}

	private static List<GrammarSymbol> reversed(List<GrammarSymbol> symbols) {
		List<GrammarSymbol> copy = new ArrayList<>(symbols);
		Collections.reverse(copy);
		return copy;
	}

	private static String sha256(String text) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	@Override
	public String toString() {
		return "GrammarArtifact[start=" + startSymbol + ", productions=" + productions.size()
				+ ", fingerprint=" + fingerprint.substring(0, 12) + "]";
	}
}
