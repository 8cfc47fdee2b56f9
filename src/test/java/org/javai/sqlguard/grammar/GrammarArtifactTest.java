package org.javai.sqlguard.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.sqlguard.schema.SchemaColumn;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Grammar artifact structural checks")
class GrammarArtifactTest {

	private static final SchemaRegistry SCHEMA = new SchemaRegistry("Ledger", "",
			List.of(SchemaColumn.numeric("balance", "", null)));

	private static final Terminal SEMI = Terminal.punctuation(";");
	private static final Terminal WS = Terminal.whitespace();

	private static Alternative countAll(GrammarSymbol... tail) {
		List<GrammarSymbol> symbols = new java.util.ArrayList<>(List.of(
				Terminal.keyword("SELECT"), WS, Terminal.function("count"), Terminal.punctuation("("),
				Terminal.punctuation("*"), Terminal.punctuation(")"), WS, Terminal.keyword("FROM"), WS));
		symbols.addAll(List.of(tail));
		return new Alternative(symbols);
	}

	@Test
	void acceptsWellFormedGrammar() {
		GrammarArtifact artifact = GrammarArtifact.create("start",
				List.of(new Production("start", List.of(countAll(Terminal.table("Ledger"), SEMI)))), SCHEMA);

		assertThat(artifact.terminalLiterals()).contains("SELECT", "Ledger", ";");
		assertThat(artifact.toString()).startsWith("GrammarArtifact[start=start, productions=1");
	}

	@Test
	void rejectsUndefinedReference() {
		List<Production> productions = List.of(
				new Production("start", List.of(countAll(new NonTerminal("table_ref"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("undefined symbol 'table_ref'");
	}

	@Test
	void rejectsUnreachableProduction() {
		List<Production> productions = List.of(
				new Production("start", List.of(countAll(Terminal.table("Ledger"), SEMI))),
				new Production("orphan", List.of(Alternative.of(Terminal.keyword("LIMIT")))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("'orphan' is unreachable");
	}

	@Test
	void rejectsExcludedKeywordTerminal() {
		List<Production> productions = List.of(new Production("start", List.of(
				countAll(Terminal.table("Ledger"), SEMI),
				Alternative.of(Terminal.keyword("DELETE"), Terminal.keyword("FROM"), Terminal.table("Ledger"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("excluded keyword DELETE");
	}

	@Test
	void rejectsExcludedKeywordInAnyCase() {
		List<Production> productions = List.of(new Production("start", List.of(
				countAll(Terminal.table("Ledger"), Terminal.keyword("union"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("UNION");
	}

	@Test
	void rejectsMisplacedTerminator() {
		List<Production> productions = List.of(new Production("start", List.of(
				new Alternative(List.of(Terminal.keyword("SELECT"), SEMI, Terminal.keyword("FROM"),
						Terminal.table("Ledger"))))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("Statement terminator");
	}

	@Test
	void rejectsSecondTerminator() {
		List<Production> productions = List.of(new Production("start", List.of(
				countAll(Terminal.table("Ledger"), SEMI, SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("exactly once");
	}

	@Test
	void rejectsForeignTable() {
		List<Production> productions = List.of(
				new Production("start", List.of(countAll(Terminal.table("Accounts"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("does not match registered table Ledger");
	}

	@Test
	void rejectsSecondTable() {
		List<Production> productions = List.of(new Production("start", List.of(
				countAll(Terminal.table("Ledger"), SEMI),
				countAll(Terminal.table("Accounts"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("exactly one table terminal, found 2");
	}

	@Test
	void rejectsUnregisteredColumn() {
		List<Production> productions = List.of(new Production("start", List.of(
				Alternative.of(Terminal.keyword("SELECT"), Terminal.column("owner"), Terminal.keyword("FROM"),
						Terminal.table("Ledger"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("'owner' is not registered");
	}

	@Test
	void rejectsDuplicateProduction() {
		Production start = new Production("start", List.of(countAll(Terminal.table("Ledger"), SEMI)));

		assertThatThrownBy(() -> GrammarArtifact.create("start", List.of(start, start), SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("Duplicate production");
	}

	@Test
	void rejectsMissingStartSymbol() {
		Production other = new Production("query", List.of(countAll(Terminal.table("Ledger"), SEMI)));

		assertThatThrownBy(() -> GrammarArtifact.create("start", List.of(other), SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("has no production");
	}

	@Test
	void rejectsAdjacentWords() {
		List<Production> productions = List.of(new Production("start", List.of(
				Alternative.of(Terminal.keyword("SELECT"), WS, Terminal.function("count"), Terminal.punctuation("("),
						Terminal.punctuation("*"), Terminal.punctuation(")"), WS, Terminal.keyword("FROM"),
						Terminal.table("Ledger"), SEMI))));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("Symbols FROM and Ledger may meet without whitespace in production 'start'");
	}

	@Test
	void rejectsWordsSeparatedOnlyByOptionalSpace() {
		List<Production> productions = List.of(
				new Production("start", List.of(countAll(Terminal.table("Ledger"), new NonTerminal("limit_opt"), SEMI))),
				new Production("limit_opt", List.of(
						Alternative.of(new NonTerminal("_ws"), Terminal.keyword("LIMIT"), WS,
								Terminal.numberPattern("LIMIT_NUM", "[1-9]")),
						Alternative.empty())),
				new Production("_ws", List.of(Alternative.of(WS), Alternative.empty())));

		assertThatThrownBy(() -> GrammarArtifact.create("start", productions, SCHEMA))
				.isInstanceOf(GrammarConstructionException.class)
				.hasMessageContaining("Symbols Ledger and limit_opt may meet without whitespace");
	}

	@Test
	void acceptsWordBeforePunctuationWithoutSpace() {
		GrammarArtifact artifact = GrammarArtifact.create("start", List.of(
				new Production("start", List.of(countAll(Terminal.table("Ledger"), SEMI)))), SCHEMA);

		assertThat(artifact.reachableTerminals()).contains(WS);
		assertThat(artifact.terminalLiterals()).doesNotContainNull();
	}

	@Test
	void underscoreNamesAreHidden() {
		assertThat(GrammarArtifact.isHidden("_ws")).isTrue();
		assertThat(GrammarArtifact.isHidden("_WS")).isTrue();
		assertThat(GrammarArtifact.isHidden("select_stmt")).isFalse();
	}

	@Test
	void productionNeedsAlternatives() {
		assertThatThrownBy(() -> new Production("empty", List.of()))
				.isInstanceOf(GrammarConstructionException.class);
	}
}
