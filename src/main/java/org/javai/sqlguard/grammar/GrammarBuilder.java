package org.javai.sqlguard.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.sqlguard.schema.SchemaColumn;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the query grammar from a {@link SchemaRegistry}.
 * <p>
 * The language is a single aggregate-oriented SELECT over the registered table:
 * <pre>
 * start        : _ws select_stmt _ws ";" _ws
 * select_stmt  : "SELECT" _WS select_list _WS "FROM" _WS table_ref where_opt group_by_opt order_by_opt limit_opt
 * select_item  : agg_func | groupable_col
 * agg_func     : "count" _ws "(" _ws "*" _ws ")" | agg_name _ws "(" _ws agg_col _ws ")"
 * where_opt    : _WS "WHERE" _WS condition (_WS "AND" _WS condition)* | (empty)
 * group_by_opt : _WS "GROUP" _WS "BY" _WS groupable_col (_ws "," _ws groupable_col)* | (empty)
 * order_by_opt : _WS "ORDER" _WS "BY" _WS order_item (_ws "," _ws order_item)* | (empty)
 * limit_opt    : _WS "LIMIT" _WS LIMIT_NUM | (empty)
 * </pre>
 * Conditions are generated per filterable column: numeric columns accept comparisons and
 * BETWEEN, categorical columns accept =, != and IN over their declared values, boolean
 * columns accept = and != over their literal pattern.
 * <p>
 * Layout is explicit. {@code _WS} requires a whitespace run next to keywords, except before an
 * opening parenthesis; {@code _ws} allows one around punctuation and operators. Nowhere else may
 * whitespace appear, and two word-shaped tokens are never adjacent without {@code _WS}.
 */
public class GrammarBuilder {

	private static final Logger logger = LoggerFactory.getLogger(GrammarBuilder.class);

	public static final String START = "start";
	public static final String LIMIT_PATTERN = "[1-9][0-9]{0,3}";
	public static final String OPTIONAL_SPACE = "_ws";

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	private static final Pattern SAFE_VALUE = Pattern.compile("[A-Za-z0-9 _.:-]+");
	// Digits, digit ranges, escaped dots, groups, alternation and quantifiers only.
	private static final Pattern UNSIGNED_LITERAL = Pattern.compile(
			"(?:\\\\d|\\\\\\.|\\[(?:[0-9]-[0-9]|[0-9])+\\]|[0-9(){},|?*+])+");
	private static final List<String> AGGREGATES = List.of("count", "sum", "avg", "min", "max");
	private static final List<String> COMPARE_OPS = List.of("=", ">", ">=", "<", "<=");
	private static final List<String> EQUALITY_OPS = List.of("=", "!=");
	private static final Set<String> KEYWORDS = Set.of(
			"SELECT", "FROM", "WHERE", "AND", "BETWEEN", "IN", "GROUP", "ORDER", "BY", "ASC", "DESC", "LIMIT");

	private static final Terminal SEMI = Terminal.punctuation(";");
	private static final Terminal COMMA = Terminal.punctuation(",");
	private static final Terminal LPAREN = Terminal.punctuation("(");
	private static final Terminal RPAREN = Terminal.punctuation(")");
	private static final Terminal STAR = Terminal.punctuation("*");
	private static final Terminal WS = Terminal.whitespace();
	private static final NonTerminal SP = new NonTerminal(OPTIONAL_SPACE);

	public GrammarArtifact build(SchemaRegistry schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		checkNames(schema);

		List<Production> productions = new ArrayList<>();
		boolean groupable = !schema.groupableColumns().isEmpty();
		boolean aggregatable = !schema.aggregatableColumns().isEmpty();
		List<SchemaColumn> filterable = schema.filterableColumns();

		productions.add(production(START, Alternative.of(SP, nt("select_stmt"), SP, SEMI, SP)));
		List<GrammarSymbol> statement = new ArrayList<>(
				List.of(kw("SELECT"), WS, nt("select_list"), WS, kw("FROM"), WS, nt("table_ref")));
		if (!filterable.isEmpty()) {
			statement.add(nt("where_opt"));
		}
		if (groupable) {
			statement.add(nt("group_by_opt"));
		}
		statement.addAll(List.of(nt("order_by_opt"), nt("limit_opt")));
		productions.add(new Production("select_stmt", List.of(new Alternative(statement))));
		productions.add(production("table_ref", Alternative.of(Terminal.table(schema.table()))));
		productions.add(production("select_list", Alternative.of(nt("select_item"), nt("select_tail"))));
		productions.add(production("select_tail",
				Alternative.of(SP, COMMA, SP, nt("select_item"), nt("select_tail")), Alternative.empty()));

		List<Alternative> selectItems = new ArrayList<>();
		selectItems.add(Alternative.of(nt("agg_func")));
		if (groupable) {
			selectItems.add(Alternative.of(nt("groupable_col")));
		}
		productions.add(new Production("select_item", selectItems));

		List<Alternative> aggFunctions = new ArrayList<>();
		aggFunctions.add(Alternative.of(Terminal.function("count"), SP, LPAREN, SP, STAR, SP, RPAREN));
		if (aggregatable) {
			aggFunctions.add(Alternative.of(nt("agg_name"), SP, LPAREN, SP, nt("agg_col"), SP, RPAREN));
		}
		productions.add(new Production("agg_func", aggFunctions));
		if (aggregatable) {
			productions.add(new Production("agg_name",
					AGGREGATES.stream().map(f -> Alternative.of(Terminal.function(f))).toList()));
			productions.add(columnChoice("agg_col", schema.aggregatableColumns()));
		}
		if (groupable) {
			productions.add(columnChoice("groupable_col", schema.groupableColumns()));
		}

		if (!filterable.isEmpty()) {
			productions.add(production("where_opt",
					Alternative.of(WS, kw("WHERE"), WS, nt("condition"), nt("condition_tail")), Alternative.empty()));
			productions.add(production("condition_tail",
					Alternative.of(WS, kw("AND"), WS, nt("condition"), nt("condition_tail")), Alternative.empty()));
			productions.add(new Production("condition",
					filterable.stream().map(c -> Alternative.of(nt(conditionName(c)))).toList()));
			boolean needsCompare = false;
			boolean needsEquality = false;
			for (SchemaColumn column : filterable) {
				switch (column.kind()) {
					case NUMERIC -> {
						productions.add(numericCondition(column));
						needsCompare = true;
					}
					case CATEGORICAL -> {
						productions.addAll(categoricalCondition(column));
						needsEquality = true;
					}
					case BOOLEAN -> {
						productions.add(booleanCondition(column));
						needsEquality = true;
					}
				}
			}
			if (needsCompare) {
				productions.add(new Production("compare_op",
						COMPARE_OPS.stream().map(op -> Alternative.of(Terminal.operator(op))).toList()));
			}
			if (needsEquality) {
				productions.add(new Production("equality_op",
						EQUALITY_OPS.stream().map(op -> Alternative.of(Terminal.operator(op))).toList()));
			}
		}

		if (groupable) {
			productions.add(production("group_by_opt",
					Alternative.of(WS, kw("GROUP"), WS, kw("BY"), WS, nt("groupable_col"), nt("group_tail")),
					Alternative.empty()));
			productions.add(production("group_tail",
					Alternative.of(SP, COMMA, SP, nt("groupable_col"), nt("group_tail")), Alternative.empty()));
		}

		productions.add(production("order_by_opt",
				Alternative.of(WS, kw("ORDER"), WS, kw("BY"), WS, nt("order_item"), nt("order_tail")),
				Alternative.empty()));
		productions.add(production("order_tail",
				Alternative.of(SP, COMMA, SP, nt("order_item"), nt("order_tail")), Alternative.empty()));
		productions.add(production("order_item", Alternative.of(nt("order_key"), nt("direction"))));
		List<Alternative> orderKeys = new ArrayList<>();
		if (groupable) {
			orderKeys.add(Alternative.of(nt("groupable_col")));
		}
		orderKeys.add(Alternative.of(nt("agg_func")));
		productions.add(new Production("order_key", orderKeys));
		productions.add(production("direction",
				Alternative.of(WS, kw("ASC")), Alternative.of(WS, kw("DESC")), Alternative.empty()));

		productions.add(production("limit_opt",
				Alternative.of(WS, kw("LIMIT"), WS, Terminal.numberPattern("LIMIT_NUM", LIMIT_PATTERN)),
				Alternative.empty()));
		productions.add(production(OPTIONAL_SPACE, Alternative.of(WS), Alternative.empty()));

		GrammarArtifact artifact = GrammarArtifact.create(START, productions, schema);
		logger.debug("Built grammar for table {} with {} productions, fingerprint {}",
				schema.table(), productions.size(), artifact.fingerprint());
		return artifact;
	}

	private Production numericCondition(SchemaColumn column) {
		Terminal col = Terminal.column(column.name());
		Terminal literal = literalPattern(column);
		return production(conditionName(column),
				Alternative.of(col, SP, nt("compare_op"), SP, literal),
				Alternative.of(col, WS, kw("BETWEEN"), WS, literal, WS, kw("AND"), WS, literal));
	}

	private Production booleanCondition(SchemaColumn column) {
		return production(conditionName(column),
				Alternative.of(Terminal.column(column.name()), SP, nt("equality_op"), SP, literalPattern(column)));
	}

	private List<Production> categoricalCondition(SchemaColumn column) {
		Terminal col = Terminal.column(column.name());
		String valueRule = ruleName(column.name()) + "_value";
		String tailRule = valueRule + "_tail";
		List<Production> result = new ArrayList<>();
		result.add(production(conditionName(column),
				Alternative.of(col, SP, nt("equality_op"), SP, nt(valueRule)),
				Alternative.of(col, WS, kw("IN"), SP, LPAREN, SP, nt(valueRule), nt(tailRule), SP, RPAREN)));
		result.add(new Production(valueRule,
				column.values().stream().map(v -> Alternative.of(Terminal.stringLiteral(v))).toList()));
		result.add(production(tailRule,
				Alternative.of(SP, COMMA, SP, nt(valueRule), nt(tailRule)), Alternative.empty()));
		return result;
	}

	private Terminal literalPattern(SchemaColumn column) {
		return Terminal.numberPattern(ruleName(column.name()).toUpperCase(Locale.ROOT) + "_LITERAL",
				column.literalPattern());
	}

	private Production columnChoice(String name, List<SchemaColumn> columns) {
		return new Production(name, columns.stream().map(c -> Alternative.of(Terminal.column(c.name()))).toList());
	}

	private void checkNames(SchemaRegistry schema) {
		checkIdentifier(schema.table(), "table");
		for (SchemaColumn column : schema.columns()) {
			checkIdentifier(column.name(), "column");
			for (String value : column.values()) {
				if (!SAFE_VALUE.matcher(value).matches()) {
					throw new GrammarConstructionException(
							"Value '" + value + "' of column " + column.name() + " contains unsupported characters");
				}
			}
			if (column.literalPattern() != null) {
				try {
					Pattern.compile(column.literalPattern());
				}
				catch (RuntimeException e) {
					throw new GrammarConstructionException(
							"Invalid literal pattern for column " + column.name() + ": " + column.literalPattern(), e);
				}
				if (!UNSIGNED_LITERAL.matcher(column.literalPattern()).matches()) {
					throw new GrammarConstructionException("Literal pattern for column " + column.name()
							+ " must describe unsigned decimal numbers: " + column.literalPattern());
				}
			}
		}
	}

	private void checkIdentifier(String name, String what) {
		if (!IDENTIFIER.matcher(name).matches()) {
			throw new GrammarConstructionException("Invalid " + what + " name: " + name);
		}
		String upper = name.toUpperCase(Locale.ROOT);
		if (KEYWORDS.contains(upper) || AGGREGATES.contains(name.toLowerCase(Locale.ROOT))) {
			throw new GrammarConstructionException("The " + what + " name '" + name + "' collides with a query keyword");
		}
		if (GrammarArtifact.EXCLUDED_KEYWORDS.contains(upper)) {
			throw new GrammarConstructionException(
					"The " + what + " name '" + name + "' spells an excluded keyword");
		}
	}

	static String conditionName(SchemaColumn column) {
		return ruleName(column.name()) + "_condition";
	}

	/**
	 * Lark rule names are lower snake case: {@code isFraud} becomes {@code is_fraud}.
	 */
	static String ruleName(String identifier) {
		return identifier.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
	}

	private static Production production(String name, Alternative... alternatives) {
		return new Production(name, List.of(alternatives));
	}

	private static NonTerminal nt(String name) {
		return new NonTerminal(name);
	}

	private static Terminal kw(String word) {
		return Terminal.keyword(word);
	}
}
