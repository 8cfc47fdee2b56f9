package org.javai.sqlguard.eval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.javai.sqlguard.grammar.TerminalKind;
import org.javai.sqlguard.validate.ParseNode;
import org.javai.sqlguard.validate.ParseTree;

/**
 * The semantic elements of an accepted query, read off its parse tree.
 *
 * @param aggregates aggregate calls in the select list, e.g. {@code count(*)}, {@code sum(amount)}
 * @param selectedColumns bare columns in the select list
 * @param filters WHERE conditions in source order
 * @param groupBy GROUP BY columns
 * @param orderBy ORDER BY keys as written
 * @param limit LIMIT value, or {@code null}
 */
public record QueryShape(
		List<Aggregate> aggregates,
		List<String> selectedColumns,
		List<Filter> filters,
		List<String> groupBy,
		List<String> orderBy,
		Integer limit
) {

	public record Aggregate(String function, String argument) {

		@Override
		public String toString() {
			return function + "(" + argument + ")";
		}
	}

	public record Filter(String column, String operator, List<String> values) {
	}

	public static QueryShape of(ParseTree tree) {
		List<Aggregate> aggregates = new ArrayList<>();
		List<String> selected = new ArrayList<>();
		for (ParseNode list : tree.nodes("select_list")) {
			collectSelectItems(list, aggregates, selected);
		}

		List<Filter> filters = new ArrayList<>();
		for (ParseNode condition : tree.nodes("condition")) {
			filters.add(toFilter(condition));
		}

		List<String> groupBy = new ArrayList<>();
		for (ParseNode node : tree.nodes("group_by_opt")) {
			for (ParseNode leaf : node.leaves()) {
				if (leaf.terminal().kind() == TerminalKind.COLUMN) {
					groupBy.add(leaf.token().value());
				}
			}
		}

		List<String> orderBy = new ArrayList<>();
		for (ParseNode item : tree.nodes("order_item")) {
			orderBy.add(item.text());
		}

		Integer limit = null;
		for (ParseNode node : tree.nodes("limit_opt")) {
			for (ParseNode leaf : node.leaves()) {
				if (leaf.terminal().kind() == TerminalKind.NUMBER_PATTERN) {
					limit = Integer.valueOf(leaf.token().value());
				}
			}
		}
		return new QueryShape(List.copyOf(aggregates), List.copyOf(selected), List.copyOf(filters),
				List.copyOf(groupBy), List.copyOf(orderBy), limit);
	}

	public Set<String> referencedColumns() {
		Set<String> columns = new LinkedHashSet<>(selectedColumns);
		for (Aggregate aggregate : aggregates) {
			if (!"*".equals(aggregate.argument())) {
				columns.add(aggregate.argument());
			}
		}
		return columns;
	}

	public boolean hasFilterOn(String column) {
		return filters.stream().anyMatch(f -> f.column().equals(column));
	}

	private static void collectSelectItems(ParseNode selectList, List<Aggregate> aggregates, List<String> selected) {
		for (ParseNode child : selectList.children()) {
			if (child.isLeaf()) {
				continue;
			}
			switch (child.name()) {
				case "select_item" -> {
					ParseNode target = child.children().get(0);
					if (target.name().equals("agg_func")) {
						aggregates.add(toAggregate(target));
					}
					else {
						selected.add(target.leaves().get(0).token().value());
					}
				}
				case "select_tail" -> collectSelectItems(child, aggregates, selected);
				default -> {
				}
			}
		}
	}

	private static Aggregate toAggregate(ParseNode aggFunc) {
		List<ParseNode> leaves = aggFunc.leaves();
		String function = leaves.get(0).token().value().toLowerCase(Locale.ROOT);
		String argument = leaves.get(2).token().value();
		return new Aggregate(function, argument);
	}

	private static Filter toFilter(ParseNode condition) {
		List<ParseNode> leaves = condition.leaves();
		String column = leaves.get(0).token().value();
		String operator = leaves.get(1).token().value().toUpperCase(Locale.ROOT);
		List<String> values = new ArrayList<>();
		for (ParseNode leaf : leaves) {
			TerminalKind kind = leaf.terminal().kind();
			if (kind == TerminalKind.STRING_LITERAL || kind == TerminalKind.NUMBER_PATTERN) {
				values.add(leaf.token().value());
			}
		}
		return new Filter(column, operator, List.copyOf(values));
	}
}
