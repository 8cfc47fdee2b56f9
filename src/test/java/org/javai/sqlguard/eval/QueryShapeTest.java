package org.javai.sqlguard.eval;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.sqlguard.grammar.GrammarBuilder;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.javai.sqlguard.validate.GrammarValidator;
import org.javai.sqlguard.validate.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Query shape")
class QueryShapeTest {

	private static final GrammarValidator VALIDATOR =
			new GrammarValidator(new GrammarBuilder().build(SchemaRegistry.loadDefault()));

	private static QueryShape shapeOf(String sql) {
		ValidationResult result = VALIDATOR.validate(sql);
		assertThat(result.accepted()).as("accepted: %s", sql).isTrue();
		return QueryShape.of(((ValidationResult.Accept) result).parseTree());
	}

	@Test
	void readsEveryClause() {
		QueryShape shape = shapeOf("SELECT type, sum(amount) FROM Transactions WHERE isFraud = 1 AND step BETWEEN 100 AND 200"
				+ " GROUP BY type ORDER BY sum(amount) DESC LIMIT 3;");

		assertThat(shape.aggregates()).containsExactly(new QueryShape.Aggregate("sum", "amount"));
		assertThat(shape.selectedColumns()).containsExactly("type");
		assertThat(shape.filters()).containsExactly(
				new QueryShape.Filter("isFraud", "=", List.of("1")),
				new QueryShape.Filter("step", "BETWEEN", List.of("100", "200")));
		assertThat(shape.groupBy()).containsExactly("type");
		assertThat(shape.orderBy()).containsExactly("sum ( amount ) DESC");
		assertThat(shape.limit()).isEqualTo(3);
		assertThat(shape.referencedColumns()).containsExactly("type", "amount");
		assertThat(shape.hasFilterOn("step")).isTrue();
		assertThat(shape.hasFilterOn("amount")).isFalse();
	}

	@Test
	void countStarReferencesNoColumn() {
		QueryShape shape = shapeOf("SELECT count(*) FROM Transactions;");

		assertThat(shape.aggregates()).containsExactly(new QueryShape.Aggregate("count", "*"));
		assertThat(shape.aggregates().get(0)).hasToString("count(*)");
		assertThat(shape.referencedColumns()).isEmpty();
		assertThat(shape.filters()).isEmpty();
		assertThat(shape.groupBy()).isEmpty();
		assertThat(shape.orderBy()).isEmpty();
		assertThat(shape.limit()).isNull();
	}

	@Test
	void inListCollectsEveryValue() {
		QueryShape shape = shapeOf("SELECT count(*) FROM Transactions WHERE type IN ('CASH-IN', 'DEBIT');");

		assertThat(shape.filters()).containsExactly(
				new QueryShape.Filter("type", "IN", List.of("CASH-IN", "DEBIT")));
	}

	@Test
	void multipleGroupingColumnsKeepOrder() {
		QueryShape shape = shapeOf("SELECT isFraud, type, count(*) FROM Transactions GROUP BY isFraud, type;");

		assertThat(shape.selectedColumns()).containsExactly("isFraud", "type");
		assertThat(shape.groupBy()).containsExactly("isFraud", "type");
	}
}
