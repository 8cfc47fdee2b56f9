package org.javai.sqlguard.eval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.eval.QueryExpectation.FilterExpectation;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.execution.ExecutionResult;
import org.javai.sqlguard.execution.QueryExecutionException;
import org.javai.sqlguard.validate.ParseTree;

/**
 * Checks that the generated query means what the question asked.
 * <p>
 * Result oracles compare the executed result with a golden query run on the same reference
 * dataset; shape and structural oracles inspect the accepted candidate itself.
 */
public class SemanticCorrectnessSuite extends AbstractEvaluationSuite {

	public static final String NAME = "semantic_correctness";
	public static final String CORPUS = EvaluationCorpusParser.CORPUS_ROOT + NAME + ".yml";

	public SemanticCorrectnessSuite(List<EvaluationCase> cases) {
		super(NAME, cases);
	}

	public static SemanticCorrectnessSuite fromClasspath() {
		return new SemanticCorrectnessSuite(EvaluationCorpusParser.loadClasspath(CORPUS).cases());
	}

	@Override
	protected boolean supports(Oracle oracle) {
		return !(oracle instanceof Oracle.ExpectedOutcome);
	}

	@Override
	protected Verdict judge(EvaluationCase evaluationCase, CompilationResult compilation, EvaluationContext context,
			CancellationToken cancellation) {
		Oracle oracle = evaluationCase.oracle();
		if (oracle instanceof Oracle.Structural structural) {
			return acceptedTree(compilation, context)
					.map(tree -> judgeStructure(structural.expectation(), QueryShape.of(tree)))
					.orElseGet(() -> Verdict.fail("No valid SQL generated (" + describeFailure(compilation) + ")"));
		}
		if (oracle instanceof Oracle.ShapeEquivalence shape) {
			return judgeShape(shape, compilation, context);
		}
		if (!compilation.success()) {
			return Verdict.fail("Query did not execute (" + describeFailure(compilation) + ")");
		}
		ExecutionResult actual = compilation.execution();
		if (oracle instanceof Oracle.RowCount rowCount) {
			return actual.rowCount() == rowCount.expectedRows()
					? Verdict.pass("Returned " + actual.rowCount() + " rows")
					: Verdict.fail("Expected " + rowCount.expectedRows() + " rows but got " + actual.rowCount());
		}
		if (oracle instanceof Oracle.ExactResult exact) {
			ExecutionResult expected = runGolden(exact.goldenSql(), context, cancellation);
			return ResultComparator.exactDifference(actual, expected)
					.map(difference -> Verdict.fail("Result differs from golden query: " + difference))
					.orElseGet(() -> Verdict.pass("Result matches golden query"));
		}
		Oracle.Tolerance tolerance = (Oracle.Tolerance) oracle;
		ExecutionResult expected = runGolden(tolerance.goldenSql(), context, cancellation);
		return ResultComparator.toleranceDifference(actual, expected, tolerance.relativeTolerance())
				.map(difference -> Verdict.fail("Result outside tolerance: " + difference))
				.orElseGet(() -> Verdict.pass("Result within " + tolerance.relativeTolerance() + " of golden query"));
	}

	private ExecutionResult runGolden(String goldenSql, EvaluationContext context, CancellationToken cancellation) {
		ExecutionGateway reference = context.reference()
				.orElseThrow(() -> new EvaluationException("No reference gateway configured for golden queries"));
		try {
			return reference.execute(goldenSql, cancellation);
		}
		catch (QueryExecutionException e) {
			throw new EvaluationException("Golden query failed: " + goldenSql, e);
		}
	}

	private Verdict judgeShape(Oracle.ShapeEquivalence shape, CompilationResult compilation,
			EvaluationContext context) {
		Optional<ParseTree> tree = acceptedTree(compilation, context);
		if (tree.isEmpty()) {
			return Verdict.fail("No valid SQL generated (" + describeFailure(compilation) + ")");
		}
		String candidate = tree.get().source();
		for (String acceptable : shape.acceptableSql()) {
			if (SqlShapeNormalizer.equivalent(candidate, acceptable)) {
				return Verdict.pass("Equivalent to " + acceptable);
			}
		}
		return Verdict.fail("Shape matches none of " + shape.acceptableSql().size() + " acceptable queries")
				.withDetails(Map.of("normalized", SqlShapeNormalizer.normalize(candidate)));
	}

	static Verdict judgeStructure(QueryExpectation expectation, QueryShape shape) {
		List<String> problems = new ArrayList<>();
		if (expectation.metric() != null && !expectation.metric().isBlank()) {
			boolean found = shape.aggregates().stream()
					.anyMatch(a -> a.function().equalsIgnoreCase(expectation.metric()));
			if (!found) {
				problems.add("missing metric " + expectation.metric());
			}
		}
		for (String column : expectation.columns()) {
			if (!shape.referencedColumns().contains(column)) {
				problems.add("missing column " + column);
			}
		}
		for (FilterExpectation filter : expectation.filters()) {
			if (shape.filters().stream().noneMatch(actual -> filterMatches(filter, actual))) {
				problems.add("missing filter on " + filter.column()
						+ (filter.operator() != null ? " " + filter.operator() : "")
						+ (filter.values().isEmpty() ? "" : " " + filter.values()));
			}
		}
		for (String column : expectation.groupBy()) {
			if (!shape.groupBy().contains(column)) {
				problems.add("missing group by " + column);
			}
		}

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("aggregates", shape.aggregates().stream().map(QueryShape.Aggregate::toString).toList());
		details.put("filters", shape.filters().stream().map(f -> f.column() + " " + f.operator()).toList());
		details.put("group_by", shape.groupBy());
		if (problems.isEmpty()) {
			return Verdict.pass("Query contains the expected elements").withDetails(details);
		}
		return Verdict.fail(String.join("; ", problems)).withDetails(details);
	}

	private static boolean filterMatches(FilterExpectation expected, QueryShape.Filter actual) {
		if (!expected.column().equals(actual.column())) {
			return false;
		}
		if (expected.operator() != null && !expected.operator().equalsIgnoreCase(actual.operator())) {
			return false;
		}
		for (String value : expected.values()) {
			if (actual.values().stream().noneMatch(v -> unquote(v).equals(value))) {
				return false;
			}
		}
		return true;
	}

	private static String unquote(String literal) {
		if (literal.length() >= 2 && literal.startsWith("'") && literal.endsWith("'")) {
			return literal.substring(1, literal.length() - 1);
		}
		return literal;
	}
}
