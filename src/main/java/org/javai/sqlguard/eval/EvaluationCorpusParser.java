package org.javai.sqlguard.eval;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.javai.sqlguard.eval.QueryExpectation.FilterExpectation;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for evaluation corpus YAML files.
 * <p>
 * Expected layout:
 * <pre>
 * suite: semantic_correctness
 * description: ...
 * default_oracle:
 *   type: outcome
 *   outcome: valid_or_clean_failure
 * cases:
 *   - id: fraud_count
 *     question: How many fraudulent transactions are there?
 *     category: count
 *     oracle:
 *       type: exact
 *       golden_sql: SELECT count(*) FROM Transactions WHERE isFraud = 1;
 * </pre>
 * Oracle types are {@code exact}, {@code tolerance}, {@code row_count}, {@code shape},
 * {@code structural} and {@code outcome}. A case without an oracle uses {@code default_oracle}.
 * {@code repeat: n} repeats the question n times, separated by spaces. Any other keys of a case
 * become its details.
 */
public class EvaluationCorpusParser {

	public static final String CORPUS_ROOT = "META-INF/sqlguard/eval/";

	static final double DEFAULT_TOLERANCE = 0.01;

	private static final List<String> CASE_KEYS = List.of("id", "question", "category", "oracle", "repeat");

	private final Yaml yaml = new Yaml();

	public static EvaluationCorpus loadClasspath(String resource) {
		ClassLoader loader = EvaluationCorpusParser.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(resource)) {
			if (in == null) {
				throw new EvaluationException("Corpus resource not found: " + resource);
			}
			return new EvaluationCorpusParser().parse(in);
		}
		catch (EvaluationException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EvaluationException("Failed to load corpus resource: " + resource, e);
		}
	}

	public EvaluationCorpus parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		}
		catch (EvaluationException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EvaluationException("Failed to parse corpus from path: " + path, e);
		}
	}

	public EvaluationCorpus parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		}
		catch (EvaluationException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EvaluationException("Failed to parse corpus from input stream", e);
		}
	}

	public EvaluationCorpus parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		}
		catch (EvaluationException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EvaluationException("Failed to parse corpus from reader", e);
		}
	}

	public EvaluationCorpus parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		}
		catch (EvaluationException e) {
			throw e;
		}
		catch (Exception e) {
			throw new EvaluationException("Failed to parse corpus from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private EvaluationCorpus build(Object document) {
		if (!(document instanceof Map<?, ?>)) {
			throw new EvaluationException("Corpus document must be a mapping");
		}
		Map<String, Object> root = (Map<String, Object>) document;
		String suite = requireString(root, "suite", "corpus");
		String description = root.get("description") != null ? String.valueOf(root.get("description")).trim() : null;
		Oracle defaultOracle = root.get("default_oracle") instanceof Map<?, ?> map
				? buildOracle((Map<String, Object>) map, "default_oracle")
				: null;

		if (!(root.get("cases") instanceof List<?> caseList)) {
			throw new EvaluationException("Corpus '" + suite + "' must declare a 'cases' list");
		}
		List<EvaluationCase> cases = new ArrayList<>();
		for (Object entry : caseList) {
			if (!(entry instanceof Map<?, ?>)) {
				throw new EvaluationException("Case entries of corpus '" + suite + "' must be mappings");
			}
			cases.add(buildCase((Map<String, Object>) entry, defaultOracle));
		}
		return new EvaluationCorpus(suite, description, cases);
	}

	@SuppressWarnings("unchecked")
	private EvaluationCase buildCase(Map<String, Object> map, Oracle defaultOracle) {
		String id = requireString(map, "id", "case");
		Object questionObj = map.get("question");
		String question = questionObj != null ? String.valueOf(questionObj) : "";
		int repeat = intValue(map.get("repeat"), 1, "repeat of case '" + id + "'");
		if (repeat > 1) {
			question = String.join(" ", Collections.nCopies(repeat, question));
		}
		String category = map.get("category") != null ? String.valueOf(map.get("category")) : null;

		Oracle oracle;
		if (map.get("oracle") instanceof Map<?, ?> oracleMap) {
			oracle = buildOracle((Map<String, Object>) oracleMap, "case '" + id + "'");
		}
		else if (defaultOracle != null) {
			oracle = defaultOracle;
		}
		else {
			throw new EvaluationException("Case '" + id + "' declares no oracle and the corpus has no default");
		}

		Map<String, Object> details = new LinkedHashMap<>();
		map.forEach((key, value) -> {
			if (!CASE_KEYS.contains(key) && value != null) {
				details.put(key, value);
			}
		});
		return new EvaluationCase(id, question, category, oracle, details);
	}

	@SuppressWarnings("unchecked")
	private Oracle buildOracle(Map<String, Object> map, String context) {
		String type = requireString(map, "type", "oracle of " + context).toLowerCase(Locale.ROOT);
		return switch (type) {
			case "exact" -> new Oracle.ExactResult(requireString(map, "golden_sql", "exact oracle of " + context));
			case "tolerance" -> new Oracle.Tolerance(
					requireString(map, "golden_sql", "tolerance oracle of " + context),
					doubleValue(map.get("tolerance"), DEFAULT_TOLERANCE, context));
			case "row_count" -> new Oracle.RowCount(intValue(map.get("rows"), -1, "rows of " + context));
			case "shape" -> new Oracle.ShapeEquivalence(stringList(map.get("acceptable")));
			case "structural" -> {
				if (!(map.get("expect") instanceof Map<?, ?> expect)) {
					throw new EvaluationException("Structural oracle of " + context + " requires an 'expect' mapping");
				}
				yield new Oracle.Structural(buildExpectation((Map<String, Object>) expect));
			}
			case "outcome" -> new Oracle.ExpectedOutcome(outcomeClass(
					requireString(map, "outcome", "outcome oracle of " + context)));
			default -> throw new EvaluationException("Unknown oracle type '" + type + "' for " + context);
		};
	}

	@SuppressWarnings("unchecked")
	private QueryExpectation buildExpectation(Map<String, Object> map) {
		String metric = map.get("metric") != null ? String.valueOf(map.get("metric")) : null;
		List<FilterExpectation> filters = new ArrayList<>();
		if (map.get("filters") instanceof List<?> filterList) {
			for (Object entry : filterList) {
				if (!(entry instanceof Map<?, ?>)) {
					throw new EvaluationException("Filter expectations must be mappings");
				}
				Map<String, Object> filter = (Map<String, Object>) entry;
				List<String> values = new ArrayList<>(stringList(filter.get("values")));
				if (filter.get("value") != null) {
					values.add(String.valueOf(filter.get("value")));
				}
				String operator = filter.get("operator") != null ? String.valueOf(filter.get("operator")) : null;
				filters.add(new FilterExpectation(requireString(filter, "column", "filter expectation"), operator,
						values));
			}
		}
		return new QueryExpectation(metric, stringList(map.get("columns")), filters, stringList(map.get("group_by")));
	}

	private static Oracle.OutcomeClass outcomeClass(String value) {
		try {
			return Oracle.OutcomeClass.valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new EvaluationException("Unknown outcome '" + value + "'", e);
		}
	}

	private static List<String> stringList(Object value) {
		if (value == null) {
			return List.of();
		}
		if (value instanceof List<?> list) {
			return list.stream().map(String::valueOf).toList();
		}
		return List.of(String.valueOf(value));
	}

	private static String requireString(Map<String, Object> map, String key, String context) {
		Object value = map.get(key);
		if (value == null || String.valueOf(value).isBlank()) {
			throw new EvaluationException("Missing '" + key + "' for " + context);
		}
		return String.valueOf(value).trim();
	}

	private static int intValue(Object value, int defaultValue, String context) {
		if (value == null) {
			if (defaultValue < 0) {
				throw new EvaluationException("Missing integer for " + context);
			}
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		}
		catch (NumberFormatException e) {
			throw new EvaluationException("Not an integer for " + context + ": " + value, e);
		}
	}

	private static double doubleValue(Object value, double defaultValue, String context) {
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(String.valueOf(value).trim());
		}
		catch (NumberFormatException e) {
			throw new EvaluationException("Not a number for tolerance of " + context + ": " + value, e);
		}
	}
}
