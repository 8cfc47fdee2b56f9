package org.javai.sqlguard.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.sqlguard.compiler.RetryFeedbackPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link SqlGuardSettings} from YAML.
 * <p>
 * Scalar values may contain {@code ${NAME}} or {@code ${NAME:default}} placeholders which are
 * resolved from the environment. Durations accept ISO-8601 ({@code PT30S}) or a number with a
 * {@code ms}, {@code s} or {@code m} suffix. Missing sections and keys fall back to defaults;
 * the {@code gateway} section is optional as a whole but requires {@code jdbc-url} when present.
 */
public class SqlGuardSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(SqlGuardSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "sqlguard.yml";

	private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_.]*)(?::([^}]*))?}");
	private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m)");

	private final Yaml yaml = new Yaml();
	private final UnaryOperator<String> environment;

	public SqlGuardSettingsLoader() {
		this(System::getenv);
	}

	public SqlGuardSettingsLoader(UnaryOperator<String> environment) {
		this.environment = environment;
	}

	public SqlGuardSettings loadDefault() {
		ClassLoader loader = SqlGuardSettingsLoader.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				logger.info("No {} on the classpath; using default settings", DEFAULT_RESOURCE);
				return SqlGuardSettings.defaults();
			}
			return parse(in);
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to load settings resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public SqlGuardSettings parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from path: " + path, e);
		}
	}

	public SqlGuardSettings parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from input stream", e);
		}
	}

	public SqlGuardSettings parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from reader", e);
		}
	}

	public SqlGuardSettings parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings from string", e);
		}
	}

	/**
	 * Replaces every placeholder in {@code value}.
	 *
	 * @throws SettingsException if a variable is unset and has no default
	 */
	String resolve(String value) {
		if (value == null) {
			return null;
		}
		Matcher matcher = PLACEHOLDER.matcher(value);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String name = matcher.group(1);
			String replacement = environment.apply(name);
			if (replacement == null) {
				replacement = matcher.group(2);
			}
			if (replacement == null) {
				throw new SettingsException("Environment variable " + name + " is not set and has no default");
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	@SuppressWarnings("unchecked")
	private SqlGuardSettings build(Object document) {
		if (document == null) {
			return SqlGuardSettings.defaults();
		}
		if (!(document instanceof Map<?, ?>)) {
			throw new SettingsException("Settings document must be a mapping");
		}
		Map<String, Object> root = (Map<String, Object>) document;
		return new SqlGuardSettings(
				buildCompiler(section(root, "compiler")),
				root.containsKey("gateway") ? buildGateway(section(root, "gateway")) : null,
				buildGeneration(section(root, "generation")),
				buildHarness(section(root, "harness")));
	}

	private SqlGuardSettings.Compiler buildCompiler(Map<String, Object> map) {
		SqlGuardSettings.Compiler defaults = SqlGuardSettings.Compiler.defaults();
		String policy = string(map, "feedback-policy");
		RetryFeedbackPolicy feedbackPolicy;
		try {
			feedbackPolicy = policy != null ? RetryFeedbackPolicy.valueOf(policy.toUpperCase(Locale.ROOT))
					: defaults.feedbackPolicy();
		}
		catch (IllegalArgumentException e) {
			throw new SettingsException("Unknown compiler.feedback-policy: " + policy, e);
		}
		return new SqlGuardSettings.Compiler(
				integer(map, "max-retries", defaults.maxRetries()),
				duration(map, "generation-timeout", defaults.generationTimeout()),
				integer(map, "min-question-length", defaults.minQuestionLength()),
				integer(map, "max-question-length", defaults.maxQuestionLength()),
				feedbackPolicy,
				integer(map, "max-candidate-length", defaults.maxCandidateLength()));
	}

	private SqlGuardSettings.Gateway buildGateway(Map<String, Object> map) {
		String jdbcUrl = string(map, "jdbc-url");
		if (jdbcUrl == null || jdbcUrl.isBlank()) {
			throw new SettingsException("gateway.jdbc-url is required when a gateway is configured");
		}
		return new SqlGuardSettings.Gateway(
				jdbcUrl,
				string(map, "username"),
				string(map, "password"),
				integer(map, "maximum-pool-size", 5),
				duration(map, "connection-timeout", Duration.ofSeconds(10)),
				duration(map, "query-timeout", Duration.ofSeconds(30)),
				integer(map, "max-rows", 10_000));
	}

	private SqlGuardSettings.Generation buildGeneration(Map<String, Object> map) {
		SqlGuardSettings.Generation defaults = SqlGuardSettings.Generation.defaults();
		String model = string(map, "model");
		return new SqlGuardSettings.Generation(
				string(map, "endpoint"),
				model != null && !model.isBlank() ? model : defaults.model(),
				string(map, "api-key"),
				duration(map, "request-timeout", defaults.requestTimeout()));
	}

	private SqlGuardSettings.Harness buildHarness(Map<String, Object> map) {
		SqlGuardSettings.Harness defaults = SqlGuardSettings.Harness.defaults();
		String directory = string(map, "report-directory");
		return new SqlGuardSettings.Harness(
				integer(map, "workers", defaults.workers()),
				duration(map, "case-timeout", defaults.caseTimeout()),
				directory != null && !directory.isBlank() ? Path.of(directory) : defaults.reportDirectory());
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> root, String key) {
		Object value = root.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?>)) {
			throw new SettingsException("Settings section '" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private String string(Map<String, Object> map, String key) {
		Object value = map.get(key);
		return value != null ? resolve(String.valueOf(value)).trim() : null;
	}

	private int integer(Map<String, Object> map, String key, int defaultValue) {
		String value = string(map, key);
		if (value == null || value.isEmpty()) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new SettingsException("Setting '" + key + "' is not an integer: " + value, e);
		}
	}

	private Duration duration(Map<String, Object> map, String key, Duration defaultValue) {
		String value = string(map, key);
		if (value == null || value.isEmpty()) {
			return defaultValue;
		}
		Matcher simple = SIMPLE_DURATION.matcher(value);
		if (simple.matches()) {
			long amount = Long.parseLong(simple.group(1));
			return switch (simple.group(2)) {
				case "ms" -> Duration.ofMillis(amount);
				case "s" -> Duration.ofSeconds(amount);
				default -> Duration.ofMinutes(amount);
			};
		}
		try {
			return Duration.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new SettingsException("Setting '" + key + "' is not a duration: " + value, e);
		}
	}
}
