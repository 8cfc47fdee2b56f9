package org.javai.sqlguard;

import java.util.Objects;
import org.javai.sqlguard.api.HealthReport;
import org.javai.sqlguard.api.QueryRequest;
import org.javai.sqlguard.api.QueryResponse;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.compiler.CompilerOptions;
import org.javai.sqlguard.compiler.QueryCompiler;
import org.javai.sqlguard.config.SettingsException;
import org.javai.sqlguard.config.SqlGuardSettings;
import org.javai.sqlguard.eval.EvaluationContext;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.execution.JdbcExecutionGateway;
import org.javai.sqlguard.generate.GenerationService;
import org.javai.sqlguard.generate.ResponsesApiGenerationService;
import org.javai.sqlguard.grammar.GrammarArtifact;
import org.javai.sqlguard.grammar.GrammarBuilder;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.javai.sqlguard.validate.GrammarValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that wires schema, grammar, validator, compiler and gateway together.
 * <p>
 * The grammar artifact and validator are built once here and shared by reference with every
 * component that needs them, so the grammar sent to the generation service is always the one
 * candidates are validated against.
 * <pre>
 * try (SqlGuard guard = SqlGuard.builder()
 *         .generationService(service)
 *         .executionGateway(gateway)
 *         .build()) {
 *     QueryResponse response = guard.ask(new QueryRequest("How many fraudulent transactions are there?"));
 * }
 * </pre>
 */
public final class SqlGuard implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SqlGuard.class);

	private final SchemaRegistry schema;
	private final GrammarArtifact artifact;
	private final GrammarValidator validator;
	private final GenerationService generationService;
	private final ExecutionGateway executionGateway;
	private final QueryCompiler compiler;

	private SqlGuard(Builder builder) {
		this.schema = builder.schema != null ? builder.schema : SchemaRegistry.loadDefault();
		this.artifact = new GrammarBuilder().build(schema);
		this.validator = new GrammarValidator(artifact, builder.maxCandidateLength);
		this.generationService = Objects.requireNonNull(builder.generationService,
				"generationService must not be null");
		this.executionGateway = Objects.requireNonNull(builder.executionGateway, "executionGateway must not be null");
		this.compiler = QueryCompiler.builder()
				.validator(validator)
				.generationService(generationService)
				.executionGateway(executionGateway)
				.options(builder.options)
				.build();
		logger.info("Grammar for table {} ready: {} productions, fingerprint {}", schema.table(),
				artifact.productions().size(), artifact.fingerprint());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Wires a guard from settings: the responses API generation service and a pooled JDBC gateway.
	 *
	 * @throws SettingsException if the settings declare no gateway
	 */
	public static SqlGuard fromSettings(SqlGuardSettings settings) {
		if (!settings.hasGateway()) {
			throw new SettingsException("A gateway section is required to build a SqlGuard from settings");
		}
		SqlGuardSettings.Generation generation = settings.generation();
		GenerationService service = ResponsesApiGenerationService.builder()
				.endpoint(generation.endpoint())
				.model(generation.model())
				.apiKey(generation.apiKey())
				.requestTimeout(generation.requestTimeout())
				.build();
		if (!generation.hasApiKey()) {
			logger.warn("No API key configured; questions will fail with GENERATION_FAILED");
		}
		return builder()
				.generationService(service)
				.executionGateway(JdbcExecutionGateway.pooled(settings.gateway().toOptions()))
				.options(settings.compiler().toOptions())
				.maxCandidateLength(settings.compiler().maxCandidateLength())
				.build();
	}

	public QueryResponse ask(QueryRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		return QueryResponse.from(compile(request.question(), CancellationToken.none()));
	}

	public CompilationResult compile(String question, CancellationToken cancellation) {
		return compiler.compile(question, cancellation);
	}

	public HealthReport health() {
		return HealthReport.of(generationService.isConfigured(), executionGateway.isHealthy(), artifact.fingerprint());
	}

	/**
	 * A harness context evaluating this guard, with golden queries run on {@code referenceGateway}.
	 */
	public EvaluationContext evaluationContext(ExecutionGateway referenceGateway) {
		return new EvaluationContext(compiler, validator, referenceGateway);
	}

	public SchemaRegistry schema() {
		return schema;
	}

	public GrammarArtifact artifact() {
		return artifact;
	}

	public GrammarValidator validator() {
		return validator;
	}

	public QueryCompiler compiler() {
		return compiler;
	}

	@Override
	public void close() {
		compiler.close();
		if (executionGateway instanceof AutoCloseable closeable) {
			try {
				closeable.close();
			}
			catch (Exception e) {
				logger.warn("Failed to close execution gateway", e);
			}
		}
	}

	public static final class Builder {

		private SchemaRegistry schema;
		private GenerationService generationService;
		private ExecutionGateway executionGateway;
		private CompilerOptions options = CompilerOptions.defaults();
		private int maxCandidateLength = GrammarValidator.DEFAULT_MAX_LENGTH;

		private Builder() {
		}

		public Builder schema(SchemaRegistry schema) {
			this.schema = schema;
			return this;
		}

		public Builder generationService(GenerationService generationService) {
			this.generationService = generationService;
			return this;
		}

		public Builder executionGateway(ExecutionGateway executionGateway) {
			this.executionGateway = executionGateway;
			return this;
		}

		public Builder options(CompilerOptions options) {
			this.options = options != null ? options : CompilerOptions.defaults();
			return this;
		}

		public Builder maxCandidateLength(int maxCandidateLength) {
			this.maxCandidateLength = maxCandidateLength;
			return this;
		}

		public SqlGuard build() {
			return new SqlGuard(this);
		}
	}
}
