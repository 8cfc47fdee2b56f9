package org.javai.sqlguard.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.javai.sqlguard.CancellationToken;
import org.javai.sqlguard.compiler.CompilationResult;
import org.javai.sqlguard.compiler.QueryCompiler;
import org.javai.sqlguard.compiler.QueryErrorKind;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.execution.ExecutionResult;
import org.javai.sqlguard.execution.QueryExecutionException;
import org.javai.sqlguard.grammar.GrammarBuilder;
import org.javai.sqlguard.schema.SchemaRegistry;
import org.javai.sqlguard.testsupport.ScriptedGenerationService;
import org.javai.sqlguard.validate.GrammarValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Query response")
class QueryResponseTest {

	private static final String QUESTION = "Transactions per type?";
	private static final String BY_TYPE = "SELECT type, count(*) FROM Transactions GROUP BY type;";

	private final ObjectMapper mapper = new ObjectMapper();
	private ScriptedGenerationService generation;

	@Mock
	private ExecutionGateway gateway;

	private QueryCompiler compiler;

	@BeforeEach
	void setUp() {
		generation = new ScriptedGenerationService();
		compiler = QueryCompiler.builder()
				.validator(new GrammarValidator(new GrammarBuilder().build(SchemaRegistry.loadDefault())))
				.generationService(generation)
				.executionGateway(gateway)
				.build();
	}

	@AfterEach
	void tearDown() {
		compiler.close();
	}

	@Test
	void successCarriesResultTable() throws Exception {
		generation.candidates(QUESTION, BY_TYPE);
		when(gateway.execute(anyString(), any(CancellationToken.class))).thenReturn(new ExecutionResult(
				List.of("type", "count(*)"),
				List.of(List.of("TRANSFER", 5), List.of("PAYMENT", 5)),
				Duration.ofMillis(12), false));

		QueryResponse response = QueryResponse.from(compiler.compile(QUESTION));
		JsonNode json = mapper.readTree(mapper.writeValueAsString(response));

		assertThat(json.path("success").asBoolean()).isTrue();
		assertThat(json.path("question").asText()).isEqualTo(QUESTION);
		assertThat(json.path("generated_sql").asText()).isEqualTo(BY_TYPE);
		assertThat(json.path("error").isNull()).isTrue();
		JsonNode result = json.path("result");
		assertThat(result.path("columns").toString()).isEqualTo("[\"type\",\"count(*)\"]");
		assertThat(result.path("data").get(0).get(0).asText()).isEqualTo("TRANSFER");
		assertThat(result.path("data").get(1).get(1).asInt()).isEqualTo(5);
		assertThat(result.path("row_count").asInt()).isEqualTo(2);
		assertThat(result.path("execution_time_ms").asLong()).isEqualTo(12);
		assertThat(result.path("truncated").asBoolean()).isFalse();
	}

	@Test
	void repeatedColumnLabelsKeepEveryValue() throws Exception {
		String sql = "SELECT count(*), count(*), sum(amount) FROM Transactions;";
		generation.candidates(QUESTION, sql);
		when(gateway.execute(anyString(), any(CancellationToken.class))).thenReturn(new ExecutionResult(
				List.of("COUNT(*)", "COUNT(*)", "SUM(AMOUNT)"),
				List.of(List.of(20, 20, new BigDecimal("18512345.50"))),
				Duration.ofMillis(3), false));

		QueryResponse response = QueryResponse.from(compiler.compile(QUESTION));
		JsonNode result = mapper.readTree(mapper.writeValueAsString(response)).path("result");

		assertThat(response.result().data()).singleElement()
				.satisfies(row -> assertThat(row).hasSameSizeAs(response.result().columns()));
		assertThat(result.path("columns").toString()).isEqualTo("[\"COUNT(*)\",\"COUNT(*)\",\"SUM(AMOUNT)\"]");
		assertThat(result.path("data").get(0).get(0).asInt()).isEqualTo(20);
		assertThat(result.path("data").get(0).get(1).asInt()).isEqualTo(20);
		assertThat(result.path("data").get(0).get(2).decimalValue()).isEqualByComparingTo("18512345.5");
	}

	@Test
	void executionFailureKeepsValidatedSql() throws Exception {
		generation.candidates(QUESTION, BY_TYPE);
		when(gateway.execute(anyString(), any(CancellationToken.class)))
				.thenThrow(new QueryExecutionException("Code: 241. Memory limit exceeded"));

		QueryResponse response = QueryResponse.from(compiler.compile(QUESTION));
		JsonNode json = mapper.readTree(mapper.writeValueAsString(response));

		assertThat(response.success()).isFalse();
		assertThat(json.path("generated_sql").asText()).isEqualTo(BY_TYPE);
		assertThat(json.path("result").isNull()).isTrue();
		assertThat(json.path("error").path("kind").asText()).isEqualTo("EXECUTION_ERROR");
		assertThat(json.path("error").path("message").asText())
				.isEqualTo("The query failed: Code: 241. Memory limit exceeded");
	}

	@Test
	void rejectedCandidateIsNeverShown() {
		generation.candidates(QUESTION, "SELECT * FROM Transactions;");

		CompilationResult compilation = compiler.compile(QUESTION);
		QueryResponse response = QueryResponse.from(compilation);

		assertThat(response.generatedSql()).isNull();
		assertThat(response.error().kind()).isEqualTo(QueryErrorKind.INTERNAL_INVARIANT_VIOLATION);
	}

	@Test
	void refusalHasNoSql() {
		generation.refusal(QUESTION, "Not answerable");

		QueryResponse response = QueryResponse.from(compiler.compile(QUESTION));

		assertThat(response.generatedSql()).isNull();
		assertThat(response.error()).isEqualTo(new QueryResponse.ErrorDetail(QueryErrorKind.REFUSED, "Not answerable"));
	}

	@Test
	void requiresExactlyOneOutcome() {
		assertThatThrownBy(() -> new QueryResponse(true, QUESTION, null, null, null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void requestReadsQuestionFromJson() throws Exception {
		QueryRequest request = mapper.readValue("{\"question\": \"How many?\"}", QueryRequest.class);

		assertThat(request.question()).isEqualTo("How many?");
	}
}
