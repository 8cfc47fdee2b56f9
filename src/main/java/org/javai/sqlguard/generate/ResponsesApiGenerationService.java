package org.javai.sqlguard.generate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GenerationService} for a responses-style HTTP API that accepts a custom tool whose
 * input is constrained by a Lark grammar.
 * <p>
 * The service performs constrained decoding; the reply's {@code custom_tool_call} input is
 * the candidate. A reply without a tool call is treated as a refusal.
 */
public class ResponsesApiGenerationService implements GenerationService {

	private static final Logger logger = LoggerFactory.getLogger(ResponsesApiGenerationService.class);

	public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/responses";
	public static final String TOOL_NAME = "sql_query";

	private final HttpClient httpClient;
	private final ObjectMapper mapper;
	private final URI endpoint;
	private final String apiKey;
	private final String model;
	private final Duration requestTimeout;

	private ResponsesApiGenerationService(Builder builder) {
		this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newHttpClient();
		this.mapper = builder.mapper != null ? builder.mapper : new ObjectMapper();
		this.endpoint = URI.create(builder.endpoint != null ? builder.endpoint : DEFAULT_ENDPOINT);
		this.apiKey = builder.apiKey;
		this.model = Objects.requireNonNull(builder.model, "model must not be null");
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : Duration.ofSeconds(90);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public GenerationResponse generate(GenerationRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		if (!isConfigured()) {
			throw new GenerationException("No API key configured for " + endpoint);
		}

		String body;
		try {
			body = mapper.writeValueAsString(buildPayload(request));
		}
		catch (IOException e) {
			throw new GenerationException("Failed to serialize generation request", e);
		}

		HttpRequest httpRequest = HttpRequest.newBuilder()
				.uri(endpoint)
				.timeout(requestTimeout)
				.header("Authorization", "Bearer " + apiKey)
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(body))
				.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GenerationException("Interrupted while waiting for the generation service", e);
		}
		catch (IOException e) {
			throw new GenerationException("Generation service unreachable: " + e.getMessage(), e);
		}

		logger.debug("Attempt {} raw response ({}):\n{}", request.attempt(), response.statusCode(), response.body());
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new GenerationException("Generation service returned HTTP " + response.statusCode());
		}
		return parseResponse(response.body());
	}

	@Override
	public boolean isConfigured() {
		return apiKey != null && !apiKey.isBlank();
	}

	ObjectNode buildPayload(GenerationRequest request) {
		ObjectNode payload = mapper.createObjectNode();
		payload.put("model", model);
		payload.put("input", GenerationPrompt.userPrompt(request));
		payload.putObject("text").putObject("format").put("type", "text");
		payload.put("parallel_tool_calls", false);

		ArrayNode tools = payload.putArray("tools");
		ObjectNode tool = tools.addObject();
		tool.put("type", "custom");
		tool.put("name", TOOL_NAME);
		tool.put("description", GenerationPrompt.toolDescription(request));
		ObjectNode format = tool.putObject("format");
		format.put("type", "grammar");
		format.put("syntax", "lark");
		format.put("definition", request.artifact().toLark());
		return payload;
	}

	GenerationResponse parseResponse(String body) {
		JsonNode root;
		try {
			root = mapper.readTree(body);
		}
		catch (IOException e) {
			throw new GenerationException("Generation service returned malformed JSON", e);
		}
		JsonNode output = root.path("output");
		if (!output.isArray()) {
			throw new GenerationException("Generation service response has no output");
		}
		StringBuilder text = new StringBuilder();
		for (JsonNode item : output) {
			if ("message".equals(item.path("type").asText())) {
				for (JsonNode part : item.path("content")) {
					text.append(part.path("text").asText(""));
				}
				continue;
			}
			boolean toolCall = "custom_tool_call".equals(item.path("type").asText())
					|| TOOL_NAME.equals(item.path("name").asText());
			JsonNode input = item.path("input");
			if (toolCall && input.isTextual()) {
				return new GenerationResponse.Candidate(input.asText().trim());
			}
		}
		logger.info("Generation service produced no tool call");
		return new GenerationResponse.Refusal(text.length() == 0 ? null : text.toString().trim());
	}

	public static class Builder {

		private HttpClient httpClient;
		private ObjectMapper mapper;
		private String endpoint;
		private String apiKey;
		private String model = "gpt-5";
		private Duration requestTimeout;

		private Builder() {
		}

		public Builder withHttpClient(HttpClient httpClient) {
			this.httpClient = httpClient;
			return this;
		}

		public Builder withObjectMapper(ObjectMapper mapper) {
			this.mapper = mapper;
			return this;
		}

		public Builder endpoint(String endpoint) {
			this.endpoint = endpoint;
			return this;
		}

		public Builder apiKey(String apiKey) {
			this.apiKey = apiKey;
			return this;
		}

		public Builder model(String model) {
			this.model = model;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public ResponsesApiGenerationService build() {
			return new ResponsesApiGenerationService(this);
		}
	}
}
