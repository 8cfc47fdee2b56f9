package org.javai.sqlguard.eval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes evaluation reports: one JSON file per suite, a combined {@code summary.json} and a
 * plain-text {@code summary.txt} listing failing cases.
 */
public class EvaluationReportWriter {

	public static final String SUMMARY_JSON = "summary.json";
	public static final String SUMMARY_TEXT = "summary.txt";

	private final ObjectMapper objectMapper;

	public EvaluationReportWriter() {
		this(defaultObjectMapper());
	}

	public EvaluationReportWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	static ObjectMapper defaultObjectMapper() {
		return new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	public void writeReport(EvaluationReport report, Path outputDirectory) throws IOException {
		Files.createDirectories(outputDirectory);
		for (SuiteReport suite : report.suites()) {
			writeSuite(suite, outputDirectory.resolve(suite.name() + ".json"));
		}
		objectMapper.writeValue(outputDirectory.resolve(SUMMARY_JSON).toFile(), report);
		Files.writeString(outputDirectory.resolve(SUMMARY_TEXT), renderSummary(report), StandardCharsets.UTF_8);
	}

	public void writeSuite(SuiteReport suite, Path path) throws IOException {
		objectMapper.writeValue(path.toFile(), suite);
	}

	public String renderSummary(EvaluationReport report) {
		StringBuilder sb = new StringBuilder();
		sb.append("Evaluation summary ").append(report.timestamp()).append('\n');
		sb.append("Grammar ").append(report.grammarFingerprint()).append("\n\n");
		for (SuiteReport suite : report.suites()) {
			sb.append(String.format("%-22s %4d/%-4d %7s  %s%n",
					suite.name(),
					suite.passed(),
					suite.total(),
					EvaluationLogger.formatRate(suite.passRate()),
					suite.status()));
		}
		sb.append(String.format("%-22s %4d/%-4d %7s  %s%n",
				"overall",
				report.passed(),
				report.total(),
				EvaluationLogger.formatRate(report.passRate()),
				report.status()));

		for (SuiteReport suite : report.suites()) {
			List<EvaluationResult> failures = suite.failures();
			if (failures.isEmpty()) {
				continue;
			}
			sb.append('\n').append("Failures in ").append(suite.name()).append(":\n");
			for (EvaluationResult failure : failures) {
				sb.append("  - ").append(failure.caseId())
						.append(" [").append(failure.category()).append("] ")
						.append(failure.diagnostic()).append('\n');
				if (failure.generatedSql() != null) {
					sb.append("      sql: ").append(failure.generatedSql().replaceAll("\\s+", " ").trim()).append('\n');
				}
			}
		}
		return sb.toString();
	}
}
