package org.javai.sqlguard.eval;

import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats per-case and per-suite harness log lines.
 */
public class EvaluationLogger {

	private final Logger logger;

	public EvaluationLogger(Class<?> owner) {
		this.logger = LoggerFactory.getLogger(owner);
	}

	public void logCaseResult(String suite, EvaluationResult result) {
		if (result.passed()) {
			if (!logger.isInfoEnabled()) {
				return;
			}
			logger.info("[{}] case='{}' category={} PASS {} ms: {}",
					suite,
					result.caseId(),
					result.category(),
					toMillis(result.elapsed()),
					result.diagnostic());
			return;
		}
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] case='{}' category={} FAIL {} ms (question='{}', sql='{}'): {}",
				suite,
				result.caseId(),
				result.category(),
				toMillis(result.elapsed()),
				summarize(result.question()),
				summarize(result.generatedSql()),
				result.diagnostic());
	}

	public void logCaseError(String suite, EvaluationCase evaluationCase, Throwable error, Duration elapsed) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] case='{}' category={} errored after {} ms (question='{}'): {}",
				suite,
				evaluationCase.id(),
				evaluationCase.category(),
				toMillis(elapsed),
				summarize(evaluationCase.question()),
				error.toString(),
				error);
	}

	public void logCaseTimeout(String suite, EvaluationCase evaluationCase, Duration timeout) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] case='{}' exceeded its {} ms budget and was cancelled",
				suite, evaluationCase.id(), toMillis(timeout));
	}

	public void logSuiteSummary(SuiteReport report) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("[{}] {}/{} passed ({}) status={} by category {}",
				report.name(),
				report.passed(),
				report.total(),
				formatRate(report.passRate()),
				report.status(),
				report.byCategory());
	}

	/**
	 * Flexible debug logging using SLF4J's {} placeholders.
	 */
	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	static String formatRate(double rate) {
		return String.format(Locale.ROOT, "%.1f%%", rate * 100);
	}

	private long toMillis(Duration duration) {
		return duration == null ? -1 : duration.toMillis();
	}

	private String summarize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
