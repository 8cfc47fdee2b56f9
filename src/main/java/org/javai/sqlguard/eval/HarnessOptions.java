package org.javai.sqlguard.eval;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link EvaluationRunner}.
 *
 * @param workers size of the worker pool
 * @param caseTimeout wall-clock budget of a single case
 * @param reportDirectory where reports are written
 */
public record HarnessOptions(int workers, Duration caseTimeout, Path reportDirectory) {

	public HarnessOptions {
		if (workers < 1) {
			throw new IllegalArgumentException("workers must be at least 1");
		}
		Objects.requireNonNull(caseTimeout, "caseTimeout must not be null");
		if (caseTimeout.isNegative() || caseTimeout.isZero()) {
			throw new IllegalArgumentException("caseTimeout must be positive");
		}
		Objects.requireNonNull(reportDirectory, "reportDirectory must not be null");
	}

	public static HarnessOptions defaults() {
		return new HarnessOptions(4, Duration.ofSeconds(120), Path.of("eval-results"));
	}

	public HarnessOptions withWorkers(int workers) {
		return new HarnessOptions(workers, caseTimeout, reportDirectory);
	}

	public HarnessOptions withCaseTimeout(Duration caseTimeout) {
		return new HarnessOptions(workers, caseTimeout, reportDirectory);
	}

	public HarnessOptions withReportDirectory(Path reportDirectory) {
		return new HarnessOptions(workers, caseTimeout, reportDirectory);
	}
}
