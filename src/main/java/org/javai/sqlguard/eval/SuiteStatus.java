package org.javai.sqlguard.eval;

/**
 * Traffic-light status of a suite run.
 */
public enum SuiteStatus {

	PASS,
	WARN,
	FAIL;

	static final double WARN_THRESHOLD = 0.8;

	public static SuiteStatus forPassRate(double passRate) {
		if (passRate >= 1.0) {
			return PASS;
		}
		return passRate >= WARN_THRESHOLD ? WARN : FAIL;
	}
}
