package org.javai.sqlguard.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Readiness of the collaborators a query depends on.
 */
public record HealthReport(
		@JsonProperty("status") String status,
		@JsonProperty("generation_configured") boolean generationConfigured,
		@JsonProperty("database_connected") boolean databaseConnected,
		@JsonProperty("grammar_fingerprint") String grammarFingerprint
) {

	public static final String HEALTHY = "healthy";
	public static final String DEGRADED = "degraded";

	public static HealthReport of(boolean generationConfigured, boolean databaseConnected, String grammarFingerprint) {
		String status = generationConfigured && databaseConnected ? HEALTHY : DEGRADED;
		return new HealthReport(status, generationConfigured, databaseConnected, grammarFingerprint);
	}
}
