package org.javai.sqlguard.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A caller's question.
 */
public record QueryRequest(@JsonProperty("question") String question) {
}
