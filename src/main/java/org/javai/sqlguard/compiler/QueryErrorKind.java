package org.javai.sqlguard.compiler;

/**
 * Failure classes a compilation can end in.
 */
public enum QueryErrorKind {

	/** The generation service did not answer within the generation timeout. */
	DECODER_TIMEOUT,
	/** A candidate failed validation. Recoverable by retry; never the final outcome of a request. */
	GRAMMAR_REJECTED,
	/** Every allowed attempt produced a candidate the validator rejected. */
	INTERNAL_INVARIANT_VIOLATION,
	/** The engine failed while running a valid query. */
	EXECUTION_ERROR,
	/** The question cannot be expressed in the supported language. */
	UNSUPPORTED_QUESTION,
	/** The generation service declined to produce a query. */
	REFUSED,
	/** The generation service could not be reached or answered with something unusable. */
	GENERATION_FAILED,
	/** The caller abandoned the request. */
	CANCELLED
}
