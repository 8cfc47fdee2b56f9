package org.javai.sqlguard.compiler;

/**
 * States of a single compilation.
 * <pre>
 * START -> AWAIT_GENERATION -> VALIDATING -> EXECUTING -> DONE
 *                 ^                 |
 *                 +---- RETRY <-----+   (bounded; exhaustion -> FAILED)
 * </pre>
 * Any state may move to FAILED.
 */
public enum CompilerState {

	START,
	AWAIT_GENERATION,
	VALIDATING,
	RETRY,
	EXECUTING,
	DONE,
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
