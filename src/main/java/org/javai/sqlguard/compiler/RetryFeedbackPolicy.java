package org.javai.sqlguard.compiler;

import org.javai.sqlguard.validate.ValidationResult;

/**
 * What the next generation attempt is told about a rejected candidate.
 */
public enum RetryFeedbackPolicy {

	/** Retry with the original request unchanged. */
	NONE {
		@Override
		public String feedbackFor(ValidationResult.Reject rejection) {
			return null;
		}
	},

	/** Include the rejection position, offending token and expected terminals. */
	DIAGNOSTIC {
		@Override
		public String feedbackFor(ValidationResult.Reject rejection) {
			return rejection.describe() + " (found " + rejection.found() + ")";
		}
	};

	public abstract String feedbackFor(ValidationResult.Reject rejection);
}
