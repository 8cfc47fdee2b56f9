package org.javai.sqlguard.eval;

import java.util.List;

/**
 * The cases of one suite as loaded from a corpus file.
 */
public record EvaluationCorpus(String suite, String description, List<EvaluationCase> cases) {

	public EvaluationCorpus {
		cases = cases != null ? List.copyOf(cases) : List.of();
	}
}
