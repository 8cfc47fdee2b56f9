package org.javai.sqlguard.eval;

import java.util.Objects;
import java.util.Optional;
import org.javai.sqlguard.compiler.QueryCompiler;
import org.javai.sqlguard.execution.ExecutionGateway;
import org.javai.sqlguard.validate.GrammarValidator;

/**
 * What the suites evaluate against.
 *
 * @param compiler the compiler under evaluation
 * @param validator validator used to re-check final candidates independently of the compiler
 * @param referenceGateway gateway on which golden queries are executed; may be {@code null} when
 * no suite needs reference results
 */
public record EvaluationContext(QueryCompiler compiler, GrammarValidator validator, ExecutionGateway referenceGateway) {

	public EvaluationContext {
		Objects.requireNonNull(compiler, "compiler must not be null");
		Objects.requireNonNull(validator, "validator must not be null");
	}

	public Optional<ExecutionGateway> reference() {
		return Optional.ofNullable(referenceGateway);
	}
}
