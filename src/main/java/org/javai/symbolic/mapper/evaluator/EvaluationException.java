package org.javai.symbolic.mapper.evaluator;

import org.javai.symbolic.SymbolicException;

/**
 * Thrown when a tree cannot be evaluated, e.g. because an operand has the wrong type.
 */
public class EvaluationException extends SymbolicException {

	public EvaluationException(String message) {
		super(message);
	}

	public EvaluationException(String message, Throwable cause) {
		super(message, cause);
	}
}
