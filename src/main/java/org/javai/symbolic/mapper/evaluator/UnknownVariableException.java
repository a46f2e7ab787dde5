package org.javai.symbolic.mapper.evaluator;

/**
 * Thrown when a variable has no value in the evaluation context.
 */
public class UnknownVariableException extends EvaluationException {

	private final String name;

	public UnknownVariableException(String name) {
		super("Unknown variable '" + name + "'");
		this.name = name;
	}

	public String name() {
		return name;
	}
}
