package org.javai.symbolic.expr;

import java.util.List;

/**
 * A deferred substitution: {@code child} with each of {@code variables} replaced by the
 * value at the same position in {@code values}.
 */
@ExpressionKind("substitution")
public final class Substitution extends Expression {

	private final Object child;
	private final List<String> variables;
	private final List<Object> values;

	public Substitution(Object child, List<String> variables, List<?> values) {
		this.child = requireOperand(child, "Substitution", "child");
		if (variables == null || values == null) {
			throw new MalformedExpressionException("Substitution: variables and values must not be null");
		}
		if (variables.size() != values.size()) {
			throw new MalformedExpressionException("Substitution: " + variables.size() + " variables but "
					+ values.size() + " values");
		}
		for (String name : variables) {
			requireName(name, "Substitution", "variable name");
		}
		this.variables = List.copyOf(variables);
		this.values = requireOperands(values, "Substitution", "values", 0);
	}

	public Object child() {
		return child;
	}

	public List<String> variables() {
		return variables;
	}

	public List<Object> values() {
		return values;
	}

	@Override
	public List<Object> children() {
		return childList(child, variables, values);
	}
}
