package org.javai.symbolic.expr;

import java.util.List;

/**
 * A function call {@code function(parameters...)}.
 */
@ExpressionKind("call")
public final class Call extends Expression {

	private final Expression function;
	private final List<Object> parameters;

	public Call(Object function, List<?> parameters) {
		this.function = requireExpression(function, "Call", "function");
		this.parameters = requireOperands(parameters, "Call", "parameters", 0);
	}

	public Expression function() {
		return function;
	}

	public List<Object> parameters() {
		return parameters;
	}

	@Override
	public List<Object> children() {
		return childList(function, parameters);
	}
}
