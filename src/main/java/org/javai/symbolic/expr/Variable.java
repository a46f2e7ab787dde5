package org.javai.symbolic.expr;

import java.util.List;

/**
 * A named leaf, e.g. {@code x}.
 */
@ExpressionKind("variable")
public final class Variable extends Expression {

	private final String name;

	public Variable(String name) {
		this.name = requireName(name, "Variable", "name");
	}

	public String name() {
		return name;
	}

	@Override
	public List<Object> children() {
		return childList(name);
	}
}
