package org.javai.symbolic.expr;

import java.util.List;

/**
 * Attribute access, {@code aggregate.name}.
 */
@ExpressionKind("lookup")
public final class Lookup extends Expression {

	private final Object aggregate;
	private final String name;

	public Lookup(Object aggregate, String name) {
		this.aggregate = requireOperand(aggregate, "Lookup", "aggregate");
		this.name = requireName(name, "Lookup", "name");
	}

	public Object aggregate() {
		return aggregate;
	}

	public String name() {
		return name;
	}

	@Override
	public List<Object> children() {
		return childList(aggregate, name);
	}
}
