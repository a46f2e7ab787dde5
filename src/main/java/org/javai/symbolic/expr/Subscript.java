package org.javai.symbolic.expr;

import java.util.List;

/**
 * Indexing, {@code aggregate[index]}. A list index denotes a multi-dimensional index
 * {@code aggregate[i, j]}.
 */
@ExpressionKind("subscript")
public final class Subscript extends Expression {

	private final Object aggregate;
	private final Object index;

	public Subscript(Object aggregate, Object index) {
		this.aggregate = requireOperand(aggregate, "Subscript", "aggregate");
		this.index = requireOperand(index, "Subscript", "index");
	}

	public Object aggregate() {
		return aggregate;
	}

	public Object index() {
		return index;
	}

	@Override
	public List<Object> children() {
		return childList(aggregate, index);
	}
}
