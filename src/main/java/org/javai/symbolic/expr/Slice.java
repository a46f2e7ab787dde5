package org.javai.symbolic.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A slice {@code start:stop:step} for use as a subscript index. Between one and three
 * components; any component may be {@code null} to leave it open.
 * <p>
 * A single component is the stop, two are start and stop.
 */
@ExpressionKind("slice")
public final class Slice extends Expression {

	private final List<Object> children;

	public Slice(List<?> children) {
		if (children == null || children.isEmpty() || children.size() > 3) {
			throw new MalformedExpressionException("Slice requires one to three components but got "
					+ (children == null ? "null" : children.size()));
		}
		List<Object> copy = new ArrayList<>(children.size());
		for (int i = 0; i < children.size(); i++) {
			Object component = children.get(i);
			copy.add(component == null ? null : requireOperand(component, "Slice", "component[" + i + "]"));
		}
		this.children = Collections.unmodifiableList(copy);
	}

	public Object start() {
		return children.size() == 1 ? null : children.get(0);
	}

	public Object stop() {
		return children.size() == 1 ? children.get(0) : children.get(1);
	}

	public Object step() {
		return children.size() == 3 ? children.get(2) : null;
	}

	@Override
	public List<Object> children() {
		return children;
	}
}
