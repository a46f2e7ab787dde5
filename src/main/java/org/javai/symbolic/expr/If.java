package org.javai.symbolic.expr;

import java.util.List;

/**
 * Conditional expression, {@code then if condition else else_}.
 */
@ExpressionKind("if")
public final class If extends Expression {

	private final Object condition;
	private final Object then;
	private final Object else_;

	public If(Object condition, Object then, Object else_) {
		this.condition = requireOperand(condition, "If", "condition");
		this.then = requireOperand(then, "If", "then");
		this.else_ = requireOperand(else_, "If", "else");
	}

	public Object condition() {
		return condition;
	}

	public Object then() {
		return then;
	}

	public Object else_() {
		return else_;
	}

	@Override
	public List<Object> children() {
		return childList(condition, then, else_);
	}
}
