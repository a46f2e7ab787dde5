package org.javai.symbolic.expr;

import java.util.List;

/**
 * Base for the bit shift operators.
 */
public abstract class ShiftOperator extends Expression {

	private final Object shiftee;
	private final Object shift;

	protected ShiftOperator(Object shiftee, Object shift) {
		String kind = getClass().getSimpleName();
		this.shiftee = requireOperand(shiftee, kind, "shiftee");
		this.shift = requireOperand(shift, kind, "shift");
	}

	public Object shiftee() {
		return shiftee;
	}

	public Object shift() {
		return shift;
	}

	@Override
	public List<Object> children() {
		return childList(shiftee, shift);
	}
}
