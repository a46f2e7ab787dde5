package org.javai.symbolic.expr;

/**
 * {@code shiftee << shift}
 */
@ExpressionKind("left_shift")
public final class LeftShift extends ShiftOperator {

	public LeftShift(Object shiftee, Object shift) {
		super(shiftee, shift);
	}
}
