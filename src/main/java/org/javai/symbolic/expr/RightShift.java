package org.javai.symbolic.expr;

/**
 * {@code shiftee >> shift}
 */
@ExpressionKind("right_shift")
public final class RightShift extends ShiftOperator {

	public RightShift(Object shiftee, Object shift) {
		super(shiftee, shift);
	}
}
