package org.javai.symbolic.expr;

/**
 * Division rounded towards negative infinity, {@code numerator // denominator}.
 */
@ExpressionKind("floor_div")
public final class FloorDiv extends QuotientBase {

	public FloorDiv(Object numerator, Object denominator) {
		super(numerator, denominator);
	}
}
