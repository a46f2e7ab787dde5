package org.javai.symbolic.expr;

/**
 * Remainder of floor division, {@code numerator % denominator}.
 */
@ExpressionKind("remainder")
public final class Remainder extends QuotientBase {

	public Remainder(Object numerator, Object denominator) {
		super(numerator, denominator);
	}
}
