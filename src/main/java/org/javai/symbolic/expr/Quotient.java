package org.javai.symbolic.expr;

/**
 * True division, {@code numerator / denominator}.
 */
@ExpressionKind("quotient")
public final class Quotient extends QuotientBase {

	public Quotient(Object numerator, Object denominator) {
		super(numerator, denominator);
	}
}
