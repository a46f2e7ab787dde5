package org.javai.symbolic.expr;

import java.util.List;

/**
 * Base for the division-like operators.
 */
public abstract class QuotientBase extends Expression {

	private final Object numerator;
	private final Object denominator;

	protected QuotientBase(Object numerator, Object denominator) {
		String kind = getClass().getSimpleName();
		this.numerator = requireOperand(numerator, kind, "numerator");
		this.denominator = requireOperand(denominator, kind, "denominator");
	}

	public Object numerator() {
		return numerator;
	}

	public Object denominator() {
		return denominator;
	}

	@Override
	public List<Object> children() {
		return childList(numerator, denominator);
	}
}
