package org.javai.symbolic.expr;

import java.util.List;

/**
 * Exponentiation, {@code base**exponent}.
 */
@ExpressionKind("power")
public final class Power extends Expression {

	private final Object base;
	private final Object exponent;

	public Power(Object base, Object exponent) {
		this.base = requireOperand(base, "Power", "base");
		this.exponent = requireOperand(exponent, "Power", "exponent");
	}

	public Object base() {
		return base;
	}

	public Object exponent() {
		return exponent;
	}

	@Override
	public List<Object> children() {
		return childList(base, exponent);
	}
}
