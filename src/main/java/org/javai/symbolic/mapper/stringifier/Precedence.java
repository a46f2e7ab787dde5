package org.javai.symbolic.mapper.stringifier;

/**
 * Binding strengths used when rendering, higher binds tighter.
 */
public final class Precedence {

	public static final int CALL = 15;
	public static final int POWER = 14;
	public static final int UNARY = 13;
	public static final int PRODUCT = 12;
	public static final int SUM = 11;
	public static final int SHIFT = 10;
	public static final int BITWISE_AND = 9;
	public static final int BITWISE_XOR = 8;
	public static final int BITWISE_OR = 7;
	public static final int COMPARISON = 6;
	public static final int LOGICAL_AND = 5;
	public static final int LOGICAL_OR = 4;
	public static final int IF = 3;

	/** Enclosing precedence of a position that never needs parentheses. */
	public static final int NONE = 0;

	private Precedence() {
	}
}
