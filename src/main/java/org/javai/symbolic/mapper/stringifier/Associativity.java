package org.javai.symbolic.mapper.stringifier;

/**
 * How operands of equal precedence group.
 */
public enum Associativity {

	/** Nested operators of the same kind render as one flat chain, e.g. {@code a + b + c}. */
	ASSOCIATIVE,

	/** The left operand may have equal precedence, the right one is parenthesized. */
	LEFT,

	/** The right operand may have equal precedence, the left one is parenthesized. */
	RIGHT,

	/** Every operand of equal precedence is parenthesized. */
	NONE
}
