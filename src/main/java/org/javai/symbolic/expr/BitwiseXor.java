package org.javai.symbolic.expr;

import java.util.List;

/**
 * Bitwise exclusive or, {@code a ^ b ^ ...}.
 */
@ExpressionKind("bitwise_xor")
public final class BitwiseXor extends MultiChildExpression {

	public BitwiseXor(List<?> children) {
		super(children);
	}
}
