package org.javai.symbolic.expr;

import java.util.List;

/**
 * A product of its children, {@code a*b*...}. The order of factors is preserved.
 */
@ExpressionKind("product")
public final class Product extends MultiChildExpression {

	public Product(List<?> children) {
		super(children);
	}
}
