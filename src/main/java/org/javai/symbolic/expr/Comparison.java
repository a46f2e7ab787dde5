package org.javai.symbolic.expr;

import java.util.List;
import java.util.Map;

/**
 * A binary comparison {@code left operator right}.
 * <p>
 * The operator may be given as a symbol ({@code == != < <= > >=}) or by name
 * ({@code eq ne lt le gt ge}); it is stored as the symbol.
 */
@ExpressionKind("comparison")
public final class Comparison extends Expression {

	private static final Map<String, String> NAMED_OPERATORS = Map.of(
			"eq", "==",
			"ne", "!=",
			"lt", "<",
			"le", "<=",
			"gt", ">",
			"ge", ">=");

	private final Object left;
	private final String operator;
	private final Object right;

	public Comparison(Object left, String operator, Object right) {
		this.left = requireOperand(left, "Comparison", "left");
		this.operator = normalize(operator);
		this.right = requireOperand(right, "Comparison", "right");
	}

	public Object left() {
		return left;
	}

	/**
	 * @return the operator symbol, one of {@code == != < <= > >=}
	 */
	public String operator() {
		return operator;
	}

	public Object right() {
		return right;
	}

	@Override
	public List<Object> children() {
		return childList(left, operator, right);
	}

	private static String normalize(String operator) {
		if (operator == null) {
			throw new MalformedExpressionException("Comparison: operator must not be null");
		}
		if (NAMED_OPERATORS.containsValue(operator)) {
			return operator;
		}
		String symbol = NAMED_OPERATORS.get(operator);
		if (symbol == null) {
			throw new MalformedExpressionException("Comparison: unknown operator '" + operator
					+ "'; expected one of == != < <= > >= or eq ne lt le gt ge");
		}
		return symbol;
	}
}
