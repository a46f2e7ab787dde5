package org.javai.symbolic.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static construction helpers.
 */
public final class Expressions {

	private Expressions() {
	}

	public static Variable variable(String name) {
		return new Variable(name);
	}

	/**
	 * Creates one variable per whitespace- or comma-separated name, e.g.
	 * {@code variables("x y z")}.
	 */
	public static List<Variable> variables(String names) {
		if (names == null || names.isBlank()) {
			throw new MalformedExpressionException("variables: no names given");
		}
		List<Variable> result = new ArrayList<>();
		for (String name : names.trim().split("[\\s,]+")) {
			result.add(new Variable(name));
		}
		return List.copyOf(result);
	}

	/**
	 * Builds a sum, splicing the children of any operand that is itself a {@link Sum}.
	 * A single resulting term is returned as is and no terms give {@code 0}.
	 */
	public static Object flattenedSum(Object... terms) {
		List<Object> flat = new ArrayList<>();
		for (Object term : terms) {
			if (term instanceof Sum sum) {
				flat.addAll(sum.children());
			} else {
				flat.add(term);
			}
		}
		if (flat.isEmpty()) {
			return 0;
		}
		return flat.size() == 1 ? flat.get(0) : new Sum(flat);
	}

	/**
	 * Builds a product, splicing the children of any operand that is itself a {@link Product}.
	 * A single resulting factor is returned as is and no factors give {@code 1}.
	 */
	public static Object flattenedProduct(Object... factors) {
		List<Object> flat = new ArrayList<>();
		for (Object factor : factors) {
			if (factor instanceof Product product) {
				flat.addAll(product.children());
			} else {
				flat.add(factor);
			}
		}
		if (flat.isEmpty()) {
			return 1;
		}
		return flat.size() == 1 ? flat.get(0) : new Product(flat);
	}

	public static Sum sum(Object... terms) {
		return new Sum(Arrays.asList(terms));
	}

	public static Product product(Object... factors) {
		return new Product(Arrays.asList(factors));
	}

	/**
	 * Wraps {@code value} in a {@link CommonSubexpression} unless it is already one or is a
	 * leaf whose sharing gains nothing (a variable or a foreign constant).
	 */
	public static Object wrapInCse(Object value, String prefix) {
		if (value instanceof CommonSubexpression || value instanceof Variable) {
			return value;
		}
		if (!(value instanceof Expression)) {
			return value;
		}
		return new CommonSubexpression(value, prefix);
	}

	/**
	 * Wraps {@code value} in a new {@link CommonSubexpression}, whatever it is.
	 */
	public static CommonSubexpression makeCommonSubexpression(Object value, String prefix, CseScope scope) {
		return new CommonSubexpression(value, prefix, scope == null ? CseScope.EVALUATION : scope);
	}
}
