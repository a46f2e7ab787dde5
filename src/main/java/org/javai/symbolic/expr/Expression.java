package org.javai.symbolic.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.symbolic.SymbolicException;
import org.javai.symbolic.mapper.ExpressionDepthExceededException;
import org.javai.symbolic.mapper.stringifier.StringifyMapper;

/**
 * Superclass of all expression tree nodes.
 * <p>
 * Expressions are immutable and never simplify themselves: whatever structure is built
 * is kept until a mapper produces a new tree. Equality and hashing are structural,
 * defined by the concrete class and the deep contents of {@link #children()}, so two
 * separately constructed trees of the same shape are interchangeable as map keys. The
 * hash is computed once per node object. Hashing and comparison use an explicit work
 * stack, so they work on trees of any depth.
 * <p>
 * A node may be shared by several parents; trees must not contain cycles.
 * <p>
 * To add a kind, subclass this class, annotate it with {@link ExpressionKind}, validate
 * the children in the constructor and implement {@link #children()}. Mappers that should
 * understand the new kind register a handler for its key; nothing else changes.
 */
public abstract class Expression {

	private final String dispatchKey;
	private int hash;
	private boolean hashIsZero;

	protected Expression() {
		this.dispatchKey = ExpressionKinds.keyOf(getClass());
	}

	/**
	 * Key under which mappers look up the handler for this node.
	 */
	public final String dispatchKey() {
		return dispatchKey;
	}

	/**
	 * The constructor arguments of this node, in order: operands, operand lists and
	 * attribute values such as names or operator symbols. The list is unmodifiable.
	 */
	public abstract List<Object> children();

	// Builders. None of these simplify.

	public Sum plus(Object other) {
		return new Sum(Arrays.asList(this, other));
	}

	public Sum minus(Object other) {
		return new Sum(Arrays.asList(this, new Product(Arrays.asList(-1, other))));
	}

	public Product times(Object other) {
		return new Product(Arrays.asList(this, other));
	}

	public Quotient dividedBy(Object other) {
		return new Quotient(this, other);
	}

	public FloorDiv floorDiv(Object other) {
		return new FloorDiv(this, other);
	}

	public Remainder mod(Object other) {
		return new Remainder(this, other);
	}

	public Power pow(Object exponent) {
		return new Power(this, exponent);
	}

	public Product negate() {
		return new Product(Arrays.asList(-1, this));
	}

	public Call call(Object... parameters) {
		return new Call(this, Arrays.asList(parameters));
	}

	public Subscript index(Object index) {
		return new Subscript(this, index);
	}

	public Lookup attr(String name) {
		return new Lookup(this, name);
	}

	public Comparison eq(Object other) {
		return new Comparison(this, "==", other);
	}

	public Comparison ne(Object other) {
		return new Comparison(this, "!=", other);
	}

	public Comparison lt(Object other) {
		return new Comparison(this, "<", other);
	}

	public Comparison le(Object other) {
		return new Comparison(this, "<=", other);
	}

	public Comparison gt(Object other) {
		return new Comparison(this, ">", other);
	}

	public Comparison ge(Object other) {
		return new Comparison(this, ">=", other);
	}

	public LogicalAnd and(Object other) {
		return new LogicalAnd(Arrays.asList(this, other));
	}

	public LogicalOr or(Object other) {
		return new LogicalOr(Arrays.asList(this, other));
	}

	public LogicalNot not() {
		return new LogicalNot(this);
	}

	@Override
	public final boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || o.getClass() != getClass() || hashCode() != o.hashCode()) {
			return false;
		}
		Deque<Object[]> pending = new ArrayDeque<>();
		pending.push(new Object[] { children(), ((Expression) o).children() });
		while (!pending.isEmpty()) {
			Object[] pair = pending.pop();
			if (!matchShallow(pair[0], pair[1], pending)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public final int hashCode() {
		if (!isHashed()) {
			computeHashes(this);
		}
		return hash;
	}

	/**
	 * Renders this node with {@link StringifyMapper}. Kinds the default renderer does not
	 * know are shown as their class name and children.
	 */
	@Override
	public String toString() {
		try {
			return StringifyMapper.render(this);
		} catch (ExpressionDepthExceededException e) {
			return getClass().getSimpleName() + "[nested deeper than " + e.maxDepth() + " levels]";
		} catch (SymbolicException e) {
			return getClass().getSimpleName() + children();
		}
	}

	// Validation helpers for subclass constructors.

	/**
	 * Checks that {@code value} is an expression, a registered constant, a list or an array.
	 * Lists are copied into unmodifiable lists and object arrays are cloned.
	 */
	protected static Object requireOperand(Object value, String kind, String role) {
		if (value == null) {
			throw new MalformedExpressionException(kind + ": " + role + " must not be null");
		}
		if (!ForeignValues.isValidOperand(value)) {
			throw new MalformedExpressionException(kind + ": " + role + " has unsupported type "
					+ value.getClass().getName() + " (" + value + ")");
		}
		if (value instanceof List<?> list) {
			return Collections.unmodifiableList(new ArrayList<>(list));
		}
		if (value instanceof Object[] array) {
			return array.clone();
		}
		return value;
	}

	/**
	 * Validates every element with {@link #requireOperand} and returns an unmodifiable copy.
	 */
	protected static List<Object> requireOperands(List<?> values, String kind, String role, int minimum) {
		if (values == null) {
			throw new MalformedExpressionException(kind + ": " + role + " must not be null");
		}
		if (values.size() < minimum) {
			throw new MalformedExpressionException(kind + " requires at least " + minimum + " " + role
					+ " but got " + values.size());
		}
		List<Object> copy = new ArrayList<>(values.size());
		for (int i = 0; i < values.size(); i++) {
			copy.add(requireOperand(values.get(i), kind, role + "[" + i + "]"));
		}
		return Collections.unmodifiableList(copy);
	}

	protected static Expression requireExpression(Object value, String kind, String role) {
		if (!(value instanceof Expression)) {
			throw new MalformedExpressionException(kind + ": " + role + " must be an expression but was " + value);
		}
		return (Expression) value;
	}

	protected static String requireName(String name, String kind, String role) {
		if (name == null || name.isBlank()) {
			throw new MalformedExpressionException(kind + ": " + role + " must not be blank");
		}
		return name;
	}

	/**
	 * Builds the value returned by {@link #children()}; {@code null} entries are allowed.
	 */
	protected static List<Object> childList(Object... values) {
		return Collections.unmodifiableList(Arrays.asList(values));
	}

	private boolean isHashed() {
		return hash != 0 || hashIsZero;
	}

	/**
	 * Hashes {@code root} and every node below it that has no hash yet, children before
	 * parents.
	 */
	private static void computeHashes(Expression root) {
		Deque<Expression> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			Expression node = stack.peek();
			if (node.isHashed()) {
				stack.pop();
				continue;
			}
			int size = stack.size();
			pushUnhashed(node.children(), stack);
			if (stack.size() == size) {
				int h = 31 * node.dispatchKey.hashCode() + deepHash(node.children());
				if (h == 0) {
					node.hashIsZero = true;
				} else {
					node.hash = h;
				}
				stack.pop();
			}
		}
	}

	private static void pushUnhashed(Object value, Deque<Expression> stack) {
		if (value instanceof Expression expression) {
			if (!expression.isHashed()) {
				stack.push(expression);
			}
		} else if (value instanceof List<?> list) {
			for (Object element : list) {
				pushUnhashed(element, stack);
			}
		} else if (value instanceof Object[] array) {
			for (Object element : array) {
				pushUnhashed(element, stack);
			}
		}
	}

	/**
	 * Compares one pair of values without descending into nested expressions, lists or
	 * arrays; their element pairs are pushed onto {@code pending} instead.
	 */
	private static boolean matchShallow(Object a, Object b, Deque<Object[]> pending) {
		if (a == b) {
			return true;
		}
		if (a instanceof Expression left && b instanceof Expression right) {
			if (left.getClass() != right.getClass() || left.hashCode() != right.hashCode()) {
				return false;
			}
			pending.push(new Object[] { left.children(), right.children() });
			return true;
		}
		if (a instanceof List<?> left && b instanceof List<?> right) {
			if (left.size() != right.size()) {
				return false;
			}
			for (int i = 0; i < left.size(); i++) {
				pending.push(new Object[] { left.get(i), right.get(i) });
			}
			return true;
		}
		if (a instanceof Object[] left && b instanceof Object[] right) {
			if (left.length != right.length) {
				return false;
			}
			for (int i = 0; i < left.length; i++) {
				pending.push(new Object[] { left[i], right[i] });
			}
			return true;
		}
		return Objects.deepEquals(a, b);
	}

	/**
	 * Hash of a child value. Nested expressions contribute their memoized hash.
	 */
	static int deepHash(Object value) {
		if (value instanceof List<?> list) {
			int h = 1;
			for (Object element : list) {
				h = 31 * h + deepHash(element);
			}
			return h;
		}
		if (value instanceof Object[] array) {
			int h = 1;
			for (Object element : array) {
				h = 31 * h + deepHash(element);
			}
			return h;
		}
		if (value != null && value.getClass().isArray()) {
			return Arrays.deepHashCode(new Object[] { value });
		}
		return Objects.hashCode(value);
	}
}
