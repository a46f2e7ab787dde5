package org.javai.symbolic.expr;

import java.util.List;

/**
 * Marks its child as a subexpression whose value should be computed once and reused.
 * <p>
 * Sharing is by object identity: every reference to the same {@code CommonSubexpression}
 * object denotes the same shared value. Two separately built wrappers around equal
 * children are equal as values but are distinct subexpressions to the caching layer and
 * to the CSE-splitting renderer.
 * <p>
 * A list or array child is copied like any other operand, but the marker remembers the
 * object it was given: markers built around the same list or array object share one
 * value even though each holds its own copy.
 */
@ExpressionKind("common_subexpression")
public final class CommonSubexpression extends Expression {

	private final Object child;
	private final Object identity;
	private final String prefix;
	private final CseScope scope;

	public CommonSubexpression(Object child) {
		this(child, null, CseScope.EVALUATION);
	}

	public CommonSubexpression(Object child, String prefix) {
		this(child, prefix, CseScope.EVALUATION);
	}

	/**
	 * @param prefix preferred name stem when the subexpression is given a name, or {@code null}
	 * @param scope how long a computed value may be reused
	 */
	public CommonSubexpression(Object child, String prefix, CseScope scope) {
		this.child = requireOperand(child, "CommonSubexpression", "child");
		this.identity = child;
		if (prefix != null && prefix.isBlank()) {
			throw new MalformedExpressionException("CommonSubexpression: prefix must not be blank");
		}
		if (scope == null) {
			throw new MalformedExpressionException("CommonSubexpression: scope must not be null");
		}
		this.prefix = prefix;
		this.scope = scope;
	}

	public Object child() {
		return child;
	}

	/**
	 * The object this marker was built around, whose identity decides which markers share
	 * a value. For an expression or constant this is {@link #child()} itself; for a list or
	 * array it is the caller's object rather than the stored copy.
	 */
	public Object identity() {
		return identity;
	}

	public String prefix() {
		return prefix;
	}

	public CseScope scope() {
		return scope;
	}

	@Override
	public List<Object> children() {
		return childList(child, prefix, scope);
	}
}
