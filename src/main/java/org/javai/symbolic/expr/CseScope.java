package org.javai.symbolic.expr;

/**
 * Lifetime of the saved value of a {@link CommonSubexpression}.
 */
public enum CseScope {

	/** Lives for one evaluation of the enclosing expression. */
	EVALUATION,

	/** Lives as long as the enclosing expression, across evaluations. */
	EXPRESSION,

	/** Lives until the execution context is discarded. */
	GLOBAL
}
