package org.javai.symbolic.expr;

import org.javai.symbolic.SymbolicException;

/**
 * Thrown when an expression cannot be constructed because its children violate the
 * arity or operand rules of its kind. No partially built node is ever returned.
 */
public class MalformedExpressionException extends SymbolicException {

	public MalformedExpressionException(String message) {
		super(message);
	}

	public MalformedExpressionException(String message, Throwable cause) {
		super(message, cause);
	}
}
