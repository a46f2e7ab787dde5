package org.javai.symbolic;

/**
 * Root of the unchecked exceptions thrown by the expression model and its mappers.
 */
public class SymbolicException extends RuntimeException {

	public SymbolicException(String message) {
		super(message);
	}

	public SymbolicException(String message, Throwable cause) {
		super(message, cause);
	}
}
