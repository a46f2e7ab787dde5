package org.javai.symbolic.mapper;

import org.javai.symbolic.SymbolicException;

/**
 * Thrown when a mapper meets a value that is neither an expression nor a recognized
 * foreign value.
 */
public class UnrecognizedForeignValueException extends SymbolicException {

	private final transient Object value;

	public UnrecognizedForeignValueException(Class<?> mapperType, Object value) {
		super(mapperType.getSimpleName() + " cannot map foreign value " + value
				+ (value == null ? "" : " of type " + value.getClass().getName()));
		this.value = value;
	}

	public Object value() {
		return value;
	}
}
