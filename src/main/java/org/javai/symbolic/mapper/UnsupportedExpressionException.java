package org.javai.symbolic.mapper;

import org.javai.symbolic.SymbolicException;

/**
 * Thrown when a mapper has no handler for the kind of value it was asked to map.
 */
public class UnsupportedExpressionException extends SymbolicException {

	private final String kind;

	public UnsupportedExpressionException(Class<?> mapperType, String kind) {
		super(mapperType.getSimpleName() + " cannot handle expressions of kind '" + kind + "'");
		this.kind = kind;
	}

	/**
	 * @return the dispatch key (or foreign category) that had no handler
	 */
	public String kind() {
		return kind;
	}
}
