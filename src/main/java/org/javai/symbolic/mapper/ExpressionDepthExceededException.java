package org.javai.symbolic.mapper;

import org.javai.symbolic.SymbolicException;

/**
 * Thrown when a single traversal recurses deeper than the configured maximum depth.
 */
public class ExpressionDepthExceededException extends SymbolicException {

	private final int maxDepth;

	public ExpressionDepthExceededException(Class<?> mapperType, int maxDepth) {
		super(mapperType.getSimpleName() + " exceeded the maximum recursion depth of " + maxDepth
				+ "; raise symbolic.mapper.max-depth for deeper trees");
		this.maxDepth = maxDepth;
	}

	public int maxDepth() {
		return maxDepth;
	}
}
