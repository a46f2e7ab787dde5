package org.javai.symbolic.expr;

/**
 * Runtime category of a value embedded in a tree that is not an {@link Expression}.
 */
public enum ForeignCategory {

	/** Instance of a class registered with {@link ForeignValues#register(Class)}. */
	CONSTANT,

	/** A {@link java.util.List}. */
	SEQUENCE,

	/** Any Java array. */
	ARRAY,

	/** Everything else, including {@code null}. */
	UNRECOGNIZED
}
