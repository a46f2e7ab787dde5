package org.javai.symbolic.mapper.stringifier;

/**
 * Precedence level and associativity of one operator kind.
 */
public record OperatorPrecedence(int level, Associativity associativity) {

	public OperatorPrecedence {
		if (associativity == null) {
			throw new IllegalArgumentException("associativity must not be null");
		}
	}
}
