package org.javai.symbolic.mapper.stringifier;

/**
 * Where an operand sits relative to its operator.
 */
public enum OperandSide {
	LEFT,
	INNER,
	RIGHT;

	/**
	 * Side of the operand at {@code index} among {@code count} operands. A lone operand
	 * counts as {@link #RIGHT}, as for prefix operators.
	 */
	public static OperandSide of(int index, int count) {
		if (index == count - 1) {
			return RIGHT;
		}
		return index == 0 ? LEFT : INNER;
	}
}
