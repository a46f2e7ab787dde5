package org.javai.symbolic.mapper;

import java.lang.reflect.Array;
import java.util.List;
import org.javai.symbolic.expr.Expression;

/**
 * Visits every node, sequence, array and constant of a tree in pre-order, calling
 * {@link #visit} before the operands and {@link #postVisit} after them. Returning
 * {@code false} from {@code visit} skips the operands and the post-visit of that value.
 * <p>
 * A node object shared by several parents is visited once per occurrence.
 *
 * @param <A> the extra argument type
 */
public class WalkMapper<A> extends Mapper<A, Void> {

	public WalkMapper() {
		for (Class<? extends Expression> kind : Operands.COMPOSITE_KINDS) {
			register(kind, this::walkOperands);
		}
		for (Class<? extends Expression> kind : Operands.LEAF_KINDS) {
			register(kind, this::walkOperands);
		}
	}

	/**
	 * @return {@code false} to skip the operands of {@code value}
	 */
	protected boolean visit(Object value, A arg) {
		return true;
	}

	protected void postVisit(Object value, A arg) {
	}

	protected Void walkOperands(Expression expression, A arg) {
		if (!visit(expression, arg)) {
			return null;
		}
		for (Object operand : Operands.of(expression)) {
			rec(operand, arg);
		}
		postVisit(expression, arg);
		return null;
	}

	@Override
	protected Void mapConstant(Object value, A arg) {
		if (visit(value, arg)) {
			postVisit(value, arg);
		}
		return null;
	}

	@Override
	protected Void mapSequence(List<?> value, A arg) {
		if (!visit(value, arg)) {
			return null;
		}
		for (Object element : value) {
			rec(element, arg);
		}
		postVisit(value, arg);
		return null;
	}

	@Override
	protected Void mapArray(Object value, A arg) {
		if (!visit(value, arg)) {
			return null;
		}
		int length = Array.getLength(value);
		for (int i = 0; i < length; i++) {
			rec(Array.get(value, i), arg);
		}
		postVisit(value, arg);
		return null;
	}
}
