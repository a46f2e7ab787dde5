package org.javai.symbolic.mapper;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import org.javai.symbolic.expr.Expression;

/**
 * A mapper that maps every operand of a node and folds the results with
 * {@link #combine(List)}.
 * <p>
 * Handlers for all built-in composite kinds are registered. Leaves (variables, NaN and
 * foreign constants) are left to subclasses. Sequences and arrays are combined
 * element-wise.
 *
 * @param <A> the extra argument type
 * @param <R> the result type
 */
public abstract class CombineMapper<A, R> extends Mapper<A, R> {

	protected CombineMapper() {
		for (Class<? extends Expression> kind : Operands.COMPOSITE_KINDS) {
			register(kind, this::combineOperands);
		}
	}

	/**
	 * Folds the results of mapping the operands of one value.
	 */
	protected abstract R combine(List<R> values);

	/**
	 * Maps every operand of {@code expression} and combines the results. Subclasses that
	 * override a handler call this to fall back to the default.
	 */
	protected R combineOperands(Expression expression, A arg) {
		return combineAll(Operands.of(expression), arg);
	}

	protected R combineAll(List<?> values, A arg) {
		List<R> results = new ArrayList<>(values.size());
		for (Object value : values) {
			results.add(rec(value, arg));
		}
		return combine(results);
	}

	@Override
	protected R mapSequence(List<?> value, A arg) {
		return combineAll(value, arg);
	}

	@Override
	protected R mapArray(Object value, A arg) {
		int length = Array.getLength(value);
		List<Object> elements = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			elements.add(Array.get(value, i));
		}
		return combineAll(elements, arg);
	}
}
