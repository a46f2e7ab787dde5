package org.javai.symbolic.mapper;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.javai.symbolic.expr.NaN;
import org.javai.symbolic.expr.Variable;

/**
 * A {@link CombineMapper} that gathers a set of items from a tree. Constants, variables
 * and NaN contribute nothing unless a subclass says otherwise.
 *
 * @param <A> the extra argument type
 * @param <T> the collected item type
 */
public abstract class Collector<A, T> extends CombineMapper<A, Set<T>> {

	protected Collector() {
		register(Variable.class, this::mapVariable);
		register(NaN.class, (nan, arg) -> new HashSet<>());
	}

	@Override
	protected Set<T> combine(List<Set<T>> values) {
		Set<T> result = new HashSet<>();
		for (Set<T> value : values) {
			result.addAll(value);
		}
		return result;
	}

	protected Set<T> mapVariable(Variable variable, A arg) {
		return new HashSet<>();
	}

	@Override
	protected Set<T> mapConstant(Object value, A arg) {
		return new HashSet<>();
	}
}
