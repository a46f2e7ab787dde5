package org.javai.symbolic.mapper;

/**
 * Handler a {@link Mapper} invokes for one node kind.
 *
 * @param <E> the node type handled
 * @param <A> the extra argument threaded through the traversal
 * @param <R> the result type
 */
@FunctionalInterface
public interface MapperMethod<E, A, R> {

	R map(E expression, A arg);
}
