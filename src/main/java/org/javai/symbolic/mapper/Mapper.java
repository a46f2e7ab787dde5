package org.javai.symbolic.mapper;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.javai.symbolic.config.SymbolicConfig;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.ExpressionKinds;
import org.javai.symbolic.expr.ForeignValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A transformation over expression trees, driven by a table of handlers keyed by
 * dispatch key.
 * <p>
 * Each mapper instance owns its handler table; registering a handler on one mapper never
 * affects another. Handlers recurse explicitly by calling {@link #rec(Object, Object)} on
 * the children they care about, which lets them skip, reorder or treat children
 * differently.
 * <p>
 * Values are routed as follows:
 * <ul>
 * <li>an {@link Expression} goes to the handler registered for its dispatch key, or for
 * the nearest key in its {@linkplain ExpressionKinds#lineage lineage}; without one it goes
 * to {@link #handleUnsupportedExpression}</li>
 * <li>a foreign constant, sequence or array goes to {@link #mapConstant},
 * {@link #mapSequence} or {@link #mapArray}</li>
 * <li>anything else goes to {@link #mapForeign}</li>
 * </ul>
 * A {@link CommonSubexpression} for which no handler is registered is computed by mapping
 * its child. When the mapper runs inside a {@link CseCachingMapper}, results for markers
 * are cached.
 * <p>
 * Mappers keep per-traversal state and must not be used by several threads at once.
 *
 * @param <A> the extra argument passed down the traversal
 * @param <R> the result type
 */
public class Mapper<A, R> {

	private static final Logger logger = LoggerFactory.getLogger(Mapper.class);

	private final Map<String, MapperMethod<Expression, A, R>> handlers = new HashMap<>();
	private final int maxDepth;
	private int depth;

	CseCache activeCache;

	public Mapper() {
		this(SymbolicConfig.get().maxDepth());
	}

	public Mapper(int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be >= 1 but was " + maxDepth);
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * Registers {@code method} for the dispatch key declared by {@code kind}, replacing any
	 * handler already registered for that key.
	 */
	public <E extends Expression> Mapper<A, R> register(Class<E> kind, MapperMethod<? super E, A, R> method) {
		if (kind == null || method == null) {
			throw new IllegalArgumentException("kind and method must not be null");
		}
		return register(ExpressionKinds.keyOf(kind), (expression, arg) -> method.map(kind.cast(expression), arg));
	}

	/**
	 * Registers {@code method} for {@code key}, replacing any handler already registered
	 * for that key.
	 */
	public Mapper<A, R> register(String key, MapperMethod<Expression, A, R> method) {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("key must not be blank");
		}
		if (method == null) {
			throw new IllegalArgumentException("method must not be null");
		}
		if (handlers.put(key, method) != null) {
			logger.debug("{} replaced the handler for '{}'", getClass().getSimpleName(), key);
		}
		return this;
	}

	/**
	 * Returns {@code true} if a handler is registered for exactly this key.
	 */
	public boolean supports(String key) {
		return handlers.containsKey(key);
	}

	/**
	 * @return the keys that have a handler registered on this mapper
	 */
	public Set<String> registeredKeys() {
		return Set.copyOf(handlers.keySet());
	}

	/**
	 * Returns the handler registered for exactly {@code key}, or {@code null}. Subclasses
	 * use this to wrap an inherited handler before registering a replacement.
	 */
	protected MapperMethod<Expression, A, R> handler(String key) {
		return handlers.get(key);
	}

	/**
	 * Maps {@code value} with the mapper's {@linkplain #defaultArgument() default argument}.
	 */
	public R apply(Object value) {
		return apply(value, defaultArgument());
	}

	/**
	 * Top-level entry point. Subclasses holding per-run state reset it here.
	 */
	public R apply(Object value, A arg) {
		return rec(value, arg);
	}

	/**
	 * Recursion entry point for handlers.
	 *
	 * @throws ExpressionDepthExceededException if the traversal is nested deeper than the
	 * configured maximum
	 */
	public final R rec(Object value, A arg) {
		depth++;
		try {
			if (depth > maxDepth) {
				throw new ExpressionDepthExceededException(getClass(), maxDepth);
			}
			return dispatch(value, arg);
		} finally {
			depth--;
		}
	}

	/**
	 * Runs {@code body} with a separate, initially empty cache for common subexpressions
	 * when the mapper runs inside a {@link CseCachingMapper}. Handlers that change what a
	 * marker's value depends on, such as new variable bindings, use this so that values
	 * computed under different conditions are not mixed.
	 */
	protected final R withSeparateCache(Supplier<R> body) {
		CseCache outer = activeCache;
		if (outer == null) {
			return body.get();
		}
		activeCache = new CseCache();
		try {
			return body.get();
		} finally {
			activeCache = outer;
		}
	}

	public int maxDepth() {
		return maxDepth;
	}

	/**
	 * Argument used by {@link #apply(Object)}; {@code null} unless overridden.
	 */
	protected A defaultArgument() {
		return null;
	}

	/**
	 * Called for an expression whose kind has no handler. Throws by default; override to
	 * supply a fallback such as pass-through.
	 */
	protected R handleUnsupportedExpression(Expression expression, A arg) {
		throw new UnsupportedExpressionException(getClass(), expression.dispatchKey());
	}

	protected R mapConstant(Object value, A arg) {
		throw new UnsupportedExpressionException(getClass(), "constant");
	}

	protected R mapSequence(List<?> value, A arg) {
		throw new UnsupportedExpressionException(getClass(), "sequence");
	}

	/**
	 * @param value a Java array, of object or primitive component type
	 */
	protected R mapArray(Object value, A arg) {
		throw new UnsupportedExpressionException(getClass(), "array");
	}

	protected R mapForeign(Object value, A arg) {
		throw new UnrecognizedForeignValueException(getClass(), value);
	}

	private R dispatch(Object value, A arg) {
		if (value instanceof CommonSubexpression cse) {
			return dispatchCommonSubexpression(cse, arg);
		}
		if (value instanceof Expression expression) {
			MapperMethod<Expression, A, R> handler = handlerFor(expression);
			if (handler == null) {
				return handleUnsupportedExpression(expression, arg);
			}
			return handler.map(expression, arg);
		}
		return switch (ForeignValues.categorize(value)) {
			case CONSTANT -> mapConstant(value, arg);
			case SEQUENCE -> mapSequence((List<?>) value, arg);
			case ARRAY -> mapArray(value, arg);
			case UNRECOGNIZED -> mapForeign(value, arg);
		};
	}

	@SuppressWarnings("unchecked")
	private R dispatchCommonSubexpression(CommonSubexpression cse, A arg) {
		CseCache cache = activeCache;
		if (cache == null) {
			return mapCommonSubexpressionUncached(cse, arg, true);
		}
		Object identity = cse.identity();
		if (cache.contains(identity, cse.scope(), arg)) {
			logger.trace("{} reused the cached result for {}", getClass().getSimpleName(), cse);
			return (R) cache.get(identity, cse.scope(), arg);
		}
		// Not computeIfAbsent: computing the result may populate the cache with nested markers.
		R result = mapCommonSubexpressionUncached(cse, arg, false);
		cache.put(identity, cse.scope(), arg, result);
		return result;
	}

	private R mapCommonSubexpressionUncached(CommonSubexpression cse, A arg, boolean outsideCache) {
		MapperMethod<Expression, A, R> handler = handlerFor(cse);
		if (handler != null) {
			return handler.map(cse, arg);
		}
		if (outsideCache && logger.isDebugEnabled()) {
			logger.debug("{} computed a common subexpression without a caching layer; it is not reused",
					getClass().getSimpleName());
		}
		return rec(cse.child(), arg);
	}

	private MapperMethod<Expression, A, R> handlerFor(Expression expression) {
		MapperMethod<Expression, A, R> handler = handlers.get(expression.dispatchKey());
		if (handler != null) {
			return handler;
		}
		for (String key : ExpressionKinds.lineage(expression.getClass())) {
			handler = handlers.get(key);
			if (handler != null) {
				return handler;
			}
		}
		return null;
	}
}
