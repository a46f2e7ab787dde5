package org.javai.symbolic.mapper;

/**
 * Runs a {@link Mapper} so that each {@link org.javai.symbolic.expr.CommonSubexpression}
 * marker is computed once per child object, scope and argument.
 * <p>
 * Values other than markers are mapped exactly as the wrapped mapper maps them. By default
 * every call to {@link #apply} starts with an empty cache; a wrapper created with
 * {@link #sharing(Mapper, CseCache)} keeps reusing the given cache across calls.
 *
 * <pre>
 * CseCachingMapper&lt;Void, Object&gt; evaluator = CseCachingMapper.wrap(new EvaluationMapper(context));
 * Object value = evaluator.apply(tree);
 * </pre>
 *
 * @param <A> the extra argument type of the wrapped mapper
 * @param <R> the result type of the wrapped mapper
 */
public final class CseCachingMapper<A, R> {

	private final Mapper<A, R> mapper;
	private final CseCache sharedCache;
	private CseCache lastCache;

	private CseCachingMapper(Mapper<A, R> mapper, CseCache sharedCache) {
		if (mapper == null) {
			throw new IllegalArgumentException("mapper must not be null");
		}
		this.mapper = mapper;
		this.sharedCache = sharedCache;
	}

	/**
	 * Wraps {@code mapper} with a fresh cache per top-level call.
	 */
	public static <A, R> CseCachingMapper<A, R> wrap(Mapper<A, R> mapper) {
		return new CseCachingMapper<>(mapper, null);
	}

	/**
	 * Wraps {@code mapper} so that all calls share {@code cache}.
	 */
	public static <A, R> CseCachingMapper<A, R> sharing(Mapper<A, R> mapper, CseCache cache) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		return new CseCachingMapper<>(mapper, cache);
	}

	public R apply(Object value) {
		return apply(value, mapper.defaultArgument());
	}

	public R apply(Object value, A arg) {
		CseCache cache = sharedCache != null ? sharedCache : new CseCache();
		CseCache previous = mapper.activeCache;
		mapper.activeCache = cache;
		try {
			return mapper.apply(value, arg);
		} finally {
			mapper.activeCache = previous;
			lastCache = cache;
		}
	}

	public Mapper<A, R> mapper() {
		return mapper;
	}

	/**
	 * @return the cache used by the most recent call, or {@code null} before the first call
	 */
	public CseCache lastCache() {
		return lastCache;
	}
}
