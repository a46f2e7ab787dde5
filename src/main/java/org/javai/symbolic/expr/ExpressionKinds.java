package org.javai.symbolic.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the dispatch keys declared with {@link ExpressionKind}.
 * <p>
 * The <em>lineage</em> of a class is its own key followed by the keys of its annotated
 * ancestors, nearest first. Mappers try the keys in that order, which lets a
 * specialised kind fall back to the handler of the kind it extends.
 */
public final class ExpressionKinds {

	private static final Map<String, Class<?>> declarations = new ConcurrentHashMap<>();

	private static final ClassValue<List<String>> lineages = new ClassValue<>() {
		@Override
		protected List<String> computeValue(Class<?> type) {
			return computeLineage(type);
		}
	};

	private ExpressionKinds() {
	}

	/**
	 * Returns the dispatch key of the given expression class.
	 *
	 * @throws MalformedExpressionException if neither the class nor an ancestor declares a
	 * key, or if the declared key is already taken by another class
	 */
	public static String keyOf(Class<? extends Expression> type) {
		return lineage(type).get(0);
	}

	/**
	 * Returns the keys to try, in order, when dispatching an instance of {@code type}.
	 */
	public static List<String> lineage(Class<? extends Expression> type) {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		return lineages.get(type);
	}

	/**
	 * Returns the class that declared {@code key}, if any class using it has been resolved.
	 */
	public static Optional<Class<?>> declaringClass(String key) {
		return Optional.ofNullable(declarations.get(key));
	}

	private static List<String> computeLineage(Class<?> type) {
		List<String> keys = new ArrayList<>();
		for (Class<?> c = type; c != null && c != Expression.class; c = c.getSuperclass()) {
			ExpressionKind kind = c.getDeclaredAnnotation(ExpressionKind.class);
			if (kind == null) {
				continue;
			}
			String key = kind.value();
			if (key == null || key.isBlank()) {
				throw new MalformedExpressionException(c.getName() + " declares a blank dispatch key");
			}
			Class<?> owner = declarations.putIfAbsent(key, c);
			if (owner != null && owner != c) {
				throw new MalformedExpressionException("Dispatch key '" + key + "' of " + c.getName()
						+ " is already declared by " + owner.getName());
			}
			keys.add(key);
		}
		if (keys.isEmpty()) {
			throw new MalformedExpressionException(type.getName()
					+ " declares no dispatch key; annotate it with @" + ExpressionKind.class.getSimpleName());
		}
		return List.copyOf(keys);
	}
}
