package org.javai.symbolic.mapper;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import org.javai.symbolic.expr.CseScope;

/**
 * Results of common subexpressions computed by one mapper, keyed by the identity of the
 * object the marker was built around ({@link org.javai.symbolic.expr.CommonSubexpression#identity()}),
 * the marker's scope and the traversal argument.
 * <p>
 * A cache belongs to a single mapper and is not synchronized.
 */
public final class CseCache {

	private final Map<Object, Map<Slot, Object>> entries = new IdentityHashMap<>();
	private int hits;
	private int misses;

	boolean contains(Object identity, CseScope scope, Object arg) {
		Map<Slot, Object> slots = entries.get(identity);
		return slots != null && slots.containsKey(new Slot(scope, arg));
	}

	Object get(Object identity, CseScope scope, Object arg) {
		hits++;
		return entries.get(identity).get(new Slot(scope, arg));
	}

	void put(Object identity, CseScope scope, Object arg, Object result) {
		misses++;
		entries.computeIfAbsent(identity, c -> new HashMap<>()).put(new Slot(scope, arg), result);
	}

	public int hits() {
		return hits;
	}

	public int misses() {
		return misses;
	}

	/**
	 * @return the number of cached results
	 */
	public int size() {
		int size = 0;
		for (Map<Slot, Object> slots : entries.values()) {
			size += slots.size();
		}
		return size;
	}

	public void clear() {
		entries.clear();
		hits = 0;
		misses = 0;
	}

	private record Slot(CseScope scope, Object arg) {
	}
}
