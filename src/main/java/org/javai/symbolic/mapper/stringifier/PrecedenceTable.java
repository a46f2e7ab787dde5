package org.javai.symbolic.mapper.stringifier;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from dispatch key to {@link OperatorPrecedence}.
 * <p>
 * {@link #defaults()} covers the built-in operators; {@link #with} adds or replaces an
 * entry, which is how user-defined operators join the parenthesization rules.
 */
public final class PrecedenceTable {

	private static final PrecedenceTable DEFAULTS = createDefaults();

	private final Map<String, OperatorPrecedence> entries;

	private PrecedenceTable(Map<String, OperatorPrecedence> entries) {
		this.entries = Map.copyOf(entries);
	}

	public static PrecedenceTable defaults() {
		return DEFAULTS;
	}

	/**
	 * Returns a copy of this table with {@code key} mapped to the given level and
	 * associativity.
	 */
	public PrecedenceTable with(String key, int level, Associativity associativity) {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("key must not be blank");
		}
		Map<String, OperatorPrecedence> copy = new HashMap<>(entries);
		copy.put(key, new OperatorPrecedence(level, associativity));
		return new PrecedenceTable(copy);
	}

	public Optional<OperatorPrecedence> find(String key) {
		return Optional.ofNullable(entries.get(key));
	}

	/**
	 * @throws IllegalArgumentException if {@code key} has no entry
	 */
	public OperatorPrecedence get(String key) {
		OperatorPrecedence precedence = entries.get(key);
		if (precedence == null) {
			throw new IllegalArgumentException("No precedence defined for '" + key + "'");
		}
		return precedence;
	}

	public int level(String key) {
		return get(key).level();
	}

	private static PrecedenceTable createDefaults() {
		Map<String, OperatorPrecedence> map = new HashMap<>();
		put(map, "call", Precedence.CALL, Associativity.LEFT);
		put(map, "call_with_kwargs", Precedence.CALL, Associativity.LEFT);
		put(map, "subscript", Precedence.CALL, Associativity.LEFT);
		put(map, "lookup", Precedence.CALL, Associativity.LEFT);
		put(map, "power", Precedence.POWER, Associativity.RIGHT);
		put(map, "bitwise_not", Precedence.UNARY, Associativity.RIGHT);
		put(map, "product", Precedence.PRODUCT, Associativity.ASSOCIATIVE);
		put(map, "quotient", Precedence.PRODUCT, Associativity.NONE);
		put(map, "floor_div", Precedence.PRODUCT, Associativity.NONE);
		put(map, "remainder", Precedence.PRODUCT, Associativity.NONE);
		put(map, "derivative", Precedence.PRODUCT, Associativity.RIGHT);
		put(map, "sum", Precedence.SUM, Associativity.ASSOCIATIVE);
		put(map, "left_shift", Precedence.SHIFT, Associativity.NONE);
		put(map, "right_shift", Precedence.SHIFT, Associativity.NONE);
		put(map, "bitwise_and", Precedence.BITWISE_AND, Associativity.ASSOCIATIVE);
		put(map, "bitwise_xor", Precedence.BITWISE_XOR, Associativity.ASSOCIATIVE);
		put(map, "bitwise_or", Precedence.BITWISE_OR, Associativity.ASSOCIATIVE);
		put(map, "comparison", Precedence.COMPARISON, Associativity.NONE);
		put(map, "logical_not", Precedence.UNARY, Associativity.RIGHT);
		put(map, "logical_and", Precedence.LOGICAL_AND, Associativity.ASSOCIATIVE);
		put(map, "logical_or", Precedence.LOGICAL_OR, Associativity.ASSOCIATIVE);
		put(map, "if", Precedence.IF, Associativity.NONE);
		return new PrecedenceTable(map);
	}

	private static void put(Map<String, OperatorPrecedence> map, String key, int level, Associativity associativity) {
		map.put(key, new OperatorPrecedence(level, associativity));
	}
}
