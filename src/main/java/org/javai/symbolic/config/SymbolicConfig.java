package org.javai.symbolic.config;

import java.util.List;

/**
 * Library-wide settings.
 *
 * @param maxDepth deepest recursion a single mapper traversal may reach
 * @param csePrefix name stem for common subexpressions that carry no prefix of their own
 * @param constantClasses fully qualified names of the classes treated as foreign constants
 */
public record SymbolicConfig(int maxDepth, String csePrefix, List<String> constantClasses) {

	public SymbolicConfig {
		if (maxDepth < 1) {
			throw new ConfigurationException("mapper.max-depth must be >= 1 but was " + maxDepth);
		}
		if (csePrefix == null || csePrefix.isBlank()) {
			throw new ConfigurationException("stringify.cse-prefix must not be blank");
		}
		constantClasses = constantClasses != null ? List.copyOf(constantClasses) : List.of();
	}

	/**
	 * Returns the process-wide configuration, loading it on first use.
	 */
	public static SymbolicConfig get() {
		return Holder.INSTANCE;
	}

	public SymbolicConfig withMaxDepth(int maxDepth) {
		return new SymbolicConfig(maxDepth, csePrefix, constantClasses);
	}

	public SymbolicConfig withCsePrefix(String csePrefix) {
		return new SymbolicConfig(maxDepth, csePrefix, constantClasses);
	}

	private static final class Holder {
		private static final SymbolicConfig INSTANCE = new SymbolicConfigLoader().load();
	}
}
