package org.javai.symbolic.mapper.stringifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.symbolic.config.SymbolicConfig;
import org.javai.symbolic.expr.CommonSubexpression;

/**
 * A {@link StringifyMapper} that pulls every common subexpression out into a named
 * assignment and renders the marker as that name.
 * <p>
 * The child of each marker is rendered once. Markers around the same child object share
 * a name. A marker with a prefix is named after it ({@code prefix}, then
 * {@code prefix_2}, ...); one without is numbered after the configured CSE prefix
 * ({@code CSE0}, {@code CSE1}, ...). {@link #assignments()} lists the assignments so that
 * each one only refers to names assigned before it.
 * <p>
 * Names and assignments accumulate across calls until {@link #reset()}.
 */
public class CseSplittingStringifyMapper extends StringifyMapper {

	private final String defaultPrefix;
	private final Map<Object, String> names = new IdentityHashMap<>();
	private final Set<String> usedNames = new HashSet<>();
	private final List<CseAssignment> assignments = new ArrayList<>();
	private int counter;

	public CseSplittingStringifyMapper() {
		this(PrecedenceTable.defaults(), SymbolicConfig.get().csePrefix());
	}

	public CseSplittingStringifyMapper(PrecedenceTable precedences, String defaultPrefix) {
		super(precedences);
		if (defaultPrefix == null || defaultPrefix.isBlank()) {
			throw new IllegalArgumentException("defaultPrefix must not be blank");
		}
		this.defaultPrefix = defaultPrefix;
	}

	/**
	 * A named common subexpression and its rendered definition.
	 */
	public record CseAssignment(String name, String text) {

		@Override
		public String toString() {
			return name + " = " + text;
		}
	}

	public List<CseAssignment> assignments() {
		return List.copyOf(assignments);
	}

	public void reset() {
		names.clear();
		usedNames.clear();
		assignments.clear();
		counter = 0;
	}

	/**
	 * Renders {@code value} and returns the assignments followed by the rendered value,
	 * one per line.
	 */
	public String renderWithAssignments(Object value) {
		String result = apply(value);
		StringBuilder text = new StringBuilder();
		for (CseAssignment assignment : assignments) {
			text.append(assignment).append('\n');
		}
		return text.append(result).toString();
	}

	@Override
	protected String mapCommonSubexpression(CommonSubexpression cse, Integer enclosing) {
		String name = names.get(cse.identity());
		if (name != null) {
			return name;
		}
		String text = rec(cse.child(), Precedence.NONE);
		name = newName(cse.prefix());
		names.put(cse.identity(), name);
		assignments.add(new CseAssignment(name, text));
		return name;
	}

	private String newName(String prefix) {
		if (prefix != null) {
			String name = prefix;
			int suffix = 2;
			while (usedNames.contains(name)) {
				name = prefix + "_" + suffix++;
			}
			usedNames.add(name);
			return name;
		}
		String name;
		do {
			name = defaultPrefix + counter++;
		} while (usedNames.contains(name));
		usedNames.add(name);
		return name;
	}
}
