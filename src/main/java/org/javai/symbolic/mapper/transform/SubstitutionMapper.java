package org.javai.symbolic.mapper.transform;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.Lookup;
import org.javai.symbolic.expr.Subscript;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.IdentityMapper;

/**
 * Replaces variables, subscripts and attribute lookups by the values a substitution
 * function returns for them. Where the function returns {@code null} the node is kept
 * (subscripts and lookups are then searched for replacements inside).
 * <p>
 * Replacement values are inserted as given and are not themselves substituted.
 */
public class SubstitutionMapper extends IdentityMapper<Void> {

	private final Function<Expression, Object> substitutions;

	public SubstitutionMapper(Function<Expression, Object> substitutions) {
		if (substitutions == null) {
			throw new IllegalArgumentException("substitutions must not be null");
		}
		this.substitutions = substitutions;
	}

	/**
	 * Substitutes into {@code expression}. Keys of {@code assignments} are variable names
	 * or expressions; values are any valid operands.
	 */
	public static Object substitute(Object expression, Map<?, ?> assignments) {
		Map<Expression, Object> replacements = new HashMap<>();
		for (Map.Entry<?, ?> entry : assignments.entrySet()) {
			Object key = entry.getKey();
			if (key instanceof String name) {
				replacements.put(new Variable(name), entry.getValue());
			} else if (key instanceof Expression target) {
				replacements.put(target, entry.getValue());
			} else {
				throw new IllegalArgumentException("Substitution keys must be names or expressions but got " + key);
			}
		}
		return new SubstitutionMapper(replacements::get).apply(expression);
	}

	@Override
	protected Object mapVariable(Variable variable, Void arg) {
		Object replacement = substitutions.apply(variable);
		return replacement != null ? replacement : variable;
	}

	@Override
	protected Object mapSubscript(Subscript subscript, Void arg) {
		Object replacement = substitutions.apply(subscript);
		return replacement != null ? replacement : super.mapSubscript(subscript, arg);
	}

	@Override
	protected Object mapLookup(Lookup lookup, Void arg) {
		Object replacement = substitutions.apply(lookup);
		return replacement != null ? replacement : super.mapLookup(lookup, arg);
	}
}
