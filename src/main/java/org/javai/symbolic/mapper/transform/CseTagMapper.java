package org.javai.symbolic.mapper.transform;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.CseScope;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.ExpressionKinds;
import org.javai.symbolic.expr.NaN;
import org.javai.symbolic.expr.Slice;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.IdentityMapper;
import org.javai.symbolic.mapper.MapperMethod;

/**
 * Wraps every composite subexpression that a {@link CseWalkMapper} saw more than once in
 * a {@link CommonSubexpression}. Variables, NaN, slices and existing markers are left
 * alone. All occurrences of equal subexpressions are replaced by the same marker object,
 * so a caching mapper computes them once.
 *
 * <pre>
 * Object tagged = CseTagMapper.tagCommonSubexpressions(tree);
 * </pre>
 */
public class CseTagMapper extends IdentityMapper<Void> {

	private static final Set<String> UNTAGGED_KINDS = Set.of(
			ExpressionKinds.keyOf(Variable.class),
			ExpressionKinds.keyOf(NaN.class),
			ExpressionKinds.keyOf(Slice.class),
			ExpressionKinds.keyOf(CommonSubexpression.class));

	private final CseWalkMapper walkMapper;
	private final Map<Expression, CommonSubexpression> markers = new HashMap<>();

	public CseTagMapper(CseWalkMapper walkMapper) {
		if (walkMapper == null) {
			throw new IllegalArgumentException("walkMapper must not be null");
		}
		this.walkMapper = walkMapper;
		for (String key : registeredKeys()) {
			if (!UNTAGGED_KINDS.contains(key)) {
				MapperMethod<Expression, Void, Object> rebuild = handler(key);
				register(key, (expression, arg) -> tagIfRepeated(expression, arg, rebuild));
			}
		}
	}

	/**
	 * Counts the subexpressions of {@code expression} and tags the repeated ones.
	 */
	public static Object tagCommonSubexpressions(Object expression) {
		CseWalkMapper walker = new CseWalkMapper();
		walker.apply(expression);
		return new CseTagMapper(walker).apply(expression);
	}

	private Object tagIfRepeated(Expression expression, Void arg, MapperMethod<Expression, Void, Object> rebuild) {
		if (walkMapper.occurrences(expression) < 2) {
			return rebuild.map(expression, arg);
		}
		CommonSubexpression marker = markers.get(expression);
		if (marker == null) {
			marker = new CommonSubexpression(rebuild.map(expression, arg), null, CseScope.EVALUATION);
			markers.put(expression, marker);
		}
		return marker;
	}
}
