package org.javai.symbolic.mapper.transform;

import java.util.HashMap;
import java.util.Map;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.mapper.WalkMapper;

/**
 * Counts how often each subexpression occurs in a tree, comparing by value. Feeds
 * {@link CseTagMapper}.
 */
public class CseWalkMapper extends WalkMapper<Void> {

	private final Map<Expression, Integer> histogram = new HashMap<>();

	@Override
	protected boolean visit(Object value, Void arg) {
		if (value instanceof Expression expression) {
			histogram.merge(expression, 1, Integer::sum);
		}
		return true;
	}

	/**
	 * @return the number of times {@code expression}, or an expression equal to it, was visited
	 */
	public int occurrences(Expression expression) {
		return histogram.getOrDefault(expression, 0);
	}

	public Map<Expression, Integer> histogram() {
		return Map.copyOf(histogram);
	}
}
