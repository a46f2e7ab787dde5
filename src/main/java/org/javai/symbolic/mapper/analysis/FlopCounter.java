package org.javai.symbolic.mapper.analysis;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.FloorDiv;
import org.javai.symbolic.expr.MultiChildExpression;
import org.javai.symbolic.expr.NaN;
import org.javai.symbolic.expr.Power;
import org.javai.symbolic.expr.Product;
import org.javai.symbolic.expr.Quotient;
import org.javai.symbolic.expr.Remainder;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.CombineMapper;

/**
 * Counts the arithmetic operations needed to evaluate a tree: {@code n - 1} per n-ary sum
 * or product and one per quotient, floor division, remainder or power.
 * <p>
 * By default a common subexpression is counted wherever it occurs. A counter created
 * with {@link #sharedOnce()} counts each marker object once per call, as a program that
 * computes shared values once would.
 */
public class FlopCounter extends CombineMapper<Void, Integer> {

	private final boolean countSharedOnce;
	private final Set<CommonSubexpression> seen = Collections.newSetFromMap(new IdentityHashMap<>());

	public FlopCounter() {
		this(false);
	}

	private FlopCounter(boolean countSharedOnce) {
		this.countSharedOnce = countSharedOnce;
		register(Variable.class, (variable, arg) -> 0);
		register(NaN.class, (nan, arg) -> 0);
		register(Sum.class, this::countNary);
		register(Product.class, this::countNary);
		register(Quotient.class, this::countBinary);
		register(FloorDiv.class, this::countBinary);
		register(Remainder.class, this::countBinary);
		register(Power.class, this::countBinary);
		register(CommonSubexpression.class, this::countCommonSubexpression);
	}

	public static FlopCounter sharedOnce() {
		return new FlopCounter(true);
	}

	/**
	 * Operation count of {@code expression}, counting shared subexpressions once.
	 */
	public static int count(Object expression) {
		return sharedOnce().apply(expression);
	}

	@Override
	public Integer apply(Object value, Void arg) {
		seen.clear();
		return super.apply(value, arg);
	}

	@Override
	protected Integer combine(List<Integer> values) {
		int total = 0;
		for (Integer value : values) {
			total += value;
		}
		return total;
	}

	@Override
	protected Integer mapConstant(Object value, Void arg) {
		return 0;
	}

	private Integer countNary(MultiChildExpression expression, Void arg) {
		return expression.children().size() - 1 + combineOperands(expression, arg);
	}

	private Integer countBinary(Expression expression, Void arg) {
		return 1 + combineOperands(expression, arg);
	}

	private Integer countCommonSubexpression(CommonSubexpression cse, Void arg) {
		if (countSharedOnce && !seen.add(cse)) {
			return 0;
		}
		return rec(cse.child(), arg);
	}
}
