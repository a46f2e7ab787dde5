package org.javai.symbolic.mapper.evaluator;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import org.javai.symbolic.expr.BitwiseAnd;
import org.javai.symbolic.expr.BitwiseNot;
import org.javai.symbolic.expr.BitwiseOr;
import org.javai.symbolic.expr.BitwiseXor;
import org.javai.symbolic.expr.Call;
import org.javai.symbolic.expr.Comparison;
import org.javai.symbolic.expr.FloorDiv;
import org.javai.symbolic.expr.If;
import org.javai.symbolic.expr.LeftShift;
import org.javai.symbolic.expr.LogicalAnd;
import org.javai.symbolic.expr.LogicalNot;
import org.javai.symbolic.expr.LogicalOr;
import org.javai.symbolic.expr.Lookup;
import org.javai.symbolic.expr.Max;
import org.javai.symbolic.expr.Min;
import org.javai.symbolic.expr.MultiChildExpression;
import org.javai.symbolic.expr.NaN;
import org.javai.symbolic.expr.Power;
import org.javai.symbolic.expr.Product;
import org.javai.symbolic.expr.Quotient;
import org.javai.symbolic.expr.Remainder;
import org.javai.symbolic.expr.RightShift;
import org.javai.symbolic.expr.Subscript;
import org.javai.symbolic.expr.Substitution;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.Mapper;

/**
 * Evaluates a tree against a context mapping variable names to values.
 * <p>
 * Numbers follow the rules of {@link Arithmetic}: exact integers, decimals kept decimal,
 * floating point otherwise, and true division for {@code /}. Comparisons and logical
 * operators give {@code Boolean}; {@code and}, {@code or} and conditionals evaluate only
 * the operands they need. A call evaluates its function to a
 * {@code Function<List<Object>, Object>} from the context and applies it to the
 * evaluated arguments. Subscripts index lists, arrays and maps; lookups read map entries.
 * <p>
 * Keyword calls, derivatives and slices are not evaluated. Common subexpressions are
 * evaluated each time they occur unless the mapper is run through a
 * {@link org.javai.symbolic.mapper.CseCachingMapper}.
 */
public class EvaluationMapper extends Mapper<Void, Object> {

	private Map<String, ?> context;

	public EvaluationMapper(Map<String, ?> context) {
		if (context == null) {
			throw new IllegalArgumentException("context must not be null");
		}
		this.context = context;
		register(Variable.class, this::mapVariable);
		register(NaN.class, (nan, arg) -> Double.NaN);
		register(Sum.class, (sum, arg) -> fold(sum, arg, Arithmetic::add));
		register(Product.class, (product, arg) -> fold(product, arg, Arithmetic::multiply));
		register(Quotient.class, (q, arg) -> Arithmetic.divide(rec(q.numerator(), arg), rec(q.denominator(), arg)));
		register(FloorDiv.class,
				(q, arg) -> Arithmetic.floorDivide(rec(q.numerator(), arg), rec(q.denominator(), arg)));
		register(Remainder.class,
				(q, arg) -> Arithmetic.remainder(rec(q.numerator(), arg), rec(q.denominator(), arg)));
		register(Power.class, (p, arg) -> Arithmetic.power(rec(p.base(), arg), rec(p.exponent(), arg)));
		register(LeftShift.class, (s, arg) -> Arithmetic.shiftLeft(rec(s.shiftee(), arg), rec(s.shift(), arg)));
		register(RightShift.class, (s, arg) -> Arithmetic.shiftRight(rec(s.shiftee(), arg), rec(s.shift(), arg)));
		register(BitwiseNot.class, (not, arg) -> Arithmetic.bitwiseNot(rec(not.child(), arg)));
		register(BitwiseAnd.class, (and, arg) -> fold(and, arg, Arithmetic::bitwiseAnd));
		register(BitwiseOr.class, (or, arg) -> fold(or, arg, Arithmetic::bitwiseOr));
		register(BitwiseXor.class, (xor, arg) -> fold(xor, arg, Arithmetic::bitwiseXor));
		register(Comparison.class, (c, arg) -> Arithmetic.compare(rec(c.left(), arg), c.operator(), rec(c.right(), arg)));
		register(LogicalNot.class, (not, arg) -> !Arithmetic.truthy(rec(not.child(), arg)));
		register(LogicalAnd.class, this::mapLogicalAnd);
		register(LogicalOr.class, this::mapLogicalOr);
		register(If.class, (conditional, arg) -> Arithmetic.truthy(rec(conditional.condition(), arg))
				? rec(conditional.then(), arg)
				: rec(conditional.else_(), arg));
		register(Min.class, (min, arg) -> fold(min, arg, (a, b) -> Arithmetic.compare(b, "<", a) ? b : a));
		register(Max.class, (max, arg) -> fold(max, arg, (a, b) -> Arithmetic.compare(b, ">", a) ? b : a));
		register(Call.class, this::mapCall);
		register(Subscript.class, this::mapSubscript);
		register(Lookup.class, this::mapLookup);
		register(Substitution.class, this::mapSubstitution);
	}

	/**
	 * Evaluates {@code expression} in {@code context}.
	 */
	public static Object evaluate(Object expression, Map<String, ?> context) {
		return new EvaluationMapper(context).apply(expression);
	}

	/**
	 * @return the variable bindings in effect, including those of any substitution being
	 * evaluated
	 */
	public Map<String, ?> context() {
		return context;
	}

	protected Object mapVariable(Variable variable, Void arg) {
		if (!context.containsKey(variable.name())) {
			throw new UnknownVariableException(variable.name());
		}
		return context.get(variable.name());
	}

	protected Object mapLogicalAnd(LogicalAnd and, Void arg) {
		for (Object child : and.children()) {
			if (!Arithmetic.truthy(rec(child, arg))) {
				return false;
			}
		}
		return true;
	}

	protected Object mapLogicalOr(LogicalOr or, Void arg) {
		for (Object child : or.children()) {
			if (Arithmetic.truthy(rec(child, arg))) {
				return true;
			}
		}
		return false;
	}

	@SuppressWarnings("unchecked")
	protected Object mapCall(Call call, Void arg) {
		Object function = rec(call.function(), arg);
		if (!(function instanceof Function)) {
			throw new EvaluationException("Cannot call " + call.function() + ": its value is not a function");
		}
		List<Object> arguments = new ArrayList<>(call.parameters().size());
		for (Object parameter : call.parameters()) {
			arguments.add(rec(parameter, arg));
		}
		try {
			return ((Function<List<Object>, Object>) function).apply(Collections.unmodifiableList(arguments));
		} catch (ClassCastException e) {
			throw new EvaluationException("Function " + call.function() + " rejected arguments " + arguments, e);
		}
	}

	protected Object mapSubscript(Subscript subscript, Void arg) {
		Object aggregate = rec(subscript.aggregate(), arg);
		Object index = rec(subscript.index(), arg);
		if (index instanceof List<?> indices) {
			for (Object component : indices) {
				aggregate = index(aggregate, component, subscript);
			}
			return aggregate;
		}
		return index(aggregate, index, subscript);
	}

	protected Object mapLookup(Lookup lookup, Void arg) {
		Object aggregate = rec(lookup.aggregate(), arg);
		if (aggregate instanceof Map<?, ?> map && map.containsKey(lookup.name())) {
			return map.get(lookup.name());
		}
		throw new EvaluationException("Cannot look up '" + lookup.name() + "' in " + aggregate);
	}

	/**
	 * Evaluates the values in the current context, then the child with those values bound.
	 * The child is evaluated by this mapper, so its handlers apply; common subexpressions
	 * inside it are cached separately from those evaluated under the outer bindings.
	 */
	protected Object mapSubstitution(Substitution substitution, Void arg) {
		Map<String, Object> extended = new HashMap<>(context);
		for (int i = 0; i < substitution.variables().size(); i++) {
			extended.put(substitution.variables().get(i), rec(substitution.values().get(i), arg));
		}
		Map<String, ?> outer = context;
		context = extended;
		try {
			return withSeparateCache(() -> rec(substitution.child(), arg));
		} finally {
			context = outer;
		}
	}

	@Override
	protected Object mapConstant(Object value, Void arg) {
		return value;
	}

	@Override
	protected Object mapSequence(List<?> value, Void arg) {
		List<Object> result = new ArrayList<>(value.size());
		for (Object element : value) {
			result.add(rec(element, arg));
		}
		return Collections.unmodifiableList(result);
	}

	@Override
	protected Object mapArray(Object value, Void arg) {
		if (!(value instanceof Object[] array)) {
			return value;
		}
		Object[] result = new Object[array.length];
		for (int i = 0; i < array.length; i++) {
			result[i] = rec(array[i], arg);
		}
		return result;
	}

	private Object fold(MultiChildExpression expression, Void arg, BinaryOperator<Object> operator) {
		List<Object> children = expression.children();
		Object result = rec(children.get(0), arg);
		for (int i = 1; i < children.size(); i++) {
			result = operator.apply(result, rec(children.get(i), arg));
		}
		return result;
	}

	private static Object index(Object aggregate, Object index, Subscript subscript) {
		if (aggregate instanceof Map<?, ?> map) {
			if (!map.containsKey(index)) {
				throw new EvaluationException("Key " + index + " not found in " + subscript.aggregate());
			}
			return map.get(index);
		}
		int length;
		if (aggregate instanceof List<?> list) {
			length = list.size();
		} else if (aggregate != null && aggregate.getClass().isArray()) {
			length = Array.getLength(aggregate);
		} else {
			throw new EvaluationException("Cannot subscript " + subscript.aggregate() + ": its value is not indexable");
		}
		int position = Arithmetic.toIndex(index);
		if (position < 0) {
			position += length;
		}
		if (position < 0 || position >= length) {
			throw new EvaluationException("Index " + index + " is out of range for " + subscript.aggregate());
		}
		return aggregate instanceof List<?> list ? list.get(position) : Array.get(aggregate, position);
	}
}
