package org.javai.symbolic.mapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.javai.symbolic.expr.BitwiseAnd;
import org.javai.symbolic.expr.BitwiseNot;
import org.javai.symbolic.expr.BitwiseOr;
import org.javai.symbolic.expr.BitwiseXor;
import org.javai.symbolic.expr.Call;
import org.javai.symbolic.expr.CallWithKwargs;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.Comparison;
import org.javai.symbolic.expr.Derivative;
import org.javai.symbolic.expr.Expression;
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
import org.javai.symbolic.expr.QuotientBase;
import org.javai.symbolic.expr.Remainder;
import org.javai.symbolic.expr.RightShift;
import org.javai.symbolic.expr.ShiftOperator;
import org.javai.symbolic.expr.Slice;
import org.javai.symbolic.expr.Subscript;
import org.javai.symbolic.expr.Substitution;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.UnaryExpression;
import org.javai.symbolic.expr.Variable;

/**
 * Rebuilds a tree node by node. Subclasses override individual {@code mapXxx} methods to
 * rewrite the kinds they care about and inherit a faithful copy of everything else.
 * <p>
 * A node whose mapped operands are all identical ({@code ==}) to the original ones is
 * returned as is, so untouched subtrees keep their identity and shared subexpressions
 * stay shared. Constants map to themselves; sequences and object arrays are rebuilt only
 * when an element changed.
 *
 * @param <A> the extra argument type
 */
public class IdentityMapper<A> extends Mapper<A, Object> {

	public IdentityMapper() {
		register(Variable.class, this::mapVariable);
		register(NaN.class, this::mapNaN);
		register(Call.class, this::mapCall);
		register(CallWithKwargs.class, this::mapCallWithKwargs);
		register(Subscript.class, this::mapSubscript);
		register(Lookup.class, this::mapLookup);
		registerMultiChild(Sum.class, Sum::new);
		registerMultiChild(Product.class, Product::new);
		registerMultiChild(BitwiseOr.class, BitwiseOr::new);
		registerMultiChild(BitwiseXor.class, BitwiseXor::new);
		registerMultiChild(BitwiseAnd.class, BitwiseAnd::new);
		registerMultiChild(LogicalOr.class, LogicalOr::new);
		registerMultiChild(LogicalAnd.class, LogicalAnd::new);
		registerMultiChild(Min.class, Min::new);
		registerMultiChild(Max.class, Max::new);
		registerQuotient(Quotient.class, Quotient::new);
		registerQuotient(FloorDiv.class, FloorDiv::new);
		registerQuotient(Remainder.class, Remainder::new);
		register(Power.class, this::mapPower);
		registerShift(LeftShift.class, LeftShift::new);
		registerShift(RightShift.class, RightShift::new);
		registerUnary(BitwiseNot.class, BitwiseNot::new);
		registerUnary(LogicalNot.class, LogicalNot::new);
		register(Comparison.class, this::mapComparison);
		register(If.class, this::mapIf);
		register(CommonSubexpression.class, this::mapCommonSubexpression);
		register(Substitution.class, this::mapSubstitution);
		register(Derivative.class, this::mapDerivative);
		register(Slice.class, this::mapSlice);
	}

	protected Object mapVariable(Variable variable, A arg) {
		return variable;
	}

	protected Object mapNaN(NaN nan, A arg) {
		return nan;
	}

	protected Object mapCall(Call call, A arg) {
		Object function = rec(call.function(), arg);
		List<Object> parameters = mapAll(call.parameters(), arg);
		if (function == call.function() && parameters == call.parameters()) {
			return call;
		}
		return new Call(function, parameters);
	}

	protected Object mapCallWithKwargs(CallWithKwargs call, A arg) {
		Object function = rec(call.function(), arg);
		List<Object> parameters = mapAll(call.parameters(), arg);
		boolean changed = function != call.function() || parameters != call.parameters();
		Map<String, Object> kwParameters = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : call.kwParameters().entrySet()) {
			Object mapped = rec(entry.getValue(), arg);
			changed |= mapped != entry.getValue();
			kwParameters.put(entry.getKey(), mapped);
		}
		return changed ? new CallWithKwargs(function, parameters, kwParameters) : call;
	}

	protected Object mapSubscript(Subscript subscript, A arg) {
		Object aggregate = rec(subscript.aggregate(), arg);
		Object index = rec(subscript.index(), arg);
		if (aggregate == subscript.aggregate() && index == subscript.index()) {
			return subscript;
		}
		return new Subscript(aggregate, index);
	}

	protected Object mapLookup(Lookup lookup, A arg) {
		Object aggregate = rec(lookup.aggregate(), arg);
		return aggregate == lookup.aggregate() ? lookup : new Lookup(aggregate, lookup.name());
	}

	protected Object mapPower(Power power, A arg) {
		Object base = rec(power.base(), arg);
		Object exponent = rec(power.exponent(), arg);
		if (base == power.base() && exponent == power.exponent()) {
			return power;
		}
		return new Power(base, exponent);
	}

	protected Object mapComparison(Comparison comparison, A arg) {
		Object left = rec(comparison.left(), arg);
		Object right = rec(comparison.right(), arg);
		if (left == comparison.left() && right == comparison.right()) {
			return comparison;
		}
		return new Comparison(left, comparison.operator(), right);
	}

	protected Object mapIf(If conditional, A arg) {
		Object condition = rec(conditional.condition(), arg);
		Object then = rec(conditional.then(), arg);
		Object else_ = rec(conditional.else_(), arg);
		if (condition == conditional.condition() && then == conditional.then() && else_ == conditional.else_()) {
			return conditional;
		}
		return new If(condition, then, else_);
	}

	protected Object mapCommonSubexpression(CommonSubexpression cse, A arg) {
		Object child = rec(cse.child(), arg);
		return child == cse.child() ? cse : new CommonSubexpression(child, cse.prefix(), cse.scope());
	}

	protected Object mapSubstitution(Substitution substitution, A arg) {
		Object child = rec(substitution.child(), arg);
		List<Object> values = mapAll(substitution.values(), arg);
		if (child == substitution.child() && values == substitution.values()) {
			return substitution;
		}
		return new Substitution(child, substitution.variables(), values);
	}

	protected Object mapDerivative(Derivative derivative, A arg) {
		Object child = rec(derivative.child(), arg);
		return child == derivative.child() ? derivative : new Derivative(child, derivative.variables());
	}

	protected Object mapSlice(Slice slice, A arg) {
		List<Object> components = new ArrayList<>(slice.children().size());
		boolean changed = false;
		for (Object component : slice.children()) {
			Object mapped = component == null ? null : rec(component, arg);
			changed |= mapped != component;
			components.add(mapped);
		}
		return changed ? new Slice(components) : slice;
	}

	@Override
	protected Object mapConstant(Object value, A arg) {
		return value;
	}

	@Override
	protected Object mapSequence(List<?> value, A arg) {
		return mapAll(value, arg);
	}

	@Override
	protected Object mapArray(Object value, A arg) {
		if (!(value instanceof Object[] array)) {
			return value;
		}
		Object[] mapped = new Object[array.length];
		boolean changed = false;
		for (int i = 0; i < array.length; i++) {
			mapped[i] = rec(array[i], arg);
			changed |= mapped[i] != array[i];
		}
		return changed ? mapped : value;
	}

	/**
	 * Maps every element, returning {@code values} itself when nothing changed.
	 */
	@SuppressWarnings("unchecked")
	protected List<Object> mapAll(List<?> values, A arg) {
		List<Object> mapped = new ArrayList<>(values.size());
		boolean changed = false;
		for (Object value : values) {
			Object result = rec(value, arg);
			changed |= result != value;
			mapped.add(result);
		}
		return changed ? Collections.unmodifiableList(mapped) : (List<Object>) values;
	}

	private <E extends MultiChildExpression> void registerMultiChild(Class<E> kind,
			Function<List<Object>, E> constructor) {
		register(kind, (expression, arg) -> {
			List<Object> children = mapAll(expression.children(), arg);
			return children == expression.children() ? expression : constructor.apply(children);
		});
	}

	private <E extends QuotientBase> void registerQuotient(Class<E> kind, BiFunction<Object, Object, E> constructor) {
		register(kind, (expression, arg) -> {
			Object numerator = rec(expression.numerator(), arg);
			Object denominator = rec(expression.denominator(), arg);
			if (numerator == expression.numerator() && denominator == expression.denominator()) {
				return expression;
			}
			return constructor.apply(numerator, denominator);
		});
	}

	private <E extends ShiftOperator> void registerShift(Class<E> kind, BiFunction<Object, Object, E> constructor) {
		register(kind, (expression, arg) -> {
			Object shiftee = rec(expression.shiftee(), arg);
			Object shift = rec(expression.shift(), arg);
			if (shiftee == expression.shiftee() && shift == expression.shift()) {
				return expression;
			}
			return constructor.apply(shiftee, shift);
		});
	}

	private <E extends UnaryExpression> void registerUnary(Class<E> kind, Function<Object, E> constructor) {
		register(kind, (expression, arg) -> {
			Object child = rec(expression.child(), arg);
			return child == expression.child() ? expression : constructor.apply(child);
		});
	}
}
