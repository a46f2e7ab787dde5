package org.javai.symbolic.mapper;

import java.util.ArrayList;
import java.util.List;
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
 * Knows which children of the built-in kinds are operands, as opposed to attributes such
 * as names, operator symbols or scopes.
 */
final class Operands {

	/** Built-in kinds that have operands. */
	static final List<Class<? extends Expression>> COMPOSITE_KINDS = List.of(
			Call.class, CallWithKwargs.class, Subscript.class, Lookup.class,
			Sum.class, Product.class, Quotient.class, FloorDiv.class, Remainder.class, Power.class,
			LeftShift.class, RightShift.class,
			BitwiseNot.class, BitwiseOr.class, BitwiseXor.class, BitwiseAnd.class,
			Comparison.class, LogicalNot.class, LogicalAnd.class, LogicalOr.class, If.class,
			Min.class, Max.class,
			CommonSubexpression.class, Substitution.class, Derivative.class, Slice.class);

	/** Built-in kinds without operands. */
	static final List<Class<? extends Expression>> LEAF_KINDS = List.of(Variable.class, NaN.class);

	private Operands() {
	}

	/**
	 * Returns the operands of a built-in expression in rendering order.
	 */
	static List<Object> of(Expression expression) {
		if (expression instanceof MultiChildExpression) {
			return expression.children();
		}
		if (expression instanceof QuotientBase quotient) {
			return List.of(quotient.numerator(), quotient.denominator());
		}
		if (expression instanceof Power power) {
			return List.of(power.base(), power.exponent());
		}
		if (expression instanceof ShiftOperator shift) {
			return List.of(shift.shiftee(), shift.shift());
		}
		if (expression instanceof UnaryExpression unary) {
			return List.of(unary.child());
		}
		if (expression instanceof Call call) {
			List<Object> operands = new ArrayList<>();
			operands.add(call.function());
			operands.addAll(call.parameters());
			return operands;
		}
		if (expression instanceof CallWithKwargs call) {
			List<Object> operands = new ArrayList<>();
			operands.add(call.function());
			operands.addAll(call.parameters());
			operands.addAll(call.kwParameters().values());
			return operands;
		}
		if (expression instanceof Subscript subscript) {
			return List.of(subscript.aggregate(), subscript.index());
		}
		if (expression instanceof Lookup lookup) {
			return List.of(lookup.aggregate());
		}
		if (expression instanceof Comparison comparison) {
			return List.of(comparison.left(), comparison.right());
		}
		if (expression instanceof If conditional) {
			return List.of(conditional.condition(), conditional.then(), conditional.else_());
		}
		if (expression instanceof CommonSubexpression cse) {
			return List.of(cse.child());
		}
		if (expression instanceof Substitution substitution) {
			List<Object> operands = new ArrayList<>();
			operands.add(substitution.child());
			operands.addAll(substitution.values());
			return operands;
		}
		if (expression instanceof Derivative derivative) {
			return List.of(derivative.child());
		}
		if (expression instanceof Slice slice) {
			List<Object> operands = new ArrayList<>();
			for (Object component : slice.children()) {
				if (component != null) {
					operands.add(component);
				}
			}
			return operands;
		}
		return List.of();
	}
}
