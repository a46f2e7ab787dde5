package org.javai.symbolic.mapper.stringifier;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
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
import org.javai.symbolic.expr.NaN;
import org.javai.symbolic.expr.Power;
import org.javai.symbolic.expr.Product;
import org.javai.symbolic.expr.Quotient;
import org.javai.symbolic.expr.Remainder;
import org.javai.symbolic.expr.RightShift;
import org.javai.symbolic.expr.Slice;
import org.javai.symbolic.expr.Subscript;
import org.javai.symbolic.expr.Substitution;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.Mapper;

/**
 * Renders a tree as infix text, inserting only the parentheses the operator precedences
 * require.
 * <p>
 * The traversal argument is the precedence demanded by the enclosing position. Every
 * operator handler renders its operands through {@link #renderOperand}, which derives
 * the demand from the {@link PrecedenceTable}, and wraps its own text with
 * {@link #parenthesizeIfNeeded} when the demand exceeds its own level. Handlers for
 * user-defined operators follow the same two steps after adding their kind to the table:
 *
 * <pre>
 * StringifyMapper renderer = new StringifyMapper(
 *         PrecedenceTable.defaults().with("dot", Precedence.PRODUCT, Associativity.LEFT));
 * renderer.register(Dot.class, (dot, enclosing) -&gt; renderer.parenthesizeIfNeeded(
 *         renderer.renderOperand(dot.left(), "dot", OperandSide.LEFT) + " . "
 *                 + renderer.renderOperand(dot.right(), "dot", OperandSide.RIGHT),
 *         enclosing, Precedence.PRODUCT));
 * </pre>
 */
public class StringifyMapper extends Mapper<Integer, String> {

	private final PrecedenceTable precedences;

	public StringifyMapper() {
		this(PrecedenceTable.defaults());
	}

	public StringifyMapper(PrecedenceTable precedences) {
		if (precedences == null) {
			throw new IllegalArgumentException("precedences must not be null");
		}
		this.precedences = precedences;
		register(Variable.class, this::mapVariable);
		register(NaN.class, this::mapNaN);
		register(Call.class, this::mapCall);
		register(CallWithKwargs.class, this::mapCallWithKwargs);
		register(Subscript.class, this::mapSubscript);
		register(Lookup.class, this::mapLookup);
		register(Sum.class, (sum, enclosing) -> renderInfix(sum, sum.children(), " + ", enclosing));
		register(Product.class, (product, enclosing) -> renderInfix(product, product.children(), "*", enclosing));
		register(Quotient.class, (quotient, enclosing) -> renderInfix(quotient,
				List.of(quotient.numerator(), quotient.denominator()), " / ", enclosing));
		register(FloorDiv.class, (quotient, enclosing) -> renderInfix(quotient,
				List.of(quotient.numerator(), quotient.denominator()), " // ", enclosing));
		register(Remainder.class, (quotient, enclosing) -> renderInfix(quotient,
				List.of(quotient.numerator(), quotient.denominator()), " % ", enclosing));
		register(Power.class, this::mapPower);
		register(LeftShift.class, (shift, enclosing) -> renderInfix(shift,
				List.of(shift.shiftee(), shift.shift()), " << ", enclosing));
		register(RightShift.class, (shift, enclosing) -> renderInfix(shift,
				List.of(shift.shiftee(), shift.shift()), " >> ", enclosing));
		register(BitwiseNot.class, (not, enclosing) -> renderPrefix(not, not.child(), "~", enclosing));
		register(BitwiseOr.class, (or, enclosing) -> renderInfix(or, or.children(), " | ", enclosing));
		register(BitwiseXor.class, (xor, enclosing) -> renderInfix(xor, xor.children(), " ^ ", enclosing));
		register(BitwiseAnd.class, (and, enclosing) -> renderInfix(and, and.children(), " & ", enclosing));
		register(Comparison.class, (comparison, enclosing) -> renderInfix(comparison,
				List.of(comparison.left(), comparison.right()), " " + comparison.operator() + " ", enclosing));
		register(LogicalNot.class, (not, enclosing) -> renderPrefix(not, not.child(), "not ", enclosing));
		register(LogicalAnd.class, (and, enclosing) -> renderInfix(and, and.children(), " and ", enclosing));
		register(LogicalOr.class, (or, enclosing) -> renderInfix(or, or.children(), " or ", enclosing));
		register(If.class, this::mapIf);
		register(Min.class, (min, enclosing) -> "min(" + joinRendered(min.children()) + ")");
		register(Max.class, (max, enclosing) -> "max(" + joinRendered(max.children()) + ")");
		register(CommonSubexpression.class, this::mapCommonSubexpression);
		register(Substitution.class, this::mapSubstitution);
		register(Derivative.class, this::mapDerivative);
		register(Slice.class, this::mapSlice);
	}

	/**
	 * Renders {@code value} with the default precedence table.
	 */
	public static String render(Object value) {
		return new StringifyMapper().apply(value);
	}

	public PrecedenceTable precedences() {
		return precedences;
	}

	/**
	 * Renders one operand of an operator registered in the precedence table under
	 * {@code parentKey}.
	 * <p>
	 * The operand may match the operator's level without parentheses when it is on the
	 * favored side of a {@link Associativity#LEFT} or {@link Associativity#RIGHT}
	 * operator, or when it is an operator of the same kind (or not an operator at all)
	 * under an {@link Associativity#ASSOCIATIVE} one. Otherwise it must bind strictly
	 * tighter.
	 */
	public String renderOperand(Object operand, String parentKey, OperandSide side) {
		OperatorPrecedence parent = precedences.get(parentKey);
		boolean favored = switch (parent.associativity()) {
			case ASSOCIATIVE -> !(operand instanceof Expression expression)
					|| expression.dispatchKey().equals(parentKey);
			case LEFT -> side == OperandSide.LEFT;
			case RIGHT -> side == OperandSide.RIGHT;
			case NONE -> false;
		};
		return rec(operand, favored ? parent.level() : parent.level() + 1);
	}

	/**
	 * Wraps {@code text} in parentheses if the enclosing position binds tighter than the
	 * construct that produced it.
	 */
	public String parenthesizeIfNeeded(String text, int enclosing, int own) {
		return enclosing > own ? "(" + text + ")" : text;
	}

	@Override
	protected Integer defaultArgument() {
		return Precedence.NONE;
	}

	protected String mapVariable(Variable variable, Integer enclosing) {
		return variable.name();
	}

	protected String mapNaN(NaN nan, Integer enclosing) {
		return "NaN";
	}

	protected String mapCall(Call call, Integer enclosing) {
		String text = renderOperand(call.function(), call.dispatchKey(), OperandSide.LEFT)
				+ "(" + joinRendered(call.parameters()) + ")";
		return parenthesizeIfNeeded(text, enclosing, precedences.level(call.dispatchKey()));
	}

	protected String mapCallWithKwargs(CallWithKwargs call, Integer enclosing) {
		List<String> arguments = new ArrayList<>();
		for (Object parameter : call.parameters()) {
			arguments.add(rec(parameter, Precedence.NONE));
		}
		for (Map.Entry<String, Object> entry : call.kwParameters().entrySet()) {
			arguments.add(entry.getKey() + "=" + rec(entry.getValue(), Precedence.NONE));
		}
		String text = renderOperand(call.function(), call.dispatchKey(), OperandSide.LEFT)
				+ "(" + String.join(", ", arguments) + ")";
		return parenthesizeIfNeeded(text, enclosing, precedences.level(call.dispatchKey()));
	}

	protected String mapSubscript(Subscript subscript, Integer enclosing) {
		Object index = subscript.index();
		String indexText = index instanceof List<?> components
				? joinRendered(components)
				: rec(index, Precedence.NONE);
		String text = renderOperand(subscript.aggregate(), subscript.dispatchKey(), OperandSide.LEFT)
				+ "[" + indexText + "]";
		return parenthesizeIfNeeded(text, enclosing, precedences.level(subscript.dispatchKey()));
	}

	protected String mapLookup(Lookup lookup, Integer enclosing) {
		String text = renderOperand(lookup.aggregate(), lookup.dispatchKey(), OperandSide.LEFT)
				+ "." + lookup.name();
		return parenthesizeIfNeeded(text, enclosing, precedences.level(lookup.dispatchKey()));
	}

	protected String mapPower(Power power, Integer enclosing) {
		return renderInfix(power, List.of(power.base(), power.exponent()), "**", enclosing);
	}

	protected String mapIf(If conditional, Integer enclosing) {
		String key = conditional.dispatchKey();
		String text = renderOperand(conditional.then(), key, OperandSide.LEFT)
				+ " if " + renderOperand(conditional.condition(), key, OperandSide.INNER)
				+ " else " + renderOperand(conditional.else_(), key, OperandSide.RIGHT);
		return parenthesizeIfNeeded(text, enclosing, precedences.level(key));
	}

	protected String mapCommonSubexpression(CommonSubexpression cse, Integer enclosing) {
		return "CSE(" + rec(cse.child(), Precedence.NONE) + ")";
	}

	protected String mapSubstitution(Substitution substitution, Integer enclosing) {
		List<String> assignments = new ArrayList<>();
		for (int i = 0; i < substitution.variables().size(); i++) {
			assignments.add(substitution.variables().get(i) + "=" + rec(substitution.values().get(i), Precedence.NONE));
		}
		return "[" + rec(substitution.child(), Precedence.NONE) + "]{" + String.join(", ", assignments) + "}";
	}

	protected String mapDerivative(Derivative derivative, Integer enclosing) {
		StringBuilder text = new StringBuilder();
		for (String variable : derivative.variables()) {
			text.append("d/d").append(variable).append(' ');
		}
		text.append(renderOperand(derivative.child(), derivative.dispatchKey(), OperandSide.RIGHT));
		return parenthesizeIfNeeded(text.toString(), enclosing, precedences.level(derivative.dispatchKey()));
	}

	protected String mapSlice(Slice slice, Integer enclosing) {
		List<String> parts = new ArrayList<>();
		parts.add(slice.start() == null ? "" : rec(slice.start(), Precedence.NONE));
		parts.add(slice.stop() == null ? "" : rec(slice.stop(), Precedence.NONE));
		if (slice.children().size() == 3) {
			parts.add(slice.step() == null ? "" : rec(slice.step(), Precedence.NONE));
		}
		return String.join(":", parts);
	}

	/**
	 * Negative numbers are parenthesized where they would otherwise read as a
	 * subtraction or bind to a tighter operator.
	 */
	@Override
	protected String mapConstant(Object value, Integer enclosing) {
		String text = String.valueOf(value);
		if (isNegative(value) && enclosing > Precedence.SUM) {
			return "(" + text + ")";
		}
		return text;
	}

	@Override
	protected String mapSequence(List<?> value, Integer enclosing) {
		return "[" + joinRendered(value) + "]";
	}

	@Override
	protected String mapArray(Object value, Integer enclosing) {
		int length = Array.getLength(value);
		List<Object> elements = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			elements.add(Array.get(value, i));
		}
		return "array(" + joinRendered(elements) + ")";
	}

	/**
	 * Renders {@code operands} separated by {@code separator}, each through
	 * {@link #renderOperand}, and parenthesizes the result as needed.
	 */
	protected String renderInfix(Expression expression, List<?> operands, String separator, int enclosing) {
		String key = expression.dispatchKey();
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < operands.size(); i++) {
			if (i > 0) {
				text.append(separator);
			}
			text.append(renderOperand(operands.get(i), key, OperandSide.of(i, operands.size())));
		}
		return parenthesizeIfNeeded(text.toString(), enclosing, precedences.level(key));
	}

	protected String renderPrefix(Expression expression, Object operand, String operator, int enclosing) {
		String key = expression.dispatchKey();
		String text = operator + renderOperand(operand, key, OperandSide.RIGHT);
		return parenthesizeIfNeeded(text, enclosing, precedences.level(key));
	}

	/**
	 * Renders each value at the lowest precedence and joins them with commas.
	 */
	protected String joinRendered(List<?> values) {
		List<String> parts = new ArrayList<>(values.size());
		for (Object value : values) {
			parts.add(rec(value, Precedence.NONE));
		}
		return String.join(", ", parts);
	}

	private static boolean isNegative(Object value) {
		if (value instanceof BigInteger integer) {
			return integer.signum() < 0;
		}
		if (value instanceof BigDecimal decimal) {
			return decimal.signum() < 0;
		}
		if (value instanceof Double || value instanceof Float) {
			return ((Number) value).doubleValue() < 0;
		}
		if (value instanceof Number number) {
			return number.longValue() < 0;
		}
		return false;
	}
}
