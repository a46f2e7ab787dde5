package org.javai.symbolic.mapper.evaluator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

/**
 * Numeric operations behind {@link EvaluationMapper}.
 * <p>
 * Integral operands ({@code Byte}, {@code Short}, {@code Integer}, {@code Long},
 * {@code BigInteger}) give exact results as {@code Long}, widened to {@code BigInteger}
 * when they do not fit. A {@code BigDecimal} operand makes the result a
 * {@code BigDecimal}; a floating operand, or any other {@code Number}, makes it a
 * {@code Double}. Floor division and remainder round towards negative infinity, so the
 * remainder takes the sign of the divisor.
 */
final class Arithmetic {

	private static final MathContext DECIMAL_CONTEXT = MathContext.DECIMAL128;
	private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

	private enum Domain {
		INTEGER,
		DECIMAL,
		FLOAT
	}

	private Arithmetic() {
	}

	static Number add(Object left, Object right) {
		Number a = number(left, "+");
		Number b = number(right, "+");
		return switch (domain(a, b)) {
			case INTEGER -> normalize(toBigInteger(a).add(toBigInteger(b)));
			case DECIMAL -> toBigDecimal(a).add(toBigDecimal(b));
			case FLOAT -> a.doubleValue() + b.doubleValue();
		};
	}

	static Number multiply(Object left, Object right) {
		Number a = number(left, "*");
		Number b = number(right, "*");
		return switch (domain(a, b)) {
			case INTEGER -> normalize(toBigInteger(a).multiply(toBigInteger(b)));
			case DECIMAL -> toBigDecimal(a).multiply(toBigDecimal(b));
			case FLOAT -> a.doubleValue() * b.doubleValue();
		};
	}

	/**
	 * True division; integral operands give a {@code Double}.
	 */
	static Number divide(Object left, Object right) {
		Number a = number(left, "/");
		Number b = requireNonZero(number(right, "/"), "/");
		if (domain(a, b) == Domain.DECIMAL) {
			return toBigDecimal(a).divide(toBigDecimal(b), DECIMAL_CONTEXT);
		}
		return a.doubleValue() / b.doubleValue();
	}

	static Number floorDivide(Object left, Object right) {
		Number a = number(left, "//");
		Number b = requireNonZero(number(right, "//"), "//");
		return switch (domain(a, b)) {
			case INTEGER -> normalize(floorDivide(toBigInteger(a), toBigInteger(b)));
			case DECIMAL -> toBigDecimal(a).divide(toBigDecimal(b), 0, RoundingMode.FLOOR);
			case FLOAT -> Math.floor(a.doubleValue() / b.doubleValue());
		};
	}

	static Number remainder(Object left, Object right) {
		Number a = number(left, "%");
		Number b = requireNonZero(number(right, "%"), "%");
		switch (domain(a, b)) {
			case INTEGER: {
				BigInteger divisor = toBigInteger(b);
				BigInteger r = toBigInteger(a).remainder(divisor);
				if (r.signum() != 0 && r.signum() != divisor.signum()) {
					r = r.add(divisor);
				}
				return normalize(r);
			}
			case DECIMAL: {
				BigDecimal divisor = toBigDecimal(b);
				BigDecimal r = toBigDecimal(a).remainder(divisor);
				if (r.signum() != 0 && r.signum() != divisor.signum()) {
					r = r.add(divisor);
				}
				return r;
			}
			default: {
				double divisor = b.doubleValue();
				double r = a.doubleValue() % divisor;
				if (r != 0 && (r < 0) != (divisor < 0)) {
					r += divisor;
				}
				return r;
			}
		}
	}

	/**
	 * Exact for integral bases with a non-negative integral exponent, decimal for decimal
	 * bases with such an exponent, {@code Double} otherwise.
	 */
	static Number power(Object left, Object right) {
		Number base = number(left, "**");
		Number exponent = number(right, "**");
		if (isIntegral(exponent)) {
			BigInteger e = toBigInteger(exponent);
			if (e.signum() >= 0 && e.bitLength() < 32) {
				if (isIntegral(base)) {
					return normalize(toBigInteger(base).pow(e.intValue()));
				}
				if (base instanceof BigDecimal decimal) {
					return decimal.pow(e.intValue(), DECIMAL_CONTEXT);
				}
			}
		}
		return Math.pow(base.doubleValue(), exponent.doubleValue());
	}

	static Number shiftLeft(Object left, Object right) {
		BigInteger shift = integer(right, "<<");
		return normalize(integer(left, "<<").shiftLeft(shiftDistance(shift, "<<")));
	}

	static Number shiftRight(Object left, Object right) {
		BigInteger shift = integer(right, ">>");
		return normalize(integer(left, ">>").shiftRight(shiftDistance(shift, ">>")));
	}

	static Number bitwiseAnd(Object left, Object right) {
		return normalize(integer(left, "&").and(integer(right, "&")));
	}

	static Number bitwiseOr(Object left, Object right) {
		return normalize(integer(left, "|").or(integer(right, "|")));
	}

	static Number bitwiseXor(Object left, Object right) {
		return normalize(integer(left, "^").xor(integer(right, "^")));
	}

	static Number bitwiseNot(Object value) {
		return normalize(integer(value, "~").not());
	}

	/**
	 * Applies a comparison operator. Numbers compare by value across representations;
	 * other values support {@code ==} and {@code !=} by equality and ordering when they are
	 * mutually {@link Comparable}.
	 */
	static boolean compare(Object left, String operator, Object right) {
		if (isNumber(left) && isNumber(right)) {
			return compareNumbers((Number) left, operator, (Number) right);
		}
		switch (operator) {
			case "==":
				return Objects.equals(left, right);
			case "!=":
				return !Objects.equals(left, right);
			default:
				return ordered(compareObjects(left, operator, right), operator);
		}
	}

	/**
	 * Truth value of an evaluated operand: {@code false}, zero, {@code null} and empty
	 * collections or strings are false.
	 */
	static boolean truthy(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean bool) {
			return bool;
		}
		if (value instanceof BigDecimal decimal) {
			return decimal.signum() != 0;
		}
		if (value instanceof BigInteger integer) {
			return integer.signum() != 0;
		}
		if (value instanceof Double || value instanceof Float) {
			return ((Number) value).doubleValue() != 0;
		}
		if (value instanceof Number number) {
			return number.longValue() != 0;
		}
		if (value instanceof Collection<?> collection) {
			return !collection.isEmpty();
		}
		if (value instanceof CharSequence text) {
			return text.length() != 0;
		}
		return true;
	}

	static int toIndex(Object value) {
		BigInteger index = integer(value, "[]");
		if (index.bitLength() >= 32) {
			throw new EvaluationException("Index " + index + " is out of range");
		}
		return index.intValue();
	}

	private static boolean compareNumbers(Number a, String operator, Number b) {
		switch (domain(a, b)) {
			case INTEGER:
				return ordered(toBigInteger(a).compareTo(toBigInteger(b)), operator);
			case DECIMAL:
				return ordered(toBigDecimal(a).compareTo(toBigDecimal(b)), operator);
			default: {
				double x = a.doubleValue();
				double y = b.doubleValue();
				return switch (operator) {
					case "==" -> x == y;
					case "!=" -> x != y;
					case "<" -> x < y;
					case "<=" -> x <= y;
					case ">" -> x > y;
					case ">=" -> x >= y;
					default -> throw new EvaluationException("Unknown comparison operator '" + operator + "'");
				};
			}
		}
	}

	@SuppressWarnings({ "unchecked", "rawtypes" })
	private static int compareObjects(Object left, String operator, Object right) {
		if (left instanceof Comparable comparable && right != null && left.getClass().isInstance(right)) {
			return comparable.compareTo(right);
		}
		throw new EvaluationException("Cannot apply '" + operator + "' to " + describe(left) + " and " + describe(right));
	}

	private static boolean ordered(int comparison, String operator) {
		return switch (operator) {
			case "==" -> comparison == 0;
			case "!=" -> comparison != 0;
			case "<" -> comparison < 0;
			case "<=" -> comparison <= 0;
			case ">" -> comparison > 0;
			case ">=" -> comparison >= 0;
			default -> throw new EvaluationException("Unknown comparison operator '" + operator + "'");
		};
	}

	private static Domain domain(Number a, Number b) {
		if (isIntegral(a) && isIntegral(b)) {
			return Domain.INTEGER;
		}
		if ((a instanceof BigDecimal || isIntegral(a)) && (b instanceof BigDecimal || isIntegral(b))) {
			return Domain.DECIMAL;
		}
		return Domain.FLOAT;
	}

	private static boolean isNumber(Object value) {
		return value instanceof Number;
	}

	private static boolean isIntegral(Number value) {
		return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
				|| value instanceof BigInteger;
	}

	private static Number number(Object value, String operator) {
		if (!(value instanceof Number number)) {
			throw new EvaluationException("Operator '" + operator + "' expects numbers but got " + describe(value));
		}
		return number;
	}

	private static BigInteger integer(Object value, String operator) {
		Number number = number(value, operator);
		if (!isIntegral(number)) {
			throw new EvaluationException("Operator '" + operator + "' expects integers but got " + describe(value));
		}
		return toBigInteger(number);
	}

	private static int shiftDistance(BigInteger shift, String operator) {
		if (shift.signum() < 0 || shift.bitLength() >= 32) {
			throw new EvaluationException("Operator '" + operator + "' cannot shift by " + shift);
		}
		return shift.intValue();
	}

	private static Number requireNonZero(Number divisor, String operator) {
		boolean zero;
		if (divisor instanceof BigDecimal decimal) {
			zero = decimal.signum() == 0;
		} else if (divisor instanceof BigInteger integer) {
			zero = integer.signum() == 0;
		} else {
			zero = divisor.doubleValue() == 0;
		}
		if (zero) {
			throw new EvaluationException("Division by zero in '" + operator + "'");
		}
		return divisor;
	}

	private static BigInteger floorDivide(BigInteger a, BigInteger b) {
		BigInteger[] qr = a.divideAndRemainder(b);
		if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
			return qr[0].subtract(BigInteger.ONE);
		}
		return qr[0];
	}

	private static BigInteger toBigInteger(Number value) {
		if (value instanceof BigInteger integer) {
			return integer;
		}
		return BigInteger.valueOf(value.longValue());
	}

	private static BigDecimal toBigDecimal(Number value) {
		if (value instanceof BigDecimal decimal) {
			return decimal;
		}
		return new BigDecimal(toBigInteger(value));
	}

	private static Number normalize(BigInteger value) {
		if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
			return value.longValue();
		}
		return value;
	}

	private static String describe(Object value) {
		return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
	}
}
