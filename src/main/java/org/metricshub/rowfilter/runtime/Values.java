package org.metricshub.rowfilter.runtime;
/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Rowfilter
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Collection;

/**
 * Value semantics of the operators applied by the evaluator.
 * <p>
 * Numbers are compared and combined by numeric value, whatever their boxed
 * type: <code>18</code> (an {@code Integer}) equals <code>18L</code> and
 * <code>18.0</code>. Other values rely on their own {@code equals()} and
 * {@code compareTo()}. No conversion between strings and numbers is ever made.
 * <p>
 * <code>NULL</code> follows SQL rules: comparisons, arithmetic and negation of
 * <code>NULL</code> give <code>NULL</code> ({@code null}), <code>AND</code> and
 * <code>OR</code> use three-valued logic, and only <code>IS</code> /
 * <code>IS NOT</code> compare <code>NULL</code> to a definite result.
 */
public final class Values {

	private Values() {}

	/**
	 * Compares two non-null values.
	 *
	 * @param left left value
	 * @param right right value
	 * @return negative, zero or positive as in {@link Comparable#compareTo(Object)}
	 * @throws EvaluationException if the values cannot be ordered against each other
	 */
	@SuppressWarnings("unchecked")
	public static int compare(Object left, Object right) {
		if (left instanceof Number && right instanceof Number) {
			Number l = (Number) left;
			Number r = (Number) right;
			if (!isFinite(l) || !isFinite(r)) {
				return Double.compare(l.doubleValue(), r.doubleValue());
			}
			return toBigDecimal(l).compareTo(toBigDecimal(r));
		}
		if (left instanceof Comparable) {
			try {
				return ((Comparable<Object>) left).compareTo(right);
			} catch (ClassCastException e) {
				throw new EvaluationException("Cannot compare " + describe(left) + " with " + describe(right), e);
			}
		}
		throw new EvaluationException("Cannot order " + describe(left));
	}

	/**
	 * Equality of two non-null values.
	 */
	public static boolean isEqual(Object left, Object right) {
		if (left instanceof Number && right instanceof Number) {
			return compare(left, right) == 0;
		}
		return left.equals(right);
	}

	/**
	 * Null-safe equality, as in <code>IS</code>: two {@code null} values are identical.
	 */
	public static boolean isIdentical(Object left, Object right) {
		if (left == null || right == null) {
			return left == right;
		}
		return isEqual(left, right);
	}

	/**
	 * SQL equality: <code>NULL</code> if either side is <code>NULL</code>.
	 */
	public static Boolean equal(Object left, Object right) {
		if (left == null || right == null) {
			return null;
		}
		return Boolean.valueOf(isEqual(left, right));
	}

	/**
	 * SQL ordering: <code>NULL</code> if either side is <code>NULL</code>,
	 * otherwise the sign of {@link #compare(Object, Object)}.
	 */
	public static Integer order(Object left, Object right) {
		if (left == null || right == null) {
			return null;
		}
		return Integer.valueOf(Integer.signum(compare(left, right)));
	}

	/**
	 * Membership of {@code item} in a list of values, as in SQL <code>IN</code>.
	 *
	 * @param item the searched value
	 * @param values a {@link Collection} of values
	 * @return {@code TRUE} if found, {@code NULL} if not found but either the item
	 *         or one of the values is <code>NULL</code>, {@code FALSE} otherwise
	 */
	public static Boolean in(Object item, Object values) {
		if (!(values instanceof Collection)) {
			throw new EvaluationException("IN requires a list of values, got " + describe(values));
		}
		if (item == null) {
			return null;
		}
		boolean sawNull = false;
		for (Object value : (Collection<?>) values) {
			if (value == null) {
				sawNull = true;
			} else if (isEqual(item, value)) {
				return Boolean.TRUE;
			}
		}
		return sawNull ? null : Boolean.FALSE;
	}

	/**
	 * @param o {@code null} or a {@link Boolean}
	 * @return the truth value of {@code o}, {@code null} for <code>NULL</code>
	 * @throws EvaluationException if {@code o} is not a truth value
	 */
	public static Boolean toBoolean(Object o) {
		if (o == null || o instanceof Boolean) {
			return (Boolean) o;
		}
		throw new EvaluationException("Not a truth value: " + describe(o));
	}

	public static Boolean not(Object o) {
		Boolean b = toBoolean(o);
		return b == null ? null : Boolean.valueOf(!b.booleanValue());
	}

	/**
	 * Three-valued conjunction.
	 */
	public static Boolean and(Object... operands) {
		boolean unknown = false;
		for (Object operand : operands) {
			Boolean b = toBoolean(operand);
			if (b == null) {
				unknown = true;
			} else if (!b.booleanValue()) {
				return Boolean.FALSE;
			}
		}
		return unknown ? null : Boolean.TRUE;
	}

	/**
	 * Three-valued disjunction.
	 */
	public static Boolean or(Object... operands) {
		boolean unknown = false;
		for (Object operand : operands) {
			Boolean b = toBoolean(operand);
			if (b == null) {
				unknown = true;
			} else if (b.booleanValue()) {
				return Boolean.TRUE;
			}
		}
		return unknown ? null : Boolean.FALSE;
	}

	public static Object negate(Object o) {
		if (o == null) {
			return null;
		}
		Number n = toNumber("-", o);
		try {
			if (isIntegral(n)) {
				return Math.negateExact(n.longValue());
			}
			if (n instanceof BigInteger) {
				return ((BigInteger) n).negate();
			}
			if (n instanceof BigDecimal) {
				return ((BigDecimal) n).negate();
			}
			return -n.doubleValue();
		} catch (ArithmeticException e) {
			throw new EvaluationException("Cannot negate " + describe(o), e);
		}
	}

	public static Object add(Object left, Object right) {
		return arithmetic('+', left, right);
	}

	public static Object subtract(Object left, Object right) {
		return arithmetic('-', left, right);
	}

	public static Object multiply(Object left, Object right) {
		return arithmetic('*', left, right);
	}

	/**
	 * Division; integral operands give a truncated integral result.
	 */
	public static Object divide(Object left, Object right) {
		return arithmetic('/', left, right);
	}

	public static Object modulo(Object left, Object right) {
		return arithmetic('%', left, right);
	}

	/**
	 * String concatenation of the two values.
	 */
	public static String concat(Object left, Object right) {
		if (left == null || right == null) {
			return null;
		}
		return String.valueOf(left) + right;
	}

	/**
	 * @return a description of a value and its type, for error messages
	 */
	public static String describe(Object o) {
		if (o == null) {
			return "NULL";
		}
		return o + " (" + o.getClass().getSimpleName() + ")";
	}

	private static Object arithmetic(char op, Object left, Object right) {
		if (left == null || right == null) {
			return null;
		}
		Number l = toNumber(String.valueOf(op), left);
		Number r = toNumber(String.valueOf(op), right);
		try {
			if (isIntegral(l) && isIntegral(r)) {
				long a = l.longValue();
				long b = r.longValue();
				switch (op) {
				case '+':
					return Math.addExact(a, b);
				case '-':
					return Math.subtractExact(a, b);
				case '*':
					return Math.multiplyExact(a, b);
				case '/':
					if (a == Long.MIN_VALUE && b == -1) {
						throw new ArithmeticException("long overflow");
					}
					return a / b;
				case '%':
					return a % b;
				default:
					throw new IllegalStateException("Unknown arithmetic operator: " + op);
				}
			}
			if (isFinite(l) && isFinite(r) && (isDecimal(l) || isDecimal(r))) {
				BigDecimal a = toBigDecimal(l);
				BigDecimal b = toBigDecimal(r);
				switch (op) {
				case '+':
					return a.add(b);
				case '-':
					return a.subtract(b);
				case '*':
					return a.multiply(b);
				case '/':
					return a.divide(b, MathContext.DECIMAL128);
				case '%':
					return a.remainder(b);
				default:
					throw new IllegalStateException("Unknown arithmetic operator: " + op);
				}
			}
			double a = l.doubleValue();
			double b = r.doubleValue();
			switch (op) {
			case '+':
				return a + b;
			case '-':
				return a - b;
			case '*':
				return a * b;
			case '/':
				if (b == 0) {
					throw new ArithmeticException("Division by zero");
				}
				return a / b;
			case '%':
				if (b == 0) {
					throw new ArithmeticException("Division by zero");
				}
				return a % b;
			default:
				throw new IllegalStateException("Unknown arithmetic operator: " + op);
			}
		} catch (ArithmeticException e) {
			throw new EvaluationException(
					"Cannot evaluate " + describe(left) + " " + op + " " + describe(right) + ": " + e.getMessage(),
					e);
		}
	}

	private static Number toNumber(String operation, Object o) {
		if (o instanceof Number) {
			return (Number) o;
		}
		throw new EvaluationException("Operator " + operation + " requires numbers, got " + describe(o));
	}

	private static boolean isIntegral(Number n) {
		return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
	}

	private static boolean isDecimal(Number n) {
		return n instanceof BigDecimal || n instanceof BigInteger;
	}

	private static boolean isFinite(Number n) {
		if (n instanceof Double || n instanceof Float) {
			return Double.isFinite(n.doubleValue());
		}
		return true;
	}

	private static BigDecimal toBigDecimal(Number n) {
		if (n instanceof BigDecimal) {
			return (BigDecimal) n;
		}
		if (n instanceof BigInteger) {
			return new BigDecimal((BigInteger) n);
		}
		if (isIntegral(n)) {
			return BigDecimal.valueOf(n.longValue());
		}
		return BigDecimal.valueOf(n.doubleValue());
	}
}
