package org.metricshub.rowfilter.tree;
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

import java.util.Arrays;

/**
 * Factory methods to assemble expression trees.
 */
public final class Expressions {

	private Expressions() {}

	/**
	 * Wraps a value into a tree node.
	 *
	 * @param value a value; {@code null} gives {@link Null#INSTANCE} and a
	 *        {@link ClauseElement} is returned as is
	 * @return the corresponding node
	 */
	public static ClauseElement literal(Object value) {
		if (value == null) {
			return Null.INSTANCE;
		}
		if (value instanceof ClauseElement) {
			return (ClauseElement) value;
		}
		return new BindParameter(value);
	}

	public static BooleanClauseList and(ClauseElement... clauses) {
		return new BooleanClauseList(Operator.AND, Arrays.asList(clauses));
	}

	public static BooleanClauseList or(ClauseElement... clauses) {
		return new BooleanClauseList(Operator.OR, Arrays.asList(clauses));
	}

	public static UnaryExpression not(ClauseElement element) {
		return new UnaryExpression(Operator.NOT, element);
	}

	public static UnaryExpression negate(ClauseElement element) {
		return new UnaryExpression(Operator.NEGATE, element);
	}

	/**
	 * @param left left operand, a value or a {@link ClauseElement}
	 * @param operator a binary operator
	 * @param right right operand, a value or a {@link ClauseElement}
	 * @return <code>left operator right</code>
	 */
	public static BinaryExpression binary(Object left, Operator operator, Object right) {
		return new BinaryExpression(literal(left), operator, literal(right));
	}
}
