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

import java.util.Objects;

/**
 * A binary operator applied to a left and a right operand.
 * <p>
 * Besides the operators of {@link Operator}, a binary expression may carry a
 * caller-defined operator (see {@link #custom(ClauseElement, String, ClauseElement)}),
 * in which case {@link #getOperator()} returns {@link Operator#CUSTOM}.
 */
public final class BinaryExpression extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final ClauseElement left;
	private final Operator operator;
	private final String customOperator;
	private final ClauseElement right;

	/**
	 * @param left left operand
	 * @param operator a binary operator other than {@link Operator#CUSTOM}
	 * @param right right operand
	 */
	public BinaryExpression(ClauseElement left, Operator operator, ClauseElement right) {
		this(left, operator, null, right);
		if (operator == Operator.CUSTOM) {
			throw new IllegalArgumentException("Custom operators must be created with BinaryExpression.custom()");
		}
	}

	private BinaryExpression(ClauseElement left, Operator operator, String customOperator, ClauseElement right) {
		if (operator == null || operator.getCategory() != Operator.Category.BINARY) {
			throw new IllegalArgumentException("Not a binary operator: " + operator);
		}
		this.left = Objects.requireNonNull(left, "left");
		this.operator = operator;
		this.customOperator = customOperator;
		this.right = Objects.requireNonNull(right, "right");
	}

	/**
	 * Creates an expression with an operator unknown to this library,
	 * e.g. <code>tags @&gt; 'x'</code>.
	 *
	 * @param left left operand
	 * @param operatorText the SQL spelling of the operator
	 * @param right right operand
	 * @return a new expression whose operator is {@link Operator#CUSTOM}
	 */
	public static BinaryExpression custom(ClauseElement left, String operatorText, ClauseElement right) {
		return new BinaryExpression(left, Operator.CUSTOM, Objects.requireNonNull(operatorText, "operatorText"), right);
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.BINARY;
	}

	public ClauseElement getLeft() {
		return left;
	}

	public Operator getOperator() {
		return operator;
	}

	/**
	 * @return the SQL spelling of a {@link Operator#CUSTOM} operator, {@code null} otherwise
	 */
	public String getCustomOperator() {
		return customOperator;
	}

	public ClauseElement getRight() {
		return right;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof BinaryExpression)) {
			return false;
		}
		BinaryExpression that = (BinaryExpression) other;
		return operator == that.operator
				&& Objects.equals(customOperator, that.customOperator)
				&& left.equals(that.left)
				&& right.equals(that.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operator, customOperator, right);
	}

	@Override
	public String toString() {
		String op = operator == Operator.CUSTOM ? customOperator : operator.getSymbol();
		return left + " " + op + " " + right;
	}
}
