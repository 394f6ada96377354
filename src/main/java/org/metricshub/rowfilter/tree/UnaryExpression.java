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
 * A unary operator applied to an operand: <code>NOT x</code> or <code>-x</code>.
 */
public final class UnaryExpression extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final Operator operator;
	private final ClauseElement element;

	/**
	 * @param operator {@link Operator#NOT} or {@link Operator#NEGATE}
	 * @param element the operand
	 */
	public UnaryExpression(Operator operator, ClauseElement element) {
		if (operator == null || operator.getCategory() != Operator.Category.UNARY) {
			throw new IllegalArgumentException("Not a unary operator: " + operator);
		}
		this.operator = operator;
		this.element = Objects.requireNonNull(element, "element");
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.UNARY;
	}

	public Operator getOperator() {
		return operator;
	}

	public ClauseElement getElement() {
		return element;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof UnaryExpression)) {
			return false;
		}
		UnaryExpression that = (UnaryExpression) other;
		return operator == that.operator && element.equals(that.element);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, element);
	}

	@Override
	public String toString() {
		return operator == Operator.NOT ? "NOT " + element : operator.getSymbol() + element;
	}
}
