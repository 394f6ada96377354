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
 * A boolean column tested with <code>IS TRUE</code> or <code>IS FALSE</code>.
 */
public final class AsBoolean extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final Column element;
	private final Operator operator;

	/**
	 * @param element the tested column
	 * @param operator {@link Operator#IS_TRUE} or {@link Operator#IS_FALSE}
	 */
	public AsBoolean(Column element, Operator operator) {
		this.element = Objects.requireNonNull(element, "element");
		if (operator == null || operator.getCategory() != Operator.Category.AS_BOOLEAN) {
			throw new IllegalArgumentException("Not a truth test operator: " + operator);
		}
		this.operator = operator;
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.AS_BOOLEAN;
	}

	public Column getElement() {
		return element;
	}

	public Operator getOperator() {
		return operator;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof AsBoolean)) {
			return false;
		}
		AsBoolean that = (AsBoolean) other;
		return element.equals(that.element) && operator == that.operator;
	}

	@Override
	public int hashCode() {
		return Objects.hash(element, operator);
	}

	@Override
	public String toString() {
		return element + " " + operator.getSymbol();
	}
}
