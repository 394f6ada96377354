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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parenthesized list of elements, typically the right-hand side of
 * <code>IN</code>: <code>('active', 'pending')</code>.
 * <p>
 * Only lists of literals ({@link BindParameter} and {@link Null}) can be
 * compiled.
 */
public final class Grouping extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final List<ClauseElement> elements;

	/**
	 * @param elements the elements between the parentheses
	 */
	public Grouping(List<? extends ClauseElement> elements) {
		this.elements = Collections.unmodifiableList(new ArrayList<ClauseElement>(elements));
	}

	/**
	 * Creates a grouping of literals.
	 *
	 * @param values the values; a {@link ClauseElement} is kept as is
	 * @return a new grouping
	 */
	public static Grouping of(Object... values) {
		List<ClauseElement> elements = new ArrayList<ClauseElement>(values.length);
		for (Object value : values) {
			elements.add(Expressions.literal(value));
		}
		return new Grouping(elements);
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.GROUPING;
	}

	public List<ClauseElement> getElements() {
		return elements;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Grouping)) {
			return false;
		}
		return elements.equals(((Grouping) other).elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(elements.get(i));
		}
		return sb.append(')').toString();
	}
}
