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
import java.util.Objects;

/**
 * An <code>AND</code> or <code>OR</code> over any number of clauses.
 */
public final class BooleanClauseList extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final Operator operator;
	private final List<ClauseElement> clauses;

	/**
	 * @param operator {@link Operator#AND} or {@link Operator#OR}
	 * @param clauses the combined clauses, at least one
	 */
	public BooleanClauseList(Operator operator, List<? extends ClauseElement> clauses) {
		if (operator == null || operator.getCategory() != Operator.Category.CLAUSE_LIST) {
			throw new IllegalArgumentException("Not a clause list operator: " + operator);
		}
		if (clauses.isEmpty()) {
			throw new IllegalArgumentException(operator + " requires at least one clause");
		}
		for (ClauseElement clause : clauses) {
			Objects.requireNonNull(clause, "clause");
		}
		this.operator = operator;
		this.clauses = Collections.unmodifiableList(new ArrayList<ClauseElement>(clauses));
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.CLAUSE_LIST;
	}

	public Operator getOperator() {
		return operator;
	}

	public List<ClauseElement> getClauses() {
		return clauses;
	}

	/**
	 * Returns a clause list with the same operator over other clauses.
	 *
	 * @param newClauses the replacement clauses
	 * @return a new clause list, this one is left untouched
	 */
	public BooleanClauseList withClauses(List<? extends ClauseElement> newClauses) {
		return new BooleanClauseList(operator, newClauses);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof BooleanClauseList)) {
			return false;
		}
		BooleanClauseList that = (BooleanClauseList) other;
		return operator == that.operator && clauses.equals(that.clauses);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, clauses);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < clauses.size(); i++) {
			if (i > 0) {
				sb.append(' ').append(operator.getSymbol()).append(' ');
			}
			sb.append(clauses.get(i));
		}
		return sb.append(')').toString();
	}
}
