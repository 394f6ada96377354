package org.metricshub.rowfilter.frontend;
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
import java.util.List;
import org.metricshub.rowfilter.tree.BooleanClauseList;
import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.tree.Column;
import org.metricshub.rowfilter.tree.ElementKind;
import org.metricshub.rowfilter.tree.Operator;
import org.metricshub.rowfilter.tree.UnaryExpression;
import org.metricshub.rowfilter.util.RowFilterLogger;
import org.slf4j.Logger;

/**
 * Rephrases an expression so that non-boolean columns can be used as truth
 * values.
 * <p>
 * A bare non-boolean column (one not used as an operand of a comparison)
 * becomes <code>column IS NOT NULL</code>, and its negation
 * <code>NOT column</code> becomes <code>column IS NULL</code>. Clauses of
 * <code>AND</code> / <code>OR</code> lists are rephrased recursively. Any other
 * node is returned as is.
 * <p>
 * The given tree is never modified: rephrased clause lists are new nodes.
 */
public final class BooleanRephraser {

	private static final Logger LOGGER = RowFilterLogger.getLogger(BooleanRephraser.class);

	private BooleanRephraser() {}

	/**
	 * @param expr the expression to rephrase
	 * @return an equivalent expression with boolean semantics for non-boolean columns
	 */
	public static ClauseElement rephrase(ClauseElement expr) {
		switch (expr.getKind()) {
		case COLUMN: {
			Column column = (Column) expr;
			if (column.isBoolean()) {
				return column;
			}
			LOGGER.trace("Rephrasing {} as IS NOT NULL", column);
			return column.isNotNull();
		}
		case UNARY: {
			UnaryExpression unary = (UnaryExpression) expr;
			if (isNegatedNonBooleanColumn(unary)) {
				LOGGER.trace("Rephrasing {} as IS NULL", unary);
				return ((Column) unary.getElement()).isNull();
			}
			return unary;
		}
		case CLAUSE_LIST: {
			BooleanClauseList clauseList = (BooleanClauseList) expr;
			List<ClauseElement> clauses = new ArrayList<ClauseElement>(clauseList.getClauses().size());
			for (ClauseElement clause : clauseList.getClauses()) {
				clauses.add(rephrase(clause));
			}
			return clauseList.withClauses(clauses);
		}
		default:
			return expr;
		}
	}

	/**
	 * @return whether the expression is <code>NOT column</code> with a non-boolean column
	 */
	static boolean isNegatedNonBooleanColumn(UnaryExpression unary) {
		if (unary.getOperator() != Operator.NOT || unary.getElement().getKind() != ElementKind.COLUMN) {
			return false;
		}
		return !((Column) unary.getElement()).isBoolean();
	}
}
