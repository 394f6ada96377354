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

/**
 * The shapes an expression tree node can take.
 */
public enum ElementKind {
	/**
	 * A bound literal value, see {@link BindParameter}.
	 */
	BIND_PARAMETER,
	/**
	 * A parenthesized list of scalar values, see {@link Grouping}.
	 */
	GROUPING,
	/**
	 * The SQL <code>NULL</code> literal, see {@link Null}.
	 */
	NULL,
	/**
	 * A column reference, see {@link Column}.
	 */
	COLUMN,
	/**
	 * A boolean column used with an explicit truth test, see {@link AsBoolean}.
	 */
	AS_BOOLEAN,
	/**
	 * An operator applied to a single operand, see {@link UnaryExpression}.
	 */
	UNARY,
	/**
	 * A conjunction or disjunction of clauses, see {@link BooleanClauseList}.
	 */
	CLAUSE_LIST,
	/**
	 * An operator applied to a left and a right operand, see {@link BinaryExpression}.
	 */
	BINARY,
	/**
	 * A SQL function call, see {@link FunctionElement}.
	 */
	FUNCTION,
	/**
	 * A raw SQL fragment, see {@link TextClause}.
	 */
	TEXT
}
