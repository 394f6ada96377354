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
 * Operators that can appear in an expression tree.
 * <p>
 * Each operator belongs to one {@link Category}, which tells which node it may
 * be attached to. {@link #CUSTOM} stands for any operator defined by the caller
 * outside of this set; such operators have no known semantics and cannot be
 * compiled.
 */
public enum Operator {
	/** <code>left IN right</code> */
	IN(Category.BINARY, "IN"),
	/** <code>left NOT IN right</code> */
	NOT_IN(Category.BINARY, "NOT IN"),
	/** <code>left IS right</code> */
	IS(Category.BINARY, "IS"),
	/** <code>left IS NOT right</code> */
	IS_NOT(Category.BINARY, "IS NOT"),
	/** <code>column IS TRUE</code> */
	IS_TRUE(Category.AS_BOOLEAN, "IS TRUE"),
	/** <code>column IS FALSE</code> */
	IS_FALSE(Category.AS_BOOLEAN, "IS FALSE"),
	/** Logical negation */
	NOT(Category.UNARY, "NOT"),
	/** Arithmetic negation */
	NEGATE(Category.UNARY, "-"),
	/** Conjunction */
	AND(Category.CLAUSE_LIST, "AND"),
	/** Disjunction */
	OR(Category.CLAUSE_LIST, "OR"),
	EQ(Category.BINARY, "="),
	NE(Category.BINARY, "<>"),
	LT(Category.BINARY, "<"),
	LE(Category.BINARY, "<="),
	GT(Category.BINARY, ">"),
	GE(Category.BINARY, ">="),
	ADD(Category.BINARY, "+"),
	SUBTRACT(Category.BINARY, "-"),
	MULTIPLY(Category.BINARY, "*"),
	DIVIDE(Category.BINARY, "/"),
	MODULO(Category.BINARY, "%"),
	CONCAT(Category.BINARY, "||"),
	/** A caller-defined binary operator; see {@link BinaryExpression#getCustomOperator()} */
	CUSTOM(Category.BINARY, "?");

	/**
	 * The node shape an operator can be attached to.
	 */
	public enum Category {
		BINARY,
		UNARY,
		CLAUSE_LIST,
		AS_BOOLEAN
	}

	private final Category category;
	private final String symbol;

	Operator(Category category, String symbol) {
		this.category = category;
		this.symbol = symbol;
	}

	/**
	 * @return the node shape this operator can be attached to
	 */
	public Category getCategory() {
		return category;
	}

	/**
	 * @return the SQL spelling of this operator
	 */
	public String getSymbol() {
		return symbol;
	}
}
