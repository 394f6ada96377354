package org.metricshub.rowfilter;
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

import java.io.PrintStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.rowfilter.backend.StackEvaluator;
import org.metricshub.rowfilter.intermediate.Symbol;
import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.tree.Column;

/**
 * An expression compiled for repeated in-memory evaluation.
 * <p>
 * The expression is held as an immutable sequence of {@link Symbol}s in reverse
 * Polish notation, which {@link #evaluate(Map)} runs against substitute values
 * for the columns involved in the expression. A compiled expression can be
 * shared and evaluated concurrently.
 * <p>
 * Two compiled expressions are equal when their symbol sequences are equal.
 *
 * @see RowFilter#compile(ClauseElement, boolean)
 */
public final class CompiledExpression implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final StackEvaluator EVALUATOR = new StackEvaluator();

	private final ClauseElement sql;
	private final List<Symbol> symbols;

	/**
	 * @param sql the source expression, as rephrased for boolean semantics if requested
	 * @param symbols the compiled symbols
	 */
	CompiledExpression(ClauseElement sql, List<Symbol> symbols) {
		this.sql = sql;
		this.symbols = Collections.unmodifiableList(new ArrayList<Symbol>(symbols));
	}

	/**
	 * Evaluates the expression on the given column values.
	 *
	 * @param columnValues value of each column used in the expression;
	 *        {@code null} values stand for SQL <code>NULL</code>
	 * @return the value of the expression, {@code null} for SQL <code>NULL</code>
	 * @throws org.metricshub.rowfilter.runtime.MissingColumnValueException if a
	 *         column of {@link #referencedColumns()} has no entry in the map
	 * @throws org.metricshub.rowfilter.runtime.EvaluationException if an operator
	 *         is applied to values of unsuitable types
	 */
	public Object evaluate(Map<Column, ?> columnValues) {
		return EVALUATOR.evaluate(symbols, columnValues);
	}

	/**
	 * Whether a row satisfies this expression used as a filter, i.e. whether it
	 * evaluates to {@code TRUE}. <code>FALSE</code> and <code>NULL</code> both
	 * reject the row, as in a SQL <code>WHERE</code> clause.
	 *
	 * @param columnValues value of each column used in the expression
	 * @return {@code true} if the expression evaluates to {@link Boolean#TRUE}
	 */
	public boolean matches(Map<Column, ?> columnValues) {
		return Boolean.TRUE.equals(evaluate(columnValues));
	}

	/**
	 * @return the distinct columns used in the expression, in order of appearance
	 */
	public Set<Column> referencedColumns() {
		Set<Column> columns = new LinkedHashSet<Column>();
		for (Symbol symbol : symbols) {
			if (symbol.isColumn()) {
				columns.add(symbol.getColumn());
			}
		}
		return Collections.unmodifiableSet(columns);
	}

	/**
	 * @return the source expression, rephrased with boolean semantics when
	 *         compiled in force boolean mode
	 */
	public ClauseElement getSql() {
		return sql;
	}

	/**
	 * @return the unmodifiable list of compiled symbols
	 */
	public List<Symbol> getSymbols() {
		return symbols;
	}

	/**
	 * Prints the compiled symbols, one per line.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		ps.println("-- " + sql);
		for (int i = 0; i < symbols.size(); i++) {
			ps.println(i + " : " + symbols.get(i));
		}
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof CompiledExpression)) {
			return false;
		}
		return symbols.equals(((CompiledExpression) other).symbols);
	}

	@Override
	public int hashCode() {
		return symbols.hashCode();
	}

	@Override
	public String toString() {
		return "CompiledExpression[" + sql + "]";
	}
}
