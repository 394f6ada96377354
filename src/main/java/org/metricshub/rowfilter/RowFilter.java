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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.List;
import org.metricshub.rowfilter.frontend.BooleanRephraser;
import org.metricshub.rowfilter.frontend.ExpressionCompiler;
import org.metricshub.rowfilter.intermediate.Symbol;
import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.util.CompileSettings;
import org.metricshub.rowfilter.util.RowFilterLogger;
import org.metricshub.rowfilter.util.RowFilterSettings;
import org.slf4j.Logger;

/**
 * Entry point to compile filter expressions for in-memory evaluation.
 * <p>
 * Typical usage:
 *
 * <pre>
 * Column age = new Column("age", ColumnType.INTEGER);
 * Column status = new Column("status", ColumnType.STRING);
 * CompiledExpression filter = RowFilter.compile(
 * 		Expressions.and(age.ge(18), Expressions.or(status.eq("active"), status.eq("pending"))));
 *
 * Map&lt;Column, Object&gt; row = new HashMap&lt;Column, Object&gt;();
 * row.put(age, 20);
 * row.put(status, "pending");
 * filter.matches(row); // true
 * </pre>
 *
 * When compiling in <em>force boolean</em> mode, bare non-boolean columns and
 * their negations are used as truth values: a column is {@code FALSE} when it
 * is <code>NULL</code> (<code>IS NULL</code>) and {@code TRUE} otherwise.
 */
public final class RowFilter {

	private static final Logger LOGGER = RowFilterLogger.getLogger(RowFilter.class);

	private static final ExpressionCompiler COMPILER = new ExpressionCompiler();

	private RowFilter() {}

	/**
	 * Compiles an expression with its plain semantics.
	 *
	 * @param expression the expression tree
	 * @return the compiled expression
	 * @throws UnsupportedOperatorException if the tree uses a caller-defined operator
	 * @throws UnsupportedExpressionException if the tree contains a node that
	 *         cannot be evaluated in memory
	 */
	public static CompiledExpression compile(ClauseElement expression) {
		return compile(expression, false);
	}

	/**
	 * Compiles an expression.
	 *
	 * @param expression the expression tree
	 * @param forceBool {@code true} to use non-boolean columns as truth values;
	 *        {@link CompiledExpression#getSql()} then returns the rephrased tree
	 * @return the compiled expression
	 * @throws UnsupportedOperatorException if the tree uses a caller-defined operator
	 * @throws UnsupportedExpressionException if the tree contains a node that
	 *         cannot be evaluated in memory
	 */
	public static CompiledExpression compile(ClauseElement expression, boolean forceBool) {
		RowFilterSettings settings = new RowFilterSettings();
		settings.setForceBoolean(forceBool);
		return compile(expression, settings);
	}

	/**
	 * Compiles an expression according to the specified settings.
	 *
	 * @param expression the expression tree
	 * @param settings compilation settings
	 * @return the compiled expression
	 * @throws UnsupportedOperatorException if the tree uses a caller-defined operator
	 * @throws UnsupportedExpressionException if the tree contains a node that
	 *         cannot be evaluated in memory
	 */
	public static CompiledExpression compile(ClauseElement expression, CompileSettings settings) {
		boolean forceBool = settings.isForceBoolean();
		ClauseElement sql = forceBool ? BooleanRephraser.rephrase(expression) : expression;
		List<Symbol> symbols = COMPILER.compile(expression, forceBool);
		CompiledExpression compiled = new CompiledExpression(sql, symbols);

		if (settings.isDumpIntermediateCode()) {
			compiled.dump(settings.getOutputStream());
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Compiled expression:\n{}", dumpToString(compiled));
		}
		return compiled;
	}

	private static String dumpToString(CompiledExpression compiled) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try {
			PrintStream ps = new PrintStream(out, true, "UTF-8");
			compiled.dump(ps);
			return out.toString("UTF-8");
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException(e);
		}
	}
}
