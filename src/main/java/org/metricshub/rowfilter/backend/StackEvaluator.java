package org.metricshub.rowfilter.backend;
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

import java.util.List;
import java.util.Map;
import org.metricshub.rowfilter.intermediate.Symbol;
import org.metricshub.rowfilter.runtime.MissingColumnValueException;
import org.metricshub.rowfilter.tree.Column;

/**
 * Evaluates compiled symbols against substitute column values.
 * <p>
 * It walks the symbols in order with an operand stack: literals and column
 * values are pushed, operators pop their operands and push their result. Once
 * all symbols are processed, the single value left on the stack is the result.
 * <p>
 * The evaluator holds no state between calls: each evaluation has its own
 * operand stack, so one instance (and one symbol list) can serve any number of
 * concurrent evaluations.
 */
public class StackEvaluator {

	/**
	 * Evaluates the symbols.
	 *
	 * @param symbols the compiled expression, in reverse Polish notation
	 * @param columnValues value of each referenced column; a {@code null} value
	 *        stands for SQL <code>NULL</code>
	 * @return the value of the expression
	 * @throws MissingColumnValueException if a referenced column has no entry in
	 *         {@code columnValues}
	 * @throws org.metricshub.rowfilter.runtime.EvaluationException if an operator
	 *         cannot be applied to its operands
	 */
	public Object evaluate(List<Symbol> symbols, Map<Column, ?> columnValues) {
		OperandStack stack = new OperandStack();
		for (Symbol symbol : symbols) {
			switch (symbol.getType()) {
			case LITERAL:
				stack.push(symbol.getValue());
				break;
			case COLUMN: {
				Column column = symbol.getColumn();
				if (!columnValues.containsKey(column)) {
					throw new MissingColumnValueException(column);
				}
				stack.push(columnValues.get(column));
				break;
			}
			case OPERATOR:
				stack.push(symbol.getOpcode().apply(stack.popN(symbol.getArity())));
				break;
			default:
				throw new IllegalStateException("Unknown symbol type: " + symbol);
			}
		}
		if (stack.size() != 1) {
			throw new IllegalStateException("Malformed expression left " + stack.size() + " value(s) on the stack: " + stack);
		}
		return stack.pop();
	}
}
