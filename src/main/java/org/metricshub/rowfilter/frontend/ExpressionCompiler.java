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
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.metricshub.rowfilter.UnsupportedExpressionException;
import org.metricshub.rowfilter.UnsupportedOperatorException;
import org.metricshub.rowfilter.intermediate.Opcode;
import org.metricshub.rowfilter.intermediate.Symbol;
import org.metricshub.rowfilter.tree.AsBoolean;
import org.metricshub.rowfilter.tree.BinaryExpression;
import org.metricshub.rowfilter.tree.BindParameter;
import org.metricshub.rowfilter.tree.BooleanClauseList;
import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.tree.Column;
import org.metricshub.rowfilter.tree.ElementKind;
import org.metricshub.rowfilter.tree.Grouping;
import org.metricshub.rowfilter.tree.Operator;
import org.metricshub.rowfilter.tree.UnaryExpression;
import org.metricshub.rowfilter.util.RowFilterLogger;
import org.slf4j.Logger;

/**
 * Compiles an expression tree into a sequence of {@link Symbol}s in reverse
 * Polish notation: operands come before the operator that consumes them.
 * <p>
 * The right operand of a binary expression is emitted before the left one, so
 * that the evaluator, which pops the most recently pushed value first, hands
 * the operands to the {@link Opcode} in left, right order.
 * <p>
 * In <em>force boolean</em> mode, bare non-boolean columns found where a truth
 * value is expected are compiled as <code>column IS NOT NULL</code>, and their
 * negation as <code>column IS NULL</code> (see {@link BooleanRephraser}).
 * <p>
 * Compilation is deterministic: the same tree and mode always give the same
 * symbols.
 */
public class ExpressionCompiler {

	private static final Logger LOGGER = RowFilterLogger.getLogger(ExpressionCompiler.class);

	/**
	 * Opcodes evaluating an operator directly, shared by binary expressions and
	 * truth tests. {@link Operator#IS_TRUE} is the identity and has no entry.
	 */
	private static final Map<Operator, Opcode> DIRECT_EQUIVALENTS = new EnumMap<Operator, Opcode>(Operator.class);

	static {
		DIRECT_EQUIVALENTS.put(Operator.IN, Opcode.IN);
		DIRECT_EQUIVALENTS.put(Operator.IS, Opcode.IS);
		DIRECT_EQUIVALENTS.put(Operator.IS_NOT, Opcode.IS_NOT);
		DIRECT_EQUIVALENTS.put(Operator.IS_FALSE, Opcode.NOT);
	}

	/**
	 * Compiles an expression.
	 *
	 * @param expr the root of the expression tree
	 * @param forceBool whether to coerce non-boolean columns to <code>NULL</code> checks
	 * @return the unmodifiable list of symbols
	 * @throws UnsupportedOperatorException if the tree uses a caller-defined operator
	 * @throws UnsupportedExpressionException if the tree contains a node that cannot
	 *         be evaluated in memory
	 */
	public List<Symbol> compile(ClauseElement expr, boolean forceBool) {
		List<Symbol> symbols = new ArrayList<Symbol>();
		serialize(expr, forceBool, symbols);
		LOGGER.debug("Compiled {} into {} symbols (forceBool={})", expr, symbols.size(), forceBool);
		return Collections.unmodifiableList(symbols);
	}

	private void serialize(ClauseElement expr, boolean forceBool, List<Symbol> symbols) {
		switch (expr.getKind()) {
		// Simple and direct value types
		case BIND_PARAMETER:
			symbols.add(Symbol.literal(boundValue((BindParameter) expr)));
			break;
		case GROUPING:
			symbols.add(Symbol.literal(groupingValues((Grouping) expr)));
			break;
		case NULL:
			symbols.add(Symbol.literal(null));
			break;
		// Columns and column-wrapping expressions
		case COLUMN: {
			Column column = (Column) expr;
			if (forceBool && !column.isBoolean()) {
				serialize(column.isNotNull(), false, symbols);
			} else {
				symbols.add(Symbol.column(column));
			}
			break;
		}
		case AS_BOOLEAN: {
			AsBoolean asBoolean = (AsBoolean) expr;
			serialize(asBoolean.getElement(), false, symbols);
			if (asBoolean.getOperator() != Operator.IS_TRUE) {
				symbols.add(Symbol.operator(directEquivalent(asBoolean.getOperator()), 1));
			}
			break;
		}
		case UNARY: {
			UnaryExpression unary = (UnaryExpression) expr;
			if (forceBool && BooleanRephraser.isNegatedNonBooleanColumn(unary)) {
				serialize(((Column) unary.getElement()).isNull(), false, symbols);
			} else {
				serialize(unary.getElement(), forceBool, symbols);
				symbols.add(Symbol.operator(toOpcode(unary.getOperator()), 1));
			}
			break;
		}
		// Multi-clause expressions
		case CLAUSE_LIST: {
			BooleanClauseList clauseList = (BooleanClauseList) expr;
			for (ClauseElement clause : clauseList.getClauses()) {
				serialize(clause, forceBool, symbols);
			}
			symbols.add(Symbol.operator(toOpcode(clauseList.getOperator()), clauseList.getClauses().size()));
			break;
		}
		case BINARY: {
			BinaryExpression binary = (BinaryExpression) expr;
			if (binary.getOperator() == Operator.CUSTOM) {
				throw new UnsupportedOperatorException(binary.getCustomOperator());
			}
			serialize(binary.getRight(), false, symbols);
			serialize(binary.getLeft(), false, symbols);
			symbols.add(Symbol.operator(directEquivalent(binary.getOperator()), 2));
			break;
		}
		default:
			throw new UnsupportedExpressionException(expr);
		}
	}

	/**
	 * @return the bound value, with collections copied so that later changes by
	 *         the caller do not reach the compiled symbols
	 */
	private static Object boundValue(BindParameter parameter) {
		Object value = parameter.getValue();
		if (value instanceof Collection) {
			return Collections.unmodifiableList(new ArrayList<Object>((Collection<?>) value));
		}
		return value;
	}

	private static List<Object> groupingValues(Grouping grouping) {
		List<Object> values = new ArrayList<Object>(grouping.getElements().size());
		for (ClauseElement element : grouping.getElements()) {
			if (element.getKind() == ElementKind.BIND_PARAMETER) {
				values.add(((BindParameter) element).getValue());
			} else if (element.getKind() == ElementKind.NULL) {
				values.add(null);
			} else {
				throw new UnsupportedExpressionException(
						grouping,
						"Unsupported element " + element + " of type " + element.getKind() + " in grouping " + grouping);
			}
		}
		return Collections.unmodifiableList(values);
	}

	/**
	 * @return the direct-evaluation opcode of an operator, falling back to its plain opcode
	 */
	private static Opcode directEquivalent(Operator operator) {
		Opcode opcode = DIRECT_EQUIVALENTS.get(operator);
		return opcode != null ? opcode : toOpcode(operator);
	}

	private static Opcode toOpcode(Operator operator) {
		switch (operator) {
		case IN:
			return Opcode.IN;
		case NOT_IN:
			return Opcode.NOT_IN;
		case IS:
			return Opcode.IS;
		case IS_NOT:
			return Opcode.IS_NOT;
		case NOT:
			return Opcode.NOT;
		case NEGATE:
			return Opcode.NEGATE;
		case AND:
			return Opcode.AND;
		case OR:
			return Opcode.OR;
		case EQ:
			return Opcode.EQ;
		case NE:
			return Opcode.NE;
		case LT:
			return Opcode.LT;
		case LE:
			return Opcode.LE;
		case GT:
			return Opcode.GT;
		case GE:
			return Opcode.GE;
		case ADD:
			return Opcode.ADD;
		case SUBTRACT:
			return Opcode.SUBTRACT;
		case MULTIPLY:
			return Opcode.MULTIPLY;
		case DIVIDE:
			return Opcode.DIVIDE;
		case MODULO:
			return Opcode.MODULO;
		case CONCAT:
			return Opcode.CONCAT;
		default:
			throw new UnsupportedOperatorException(operator.getSymbol());
		}
	}
}
