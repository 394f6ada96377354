package org.metricshub.rowfilter.intermediate;
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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.Serializable;
import java.util.Objects;
import org.metricshub.rowfilter.tree.Column;

/**
 * A single instruction of a compiled expression.
 * <p>
 * A symbol is a <code>(type, arity, value)</code> triple:
 * <ul>
 * <li>{@link SymbolType#LITERAL}: the value is the constant to push, possibly
 * {@code null} or a list of values; the arity is {@link #NO_ARITY}.
 * <li>{@link SymbolType#COLUMN}: the value is the {@link Column} whose
 * substitute is pushed; the arity is {@link #NO_ARITY}.
 * <li>{@link SymbolType#OPERATOR}: the value is the {@link Opcode} to apply and
 * the arity the number of operands it pops.
 * </ul>
 * Symbols are immutable. Two symbols are equal when their three components are.
 */
@SuppressFBWarnings(value = "SE_BAD_FIELD", justification = "Literal payloads are caller values; serializing requires them to be serializable")
public final class Symbol implements Serializable {

	private static final long serialVersionUID = 1L;

	/**
	 * Arity of literal and column symbols.
	 */
	public static final int NO_ARITY = -1;

	private final SymbolType type;
	private final int arity;
	private final Object value;

	private Symbol(SymbolType type, int arity, Object value) {
		this.type = type;
		this.arity = arity;
		this.value = value;
	}

	/**
	 * @param value the constant to push, may be {@code null}
	 * @return a {@link SymbolType#LITERAL} symbol
	 */
	public static Symbol literal(Object value) {
		return new Symbol(SymbolType.LITERAL, NO_ARITY, value);
	}

	/**
	 * @param column the column whose substitute value is pushed
	 * @return a {@link SymbolType#COLUMN} symbol
	 */
	public static Symbol column(Column column) {
		return new Symbol(SymbolType.COLUMN, NO_ARITY, Objects.requireNonNull(column, "column"));
	}

	/**
	 * @param opcode the function to apply
	 * @param arity the number of operands to pop
	 * @return a {@link SymbolType#OPERATOR} symbol
	 * @throws IllegalArgumentException if the opcode does not accept that many operands
	 */
	public static Symbol operator(Opcode opcode, int arity) {
		Objects.requireNonNull(opcode, "opcode");
		if (!opcode.acceptsArity(arity)) {
			throw new IllegalArgumentException(opcode + " cannot be applied to " + arity + " operand(s)");
		}
		return new Symbol(SymbolType.OPERATOR, arity, opcode);
	}

	public SymbolType getType() {
		return type;
	}

	/**
	 * @return the number of operands of an operator, {@link #NO_ARITY} otherwise
	 */
	public int getArity() {
		return arity;
	}

	/**
	 * @return the literal value, the {@link Column} or the {@link Opcode}
	 */
	public Object getValue() {
		return value;
	}

	public boolean isColumn() {
		return type == SymbolType.COLUMN;
	}

	/**
	 * @return the referenced column
	 * @throws IllegalStateException if this is not a {@link SymbolType#COLUMN} symbol
	 */
	public Column getColumn() {
		if (type != SymbolType.COLUMN) {
			throw new IllegalStateException("Not a column symbol: " + this);
		}
		return (Column) value;
	}

	/**
	 * @return the opcode to apply
	 * @throws IllegalStateException if this is not a {@link SymbolType#OPERATOR} symbol
	 */
	public Opcode getOpcode() {
		if (type != SymbolType.OPERATOR) {
			throw new IllegalStateException("Not an operator symbol: " + this);
		}
		return (Opcode) value;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Symbol)) {
			return false;
		}
		Symbol that = (Symbol) other;
		return type == that.type && arity == that.arity && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, arity, value);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(type.name()).append(", ");
		if (type == SymbolType.OPERATOR) {
			sb.append(value).append('/').append(arity);
		} else if (value instanceof String) {
			sb.append('"').append(value).append('"');
		} else {
			sb.append(value);
		}
		return sb.toString();
	}
}
