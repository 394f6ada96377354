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

/**
 * Kind of a {@link Symbol} in a compiled instruction sequence.
 */
public enum SymbolType {
	/**
	 * Pushes a constant value onto the operand stack.
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: value ...
	 */
	LITERAL,
	/**
	 * Pushes the value substituted for a column onto the operand stack.
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: column-value ...
	 */
	COLUMN,
	/**
	 * Pops N operands, applies an {@link Opcode} to them and pushes the result.
	 * <p>
	 * Stack before: x1 x2 .. xN ...<br/>
	 * Stack after: opcode(x1, x2, .. xN) ...
	 */
	OPERATOR
}
