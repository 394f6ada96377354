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

/**
 * Thrown when the expression uses an operator with no in-memory semantics,
 * such as a caller-defined operator.
 */
public class UnsupportedOperatorException extends RowFilterCompileException {

	private static final long serialVersionUID = 1L;

	private final String operator;

	/**
	 * @param operator SQL spelling of the offending operator
	 */
	public UnsupportedOperatorException(String operator) {
		super("Unsupported operator " + operator);
		this.operator = operator;
	}

	/**
	 * @return SQL spelling of the offending operator
	 */
	public String getOperator() {
		return operator;
	}
}
