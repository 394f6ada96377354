package org.metricshub.rowfilter.runtime;
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

import org.metricshub.rowfilter.tree.Column;

/**
 * Thrown when an expression is evaluated against a value map that has no entry
 * for one of the columns the expression references.
 * <p>
 * A map entry whose value is {@code null} is a valid SQL <code>NULL</code> and
 * does not trigger this exception.
 */
public class MissingColumnValueException extends EvaluationException {

	private static final long serialVersionUID = 1L;

	private final Column column;

	/**
	 * @param column the column with no supplied value
	 */
	public MissingColumnValueException(Column column) {
		super("No value supplied for column " + column);
		this.column = column;
	}

	/**
	 * @return the column with no supplied value
	 */
	public Column getColumn() {
		return column;
	}
}
