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
 * Declared type of a {@link Column}.
 * <p>
 * Only the distinction between {@link #BOOLEAN} and everything else matters to
 * the compiler: non-boolean columns used as truth values are coerced to a
 * <code>NULL</code> check.
 */
public enum ColumnType {
	BOOLEAN,
	INTEGER,
	DECIMAL,
	STRING,
	DATE,
	TIMESTAMP,
	BINARY,
	OTHER;

	/**
	 * @return {@code true} if values of this type are already truth values
	 */
	public boolean isBoolean() {
		return this == BOOLEAN;
	}
}
