package org.metricshub.rowfilter.util;
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

/**
 * Settings used during compilation of filter expressions.
 */
public interface CompileSettings {

	/**
	 * @return {@code true} to coerce non-boolean columns used as truth values
	 *         into <code>IS NOT NULL</code> / <code>IS NULL</code> tests
	 */
	boolean isForceBoolean();

	/**
	 * @return {@code true} to dump the compiled instructions
	 */
	boolean isDumpIntermediateCode();

	/**
	 * @return where the compiled instructions are dumped
	 */
	PrintStream getOutputStream();
}
