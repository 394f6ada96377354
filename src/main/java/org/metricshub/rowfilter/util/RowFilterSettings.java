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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a compilation.
 * These values have defaults, which may be changed when compiling
 * programmatically.
 */
public class RowFilterSettings implements CompileSettings {

	/**
	 * Whether bare non-boolean columns (and their negation) are coerced
	 * to <code>NULL</code> checks;
	 * <code>false</code> by default.
	 */
	private boolean forceBoolean = false;

	/**
	 * Whether to print the compiled instructions;
	 * <code>false</code> by default.
	 */
	private boolean dumpIntermediateCode = false;

	/**
	 * Output stream for dumps;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("forceBoolean = ").append(isForceBoolean()).append(newLine);
		desc.append("dumpIntermediateCode = ").append(isDumpIntermediateCode()).append(newLine);

		return desc.toString();
	}

	@Override
	public boolean isForceBoolean() {
		return forceBoolean;
	}

	/**
	 * @param forceBoolean whether to coerce non-boolean columns to <code>NULL</code> checks
	 */
	public void setForceBoolean(boolean forceBoolean) {
		this.forceBoolean = forceBoolean;
	}

	@Override
	public boolean isDumpIntermediateCode() {
		return dumpIntermediateCode;
	}

	public void setDumpIntermediateCode(boolean dumpIntermediateCode) {
		this.dumpIntermediateCode = dumpIntermediateCode;
	}

	@Override
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "PrintStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the stream to dump to (instead of System.out by default)
	 *
	 * @param pOutputStream PrintStream to use for dumps
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
