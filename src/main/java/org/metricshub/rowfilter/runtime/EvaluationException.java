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

/**
 * A runtime exception thrown while evaluating a compiled expression. It is
 * provided to conveniently distinguish between evaluation errors and other
 * runtime exceptions.
 */
public class EvaluationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param msg description of the failure
	 */
	public EvaluationException(String msg) {
		super(msg);
	}

	/**
	 * @param msg description of the failure
	 * @param cause underlying cause
	 */
	public EvaluationException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
