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

import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.tree.ElementKind;

/**
 * Thrown when the expression contains a node the compiler does not know how to
 * evaluate in memory.
 */
public class UnsupportedExpressionException extends RowFilterCompileException {

	private static final long serialVersionUID = 1L;

	private final ElementKind kind;

	/**
	 * @param expression the offending node
	 */
	public UnsupportedExpressionException(ClauseElement expression) {
		this(expression, "Unsupported expression " + expression + " of type " + expression.getKind());
	}

	/**
	 * @param expression the offending node
	 * @param message description of the failure
	 */
	public UnsupportedExpressionException(ClauseElement expression, String message) {
		super(message);
		this.kind = expression.getKind();
	}

	/**
	 * @return the shape of the offending node
	 */
	public ElementKind getKind() {
		return kind;
	}
}
