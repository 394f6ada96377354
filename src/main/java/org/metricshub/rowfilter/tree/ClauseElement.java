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

import java.io.Serializable;

/**
 * Base class of every node of a filter expression tree.
 * <p>
 * The set of node shapes is closed: each concrete subclass reports exactly one
 * {@link ElementKind}, and the compiler dispatches on that kind rather than on
 * the runtime class of the node. Nodes are immutable and may be shared between
 * trees.
 *
 * @see org.metricshub.rowfilter.frontend.ExpressionCompiler
 */
public abstract class ClauseElement implements Serializable {

	private static final long serialVersionUID = 1L;

	/**
	 * @return the shape of this node
	 */
	public abstract ElementKind getKind();
}
