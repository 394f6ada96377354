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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * A literal value bound into the expression.
 */
@SuppressFBWarnings(value = "SE_BAD_FIELD", justification = "Bound values are caller objects; serializing the tree requires them to be serializable")
public final class BindParameter extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final Object value;

	/**
	 * @param value the bound value, may be {@code null}
	 */
	public BindParameter(Object value) {
		this.value = value;
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.BIND_PARAMETER;
	}

	public Object getValue() {
		return value;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof BindParameter)) {
			return false;
		}
		return Objects.equals(value, ((BindParameter) other).value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public String toString() {
		if (value instanceof String) {
			return "'" + value + "'";
		}
		return String.valueOf(value);
	}
}
