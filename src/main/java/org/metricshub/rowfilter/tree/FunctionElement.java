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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A SQL function call such as <code>lower(name)</code>.
 * <p>
 * Functions are evaluated by the data store; expressions containing them
 * cannot be compiled for in-memory evaluation.
 */
public final class FunctionElement extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final String name;
	private final List<ClauseElement> arguments;

	public FunctionElement(String name, List<? extends ClauseElement> arguments) {
		this.name = Objects.requireNonNull(name, "name");
		this.arguments = Collections.unmodifiableList(new ArrayList<ClauseElement>(arguments));
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.FUNCTION;
	}

	public String getName() {
		return name;
	}

	public List<ClauseElement> getArguments() {
		return arguments;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof FunctionElement)) {
			return false;
		}
		FunctionElement that = (FunctionElement) other;
		return name.equals(that.name) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name).append('(');
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(arguments.get(i));
		}
		return sb.append(')').toString();
	}
}
