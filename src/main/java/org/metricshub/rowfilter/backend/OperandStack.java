package org.metricshub.rowfilter.backend;
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

import java.util.Deque;
import java.util.LinkedList;

/**
 * Operand stack used by the {@link StackEvaluator}.
 * <p>
 * Holds <code>NULL</code> values, hence the {@link LinkedList}. Only
 * malformed symbol sequences can underflow it.
 */
class OperandStack {

	private final Deque<Object> operands = new LinkedList<Object>();

	void push(Object o) {
		operands.push(o);
	}

	Object pop() {
		if (operands.isEmpty()) {
			throw new IllegalStateException("Operand stack underflow");
		}
		return operands.pop();
	}

	/**
	 * Pops {@code count} operands, the most recently pushed first.
	 *
	 * @param count number of operands to pop
	 * @return the operands, in popped order
	 */
	Object[] popN(int count) {
		if (operands.size() < count) {
			throw new IllegalStateException(
					"Operand stack underflow: " + count + " operand(s) needed, " + operands.size() + " available");
		}
		Object[] popped = new Object[count];
		for (int i = 0; i < count; i++) {
			popped[i] = operands.pop();
		}
		return popped;
	}

	int size() {
		return operands.size();
	}

	@Override
	public String toString() {
		return operands.toString();
	}
}
