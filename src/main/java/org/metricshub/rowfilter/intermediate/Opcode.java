package org.metricshub.rowfilter.intermediate;
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

import org.metricshub.rowfilter.runtime.Values;

/**
 * The functions an {@link SymbolType#OPERATOR} symbol can apply.
 * <p>
 * Operands are passed in the order they are popped off the operand stack: for
 * a binary opcode, <code>operands[0]</code> is the left operand and
 * <code>operands[1]</code> the right one, since the compiler pushes the right
 * operand first.
 * <p>
 * Value semantics are those of {@link Values}.
 */
public enum Opcode {
	/**
	 * Membership test against a list of values.
	 * <p>
	 * Stack before: x list ...<br/>
	 * Stack after: (x IN list) ...
	 */
	IN(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.in(operands[0], operands[1]);
		}
	},
	/**
	 * Negated membership test against a list of values.
	 * <p>
	 * Stack before: x list ...<br/>
	 * Stack after: (x NOT IN list) ...
	 */
	NOT_IN(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.not(Values.in(operands[0], operands[1]));
		}
	},
	/**
	 * Null-safe equality; never yields <code>NULL</code>.
	 * <p>
	 * Stack before: x y ...<br/>
	 * Stack after: (x IS y) ...
	 */
	IS(2) {
		@Override
		public Object apply(Object... operands) {
			return Boolean.valueOf(Values.isIdentical(operands[0], operands[1]));
		}
	},
	/**
	 * Null-safe inequality; never yields <code>NULL</code>.
	 * <p>
	 * Stack before: x y ...<br/>
	 * Stack after: (x IS NOT y) ...
	 */
	IS_NOT(2) {
		@Override
		public Object apply(Object... operands) {
			return Boolean.valueOf(!Values.isIdentical(operands[0], operands[1]));
		}
	},
	/**
	 * Logical negation.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: (NOT x) ...
	 */
	NOT(1) {
		@Override
		public Object apply(Object... operands) {
			return Values.not(operands[0]);
		}
	},
	/**
	 * Arithmetic negation.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: -x ...
	 */
	NEGATE(1) {
		@Override
		public Object apply(Object... operands) {
			return Values.negate(operands[0]);
		}
	},
	/**
	 * Conjunction of N truth values, N being the arity of the symbol.
	 * <p>
	 * Stack before: x1 x2 .. xN ...<br/>
	 * Stack after: (x1 AND x2 .. AND xN) ...
	 */
	AND(Opcode.VARIADIC) {
		@Override
		public Object apply(Object... operands) {
			return Values.and(operands);
		}
	},
	/**
	 * Disjunction of N truth values, N being the arity of the symbol.
	 * <p>
	 * Stack before: x1 x2 .. xN ...<br/>
	 * Stack after: (x1 OR x2 .. OR xN) ...
	 */
	OR(Opcode.VARIADIC) {
		@Override
		public Object apply(Object... operands) {
			return Values.or(operands);
		}
	},
	EQ(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.equal(operands[0], operands[1]);
		}
	},
	NE(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.not(Values.equal(operands[0], operands[1]));
		}
	},
	LT(2) {
		@Override
		public Object apply(Object... operands) {
			Integer sign = Values.order(operands[0], operands[1]);
			return sign == null ? null : Boolean.valueOf(sign.intValue() < 0);
		}
	},
	LE(2) {
		@Override
		public Object apply(Object... operands) {
			Integer sign = Values.order(operands[0], operands[1]);
			return sign == null ? null : Boolean.valueOf(sign.intValue() <= 0);
		}
	},
	GT(2) {
		@Override
		public Object apply(Object... operands) {
			Integer sign = Values.order(operands[0], operands[1]);
			return sign == null ? null : Boolean.valueOf(sign.intValue() > 0);
		}
	},
	GE(2) {
		@Override
		public Object apply(Object... operands) {
			Integer sign = Values.order(operands[0], operands[1]);
			return sign == null ? null : Boolean.valueOf(sign.intValue() >= 0);
		}
	},
	ADD(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.add(operands[0], operands[1]);
		}
	},
	SUBTRACT(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.subtract(operands[0], operands[1]);
		}
	},
	MULTIPLY(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.multiply(operands[0], operands[1]);
		}
	},
	DIVIDE(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.divide(operands[0], operands[1]);
		}
	},
	MODULO(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.modulo(operands[0], operands[1]);
		}
	},
	CONCAT(2) {
		@Override
		public Object apply(Object... operands) {
			return Values.concat(operands[0], operands[1]);
		}
	};

	/**
	 * Arity of opcodes accepting any number (at least one) of operands.
	 */
	public static final int VARIADIC = -1;

	private final int arity;

	Opcode(int arity) {
		this.arity = arity;
	}

	/**
	 * @return the number of operands, or {@link #VARIADIC}
	 */
	public int getArity() {
		return arity;
	}

	/**
	 * @param operandCount number of operands of a symbol
	 * @return whether this opcode can be applied to that many operands
	 */
	public boolean acceptsArity(int operandCount) {
		if (arity == VARIADIC) {
			return operandCount >= 1;
		}
		return operandCount == arity;
	}

	/**
	 * Applies this opcode.
	 *
	 * @param operands the operands, in the order they were popped
	 * @return the result to push back onto the operand stack
	 * @throws org.metricshub.rowfilter.runtime.EvaluationException if the operands
	 *         are not of a suitable type
	 */
	public abstract Object apply(Object... operands);
}
