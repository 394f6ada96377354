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

import java.util.Collection;
import java.util.Objects;

/**
 * A reference to a named column of a table.
 * <p>
 * Two columns are equal when they have the same table, name and declared type,
 * so a column can be used as the key of the value map handed to
 * {@link org.metricshub.rowfilter.CompiledExpression#evaluate(java.util.Map)}.
 * <p>
 * The helper methods build the usual predicates around this column, e.g.
 * <code>age.ge(18)</code> or <code>status.in("active", "pending")</code>.
 */
public final class Column extends ClauseElement {

	private static final long serialVersionUID = 1L;

	private final String table;
	private final String name;
	private final ColumnType type;

	/**
	 * Creates a column that does not belong to a named table.
	 *
	 * @param name name of the column
	 * @param type declared type of the column
	 */
	public Column(String name, ColumnType type) {
		this(null, name, type);
	}

	/**
	 * @param table name of the table, may be {@code null}
	 * @param name name of the column
	 * @param type declared type of the column
	 */
	public Column(String table, String name, ColumnType type) {
		this.table = table;
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
	}

	@Override
	public ElementKind getKind() {
		return ElementKind.COLUMN;
	}

	public String getTable() {
		return table;
	}

	public String getName() {
		return name;
	}

	public ColumnType getType() {
		return type;
	}

	/**
	 * @return {@code true} if the declared type of this column is boolean
	 */
	public boolean isBoolean() {
		return type.isBoolean();
	}

	/**
	 * @return <code>column IS NULL</code>
	 */
	public BinaryExpression isNull() {
		return new BinaryExpression(this, Operator.IS, Null.INSTANCE);
	}

	/**
	 * @return <code>column IS NOT NULL</code>
	 */
	public BinaryExpression isNotNull() {
		return new BinaryExpression(this, Operator.IS_NOT, Null.INSTANCE);
	}

	/**
	 * @return <code>column IS TRUE</code>
	 */
	public AsBoolean isTrue() {
		return new AsBoolean(this, Operator.IS_TRUE);
	}

	/**
	 * @return <code>column IS FALSE</code>
	 */
	public AsBoolean isFalse() {
		return new AsBoolean(this, Operator.IS_FALSE);
	}

	/**
	 * Comparing to {@code null} yields <code>column IS NULL</code>, as SQL
	 * equality with <code>NULL</code> is never true.
	 *
	 * @param value a value or another {@link ClauseElement}
	 * @return <code>column = value</code>
	 */
	public BinaryExpression eq(Object value) {
		if (value == null) {
			return isNull();
		}
		return new BinaryExpression(this, Operator.EQ, Expressions.literal(value));
	}

	/**
	 * Comparing to {@code null} yields <code>column IS NOT NULL</code>.
	 *
	 * @param value a value or another {@link ClauseElement}
	 * @return <code>column &lt;&gt; value</code>
	 */
	public BinaryExpression ne(Object value) {
		if (value == null) {
			return isNotNull();
		}
		return new BinaryExpression(this, Operator.NE, Expressions.literal(value));
	}

	public BinaryExpression lt(Object value) {
		return new BinaryExpression(this, Operator.LT, Expressions.literal(value));
	}

	public BinaryExpression le(Object value) {
		return new BinaryExpression(this, Operator.LE, Expressions.literal(value));
	}

	public BinaryExpression gt(Object value) {
		return new BinaryExpression(this, Operator.GT, Expressions.literal(value));
	}

	public BinaryExpression ge(Object value) {
		return new BinaryExpression(this, Operator.GE, Expressions.literal(value));
	}

	/**
	 * @param values the literal values to test membership against
	 * @return <code>column IN (values...)</code>
	 */
	public BinaryExpression in(Object... values) {
		return new BinaryExpression(this, Operator.IN, Grouping.of(values));
	}

	/**
	 * @param values the literal values to test membership against
	 * @return <code>column NOT IN (values...)</code>
	 */
	public BinaryExpression notIn(Object... values) {
		return new BinaryExpression(this, Operator.NOT_IN, Grouping.of(values));
	}

	/**
	 * Same as {@link #in(Object...)} with the values taken from a collection,
	 * e.g. <code>status.in(Arrays.asList("active", "pending"))</code>.
	 *
	 * @param values the literal values to test membership against
	 * @return <code>column IN (values...)</code>
	 */
	public BinaryExpression in(Collection<?> values) {
		return in(values.toArray());
	}

	/**
	 * @param values the literal values to test membership against
	 * @return <code>column NOT IN (values...)</code>
	 */
	public BinaryExpression notIn(Collection<?> values) {
		return notIn(values.toArray());
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Column)) {
			return false;
		}
		Column column = (Column) other;
		return Objects.equals(table, column.table) && name.equals(column.name) && type == column.type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(table, name, type);
	}

	@Override
	public String toString() {
		return table == null ? name : table + "." + name;
	}
}
