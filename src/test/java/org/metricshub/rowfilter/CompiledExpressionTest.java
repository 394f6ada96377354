package org.metricshub.rowfilter;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.rowfilter.runtime.EvaluationException;
import org.metricshub.rowfilter.runtime.MissingColumnValueException;
import org.metricshub.rowfilter.tree.BinaryExpression;
import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.tree.Column;
import org.metricshub.rowfilter.tree.ColumnType;
import org.metricshub.rowfilter.tree.Expressions;
import org.metricshub.rowfilter.tree.Operator;

public class CompiledExpressionTest {

	private static final Column AGE = new Column("age", ColumnType.INTEGER);
	private static final Column STATUS = new Column("status", ColumnType.STRING);
	private static final Column VERIFIED = new Column("verified", ColumnType.BOOLEAN);
	private static final Column A = new Column("a", ColumnType.INTEGER);
	private static final Column B = new Column("b", ColumnType.INTEGER);

	private static Map<Column, Object> row(Object... columnsAndValues) {
		Map<Column, Object> row = new HashMap<Column, Object>();
		for (int i = 0; i < columnsAndValues.length; i += 2) {
			row.put((Column) columnsAndValues[i], columnsAndValues[i + 1]);
		}
		return row;
	}

	private static ClauseElement adultAndActiveOrPending() {
		return Expressions.and(
				AGE.ge(18),
				Expressions.or(STATUS.eq("active"), STATUS.eq("pending")));
	}

	@Test
	public void testAdultActiveOrPending() {
		CompiledExpression filter = RowFilter.compile(adultAndActiveOrPending());
		assertEquals(Boolean.TRUE, filter.evaluate(row(AGE, 20, STATUS, "pending")));
		assertEquals(Boolean.FALSE, filter.evaluate(row(AGE, 16, STATUS, "active")));
		assertEquals(Boolean.FALSE, filter.evaluate(row(AGE, 30, STATUS, "closed")));
		assertTrue(filter.matches(row(AGE, 18L, STATUS, "active")));
	}

	@Test
	public void testNullRowIsRejectedByFilter() {
		CompiledExpression filter = RowFilter.compile(adultAndActiveOrPending());
		assertNull(filter.evaluate(row(AGE, null, STATUS, "active")));
		assertFalse(filter.matches(row(AGE, null, STATUS, "active")));
		assertEquals(Boolean.FALSE, filter.evaluate(row(AGE, null, STATUS, "closed")));
	}

	@Test
	public void testLeftRightOrderIsPreserved() {
		CompiledExpression lessThan = RowFilter.compile(new BinaryExpression(A, Operator.LT, B));
		assertEquals(Boolean.TRUE, lessThan.evaluate(row(A, 3, B, 5)));
		assertEquals(Boolean.FALSE, lessThan.evaluate(row(A, 5, B, 3)));

		CompiledExpression minus = RowFilter.compile(new BinaryExpression(A, Operator.SUBTRACT, B));
		assertEquals(Long.valueOf(-2), minus.evaluate(row(A, 3, B, 5)));

		CompiledExpression concat = RowFilter.compile(Expressions.binary(STATUS, Operator.CONCAT, "!"));
		assertEquals("done!", concat.evaluate(row(STATUS, "done")));
	}

	@Test
	public void testForcedColumnIsNullCheck() {
		CompiledExpression bare = RowFilter.compile(AGE, true);
		assertEquals(Boolean.FALSE, bare.evaluate(row(AGE, null)));
		assertEquals(Boolean.TRUE, bare.evaluate(row(AGE, 5)));

		CompiledExpression negated = RowFilter.compile(Expressions.not(AGE), true);
		assertEquals(Boolean.TRUE, negated.evaluate(row(AGE, null)));
		assertEquals(Boolean.FALSE, negated.evaluate(row(AGE, 5)));
	}

	@Test
	public void testForcedBooleanColumnKeepsItsValue() {
		CompiledExpression expr = RowFilter.compile(Expressions.and(VERIFIED, STATUS), true);
		assertEquals(Boolean.TRUE, expr.evaluate(row(VERIFIED, true, STATUS, "x")));
		assertEquals(Boolean.FALSE, expr.evaluate(row(VERIFIED, false, STATUS, "x")));
		assertEquals(Boolean.FALSE, expr.evaluate(row(VERIFIED, true, STATUS, null)));
	}

	@Test
	public void testTruthTests() {
		assertEquals(Boolean.TRUE, RowFilter.compile(VERIFIED.isTrue()).evaluate(row(VERIFIED, true)));
		assertEquals(Boolean.FALSE, RowFilter.compile(VERIFIED.isFalse()).evaluate(row(VERIFIED, true)));
		assertEquals(Boolean.TRUE, RowFilter.compile(VERIFIED.isFalse()).evaluate(row(VERIFIED, false)));
	}

	@Test
	public void testMembership() {
		CompiledExpression in = RowFilter.compile(STATUS.in("active", "pending"));
		assertEquals(Boolean.TRUE, in.evaluate(row(STATUS, "pending")));
		assertEquals(Boolean.FALSE, in.evaluate(row(STATUS, "closed")));

		CompiledExpression notIn = RowFilter.compile(AGE.notIn(1, 2, 3));
		assertEquals(Boolean.FALSE, notIn.evaluate(row(AGE, 2L)));
		assertEquals(Boolean.TRUE, notIn.evaluate(row(AGE, 4)));
	}

	@Test
	public void testMembershipInCollection() {
		CompiledExpression in = RowFilter.compile(STATUS.in(Arrays.asList("active", "pending")));
		assertEquals(RowFilter.compile(STATUS.in("active", "pending")), in);
		assertEquals(Boolean.TRUE, in.evaluate(row(STATUS, "pending")));
		assertEquals(Boolean.FALSE, in.evaluate(row(STATUS, "closed")));

		CompiledExpression notIn = RowFilter.compile(AGE.notIn(Arrays.asList(1, 2, 3)));
		assertEquals(Boolean.FALSE, notIn.evaluate(row(AGE, 2)));
		assertEquals(Boolean.TRUE, notIn.evaluate(row(AGE, 4)));
	}

	@Test
	public void testBoundCollectionIsCopiedAtCompileTime() {
		List<String> allowed = new ArrayList<String>();
		allowed.add("active");
		CompiledExpression filter = RowFilter.compile(Expressions.binary(STATUS, Operator.IN, allowed));
		CompiledExpression twin = RowFilter.compile(Expressions.binary(STATUS, Operator.IN, Arrays.asList("active")));
		int hashCode = filter.hashCode();
		assertEquals(Boolean.FALSE, filter.evaluate(row(STATUS, "pending")));

		allowed.add("pending");

		assertEquals(Boolean.FALSE, filter.evaluate(row(STATUS, "pending")));
		assertEquals(hashCode, filter.hashCode());
		assertEquals(twin, filter);
	}

	@Test
	public void testClauseListOfThree() {
		CompiledExpression expr = RowFilter.compile(Expressions.or(A.eq(1), A.eq(2), A.eq(3)));
		assertEquals(3, expr.getSymbols().get(expr.getSymbols().size() - 1).getArity());
		assertEquals(Boolean.TRUE, expr.evaluate(row(A, 3)));
		assertEquals(Boolean.FALSE, expr.evaluate(row(A, 4)));
	}

	@Test
	public void testEvaluationIsPure() {
		CompiledExpression filter = RowFilter.compile(adultAndActiveOrPending());
		Map<Column, Object> row = row(AGE, 20, STATUS, "pending");
		assertEquals(filter.evaluate(row), filter.evaluate(row));
		assertEquals(Boolean.FALSE, filter.evaluate(row(AGE, 20, STATUS, "closed")));
		assertEquals(Boolean.TRUE, filter.evaluate(row));
	}

	@Test
	public void testUnreferencedColumnsAreIgnored() {
		CompiledExpression filter = RowFilter.compile(AGE.gt(10));
		assertEquals(Boolean.TRUE, filter.evaluate(row(AGE, 11, STATUS, "whatever")));
	}

	@Test
	public void testReferencedColumns() {
		CompiledExpression filter = RowFilter.compile(adultAndActiveOrPending());
		assertEquals(new LinkedHashSet<Column>(Arrays.asList(AGE, STATUS)), filter.referencedColumns());

		CompiledExpression literalOnly = RowFilter.compile(Expressions.binary(1, Operator.LT, 2));
		assertTrue(literalOnly.referencedColumns().isEmpty());
		assertEquals(Boolean.TRUE, literalOnly.evaluate(new HashMap<Column, Object>()));
	}

	@Test
	public void testMissingColumnValue() {
		CompiledExpression filter = RowFilter.compile(adultAndActiveOrPending());
		MissingColumnValueException e = assertThrows(
				MissingColumnValueException.class,
				() -> filter.evaluate(row(AGE, 20)));
		assertEquals(STATUS, e.getColumn());
	}

	@Test
	public void testIncompatibleTypes() {
		CompiledExpression filter = RowFilter.compile(AGE.ge(18));
		assertThrows(EvaluationException.class, () -> filter.evaluate(row(AGE, "twenty")));
	}

	@Test
	public void testEquality() {
		CompiledExpression first = RowFilter.compile(adultAndActiveOrPending(), true);
		CompiledExpression second = RowFilter.compile(adultAndActiveOrPending(), true);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first, RowFilter.compile(AGE.ge(21)));
	}

	@Test
	public void testSqlIsRephrasedWhenForced() {
		ClauseElement expr = Expressions.and(STATUS, Expressions.not(AGE));
		assertSame(expr, RowFilter.compile(expr).getSql());
		assertEquals(Expressions.and(STATUS.isNotNull(), AGE.isNull()), RowFilter.compile(expr, true).getSql());
	}

	@Test
	public void testSerialization() throws Exception {
		CompiledExpression filter = RowFilter.compile(adultAndActiveOrPending());

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
			out.writeObject(filter);
		}
		CompiledExpression restored;
		try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
			restored = (CompiledExpression) in.readObject();
		}

		assertEquals(filter, restored);
		assertTrue(restored.matches(row(AGE, 20, STATUS, "active")));
	}
}
