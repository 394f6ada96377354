package org.metricshub.rowfilter;

import static org.junit.Assert.*;

import java.util.Collections;
import org.junit.Test;
import org.metricshub.rowfilter.frontend.BooleanRephraser;
import org.metricshub.rowfilter.tree.BinaryExpression;
import org.metricshub.rowfilter.tree.BooleanClauseList;
import org.metricshub.rowfilter.tree.ClauseElement;
import org.metricshub.rowfilter.tree.Column;
import org.metricshub.rowfilter.tree.ColumnType;
import org.metricshub.rowfilter.tree.Expressions;
import org.metricshub.rowfilter.tree.FunctionElement;
import org.metricshub.rowfilter.tree.Null;
import org.metricshub.rowfilter.tree.Operator;
import org.metricshub.rowfilter.tree.UnaryExpression;

public class BooleanRephraserTest {

	private static final Column NAME = new Column("users", "name", ColumnType.STRING);
	private static final Column ADMIN = new Column("users", "admin", ColumnType.BOOLEAN);

	@Test
	public void testNonBooleanColumnBecomesIsNotNull() {
		ClauseElement rephrased = BooleanRephraser.rephrase(NAME);
		assertEquals(new BinaryExpression(NAME, Operator.IS_NOT, Null.INSTANCE), rephrased);
	}

	@Test
	public void testBooleanColumnIsUnchanged() {
		assertSame(ADMIN, BooleanRephraser.rephrase(ADMIN));
	}

	@Test
	public void testNegatedNonBooleanColumnBecomesIsNull() {
		assertEquals(NAME.isNull(), BooleanRephraser.rephrase(Expressions.not(NAME)));
	}

	@Test
	public void testOtherNegationsAreUnchanged() {
		UnaryExpression notAdmin = Expressions.not(ADMIN);
		assertSame(notAdmin, BooleanRephraser.rephrase(notAdmin));

		UnaryExpression notComparison = Expressions.not(NAME.eq("root"));
		assertSame(notComparison, BooleanRephraser.rephrase(notComparison));

		UnaryExpression negated = Expressions.negate(NAME);
		assertSame(negated, BooleanRephraser.rephrase(negated));
	}

	@Test
	public void testClauseListIsRephrasedRecursively() {
		BooleanClauseList original = Expressions.or(
				NAME,
				Expressions.not(NAME),
				Expressions.and(ADMIN, NAME),
				NAME.eq("root"));

		BooleanClauseList rephrased = (BooleanClauseList) BooleanRephraser.rephrase(original);

		assertEquals(Operator.OR, rephrased.getOperator());
		assertEquals(4, rephrased.getClauses().size());
		assertEquals(NAME.isNotNull(), rephrased.getClauses().get(0));
		assertEquals(NAME.isNull(), rephrased.getClauses().get(1));
		assertEquals(Expressions.and(ADMIN, NAME.isNotNull()), rephrased.getClauses().get(2));
		assertEquals(NAME.eq("root"), rephrased.getClauses().get(3));
	}

	@Test
	public void testOriginalTreeIsNotModified() {
		BooleanClauseList original = Expressions.and(NAME, ADMIN);
		BooleanRephraser.rephrase(original);
		assertSame(NAME, original.getClauses().get(0));
		assertSame(ADMIN, original.getClauses().get(1));
	}

	@Test
	public void testOtherShapesAreUnchanged() {
		BinaryExpression comparison = NAME.eq("x");
		assertSame(comparison, BooleanRephraser.rephrase(comparison));

		FunctionElement function = new FunctionElement("lower", Collections.singletonList(NAME));
		assertSame(function, BooleanRephraser.rephrase(function));

		assertSame(Null.INSTANCE, BooleanRephraser.rephrase(Null.INSTANCE));
	}

	@Test
	public void testRephrasedTreeCompilesLikeForcedTree() {
		BooleanClauseList expr = Expressions.and(NAME, Expressions.not(NAME), ADMIN);
		assertEquals(
				RowFilter.compile(expr, true),
				RowFilter.compile(BooleanRephraser.rephrase(expr), false));
	}
}
