package org.metricshub.rowfilter;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.rowfilter.backend.StackEvaluator;
import org.metricshub.rowfilter.intermediate.Opcode;
import org.metricshub.rowfilter.intermediate.Symbol;
import org.metricshub.rowfilter.runtime.MissingColumnValueException;
import org.metricshub.rowfilter.tree.Column;
import org.metricshub.rowfilter.tree.ColumnType;

public class StackEvaluatorTest {

	private static final StackEvaluator EVALUATOR = new StackEvaluator();

	private static final Map<Column, Object> NO_VALUES = Collections.<Column, Object>emptyMap();

	@Test
	public void testOperatorReceivesOperandsInPoppedOrder() {
		// 3 is pushed last, so it is the left operand: 3 < 5
		List<Symbol> symbols = Arrays.asList(Symbol.literal(5), Symbol.literal(3), Symbol.operator(Opcode.LT, 2));
		assertEquals(Boolean.TRUE, EVALUATOR.evaluate(symbols, NO_VALUES));

		symbols = Arrays.asList(Symbol.literal(2), Symbol.literal(10), Symbol.operator(Opcode.SUBTRACT, 2));
		assertEquals(Long.valueOf(8), EVALUATOR.evaluate(symbols, NO_VALUES));
	}

	@Test
	public void testVariadicOperatorPopsItsArity() {
		List<Symbol> symbols = Arrays.asList(
				Symbol.literal(false),
				Symbol.literal(true),
				Symbol.literal(true),
				Symbol.literal(true),
				Symbol.operator(Opcode.AND, 3),
				Symbol.operator(Opcode.AND, 2));
		assertEquals(Boolean.FALSE, EVALUATOR.evaluate(symbols, NO_VALUES));
	}

	@Test
	public void testColumnValuesAreSubstituted() {
		Column size = new Column("size", ColumnType.INTEGER);
		List<Symbol> symbols = Arrays.asList(Symbol.literal(100), Symbol.column(size), Symbol.operator(Opcode.GT, 2));

		Map<Column, Object> values = new HashMap<Column, Object>();
		values.put(size, 150);
		assertEquals(Boolean.TRUE, EVALUATOR.evaluate(symbols, values));
		values.put(size, 50);
		assertEquals(Boolean.FALSE, EVALUATOR.evaluate(symbols, values));
		values.put(size, null);
		assertNull(EVALUATOR.evaluate(symbols, values));

		values.clear();
		assertThrows(MissingColumnValueException.class, () -> EVALUATOR.evaluate(symbols, values));
	}

	@Test
	public void testLiteralValuesArePushedUnchanged() {
		List<Object> list = Arrays.<Object>asList("a", "b");
		assertSame(list, EVALUATOR.evaluate(Collections.singletonList(Symbol.literal(list)), NO_VALUES));
		assertNull(EVALUATOR.evaluate(Collections.singletonList(Symbol.literal(null)), NO_VALUES));
	}

	@Test
	public void testMalformedSequences() {
		assertThrows(
				IllegalStateException.class,
				() -> EVALUATOR.evaluate(Collections.singletonList(Symbol.operator(Opcode.NOT, 1)), NO_VALUES));
		assertThrows(
				IllegalStateException.class,
				() -> EVALUATOR.evaluate(Arrays.asList(Symbol.literal(1), Symbol.literal(2)), NO_VALUES));
	}
}
