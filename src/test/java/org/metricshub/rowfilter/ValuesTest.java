package org.metricshub.rowfilter;

import static org.junit.Assert.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.rowfilter.intermediate.Opcode;
import org.metricshub.rowfilter.runtime.EvaluationException;
import org.metricshub.rowfilter.runtime.Values;

public class ValuesTest {

	@Test
	public void testNumbersCompareByValue() {
		assertTrue(Values.isEqual(18, 18L));
		assertTrue(Values.isEqual(18, 18.0));
		assertTrue(Values.isEqual(new BigDecimal("18.00"), 18));
		assertTrue(Values.compare(2, 10L) < 0);
		assertFalse(Values.isEqual("18", 18));
	}

	@Test
	public void testOtherComparables() {
		assertTrue(Values.compare("apple", "banana") < 0);
		assertTrue(Values.compare(LocalDate.of(2024, 1, 2), LocalDate.of(2023, 12, 31)) > 0);
		assertThrows(EvaluationException.class, () -> Values.compare("a", 1));
	}

	@Test
	public void testNullComparisons() {
		assertNull(Values.equal(null, 1));
		assertNull(Values.order(1, null));
		assertNull(Opcode.LT.apply(null, 3));
		assertNull(Opcode.NE.apply("x", null));
		assertTrue(Values.isIdentical(null, null));
		assertFalse(Values.isIdentical(null, 0));
		assertEquals(Boolean.TRUE, Opcode.IS.apply(null, null));
		assertEquals(Boolean.TRUE, Opcode.IS_NOT.apply(0, null));
	}

	@Test
	public void testThreeValuedLogic() {
		assertNull(Values.and(true, null));
		assertEquals(Boolean.FALSE, Values.and(false, null));
		assertEquals(Boolean.TRUE, Values.and(true, true, true));
		assertEquals(Boolean.TRUE, Values.or(true, null));
		assertNull(Values.or(false, null));
		assertEquals(Boolean.FALSE, Values.or(false, false));
		assertNull(Values.not(null));
		assertThrows(EvaluationException.class, () -> Values.and(true, "yes"));
	}

	@Test
	public void testMembership() {
		assertEquals(Boolean.TRUE, Values.in(2L, Arrays.asList(1, 2, 3)));
		assertEquals(Boolean.FALSE, Values.in(4, Arrays.asList(1, 2, 3)));
		assertNull(Values.in(4, Arrays.asList(1, null)));
		assertNull(Values.in(null, Arrays.asList(1, 2)));
		assertNull(Opcode.NOT_IN.apply(4, Arrays.asList(1, null)));
		assertThrows(EvaluationException.class, () -> Values.in(1, "1, 2"));
	}

	@Test
	public void testArithmetic() {
		assertEquals(Long.valueOf(5), Values.add(2, 3L));
		assertEquals(Long.valueOf(3), Values.divide(7, 2));
		assertEquals(Long.valueOf(1), Values.modulo(7, 3));
		assertEquals(3.5, (Double) Values.divide(7.0, 2), 0.0);
		assertEquals(0, new BigDecimal("3.10").compareTo((BigDecimal) Values.add(new BigDecimal("1.10"), 2)));
		assertEquals(Long.valueOf(-5), Values.negate(5));
		assertNull(Values.multiply(null, 2));
		assertEquals("a1", Values.concat("a", 1));
	}

	@Test
	public void testArithmeticFailures() {
		assertThrows(EvaluationException.class, () -> Values.divide(7, 0));
		assertThrows(EvaluationException.class, () -> Values.divide(7.0, 0.0));
		assertThrows(EvaluationException.class, () -> Values.add(Long.MAX_VALUE, 1));
		assertThrows(EvaluationException.class, () -> Values.divide(Long.MIN_VALUE, -1));
		assertThrows(EvaluationException.class, () -> Values.add("1", 1));
		assertThrows(EvaluationException.class, () -> Values.negate("x"));
	}

	@Test
	public void testOpcodeArity() {
		assertEquals(2, Opcode.GE.getArity());
		assertEquals(1, Opcode.NOT.getArity());
		assertEquals(Opcode.VARIADIC, Opcode.OR.getArity());
		assertTrue(Opcode.OR.acceptsArity(7));
		assertFalse(Opcode.NOT.acceptsArity(2));
	}
}
