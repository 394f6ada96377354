package org.metricshub.rowfilter;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.rowfilter.tree.Column;
import org.metricshub.rowfilter.tree.ColumnType;
import org.metricshub.rowfilter.tree.Expressions;
import org.metricshub.rowfilter.util.RowFilterSettings;

public class RowFilterSettingsTest {

	private static final Column AGE = new Column("age", ColumnType.INTEGER);
	private static final Column NICKNAME = new Column("nickname", ColumnType.STRING);

	@Test
	public void testDefaults() {
		RowFilterSettings settings = new RowFilterSettings();
		assertFalse(settings.isForceBoolean());
		assertFalse(settings.isDumpIntermediateCode());
		assertSame(System.out, settings.getOutputStream());
		assertEquals("forceBoolean = false\ndumpIntermediateCode = false\n", settings.toDescriptionString());
	}

	@Test
	public void testDumpIntermediateCode() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		RowFilterSettings settings = new RowFilterSettings();
		settings.setDumpIntermediateCode(true);
		settings.setOutputStream(new PrintStream(out, true, "UTF-8"));

		RowFilter.compile(AGE.ge(18), settings);

		String dump = new String(out.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(dump, dump.contains("0 : LITERAL, 18"));
		assertTrue(dump, dump.contains("1 : COLUMN, age"));
		assertTrue(dump, dump.contains("2 : OPERATOR, GE/2"));
	}

	@Test
	public void testNoDumpByDefault() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		RowFilterSettings settings = new RowFilterSettings();
		settings.setOutputStream(new PrintStream(out, true, "UTF-8"));

		RowFilter.compile(AGE.ge(18), settings);

		assertEquals(0, out.size());
	}

	@Test
	public void testForceBooleanSetting() {
		RowFilterSettings settings = new RowFilterSettings();
		settings.setForceBoolean(true);

		CompiledExpression expr = RowFilter.compile(Expressions.and(Expressions.not(NICKNAME), AGE.gt(3)), settings);

		assertEquals(RowFilter.compile(Expressions.and(Expressions.not(NICKNAME), AGE.gt(3)), true), expr);
		assertEquals(Expressions.and(NICKNAME.isNull(), AGE.gt(3)), expr.getSql());
	}
}
