package org.metricshub.rowfilter;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.rowfilter.util.RowFilterLogger;
import org.slf4j.Logger;

public class RowFilterLoggerTest {

	@Test
	public void testLoggerSilencesSlf4jNotices() {
		Logger logger = RowFilterLogger.getLogger(RowFilter.class);
		assertEquals(RowFilter.class.getName(), logger.getName());
		assertEquals("WARN", System.getProperty("slf4j.internal.verbosity"));
	}
}
