package rgv;

import org.junit.Test;

import java.io.InputStream;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.Assert.*;

public class RGVOptionsTest {

	@Test
	public void defaults() {
		RGVOptions options = new RGVOptions();
		assertTrue(options.sectionComments);
		assertTrue(options.reportDroppedFailures);
		assertEquals(Level.INFO, options.logLevel);
	}

	@Test
	public void loadFromClasspath() throws Exception {
		try (InputStream in = getClass().getResourceAsStream("/rgv/options.json")) {
			assertNotNull(in);
			RGVOptions options = RGVOptions.load(in, "options.json");
			assertFalse(options.sectionComments);
			assertFalse(options.reportDroppedFailures);
			assertEquals(Level.FINE, options.logLevel);
		}
	}

	// absent keys keep their defaults
	@Test
	public void partialConfiguration() throws RGVOptionException {
		RGVOptions options = RGVOptions.fromJSON("inline", "{\"sectionComments\": false}");
		assertFalse(options.sectionComments);
		assertTrue(options.reportDroppedFailures);
		assertEquals(Level.INFO, options.logLevel);
	}

	@Test(expected = RGVOptionException.class)
	public void malformedJSON() throws RGVOptionException {
		RGVOptions.fromJSON("inline", "{\"sectionComments\": ");
	}

	@Test(expected = RGVOptionException.class)
	public void wrongValueType() throws RGVOptionException {
		RGVOptions.fromJSON("inline", "{\"sectionComments\": \"sometimes\"}");
	}

	@Test(expected = RGVOptionException.class)
	public void unknownLogLevel() throws RGVOptionException {
		RGVOptions.fromJSON("inline", "{\"logLevel\": \"LOUD\"}");
	}

	@Test(expected = RGVOptionException.class)
	public void missingFile() throws RGVOptionException {
		RGVOptions.load(Paths.get("does", "not", "exist.json"));
	}

	@Test
	public void logLevelAppliesToTheRootLogger() throws RGVOptionException {
		RGVOptions options = RGVOptions.fromJSON("inline", "{\"logLevel\": \"WARNING\"}");
		options.applyLogLevel();
		assertEquals(Level.WARNING, Logger.getLogger(RGVOptions.LOGGER_NAME).getLevel());
		new RGVOptions().applyLogLevel();
	}
}
