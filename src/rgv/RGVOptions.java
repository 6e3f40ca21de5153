package rgv;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-run translator configuration, read from a JSON document of the form
 *
 * <pre>
 * { "sectionComments": true, "logLevel": "INFO", "reportDroppedFailures": true }
 * </pre>
 *
 * Keys that are absent keep their defaults; unknown keys are ignored.
 */
public class RGVOptions {
	public static final String LOGGER_NAME = "RGV";

	// wrap every translated proof rule in BEGIN/END comments
	public boolean sectionComments = true;

	public Level logLevel = Level.INFO;

	// log backend failures that no error transformer matched
	public boolean reportDroppedFailures = true;

	public RGVOptions() {}

	public static RGVOptions load(Path configFile) throws RGVOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(configFile.toFile(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new RGVOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}
		return fromJSON(configFile.toString(), s);
	}

	public static RGVOptions load(InputStream in, String name) throws RGVOptionException {
		String s;
		try {
			s = IOUtils.toString(in, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new RGVOptionException("Error reading configuration " + name + ": " + ex.getMessage(), ex);
		}
		return fromJSON(name, s);
	}

	public static RGVOptions fromJSON(String name, String json) throws RGVOptionException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new RGVOptionException(name + ": parsing error: " + e.getMessage(), e);
		}

		RGVOptions options = new RGVOptions();
		try {
			if (config.has("sectionComments")) {
				options.sectionComments = config.getBoolean("sectionComments");
			}
			if (config.has("reportDroppedFailures")) {
				options.reportDroppedFailures = config.getBoolean("reportDroppedFailures");
			}
			if (config.has("logLevel")) {
				options.logLevel = Level.parse(config.getString("logLevel").toUpperCase());
			}
		} catch (JSONException | IllegalArgumentException e) {
			throw new RGVOptionException(name + ": invalid option value: " + e.getMessage(), e);
		}
		return options;
	}

	public void applyLogLevel() {
		Logger.getLogger(LOGGER_NAME).setLevel(logLevel);
	}
}
