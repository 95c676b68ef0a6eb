package dev.microtest;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Version information stamped into {@code microtest.properties} by the Maven build. */
public final class BuildInfo {
    private static final Logger logger = LogManager.getLogger(BuildInfo.class);

    public static final String version = loadVersion();

    private BuildInfo() {}

    private static String loadVersion() {
        try (InputStream in = BuildInfo.class.getResourceAsStream("/microtest.properties")) {
            if (in == null) {
                return "unknown";
            }
            var props = new Properties();
            props.load(in);
            String value = props.getProperty("version", "unknown");
            // unfiltered resource, e.g. when running from an IDE
            return value.startsWith("${") ? "unknown" : value;
        } catch (IOException e) {
            logger.debug("Could not read microtest.properties: {}", e.getMessage());
            return "unknown";
        }
    }
}
