package dev.makefmt.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import picocli.CommandLine;

/**
 * Reads the version stamped into {@code makefmt.properties} at build time.
 */
public class VersionProvider implements CommandLine.IVersionProvider {

    static final String RESOURCE = "/makefmt.properties";
    static final String VERSION_KEY = "makefmt.version";
    static final String DEFAULT_VERSION = "dev";

    @Override
    public String[] getVersion() {
        return new String[] {"makefmt " + version()};
    }

    static String version() {
        try (InputStream stream = VersionProvider.class.getResourceAsStream(RESOURCE)) {
            if (stream == null) {
                return DEFAULT_VERSION;
            }
            Properties properties = new Properties();
            properties.load(stream);
            String version = properties.getProperty(VERSION_KEY, "").trim();
            // unfiltered resource when run from an IDE
            if (version.isEmpty() || version.startsWith("${")) {
                return DEFAULT_VERSION;
            }
            return version;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, ex);
        }
    }
}
