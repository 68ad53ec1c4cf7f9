package ca.gc.cra.sbuild.api;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version stamped into {@code sbuild-linter.properties} at build time.
 */
final class BuildInfo {
  private static final Logger log = LoggerFactory.getLogger(BuildInfo.class);
  private static final String RESOURCE = "/sbuild-linter.properties";
  private static final String UNKNOWN = "dev";

  private BuildInfo() {}

  static String version() {
    try (InputStream in = BuildInfo.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        return UNKNOWN;
      }
      Properties properties = new Properties();
      properties.load(in);
      String version = properties.getProperty("version", UNKNOWN).trim();
      return version.isEmpty() || version.startsWith("${") ? UNKNOWN : version;
    } catch (IOException ex) {
      log.debug("Unable to read {}", RESOURCE, ex);
      return UNKNOWN;
    }
  }
}
