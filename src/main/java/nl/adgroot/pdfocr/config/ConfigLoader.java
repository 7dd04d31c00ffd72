package nl.adgroot.pdfocr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  public static final String WORKING_DIR_CONFIG = "ai_config.json";
  public static final String CLASSPATH_CONFIG = "config.json";
  public static final String API_KEY_ENV = "GEMINI_API_KEY";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) throws IOException {
    return load(configPath, System.getenv());
  }

  /**
   * Reads the given config file and applies the API key fallback from {@code env}.
   */
  public static AppConfig load(Path configPath, Map<String, String> env) throws IOException {
    AppConfig cfg;
    try (InputStream in = Files.newInputStream(configPath)) {
      cfg = MAPPER.readValue(in, AppConfig.class);
    }
    log.info("Loaded config from {}", configPath.toAbsolutePath());
    return withApiKeyFallback(cfg, env);
  }

  /**
   * Lookup order: explicit path, {@value #WORKING_DIR_CONFIG} in the working directory,
   * {@value #CLASSPATH_CONFIG} on the classpath, built-in defaults.
   */
  public static AppConfig loadDefault(Path explicitPath) throws IOException {
    if (explicitPath != null) {
      return load(explicitPath);
    }

    Path local = Path.of(WORKING_DIR_CONFIG);
    if (Files.isRegularFile(local)) {
      return load(local);
    }

    try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
      if (in != null) {
        log.debug("Using classpath {}", CLASSPATH_CONFIG);
        return withApiKeyFallback(MAPPER.readValue(in, AppConfig.class), System.getenv());
      }
    }

    return withApiKeyFallback(new AppConfig(), System.getenv());
  }

  static AppConfig withApiKeyFallback(AppConfig cfg, Map<String, String> env) {
    if (cfg.gemini == null) {
      cfg.gemini = new AppConfig.GeminiConfig();
    }
    if (cfg.batch == null) {
      cfg.batch = new AppConfig.BatchConfig();
    }
    if (cfg.gemini.apiKey == null || cfg.gemini.apiKey.isBlank()) {
      String fromEnv = env.get(API_KEY_ENV);
      cfg.gemini.apiKey = fromEnv == null ? "" : fromEnv.trim();
    }
    return cfg;
  }
}
