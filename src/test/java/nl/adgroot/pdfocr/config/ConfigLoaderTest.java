package nl.adgroot.pdfocr.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

  @TempDir
  Path dir;

  @Test
  void load_overridesOnlyGivenValues() throws Exception {
    Path file = dir.resolve("cfg.json");
    Files.writeString(file, "{\"batch\": {\"maxRetries\": 5}, \"gemini\": {\"model\": \"m\"}, \"unknown\": 1}",
        StandardCharsets.UTF_8);

    AppConfig cfg = ConfigLoader.load(file, Map.of());

    assertEquals(5, cfg.batch.maxRetries);
    assertEquals(10, cfg.batch.pollIntervalSeconds);
    assertEquals(18L * 1024 * 1024, cfg.batch.maxPayloadBytes);
    assertEquals("m", cfg.gemini.model);
  }

  @Test
  void apiKey_fallsBackToEnvironment() throws Exception {
    Path file = dir.resolve("cfg.json");
    Files.writeString(file, "{}", StandardCharsets.UTF_8);

    AppConfig cfg = ConfigLoader.load(file, Map.of(ConfigLoader.API_KEY_ENV, " secret "));

    assertEquals("secret", cfg.gemini.apiKey);
  }

  @Test
  void apiKey_fromConfigWinsOverEnvironment() {
    AppConfig cfg = new AppConfig();
    cfg.gemini.apiKey = "from-file";

    ConfigLoader.withApiKeyFallback(cfg, Map.of(ConfigLoader.API_KEY_ENV, "from-env"));

    assertEquals("from-file", cfg.gemini.apiKey);
  }

  @Test
  void nullSections_getDefaults() throws Exception {
    Path file = dir.resolve("cfg.json");
    Files.writeString(file, "{\"gemini\": null, \"batch\": null}", StandardCharsets.UTF_8);

    AppConfig cfg = ConfigLoader.load(file, Map.of());

    assertEquals(3, cfg.batch.maxRetries);
    assertEquals("", cfg.gemini.apiKey);
  }

  @Test
  void bundledConfig_matchesDefaults() throws Exception {
    AppConfig cfg = ConfigLoader.loadDefault(null);

    assertEquals(new AppConfig.BatchConfig().maxPayloadBytes, cfg.batch.maxPayloadBytes);
    assertEquals(1, cfg.batch.retryDelaySeconds);
  }
}
