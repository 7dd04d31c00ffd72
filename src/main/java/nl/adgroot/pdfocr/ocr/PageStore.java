package nl.adgroot.pdfocr.ocr;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code <stem>.json} page list. Pages in it are never requested again, which makes reruns
 * incremental.
 */
public class PageStore {

  private static final Logger log = LoggerFactory.getLogger(PageStore.class);

  private static final TypeReference<List<OcrPage>> PAGE_LIST = new TypeReference<>() {};

  private final Path jsonPath;
  private final ObjectMapper mapper;

  public PageStore(Path jsonPath) {
    this.jsonPath = jsonPath;
    this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  public Path path() {
    return jsonPath;
  }

  /**
   * Previously extracted pages, or an empty list when there is no usable file. An unreadable file
   * is logged and treated as absent; it is replaced on the next save.
   */
  public List<OcrPage> load() {
    if (!Files.isRegularFile(jsonPath)) {
      return List.of();
    }
    try {
      List<OcrPage> pages = mapper.readValue(jsonPath.toFile(), PAGE_LIST);
      List<OcrPage> valid = pages.stream().filter(p -> p.pageNumber() > 0).toList();
      log.info("Loaded existing JSON with {} pages from {}", valid.size(), jsonPath.getFileName());
      return valid;
    } catch (IOException e) {
      log.warn("Failed to load existing JSON {}: {}. Starting fresh.", jsonPath, e.getMessage());
      return List.of();
    }
  }

  /** Writes to a sibling temp file first, then moves it over the target. */
  public void save(List<OcrPage> pages) throws IOException {
    Path dir = jsonPath.toAbsolutePath().getParent();
    Path tmp = Files.createTempFile(dir, jsonPath.getFileName().toString(), ".tmp");
    try {
      mapper.writeValue(tmp.toFile(), pages);
      try {
        Files.move(tmp, jsonPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", jsonPath);
        Files.move(tmp, jsonPath, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  public static Set<Integer> pageNumbers(List<OcrPage> pages) {
    return pages.stream().map(OcrPage::pageNumber).collect(Collectors.toSet());
  }

  /**
   * Union keyed by absolute page number, sorted ascending. A page in {@code added} replaces an
   * existing page with the same number.
   */
  public static List<OcrPage> merge(List<OcrPage> existing, List<OcrPage> added) {
    Map<Integer, OcrPage> byNumber = new TreeMap<>();
    for (OcrPage p : existing) {
      byNumber.put(p.pageNumber(), p);
    }
    for (OcrPage p : added) {
      byNumber.put(p.pageNumber(), p);
    }
    return new ArrayList<>(byNumber.values());
  }
}
