package dev.sqljudge.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Loads benchmark datasets: JSON arrays of {@link QueryRecord} objects.
 *
 * <p>A location starting with {@code classpath:} is resolved on the classpath, anything else as a
 * filesystem path.
 */
@Component
public class DatasetLoader {

  private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

  static final String CLASSPATH_PREFIX = "classpath:";

  private final ObjectMapper objectMapper;

  public DatasetLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Reads all records from a dataset file.
   *
   * @param location filesystem path or {@code classpath:} location
   * @return the records in file order
   * @throws IOException if the file is missing or is not a JSON array of records with {@code SQL}
   */
  public List<QueryRecord> load(String location) throws IOException {
    Resource resource = resolve(location);
    if (!resource.exists()) {
      throw new IOException("Dataset not found: " + location);
    }
    try (InputStream is = resource.getInputStream()) {
      List<QueryRecord> records =
          objectMapper.readValue(is, new TypeReference<List<QueryRecord>>() {});
      if (records == null || records.contains(null)) {
        throw new IOException("Dataset must be a JSON array of objects: " + location);
      }
      log.info("Loaded {} records from {}", records.size(), location);
      return List.copyOf(records);
    }
  }

  private static Resource resolve(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()));
    }
    return new FileSystemResource(location);
  }
}
