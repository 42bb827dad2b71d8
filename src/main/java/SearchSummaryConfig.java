import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

/**
 * Job configuration: where to read the user search log and where to write the
 * two derived tables. Values come from a properties file and can be overridden
 * with system properties of the same name.
 */
public class SearchSummaryConfig {
  
  static final String SOURCE_BUCKET = "source.bucket";
  static final String SOURCE_KEY = "source.key";
  static final String DEST_BUCKET = "dest.bucket";
  static final String DEST_SEARCHES_KEY = "dest.searches.key";
  static final String DEST_SUMMARY_KEY = "dest.summary.key";
  static final String SOURCE_PROFILE = "source.profile";
  static final String DEST_PROFILE = "dest.profile";
  
  private final Properties properties;
  
  public SearchSummaryConfig(Properties properties) {
    this.properties = properties;
  }
  
  public static SearchSummaryConfig load(Path file) throws IOException {
    Properties properties = new Properties();
    try (InputStream in = new FileInputStream(file.toFile())) {
      properties.load(in);
    }
    return new SearchSummaryConfig(properties);
  }
  
  private Optional<String> getProperty(String key) {
    String value = System.getProperty(key, properties.getProperty(key));
    return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
  }
  
  private String required(String key) {
    return getProperty(key)
      .orElseThrow(() -> new IllegalStateException("Missing required configuration property " + key));
  }
  
  public String getSourceBucket() {
    return required(SOURCE_BUCKET);
  }
  
  public String getSourceKey() {
    return required(SOURCE_KEY);
  }
  
  public String getDestBucket() {
    return required(DEST_BUCKET);
  }
  
  public String getDestSearchesKey() {
    return required(DEST_SEARCHES_KEY);
  }
  
  public String getDestSummaryKey() {
    return required(DEST_SUMMARY_KEY);
  }
  
  public Optional<String> getSourceProfile() {
    return getProperty(SOURCE_PROFILE);
  }
  
  public Optional<String> getDestProfile() {
    return getProperty(DEST_PROFILE);
  }
}
