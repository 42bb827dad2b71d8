import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;

public class SearchSummaryApp {
  
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchSummaryApp.class);
  
  public static void main(String[] args) {
    if (args.length < 1) {
      System.err.println("Usage: java -jar search-summary-worker.jar <config.properties> [yyyy-MM-dd]");
      System.exit(1);
    }
    
    try {
      SearchSummaryConfig config = SearchSummaryConfig.load(Path.of(args[0]));
      LocalDate runDate = args.length > 1 ? LocalDate.parse(args[1]) : LocalDate.now();
      
      try (S3Client sourceClient = buildClient(config.getSourceProfile());
           S3Client destClient = buildClient(config.getDestProfile())) {
        SearchTables tables = new SearchSummaryWorker(sourceClient, destClient, config).run(runDate);
        LOGGER.info("Wrote {} user summaries and {} unique searches",
          tables.getSummaries().size(), tables.getUniqueSearches().size());
      }
      
    } catch (Exception e) {
      LOGGER.error("Search summary failed: {}", e.getMessage(), e);
      System.exit(2);
    }
  }
  
  static S3Client buildClient(Optional<String> profile) {
    S3ClientBuilder builder = S3Client.builder();
    profile.ifPresent(name -> builder.credentialsProvider(ProfileCredentialsProvider.create(name)));
    return builder.build();
  }
}
