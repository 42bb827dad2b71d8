import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.Map;

public class SearchSummaryWorker {
  
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchSummaryWorker.class);
  
  private final S3Client sourceClient;
  private final S3Client destClient;
  private final SearchSummaryConfig config;
  private final SearchSummaryEngine engine;
  
  public SearchSummaryWorker(S3Client sourceClient, S3Client destClient, SearchSummaryConfig config) {
    this(sourceClient, destClient, config, new SearchSummaryEngine());
  }
  
  SearchSummaryWorker(S3Client sourceClient, S3Client destClient, SearchSummaryConfig config,
                      SearchSummaryEngine engine) {
    this.sourceClient = sourceClient;
    this.destClient = destClient;
    this.config = config;
    this.engine = engine;
  }
  
  public SearchTables run(LocalDate runDate) {
    LOGGER.info("Executing search summary for {}", runDate);
    Map<String, String> context = RunContext.forDate(runDate);
    
    String sourceBucket = config.getSourceBucket();
    String sourceKey = KeyTemplate.render(config.getSourceKey(), context);
    LOGGER.info("Rendered source key {}", sourceKey);
    
    SearchTables tables = extract(sourceBucket, sourceKey);
    
    String destBucket = config.getDestBucket();
    String searchesKey = KeyTemplate.render(config.getDestSearchesKey(), context);
    LOGGER.info("Rendered unique searches key {}", searchesKey);
    ByteArrayOutputStream searches = new ByteArrayOutputStream();
    int searchRows = write(searchesKey, () -> engine.writeUniqueSearches(tables, searches));
    upload(destBucket, searchesKey, searches.toByteArray(), searchRows, SearchSummaryEngine.SEARCHES_HEADER.length);
    
    String summaryKey = KeyTemplate.render(config.getDestSummaryKey(), context);
    LOGGER.info("Rendered summary key {}", summaryKey);
    ByteArrayOutputStream summary = new ByteArrayOutputStream();
    int summaryRows = write(summaryKey, () -> engine.writeSummary(tables, summary));
    upload(destBucket, summaryKey, summary.toByteArray(), summaryRows, SearchSummaryEngine.SUMMARY_HEADER.length);
    
    LOGGER.info("Search summary for {} completed", runDate);
    return tables;
  }
  
  private SearchTables extract(String bucket, String key) {
    try {
      sourceClient.headObject(HeadObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .build());
    } catch (NoSuchKeyException e) {
      throw new RuntimeException("Object " + key + " does not exist in bucket " + bucket, e);
    }
    
    LOGGER.info("Extract data from s3://{}/{}", bucket, key);
    try (ResponseInputStream<GetObjectResponse> s3Object = sourceClient.getObject(GetObjectRequest.builder()
      .bucket(bucket)
      .key(key)
      .build())) {
      return engine.process(s3Object);
    } catch (MalformedSearchException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException("Error processing S3 object s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
    }
  }
  
  private int write(String key, TableWriter writer) {
    try {
      return writer.write();
    } catch (IOException e) {
      throw new UncheckedIOException("Error rendering " + key, e);
    }
  }
  
  private void upload(String bucket, String key, byte[] content, int rows, int columns) {
    LOGGER.info("Started writing ({}, {}) to s3://{}/{}", rows, columns, bucket, key);
    PutObjectRequest putRequest = PutObjectRequest.builder()
      .bucket(bucket)
      .key(key)
      .contentType("text/csv")
      .build();
    destClient.putObject(putRequest, RequestBody.fromBytes(content));
    LOGGER.info("Completed writing ({}, {}) to s3://{}/{}", rows, columns, bucket, key);
  }
  
  @FunctionalInterface
  interface TableWriter {
    int write() throws IOException;
  }
}
