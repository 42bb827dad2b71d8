import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Turns a gzip-compressed, header-less {@code user_id,searches} CSV into
 * {@link SearchTables} and writes those tables back out as CSV.
 */
public class SearchSummaryEngine {
  
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchSummaryEngine.class);
  
  static final String[] SEARCHES_HEADER = {"searches"};
  static final String[] SUMMARY_HEADER = {
    "user_id", "num_valid_searches", "avg_listings", "type_of_search", "list_of_valid_searches"
  };
  
  /**
   * Reads the whole input into memory and builds both tables. The input
   * stream is closed once it has been consumed.
   */
  public SearchTables process(InputStream gzippedCsv) throws IOException, CsvException {
    List<UserSummary> summaries = new ArrayList<>();
    
    try (BufferedReader reader = new BufferedReader(
           new InputStreamReader(new GZIPInputStream(gzippedCsv), StandardCharsets.UTF_8));
         CSVReader csvReader = new CSVReaderBuilder(reader)
           .withCSVParser(new RFC4180ParserBuilder().build())
           .build()) {
      
      List<String[]> records = csvReader.readAll();
      LOGGER.info("Read {} user rows", records.size());
      
      for (String[] record : records) {
        if (isBlank(record)) {
          continue;
        }
        processRecord(record).ifPresent(summaries::add);
      }
    }
    
    return SearchTables.build(summaries);
  }
  
  Optional<UserSummary> processRecord(String[] record) {
    if (record.length > 2) {
      throw new MalformedSearchException("Expected columns user_id,searches but found " + record.length
        + " columns for user " + record[0]);
    }
    String userId = record[0];
    String searches = record.length > 1 ? record[1] : "";
    
    try {
      return UserSummary.of(userId, SearchDecoder.decode(searches));
    } catch (MalformedSearchException e) {
      throw new MalformedSearchException("Malformed searches for user " + userId + ": " + e.getMessage(), e);
    }
  }
  
  private static boolean isBlank(String[] record) {
    return record.length == 0 || (record.length == 1 && record[0].isBlank());
  }
  
  public int writeUniqueSearches(SearchTables tables, OutputStream out) throws IOException {
    ICSVWriter writer = newWriter(out);
    writer.writeNext(SEARCHES_HEADER, false);
    for (String search : tables.getUniqueSearches()) {
      writer.writeNext(new String[] {search}, false);
    }
    writer.flush();
    return tables.getUniqueSearches().size();
  }
  
  public int writeSummary(SearchTables tables, OutputStream out) throws IOException {
    ICSVWriter writer = newWriter(out);
    writer.writeNext(SUMMARY_HEADER, false);
    for (UserSummary summary : tables.getSummaries()) {
      writer.writeNext(new String[] {
        summary.getUserId(),
        String.valueOf(summary.getNumValidSearches()),
        summary.getAvgListings().toPlainString(),
        summary.getTypeOfSearch().label(),
        formatSearchList(summary.getListOfValidSearches())
      }, false);
    }
    writer.flush();
    return tables.getSummaries().size();
  }
  
  // The caller owns the stream, so the writer is flushed but never closed.
  private static ICSVWriter newWriter(OutputStream out) {
    Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    return new CSVWriter(writer,
      ICSVWriter.DEFAULT_SEPARATOR,
      ICSVWriter.DEFAULT_QUOTE_CHARACTER,
      ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
      "\n");
  }
  
  /** Renders ids as {@code ['1', '2']}, the list format downstream loaders expect. */
  static String formatSearchList(List<String> ids) {
    StringBuilder output = new StringBuilder("[");
    for (int i = 0; i < ids.size(); i++) {
      if (i > 0) {
        output.append(", ");
      }
      output.append(quoteId(ids.get(i)));
    }
    return output.append("]").toString();
  }
  
  private static String quoteId(String id) {
    String escaped = id.replace("\\", "\\\\");
    if (escaped.contains("'") && !escaped.contains("\"")) {
      return "\"" + escaped + "\"";
    }
    return "'" + escaped.replace("'", "\\'") + "'";
  }
}
