import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes the raw "searches" cell of a user row into {@link SearchRecord}s.
 *
 * <p>Searches are joined with the literal three characters {@code \n-}. Each
 * search is a run of {@code key:value} pairs separated by whitespace followed by
 * a colon. Blocks starting with {@code ---} are headers and are discarded, as
 * are blank blocks left by leading or trailing delimiters.
 */
public final class SearchDecoder {
  
  static final String SEARCH_DELIMITER = "\\n-";
  static final String HEADER_PREFIX = "---";
  
  private static final Pattern ESCAPES = Pattern.compile("\\\\.n|\\\\.n\\s+:|\\\\");
  private static final Pattern PAIR_SEPARATOR = Pattern.compile("\\s+:");
  
  private SearchDecoder() {
  }
  
  public static List<SearchRecord> decode(String raw) {
    List<SearchRecord> records = new ArrayList<>();
    if (raw == null) {
      return records;
    }
    
    for (String chunk : raw.split(Pattern.quote(SEARCH_DELIMITER), -1)) {
      if (chunk.startsWith(HEADER_PREFIX) || chunk.isBlank()) {
        continue;
      }
      records.add(decodeChunk(chunk));
    }
    return records;
  }
  
  static SearchRecord decodeChunk(String chunk) {
    String cleaned = ESCAPES.matcher(chunk).replaceAll(" ");
    cleaned = PAIR_SEPARATOR.matcher(cleaned).replaceAll(",");
    
    SearchRecord record = new SearchRecord();
    for (String token : cleaned.split(",", -1)) {
      String[] parts = token.split(":", -1);
      Optional<SearchField> field = SearchField.fromKey(parts[0].trim());
      if (field.isEmpty()) {
        continue;
      }
      if (parts.length < 2) {
        throw new MalformedSearchException("Search field '" + field.get().key() + "' has no value in: " + chunk);
      }
      record.put(field.get(), parts[1].strip());
    }
    return record;
  }
}
