import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One saved search decoded from a user's search blob. Only the recognized
 * {@link SearchField}s are kept; every field may be absent.
 */
public class SearchRecord {
  
  private final Map<SearchField, String> fields = new EnumMap<>(SearchField.class);
  
  public SearchRecord put(SearchField field, String value) {
    fields.put(field, value);
    return this;
  }
  
  public Optional<String> get(SearchField field) {
    return Optional.ofNullable(fields.get(field));
  }
  
  public boolean has(SearchField field) {
    return fields.containsKey(field);
  }
  
  public Optional<String> searchId() {
    return get(SearchField.SEARCH_ID).filter(id -> !id.isEmpty());
  }
  
  public String enabled() {
    return get(SearchField.ENABLED)
      .orElseThrow(() -> new MalformedSearchException("Search record has no 'enabled' field: " + this));
  }
  
  public BigInteger clicks() {
    return get(SearchField.CLICKS).map(v -> parseInteger(SearchField.CLICKS, v)).orElse(BigInteger.ZERO);
  }
  
  // An empty value counts as absent.
  public Optional<BigInteger> listingsSent() {
    return get(SearchField.LISTINGS_SENT)
      .filter(v -> !v.isEmpty())
      .map(v -> parseInteger(SearchField.LISTINGS_SENT, v));
  }
  
  public Optional<String> type() {
    return get(SearchField.TYPE);
  }
  
  public Map<SearchField, String> fields() {
    return Collections.unmodifiableMap(fields);
  }
  
  // Counts have no upper bound in the source data.
  private static BigInteger parseInteger(SearchField field, String value) {
    try {
      return new BigInteger(value);
    } catch (NumberFormatException e) {
      throw new MalformedSearchException("Field '" + field.key() + "' is not an integer: " + value, e);
    }
  }
  
  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return fields.equals(((SearchRecord) obj).fields);
  }
  
  @Override
  public int hashCode() {
    return fields.hashCode();
  }
  
  @Override
  public String toString() {
    return fields.toString();
  }
}
