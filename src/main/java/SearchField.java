import java.util.Optional;

public enum SearchField {
  SEARCH_ID("search_id"),
  ENABLED("enabled"),
  CLICKS("clicks"),
  TYPE("type"),
  LISTINGS_SENT("listings_sent"),
  RECOMMENDED("recommended");
  
  private final String key;
  
  SearchField(String key) {
    this.key = key;
  }
  
  public String key() {
    return key;
  }
  
  public static Optional<SearchField> fromKey(String key) {
    for (SearchField field : values()) {
      if (field.key.equals(key)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }
}
