import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The two tables produced by one run: the per-user summary and the set of
 * distinct valid search ids.
 */
public class SearchTables {
  
  private static final Logger LOGGER = LoggerFactory.getLogger(SearchTables.class);
  
  private final List<UserSummary> summaries;
  private final SortedSet<String> uniqueSearches;
  
  private SearchTables(List<UserSummary> summaries, SortedSet<String> uniqueSearches) {
    this.summaries = Collections.unmodifiableList(summaries);
    this.uniqueSearches = Collections.unmodifiableSortedSet(uniqueSearches);
  }
  
  public static SearchTables build(List<UserSummary> summaries) {
    List<UserSummary> retained = new ArrayList<>();
    SortedSet<String> unique = new TreeSet<>();
    
    for (UserSummary summary : summaries) {
      if (summary.getNumValidSearches() == 0) {
        continue;
      }
      retained.add(summary);
      for (String id : summary.getListOfValidSearches()) {
        unique.add(id.replace("'", ""));
      }
    }
    
    SearchTables tables = new SearchTables(retained, unique);
    LOGGER.info("Total valid searches today are: {}", tables.totalValidSearches());
    LOGGER.info("Total users today are: {}", tables.getSummaries().size());
    return tables;
  }
  
  public List<UserSummary> getSummaries() {
    return summaries;
  }
  
  public SortedSet<String> getUniqueSearches() {
    return uniqueSearches;
  }
  
  public long totalValidSearches() {
    long total = 0;
    for (UserSummary summary : summaries) {
      total += summary.getNumValidSearches();
    }
    return total;
  }
}
