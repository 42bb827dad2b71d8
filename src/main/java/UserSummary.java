import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class UserSummary {
  
  private final String userId;
  private final int numValidSearches;
  private final BigDecimal avgListings;
  private final SearchType typeOfSearch;
  private final List<String> listOfValidSearches;
  
  public UserSummary(String userId, int numValidSearches, BigDecimal avgListings,
                     SearchType typeOfSearch, List<String> listOfValidSearches) {
    this.userId = userId;
    this.numValidSearches = numValidSearches;
    this.avgListings = avgListings;
    this.typeOfSearch = typeOfSearch;
    this.listOfValidSearches = List.copyOf(listOfValidSearches);
  }
  
  /**
   * Builds the summary for one user, empty when none of the user's searches
   * is valid.
   */
  public static Optional<UserSummary> of(String userId, List<SearchRecord> records) {
    List<SearchRecord> valid = SearchValidator.validSearches(records);
    if (valid.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new UserSummary(userId,
      valid.size(),
      SearchValidator.avgListings(valid),
      SearchValidator.typeOfSearch(valid),
      SearchValidator.listOfValidSearches(valid)));
  }
  
  public String getUserId() {
    return userId;
  }
  
  public int getNumValidSearches() {
    return numValidSearches;
  }
  
  public BigDecimal getAvgListings() {
    return avgListings;
  }
  
  public SearchType getTypeOfSearch() {
    return typeOfSearch;
  }
  
  public List<String> getListOfValidSearches() {
    return listOfValidSearches;
  }
  
  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    UserSummary that = (UserSummary) obj;
    return numValidSearches == that.numValidSearches
      && userId.equals(that.userId)
      && avgListings.equals(that.avgListings)
      && typeOfSearch == that.typeOfSearch
      && listOfValidSearches.equals(that.listOfValidSearches);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(userId, numValidSearches, avgListings, typeOfSearch, listOfValidSearches);
  }
  
  @Override
  public String toString() {
    return "UserSummary{userId=" + userId + ", numValidSearches=" + numValidSearches
      + ", avgListings=" + avgListings + ", typeOfSearch=" + typeOfSearch
      + ", listOfValidSearches=" + listOfValidSearches + "}";
  }
}
