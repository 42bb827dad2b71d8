import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Filters decoded searches down to the valid ones and derives the per-user
 * metrics from them. A search is valid when {@code enabled} is exactly
 * {@code "true"} and it has at least three clicks.
 */
public final class SearchValidator {
  
  static final BigInteger MIN_CLICKS = BigInteger.valueOf(3);
  static final String ENABLED = "true";
  static final String RENTAL = "Rental";
  static final String SALE = "Sale";
  
  private SearchValidator() {
  }
  
  public static boolean isValid(SearchRecord record) {
    return ENABLED.equals(record.enabled()) && record.clicks().compareTo(MIN_CLICKS) >= 0;
  }
  
  public static List<SearchRecord> validSearches(List<SearchRecord> records) {
    List<SearchRecord> valid = new ArrayList<>();
    for (SearchRecord record : records) {
      if (isValid(record)) {
        valid.add(record);
      }
    }
    return valid;
  }
  
  public static BigDecimal avgListings(List<SearchRecord> validSearches) {
    int withListings = 0;
    BigInteger listings = BigInteger.ZERO;
    for (SearchRecord search : validSearches) {
      Optional<BigInteger> sent = search.listingsSent();
      if (sent.isPresent()) {
        withListings++;
        listings = listings.add(sent.get());
      }
    }
    
    if (withListings == 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal avg = BigDecimal.valueOf(roundHalfEven(listings.doubleValue() / withListings));
    // Whole averages keep one decimal place: 15.0, 12000000.0.
    return avg.scale() < 1 ? avg.setScale(1) : avg;
  }
  
  // Two places on the binary value, ties to even: 0.125 -> 0.12, 0.375 -> 0.38.
  static double roundHalfEven(double value) {
    return Math.rint(value * 100) / 100;
  }
  
  public static SearchType typeOfSearch(List<SearchRecord> validSearches) {
    int rental = 0;
    int sale = 0;
    for (SearchRecord search : validSearches) {
      String type = search.type().orElse(null);
      if (RENTAL.equals(type)) {
        rental++;
      } else if (SALE.equals(type)) {
        sale++;
      }
    }
    
    if (rental > 0 && sale > 0) {
      return SearchType.RENTAL_AND_SALE;
    } else if (rental > 0) {
      return SearchType.RENTAL;
    } else if (sale > 0) {
      return SearchType.SALE;
    }
    return SearchType.NONE;
  }
  
  public static List<String> listOfValidSearches(List<SearchRecord> validSearches) {
    List<String> ids = new ArrayList<>();
    for (SearchRecord search : validSearches) {
      search.searchId().ifPresent(ids::add);
    }
    return ids;
  }
}
