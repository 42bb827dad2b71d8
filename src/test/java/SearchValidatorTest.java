import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchValidatorTest {
  
  private static SearchRecord search(String enabled, String clicks) {
    SearchRecord record = new SearchRecord().put(SearchField.ENABLED, enabled);
    if (clicks != null) {
      record.put(SearchField.CLICKS, clicks);
    }
    return record;
  }
  
  private static SearchRecord valid() {
    return search("true", "3");
  }
  
  @Nested
  class Validity {
    
    @Test
    void shouldAcceptEnabledSearchWithEnoughClicks() {
      assertThat(SearchValidator.isValid(search("true", "5"))).isTrue();
      assertThat(SearchValidator.isValid(search("true", "3"))).isTrue();
    }
    
    @Test
    void shouldAcceptClicksBeyondIntRange() {
      SearchRecord record = SearchDecoder.decode("search_id:1 :enabled:true :clicks:3000000000").get(0);
      
      assertThat(SearchValidator.isValid(record)).isTrue();
    }
    
    @Test
    void shouldRejectSearchWithTooFewClicks() {
      assertThat(SearchValidator.isValid(search("true", "2"))).isFalse();
      assertThat(SearchValidator.isValid(search("true", null))).isFalse();
    }
    
    @Test
    void shouldRejectDisabledSearch() {
      assertThat(SearchValidator.isValid(search("false", "10"))).isFalse();
      assertThat(SearchValidator.isValid(search("True", "10"))).isFalse();
    }
    
    @Test
    void shouldFailOnSearchWithoutEnabledField() {
      SearchRecord record = new SearchRecord().put(SearchField.CLICKS, "8");
      
      assertThatThrownBy(() -> SearchValidator.validSearches(List.of(valid(), record)))
        .isInstanceOf(MalformedSearchException.class);
    }
    
    @Test
    void shouldKeepValidSearchesInOrder() {
      SearchRecord first = search("true", "4").put(SearchField.SEARCH_ID, "a");
      SearchRecord second = search("false", "4").put(SearchField.SEARCH_ID, "b");
      SearchRecord third = search("true", "9").put(SearchField.SEARCH_ID, "c");
      
      assertThat(SearchValidator.validSearches(List.of(first, second, third))).containsExactly(first, third);
    }
  }
  
  @Nested
  class AvgListings {
    
    @Test
    void shouldAverageListingsOfSearchesThatHaveThem() {
      List<SearchRecord> searches = List.of(
        valid().put(SearchField.LISTINGS_SENT, "10"),
        valid().put(SearchField.LISTINGS_SENT, "20"),
        valid());
      
      BigDecimal avg = SearchValidator.avgListings(searches);
      
      assertThat(avg).isEqualByComparingTo("15");
      assertThat(avg.toString()).isEqualTo("15.0");
    }
    
    @Test
    void shouldReturnExactZeroWhenNoSearchHasListings() {
      BigDecimal avg = SearchValidator.avgListings(List.of(valid(), valid()));
      
      assertThat(avg).isSameAs(BigDecimal.ZERO);
      assertThat(avg.toString()).isEqualTo("0");
    }
    
    @Test
    void shouldRenderLargeAveragesWithoutExponent() {
      List<SearchRecord> searches = List.of(valid().put(SearchField.LISTINGS_SENT, "12000000"));
      
      assertThat(SearchValidator.avgListings(searches).toPlainString()).isEqualTo("12000000.0");
    }
    
    @Test
    void shouldAverageListingsBeyondIntRange() {
      List<SearchRecord> searches = List.of(
        valid().put(SearchField.LISTINGS_SENT, "3000000000"),
        valid().put(SearchField.LISTINGS_SENT, "3000000000"));
      
      assertThat(SearchValidator.avgListings(searches).toPlainString()).isEqualTo("3000000000.0");
    }
    
    @Test
    void shouldRoundToTwoDecimals() {
      List<SearchRecord> searches = List.of(
        valid().put(SearchField.LISTINGS_SENT, "1"),
        valid().put(SearchField.LISTINGS_SENT, "1"),
        valid().put(SearchField.LISTINGS_SENT, "2"));
      
      assertThat(SearchValidator.avgListings(searches).toString()).isEqualTo("1.33");
    }
    
    @Test
    void shouldRoundTiesToEven() {
      assertThat(SearchValidator.roundHalfEven(0.125)).isEqualTo(0.12);
      assertThat(SearchValidator.roundHalfEven(0.375)).isEqualTo(0.38);
      assertThat(SearchValidator.roundHalfEven(2.5)).isEqualTo(2.5);
    }
    
    @Test
    void shouldRoundEightListingTieDown() {
      List<SearchRecord> searches = List.of(
        valid().put(SearchField.LISTINGS_SENT, "1"),
        valid().put(SearchField.LISTINGS_SENT, "0"),
        valid().put(SearchField.LISTINGS_SENT, "0"),
        valid().put(SearchField.LISTINGS_SENT, "0"),
        valid().put(SearchField.LISTINGS_SENT, "0"),
        valid().put(SearchField.LISTINGS_SENT, "0"),
        valid().put(SearchField.LISTINGS_SENT, "0"),
        valid().put(SearchField.LISTINGS_SENT, "0"));
      
      assertThat(SearchValidator.avgListings(searches).toString()).isEqualTo("0.12");
    }
    
    @Test
    void shouldFailOnNonNumericListings() {
      List<SearchRecord> searches = List.of(valid().put(SearchField.LISTINGS_SENT, "ten"));
      
      assertThatThrownBy(() -> SearchValidator.avgListings(searches))
        .isInstanceOf(MalformedSearchException.class)
        .hasMessageContaining("listings_sent");
    }
  }
  
  @Nested
  class TypeOfSearch {
    
    private List<SearchRecord> ofTypes(String... types) {
      return Arrays.stream(types)
        .map(type -> valid().put(SearchField.TYPE, type))
        .toList();
    }
    
    @Test
    void shouldClassifyRentalOnly() {
      assertThat(SearchValidator.typeOfSearch(ofTypes("Rental", "Rental"))).isEqualTo(SearchType.RENTAL);
    }
    
    @Test
    void shouldClassifySaleOnly() {
      assertThat(SearchValidator.typeOfSearch(ofTypes("Sale", "Commercial"))).isEqualTo(SearchType.SALE);
    }
    
    @Test
    void shouldClassifyRentalAndSale() {
      assertThat(SearchValidator.typeOfSearch(ofTypes("Rental", "Sale"))).isEqualTo(SearchType.RENTAL_AND_SALE);
    }
    
    @Test
    void shouldClassifyNone() {
      assertThat(SearchValidator.typeOfSearch(List.of())).isEqualTo(SearchType.NONE);
      assertThat(SearchValidator.typeOfSearch(ofTypes("rental", "SALE"))).isEqualTo(SearchType.NONE);
      assertThat(SearchValidator.typeOfSearch(List.of(valid()))).isEqualTo(SearchType.NONE);
    }
  }
  
  @Test
  void shouldListSearchIdsSkippingSearchesWithoutOne() {
    List<SearchRecord> searches = List.of(
      valid().put(SearchField.SEARCH_ID, "7"),
      valid(),
      valid().put(SearchField.SEARCH_ID, ""),
      valid().put(SearchField.SEARCH_ID, "3"));
    
    assertThat(SearchValidator.listOfValidSearches(searches)).containsExactly("7", "3");
  }
}
