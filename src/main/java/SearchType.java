public enum SearchType {
  RENTAL_AND_SALE("rental_and_sale"),
  RENTAL("rental"),
  SALE("sale"),
  NONE("none");
  
  private final String label;
  
  SearchType(String label) {
    this.label = label;
  }
  
  public String label() {
    return label;
  }
  
  @Override
  public String toString() {
    return label;
  }
}
