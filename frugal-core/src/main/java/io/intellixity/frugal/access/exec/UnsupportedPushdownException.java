package io.intellixity.frugal.access.exec;

/**
 * The store cannot evaluate a predicate, projection or aggregate natively.
 * <p>
 * Raised before any round trip is made; nothing is ever evaluated in process instead.
 */
public final class UnsupportedPushdownException extends RuntimeException {
  private final String storeId;
  private final String feature;

  public UnsupportedPushdownException(String storeId, String feature) {
    super("Store '" + storeId + "' cannot push down " + feature);
    this.storeId = storeId;
    this.feature = feature;
  }

  public String storeId() { return storeId; }
  public String feature() { return feature; }
}
