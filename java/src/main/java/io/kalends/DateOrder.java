package io.kalends;

/** The chronological relation between two dates. */
public enum DateOrder {
  /** The first date falls on an earlier day. */
  BEFORE("before"),
  /** Both dates denote the same day. */
  SAME("same"),
  /** The first date falls on a later day. */
  AFTER("after");

  private final String value;

  DateOrder(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the order as a lowercase string
   */
  public String value() {
    return value;
  }

  /**
   * Maps the sign of a comparison result to an order.
   *
   * @param comparison a negative, zero, or positive comparison result
   * @return the matching order
   */
  public static DateOrder fromComparison(int comparison) {
    if (comparison < 0) {
      return BEFORE;
    }
    return comparison == 0 ? SAME : AFTER;
  }

  @Override
  public String toString() {
    return value;
  }
}
