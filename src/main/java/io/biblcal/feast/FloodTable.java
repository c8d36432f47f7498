package io.biblcal.feast;

import java.util.List;

/**
 * Flood-duration results for a range of years.
 *
 * @param range the years scanned
 * @param years one entry per year, in increasing order
 */
public record FloodTable(YearRange range, List<FloodYear> years) {
  public FloodTable {
    years = List.copyOf(years);
  }

  /**
   * Returns the years that fall in a bucket, in increasing order.
   *
   * @param bucket the bucket
   * @return the years
   */
  public List<Integer> yearsIn(FloodBucket bucket) {
    return years.stream().filter(y -> y.bucket() == bucket).map(FloodYear::year).toList();
  }
}
