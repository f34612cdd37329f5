package io.b2mash.pivot.model;

/**
 * Summary statistics of one computation.
 *
 * @param totalDataRows rows left after filtering
 * @param totalDataColumns number of fields in the first filtered row
 * @param bucketCount distinct (row tuple, column tuple) combinations
 * @param computationTimeMillis wall time spent computing or updating the structure
 */
public record PivotSummary(
    int totalDataRows, int totalDataColumns, int bucketCount, double computationTimeMillis) {

  /** Equal counts, whatever the computation time. */
  public boolean sameCountsAs(PivotSummary other) {
    return other != null
        && totalDataRows == other.totalDataRows
        && totalDataColumns == other.totalDataColumns
        && bucketCount == other.bucketCount;
  }
}
