package io.b2mash.pivot.model;

public record PivotOptions(boolean showGrandTotals, boolean showSubtotals) {

  public static PivotOptions none() {
    return new PivotOptions(false, false);
  }

  public static PivotOptions grandTotals() {
    return new PivotOptions(true, false);
  }

  public static PivotOptions all() {
    return new PivotOptions(true, true);
  }
}
