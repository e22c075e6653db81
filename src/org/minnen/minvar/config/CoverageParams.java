package org.minnen.minvar.config;

/** Missing-data thresholds that decide whether an asset is eligible for a window. */
public class CoverageParams
{
  public final int    minObservations;
  public final double maxMissingPct;

  public CoverageParams(int minObservations, double maxMissingPct)
  {
    if (minObservations < 0) {
      throw new IllegalArgumentException(String.format("min_observations must be non-negative (%d)",
          minObservations));
    }
    if (!(maxMissingPct >= 0.0 && maxMissingPct <= 1.0)) {
      throw new IllegalArgumentException(String.format("max_missing_pct must be in [0, 1] (%f)", maxMissingPct));
    }
    this.minObservations = minObservations;
    this.maxMissingPct = maxMissingPct;
  }

  @Override
  public String toString()
  {
    return String.format("[min_obs=%d, max_missing=%.1f%%]", minObservations, maxMissingPct * 100.0);
  }
}
