package org.minnen.minvar.backtest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.minnen.minvar.backtest.Coverage.Kind;
import org.minnen.minvar.config.CoverageParams;
import org.minnen.minvar.data.ReturnWindow;

/** Decides which assets have enough data in a window to take part in the optimization. */
public class CoverageFilter
{
  public final CoverageParams params;

  public CoverageFilter(CoverageParams params)
  {
    this.params = params;
  }

  /**
   * Find the eligible tickers for the given window.
   *
   * A ticker is eligible if it has at least `minObservations` values and its missing fraction does not exceed
   * `maxMissingPct`. Eligible tickers keep the order of `candidates`.
   */
  public Coverage apply(ReturnWindow window, List<String> candidates)
  {
    final int length = window.length();
    List<String> eligible = new ArrayList<>();
    Map<String, Integer> observations = new LinkedHashMap<>();
    for (String ticker : candidates) {
      int count = window.countObservations(ticker);
      observations.put(ticker, count);
      double missingFraction = (double) (length - count) / length;
      if (count >= params.minObservations && missingFraction <= params.maxMissingPct + 1e-12) {
        eligible.add(ticker);
      }
    }

    if (eligible.size() < 2) {
      return new Coverage(Kind.INSUFFICIENT_UNIVERSE, window, eligible, 0, observations);
    }

    int completePeriods = window.completeRows(eligible).length;
    Kind kind = (completePeriods >= eligible.size() + 1 ? Kind.OK : Kind.SAMPLE_SINGULAR);
    return new Coverage(kind, window, eligible, completePeriods, observations);
  }
}
