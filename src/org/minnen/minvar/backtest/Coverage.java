package org.minnen.minvar.backtest;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.minnen.minvar.data.ReturnWindow;

/** Result of applying a {@link CoverageFilter} to one window. */
public class Coverage
{
  public enum Kind {
    /** Enough eligible assets and enough complete periods for a non-singular sample covariance. */
    OK,

    /** Enough eligible assets but too few complete periods (T < N + 1) for the sample estimator. */
    SAMPLE_SINGULAR,

    /** Fewer than two eligible assets, so there is nothing to diversify. */
    INSUFFICIENT_UNIVERSE
  }

  public final Kind                 kind;
  public final ReturnWindow         window;
  public final List<String>         eligible;

  /** Rows in the window where every eligible ticker has a value. */
  public final int                  completePeriods;

  /** Non-missing observation count for every candidate ticker. */
  public final Map<String, Integer> observations;

  public Coverage(Kind kind, ReturnWindow window, List<String> eligible, int completePeriods,
      Map<String, Integer> observations)
  {
    this.kind = kind;
    this.window = window;
    this.eligible = Collections.unmodifiableList(eligible);
    this.completePeriods = completePeriods;
    this.observations = Collections.unmodifiableMap(observations);
  }

  /** @return true if at least two assets are eligible. */
  public boolean isUsable()
  {
    return kind != Kind.INSUFFICIENT_UNIVERSE;
  }

  public int numEligible()
  {
    return eligible.size();
  }

  @Override
  public String toString()
  {
    return String.format("[%s %s: %d eligible, %d complete periods]", kind, window, eligible.size(), completePeriods);
  }
}
