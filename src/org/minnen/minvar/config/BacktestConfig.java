package org.minnen.minvar.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.minnen.minvar.data.DataException;

/**
 * Settings for one rolling-window backtest.
 *
 * Instances are immutable; use {@link #builder()} to create one. Every default lives in the builder so that runs are
 * reproducible from the values stored here.
 */
public class BacktestConfig
{
  /** Tickers to consider; an empty list means every ticker in the data. */
  public final List<String>   tickers;
  public final int            startYear;
  public final int            endYear;
  public final int            estimationWindow;
  public final int            step;
  public final Constraints    constraints;
  public final double         riskFreeRate;
  public final CoverageParams coverage;
  public final double         degradedThreshold;
  public final int            parallelism;
  public final int            maxUniverseWarning;

  private BacktestConfig(Builder builder)
  {
    this.tickers = Collections.unmodifiableList(new ArrayList<>(builder.tickers));
    this.startYear = builder.startYear;
    this.endYear = builder.endYear;
    this.estimationWindow = builder.estimationWindow;
    this.step = builder.step;
    this.constraints = builder.constraints;
    this.riskFreeRate = builder.riskFreeRate;
    this.coverage = (builder.coverage != null ? builder.coverage
        : new CoverageParams(builder.estimationWindow, Builder.DEFAULT_MAX_MISSING));
    this.degradedThreshold = builder.degradedThreshold;
    this.parallelism = builder.parallelism;
    this.maxUniverseWarning = builder.maxUniverseWarning;
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /** @return builder initialized with the values of this config. */
  public Builder toBuilder()
  {
    return new Builder().tickers(tickers).years(startYear, endYear).estimationWindow(estimationWindow).step(step)
        .constraints(constraints).riskFreeRate(riskFreeRate).coverage(coverage).degradedThreshold(degradedThreshold)
        .parallelism(parallelism).maxUniverseWarning(maxUniverseWarning);
  }

  public boolean hasYearRange()
  {
    return startYear != Integer.MIN_VALUE || endYear != Integer.MAX_VALUE;
  }

  /**
   * Check that the settings describe a runnable backtest.
   *
   * @throws DataException if any value is out of range
   */
  public void validate() throws DataException
  {
    if (startYear > endYear) {
      throw new DataException(String.format("Invalid date range: start year %d is after end year %d", startYear,
          endYear));
    }
    if (estimationWindow < 2) {
      throw new DataException(String.format("Estimation window must be at least 2 months (%d)", estimationWindow));
    }
    if (step < 1) {
      throw new DataException(String.format("Step must be at least 1 month (%d)", step));
    }
    if (coverage.minObservations > estimationWindow) {
      throw new DataException(String.format("min_observations (%d) exceeds the estimation window (%d)",
          coverage.minObservations, estimationWindow));
    }
    if (!Double.isFinite(riskFreeRate)) {
      throw new DataException("Risk-free rate must be finite");
    }
    if (!(degradedThreshold >= 0.0 && degradedThreshold <= 1.0)) {
      throw new DataException(String.format("Degraded threshold must be in [0, 1] (%f)", degradedThreshold));
    }
    if (parallelism < 1) {
      throw new DataException(String.format("Parallelism must be at least 1 (%d)", parallelism));
    }
  }

  @Override
  public String toString()
  {
    String years = hasYearRange() ? String.format("%d-%d", startYear, endYear) : "all";
    return String.format("[years=%s, window=%d, step=%d, weights=%s, rf=%.3f, coverage=%s, tickers=%s]", years,
        estimationWindow, step, constraints, riskFreeRate, coverage, tickers.isEmpty() ? "all" : tickers.size());
  }

  public static class Builder
  {
    public static final int    DEFAULT_WINDOW               = 36;
    public static final double DEFAULT_RISK_FREE            = 0.042;
    public static final double DEFAULT_MAX_MISSING          = 0.10;
    public static final double DEFAULT_DEGRADED_THRESHOLD   = 0.20;
    public static final int    DEFAULT_MAX_UNIVERSE_WARNING = 250;

    private List<String>       tickers                      = new ArrayList<>();
    private int                startYear                    = Integer.MIN_VALUE;
    private int                endYear                      = Integer.MAX_VALUE;
    private int                estimationWindow             = DEFAULT_WINDOW;
    private int                step                         = 1;
    private Constraints        constraints                  = Constraints.longShort(-1.0, 1.0);
    private double             riskFreeRate                 = DEFAULT_RISK_FREE;
    private CoverageParams     coverage;
    private double             degradedThreshold            = DEFAULT_DEGRADED_THRESHOLD;
    private int                parallelism                  = 1;
    private int                maxUniverseWarning           = DEFAULT_MAX_UNIVERSE_WARNING;

    public Builder tickers(Collection<String> tickers)
    {
      this.tickers = new ArrayList<>(tickers);
      return this;
    }

    public Builder tickers(String... tickers)
    {
      return tickers(Arrays.asList(tickers));
    }

    public Builder years(int startYear, int endYear)
    {
      this.startYear = startYear;
      this.endYear = endYear;
      return this;
    }

    public Builder estimationWindow(int estimationWindow)
    {
      this.estimationWindow = estimationWindow;
      return this;
    }

    public Builder step(int step)
    {
      this.step = step;
      return this;
    }

    public Builder constraints(Constraints constraints)
    {
      this.constraints = constraints;
      return this;
    }

    public Builder riskFreeRate(double riskFreeRate)
    {
      this.riskFreeRate = riskFreeRate;
      return this;
    }

    /** Coverage thresholds; if never set, min_observations defaults to the estimation window. */
    public Builder coverage(CoverageParams coverage)
    {
      this.coverage = coverage;
      return this;
    }

    public Builder coverage(int minObservations, double maxMissingPct)
    {
      return coverage(new CoverageParams(minObservations, maxMissingPct));
    }

    public Builder degradedThreshold(double degradedThreshold)
    {
      this.degradedThreshold = degradedThreshold;
      return this;
    }

    public Builder parallelism(int parallelism)
    {
      this.parallelism = parallelism;
      return this;
    }

    public Builder maxUniverseWarning(int maxUniverseWarning)
    {
      this.maxUniverseWarning = maxUniverseWarning;
      return this;
    }

    public BacktestConfig build()
    {
      if (constraints == null) {
        throw new IllegalArgumentException("Constraints are required");
      }
      return new BacktestConfig(this);
    }
  }
}
