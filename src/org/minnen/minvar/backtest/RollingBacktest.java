package org.minnen.minvar.backtest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.minnen.minvar.config.BacktestConfig;
import org.minnen.minvar.config.Constraints;
import org.minnen.minvar.cov.CovarianceEstimate;
import org.minnen.minvar.cov.CovarianceMethod;
import org.minnen.minvar.data.DataException;
import org.minnen.minvar.data.ReturnSeries;
import org.minnen.minvar.data.ReturnWindow;
import org.minnen.minvar.opt.OptimizationResult;
import org.minnen.minvar.opt.PortfolioOpt;
import org.minnen.minvar.util.Library;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walk-forward backtest that compares covariance estimators for minimum-variance portfolios.
 *
 * At each rebalance index t the trailing window [t - window, t) selects the eligible assets, each
 * {@link CovarianceMethod} estimates a covariance matrix, the optimizer picks weights and the weights earn the
 * returns observed at t. Nothing at or after t is used to choose the weights.
 */
public class RollingBacktest
{
  private static final Logger  log = LoggerFactory.getLogger(RollingBacktest.class);

  public final BacktestConfig  config;
  private final CoverageFilter filter;

  public RollingBacktest(BacktestConfig config)
  {
    this.config = config;
    this.filter = new CoverageFilter(config.coverage);
  }

  /** Weights and diagnostics chosen by one method for one period. */
  static class Allocation
  {
    final CovarianceMethod    method;
    final Map<String, Double> weights;
    final double              realizedReturn;
    final boolean             degraded;
    final double              diagnostic;
    final Set<PeriodFlag>     flags;

    Allocation(CovarianceMethod method, Map<String, Double> weights, double realizedReturn, boolean degraded,
        double diagnostic, Set<PeriodFlag> flags)
    {
      this.method = method;
      this.weights = weights;
      this.realizedReturn = realizedReturn;
      this.degraded = degraded;
      this.diagnostic = diagnostic;
      this.flags = flags;
    }
  }

  /** Everything computed for one rebalance index except turnover. */
  static class Period
  {
    final LocalDate        date;
    final Coverage         coverage;
    final List<Allocation> allocations;

    Period(LocalDate date, Coverage coverage, List<Allocation> allocations)
    {
      this.date = date;
      this.coverage = coverage;
      this.allocations = allocations;
    }
  }

  /**
   * Run the backtest over every rebalance date in the series.
   *
   * @param series monthly returns; candidate assets are all of its tickers
   * @return rows for both methods in date order
   * @throws DataException if the config is invalid, the series holds a non-finite return or the series is shorter
   *           than the estimation window plus one period
   * @throws BacktestException if the first window has fewer than two eligible assets
   */
  public BacktestResult run(ReturnSeries series) throws BacktestException, DataException
  {
    config.validate();
    series.checkFinite();
    final int window = config.estimationWindow;
    if (series.size() < window + 1) {
      throw new DataException(String.format("Need at least %d dates for a %d-month window but only have %d",
          window + 1, window, series.size()));
    }

    List<Integer> indices = new ArrayList<>();
    for (int t = window; t < series.size(); t += config.step) {
      indices.add(t);
    }
    log.info("Backtest: {} tickers, {} periods from {} to {}, window={}, constraints={}", series.numTickers(),
        indices.size(), series.getDate(indices.get(0)), series.getDate(indices.get(indices.size() - 1)), window,
        config.constraints);

    List<Period> periods = (config.parallelism > 1 ? computeParallel(series, indices) : computeSerial(series, indices));

    // Serial pass: check coverage in date order and measure turnover against the last recorded weights.
    List<BacktestRow> rows = new ArrayList<>();
    List<LocalDate> skipped = new ArrayList<>();
    Map<CovarianceMethod, Map<String, Double>> prevWeights = new EnumMap<>(CovarianceMethod.class);
    int maxUniverse = 0;
    for (int i = 0; i < periods.size(); ++i) {
      Period period = periods.get(i);
      if (!period.coverage.isUsable()) {
        if (i == 0) {
          throw new BacktestException(BacktestException.Kind.INSUFFICIENT_UNIVERSE,
              String.format("Only %d eligible tickers in first window %s", period.coverage.numEligible(),
                  period.coverage.window));
        }
        log.warn("Skipping {}: only {} eligible tickers in {}", period.date, period.coverage.numEligible(),
            period.coverage.window);
        skipped.add(period.date);
        continue;
      }
      maxUniverse = Math.max(maxUniverse, period.coverage.numEligible());

      for (Allocation alloc : period.allocations) {
        Map<String, Double> prev = prevWeights.get(alloc.method);
        double turnover = (prev == null ? 0.0 : Library.l1Distance(prev, alloc.weights));
        rows.add(new BacktestRow(period.date, alloc.method, alloc.weights, alloc.realizedReturn, turnover,
            alloc.degraded, alloc.diagnostic, alloc.flags));
        prevWeights.put(alloc.method, alloc.weights);
      }
    }

    if (maxUniverse > config.maxUniverseWarning) {
      log.warn("Eligible universe reached {} tickers (warning level is {}); each period costs O(N^3)", maxUniverse,
          config.maxUniverseWarning);
    }

    BacktestResult result = new BacktestResult(rows, skipped, config.degradedThreshold);
    for (CovarianceMethod method : CovarianceMethod.values()) {
      double rate = result.getDegradedRate(method);
      if (result.isRunDegraded(method)) {
        log.warn("{}: {}% of periods used the equal-weight fallback (threshold {}%)", method.label,
            String.format("%.1f", rate * 100), String.format("%.1f", config.degradedThreshold * 100));
      } else {
        log.debug("{}: degraded rate {}", method.label, rate);
      }
    }
    log.info("Backtest complete: {} rows, {} skipped dates", rows.size(), skipped.size());
    return result;
  }

  private List<Period> computeSerial(ReturnSeries series, List<Integer> indices)
  {
    List<Period> periods = new ArrayList<>();
    for (int t : indices) {
      periods.add(computePeriod(series, t));
    }
    return periods;
  }

  private List<Period> computeParallel(ReturnSeries series, List<Integer> indices) throws BacktestException
  {
    ExecutorService executor = Executors.newFixedThreadPool(config.parallelism);
    try {
      List<Future<Period>> futures = new ArrayList<>();
      for (int t : indices) {
        futures.add(executor.submit(() -> computePeriod(series, t)));
      }
      List<Period> periods = new ArrayList<>();
      for (Future<Period> future : futures) {
        periods.add(future.get());
      }
      return periods;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BacktestException(BacktestException.Kind.INTERRUPTED, "Interrupted while waiting for periods", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException("Period computation failed", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  /** Compute weights and realized returns for both methods at index t using rows strictly before t. */
  Period computePeriod(ReturnSeries series, int t)
  {
    LocalDate date = series.getDate(t);
    ReturnWindow window = series.windowBefore(t, config.estimationWindow);
    Coverage coverage = filter.apply(window, series.getTickers());
    List<Allocation> allocations = new ArrayList<>();
    if (!coverage.isUsable()) {
      return new Period(date, coverage, allocations);
    }

    List<String> eligible = coverage.eligible;
    for (CovarianceMethod method : CovarianceMethod.values()) {
      CovarianceEstimate est = method.estimate(method.getInput(window, eligible), eligible.size());
      allocations.add(allocate(series, t, eligible, est));
    }
    log.debug("{}: {}", date, coverage);
    return new Period(date, coverage, allocations);
  }

  private Allocation allocate(ReturnSeries series, int t, List<String> eligible, CovarianceEstimate est)
  {
    final int n = eligible.size();
    final Constraints constraints = config.constraints;
    Set<PeriodFlag> flags = EnumSet.noneOf(PeriodFlag.class);
    if (est.singular) {
      flags.add(PeriodFlag.SINGULAR_COVARIANCE);
    }
    if (!constraints.isFeasible(n)) {
      flags.add(PeriodFlag.INFEASIBLE);
    }

    double[] w;
    if (flags.isEmpty()) {
      OptimizationResult opt = PortfolioOpt.minvar(est.matrix, constraints);
      w = opt.weights;
      if (opt.status == OptimizationResult.Status.INFEASIBLE) {
        flags.add(PeriodFlag.INFEASIBLE);
      } else if (opt.status == OptimizationResult.Status.NON_CONVERGENCE) {
        flags.add(PeriodFlag.NON_CONVERGENCE);
      }
      if (!opt.isOptimal()) {
        log.debug("{} {}: {}", series.getDate(t), est.method, opt);
      }
    } else {
      w = Library.equalWeights(n);
    }

    Map<String, Double> weights = new LinkedHashMap<>();
    double realized = 0.0;
    for (int i = 0; i < n; ++i) {
      String ticker = eligible.get(i);
      weights.put(ticker, w[i]);
      double r = series.get(t, ticker);
      if (!Double.isNaN(r)) {
        realized += w[i] * r;
      }
    }
    return new Allocation(est.method, weights, realized, !flags.isEmpty(), est.diagnostic, flags);
  }
}
