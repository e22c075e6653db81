package org.minnen.minvar;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.minnen.minvar.backtest.BacktestResult;
import org.minnen.minvar.cov.CovarianceMethod;
import org.minnen.minvar.stats.MethodComparison;
import org.minnen.minvar.stats.PerformanceStats;
import org.minnen.minvar.stats.TurnoverStats;

/** Backtest rows plus the statistics derived from them for each covariance method. */
public class AnalysisResult
{
  public final BacktestResult                          backtest;
  public final Map<CovarianceMethod, PerformanceStats> performance;
  public final Map<CovarianceMethod, TurnoverStats>    turnover;
  public final MethodComparison                        comparison;

  /** Tickers that were eligible in at least one period, in data order. */
  public final List<String>                            tickers;

  public AnalysisResult(BacktestResult backtest, Map<CovarianceMethod, PerformanceStats> performance,
      Map<CovarianceMethod, TurnoverStats> turnover, MethodComparison comparison, List<String> tickers)
  {
    this.backtest = backtest;
    this.performance = Collections.unmodifiableMap(performance);
    this.turnover = Collections.unmodifiableMap(turnover);
    this.comparison = comparison;
    this.tickers = Collections.unmodifiableList(tickers);
  }

  public PerformanceStats getPerformance(CovarianceMethod method)
  {
    return performance.get(method);
  }

  public TurnoverStats getTurnover(CovarianceMethod method)
  {
    return turnover.get(method);
  }

  /** @return true if either method fell back to equal weights more often than the configured threshold allows. */
  public boolean isRunDegraded()
  {
    for (CovarianceMethod method : CovarianceMethod.values()) {
      if (backtest.isRunDegraded(method)) return true;
    }
    return false;
  }
}
