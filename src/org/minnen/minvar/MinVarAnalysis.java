package org.minnen.minvar;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.minnen.minvar.backtest.BacktestException;
import org.minnen.minvar.backtest.BacktestResult;
import org.minnen.minvar.backtest.BacktestRow;
import org.minnen.minvar.backtest.RollingBacktest;
import org.minnen.minvar.config.BacktestConfig;
import org.minnen.minvar.config.ConfigIO;
import org.minnen.minvar.cov.CovarianceMethod;
import org.minnen.minvar.data.DataException;
import org.minnen.minvar.data.DataIO;
import org.minnen.minvar.data.ReturnSeries;
import org.minnen.minvar.stats.MethodComparison;
import org.minnen.minvar.stats.PerformanceStats;
import org.minnen.minvar.stats.TurnoverStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares sample and Ledoit-Wolf covariance estimates for minimum-variance portfolios.
 *
 * Prepares the data according to a {@link BacktestConfig}, runs the rolling backtest and summarizes both methods.
 */
public class MinVarAnalysis
{
  private static final Logger log = LoggerFactory.getLogger(MinVarAnalysis.class);

  public static AnalysisResult run(ReturnSeries series, BacktestConfig config) throws DataException, BacktestException
  {
    config.validate();
    ReturnSeries data = prepare(series, config);

    RollingBacktest backtest = new RollingBacktest(config);
    BacktestResult result = backtest.run(data);

    Map<CovarianceMethod, PerformanceStats> performance = new EnumMap<>(CovarianceMethod.class);
    Map<CovarianceMethod, TurnoverStats> turnover = new EnumMap<>(CovarianceMethod.class);
    for (CovarianceMethod method : CovarianceMethod.values()) {
      PerformanceStats stats = PerformanceStats.calc(method.label, result.getReturns(method), config.riskFreeRate);
      performance.put(method, stats);
      turnover.put(method, TurnoverStats.calc(method.label, result.getTurnover(method)));
      log.info("{} {}", stats, turnover.get(method));
    }
    MethodComparison comparison = MethodComparison.calc(performance.get(CovarianceMethod.SAMPLE),
        performance.get(CovarianceMethod.SHRINKAGE));
    log.info("{}", comparison);

    AnalysisResult analysis = new AnalysisResult(result, performance, turnover, comparison, usedTickers(data, result));
    if (analysis.isRunDegraded()) {
      log.warn("Run is degraded: too many periods used the equal-weight fallback");
    }
    return analysis;
  }

  /** Restrict the series to the configured years and tickers. */
  static ReturnSeries prepare(ReturnSeries series, BacktestConfig config) throws DataException
  {
    ReturnSeries data = series;
    if (config.hasYearRange()) {
      data = data.subsetYears(config.startYear, config.endYear);
    }
    if (!config.tickers.isEmpty()) {
      List<String> missing = new ArrayList<>();
      for (String ticker : config.tickers) {
        if (!data.hasTicker(ticker)) {
          missing.add(ticker);
        }
      }
      if (!missing.isEmpty()) {
        log.warn("Tickers not found in data: {}", missing);
      }
      data = data.subsetTickers(config.tickers);
    }
    if (data.size() < config.estimationWindow + 1) {
      throw new DataException(String.format("Only %d dates available; need at least %d for a %d-month window",
          data.size(), config.estimationWindow + 1, config.estimationWindow));
    }
    log.info("Prepared data: {}", data);
    return data;
  }

  private static List<String> usedTickers(ReturnSeries data, BacktestResult result)
  {
    Set<String> used = new LinkedHashSet<>();
    for (BacktestRow row : result.rows) {
      used.addAll(row.weights.keySet());
    }
    List<String> tickers = new ArrayList<>();
    for (String ticker : data.getTickers()) {
      if (used.contains(ticker)) {
        tickers.add(ticker);
      }
    }
    return tickers;
  }

  public static void main(String[] args) throws IOException, DataException, BacktestException
  {
    if (args.length < 1 || args.length > 2) {
      System.err.println("Usage: MinVarAnalysis <returns.csv> [config.properties]");
      System.exit(1);
    }
    ReturnSeries series = DataIO.loadCSV(new File(args[0]));
    BacktestConfig config = (args.length > 1 ? ConfigIO.load(new File(args[1])) : ConfigIO.loadDefaults());
    AnalysisResult analysis = run(series, config);

    System.out.printf("%20s: %8s %8s %7s %7s %9s %7s\n", "Method", "Return", "Vol", "Sharpe", "Sortino", "MaxDD",
        "Win");
    for (CovarianceMethod method : CovarianceMethod.values()) {
      System.out.println(analysis.getPerformance(method).toRowString());
    }
    for (CovarianceMethod method : CovarianceMethod.values()) {
      System.out.println(analysis.getTurnover(method));
    }
    System.out.println(analysis.comparison);
  }
}
