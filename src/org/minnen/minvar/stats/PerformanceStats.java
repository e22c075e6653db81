package org.minnen.minvar.stats;

import org.apache.commons.math3.stat.descriptive.moment.Kurtosis;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.minnen.minvar.util.Library;

/**
 * Holds statistics that characterize the monthly returns of one backtested portfolio.
 *
 * Annualized values assume twelve periods per year. Drawdown is a non-positive fraction.
 *
 * @author David Minnen
 */
public class PerformanceStats
{
  public String   name;
  public double[] returns;
  public double   riskFreeRate;
  public int      count;
  public double   totalReturn;
  public double   annualizedReturn;
  public double   annualizedVolatility;
  public double   sharpe;
  public double   sortino;
  public double   maxDrawdown;
  public double   winRate;
  public double   skewness;
  public double   kurtosis;
  public double   bestMonth;
  public double   worstMonth;

  public static PerformanceStats calc(String name, double[] returns, double riskFreeRate)
  {
    PerformanceStats stats = new PerformanceStats();
    stats.name = name;
    stats.returns = returns.clone();
    stats.riskFreeRate = riskFreeRate;
    stats.count = returns.length;

    if (returns.length > 0) {
      stats.annualizedReturn = Library.mean(returns) * 12.0;
      stats.annualizedVolatility = Library.stdev(returns) * Library.SQRT_12;
      if (stats.annualizedVolatility > 0.0) {
        stats.sharpe = (stats.annualizedReturn - riskFreeRate) / stats.annualizedVolatility;
      }

      double[] downside = Library.negatives(returns);
      if (downside.length >= 2) {
        double downDev = Library.stdev(downside) * Library.SQRT_12;
        if (downDev > 0.0) {
          stats.sortino = (stats.annualizedReturn - riskFreeRate) / downDev;
        }
      }

      int nUp = 0;
      stats.bestMonth = Double.NEGATIVE_INFINITY;
      stats.worstMonth = Double.POSITIVE_INFINITY;
      for (double r : returns) {
        if (r > 0.0) ++nUp;
        stats.bestMonth = Math.max(stats.bestMonth, r);
        stats.worstMonth = Math.min(stats.worstMonth, r);
      }
      stats.winRate = (double) nUp / returns.length;

      stats.skewness = finiteOrZero(new Skewness().evaluate(returns));
      stats.kurtosis = finiteOrZero(new Kurtosis().evaluate(returns));

      stats.calcDrawdownStats();
    }
    return stats;
  }

  /** Total return and the worst peak-to-trough decline of the compounded value. */
  private void calcDrawdownStats()
  {
    double value = 1.0;
    double peak = Double.NEGATIVE_INFINITY;
    maxDrawdown = 0.0;
    for (double r : returns) {
      value *= 1.0 + r;
      peak = Math.max(peak, value);
      // A peak at or below zero means the capital is gone.
      double drawdown = (peak > 0.0 ? (value - peak) / peak : -1.0);
      if (drawdown < maxDrawdown) {
        maxDrawdown = drawdown;
      }
    }
    totalReturn = value - 1.0;
  }

  private static double finiteOrZero(double x)
  {
    return Double.isFinite(x) ? x : 0.0;
  }

  @Override
  public String toString()
  {
    return String.format("[%s: ret=%.2f%%, vol=%.2f%%, sharpe=%.3f, sortino=%.3f, dd=%.2f%%]", name,
        annualizedReturn * 100, annualizedVolatility * 100, sharpe, sortino, maxDrawdown * 100);
  }

  public String toRowString()
  {
    return String.format("%20s: %7.2f%% %7.2f%% %7.3f %7.3f %8.2f%% %6.1f%%", name, annualizedReturn * 100,
        annualizedVolatility * 100, sharpe, sortino, maxDrawdown * 100, winRate * 100);
  }
}
