package org.minnen.minvar.stats;

/**
 * Summary of how much a portfolio was traded over a backtest.
 *
 * The first period has no prior portfolio so only later periods are counted as rebalances.
 */
public class TurnoverStats
{
  public String name;
  public int    rebalances;
  public double average;
  public double total;
  public double max;

  /**
   * @param name name of the method or portfolio
   * @param turnover per-period L1 weight change in date order (first entry is the initial allocation)
   */
  public static TurnoverStats calc(String name, double[] turnover)
  {
    TurnoverStats stats = new TurnoverStats();
    stats.name = name;
    for (int i = 1; i < turnover.length; ++i) {
      stats.total += turnover[i];
      stats.max = Math.max(stats.max, turnover[i]);
      ++stats.rebalances;
    }
    if (stats.rebalances > 0) {
      stats.average = stats.total / stats.rebalances;
    }
    return stats;
  }

  @Override
  public String toString()
  {
    return String.format("[%s: avg=%.4f, max=%.4f, n=%d]", name, average, max, rebalances);
  }
}
