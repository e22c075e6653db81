package org.minnen.minvar.backtest;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.minnen.minvar.cov.CovarianceMethod;

/**
 * Outcome of one rebalancing period for one covariance method.
 *
 * The weights were chosen from data strictly before `date` and the realized return is the portfolio return on `date`.
 */
public class BacktestRow
{
  public final LocalDate           date;
  public final CovarianceMethod    method;
  public final Map<String, Double> weights;
  public final double              realizedReturn;

  /** L1 distance to the previous row's weights for the same method (0 for the first row). */
  public final double              turnover;

  /** True if the weights are the equal-weight fallback rather than the optimizer's solution. */
  public final boolean             degraded;

  /** Shrinkage intensity (Ledoit-Wolf) or 0 (sample). */
  public final double              diagnostic;

  public final Set<PeriodFlag>     flags;

  public BacktestRow(LocalDate date, CovarianceMethod method, Map<String, Double> weights, double realizedReturn,
      double turnover, boolean degraded, double diagnostic, Set<PeriodFlag> flags)
  {
    this.date = date;
    this.method = method;
    this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    this.realizedReturn = realizedReturn;
    this.turnover = turnover;
    this.degraded = degraded;
    this.diagnostic = diagnostic;
    this.flags = Collections.unmodifiableSet(flags.isEmpty() ? EnumSet.noneOf(PeriodFlag.class) : EnumSet.copyOf(flags));
  }

  public double getWeight(String ticker)
  {
    return weights.getOrDefault(ticker, 0.0);
  }

  public boolean hasFlag(PeriodFlag flag)
  {
    return flags.contains(flag);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof BacktestRow)) return false;
    BacktestRow other = (BacktestRow) o;
    return date.equals(other.date) && method == other.method && weights.equals(other.weights)
        && Double.compare(realizedReturn, other.realizedReturn) == 0 && Double.compare(turnover, other.turnover) == 0
        && degraded == other.degraded && Double.compare(diagnostic, other.diagnostic) == 0
        && flags.equals(other.flags);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(date, method, weights, realizedReturn, turnover, degraded, diagnostic, flags);
  }

  @Override
  public String toString()
  {
    return String.format("[%s %s: %d assets, ret=%.4f, turnover=%.4f%s%s]", date, method, weights.size(),
        realizedReturn, turnover, degraded ? ", degraded" : "", flags.isEmpty() ? "" : " " + flags);
  }
}
