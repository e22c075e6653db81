package org.minnen.minvar.backtest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.minnen.minvar.cov.CovarianceMethod;

/** All rows produced by a {@link RollingBacktest} run, in (date, method) order. */
public class BacktestResult
{
  public final List<BacktestRow> rows;

  /** Rebalancing dates skipped because fewer than two assets were eligible. */
  public final List<LocalDate>   skippedDates;

  public final double            degradedThreshold;

  public BacktestResult(List<BacktestRow> rows, List<LocalDate> skippedDates, double degradedThreshold)
  {
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    this.skippedDates = Collections.unmodifiableList(new ArrayList<>(skippedDates));
    this.degradedThreshold = degradedThreshold;
  }

  public boolean isEmpty()
  {
    return rows.isEmpty();
  }

  /** @return rows for the given method in date order. */
  public List<BacktestRow> getRows(CovarianceMethod method)
  {
    List<BacktestRow> list = new ArrayList<>();
    for (BacktestRow row : rows) {
      if (row.method == method) {
        list.add(row);
      }
    }
    return list;
  }

  /** @return realized returns for the given method in date order. */
  public double[] getReturns(CovarianceMethod method)
  {
    return getRows(method).stream().mapToDouble(row -> row.realizedReturn).toArray();
  }

  /** @return per-row turnover for the given method in date order (first entry is zero). */
  public double[] getTurnover(CovarianceMethod method)
  {
    return getRows(method).stream().mapToDouble(row -> row.turnover).toArray();
  }

  public List<LocalDate> getDates(CovarianceMethod method)
  {
    List<LocalDate> dates = new ArrayList<>();
    for (BacktestRow row : getRows(method)) {
      dates.add(row.date);
    }
    return dates;
  }

  /** @return fraction of rows for the given method that used the equal-weight fallback. */
  public double getDegradedRate(CovarianceMethod method)
  {
    List<BacktestRow> list = getRows(method);
    if (list.isEmpty()) return 0.0;
    long n = list.stream().filter(row -> row.degraded).count();
    return (double) n / list.size();
  }

  /** @return true if the degraded rate for the given method exceeds the configured threshold. */
  public boolean isRunDegraded(CovarianceMethod method)
  {
    return getDegradedRate(method) > degradedThreshold;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof BacktestResult)) return false;
    BacktestResult other = (BacktestResult) o;
    return rows.equals(other.rows) && skippedDates.equals(other.skippedDates)
        && Double.compare(degradedThreshold, other.degradedThreshold) == 0;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(rows, skippedDates, degradedThreshold);
  }

  @Override
  public String toString()
  {
    return String.format("[BacktestResult: %d rows, %d skipped]", rows.size(), skippedDates.size());
  }
}
