package org.minnen.minvar.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Contiguous block of rows [iStart, iEnd) from a {@link ReturnSeries}. */
public class ReturnWindow
{
  public final ReturnSeries series;
  public final int          iStart;
  public final int          iEnd;

  public ReturnWindow(ReturnSeries series, int iStart, int iEnd)
  {
    if (iStart < 0 || iEnd > series.size() || iStart >= iEnd) {
      throw new IllegalArgumentException(String.format("Invalid window [%d, %d) for series with %d dates", iStart,
          iEnd, series.size()));
    }
    this.series = series;
    this.iStart = iStart;
    this.iEnd = iEnd;
  }

  /** @return number of rows in this window. */
  public int length()
  {
    return iEnd - iStart;
  }

  public LocalDate getStartDate()
  {
    return series.getDate(iStart);
  }

  /** @return date of the last row inside the window. */
  public LocalDate getEndDate()
  {
    return series.getDate(iEnd - 1);
  }

  /** @return number of non-missing observations for the given ticker. */
  public int countObservations(String ticker)
  {
    int iTicker = series.indexOf(ticker);
    if (iTicker < 0) return 0;
    int n = 0;
    for (int i = iStart; i < iEnd; ++i) {
      if (!series.isMissing(i, iTicker)) {
        ++n;
      }
    }
    return n;
  }

  /** @return rows (as series indices) where every listed ticker has a value. */
  public int[] completeRows(List<String> tickers)
  {
    int[] cols = columns(tickers);
    List<Integer> rows = new ArrayList<>();
    for (int i = iStart; i < iEnd; ++i) {
      boolean complete = true;
      for (int col : cols) {
        if (series.isMissing(i, col)) {
          complete = false;
          break;
        }
      }
      if (complete) {
        rows.add(i);
      }
    }
    return rows.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Extract the T x N return matrix for the given tickers.
   *
   * Rows with a missing value for any of the tickers are dropped so T may be less than the window length.
   */
  public double[][] getMatrix(List<String> tickers)
  {
    int[] cols = columns(tickers);
    int[] rows = completeRows(tickers);
    double[][] m = new double[rows.length][cols.length];
    for (int i = 0; i < rows.length; ++i) {
      for (int j = 0; j < cols.length; ++j) {
        m[i][j] = series.get(rows[i], cols[j]);
      }
    }
    return m;
  }

  /**
   * Extract the full L x N return matrix for the given tickers, where L is the window length.
   *
   * A missing value is replaced by the mean of the ticker's observed values in this window so gaps in one ticker do
   * not remove rows for the others. A ticker with no observations is filled with zeros.
   */
  public double[][] getFilledMatrix(List<String> tickers)
  {
    int[] cols = columns(tickers);
    double[][] m = new double[length()][cols.length];
    for (int j = 0; j < cols.length; ++j) {
      double sum = 0.0;
      int n = 0;
      for (int i = iStart; i < iEnd; ++i) {
        if (!series.isMissing(i, cols[j])) {
          sum += series.get(i, cols[j]);
          ++n;
        }
      }
      double mean = (n > 0 ? sum / n : 0.0);
      for (int i = iStart; i < iEnd; ++i) {
        m[i - iStart][j] = (series.isMissing(i, cols[j]) ? mean : series.get(i, cols[j]));
      }
    }
    return m;
  }

  private int[] columns(List<String> tickers)
  {
    int[] cols = new int[tickers.size()];
    for (int j = 0; j < cols.length; ++j) {
      cols[j] = series.indexOf(tickers.get(j));
      if (cols[j] < 0) {
        throw new IllegalArgumentException(String.format("Unknown ticker: %s", tickers.get(j)));
      }
    }
    return cols;
  }

  @Override
  public String toString()
  {
    return String.format("[%s -> %s]", getStartDate(), getEndDate());
  }
}
