package org.minnen.minvar.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable table of monthly returns indexed by date (rows) and ticker (columns).
 *
 * Missing observations are stored as NaN. Dates are strictly increasing.
 *
 * @author David Minnen
 */
public class ReturnSeries
{
  private final String               name;
  private final List<LocalDate>      dates;
  private final List<String>         tickers;
  private final Map<String, Integer> tickerIndex;
  private final double[][]           data;

  /**
   * Create a return series from the given table.
   *
   * @param name name of this series
   * @param dates strictly increasing observation dates
   * @param tickers column names
   * @param data returns with data[iDate][iTicker]; NaN marks a missing value
   */
  public ReturnSeries(String name, List<LocalDate> dates, List<String> tickers, double[][] data)
  {
    if (dates.size() != data.length) {
      throw new IllegalArgumentException(String.format("Date count (%d) does not match row count (%d)", dates.size(),
          data.length));
    }
    for (int i = 1; i < dates.size(); ++i) {
      if (!dates.get(i).isAfter(dates.get(i - 1))) {
        throw new IllegalArgumentException(String.format("Dates must be strictly increasing (%s then %s)",
            dates.get(i - 1), dates.get(i)));
      }
    }
    this.tickerIndex = new HashMap<>();
    for (int i = 0; i < tickers.size(); ++i) {
      if (tickerIndex.put(tickers.get(i), i) != null) {
        throw new IllegalArgumentException(String.format("Duplicate ticker: %s", tickers.get(i)));
      }
    }

    this.name = name;
    this.dates = Collections.unmodifiableList(new ArrayList<>(dates));
    this.tickers = Collections.unmodifiableList(new ArrayList<>(tickers));
    this.data = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      if (data[i].length != tickers.size()) {
        throw new IllegalArgumentException(String.format("Row %d has %d values but there are %d tickers", i,
            data[i].length, tickers.size()));
      }
      this.data[i] = Arrays.copyOf(data[i], data[i].length);
    }
  }

  public String getName()
  {
    return name;
  }

  /** @return number of dates in this series. */
  public int size()
  {
    return dates.size();
  }

  public boolean isEmpty()
  {
    return dates.isEmpty();
  }

  public int numTickers()
  {
    return tickers.size();
  }

  public List<LocalDate> getDates()
  {
    return dates;
  }

  public LocalDate getDate(int i)
  {
    return dates.get(i);
  }

  public List<String> getTickers()
  {
    return tickers;
  }

  public boolean hasTicker(String ticker)
  {
    return tickerIndex.containsKey(ticker);
  }

  /** @return column index of the given ticker or -1 if it is not in this series. */
  public int indexOf(String ticker)
  {
    Integer index = tickerIndex.get(ticker);
    return index == null ? -1 : index;
  }

  public double get(int iDate, int iTicker)
  {
    return data[iDate][iTicker];
  }

  /** @return return for the given ticker at row `iDate`, or NaN if missing. */
  public double get(int iDate, String ticker)
  {
    int index = indexOf(ticker);
    if (index < 0) {
      throw new IllegalArgumentException(String.format("Unknown ticker: %s", ticker));
    }
    return data[iDate][index];
  }

  public boolean isMissing(int iDate, int iTicker)
  {
    return Double.isNaN(data[iDate][iTicker]);
  }

  /**
   * Verify that every present value is finite.
   *
   * @throws DataException naming the first infinite return
   */
  public void checkFinite() throws DataException
  {
    for (int i = 0; i < data.length; ++i) {
      for (int j = 0; j < data[i].length; ++j) {
        if (Double.isInfinite(data[i][j])) {
          throw new DataException(String.format("Non-finite return for %s on %s (%s)", tickers.get(j), dates.get(i),
              name));
        }
      }
    }
  }

  /** @return trailing window of `length` rows that ends just before row `iEnd`. */
  public ReturnWindow windowBefore(int iEnd, int length)
  {
    return new ReturnWindow(this, iEnd - length, iEnd);
  }

  /** @return series restricted to dates within [startYear, endYear] (inclusive). */
  public ReturnSeries subsetYears(int startYear, int endYear)
  {
    List<LocalDate> subDates = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    for (int i = 0; i < dates.size(); ++i) {
      int year = dates.get(i).getYear();
      if (year >= startYear && year <= endYear) {
        subDates.add(dates.get(i));
        rows.add(data[i]);
      }
    }
    return new ReturnSeries(name, subDates, tickers, rows.toArray(new double[rows.size()][]));
  }

  /**
   * Restrict this series to the given tickers.
   *
   * Tickers that are not present in this series are ignored; order follows the `keep` collection.
   */
  public ReturnSeries subsetTickers(Collection<String> keep)
  {
    List<String> subTickers = new ArrayList<>();
    for (String ticker : new LinkedHashSet<>(keep)) {
      if (hasTicker(ticker)) {
        subTickers.add(ticker);
      }
    }
    double[][] subData = new double[data.length][subTickers.size()];
    for (int i = 0; i < data.length; ++i) {
      for (int j = 0; j < subTickers.size(); ++j) {
        subData[i][j] = data[i][indexOf(subTickers.get(j))];
      }
    }
    return new ReturnSeries(name, dates, subTickers, subData);
  }

  /** @return first `n` rows of this series. */
  public ReturnSeries head(int n)
  {
    n = Math.min(n, size());
    return new ReturnSeries(name, dates.subList(0, n), tickers, Arrays.copyOf(data, n));
  }

  @Override
  public String toString()
  {
    if (isEmpty()) {
      return String.format("[%s: empty, %d tickers]", name, numTickers());
    }
    return String.format("[%s: %s -> %s, %d dates, %d tickers]", name, dates.get(0), dates.get(size() - 1), size(),
        numTickers());
  }

  /**
   * Collects (date, ticker, return) observations in any order and builds a {@link ReturnSeries}.
   *
   * The first value seen for a (date, ticker) pair is kept. Ticker order follows first appearance.
   */
  public static class Builder
  {
    private final String                                name;
    private final TreeMap<LocalDate, Map<String, Double>> rows    = new TreeMap<>();
    private final LinkedHashSet<String>                 tickers = new LinkedHashSet<>();
    private int                                         nDuplicates;

    public Builder(String name)
    {
      this.name = name;
    }

    /** Register a ticker even if it never receives a value. */
    public Builder addTicker(String ticker)
    {
      tickers.add(ticker);
      return this;
    }

    public Builder add(LocalDate date, String ticker, double value)
    {
      tickers.add(ticker);
      Map<String, Double> row = rows.computeIfAbsent(date, d -> new LinkedHashMap<>());
      if (row.containsKey(ticker)) {
        ++nDuplicates;
      } else {
        row.put(ticker, value);
      }
      return this;
    }

    /** @return number of observations dropped because their (date, ticker) pair was already present. */
    public int getDuplicateCount()
    {
      return nDuplicates;
    }

    public ReturnSeries build()
    {
      List<String> tickerList = new ArrayList<>(tickers);
      List<LocalDate> dateList = new ArrayList<>(rows.keySet());
      double[][] data = new double[dateList.size()][tickerList.size()];
      int i = 0;
      for (Map<String, Double> row : rows.values()) {
        for (int j = 0; j < tickerList.size(); ++j) {
          data[i][j] = row.getOrDefault(tickerList.get(j), Double.NaN);
        }
        ++i;
      }
      return new ReturnSeries(name, dateList, tickerList, data);
    }
  }
}
