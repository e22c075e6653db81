package org.minnen.minvar.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads monthly return data from CSV files.
 *
 * Two layouts are supported:
 * <ul>
 * <li>long: <code>date,ticker,return[,...]</code> with one observation per line</li>
 * <li>wide: <code>date,T1,T2,...</code> with one date per line and empty cells for missing values</li>
 * </ul>
 * Dates may be <code>yyyy-MM-dd</code> or <code>yyyy-MM</code> (mapped to the last day of the month).
 */
public class DataIO
{
  private static final Logger log = LoggerFactory.getLogger(DataIO.class);

  /**
   * Load return data from a CSV file, detecting the layout from the header.
   *
   * @param file file to load
   * @return ReturnSeries with data loaded from the given file.
   * @throws IOException if the file can't be read
   * @throws DataException if the file has no usable header or data
   */
  public static ReturnSeries loadCSV(File file) throws IOException, DataException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read CSV file (%s)", file.getPath()));
    }
    log.info("Loading CSV data file: [{}]", file.getPath());
    try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return loadCSV(file.getName(), in);
    }
  }

  /** Load return data from a CSV stream (e.g. a classpath resource). */
  public static ReturnSeries loadCSV(String name, InputStream stream) throws IOException, DataException
  {
    try (BufferedReader in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      return loadCSV(name, in);
    }
  }

  private static ReturnSeries loadCSV(String name, Reader reader) throws IOException, DataException
  {
    BufferedReader in = (reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader));
    String header = nextLine(in);
    if (header == null) {
      throw new DataException(String.format("Empty CSV data (%s)", name));
    }
    String[] cols = split(header);
    for (int i = 0; i < cols.length; ++i) {
      cols[i] = cols[i].toLowerCase(Locale.ROOT);
    }
    if (indexOf(cols, "ticker") >= 0) {
      return readLong(name, cols, in);
    } else {
      return readWide(name, split(header), in);
    }
  }

  private static ReturnSeries readLong(String name, String[] cols, BufferedReader in) throws IOException, DataException
  {
    final int iDate = indexOf(cols, "date");
    final int iTicker = indexOf(cols, "ticker");
    int iReturn = indexOf(cols, "return");
    if (iReturn < 0) {
      iReturn = indexOf(cols, "ret");
    }
    if (iDate < 0 || iReturn < 0) {
      throw new DataException(String.format("Long CSV header needs date, ticker and return columns (%s)", name));
    }
    final int minTokens = Math.max(iDate, Math.max(iTicker, iReturn)) + 1;

    ReturnSeries.Builder builder = new ReturnSeries.Builder(name);
    int nSkipped = 0;
    int nBadValues = 0;
    String line;
    while ((line = nextLine(in)) != null) {
      String[] toks = split(line);
      if (toks.length < minTokens || toks[iTicker].isEmpty()) {
        ++nSkipped;
        continue;
      }
      LocalDate date = parseDate(toks[iDate]);
      if (date == null) {
        ++nSkipped;
        continue;
      }
      // Tickers with a blank return still count as part of the universe.
      builder.addTicker(toks[iTicker]);
      double r = parseReturn(toks[iReturn]);
      if (!Double.isNaN(r)) {
        builder.add(date, toks[iTicker], r);
      } else if (!isMissingToken(toks[iReturn])) {
        ++nBadValues;
      }
    }
    if (nSkipped > 0) {
      log.warn("Skipped {} malformed lines in {}", nSkipped, name);
    }
    if (nBadValues > 0) {
      log.warn("Treated {} unparseable or non-finite returns as missing in {}", nBadValues, name);
    }
    if (builder.getDuplicateCount() > 0) {
      log.warn("Dropped {} duplicate (date, ticker) rows in {}", builder.getDuplicateCount(), name);
    }
    return finish(builder.build());
  }

  private static ReturnSeries readWide(String name, String[] header, BufferedReader in) throws IOException,
      DataException
  {
    if (header.length < 2) {
      throw new DataException(String.format("Wide CSV header needs a date column and at least one ticker (%s)", name));
    }
    ReturnSeries.Builder builder = new ReturnSeries.Builder(name);
    for (int j = 1; j < header.length; ++j) {
      builder.addTicker(header[j]);
    }

    int nSkipped = 0;
    int nBadValues = 0;
    String line;
    while ((line = nextLine(in)) != null) {
      String[] toks = split(line);
      LocalDate date = parseDate(toks[0]);
      if (date == null) {
        ++nSkipped;
        continue;
      }
      for (int j = 1; j < header.length && j < toks.length; ++j) {
        double r = parseReturn(toks[j]);
        if (!Double.isNaN(r)) {
          builder.add(date, header[j], r);
        } else if (!isMissingToken(toks[j])) {
          ++nBadValues;
        }
      }
    }
    if (nSkipped > 0) {
      log.warn("Skipped {} malformed lines in {}", nSkipped, name);
    }
    if (nBadValues > 0) {
      log.warn("Treated {} unparseable or non-finite returns as missing in {}", nBadValues, name);
    }
    return finish(builder.build());
  }

  private static ReturnSeries finish(ReturnSeries series) throws DataException
  {
    if (series.isEmpty()) {
      throw new DataException(String.format("No return data found (%s)", series.getName()));
    }
    log.info("Loaded {}", series);
    return series;
  }

  /**
   * Parse a date in <code>yyyy-MM-dd</code> or <code>yyyy-MM</code> format.
   *
   * @return parsed date or null if the string is not a valid date
   */
  public static LocalDate parseDate(String s)
  {
    try {
      if (s.length() <= 7) {
        return YearMonth.parse(s).atEndOfMonth();
      }
      return LocalDate.parse(s.substring(0, 10));
    } catch (DateTimeParseException | StringIndexOutOfBoundsException e) {
      return null;
    }
  }

  /** @return true if the given cell is an explicit missing-value marker. */
  public static boolean isMissingToken(String s)
  {
    return StringUtils.isBlank(s) || s.equals(".") || s.equalsIgnoreCase("NA") || s.equalsIgnoreCase("NaN");
  }

  /** @return parsed return or NaN for missing, unparseable or non-finite values (e.g. "Infinity" or "1e400"). */
  public static double parseReturn(String s)
  {
    if (isMissingToken(s)) {
      return Double.NaN;
    }
    try {
      double r = Double.parseDouble(s);
      return Double.isFinite(r) ? r : Double.NaN;
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }

  /** @return next non-empty line (trimmed) or null at end of stream. */
  private static String nextLine(BufferedReader in) throws IOException
  {
    String line;
    while ((line = in.readLine()) != null) {
      line = line.trim();
      if (!line.isEmpty() && !line.startsWith("#")) {
        return line;
      }
    }
    return null;
  }

  private static String[] split(String line)
  {
    String[] toks = line.split(",", -1);
    for (int i = 0; i < toks.length; ++i) {
      toks[i] = StringUtils.strip(toks[i].trim(), "\"");
    }
    return toks;
  }

  private static int indexOf(String[] cols, String name)
  {
    for (int i = 0; i < cols.length; ++i) {
      if (cols[i].equals(name)) return i;
    }
    return -1;
  }
}
