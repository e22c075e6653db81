package org.minnen.minvar.tests;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;
import org.minnen.minvar.backtest.BacktestException;
import org.minnen.minvar.backtest.BacktestResult;
import org.minnen.minvar.backtest.BacktestRow;
import org.minnen.minvar.backtest.PeriodFlag;
import org.minnen.minvar.backtest.RollingBacktest;
import org.minnen.minvar.config.BacktestConfig;
import org.minnen.minvar.config.Constraints;
import org.minnen.minvar.cov.CovarianceMethod;
import org.minnen.minvar.data.DataException;
import org.minnen.minvar.data.ReturnSeries;

public class TestRollingBacktest
{
  private static void assertValidWeights(BacktestResult result, Constraints constraints)
  {
    for (BacktestRow row : result.rows) {
      double sum = 0.0;
      for (double w : row.weights.values()) {
        assertTrue(row.toString(), w >= constraints.getLower() - 1e-6);
        assertTrue(row.toString(), w <= constraints.getUpper() + 1e-6);
        sum += w;
      }
      assertEquals(row.toString(), 1.0, sum, 1e-6);
    }
  }

  @Test
  public void testThreeAssetsSixMonths() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(6, 3, 41);
    Constraints constraints = Constraints.longOnly(1.0);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(3).constraints(constraints).build();
    BacktestResult result = new RollingBacktest(config).run(series);

    assertEquals(6, result.rows.size());
    assertTrue(result.skippedDates.isEmpty());
    for (CovarianceMethod method : CovarianceMethod.values()) {
      List<BacktestRow> rows = result.getRows(method);
      assertEquals(3, rows.size());
      assertEquals(series.getDates().subList(3, 6), result.getDates(method));
      assertEquals(0.0, rows.get(0).turnover, 0.0);
    }
    assertValidWeights(result, constraints);

    // Three observations of three assets are not enough for the sample estimator.
    for (BacktestRow row : result.getRows(CovarianceMethod.SAMPLE)) {
      assertTrue(row.degraded);
      assertTrue(row.hasFlag(PeriodFlag.SINGULAR_COVARIANCE));
      assertEquals(1.0 / 3.0, row.getWeight("T0"), 1e-12);
    }
    for (BacktestRow row : result.getRows(CovarianceMethod.SHRINKAGE)) {
      assertFalse(row.hasFlag(PeriodFlag.SINGULAR_COVARIANCE));
      assertTrue(row.diagnostic >= 0.0 && row.diagnostic <= 1.0);
    }
  }

  @Test
  public void testMoreAssetsThanObservations() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(11, 15, 42);
    Constraints constraints = Constraints.longOnly(1.0);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(10).constraints(constraints).build();
    BacktestResult result = new RollingBacktest(config).run(series);
    assertEquals(2, result.rows.size());

    BacktestRow sample = result.getRows(CovarianceMethod.SAMPLE).get(0);
    assertTrue(sample.degraded);
    assertTrue(sample.hasFlag(PeriodFlag.SINGULAR_COVARIANCE));
    assertEquals(15, sample.weights.size());
    for (double w : sample.weights.values()) {
      assertEquals(1.0 / 15.0, w, 1e-12);
    }
    assertEquals(1.0, result.getDegradedRate(CovarianceMethod.SAMPLE), 0.0);
    assertTrue(result.isRunDegraded(CovarianceMethod.SAMPLE));

    BacktestRow shrunk = result.getRows(CovarianceMethod.SHRINKAGE).get(0);
    assertFalse(shrunk.degraded);
    assertTrue(shrunk.flags.isEmpty());
    assertTrue(shrunk.diagnostic > 0.0);
    assertFalse(result.isRunDegraded(CovarianceMethod.SHRINKAGE));
    assertValidWeights(result, constraints);
  }

  @Test
  public void testRealizedReturn() throws BacktestException, DataException
  {
    double[][] data = AllTests.randomReturns(30, 4, 43);
    data[25][2] = Double.NaN;
    ReturnSeries series = AllTests.buildSeries(data, AllTests.tickers(4));
    BacktestConfig config = BacktestConfig.builder().estimationWindow(12).coverage(11, 0.1).build();
    BacktestResult result = new RollingBacktest(config).run(series);

    for (BacktestRow row : result.rows) {
      int t = series.getDates().indexOf(row.date);
      double expected = 0.0;
      for (String ticker : row.weights.keySet()) {
        double r = series.get(t, ticker);
        if (!Double.isNaN(r)) {
          expected += row.getWeight(ticker) * r;
        }
      }
      assertEquals(expected, row.realizedReturn, 1e-12);
    }

    // T2 has a value in the window for t=25 but not at t=25 itself.
    BacktestRow row = result.getRows(CovarianceMethod.SHRINKAGE).get(25 - 12);
    assertEquals(series.getDate(25), row.date);
    assertTrue(row.weights.containsKey("T2"));
  }

  @Test
  public void testNoLookAhead() throws BacktestException, DataException
  {
    final int cut = 40;
    double[][] data = AllTests.randomReturns(60, 4, 44);
    double[][] altered = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      altered[i] = data[i].clone();
      if (i > cut) {
        for (int j = 0; j < altered[i].length; ++j) {
          altered[i][j] = -altered[i][j] * 3.0 + 0.05;
        }
      }
    }
    ReturnSeries original = AllTests.buildSeries(data, AllTests.tickers(4));
    ReturnSeries future = AllTests.buildSeries(altered, AllTests.tickers(4));
    ReturnSeries truncated = original.head(cut + 1);

    BacktestConfig config = BacktestConfig.builder().estimationWindow(24).build();
    BacktestResult a = new RollingBacktest(config).run(original);
    BacktestResult b = new RollingBacktest(config).run(future);
    BacktestResult c = new RollingBacktest(config).run(truncated);

    int nKept = 0;
    for (int i = 0; i < a.rows.size(); ++i) {
      BacktestRow row = a.rows.get(i);
      if (row.date.isAfter(original.getDate(cut))) break;
      assertEquals(row, b.rows.get(i));
      assertEquals(row, c.rows.get(i));
      ++nKept;
    }
    assertEquals(c.rows.size(), nKept);
    assertEquals(2 * (cut - 24 + 1), nKept);
  }

  @Test
  public void testDeterministic() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(48, 6, 45);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(24).build();
    BacktestResult a = new RollingBacktest(config).run(series);
    BacktestResult b = new RollingBacktest(config).run(series);
    assertEquals(a, b);
  }

  @Test
  public void testParallelMatchesSerial() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(48, 6, 46);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(24).constraints(Constraints.longOnly(0.4))
        .build();
    BacktestResult serial = new RollingBacktest(config).run(series);
    BacktestResult parallel = new RollingBacktest(config.toBuilder().parallelism(4).build()).run(series);
    assertEquals(serial, parallel);
    assertEquals(2 * 24, parallel.rows.size());
  }

  @Test
  public void testStep() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(30, 3, 47);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(12).step(5).build();
    BacktestResult result = new RollingBacktest(config).run(series);

    // t = 12, 17, 22, 27
    List<BacktestRow> rows = result.getRows(CovarianceMethod.SAMPLE);
    assertEquals(4, rows.size());
    assertEquals(series.getDate(12), rows.get(0).date);
    assertEquals(series.getDate(27), rows.get(3).date);
  }

  @Test
  public void testLongOnlyTurnoverBound() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(60, 5, 48);
    Constraints constraints = Constraints.longOnly(1.0);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(12).constraints(constraints).build();
    BacktestResult result = new RollingBacktest(config).run(series);
    assertValidWeights(result, constraints);
    for (BacktestRow row : result.rows) {
      assertTrue(row.turnover >= 0.0);
      assertTrue(row.turnover <= 2.0 + 1e-9);
    }
  }

  @Test
  public void testZeroTurnover() throws BacktestException, DataException
  {
    // A box of [0.5, 0.5] admits only one portfolio.
    ReturnSeries series = AllTests.randomSeries(20, 2, 49);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(6)
        .constraints(new Constraints(0.5, 0.5, false, true)).build();
    BacktestResult result = new RollingBacktest(config).run(series);
    assertEquals(2 * 14, result.rows.size());
    for (BacktestRow row : result.rows) {
      assertEquals(0.0, row.turnover, 0.0);
      assertFalse(row.degraded);
    }
  }

  @Test
  public void testInfeasibleBox() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(20, 3, 50);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(6).constraints(Constraints.longOnly(0.25))
        .build();
    BacktestResult result = new RollingBacktest(config).run(series);
    for (BacktestRow row : result.rows) {
      assertTrue(row.degraded);
      assertTrue(row.hasFlag(PeriodFlag.INFEASIBLE));
      assertEquals(1.0 / 3.0, row.getWeight("T1"), 1e-12);
    }
  }

  @Test
  public void testFirstWindowInsufficient() throws DataException
  {
    double[][] data = AllTests.randomReturns(20, 3, 51);
    for (int i = 0; i < 12; ++i) {
      data[i][1] = Double.NaN;
      data[i][2] = Double.NaN;
    }
    ReturnSeries series = AllTests.buildSeries(data, AllTests.tickers(3));
    BacktestConfig config = BacktestConfig.builder().estimationWindow(6).build();
    try {
      new RollingBacktest(config).run(series);
      fail("Expected BacktestException");
    } catch (BacktestException e) {
      assertEquals(BacktestException.Kind.INSUFFICIENT_UNIVERSE, e.kind);
    }
  }

  @Test
  public void testLaterWindowSkipped() throws BacktestException, DataException
  {
    double[][] data = AllTests.randomReturns(20, 2, 52);
    for (int i = 10; i <= 13; ++i) {
      data[i][1] = Double.NaN;
    }
    ReturnSeries series = AllTests.buildSeries(data, AllTests.tickers(2));
    BacktestConfig config = BacktestConfig.builder().estimationWindow(4).build();
    BacktestResult result = new RollingBacktest(config).run(series);

    // Windows ending at t = 11..17 include a gap for T1.
    assertEquals(7, result.skippedDates.size());
    assertEquals(series.getDate(11), result.skippedDates.get(0));
    assertEquals(series.getDate(17), result.skippedDates.get(6));

    List<BacktestRow> rows = result.getRows(CovarianceMethod.SHRINKAGE);
    assertEquals(9, rows.size());
    assertEquals(series.getDate(10), rows.get(6).date);
    assertEquals(series.getDate(18), rows.get(7).date);

    // Turnover after the gap is measured against the last recorded weights.
    BacktestRow before = rows.get(6);
    BacktestRow after = rows.get(7);
    double expected = Math.abs(after.getWeight("T0") - before.getWeight("T0"))
        + Math.abs(after.getWeight("T1") - before.getWeight("T1"));
    assertEquals(expected, after.turnover, 1e-12);

    // T1 was eligible for t=10 but has no return that month.
    assertEquals(before.getWeight("T0") * series.get(10, "T0"), before.realizedReturn, 1e-12);
  }

  @Test
  public void testStaggeredGaps() throws BacktestException, DataException
  {
    // Every ticker misses three months of the first window and every month misses some ticker.
    double[][] data = AllTests.randomReturns(40, 20, 54);
    for (int j = 0; j < 20; ++j) {
      data[j][j] = Double.NaN;
      data[(j + 13) % 36][j] = Double.NaN;
      data[(j + 26) % 36][j] = Double.NaN;
    }
    ReturnSeries series = AllTests.buildSeries(data, AllTests.tickers(20));
    Constraints constraints = Constraints.longOnly(1.0);
    BacktestConfig config = BacktestConfig.builder().estimationWindow(36).coverage(30, 0.10)
        .constraints(constraints).build();
    BacktestResult result = new RollingBacktest(config).run(series);

    BacktestRow sample = result.getRows(CovarianceMethod.SAMPLE).get(0);
    assertEquals(20, sample.weights.size());
    assertTrue(sample.hasFlag(PeriodFlag.SINGULAR_COVARIANCE));

    BacktestRow shrunk = result.getRows(CovarianceMethod.SHRINKAGE).get(0);
    assertEquals(series.getDate(36), shrunk.date);
    assertEquals(20, shrunk.weights.size());
    assertTrue(shrunk.toString(), shrunk.flags.isEmpty());
    assertFalse(shrunk.degraded);
    assertTrue(shrunk.diagnostic >= 0.0 && shrunk.diagnostic <= 1.0);
    assertValidWeights(result, constraints);
  }

  @Test
  public void testInfiniteReturn() throws BacktestException
  {
    double[][] data = AllTests.randomReturns(30, 4, 55);
    data[5][1] = Double.POSITIVE_INFINITY;
    ReturnSeries series = AllTests.buildSeries(data, AllTests.tickers(4));
    try {
      new RollingBacktest(BacktestConfig.builder().estimationWindow(12).build()).run(series);
      fail("Expected DataException");
    } catch (DataException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("T1"));
    }
  }

  @Test(expected = DataException.class)
  public void testZeroStep() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(30, 3, 56);
    new RollingBacktest(BacktestConfig.builder().estimationWindow(12).step(0).build()).run(series);
  }

  @Test(expected = DataException.class)
  public void testZeroWindow() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(30, 3, 57);
    new RollingBacktest(BacktestConfig.builder().estimationWindow(0).build()).run(series);
  }

  @Test(expected = DataException.class)
  public void testTooShort() throws BacktestException, DataException
  {
    ReturnSeries series = AllTests.randomSeries(12, 3, 53);
    new RollingBacktest(BacktestConfig.builder().estimationWindow(12).build()).run(series);
  }
}
