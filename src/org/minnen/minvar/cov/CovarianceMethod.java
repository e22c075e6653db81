package org.minnen.minvar.cov;

import java.util.List;

import org.minnen.minvar.data.ReturnWindow;

/**
 * The two competing covariance estimators.
 *
 * Each constant maps a T x N return matrix (rows are periods, columns are assets) to a {@link CovarianceEstimate}.
 */
public enum CovarianceMethod {
  /** Unbiased sample covariance over complete rows; singular whenever T <= N. */
  SAMPLE("sample", "Sample") {
    @Override
    public CovarianceEstimate estimate(double[][] returns, int nAssets)
    {
      return CovLib.sample(returns, nAssets);
    }

    @Override
    public double[][] getInput(ReturnWindow window, List<String> tickers)
    {
      return window.getMatrix(tickers);
    }
  },

  /** Ledoit-Wolf shrinkage toward a scaled identity; stays invertible when T < N. */
  SHRINKAGE("lw", "Ledoit-Wolf") {
    @Override
    public CovarianceEstimate estimate(double[][] returns, int nAssets)
    {
      return CovLib.ledoitWolf(returns, nAssets);
    }

    @Override
    public double[][] getInput(ReturnWindow window, List<String> tickers)
    {
      return window.getFilledMatrix(tickers);
    }
  };

  /** Short name used in config files and result tables. */
  public final String key;
  public final String label;

  private CovarianceMethod(String key, String label)
  {
    this.key = key;
    this.label = label;
  }

  /**
   * Estimate the covariance of the given returns.
   *
   * @param returns T x N return matrix (T may be zero)
   * @param nAssets number of assets N
   */
  public abstract CovarianceEstimate estimate(double[][] returns, int nAssets);

  /**
   * Build the return matrix this estimator sees for a window.
   *
   * The sample estimator uses only rows where every ticker has a value. The shrinkage estimator keeps every row and
   * fills gaps with the ticker's mean so staggered gaps cannot leave it without observations.
   */
  public abstract double[][] getInput(ReturnWindow window, List<String> tickers);

  /** Estimate the covariance of a non-empty T x N return matrix. */
  public CovarianceEstimate estimate(double[][] returns)
  {
    if (returns.length == 0) {
      throw new IllegalArgumentException("Return matrix is empty; use estimate(returns, nAssets)");
    }
    return estimate(returns, returns[0].length);
  }

  /** @return method with the given key or label (case-insensitive). */
  public static CovarianceMethod fromKey(String key)
  {
    for (CovarianceMethod method : values()) {
      if (method.key.equalsIgnoreCase(key) || method.label.equalsIgnoreCase(key)
          || method.name().equalsIgnoreCase(key)) {
        return method;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown covariance method: %s", key));
  }
}
