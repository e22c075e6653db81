package org.minnen.minvar.cov;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.stat.correlation.Covariance;

/** Covariance estimators and matrix checks used by {@link CovarianceMethod}. */
public final class CovLib
{
  /** Smallest acceptable ratio between the smallest and largest eigenvalue of a sample covariance matrix. */
  public static final double MIN_EIGEN_RATIO = 1e-12;

  private CovLib()
  {}

  /**
   * Unbiased sample covariance (divides by T-1).
   *
   * The estimate is flagged singular when T <= N or when the matrix is numerically rank deficient.
   *
   * @param x T x N matrix of returns
   * @param n number of assets (columns), needed when T is zero
   */
  public static CovarianceEstimate sample(double[][] x, int n)
  {
    final int nObs = x.length;
    if (nObs < 2) {
      return new CovarianceEstimate(CovarianceMethod.SAMPLE, new double[n][n], 0.0, true, nObs);
    }

    double[][] cov = new Covariance(x, true).getCovarianceMatrix().getData();
    symmetrize(cov);
    boolean singular = (nObs <= n) || isIllConditioned(cov);
    return new CovarianceEstimate(CovarianceMethod.SAMPLE, cov, 0.0, singular, nObs);
  }

  /**
   * Ledoit-Wolf shrinkage estimate.
   *
   * The maximum-likelihood covariance S (divides by T) is blended with the target mu*I where mu = trace(S)/N. The
   * intensity minimizes the expected Frobenius loss and is clipped to [0, 1].
   *
   * The estimate is flagged singular only when fewer than two observations are available or the input holds a
   * non-finite value.
   *
   * @param x T x N matrix of returns
   * @param n number of assets (columns), needed when T is zero
   */
  public static CovarianceEstimate ledoitWolf(double[][] x, int n)
  {
    final int nObs = x.length;
    if (nObs < 2) {
      return new CovarianceEstimate(CovarianceMethod.SHRINKAGE, new double[n][n], 0.0, true, nObs);
    }

    double[][] xc = center(x, n);
    double[][] s = new double[n][n];
    for (int i = 0; i < n; ++i) {
      for (int j = i; j < n; ++j) {
        double sum = 0.0;
        for (int t = 0; t < nObs; ++t) {
          sum += xc[t][i] * xc[t][j];
        }
        s[i][j] = s[j][i] = sum / nObs;
      }
    }

    double trace = 0.0;
    for (int i = 0; i < n; ++i) {
      trace += s[i][i];
    }
    final double mu = trace / n;

    // sum over (i,j) of sum_t (x_ti^2 * x_tj^2), computed per row as (sum_i x_ti^2)^2.
    double beta0 = 0.0;
    for (int t = 0; t < nObs; ++t) {
      double rowSq = 0.0;
      for (int i = 0; i < n; ++i) {
        rowSq += xc[t][i] * xc[t][i];
      }
      beta0 += rowSq * rowSq;
    }

    double frob = 0.0;
    for (int i = 0; i < n; ++i) {
      for (int j = 0; j < n; ++j) {
        frob += s[i][j] * s[i][j];
      }
    }

    double delta = (frob - n * mu * mu) / n;
    double beta = (beta0 / nObs - frob) / ((double) n * nObs);
    double shrinkage = 0.0;
    if (delta > 0.0) {
      beta = Math.min(beta, delta);
      shrinkage = Math.max(0.0, Math.min(1.0, beta / delta));
    }

    double[][] sigma = new double[n][n];
    for (int i = 0; i < n; ++i) {
      for (int j = 0; j < n; ++j) {
        sigma[i][j] = (1.0 - shrinkage) * s[i][j];
      }
      sigma[i][i] += shrinkage * mu;
    }
    return new CovarianceEstimate(CovarianceMethod.SHRINKAGE, sigma, shrinkage, !isFinite(sigma), nObs);
  }

  /** @return true if every entry of the matrix is finite. */
  public static boolean isFinite(double[][] m)
  {
    for (double[] row : m) {
      for (double x : row) {
        if (!Double.isFinite(x)) return false;
      }
    }
    return true;
  }

  /** @return eigenvalues of the given symmetric matrix. */
  public static double[] eigenvalues(double[][] m)
  {
    return new EigenDecomposition(MatrixUtils.createRealMatrix(m)).getRealEigenvalues();
  }

  /**
   * @return true if the smallest eigenvalue is tiny relative to the largest, the matrix is all zeros, it holds a
   *         non-finite entry or its eigenvalues cannot be computed.
   */
  public static boolean isIllConditioned(double[][] m)
  {
    if (m.length == 0 || !isFinite(m)) return true;
    double[] eig;
    try {
      eig = eigenvalues(m);
    } catch (MathIllegalStateException e) {
      return true;
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double e : eig) {
      min = Math.min(min, e);
      max = Math.max(max, e);
    }
    return max <= 0.0 || min <= max * MIN_EIGEN_RATIO;
  }

  private static double[][] center(double[][] x, int n)
  {
    final int nObs = x.length;
    double[][] xc = new double[nObs][n];
    for (int j = 0; j < n; ++j) {
      double mean = 0.0;
      for (int t = 0; t < nObs; ++t) {
        mean += x[t][j];
      }
      mean /= nObs;
      for (int t = 0; t < nObs; ++t) {
        xc[t][j] = x[t][j] - mean;
      }
    }
    return xc;
  }

  private static void symmetrize(double[][] m)
  {
    for (int i = 0; i < m.length; ++i) {
      for (int j = i + 1; j < m.length; ++j) {
        double avg = 0.5 * (m[i][j] + m[j][i]);
        m[i][j] = m[j][i] = avg;
      }
    }
  }
}
