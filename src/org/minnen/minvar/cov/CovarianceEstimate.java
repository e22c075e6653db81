package org.minnen.minvar.cov;

/** Covariance matrix produced by one {@link CovarianceMethod} along with its diagnostic value. */
public class CovarianceEstimate
{
  public final CovarianceMethod method;
  public final double[][]       matrix;

  /** Shrinkage intensity for {@link CovarianceMethod#SHRINKAGE}; always 0 for {@link CovarianceMethod#SAMPLE}. */
  public final double           diagnostic;

  /** True if the matrix is singular or too ill-conditioned to optimize against. */
  public final boolean          singular;

  /** Number of observations (rows) used for the estimate. */
  public final int              nObs;

  public CovarianceEstimate(CovarianceMethod method, double[][] matrix, double diagnostic, boolean singular, int nObs)
  {
    this.method = method;
    this.matrix = matrix;
    this.diagnostic = diagnostic;
    this.singular = singular;
    this.nObs = nObs;
  }

  /** @return number of assets covered by this matrix. */
  public int size()
  {
    return matrix.length;
  }

  @Override
  public String toString()
  {
    return String.format("[%s: %dx%d, T=%d, diag=%.4f%s]", method, size(), size(), nObs, diagnostic,
        singular ? ", singular" : "");
  }
}
