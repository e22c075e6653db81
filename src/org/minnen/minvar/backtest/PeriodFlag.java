package org.minnen.minvar.backtest;

/** Conditions recorded on a backtest row when a period did not get a regular optimized portfolio. */
public enum PeriodFlag {
  /** The covariance estimate could not be inverted (sample estimator with T <= N). */
  SINGULAR_COVARIANCE,

  /** The solver failed or produced weights that violate the constraints. */
  NON_CONVERGENCE,

  /** The position limits admit no fully invested portfolio for the eligible universe. */
  INFEASIBLE
}
