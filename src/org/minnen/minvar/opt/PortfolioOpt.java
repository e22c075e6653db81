package org.minnen.minvar.opt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.minnen.minvar.config.Constraints;
import org.minnen.minvar.opt.OptimizationResult.Status;
import org.minnen.minvar.util.Library;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.joptimizer.functions.ConvexMultivariateRealFunction;
import com.joptimizer.functions.LinearMultivariateRealFunction;
import com.joptimizer.functions.PDQuadraticMultivariateRealFunction;
import com.joptimizer.optimizers.JOptimizer;
import com.joptimizer.optimizers.OptimizationRequest;
import com.joptimizer.optimizers.OptimizationResponse;

/**
 * Minimum-variance portfolio optimization via JOptimizer's interior-point solver.
 *
 * Solves: min w'Sw - tau * mu'w subject to sum(w) = 1 and lower <= w_i <= upper. Any failure yields the equal-weight
 * vector with a non-optimal status so callers can keep going.
 */
public class PortfolioOpt
{
  private static final Logger log           = LoggerFactory.getLogger(PortfolioOpt.class);

  /** Relative size of the diagonal ridge that keeps near-singular matrices positive definite. */
  public static final double  RIDGE         = 1e-10;

  public static final double  TOLERANCE     = 1e-8;
  public static final int     MAX_ITERATION = 500;

  public static OptimizationResult minvar(double[][] cov, Constraints constraints)
  {
    return minvar(cov, null, 0.0, constraints);
  }

  public static OptimizationResult minvar(double[][] cov, double lower, double upper)
  {
    return minvar(cov, null, 0.0, lower, upper);
  }

  /**
   * Optimize weights for the given covariance matrix.
   *
   * @param cov N x N covariance matrix
   * @param expectedReturns optional expected return for each asset (may be null)
   * @param riskTolerance weight on the expected-return term (ignored if expectedReturns is null)
   * @param constraints position limits
   * @return optimal weights or the equal-weight fallback
   */
  public static OptimizationResult minvar(double[][] cov, double[] expectedReturns, double riskTolerance,
      Constraints constraints)
  {
    return minvar(cov, expectedReturns, riskTolerance, constraints.getLower(), constraints.getUpper());
  }

  public static OptimizationResult minvar(double[][] cov, double[] expectedReturns, double riskTolerance,
      double lower, double upper)
  {
    final int n = cov.length;
    if (n == 0) {
      throw new IllegalArgumentException("Covariance matrix is empty");
    }
    if (!Library.isSymmetric(cov, 1e-9)) {
      throw new IllegalArgumentException("Covariance matrix must be square and symmetric");
    }
    if (expectedReturns != null && expectedReturns.length != n) {
      throw new IllegalArgumentException(String.format("Expected %d returns, not %d", n, expectedReturns.length));
    }

    final double eps = 1e-12;
    if (upper < lower || n * lower > 1.0 + eps || n * upper < 1.0 - eps) {
      return OptimizationResult.fallback(n, Status.INFEASIBLE,
          String.format("%d weights in [%.4f, %.4f] cannot sum to one", n, lower, upper));
    }

    // Box is so tight that equal weights are the only solution.
    if (n == 1 || Math.abs(n * lower - 1.0) <= eps || Math.abs(n * upper - 1.0) <= eps) {
      return OptimizationResult.optimal(Library.equalWeights(n));
    }

    // Initial guess is equal weights, which is strictly inside the box.
    double[] guess = Library.equalWeights(n);

    // Enforce sum(weights)=1.0 via Ax=b (where x == weights).
    double[][] A = new double[1][n];
    Arrays.fill(A[0], 1.0);
    double[] b = new double[] { 1.0 };

    // Objective function: 0.5 x'Px + q'x with P = 2*S (plus ridge) and q = -tau*mu.
    double avgVar = 0.0;
    for (int i = 0; i < n; ++i) {
      avgVar += cov[i][i];
    }
    avgVar = Math.max(avgVar / n, 1e-12);
    double[][] P = new double[n][n];
    for (int i = 0; i < n; ++i) {
      for (int j = 0; j < n; ++j) {
        P[i][j] = 2.0 * cov[i][j];
      }
      P[i][i] += 2.0 * RIDGE * avgVar;
    }
    double[] q = null;
    if (expectedReturns != null && riskTolerance != 0.0) {
      q = new double[n];
      for (int i = 0; i < n; ++i) {
        q[i] = -riskTolerance * expectedReturns[i];
      }
    }
    PDQuadraticMultivariateRealFunction objective = new PDQuadraticMultivariateRealFunction(P, q, 0);

    // Box constraints: lower - w_i < 0 and w_i - upper < 0. The upper bound can only bind if it is below one or
    // shorting lets other weights go negative.
    final boolean bUpper = (upper < 1.0 || lower < 0.0);
    List<ConvexMultivariateRealFunction> inequalities = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      double[] a = new double[n];
      a[i] = -1.0;
      inequalities.add(new LinearMultivariateRealFunction(a, lower));

      if (bUpper) {
        a = new double[n];
        a[i] = 1.0;
        inequalities.add(new LinearMultivariateRealFunction(a, -upper - 1e-11));
      }
    }

    // Setup optimization problem.
    OptimizationRequest or = new OptimizationRequest();
    or.setF0(objective);
    or.setA(A);
    or.setB(b);
    or.setFi(inequalities.toArray(new ConvexMultivariateRealFunction[inequalities.size()]));
    or.setToleranceFeas(TOLERANCE);
    or.setTolerance(TOLERANCE);
    or.setMaxIteration(MAX_ITERATION);
    or.setInitialPoint(guess);

    // Find the solution.
    JOptimizer opt = new JOptimizer();
    opt.setOptimizationRequest(or);
    double[] w;
    try {
      int code = opt.optimize();
      if (code == OptimizationResponse.FAILED) {
        return OptimizationResult.fallback(n, Status.NON_CONVERGENCE, "Solver reported failure");
      }
      w = opt.getOptimizationResponse().getSolution();
    } catch (Exception e) {
      log.debug("Optimization failed for {} assets", n, e);
      return OptimizationResult.fallback(n, Status.NON_CONVERGENCE, e.getMessage());
    }
    return verify(w, lower, upper);
  }

  /** Snap tiny bound violations and reject solutions that break the constraints. */
  static OptimizationResult verify(double[] w, double lower, double upper)
  {
    final int n = w.length;
    for (int i = 0; i < n; ++i) {
      if (Double.isNaN(w[i]) || w[i] < lower - Library.WEIGHT_EPS || w[i] > upper + Library.WEIGHT_EPS) {
        return OptimizationResult.fallback(n, Status.NON_CONVERGENCE,
            String.format("Weight %d out of bounds (%g)", i, w[i]));
      }
      w[i] = Math.max(lower, Math.min(upper, w[i]));
    }
    double sum = Library.sum(w);
    if (Math.abs(sum - 1.0) > Library.WEIGHT_EPS) {
      return OptimizationResult.fallback(n, Status.NON_CONVERGENCE, String.format("Weights sum to %g", sum));
    }
    return OptimizationResult.optimal(w);
  }
}
