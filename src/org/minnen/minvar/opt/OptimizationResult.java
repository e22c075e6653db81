package org.minnen.minvar.opt;

import java.util.Arrays;

import org.minnen.minvar.util.Library;

/** Outcome of one portfolio optimization: the weights to use and how they were obtained. */
public class OptimizationResult
{
  public enum Status {
    /** Solver converged to a solution that satisfies every constraint. */
    OPTIMAL,

    /** No weight vector inside the box sums to one. */
    INFEASIBLE,

    /** Solver failed or returned a solution that violates the constraints. */
    NON_CONVERGENCE
  }

  public final Status   status;
  public final double[] weights;
  public final String   message;

  private OptimizationResult(Status status, double[] weights, String message)
  {
    this.status = status;
    this.weights = weights;
    this.message = message;
  }

  public static OptimizationResult optimal(double[] weights)
  {
    return new OptimizationResult(Status.OPTIMAL, weights, null);
  }

  /** @return equal-weight fallback carrying the reason the optimizer did not produce a solution. */
  public static OptimizationResult fallback(int n, Status status, String message)
  {
    assert status != Status.OPTIMAL;
    return new OptimizationResult(status, Library.equalWeights(n), message);
  }

  public boolean isOptimal()
  {
    return status == Status.OPTIMAL;
  }

  @Override
  public String toString()
  {
    return String.format("[%s: %s%s]", status, Arrays.toString(weights), message == null ? "" : " (" + message + ")");
  }
}
