package org.minnen.minvar.util;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public final class Library
{
  /** Tolerance used when checking that weights sum to one and respect their bounds. */
  public static final double WEIGHT_EPS   = 1e-6;

  public static final double SQRT_12      = Math.sqrt(12.0);

  private Library()
  {}

  public static double sum(double[] a)
  {
    return sum(a, 0, -1);
  }

  /** @return sum of values in [iStart, iEnd]. */
  public static double sum(double[] a, int iStart, int iEnd)
  {
    if (iStart < 0) {
      iStart += a.length;
    }
    if (iEnd < 0) {
      iEnd += a.length;
    }
    double sum = 0;
    for (int i = iStart; i <= iEnd; ++i) {
      sum += a[i];
    }
    return sum;
  }

  public static double mean(double... a)
  {
    if (a == null || a.length == 0) return Double.NaN;
    return sum(a) / a.length;
  }

  /** @return unbiased variance (divides by n-1) or zero for fewer than two values. */
  public static double variance(double... a)
  {
    if (a.length < 2) {
      return 0.0;
    }

    double mean = mean(a);
    double s1 = 0.0, s2 = 0.0;
    for (int i = 0; i < a.length; ++i) {
      double diff = a[i] - mean;
      s1 += diff * diff;
      s2 += diff;
    }
    return (s1 - s2 * s2 / a.length) / (a.length - 1);
  }

  public static double stdev(double... a)
  {
    return Math.sqrt(variance(a));
  }

  public static double dot(double[] a, double[] b)
  {
    assert a.length == b.length;
    double sum = 0.0;
    for (int i = 0; i < a.length; ++i) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  /** @return w' * m * w */
  public static double quadForm(double[][] m, double[] w)
  {
    double sum = 0.0;
    for (int i = 0; i < w.length; ++i) {
      sum += w[i] * dot(m[i], w);
    }
    return sum;
  }

  /** @return array of length n with every value equal to 1/n. */
  public static double[] equalWeights(int n)
  {
    double[] w = new double[n];
    Arrays.fill(w, 1.0 / n);
    return w;
  }

  /** @return values of `a` that are strictly less than zero. */
  public static double[] negatives(double[] a)
  {
    return Arrays.stream(a).filter(x -> x < 0.0).toArray();
  }

  public static boolean isSymmetric(double[][] m, double eps)
  {
    for (int i = 0; i < m.length; ++i) {
      if (m[i].length != m.length) return false;
      for (int j = i + 1; j < m.length; ++j) {
        if (Math.abs(m[i][j] - m[j][i]) > eps) return false;
      }
    }
    return true;
  }

  /**
   * Sum of absolute weight changes between two allocations.
   *
   * A key that appears on only one side is treated as a move to or from zero weight.
   */
  public static double l1Distance(Map<String, Double> a, Map<String, Double> b)
  {
    Set<String> keys = new TreeSet<>(a.keySet());
    keys.addAll(b.keySet());
    double sum = 0.0;
    for (String key : keys) {
      sum += Math.abs(a.getOrDefault(key, 0.0) - b.getOrDefault(key, 0.0));
    }
    return sum;
  }
}
