package org.minnen.minvar.config;

/**
 * Position limits applied uniformly to every eligible asset.
 *
 * When shorting is not allowed (or the portfolio is long-only) the effective lower bound is clipped at zero.
 */
public class Constraints
{
  public final double  minWeight;
  public final double  maxWeight;
  public final boolean allowShort;
  public final boolean longOnly;

  public Constraints(double minWeight, double maxWeight, boolean allowShort, boolean longOnly)
  {
    if (Double.isNaN(minWeight) || Double.isNaN(maxWeight) || minWeight > maxWeight) {
      throw new IllegalArgumentException(String.format("Invalid weight range [%f, %f]", minWeight, maxWeight));
    }
    this.minWeight = minWeight;
    this.maxWeight = maxWeight;
    this.allowShort = allowShort;
    this.longOnly = longOnly;
  }

  /** @return long-only constraints with weights in [0, maxWeight]. */
  public static Constraints longOnly(double maxWeight)
  {
    return new Constraints(0.0, maxWeight, false, true);
  }

  /** @return long/short constraints with weights in [minWeight, maxWeight]. */
  public static Constraints longShort(double minWeight, double maxWeight)
  {
    return new Constraints(minWeight, maxWeight, true, false);
  }

  public boolean isShortingAllowed()
  {
    return allowShort && !longOnly;
  }

  /** @return effective lower bound for each weight. */
  public double getLower()
  {
    return isShortingAllowed() ? minWeight : Math.max(minWeight, 0.0);
  }

  /** @return effective upper bound for each weight. */
  public double getUpper()
  {
    return maxWeight;
  }

  /** @return true if `n` weights can sum to one within these bounds. */
  public boolean isFeasible(int n)
  {
    final double eps = 1e-12;
    return n > 0 && getUpper() >= getLower() && n * getLower() <= 1.0 + eps && n * getUpper() >= 1.0 - eps;
  }

  @Override
  public String toString()
  {
    return String.format("[%.2f, %.2f]%s", getLower(), getUpper(), isShortingAllowed() ? " (long/short)" : "");
  }
}
