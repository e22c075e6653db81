package org.minnen.minvar.stats;

/** Picks the better of two backtested methods by Sharpe ratio. */
public class MethodComparison
{
  public final PerformanceStats winner;
  public final PerformanceStats loser;

  /** Relative Sharpe improvement of the winner over the loser, in percent. */
  public final double           improvement;

  private MethodComparison(PerformanceStats winner, PerformanceStats loser, double improvement)
  {
    this.winner = winner;
    this.loser = loser;
    this.improvement = improvement;
  }

  /**
   * Compare two sets of statistics.
   *
   * Ties go to the first argument. Improvement is zero when the loser's Sharpe ratio is zero.
   */
  public static MethodComparison calc(PerformanceStats a, PerformanceStats b)
  {
    PerformanceStats winner = (b.sharpe > a.sharpe ? b : a);
    PerformanceStats loser = (winner == a ? b : a);
    double improvement = 0.0;
    if (loser.sharpe != 0.0) {
      improvement = (winner.sharpe - loser.sharpe) / Math.abs(loser.sharpe) * 100.0;
    }
    return new MethodComparison(winner, loser, improvement);
  }

  public double getSharpeDifference()
  {
    return winner.sharpe - loser.sharpe;
  }

  @Override
  public String toString()
  {
    return String.format("[Winner: %s (Sharpe %.3f vs %.3f, %+.1f%%)]", winner.name, winner.sharpe, loser.sharpe,
        improvement);
  }
}
