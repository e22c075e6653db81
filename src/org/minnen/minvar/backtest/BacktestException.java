package org.minnen.minvar.backtest;

/** Fatal condition discovered while running a backtest. */
public class BacktestException extends Exception
{
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** The first window has fewer than two eligible assets. */
    INSUFFICIENT_UNIVERSE,

    /** The run was interrupted while waiting for parallel work. */
    INTERRUPTED
  }

  public final Kind kind;

  public BacktestException(Kind kind, String message)
  {
    super(message);
    this.kind = kind;
  }

  public BacktestException(Kind kind, String message, Throwable cause)
  {
    super(message, cause);
    this.kind = kind;
  }
}
