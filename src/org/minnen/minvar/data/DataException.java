package org.minnen.minvar.data;

/**
 * Unrecoverable problem with the input data or the run configuration (bad date range, too little history, malformed
 * file). Raised before any computation starts.
 */
public class DataException extends Exception
{
  private static final long serialVersionUID = 1L;

  public DataException(String message)
  {
    super(message);
  }

  public DataException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
