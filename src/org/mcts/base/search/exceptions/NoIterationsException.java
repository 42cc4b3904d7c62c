package org.mcts.base.search.exceptions;

/**
 * Exception thrown when a best move is requested but the search has no statistics to decide from (and there isn't
 * exactly one legal move to fall back on).
 */
public class NoIterationsException extends Exception
{
  private static final long serialVersionUID = 1L;

  /**
   * @param xiMessage - description of why no move could be chosen.
   */
  public NoIterationsException(String xiMessage)
  {
    super(xiMessage);
  }
}
