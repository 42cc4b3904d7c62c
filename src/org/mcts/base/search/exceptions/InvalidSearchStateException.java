package org.mcts.base.search.exceptions;

import org.mcts.base.search.SearchStatus;

/**
 * Exception thrown when a searcher is driven in a way that its current status doesn't allow, e.g. starting a search
 * that's already running.
 */
public class InvalidSearchStateException extends IllegalStateException
{
  private static final long serialVersionUID = 1L;

  private final SearchStatus mStatus;

  /**
   * @param xiOperation - the operation that was attempted.
   * @param xiStatus - the status of the searcher at the time.
   */
  public InvalidSearchStateException(String xiOperation, SearchStatus xiStatus)
  {
    super("Cannot " + xiOperation + " whilst search is " + xiStatus);
    mStatus = xiStatus;
  }

  /**
   * @return the status the searcher was in.
   */
  public SearchStatus getStatus()
  {
    return mStatus;
  }
}
