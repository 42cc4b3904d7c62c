package org.mcts.base.search;

/**
 * Lifecycle of an {@link MCTSSearcher}.
 */
public enum SearchStatus
{
  /**
   * No search in progress.
   */
  IDLE,

  /**
   * A search has been started and its budget isn't yet used up.
   */
  RUNNING,

  /**
   * The search budget is used up and the best move can be read.
   */
  DONE;
}
