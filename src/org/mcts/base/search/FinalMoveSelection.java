package org.mcts.base.search;

import java.util.List;

/**
 * Ways of choosing the move to play once a search has finished.
 */
public enum FinalMoveSelection
{
  /**
   * The most visited move.  Ties go to the higher mean value, then to the first expanded.
   */
  ROBUST_CHILD
  {
    @Override
    boolean isBetter(MoveStatistics<?> xiCandidate, MoveStatistics<?> xiBest)
    {
      if (xiCandidate.getNumVisits() != xiBest.getNumVisits())
      {
        return xiCandidate.getNumVisits() > xiBest.getNumVisits();
      }
      return xiCandidate.getMeanValue() > xiBest.getMeanValue();
    }
  },

  /**
   * The move with the highest mean value.  Ties go to the more visited, then to the first expanded.
   */
  MAX_CHILD
  {
    @Override
    boolean isBetter(MoveStatistics<?> xiCandidate, MoveStatistics<?> xiBest)
    {
      if (xiCandidate.getMeanValue() != xiBest.getMeanValue())
      {
        return xiCandidate.getMeanValue() > xiBest.getMeanValue();
      }
      return xiCandidate.getNumVisits() > xiBest.getNumVisits();
    }
  };

  /**
   * @return whether the candidate is strictly preferable to the best so far.
   */
  abstract boolean isBetter(MoveStatistics<?> xiCandidate, MoveStatistics<?> xiBest);

  /**
   * @return the preferred move, or null if none of the moves has been visited.
   *
   * @param xiMoves - the statistics of each root move, in expansion order.
   */
  public <M> MoveStatistics<M> select(List<MoveStatistics<M>> xiMoves)
  {
    MoveStatistics<M> lBest = null;
    for (MoveStatistics<M> lCandidate : xiMoves)
    {
      if (lCandidate.getNumVisits() == 0)
      {
        continue;
      }
      if ((lBest == null) || isBetter(lCandidate, lBest))
      {
        lBest = lCandidate;
      }
    }
    return lBest;
  }
}
