package org.mcts.base.search;

/**
 * Statistics for a single move from the root of a search.
 *
 * @param <M> - the move type.
 */
public class MoveStatistics<M>
{
  private final M mMove;
  private final int mNumVisits;
  private final double mTotalValue;

  /**
   * @param xiMove - the move.
   * @param xiNumVisits - the number of simulations through the move.
   * @param xiTotalValue - the sum of the rewards for the player making the move.
   */
  public MoveStatistics(M xiMove, int xiNumVisits, double xiTotalValue)
  {
    mMove = xiMove;
    mNumVisits = xiNumVisits;
    mTotalValue = xiTotalValue;
  }

  /**
   * @return the statistics of a root child node.
   *
   * @param xiChild - the child.
   */
  public static <M> MoveStatistics<M> of(SearchTreeNode<?, M> xiChild)
  {
    return new MoveStatistics<>(xiChild.getIncomingMove(), xiChild.getNumVisits(), xiChild.getTotalValue());
  }

  /**
   * @return statistics combining these with another set for the same move.
   *
   * @param xiOther - the other statistics.
   */
  public MoveStatistics<M> merge(MoveStatistics<M> xiOther)
  {
    return new MoveStatistics<>(mMove, mNumVisits + xiOther.mNumVisits, mTotalValue + xiOther.mTotalValue);
  }

  public M getMove()
  {
    return mMove;
  }

  public int getNumVisits()
  {
    return mNumVisits;
  }

  public double getTotalValue()
  {
    return mTotalValue;
  }

  /**
   * @return the mean reward, or 0 if the move was never visited.
   */
  public double getMeanValue()
  {
    return (mNumVisits == 0) ? 0 : mTotalValue / mNumVisits;
  }

  @Override
  public String toString()
  {
    return mMove + ": " + mNumVisits + " visits, mean " + getMeanValue();
  }
}
