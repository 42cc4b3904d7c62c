package org.mcts.base.search.policy;

import org.mcts.base.search.SearchTreeNode;

/**
 * Select the child node with the maximum UCT score.
 *
 * Each child's value is stored from the point of view of the player who moved into it, which is the player choosing
 * at the parent, so the parent always maximises.  Ties go to the first child found.
 */
public class UCTSelectionPolicy implements SelectionPolicy
{
  private final double mExplorationConstant;

  /**
   * @param xiExplorationConstant - the exploration constant (C in the UCT formula).
   */
  public UCTSelectionPolicy(double xiExplorationConstant)
  {
    mExplorationConstant = xiExplorationConstant;
  }

  @Override
  public <S, M> SearchTreeNode<S, M> select(SearchTreeNode<S, M> xiNode)
  {
    double lLogParentVisits = Math.log(xiNode.getNumVisits());
    double lBestScore = Double.NEGATIVE_INFINITY;
    SearchTreeNode<S, M> lBestChild = null;

    for (SearchTreeNode<S, M> lChild : xiNode.getChildren())
    {
      double lScore = calculateUCT(lLogParentVisits, lChild);
      if ((lBestChild == null) || (lScore > lBestScore))
      {
        lBestChild = lChild;
        lBestScore = lScore;
      }
    }
    return lBestChild;
  }

  /**
   * @return the UCT score of a child.
   *
   * @param xiLogParentVisits - natural log of the parent's visit count.
   * @param xiChild - the child.
   */
  double calculateUCT(double xiLogParentVisits, SearchTreeNode<?, ?> xiChild)
  {
    int lChildVisits = xiChild.getNumVisits();
    if (lChildVisits == 0)
    {
      // Only possible if a simulation from this child failed part way.
      return Double.POSITIVE_INFINITY;
    }

    return xiChild.getMeanValue() + mExplorationConstant * Math.sqrt(xiLogParentVisits / lChildVisits);
  }

  /**
   * @return the exploration constant.
   */
  public double getExplorationConstant()
  {
    return mExplorationConstant;
  }
}
