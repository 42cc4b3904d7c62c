package org.mcts.base.search.policy;

import org.mcts.base.search.SearchTreeNode;

/**
 * Update policy for two-player zero-sum games.
 *
 * Walks from the leaf to the root, updating every node on the way.  The value is negated whenever the mover changes
 * between a node and its parent, so every node holds the reward for the player who moved into it.
 */
public class AlternatingUpdatePolicy implements UpdatePolicy
{
  @Override
  public void update(SearchTreeNode<?, ?> xiLeaf, double xiValue)
  {
    xiLeaf.noteLeafSimulation();

    double lValue = xiValue;
    SearchTreeNode<?, ?> lNode = xiLeaf;
    while (lNode != null)
    {
      lNode.update(lValue);

      SearchTreeNode<?, ?> lParent = lNode.getParent();
      if ((lParent != null) && (lParent.getMover() != lNode.getMover()))
      {
        lValue = -lValue;
      }
      lNode = lParent;
    }
  }
}
