package org.mcts.base.search.policy;

import org.mcts.base.search.SearchTreeNode;

/**
 * An MCTS update (backpropagation) policy.
 */
public interface UpdatePolicy
{
  /**
   * Update a tree with the result of a single simulation.
   *
   * @param xiLeaf - the node at which the simulation started.
   * @param xiValue - the result, from the point of view of the player who moved into the leaf.
   */
  public void update(SearchTreeNode<?, ?> xiLeaf, double xiValue);
}
