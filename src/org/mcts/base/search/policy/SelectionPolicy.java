package org.mcts.base.search.policy;

import org.mcts.base.search.SearchTreeNode;

/**
 * An MCTS child selection policy.
 */
public interface SelectionPolicy
{
  /**
   * @return the best child of the specified node, for the player whose turn it is at that node.
   *
   * @param xiNode - the parent node, which is fully expanded and has at least one child.
   */
  public <S, M> SearchTreeNode<S, M> select(SearchTreeNode<S, M> xiNode);
}
