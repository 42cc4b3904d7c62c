package org.mcts.base.search.policy;

import org.mcts.base.search.SearchTreeNode;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * An MCTS node expansion policy.
 */
public interface ExpansionPolicy
{
  /**
   * Expand a single untried move of the specified node.
   *
   * @param xiLeaf - the node to expand.  It is non-terminal and has at least one untried move.
   *
   * @return the newly created child, from which to simulate.
   *
   * @throws InvalidMoveException if the game rejects the move.
   */
  public <S, M> SearchTreeNode<S, M> expand(SearchTreeNode<S, M> xiLeaf) throws InvalidMoveException;
}
