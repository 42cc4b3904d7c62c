package org.mcts.base.search.policy;

import org.mcts.base.search.SearchTreeNode;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * A simple expansion policy that expands the first untried move, in the order the game listed its legal moves.
 */
public class SimpleExpansionPolicy implements ExpansionPolicy
{
  @Override
  public <S, M> SearchTreeNode<S, M> expand(SearchTreeNode<S, M> xiLeaf) throws InvalidMoveException
  {
    return xiLeaf.addChild(xiLeaf.getUntriedMoves().get(0));
  }
}
