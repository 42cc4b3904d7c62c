package org.mcts.base.search;

import org.mcts.base.search.exceptions.NoIterationsException;
import org.mcts.base.util.game.exceptions.InvalidMoveException;

/**
 * A decision maker that picks a move to play in a given state.
 *
 * @param <S> - the game state type.
 * @param <M> - the move type.
 */
public interface Search<S, M>
{
  /**
   * @return the move to play.
   *
   * @param xiState - the state to play in.
   *
   * @throws InvalidMoveException if the game rejects a move it listed as legal.
   * @throws NoIterationsException if there's no move to choose.
   */
  public M search(S xiState) throws InvalidMoveException, NoIterationsException;
}
